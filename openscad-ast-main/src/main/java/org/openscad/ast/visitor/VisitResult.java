package org.openscad.ast.visitor;

import java.util.Objects;

import org.openscad.ast.node.AstNode;

/**
 * Outcome of offering a CST node to a {@link CstVisitor}: either the AST node it produced, or
 * "not applicable" when the node is not of a kind the visitor handles. Lowering problems are
 * expressed as handled error nodes, never as "not applicable".
 */
public final class VisitResult {

    private static final VisitResult NOT_APPLICABLE = new VisitResult(null);

    private final AstNode node;

    private VisitResult(AstNode node) {
        this.node = node;
    }

    public static VisitResult handled(AstNode node) {
        return new VisitResult(Objects.requireNonNull(node, "node"));
    }

    public static VisitResult notApplicable() {
        return NOT_APPLICABLE;
    }

    public boolean isHandled() {
        return node != null;
    }

    /**
     * @throws IllegalStateException if the visitor declined the node
     */
    public AstNode node() {
        if (node == null) {
            throw new IllegalStateException("No node: the visitor declined");
        }
        return node;
    }

    @Override
    public String toString() {
        return node == null ? "NotApplicable" : "Handled(" + node.type() + ")";
    }
}
