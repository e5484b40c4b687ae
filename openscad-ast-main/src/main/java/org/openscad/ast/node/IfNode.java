package org.openscad.ast.node;

import java.util.List;

import org.openscad.ast.location.SourceRange;
import org.openscad.ast.node.visitor.AstVisitor;

/**
 * {@code if (condition) ... else ...}. An {@code else if} is an {@link IfNode} alone in the
 * {@code elseBranch}; {@code elseBranch} is {@code null} when there is no {@code else} at all.
 */
public record IfNode(ExpressionNode condition, List<AstNode> thenBranch, List<AstNode> elseBranch,
                     SourceRange location) implements AstNode {

    public IfNode {
        thenBranch = List.copyOf(thenBranch);
        elseBranch = elseBranch == null ? null : List.copyOf(elseBranch);
    }

    public boolean hasElse() {
        return elseBranch != null;
    }

    @Override
    public NodeType type() {
        return NodeType.IF;
    }

    @Override
    public <R, A> R accept(AstVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }
}
