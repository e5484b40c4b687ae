package org.openscad.ast.node;

import java.util.List;

import org.openscad.ast.location.SourceRange;
import org.openscad.ast.node.visitor.AstVisitor;

/**
 * Statement-level {@code let(a = 1, b = a * 2) children}.
 */
public record LetNode(List<Binding> assignments, List<AstNode> body, SourceRange location) implements AstNode {

    public LetNode {
        assignments = List.copyOf(assignments);
        body = List.copyOf(body);
    }

    @Override
    public NodeType type() {
        return NodeType.LET;
    }

    @Override
    public <R, A> R accept(AstVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }
}
