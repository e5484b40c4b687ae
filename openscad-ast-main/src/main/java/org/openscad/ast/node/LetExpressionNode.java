package org.openscad.ast.node;

import java.util.List;

import org.openscad.ast.location.SourceRange;
import org.openscad.ast.node.visitor.AstVisitor;

public record LetExpressionNode(List<Binding> assignments, ExpressionNode body,
                                SourceRange location) implements ExpressionNode {

    public LetExpressionNode {
        assignments = List.copyOf(assignments);
    }

    @Override
    public NodeType type() {
        return NodeType.LET_EXPRESSION;
    }

    @Override
    public <R, A> R accept(AstVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }
}
