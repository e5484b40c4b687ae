package org.openscad.ast.node;

import java.util.List;

import org.openscad.ast.location.SourceRange;
import org.openscad.ast.node.visitor.AstVisitor;

public record VectorExpressionNode(List<ExpressionNode> elements, SourceRange location) implements ExpressionNode {

    public VectorExpressionNode {
        elements = List.copyOf(elements);
    }

    @Override
    public NodeType type() {
        return NodeType.VECTOR;
    }

    @Override
    public <R, A> R accept(AstVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }
}
