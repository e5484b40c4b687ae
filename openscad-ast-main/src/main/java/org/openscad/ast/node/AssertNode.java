package org.openscad.ast.node;

import org.openscad.ast.location.SourceRange;
import org.openscad.ast.node.visitor.AstVisitor;

public record AssertNode(ExpressionNode condition, ExpressionNode message, SourceRange location) implements AstNode {

    @Override
    public NodeType type() {
        return NodeType.ASSERT;
    }

    @Override
    public <R, A> R accept(AstVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }
}
