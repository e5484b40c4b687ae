package org.openscad.ast.node;

import org.openscad.ast.location.SourceRange;
import org.openscad.ast.node.visitor.AstVisitor;

public record IndexExpressionNode(ExpressionNode array, ExpressionNode index,
                                  SourceRange location) implements ExpressionNode {

    @Override
    public NodeType type() {
        return NodeType.INDEX;
    }

    @Override
    public <R, A> R accept(AstVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }
}
