package org.openscad.ast.node;

import org.openscad.ast.location.SourceRange;
import org.openscad.ast.node.visitor.AstVisitor;

public record ConditionalExpressionNode(ExpressionNode condition, ExpressionNode thenBranch,
                                        ExpressionNode elseBranch, SourceRange location) implements ExpressionNode {

    @Override
    public NodeType type() {
        return NodeType.CONDITIONAL;
    }

    @Override
    public <R, A> R accept(AstVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }
}
