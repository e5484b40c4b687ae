package org.openscad.ast.node;

import org.openscad.ast.location.SourceRange;
import org.openscad.ast.node.visitor.AstVisitor;

/**
 * {@code [start : end]} or {@code [start : step : end]}; {@code step} is {@code null} in the
 * first form.
 */
public record RangeExpressionNode(ExpressionNode start, ExpressionNode step, ExpressionNode end,
                                  SourceRange location) implements ExpressionNode {

    @Override
    public NodeType type() {
        return NodeType.RANGE;
    }

    @Override
    public <R, A> R accept(AstVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }
}
