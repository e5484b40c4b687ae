package org.openscad.ast.node;

import org.openscad.ast.location.SourceRange;
import org.openscad.ast.node.visitor.AstVisitor;

/**
 * {@code each expression}: splices the elements of a list into the enclosing vector.
 */
public record EachNode(ExpressionNode expression, SourceRange location) implements ExpressionNode {

    @Override
    public NodeType type() {
        return NodeType.EACH;
    }

    @Override
    public <R, A> R accept(AstVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }
}
