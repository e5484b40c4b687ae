package org.openscad.ast.node;

import org.openscad.ast.location.SourceRange;
import org.openscad.ast.node.visitor.AstVisitor;

/**
 * {@code square(size, center)}. A vector size always has two components.
 */
public record SquareNode(Dimensions size, boolean center, SourceRange location) implements AstNode {

    @Override
    public NodeType type() {
        return NodeType.SQUARE;
    }

    @Override
    public <R, A> R accept(AstVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }
}
