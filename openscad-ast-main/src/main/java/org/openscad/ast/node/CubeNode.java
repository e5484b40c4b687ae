package org.openscad.ast.node;

import org.openscad.ast.location.SourceRange;
import org.openscad.ast.node.visitor.AstVisitor;

/**
 * {@code cube(size, center)}. A vector size always has three components.
 */
public record CubeNode(Dimensions size, boolean center, SourceRange location) implements AstNode {

    @Override
    public NodeType type() {
        return NodeType.CUBE;
    }

    @Override
    public <R, A> R accept(AstVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }
}
