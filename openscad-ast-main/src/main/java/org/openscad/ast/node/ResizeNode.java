package org.openscad.ast.node;

import java.util.List;

import org.openscad.ast.location.SourceRange;
import org.openscad.ast.node.visitor.AstVisitor;

/**
 * {@code resize(newsize, auto)}. {@code auto} holds one flag per axis.
 */
public record ResizeNode(List<Double> newsize, List<Boolean> auto,
                         List<AstNode> children, SourceRange location) implements ParentNode {

    public ResizeNode {
        newsize = List.copyOf(newsize);
        auto = List.copyOf(auto);
        children = List.copyOf(children);
    }

    @Override
    public NodeType type() {
        return NodeType.RESIZE;
    }

    @Override
    public <R, A> R accept(AstVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }
}
