package org.openscad.ast.node;

import java.util.List;

import org.openscad.ast.location.SourceRange;
import org.openscad.ast.node.visitor.AstVisitor;

/**
 * {@code scale(v)}. Missing trailing factors are 1.
 */
public record ScaleNode(List<Double> v,
                        List<AstNode> children, SourceRange location) implements ParentNode {

    public ScaleNode {
        v = List.copyOf(v);
        children = List.copyOf(children);
    }

    @Override
    public NodeType type() {
        return NodeType.SCALE;
    }

    @Override
    public <R, A> R accept(AstVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }
}
