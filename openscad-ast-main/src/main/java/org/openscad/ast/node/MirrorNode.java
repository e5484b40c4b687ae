package org.openscad.ast.node;

import java.util.List;

import org.openscad.ast.location.SourceRange;
import org.openscad.ast.node.visitor.AstVisitor;

/**
 * {@code mirror(v)}: the normal of the mirror plane through the origin.
 */
public record MirrorNode(List<Double> v,
                         List<AstNode> children, SourceRange location) implements ParentNode {

    public MirrorNode {
        v = List.copyOf(v);
        children = List.copyOf(children);
    }

    @Override
    public NodeType type() {
        return NodeType.MIRROR;
    }

    @Override
    public <R, A> R accept(AstVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }
}
