package org.openscad.ast.node;

import java.util.List;

import org.openscad.ast.location.SourceRange;
import org.openscad.ast.node.visitor.AstVisitor;

/**
 * {@code color(c, alpha)}.
 * <p>
 * A named or hex color sets {@code colorName}; a vector color sets {@code rgba}, always four
 * components with alpha already applied. {@code alpha} is the effective alpha, {@code null} for a
 * named color without an explicit one.
 */
public record ColorNode(String colorName, List<Double> rgba, Double alpha,
                        List<AstNode> children, SourceRange location) implements ParentNode {

    public ColorNode {
        rgba = rgba == null ? null : List.copyOf(rgba);
        children = List.copyOf(children);
    }

    @Override
    public NodeType type() {
        return NodeType.COLOR;
    }

    @Override
    public <R, A> R accept(AstVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }
}
