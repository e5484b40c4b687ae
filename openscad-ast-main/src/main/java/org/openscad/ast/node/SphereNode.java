package org.openscad.ast.node;

import org.openscad.ast.location.SourceRange;
import org.openscad.ast.node.visitor.AstVisitor;

/**
 * {@code sphere(r | d, $fn, $fa, $fs)}. The radius is always resolved, from {@code d / 2} when
 * only a diameter was given; {@code diameter} keeps the value as written.
 */
public record SphereNode(double radius, Double diameter, Double fn, Double fa, Double fs,
                         SourceRange location) implements AstNode {

    @Override
    public NodeType type() {
        return NodeType.SPHERE;
    }

    @Override
    public <R, A> R accept(AstVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }
}
