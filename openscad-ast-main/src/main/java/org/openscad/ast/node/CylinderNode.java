package org.openscad.ast.node;

import org.openscad.ast.location.SourceRange;
import org.openscad.ast.node.visitor.AstVisitor;

/**
 * {@code cylinder(h, r | r1, r2 | d | d1, d2, center, $fn, $fa, $fs)}.
 * <p>
 * Radius and diameter components hold exactly what the call supplied ({@code null} when absent).
 * The radii the cylinder is built with are derived by {@link #bottomRadius()} and
 * {@link #topRadius()}.
 */
public record CylinderNode(double h,
                           Double r,
                           Double r1,
                           Double r2,
                           Double d,
                           Double d1,
                           Double d2,
                           boolean center,
                           Double fn,
                           Double fa,
                           Double fs,
                           SourceRange location) implements AstNode {

    public static final double DEFAULT_RADIUS = 1.0;

    /**
     * Explicit {@code r1}, else {@code d1 / 2}, else the shared radius.
     */
    public double bottomRadius() {
        if (r1 != null) {
            return r1;
        }
        if (d1 != null) {
            return d1 / 2;
        }
        return sharedRadius();
    }

    /**
     * Explicit {@code r2}, else {@code d2 / 2}, else the shared radius.
     */
    public double topRadius() {
        if (r2 != null) {
            return r2;
        }
        if (d2 != null) {
            return d2 / 2;
        }
        return sharedRadius();
    }

    /**
     * {@code r}, else {@code d / 2}, else the default radius of 1.
     */
    public double sharedRadius() {
        if (r != null) {
            return r;
        }
        if (d != null) {
            return d / 2;
        }
        return DEFAULT_RADIUS;
    }

    public boolean isCone() {
        return bottomRadius() != topRadius();
    }

    @Override
    public NodeType type() {
        return NodeType.CYLINDER;
    }

    @Override
    public <R, A> R accept(AstVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }
}
