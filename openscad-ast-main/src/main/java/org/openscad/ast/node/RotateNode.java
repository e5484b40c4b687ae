package org.openscad.ast.node;

import java.util.List;

import org.openscad.ast.location.SourceRange;
import org.openscad.ast.node.visitor.AstVisitor;

/**
 * {@code rotate(a, v)}.
 * <p>
 * With a scalar {@code a} the rotation is {@code angle} degrees about {@code axis}
 * (default {@code [0,0,1]}) and {@code angles} is {@code null}. With a vector {@code a} the
 * rotation is given per axis in {@code angles} and both {@code angle} and {@code axis} are
 * {@code null}.
 */
public record RotateNode(Double angle, List<Double> angles, List<Double> axis,
                         List<AstNode> children, SourceRange location) implements ParentNode {

    public RotateNode {
        angles = angles == null ? null : List.copyOf(angles);
        axis = axis == null ? null : List.copyOf(axis);
        children = List.copyOf(children);
    }

    public boolean isAxisAngle() {
        return angle != null;
    }

    @Override
    public NodeType type() {
        return NodeType.ROTATE;
    }

    @Override
    public <R, A> R accept(AstVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }
}
