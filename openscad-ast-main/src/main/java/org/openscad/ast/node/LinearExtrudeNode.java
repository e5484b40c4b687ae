package org.openscad.ast.node;

import java.util.List;

import org.openscad.ast.location.SourceRange;
import org.openscad.ast.node.visitor.AstVisitor;

/**
 * {@code linear_extrude(height, center, convexity, twist, slices, scale, $fn)}. {@code scale} is
 * the x/y scale at the top.
 */
public record LinearExtrudeNode(double height,
                                boolean center,
                                Integer convexity,
                                double twist,
                                Integer slices,
                                List<Double> scale,
                                Double fn,
                                List<AstNode> children,
                                SourceRange location) implements ParentNode {

    public LinearExtrudeNode {
        scale = List.copyOf(scale);
        children = List.copyOf(children);
    }

    @Override
    public NodeType type() {
        return NodeType.LINEAR_EXTRUDE;
    }

    @Override
    public <R, A> R accept(AstVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }
}
