package org.openscad.ast.node;

import java.util.List;

import org.openscad.ast.location.SourceRange;
import org.openscad.ast.node.visitor.AstVisitor;

/**
 * {@code polygon(points, paths, convexity)}. An empty {@code paths} list means the points are
 * joined in order.
 */
public record PolygonNode(List<List<Double>> points, List<List<Integer>> paths, Integer convexity,
                          SourceRange location) implements AstNode {

    public PolygonNode {
        points = List.copyOf(points);
        paths = paths == null ? List.of() : List.copyOf(paths);
    }

    @Override
    public NodeType type() {
        return NodeType.POLYGON;
    }

    @Override
    public <R, A> R accept(AstVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }
}
