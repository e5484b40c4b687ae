package org.openscad.ast.node;

import java.util.List;

import org.openscad.ast.location.SourceRange;
import org.openscad.ast.node.visitor.AstVisitor;

public record PolyhedronNode(List<List<Double>> points, List<List<Integer>> faces, Integer convexity,
                             SourceRange location) implements AstNode {

    public PolyhedronNode {
        points = List.copyOf(points);
        faces = List.copyOf(faces);
    }

    @Override
    public NodeType type() {
        return NodeType.POLYHEDRON;
    }

    @Override
    public <R, A> R accept(AstVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }
}
