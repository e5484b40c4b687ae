package org.openscad.ast.node;

import java.util.List;

import org.openscad.ast.location.SourceRange;
import org.openscad.ast.node.visitor.AstVisitor;

public record RotateExtrudeNode(double angle, Integer convexity, Double fn,
                                List<AstNode> children, SourceRange location) implements ParentNode {

    public RotateExtrudeNode {
        children = List.copyOf(children);
    }

    @Override
    public NodeType type() {
        return NodeType.ROTATE_EXTRUDE;
    }

    @Override
    public <R, A> R accept(AstVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }
}
