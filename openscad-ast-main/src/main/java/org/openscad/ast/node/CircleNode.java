package org.openscad.ast.node;

import org.openscad.ast.location.SourceRange;
import org.openscad.ast.node.visitor.AstVisitor;

public record CircleNode(double radius, Double diameter, Double fn, Double fa, Double fs,
                         SourceRange location) implements AstNode {

    @Override
    public NodeType type() {
        return NodeType.CIRCLE;
    }

    @Override
    public <R, A> R accept(AstVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }
}
