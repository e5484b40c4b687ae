package org.openscad.ast.node;

import java.util.List;

import org.openscad.ast.location.SourceRange;
import org.openscad.ast.node.visitor.AstVisitor;

public record HullNode(List<AstNode> children, SourceRange location) implements ParentNode {

    public HullNode {
        children = List.copyOf(children);
    }

    @Override
    public NodeType type() {
        return NodeType.HULL;
    }

    @Override
    public <R, A> R accept(AstVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }
}
