package org.openscad.ast.node;

import java.util.List;

import org.openscad.ast.location.SourceRange;
import org.openscad.ast.node.visitor.AstVisitor;

public record OffsetNode(double r, double delta, boolean chamfer,
                         List<AstNode> children, SourceRange location) implements ParentNode {

    public OffsetNode {
        children = List.copyOf(children);
    }

    @Override
    public NodeType type() {
        return NodeType.OFFSET;
    }

    @Override
    public <R, A> R accept(AstVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }
}
