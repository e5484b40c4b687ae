package org.openscad.ast.node;

import java.util.List;

import org.openscad.ast.location.SourceRange;
import org.openscad.ast.node.visitor.AstVisitor;

/**
 * {@code children()} inside a module body, optionally selecting children by index, vector or range.
 */
public record ChildrenNode(List<ExpressionNode> selectors, SourceRange location) implements AstNode {

    public ChildrenNode {
        selectors = List.copyOf(selectors);
    }

    @Override
    public NodeType type() {
        return NodeType.CHILDREN;
    }

    @Override
    public <R, A> R accept(AstVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }
}
