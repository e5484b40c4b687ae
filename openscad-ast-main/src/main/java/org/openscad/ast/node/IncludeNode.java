package org.openscad.ast.node;

import org.openscad.ast.location.SourceRange;
import org.openscad.ast.node.visitor.AstVisitor;

public record IncludeNode(String path, SourceRange location) implements AstNode {

    @Override
    public NodeType type() {
        return NodeType.INCLUDE;
    }

    @Override
    public <R, A> R accept(AstVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }
}
