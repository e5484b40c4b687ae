package org.openscad.ast.node;

import java.util.List;

import org.openscad.ast.location.SourceRange;
import org.openscad.ast.node.visitor.AstVisitor;

public record EchoNode(List<Argument> arguments, SourceRange location) implements AstNode {

    public EchoNode {
        arguments = List.copyOf(arguments);
    }

    @Override
    public NodeType type() {
        return NodeType.ECHO;
    }

    @Override
    public <R, A> R accept(AstVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }
}
