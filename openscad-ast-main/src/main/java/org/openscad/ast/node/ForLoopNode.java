package org.openscad.ast.node;

import java.util.List;

import org.openscad.ast.location.SourceRange;
import org.openscad.ast.node.visitor.AstVisitor;

public record ForLoopNode(List<ForBinding> variables, List<AstNode> body, SourceRange location) implements AstNode {

    public ForLoopNode {
        variables = List.copyOf(variables);
        body = List.copyOf(body);
    }

    @Override
    public NodeType type() {
        return NodeType.FOR_LOOP;
    }

    @Override
    public <R, A> R accept(AstVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }
}
