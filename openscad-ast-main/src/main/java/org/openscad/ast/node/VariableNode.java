package org.openscad.ast.node;

import org.openscad.ast.location.SourceRange;
import org.openscad.ast.node.visitor.AstVisitor;

public record VariableNode(String name, SourceRange location) implements ExpressionNode {

    public boolean isSpecial() {
        return name.startsWith("$");
    }

    @Override
    public NodeType type() {
        return NodeType.VARIABLE;
    }

    @Override
    public <R, A> R accept(AstVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }
}
