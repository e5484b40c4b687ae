package org.openscad.ast.node;

import org.openscad.ast.location.SourceRange;
import org.openscad.ast.node.visitor.AstVisitor;

/**
 * {@code variable = value;}. Special variables keep their {@code $} prefix.
 */
public record AssignmentNode(String variable, ExpressionNode value, SourceRange location) implements AstNode {

    @Override
    public NodeType type() {
        return NodeType.ASSIGNMENT;
    }

    @Override
    public <R, A> R accept(AstVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }
}
