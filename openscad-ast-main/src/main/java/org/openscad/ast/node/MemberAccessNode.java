package org.openscad.ast.node;

import org.openscad.ast.location.SourceRange;
import org.openscad.ast.node.visitor.AstVisitor;

/**
 * {@code object.member}, e.g. {@code v.x}.
 */
public record MemberAccessNode(ExpressionNode object, String member, SourceRange location) implements ExpressionNode {

    @Override
    public NodeType type() {
        return NodeType.MEMBER;
    }

    @Override
    public <R, A> R accept(AstVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }
}
