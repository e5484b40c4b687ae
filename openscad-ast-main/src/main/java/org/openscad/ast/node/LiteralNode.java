package org.openscad.ast.node;

import org.openscad.ast.location.SourceRange;
import org.openscad.ast.node.visitor.AstVisitor;

/**
 * A literal. {@code value} is a {@link Double}, {@link String} or {@link Boolean} matching
 * {@code literalType}, and {@code null} for {@code undef}.
 */
public record LiteralNode(LiteralType literalType, Object value, SourceRange location) implements ExpressionNode {

    public static LiteralNode number(double value, SourceRange location) {
        return new LiteralNode(LiteralType.NUMBER, value, location);
    }

    public static LiteralNode string(String value, SourceRange location) {
        return new LiteralNode(LiteralType.STRING, value, location);
    }

    public static LiteralNode bool(boolean value, SourceRange location) {
        return new LiteralNode(LiteralType.BOOLEAN, value, location);
    }

    public static LiteralNode undef(SourceRange location) {
        return new LiteralNode(LiteralType.UNDEF, null, location);
    }

    @Override
    public NodeType type() {
        return NodeType.LITERAL;
    }

    @Override
    public <R, A> R accept(AstVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }
}
