package org.openscad.ast.node;

import java.util.List;

import org.openscad.ast.location.SourceRange;
import org.openscad.ast.node.visitor.AstVisitor;

/**
 * An instantiation prefixed by debug modifiers such as {@code #} or {@code %}.
 */
public record ModifierNode(List<Modifier> modifiers, AstNode child, SourceRange location) implements AstNode {

    public ModifierNode {
        modifiers = List.copyOf(modifiers);
    }

    public boolean has(Modifier modifier) {
        return modifiers.contains(modifier);
    }

    @Override
    public NodeType type() {
        return NodeType.MODIFIER;
    }

    @Override
    public <R, A> R accept(AstVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }
}
