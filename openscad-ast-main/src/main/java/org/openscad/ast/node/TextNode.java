package org.openscad.ast.node;

import org.openscad.ast.location.SourceRange;
import org.openscad.ast.node.visitor.AstVisitor;

/**
 * {@code text(text, size, font, halign, valign, spacing, direction, language, script, $fn)}.
 * Unspecified options carry OpenSCAD's defaults.
 */
public record TextNode(String text,
                       double size,
                       String font,
                       String halign,
                       String valign,
                       double spacing,
                       String direction,
                       String language,
                       String script,
                       Double fn,
                       SourceRange location) implements AstNode {

    @Override
    public NodeType type() {
        return NodeType.TEXT;
    }

    @Override
    public <R, A> R accept(AstVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }
}
