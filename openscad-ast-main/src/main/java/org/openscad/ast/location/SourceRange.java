package org.openscad.ast.location;

/**
 * Span of source an AST node was lowered from. {@code text} is the original source text, or
 * {@code null} when text capture is switched off.
 */
public record SourceRange(Position start, Position end, String text) {

    public SourceRange withoutText() {
        return text == null ? this : new SourceRange(start, end, null);
    }
}
