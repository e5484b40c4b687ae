package org.openscad.ast.location;

/**
 * A point in the source: zero-based line and column, character offset from the start.
 */
public record Position(int line, int column, int offset) {
}
