package org.openscad.cst;

/**
 * A point in the parsed source. Row and column are zero based; offset is the character index
 * into the source, or -1 for tokens the parser inserted during error recovery.
 */
public record CstPoint(int row, int column, int offset) {

    public static final CstPoint ORIGIN = new CstPoint(0, 0, 0);
}
