package org.openscad.ast.location;

import org.openscad.cst.CstNode;
import org.openscad.cst.CstPoint;

public final class Locations {

    private Locations() {
    }

    public static Position toPosition(CstPoint point) {
        return new Position(point.row(), point.column(), point.offset());
    }

    public static SourceRange of(CstNode node) {
        return of(node, true);
    }

    public static SourceRange of(CstNode node, boolean includeText) {
        return new SourceRange(toPosition(node.startPoint()), toPosition(node.endPoint()),
                includeText ? node.text() : null);
    }
}
