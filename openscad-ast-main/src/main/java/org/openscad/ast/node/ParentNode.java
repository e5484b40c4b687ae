package org.openscad.ast.node;

import java.util.List;

/**
 * A node that applies to the geometry of its child statements: transforms, extrusions and
 * boolean operations.
 */
public interface ParentNode extends AstNode {

    List<AstNode> children();
}
