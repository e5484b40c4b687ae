package org.openscad.ast.node;

/**
 * Marker for nodes that may appear in expression position.
 */
public interface ExpressionNode extends AstNode {
}
