package org.openscad.ast.node;

import org.openscad.ast.location.SourceRange;
import org.openscad.ast.node.visitor.AstVisitor;

/**
 * A node of the OpenSCAD abstract syntax tree. Nodes are immutable and compare structurally.
 */
public interface AstNode {

    NodeType type();

    /**
     * Where the node came from, or {@code null} for synthesized nodes.
     */
    SourceRange location();

    <R, A> R accept(AstVisitor<R, A> visitor, A arg);
}
