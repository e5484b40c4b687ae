package org.openscad.ast.node;

import java.util.List;

import org.openscad.ast.location.SourceRange;
import org.openscad.ast.node.visitor.AstVisitor;

/**
 * Call of a module that is neither a built-in primitive, transform nor boolean operation.
 */
public record ModuleInstantiationNode(String name, List<Argument> arguments, List<AstNode> children,
                                      SourceRange location) implements AstNode {

    public ModuleInstantiationNode {
        arguments = List.copyOf(arguments);
        children = List.copyOf(children);
    }

    @Override
    public NodeType type() {
        return NodeType.MODULE_INSTANTIATION;
    }

    @Override
    public <R, A> R accept(AstVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }
}
