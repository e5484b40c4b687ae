package org.openscad.ast.node;

import java.util.List;

import org.openscad.ast.location.SourceRange;
import org.openscad.ast.node.visitor.AstVisitor;

public record ModuleDefinitionNode(String name, List<ParameterDeclaration> parameters, List<AstNode> body,
                                   SourceRange location) implements AstNode {

    public ModuleDefinitionNode {
        parameters = List.copyOf(parameters);
        body = List.copyOf(body);
    }

    @Override
    public NodeType type() {
        return NodeType.MODULE_DEFINITION;
    }

    @Override
    public <R, A> R accept(AstVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }
}
