package org.openscad.ast.node;

import java.util.List;

import org.openscad.ast.location.SourceRange;
import org.openscad.ast.node.visitor.AstVisitor;

public record FunctionDefinitionNode(String name, List<ParameterDeclaration> parameters, ExpressionNode expression,
                                     SourceRange location) implements AstNode {

    public FunctionDefinitionNode {
        parameters = List.copyOf(parameters);
    }

    @Override
    public NodeType type() {
        return NodeType.FUNCTION_DEFINITION;
    }

    @Override
    public <R, A> R accept(AstVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }
}
