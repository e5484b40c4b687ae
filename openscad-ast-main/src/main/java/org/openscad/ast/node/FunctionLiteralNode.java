package org.openscad.ast.node;

import java.util.List;

import org.openscad.ast.location.SourceRange;
import org.openscad.ast.node.visitor.AstVisitor;

/**
 * Anonymous function, {@code function(x) x * 2}.
 */
public record FunctionLiteralNode(List<ParameterDeclaration> parameters, ExpressionNode body,
                                  SourceRange location) implements ExpressionNode {

    public FunctionLiteralNode {
        parameters = List.copyOf(parameters);
    }

    @Override
    public NodeType type() {
        return NodeType.FUNCTION_LITERAL;
    }

    @Override
    public <R, A> R accept(AstVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }
}
