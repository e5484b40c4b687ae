package org.openscad.ast.node;

/**
 * A formal parameter of a module, function or function literal.
 */
public record ParameterDeclaration(String name, ExpressionNode defaultValue) {

    public boolean hasDefault() {
        return defaultValue != null;
    }
}
