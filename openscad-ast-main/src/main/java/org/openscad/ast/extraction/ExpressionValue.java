package org.openscad.ast.extraction;

import java.util.Objects;

import org.openscad.cst.CstNode;

/**
 * An argument whose CST is an expression rather than a literal, e.g. {@code 2 * r}. Kept as the
 * CST node so later coercion can still fold constant arithmetic.
 */
public record ExpressionValue(CstNode node) implements ParameterValue {

    public ExpressionValue {
        Objects.requireNonNull(node, "node");
    }

    @Override
    public String describe() {
        return node.text();
    }
}
