package org.openscad.ast.node;

import java.util.Objects;

/**
 * One loop variable of a {@code for}. {@code step} is copied out of a stepped range literal and is
 * {@code null} otherwise.
 */
public record ForBinding(String variable, ExpressionNode range, ExpressionNode step) {

    public ForBinding {
        Objects.requireNonNull(variable, "variable");
        Objects.requireNonNull(range, "range");
    }
}
