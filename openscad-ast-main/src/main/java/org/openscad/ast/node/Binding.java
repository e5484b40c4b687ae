package org.openscad.ast.node;

import java.util.Objects;

/**
 * A {@code name = value} pair of a {@code let}.
 */
public record Binding(String name, ExpressionNode value) {

    public Binding {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(value, "value");
    }
}
