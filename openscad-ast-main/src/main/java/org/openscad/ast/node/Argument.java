package org.openscad.ast.node;

import java.util.Objects;

/**
 * One call argument; {@code name} is {@code null} for positional arguments.
 */
public record Argument(String name, ExpressionNode value) {

    public Argument {
        Objects.requireNonNull(value, "value");
    }

    public boolean isNamed() {
        return name != null;
    }
}
