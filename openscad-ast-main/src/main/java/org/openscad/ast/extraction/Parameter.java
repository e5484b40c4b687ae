package org.openscad.ast.extraction;

import java.util.Objects;

/**
 * One call argument after extraction. The value is never absent: an argument that yields nothing
 * produces no parameter at all.
 */
public record Parameter(String name, ParameterValue value) {

    public Parameter {
        Objects.requireNonNull(value, "value");
    }

    public static Parameter positional(ParameterValue value) {
        return new Parameter(null, value);
    }

    public static Parameter named(String name, ParameterValue value) {
        return new Parameter(Objects.requireNonNull(name, "name"), value);
    }

    public boolean isNamed() {
        return name != null;
    }
}
