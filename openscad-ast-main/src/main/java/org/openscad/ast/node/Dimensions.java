package org.openscad.ast.node;

import java.util.List;

/**
 * Size of a cube or square: either one number for every axis or one number per axis.
 */
public record Dimensions(Double scalar, List<Double> vector) {

    public Dimensions {
        if ((scalar == null) == (vector == null)) {
            throw new IllegalArgumentException("Exactly one of scalar and vector must be set");
        }
        vector = vector == null ? null : List.copyOf(vector);
    }

    public static Dimensions of(double scalar) {
        return new Dimensions(scalar, null);
    }

    public static Dimensions of(List<Double> vector) {
        return new Dimensions(null, vector);
    }

    public boolean isScalar() {
        return scalar != null;
    }

    @Override
    public String toString() {
        return isScalar() ? String.valueOf(scalar) : vector.toString();
    }
}
