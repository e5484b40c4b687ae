package org.openscad.ast.extraction;

/**
 * The value of a call parameter: either a literal {@link Value} or an {@link ExpressionValue}
 * that could not be reduced to one.
 */
public interface ParameterValue {

    /**
     * Short source-like rendering, for diagnostics.
     */
    String describe();
}
