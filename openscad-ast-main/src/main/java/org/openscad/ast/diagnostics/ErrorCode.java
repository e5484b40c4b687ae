package org.openscad.ast.diagnostics;

/**
 * Codes carried by error nodes and error diagnostics.
 */
public enum ErrorCode {

    SYNTAX_ERROR("E100"),
    TYPE_ERROR("E200"),
    VALIDATION_ERROR("E300"),
    MISSING_REQUIRED_PARAMETER("E301"),
    MISSING_CYLINDER_H("E301_MISSING_CYLINDER_H"),
    FOR_NO_ASSIGNMENTS("E302_FOR_NO_ASSIGNMENTS"),
    RECURSION_LIMIT("E303_RECURSION_LIMIT"),
    UNSUPPORTED_CONSTRUCT("E500"),
    INTERNAL_ERROR("E900");

    private final String code;

    ErrorCode(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    @Override
    public String toString() {
        return code;
    }
}
