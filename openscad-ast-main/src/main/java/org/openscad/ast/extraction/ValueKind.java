package org.openscad.ast.extraction;

public enum ValueKind {
    NUMBER,
    BOOLEAN,
    STRING,
    IDENTIFIER,
    VECTOR,
    RANGE
}
