package org.openscad.ast.node;

public enum LiteralType {
    NUMBER,
    STRING,
    BOOLEAN,
    UNDEF
}
