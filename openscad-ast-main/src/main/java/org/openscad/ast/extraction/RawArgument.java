package org.openscad.ast.extraction;

import java.util.Objects;

import org.openscad.cst.CstNode;

/**
 * An argument split out of an argument list but not interpreted yet.
 */
public record RawArgument(String name, CstNode value) {

    public RawArgument {
        Objects.requireNonNull(value, "value");
    }

    public boolean isNamed() {
        return name != null;
    }
}
