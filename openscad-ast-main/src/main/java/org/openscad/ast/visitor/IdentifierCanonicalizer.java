package org.openscad.ast.visitor;

import java.util.Map;

/**
 * Maps truncated built-in module names back to their full name, e.g. {@code sphe} to
 * {@code sphere}. Some CST providers cut identifier text short at node boundaries; names missing
 * from the table pass through unchanged and simply fail to match a built-in.
 * <p>
 * A user module whose name happens to be one of these prefixes is matched as the built-in.
 */
public final class IdentifierCanonicalizer {

    private static final Map<String, String> TRUNCATIONS = Map.ofEntries(
            Map.entry("cub", "cube"),
            Map.entry("sphe", "sphere"),
            Map.entry("spher", "sphere"),
            Map.entry("cyli", "cylinder"),
            Map.entry("cylin", "cylinder"),
            Map.entry("cylind", "cylinder"),
            Map.entry("cylinde", "cylinder"),
            Map.entry("polyh", "polyhedron"),
            Map.entry("polyhe", "polyhedron"),
            Map.entry("polyhed", "polyhedron"),
            Map.entry("polyhedr", "polyhedron"),
            Map.entry("polyhedro", "polyhedron"),
            Map.entry("polyg", "polygon"),
            Map.entry("polygo", "polygon"),
            Map.entry("squa", "square"),
            Map.entry("squar", "square"),
            Map.entry("circ", "circle"),
            Map.entry("circl", "circle"),
            Map.entry("tex", "text"),
            Map.entry("tran", "translate"),
            Map.entry("transl", "translate"),
            Map.entry("transla", "translate"),
            Map.entry("translat", "translate"),
            Map.entry("rota", "rotate"),
            Map.entry("rotat", "rotate"),
            Map.entry("scal", "scale"),
            Map.entry("mirr", "mirror"),
            Map.entry("mirro", "mirror"),
            Map.entry("colo", "color"),
            Map.entry("mult", "multmatrix"),
            Map.entry("unio", "union"),
            Map.entry("diff", "difference"),
            Map.entry("inte", "intersection")
    );

    private IdentifierCanonicalizer() {
    }

    public static String canonicalize(String name) {
        if (name == null) {
            return null;
        }
        return TRUNCATIONS.getOrDefault(name, name);
    }
}
