package org.openscad.ast.node;

/**
 * Debug modifiers that may prefix an instantiation.
 */
public enum Modifier {

    HIGHLIGHT("#"),
    ROOT("!"),
    BACKGROUND("%"),
    DISABLE("*");

    private final String symbol;

    Modifier(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }

    public static Modifier fromSymbol(String symbol) {
        for (Modifier modifier : values()) {
            if (modifier.symbol.equals(symbol)) {
                return modifier;
            }
        }
        throw new IllegalArgumentException("Unknown modifier: " + symbol);
    }
}
