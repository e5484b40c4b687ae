package org.openscad.ast.node;

public enum UnaryOperator {

    MINUS("-"),
    PLUS("+"),
    NOT("!");

    private final String symbol;

    UnaryOperator(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }
}
