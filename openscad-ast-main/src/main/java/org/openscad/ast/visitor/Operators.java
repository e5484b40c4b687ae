package org.openscad.ast.visitor;

import java.util.Map;

import org.openscad.ast.node.BinaryOperator;
import org.openscad.ast.node.UnaryOperator;

public final class Operators {

    private static final Map<String, BinaryOperator> BINARY_OPERATORS = Map.ofEntries(
            Map.entry("+", BinaryOperator.PLUS),
            Map.entry("-", BinaryOperator.MINUS),
            Map.entry("*", BinaryOperator.MULTIPLY),
            Map.entry("/", BinaryOperator.DIVIDE),
            Map.entry("%", BinaryOperator.MODULO),
            Map.entry("^", BinaryOperator.POWER),
            Map.entry("==", BinaryOperator.EQUALS),
            Map.entry("!=", BinaryOperator.NOT_EQUALS),
            Map.entry("<", BinaryOperator.LESS),
            Map.entry("<=", BinaryOperator.LESS_EQUALS),
            Map.entry(">", BinaryOperator.GREATER),
            Map.entry(">=", BinaryOperator.GREATER_EQUALS),
            Map.entry("&&", BinaryOperator.AND),
            Map.entry("||", BinaryOperator.OR)
    );

    private static final Map<String, UnaryOperator> UNARY_OPERATORS = Map.of(
            "-", UnaryOperator.MINUS,
            "+", UnaryOperator.PLUS,
            "!", UnaryOperator.NOT
    );

    private Operators() {
    }

    public static BinaryOperator getBinaryOperator(String operatorText) {
        BinaryOperator operator = BINARY_OPERATORS.get(operatorText);
        if (operator == null) {
            throw new IllegalArgumentException("Unknown binary operator: " + operatorText);
        }
        return operator;
    }

    public static UnaryOperator getUnaryOperator(String operatorText) {
        UnaryOperator operator = UNARY_OPERATORS.get(operatorText);
        if (operator == null) {
            throw new IllegalArgumentException("Unknown unary operator: " + operatorText);
        }
        return operator;
    }
}
