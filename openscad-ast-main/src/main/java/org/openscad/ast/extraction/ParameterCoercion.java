package org.openscad.ast.extraction;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

import org.openscad.cst.CstNode;
import org.openscad.cst.CstTypes;

/**
 * Converts parameter values to the Java types AST nodes are built from. Every method returns an
 * empty result when the value does not have the requested shape; reporting that is up to the
 * caller.
 * <p>
 * Expression values are folded when they consist only of numeric literals and arithmetic, so
 * {@code cube(2 * 5)} still produces a size.
 */
public final class ParameterCoercion {

    private ParameterCoercion() {
    }

    public static Optional<Double> toNumber(ParameterValue value) {
        if (value instanceof Value.Number number) {
            return parseDouble(number.raw());
        }
        if (value instanceof Value.Str str) {
            return parseDouble(str.value().trim());
        }
        if (value instanceof ExpressionValue expression) {
            return fold(expression.node());
        }
        return Optional.empty();
    }

    /**
     * Whole numbers within the {@code int} range only; larger counts are rejected rather than
     * clamped.
     */
    public static Optional<Integer> toInteger(ParameterValue value) {
        return toNumber(value)
                .filter(d -> d == Math.rint(d) && d >= Integer.MIN_VALUE && d <= Integer.MAX_VALUE)
                .map(Double::intValue);
    }

    public static Optional<Boolean> toBoolean(ParameterValue value) {
        if (value instanceof Value.Bool bool) {
            return Optional.of(bool.value());
        }
        if (value instanceof Value.Str str) {
            String text = str.value().trim();
            if ("true".equals(text) || "false".equals(text)) {
                return Optional.of(Boolean.parseBoolean(text));
            }
        }
        return Optional.empty();
    }

    public static Optional<String> toText(ParameterValue value) {
        if (value instanceof Value.Str str) {
            return Optional.of(str.value());
        }
        return Optional.empty();
    }

    /**
     * A vector whose every element is numeric. Vectors that lost elements during extraction are
     * rejected so their dimensionality is never misreported.
     */
    public static Optional<List<Double>> toNumberVector(ParameterValue value) {
        if (!(value instanceof Value.Vector vector) || !vector.complete()) {
            return Optional.empty();
        }
        List<Double> numbers = new ArrayList<>(vector.size());
        for (Value element : vector.elements()) {
            Optional<Double> number = toNumber(element);
            if (number.isEmpty()) {
                return Optional.empty();
            }
            numbers.add(number.get());
        }
        return Optional.of(Collections.unmodifiableList(numbers));
    }

    public static Optional<List<Boolean>> toBooleanVector(ParameterValue value) {
        if (!(value instanceof Value.Vector vector) || !vector.complete()) {
            return Optional.empty();
        }
        List<Boolean> flags = new ArrayList<>(vector.size());
        for (Value element : vector.elements()) {
            Optional<Boolean> flag = toBoolean(element);
            if (flag.isEmpty()) {
                return Optional.empty();
            }
            flags.add(flag.get());
        }
        return Optional.of(Collections.unmodifiableList(flags));
    }

    public static Optional<List<List<Double>>> toNumberMatrix(ParameterValue value) {
        if (!(value instanceof Value.Vector vector) || !vector.complete()) {
            return Optional.empty();
        }
        List<List<Double>> rows = new ArrayList<>(vector.size());
        for (Value element : vector.elements()) {
            Optional<List<Double>> row = toNumberVector(element);
            if (row.isEmpty()) {
                return Optional.empty();
            }
            rows.add(row.get());
        }
        return Optional.of(Collections.unmodifiableList(rows));
    }

    public static Optional<List<List<Integer>>> toIndexLists(ParameterValue value) {
        if (!(value instanceof Value.Vector vector) || !vector.complete()) {
            return Optional.empty();
        }
        List<List<Integer>> lists = new ArrayList<>(vector.size());
        for (Value element : vector.elements()) {
            if (!(element instanceof Value.Vector inner) || !inner.complete()) {
                return Optional.empty();
            }
            List<Integer> indices = new ArrayList<>(inner.size());
            for (Value index : inner.elements()) {
                Optional<Integer> i = toInteger(index);
                if (i.isEmpty()) {
                    return Optional.empty();
                }
                indices.add(i.get());
            }
            lists.add(Collections.unmodifiableList(indices));
        }
        return Optional.of(Collections.unmodifiableList(lists));
    }

    /**
     * Pads {@code values} with {@code fill} up to {@code size} elements, or truncates it to that size.
     */
    public static List<Double> fit(List<Double> values, int size, double fill) {
        List<Double> result = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            result.add(i < values.size() ? values.get(i) : fill);
        }
        return Collections.unmodifiableList(result);
    }

    private static Optional<Double> parseDouble(String text) {
        if (text.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(Double.parseDouble(text));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    private static Optional<Double> fold(CstNode node) {
        if (node == null || node.hasError()) {
            return Optional.empty();
        }
        switch (node.type()) {
            case CstTypes.NUMBER:
                return parseDouble(node.text().trim());
            case CstTypes.UNARY_EXPRESSION: {
                Optional<CstNode> operand = node.childForFieldName("operand");
                if (operand.isEmpty()) {
                    return foldSingle(node);
                }
                String operator = operatorOf(node);
                Optional<Double> value = fold(operand.get());
                if ("-".equals(operator)) {
                    return value.map(v -> -v);
                }
                return "+".equals(operator) ? value : Optional.empty();
            }
            case CstTypes.BINARY_EXPRESSION: {
                Optional<CstNode> left = node.childForFieldName("left");
                Optional<CstNode> right = node.childForFieldName("right");
                if (left.isEmpty() || right.isEmpty()) {
                    return foldSingle(node);
                }
                Optional<Double> l = fold(left.get());
                Optional<Double> r = fold(right.get());
                if (l.isEmpty() || r.isEmpty()) {
                    return Optional.empty();
                }
                return arithmetic(operatorOf(node), l.get(), r.get());
            }
            case CstTypes.PARENTHESIZED_EXPRESSION:
            case CstTypes.PRIMARY_EXPRESSION:
            case CstTypes.EXPRESSION:
                return foldSingle(node);
            default:
                return Optional.empty();
        }
    }

    private static Optional<Double> foldSingle(CstNode node) {
        return node.namedChildCount() == 1 ? fold(node.namedChild(0)) : Optional.empty();
    }

    private static String operatorOf(CstNode node) {
        Optional<CstNode> operator = node.childForFieldName("operator");
        if (operator.isPresent()) {
            return operator.get().text();
        }
        for (CstNode child : node.children()) {
            if (!child.isNamed()) {
                return child.type();
            }
        }
        return "";
    }

    private static Optional<Double> arithmetic(String operator, double l, double r) {
        return switch (operator) {
            case "+" -> Optional.of(l + r);
            case "-" -> Optional.of(l - r);
            case "*" -> Optional.of(l * r);
            case "/" -> Optional.of(l / r);
            case "%" -> Optional.of(l % r);
            case "^" -> Optional.of(Math.pow(l, r));
            default -> Optional.empty();
        };
    }
}
