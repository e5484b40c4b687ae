package org.openscad.ast.extraction;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import org.openscad.ast.diagnostics.DiagnosticSink;
import org.openscad.ast.location.Locations;
import org.openscad.cst.CstNode;
import org.openscad.cst.CstTypes;

/**
 * Reads literal values (numbers, booleans, strings, identifiers, vectors and ranges) off CST
 * argument nodes. Anything else yields an empty result, which callers treat as "no match".
 */
public final class ValueExtractor {

    // wrappers that only add a precedence or grouping layer around a single operand
    private static final Set<String> PASS_THROUGH = Set.of(
            CstTypes.EXPRESSION,
            CstTypes.PRIMARY_EXPRESSION,
            CstTypes.PARENTHESIZED_EXPRESSION,
            CstTypes.ARGUMENT,
            CstTypes.ARGUMENTS,
            CstTypes.BINARY_EXPRESSION,
            CstTypes.UNARY_EXPRESSION,
            CstTypes.CONDITIONAL_EXPRESSION);

    private ValueExtractor() {
    }

    public static Optional<Value> extractValue(CstNode node, DiagnosticSink sink) {
        if (node == null || node.isError() || node.isMissing()) {
            return Optional.empty();
        }
        switch (node.type()) {
            case CstTypes.NUMBER:
                return Optional.of(new Value.Number(node.text().trim()));
            case CstTypes.STRING:
                return Optional.of(new Value.Str(unquote(node.text().trim())));
            case CstTypes.BOOLEAN:
            case "true":
            case "false":
                return Optional.of(new Value.Bool(Boolean.parseBoolean(node.text().trim())));
            case CstTypes.IDENTIFIER:
            case CstTypes.SPECIAL_VARIABLE:
                return Optional.of(new Value.Identifier(node.text().trim()));
            case CstTypes.UNDEF:
                return Optional.empty();
            case CstTypes.VECTOR_EXPRESSION:
                return Optional.of(extractVector(node, sink));
            case CstTypes.RANGE_EXPRESSION:
                return extractRange(node);
            case CstTypes.UNARY_EXPRESSION:
                if (node.childForFieldName("operand").isPresent()) {
                    return extractSignedNumber(node, sink);
                }
                return descend(node, sink);
            default:
                if (PASS_THROUGH.contains(node.type())) {
                    return descend(node, sink);
                }
                return Optional.empty();
        }
    }

    private static Optional<Value> descend(CstNode node, DiagnosticSink sink) {
        Optional<CstNode> value = node.childForFieldName("value");
        if (value.isPresent()) {
            return extractValue(value.get(), sink);
        }
        Optional<CstNode> inner = node.childForFieldName("inner");
        if (inner.isPresent()) {
            return extractValue(inner.get(), sink);
        }
        if (node.namedChildCount() == 1) {
            return extractValue(node.namedChild(0), sink);
        }
        return Optional.empty();
    }

    private static Value.Vector extractVector(CstNode node, DiagnosticSink sink) {
        List<Value> elements = new ArrayList<>();
        int candidates = 0;
        for (CstNode child : node.children()) {
            if (!child.isNamed()) {
                continue;
            }
            candidates++;
            extractValue(child, sink).ifPresent(elements::add);
        }
        if (candidates > 0 && elements.isEmpty()) {
            sink.warn("No element of vector " + node.text() + " could be extracted", node.type(),
                    Locations.of(node));
        }
        return new Value.Vector(elements, elements.size() == candidates);
    }

    private static Optional<Value> extractRange(CstNode node) {
        Optional<CstNode> begin = node.childForFieldName("begin").or(() -> node.childForFieldName("start"));
        Optional<CstNode> end = node.childForFieldName("end");
        if (begin.isEmpty() || end.isEmpty()) {
            return Optional.empty();
        }
        String step = node.childForFieldName("step").map(s -> s.text().trim()).orElse(null);
        return Optional.of(new Value.Range(begin.get().text().trim(), end.get().text().trim(), step));
    }

    private static Optional<Value> extractSignedNumber(CstNode node, DiagnosticSink sink) {
        String operator = node.childForFieldName("operator").map(CstNode::text).orElse("");
        Optional<Value> operand = extractValue(node.childForFieldName("operand").get(), sink);
        if (operand.isEmpty() || !(operand.get() instanceof Value.Number number)) {
            return Optional.empty();
        }
        switch (operator) {
            case "+":
                return operand;
            case "-":
                String raw = number.raw();
                return Optional.of(new Value.Number(raw.startsWith("-") ? raw.substring(1) : "-" + raw));
            default:
                return Optional.empty();
        }
    }

    /**
     * Strips the surrounding double quotes of a string literal and resolves its escapes.
     */
    public static String unquote(String literal) {
        String body = literal;
        if (body.length() >= 2 && body.startsWith("\"") && body.endsWith("\"")) {
            body = body.substring(1, body.length() - 1);
        }
        if (body.indexOf('\\') < 0) {
            return body;
        }
        StringBuilder sb = new StringBuilder(body.length());
        for (int i = 0; i < body.length(); i++) {
            char c = body.charAt(i);
            if (c != '\\' || i + 1 == body.length()) {
                sb.append(c);
                continue;
            }
            char next = body.charAt(++i);
            switch (next) {
                case 'n' -> sb.append('\n');
                case 't' -> sb.append('\t');
                case 'r' -> sb.append('\r');
                default -> sb.append(next);
            }
        }
        return sb.toString();
    }
}
