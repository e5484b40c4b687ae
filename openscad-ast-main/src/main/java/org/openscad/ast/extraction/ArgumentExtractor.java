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
 * Splits a CST argument list into positional and named arguments, in source order.
 * <p>
 * Two argument shapes are understood: a dedicated {@code named_argument} node holding a name and a
 * value, and a generic {@code argument} node that is named exactly when it carries an {@code =}
 * token and two named children. Any other named child of the list is taken as a positional value.
 */
public final class ArgumentExtractor {

    private static final Set<String> PUNCTUATION = Set.of("(", ")", ",", "=");

    private ArgumentExtractor() {
    }

    public static List<Parameter> extractArguments(CstNode argumentList, DiagnosticSink sink) {
        List<Parameter> parameters = new ArrayList<>();
        for (RawArgument raw : splitArguments(argumentList, sink)) {
            ParameterValue value = toParameterValue(raw.value(), sink);
            parameters.add(new Parameter(raw.name(), value));
        }
        return parameters;
    }

    public static List<RawArgument> splitArguments(CstNode argumentList, DiagnosticSink sink) {
        if (argumentList == null || argumentList.text().isBlank()) {
            return List.of();
        }
        List<RawArgument> arguments = new ArrayList<>();
        collect(argumentList, arguments, sink);
        return arguments;
    }

    /**
     * The literal value of an argument, or the argument's expression when it is not a literal.
     */
    public static ParameterValue toParameterValue(CstNode valueNode, DiagnosticSink sink) {
        Optional<Value> value = ValueExtractor.extractValue(valueNode, sink);
        if (value.isPresent()) {
            return value.get();
        }
        return new ExpressionValue(valueNode);
    }

    private static void collect(CstNode container, List<RawArgument> out, DiagnosticSink sink) {
        for (CstNode child : container.children()) {
            if (!child.isNamed()) {
                if (!PUNCTUATION.contains(child.type()) && !child.isMissing()) {
                    sink.debug("Ignoring token '" + child.text() + "' in argument list", container.type(),
                            Locations.of(child));
                }
                continue;
            }
            switch (child.type()) {
                case CstTypes.ARGUMENTS -> collect(child, out, sink);
                case CstTypes.NAMED_ARGUMENT -> namedArgument(child, out, sink);
                case CstTypes.ARGUMENT -> genericArgument(child, out, sink);
                case CstTypes.ERROR -> sink.warn("Skipping malformed argument '" + child.text() + "'",
                        container.type(), Locations.of(child));
                default -> out.add(new RawArgument(null, child));
            }
        }
    }

    private static void namedArgument(CstNode node, List<RawArgument> out, DiagnosticSink sink) {
        Optional<CstNode> name = node.childForFieldName("name");
        Optional<CstNode> value = node.childForFieldName("value");
        if (name.isEmpty() && node.namedChildCount() >= 1) {
            name = Optional.of(node.namedChild(0));
        }
        if (value.isEmpty() && node.namedChildCount() >= 2) {
            value = Optional.of(node.namedChild(node.namedChildCount() - 1));
        }
        if (name.isEmpty() || value.isEmpty()) {
            sink.warn("Named argument '" + node.text() + "' has no value", node.type(), Locations.of(node));
            return;
        }
        out.add(new RawArgument(name.get().text().trim(), value.get()));
    }

    private static void genericArgument(CstNode node, List<RawArgument> out, DiagnosticSink sink) {
        boolean assigns = node.children().stream().anyMatch(c -> !c.isNamed() && "=".equals(c.type()));
        if (assigns && node.namedChildCount() >= 2) {
            namedArgument(node, out, sink);
            return;
        }
        Optional<CstNode> value = node.childForFieldName("value");
        if (value.isEmpty() && node.namedChildCount() == 1) {
            value = Optional.of(node.namedChild(0));
        }
        if (value.isEmpty()) {
            sink.warn("Cannot interpret argument '" + node.text() + "'", node.type(), Locations.of(node));
            return;
        }
        out.add(new RawArgument(null, value.get()));
    }
}
