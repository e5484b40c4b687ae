package org.openscad.ast.extraction;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

import org.openscad.ast.diagnostics.DiagnosticSink;
import org.openscad.ast.location.SourceRange;

/**
 * Parameters of one call matched against the names a shape or transform accepts.
 * <p>
 * Matching happens in two passes. Named arguments are bound first, whatever their position;
 * a name given twice keeps its first value. The positional arguments then fill, in order, the
 * canonical names that are still unbound.
 */
public final class ResolvedParameters {

    private final String callee;
    private final SourceRange location;
    private final DiagnosticSink sink;
    private final Map<String, ParameterValue> values = new LinkedHashMap<>();
    private final List<ParameterValue> positional = new ArrayList<>();

    private ResolvedParameters(String callee, SourceRange location, DiagnosticSink sink) {
        this.callee = callee;
        this.location = location;
        this.sink = sink;
    }

    /**
     * Binds the named arguments and keeps the positional ones aside for {@link #bindPositional}.
     * Names outside {@code knownNames} are reported and dropped, except special variables
     * ({@code $fn}, ...), which every call may carry.
     */
    public static ResolvedParameters resolveNamed(String callee, List<Parameter> parameters,
                                                  Collection<String> knownNames, SourceRange location,
                                                  DiagnosticSink sink) {
        ResolvedParameters resolved = new ResolvedParameters(callee, location, sink);
        for (Parameter parameter : parameters) {
            if (!parameter.isNamed()) {
                resolved.positional.add(parameter.value());
                continue;
            }
            String name = parameter.name();
            if (!knownNames.contains(name) && !name.startsWith("$")) {
                sink.warn("Unknown parameter '" + name + "' for " + callee, callee, location);
                continue;
            }
            if (resolved.values.containsKey(name)) {
                sink.warn("Parameter '" + name + "' given more than once for " + callee + ", keeping the first",
                        callee, location);
                continue;
            }
            resolved.values.put(name, parameter.value());
        }
        return resolved;
    }

    /**
     * Both passes at once: {@code canonicalOrder} lists the positional slots, {@code namedOnly}
     * the names that may only be given by name.
     */
    public static ResolvedParameters resolve(String callee, List<Parameter> parameters, List<String> canonicalOrder,
                                             Collection<String> namedOnly, SourceRange location,
                                             DiagnosticSink sink) {
        Set<String> known = new LinkedHashSet<>(canonicalOrder);
        known.addAll(namedOnly);
        return resolveNamed(callee, parameters, known, location, sink).bindPositional(canonicalOrder);
    }

    /**
     * Assigns the pending positional arguments to the first unbound names of {@code canonicalOrder}.
     * Arguments left over are reported and stay available from {@link #positional()}.
     */
    public ResolvedParameters bindPositional(List<String> canonicalOrder) {
        List<ParameterValue> pending = new ArrayList<>(positional);
        positional.clear();
        int slot = 0;
        for (ParameterValue value : pending) {
            while (slot < canonicalOrder.size() && values.containsKey(canonicalOrder.get(slot))) {
                slot++;
            }
            if (slot < canonicalOrder.size()) {
                values.put(canonicalOrder.get(slot++), value);
            } else {
                positional.add(value);
            }
        }
        if (!positional.isEmpty()) {
            reportUnusedPositional(0);
        }
        return this;
    }

    /**
     * Positional arguments not bound to a name.
     */
    public List<ParameterValue> positional() {
        return Collections.unmodifiableList(positional);
    }

    /**
     * Reports the positional arguments from index {@code used} on as ignored.
     */
    public void reportUnusedPositional(int used) {
        for (int i = used; i < positional.size(); i++) {
            sink.warn("Ignoring extra positional argument " + positional.get(i).describe() + " for " + callee,
                    callee, location);
        }
    }

    public void bind(String name, ParameterValue value) {
        values.putIfAbsent(name, value);
    }

    public boolean has(String name) {
        return values.containsKey(name);
    }

    public Optional<ParameterValue> get(String name) {
        return Optional.ofNullable(values.get(name));
    }

    public Optional<Double> number(String name) {
        return coerce(name, ParameterCoercion::toNumber, "a number");
    }

    public double number(String name, double fallback) {
        return number(name).orElse(fallback);
    }

    public Optional<Integer> integer(String name) {
        return coerce(name, ParameterCoercion::toInteger, "an integer");
    }

    public Optional<Boolean> bool(String name) {
        return coerce(name, ParameterCoercion::toBoolean, "a boolean");
    }

    public boolean bool(String name, boolean fallback) {
        return bool(name).orElse(fallback);
    }

    public Optional<String> text(String name) {
        return coerce(name, ParameterCoercion::toText, "a string");
    }

    public Optional<List<Double>> vector(String name) {
        return coerce(name, ParameterCoercion::toNumberVector, "a numeric vector");
    }

    /**
     * Coerces the value bound to {@code name}. A value that is present but of the wrong shape is
     * reported, and the caller falls back to its default.
     */
    public <T> Optional<T> coerce(String name, Function<ParameterValue, Optional<T>> coercion, String expected) {
        ParameterValue value = values.get(name);
        if (value == null) {
            return Optional.empty();
        }
        Optional<T> result = coercion.apply(value);
        if (result.isEmpty()) {
            sink.warn("Parameter '" + name + "' of " + callee + " should be " + expected + ", got "
                    + value.describe() + "; using the default", callee, location);
        }
        return result;
    }

    public String getCallee() {
        return callee;
    }

    public SourceRange getLocation() {
        return location;
    }

    public DiagnosticSink getSink() {
        return sink;
    }
}
