package org.openscad.ast.extraction;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * A literal value read off the CST while extracting call arguments.
 */
public interface Value extends ParameterValue {

    ValueKind kind();

    /**
     * A number kept as written; parsing is left to whoever needs a double.
     */
    record Number(String raw) implements Value {

        public Number {
            Objects.requireNonNull(raw, "raw");
        }

        @Override
        public ValueKind kind() {
            return ValueKind.NUMBER;
        }

        @Override
        public String describe() {
            return raw;
        }
    }

    record Bool(boolean value) implements Value {

        @Override
        public ValueKind kind() {
            return ValueKind.BOOLEAN;
        }

        @Override
        public String describe() {
            return String.valueOf(value);
        }
    }

    /**
     * A string literal without its quotes.
     */
    record Str(String value) implements Value {

        public Str {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public ValueKind kind() {
            return ValueKind.STRING;
        }

        @Override
        public String describe() {
            return '"' + value + '"';
        }
    }

    record Identifier(String name) implements Value {

        public Identifier {
            Objects.requireNonNull(name, "name");
        }

        @Override
        public ValueKind kind() {
            return ValueKind.IDENTIFIER;
        }

        @Override
        public String describe() {
            return name;
        }
    }

    /**
     * A vector literal. {@code complete} is false when some elements could not be extracted and
     * were left out, so the element count no longer matches the source.
     */
    record Vector(List<Value> elements, boolean complete) implements Value {

        public Vector {
            elements = List.copyOf(elements);
        }

        public int size() {
            return elements.size();
        }

        @Override
        public ValueKind kind() {
            return ValueKind.VECTOR;
        }

        @Override
        public String describe() {
            return elements.stream().map(Value::describe).collect(Collectors.joining(", ", "[", "]"));
        }
    }

    /**
     * A range literal with its bounds kept as source text; {@code step} is {@code null} when absent.
     */
    record Range(String start, String end, String step) implements Value {

        @Override
        public ValueKind kind() {
            return ValueKind.RANGE;
        }

        @Override
        public String describe() {
            return step == null ? "[" + start + ":" + end + "]" : "[" + start + ":" + step + ":" + end + "]";
        }
    }
}
