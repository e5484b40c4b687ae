package org.openscad.cst;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable in-memory {@link CstNode}, for trees assembled by hand or by parsers other than the
 * bundled ANTLR one.
 */
public final class SimpleCstNode implements CstNode {

    private final String type;
    private final String text;
    private final boolean named;
    private final boolean error;
    private final boolean missing;
    private final boolean hasError;
    private final List<CstNode> children;
    private final List<CstNode> namedChildren;
    private final Map<String, CstNode> fields;
    private final CstPoint startPoint;
    private final CstPoint endPoint;

    private SimpleCstNode(Builder builder) {
        this.type = builder.type;
        this.named = builder.named;
        this.error = builder.error;
        this.missing = builder.missing;
        this.children = List.copyOf(builder.children);
        this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(builder.fields));
        this.text = builder.text != null ? builder.text : joinChildText(children);
        this.startPoint = builder.startPoint;
        this.endPoint = builder.endPoint;

        List<CstNode> namedOnes = new ArrayList<>();
        boolean anyError = error || missing;
        for (CstNode child : children) {
            if (child.isNamed()) {
                namedOnes.add(child);
            }
            anyError |= child.hasError();
        }
        this.namedChildren = List.copyOf(namedOnes);
        this.hasError = anyError;
    }

    /**
     * Named leaf, e.g. {@code leaf("number", "10")}.
     */
    public static SimpleCstNode leaf(String type, String text) {
        return named(type).text(text).build();
    }

    /**
     * Anonymous token whose type is its text, e.g. {@code token("(")}.
     */
    public static SimpleCstNode token(String text) {
        return new Builder(text, false).text(text).build();
    }

    public static Builder named(String type) {
        return new Builder(type, true);
    }

    public static Builder error() {
        return new Builder(CstTypes.ERROR, true).markError();
    }

    private static String joinChildText(List<CstNode> children) {
        StringBuilder sb = new StringBuilder();
        for (CstNode child : children) {
            sb.append(child.text());
        }
        return sb.toString();
    }

    @Override
    public String type() {
        return type;
    }

    @Override
    public String text() {
        return text;
    }

    @Override
    public boolean isNamed() {
        return named;
    }

    @Override
    public boolean isError() {
        return error;
    }

    @Override
    public boolean isMissing() {
        return missing;
    }

    @Override
    public boolean hasError() {
        return hasError;
    }

    @Override
    public List<CstNode> children() {
        return children;
    }

    @Override
    public List<CstNode> namedChildren() {
        return namedChildren;
    }

    @Override
    public Optional<CstNode> childForFieldName(String fieldName) {
        return Optional.ofNullable(fields.get(fieldName));
    }

    @Override
    public CstPoint startPoint() {
        return startPoint;
    }

    @Override
    public CstPoint endPoint() {
        return endPoint;
    }

    @Override
    public String toString() {
        return type + "[" + text + "]";
    }

    public static final class Builder {

        private final String type;
        private final boolean named;
        private boolean error;
        private boolean missing;
        private String text;
        private final List<CstNode> children = new ArrayList<>();
        private final Map<String, CstNode> fields = new LinkedHashMap<>();
        private CstPoint startPoint = CstPoint.ORIGIN;
        private CstPoint endPoint = CstPoint.ORIGIN;

        private Builder(String type, boolean named) {
            this.type = Objects.requireNonNull(type, "type");
            this.named = named;
        }

        public Builder text(String text) {
            this.text = text;
            return this;
        }

        public Builder child(CstNode child) {
            children.add(Objects.requireNonNull(child, "child"));
            return this;
        }

        public Builder token(String tokenText) {
            return child(SimpleCstNode.token(tokenText));
        }

        /**
         * Appends {@code child} and makes it reachable through {@link CstNode#childForFieldName}.
         */
        public Builder field(String fieldName, CstNode child) {
            child(child);
            fields.put(fieldName, child);
            return this;
        }

        public Builder span(CstPoint start, CstPoint end) {
            this.startPoint = start;
            this.endPoint = end;
            return this;
        }

        public Builder markError() {
            this.error = true;
            return this;
        }

        public Builder markMissing() {
            this.missing = true;
            return this;
        }

        public SimpleCstNode build() {
            return new SimpleCstNode(this);
        }
    }
}
