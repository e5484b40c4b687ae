package org.openscad.ast;

import java.util.Properties;

/**
 * Settings of an {@link AstGenerator}. Immutable; use {@link #builder()} or
 * {@link #fromSystemProperties()}.
 * <p>
 * Recognized system properties:
 * <ul>
 *     <li>{@code openscad.ast.canonicalizeIdentifiers} (default {@code true})</li>
 *     <li>{@code openscad.ast.reportUnrecognized} (default {@code true})</li>
 *     <li>{@code openscad.ast.maxDepth} (default {@code 512})</li>
 *     <li>{@code openscad.ast.includeSourceText} (default {@code true})</li>
 * </ul>
 */
public final class GeneratorOptions {

    public static final String PREFIX = "openscad.ast.";
    public static final String CANONICALIZE_IDENTIFIERS = PREFIX + "canonicalizeIdentifiers";
    public static final String REPORT_UNRECOGNIZED = PREFIX + "reportUnrecognized";
    public static final String MAX_DEPTH = PREFIX + "maxDepth";
    public static final String INCLUDE_SOURCE_TEXT = PREFIX + "includeSourceText";

    public static final int DEFAULT_MAX_DEPTH = 512;

    private static final GeneratorOptions DEFAULTS = builder().build();

    private final boolean canonicalizeIdentifiers;
    private final boolean reportUnrecognized;
    private final int maxDepth;
    private final boolean includeSourceText;

    private GeneratorOptions(Builder builder) {
        this.canonicalizeIdentifiers = builder.canonicalizeIdentifiers;
        this.reportUnrecognized = builder.reportUnrecognized;
        this.maxDepth = builder.maxDepth;
        this.includeSourceText = builder.includeSourceText;
    }

    public static GeneratorOptions defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static GeneratorOptions fromSystemProperties() {
        return fromProperties(System.getProperties());
    }

    /**
     * Reads the {@code openscad.ast.*} keys of {@code properties}; absent keys keep their defaults.
     *
     * @throws IllegalArgumentException if {@code maxDepth} is not a positive integer
     */
    public static GeneratorOptions fromProperties(Properties properties) {
        Builder builder = builder();
        String value = properties.getProperty(CANONICALIZE_IDENTIFIERS);
        if (value != null) {
            builder.canonicalizeIdentifiers(Boolean.parseBoolean(value.trim()));
        }
        value = properties.getProperty(REPORT_UNRECOGNIZED);
        if (value != null) {
            builder.reportUnrecognized(Boolean.parseBoolean(value.trim()));
        }
        value = properties.getProperty(INCLUDE_SOURCE_TEXT);
        if (value != null) {
            builder.includeSourceText(Boolean.parseBoolean(value.trim()));
        }
        value = properties.getProperty(MAX_DEPTH);
        if (value != null) {
            try {
                builder.maxDepth(Integer.parseInt(value.trim()));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid value for " + MAX_DEPTH + ": " + value, e);
            }
        }
        return builder.build();
    }

    /**
     * Whether truncated built-in names such as {@code sphe} are mapped back to their full name.
     */
    public boolean isCanonicalizeIdentifiers() {
        return canonicalizeIdentifiers;
    }

    /**
     * Whether CST nodes no visitor understands produce a warning.
     */
    public boolean isReportUnrecognized() {
        return reportUnrecognized;
    }

    /**
     * Nesting depth past which lowering stops with an error node.
     */
    public int getMaxDepth() {
        return maxDepth;
    }

    /**
     * Whether source ranges carry the text they cover.
     */
    public boolean isIncludeSourceText() {
        return includeSourceText;
    }

    public Builder toBuilder() {
        return builder()
                .canonicalizeIdentifiers(canonicalizeIdentifiers)
                .reportUnrecognized(reportUnrecognized)
                .maxDepth(maxDepth)
                .includeSourceText(includeSourceText);
    }

    @Override
    public String toString() {
        return "GeneratorOptions{canonicalizeIdentifiers=" + canonicalizeIdentifiers
                + ", reportUnrecognized=" + reportUnrecognized
                + ", maxDepth=" + maxDepth
                + ", includeSourceText=" + includeSourceText + '}';
    }

    public static final class Builder {

        private boolean canonicalizeIdentifiers = true;
        private boolean reportUnrecognized = true;
        private int maxDepth = DEFAULT_MAX_DEPTH;
        private boolean includeSourceText = true;

        private Builder() {
        }

        public Builder canonicalizeIdentifiers(boolean canonicalizeIdentifiers) {
            this.canonicalizeIdentifiers = canonicalizeIdentifiers;
            return this;
        }

        public Builder reportUnrecognized(boolean reportUnrecognized) {
            this.reportUnrecognized = reportUnrecognized;
            return this;
        }

        public Builder maxDepth(int maxDepth) {
            if (maxDepth < 1) {
                throw new IllegalArgumentException("maxDepth must be positive: " + maxDepth);
            }
            this.maxDepth = maxDepth;
            return this;
        }

        public Builder includeSourceText(boolean includeSourceText) {
            this.includeSourceText = includeSourceText;
            return this;
        }

        public GeneratorOptions build() {
            return new GeneratorOptions(this);
        }
    }
}
