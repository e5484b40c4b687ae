package org.openscad.ast.diagnostics;

import org.openscad.ast.location.SourceRange;

/**
 * Receives diagnostics during generation. Implementations must not throw.
 */
@FunctionalInterface
public interface DiagnosticSink {

    void report(Diagnostic diagnostic);

    default void debug(String message, String origin, SourceRange range) {
        report(Diagnostic.of(Severity.DEBUG, message, origin, range));
    }

    default void warn(String message, String origin, SourceRange range) {
        report(Diagnostic.of(Severity.WARNING, message, origin, range));
    }

    default void error(String message, String origin, SourceRange range) {
        report(Diagnostic.of(Severity.ERROR, message, origin, range));
    }
}
