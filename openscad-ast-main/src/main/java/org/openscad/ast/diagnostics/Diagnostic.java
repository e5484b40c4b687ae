package org.openscad.ast.diagnostics;

import java.util.Objects;

import org.openscad.ast.location.SourceRange;

/**
 * One recoverable problem met during AST generation.
 *
 * @param severity how bad it is
 * @param message  human readable description
 * @param origin   CST type or shape name the problem was found on
 * @param range    where in the source, may be {@code null}
 * @param context  optional extra detail, such as the parameter involved
 */
public record Diagnostic(Severity severity, String message, String origin, SourceRange range, String context) {

    public Diagnostic {
        Objects.requireNonNull(severity, "severity");
        Objects.requireNonNull(message, "message");
    }

    public static Diagnostic of(Severity severity, String message, String origin, SourceRange range) {
        return new Diagnostic(severity, message, origin, range, null);
    }

    public Diagnostic withContext(String context) {
        return new Diagnostic(severity, message, origin, range, context);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder().append(severity).append(' ');
        if (range != null) {
            sb.append(range.start().line() + 1).append(':').append(range.start().column()).append(' ');
        }
        sb.append(message);
        if (context != null) {
            sb.append(" (").append(context).append(')');
        }
        return sb.toString();
    }
}
