package org.openscad.ast.diagnostics;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Stores every diagnostic it receives, logs it, and optionally forwards it to another sink.
 * Owned by one generation call at a time.
 */
public class CollectingDiagnosticSink implements DiagnosticSink {

    private static final Logger log = LoggerFactory.getLogger(CollectingDiagnosticSink.class);

    private final List<Diagnostic> diagnostics = new ArrayList<>();
    private final DiagnosticSink downstream;

    public CollectingDiagnosticSink() {
        this(null);
    }

    public CollectingDiagnosticSink(DiagnosticSink downstream) {
        this.downstream = downstream;
    }

    @Override
    public void report(Diagnostic diagnostic) {
        diagnostics.add(diagnostic);
        switch (diagnostic.severity()) {
            case DEBUG -> log.debug("{}", diagnostic);
            case INFO -> log.info("{}", diagnostic);
            case WARNING -> log.warn("{}", diagnostic);
            case ERROR, FATAL -> log.error("{}", diagnostic);
        }
        if (downstream != null) {
            downstream.report(diagnostic);
        }
    }

    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    public List<Diagnostic> getDiagnostics(Severity atLeast) {
        List<Diagnostic> result = new ArrayList<>();
        for (Diagnostic diagnostic : diagnostics) {
            if (diagnostic.severity().isAtLeast(atLeast)) {
                result.add(diagnostic);
            }
        }
        return result;
    }

    public boolean hasErrors() {
        return !getDiagnostics(Severity.ERROR).isEmpty();
    }
}
