package org.openscad.ast;

import java.util.List;

import org.openscad.ast.diagnostics.Diagnostic;
import org.openscad.ast.diagnostics.Severity;
import org.openscad.ast.node.AstNode;
import org.openscad.ast.node.ErrorNode;

/**
 * Output of one generation: the top-level statements, every diagnostic reported on the way, and
 * the error nodes placed in the tree.
 */
public record GenerationResult(List<AstNode> statements, List<Diagnostic> diagnostics, List<ErrorNode> errorNodes) {

    public GenerationResult {
        statements = List.copyOf(statements);
        diagnostics = List.copyOf(diagnostics);
        errorNodes = List.copyOf(errorNodes);
    }

    /**
     * True when any error node was produced or any diagnostic is an error.
     */
    public boolean hasErrors() {
        return !errorNodes.isEmpty()
                || diagnostics.stream().anyMatch(d -> d.severity().isAtLeast(Severity.ERROR));
    }

    public List<Diagnostic> diagnostics(Severity atLeast) {
        return diagnostics.stream().filter(d -> d.severity().isAtLeast(atLeast)).toList();
    }
}
