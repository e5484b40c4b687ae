package org.openscad.ast.visitor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

import org.openscad.ast.GeneratorOptions;
import org.openscad.ast.diagnostics.Diagnostic;
import org.openscad.ast.diagnostics.DiagnosticSink;
import org.openscad.ast.diagnostics.ErrorCode;
import org.openscad.ast.diagnostics.Severity;
import org.openscad.ast.extraction.ArgumentExtractor;
import org.openscad.ast.extraction.Parameter;
import org.openscad.ast.location.Locations;
import org.openscad.ast.location.SourceRange;
import org.openscad.ast.node.AstNode;
import org.openscad.ast.node.ErrorNode;
import org.openscad.ast.node.ExpressionNode;
import org.openscad.cst.CstNode;

/**
 * State of one generation call, handed to every visitor. Not thread-safe; each call gets its own.
 */
public final class VisitContext {

    private final CompositeDispatcher dispatcher;
    private final DiagnosticSink sink;
    private final GeneratorOptions options;
    private final List<ErrorNode> errorNodes = new ArrayList<>();
    private int depth;

    VisitContext(CompositeDispatcher dispatcher, DiagnosticSink sink, GeneratorOptions options) {
        this.dispatcher = dispatcher;
        this.sink = sink;
        this.options = options;
    }

    public DiagnosticSink getSink() {
        return sink;
    }

    public GeneratorOptions getOptions() {
        return options;
    }

    /**
     * Error nodes created so far, in creation order.
     */
    public List<ErrorNode> getErrorNodes() {
        return Collections.unmodifiableList(errorNodes);
    }

    public int getDepth() {
        return depth;
    }

    public SourceRange location(CstNode node) {
        return Locations.of(node, options.isIncludeSourceText());
    }

    /**
     * Name used to match built-in modules, after undoing known truncations when enabled.
     */
    public String canonicalName(String name) {
        return options.isCanonicalizeIdentifiers() ? IdentifierCanonicalizer.canonicalize(name) : name;
    }

    public Optional<AstNode> dispatch(CstNode node) {
        return dispatcher.dispatch(node, this);
    }

    public List<AstNode> lowerBody(CstNode body) {
        return dispatcher.lowerBody(body, this);
    }

    public ExpressionNode lowerExpression(CstNode node) {
        return dispatcher.lowerExpression(node, this);
    }

    public List<Parameter> parameters(CstNode argumentList) {
        return ArgumentExtractor.extractArguments(argumentList, sink);
    }

    public ErrorNode error(ErrorCode code, String message, CstNode node) {
        return error(code, message, node, null);
    }

    /**
     * Creates an error node standing in for {@code node} and reports it.
     */
    public ErrorNode error(ErrorCode code, String message, CstNode node, Throwable cause) {
        SourceRange range = location(node);
        ErrorNode errorNode = new ErrorNode(code.getCode(), message, node.type(), node.text(), cause, range);
        errorNodes.add(errorNode);
        sink.report(new Diagnostic(Severity.ERROR, message, node.type(), range, code.getCode()));
        return errorNode;
    }

    boolean enter() {
        if (depth >= options.getMaxDepth()) {
            return false;
        }
        depth++;
        return true;
    }

    void exit() {
        depth--;
    }
}
