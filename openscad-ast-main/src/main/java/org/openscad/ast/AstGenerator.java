package org.openscad.ast;

import java.util.List;

import org.openscad.AstGenerationException;
import org.openscad.ast.diagnostics.CollectingDiagnosticSink;
import org.openscad.ast.diagnostics.DiagnosticSink;
import org.openscad.ast.node.AstNode;
import org.openscad.ast.visitor.CompositeDispatcher;
import org.openscad.ast.visitor.VisitContext;
import org.openscad.cst.CstNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Lowers an OpenSCAD CST to AST statements.
 * <p>
 * Generation is best effort: problems are reported as diagnostics and failed nodes are replaced
 * by error nodes, so the result always covers the whole program. The only failure is being given
 * no tree at all.
 * <p>
 * A generator is immutable and can be shared; every call works on its own state.
 */
public class AstGenerator {

    private static final Logger log = LoggerFactory.getLogger(AstGenerator.class);

    private final CompositeDispatcher dispatcher;

    public AstGenerator() {
        this(GeneratorOptions.defaults());
    }

    public AstGenerator(GeneratorOptions options) {
        this(CompositeDispatcher.standard(options));
    }

    public AstGenerator(CompositeDispatcher dispatcher) {
        this.dispatcher = dispatcher;
    }

    public GeneratorOptions getOptions() {
        return dispatcher.getOptions();
    }

    public GenerationResult generate(CstNode root) {
        return generate(root, null);
    }

    /**
     * @param downstream also receives every diagnostic as it is reported; may be {@code null}
     * @throws AstGenerationException if {@code root} is {@code null}
     */
    public GenerationResult generate(CstNode root, DiagnosticSink downstream) {
        if (root == null) {
            throw new AstGenerationException("No syntax tree to generate from", null);
        }
        CollectingDiagnosticSink sink = new CollectingDiagnosticSink(downstream);
        VisitContext ctx = dispatcher.newContext(sink);
        List<AstNode> statements = dispatcher.lowerProgram(root, ctx);
        log.debug("Generated {} statements from {} with {} diagnostics and {} error nodes",
                statements.size(), root.type(), sink.getDiagnostics().size(), ctx.getErrorNodes().size());
        return new GenerationResult(statements, sink.getDiagnostics(), ctx.getErrorNodes());
    }
}
