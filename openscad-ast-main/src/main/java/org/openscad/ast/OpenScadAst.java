package org.openscad.ast;

import java.util.ArrayList;
import java.util.List;

import org.openscad.ast.diagnostics.Diagnostic;
import org.openscad.ast.diagnostics.ErrorCode;
import org.openscad.ast.diagnostics.Severity;
import org.openscad.ast.location.Position;
import org.openscad.ast.location.SourceRange;
import org.openscad.cst.antlr4.Antlr4ScadParser;
import org.openscad.cst.antlr4.CstParseResult;
import org.openscad.cst.antlr4.SyntaxProblem;

/**
 * Entry point from source text: parses with the ANTLR grammar and lowers the resulting CST.
 * Syntax problems found by the parser are prepended to the diagnostics as errors.
 */
public final class OpenScadAst {

    private OpenScadAst() {
    }

    public static GenerationResult parse(String source) {
        return parse(source, GeneratorOptions.defaults());
    }

    public static GenerationResult parse(String source, GeneratorOptions options) {
        CstParseResult parsed = Antlr4ScadParser.parse(source);
        GenerationResult generated = new AstGenerator(options).generate(parsed.root());
        if (!parsed.hasProblems()) {
            return generated;
        }
        List<Diagnostic> diagnostics = new ArrayList<>();
        for (SyntaxProblem problem : parsed.problems()) {
            Position at = new Position(problem.line() - 1, problem.column(), -1);
            diagnostics.add(new Diagnostic(Severity.ERROR, problem.message(), "parser",
                    new SourceRange(at, at, problem.offendingText()), ErrorCode.SYNTAX_ERROR.getCode()));
        }
        diagnostics.addAll(generated.diagnostics());
        return new GenerationResult(generated.statements(), diagnostics, generated.errorNodes());
    }
}
