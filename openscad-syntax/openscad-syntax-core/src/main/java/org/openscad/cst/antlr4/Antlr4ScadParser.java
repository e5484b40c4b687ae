package org.openscad.cst.antlr4;

import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.ParserRuleContext;
import org.openscad.SourceParseException;
import org.openscad.cst.CstNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point of the grammar-driven parser: turns OpenSCAD source text into a {@link CstNode} tree.
 */
public final class Antlr4ScadParser {

    private static final Logger log = LoggerFactory.getLogger(Antlr4ScadParser.class);

    private Antlr4ScadParser() {
    }

    /**
     * Parses a whole source file. Syntax errors do not abort parsing; they are returned alongside
     * a tree that contains error nodes where recovery happened.
     */
    public static CstParseResult parse(String source) {
        return parse(source, Antlr4ParseStart.SOURCE_FILE);
    }

    public static CstParseResult parse(String source, Antlr4ParseStart start) {
        SyntaxErrorCollector errors = new SyntaxErrorCollector();

        OpenScadLexer lexer = new OpenScadLexer(CharStreams.fromString(source));
        lexer.removeErrorListeners();
        lexer.addErrorListener(errors);

        OpenScadParser parser = new OpenScadParser(new CommonTokenStream(lexer));
        parser.removeErrorListeners();
        parser.addErrorListener(errors);

        ParserRuleContext tree = start.parse(parser);
        if (errors.hasProblems()) {
            log.debug("Parsed {} characters with {} syntax problem(s)", source.length(), errors.getProblemCount());
        }
        return new CstParseResult(AntlrCstNode.wrap(tree, parser), errors.getProblems());
    }

    /**
     * Parses a whole source file, failing on the first syntax problem.
     *
     * @throws SourceParseException if the source is not well formed
     */
    public static CstNode parseStrict(String source) {
        CstParseResult result = parse(source);
        if (result.hasProblems()) {
            SyntaxProblem first = result.problems().get(0);
            throw new SourceParseException("Parse error at " + first + " in: " + source,
                    source, first.line(), first.column());
        }
        return result.root();
    }
}
