package org.openscad.cst.antlr4;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.antlr.v4.runtime.Token;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Records syntax errors instead of printing them; parsing continues with ANTLR's recovery.
 */
public class SyntaxErrorCollector extends BaseErrorListener {

    private static final Logger log = LoggerFactory.getLogger(SyntaxErrorCollector.class);

    private final List<SyntaxProblem> problems = new ArrayList<>();

    @Override
    public void syntaxError(Recognizer<?, ?> recognizer,
                            Object offendingSymbol,
                            int line,
                            int charPositionInLine,
                            String msg,
                            RecognitionException e) {
        String offendingText = offendingSymbol instanceof Token token ? token.getText() : null;
        log.debug("Syntax error at {}:{}: {}", line, charPositionInLine, msg);
        problems.add(new SyntaxProblem(line, charPositionInLine, msg, offendingText));
    }

    public boolean hasProblems() {
        return !problems.isEmpty();
    }

    public int getProblemCount() {
        return problems.size();
    }

    public List<SyntaxProblem> getProblems() {
        return Collections.unmodifiableList(problems);
    }
}
