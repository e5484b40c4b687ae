package org.openscad.cst.antlr4;

import java.util.List;

import org.openscad.cst.CstNode;

/**
 * A parsed tree together with the syntax problems met while building it. The tree is always
 * present; problems show up in it as error nodes.
 */
public record CstParseResult(CstNode root, List<SyntaxProblem> problems) {

    public CstParseResult {
        problems = List.copyOf(problems);
    }

    public boolean hasProblems() {
        return !problems.isEmpty();
    }
}
