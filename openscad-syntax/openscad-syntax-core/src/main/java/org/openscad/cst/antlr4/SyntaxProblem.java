package org.openscad.cst.antlr4;

/**
 * One syntax error reported by the lexer or parser. Line is one based, column zero based.
 */
public record SyntaxProblem(int line, int column, String message, String offendingText) {

    @Override
    public String toString() {
        return line + ":" + column + " " + message;
    }
}
