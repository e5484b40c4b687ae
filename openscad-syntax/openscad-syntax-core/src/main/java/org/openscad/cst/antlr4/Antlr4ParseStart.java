package org.openscad.cst.antlr4;

import org.antlr.v4.runtime.ParserRuleContext;

/**
 * The start production for Antlr.
 * Tells Antlr what piece of OpenSCAD source it can expect.
 */
@FunctionalInterface
public interface Antlr4ParseStart {

    ParserRuleContext parse(OpenScadParser parser);

    Antlr4ParseStart SOURCE_FILE = OpenScadParser::source_file;
    Antlr4ParseStart STATEMENT = OpenScadParser::statement;
    Antlr4ParseStart EXPRESSION = OpenScadParser::expression;
}
