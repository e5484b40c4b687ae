package org.openscad.ast.printer;

import java.util.List;

import org.openscad.ast.node.AstNode;

/**
 * Prints AST nodes back as OpenSCAD source.
 */
public final class AstPrinter {

    private AstPrinter() {
    }

    public static String print(List<? extends AstNode> statements) {
        ScadPrintVisitor visitor = new ScadPrintVisitor();
        for (AstNode statement : statements) {
            visitor.printStatement(statement);
        }
        return visitor.getSource();
    }

    public static String print(AstNode node) {
        return print(List.of(node));
    }
}
