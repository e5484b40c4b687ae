package org.openscad.ast;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

import org.openscad.ast.diagnostics.DiagnosticSink;
import org.openscad.ast.extraction.ArgumentExtractor;
import org.openscad.ast.extraction.Parameter;
import org.openscad.cst.CstNode;
import org.openscad.cst.CstTypes;
import org.openscad.cst.antlr4.Antlr4ParseStart;
import org.openscad.cst.antlr4.Antlr4ScadParser;

/**
 * Builds CSTs from OpenSCAD snippets for tests.
 */
public final class CstFixtures {

    private CstFixtures() {
    }

    public static CstNode program(String source) {
        return Antlr4ScadParser.parseStrict(source);
    }

    public static CstNode expression(String source) {
        return Antlr4ScadParser.parse(source, Antlr4ParseStart.EXPRESSION).root();
    }

    /**
     * First node of {@code type} in depth-first order.
     */
    public static CstNode firstOfType(CstNode root, String type) {
        Deque<CstNode> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            CstNode node = stack.pop();
            if (node.type().equals(type)) {
                return node;
            }
            List<CstNode> children = node.children();
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(children.get(i));
            }
        }
        throw new AssertionError("No " + type + " in " + root.text());
    }

    /**
     * Argument list of a single call such as {@code cube(10, center = true)}.
     */
    public static CstNode argumentList(String call) {
        return firstOfType(program(call + ";"), CstTypes.ARGUMENT_LIST);
    }

    public static List<Parameter> parameters(String call, DiagnosticSink sink) {
        return ArgumentExtractor.extractArguments(argumentList(call), sink);
    }
}
