package org.openscad.ast.visitor;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.openscad.ast.diagnostics.ErrorCode;
import org.openscad.ast.node.Argument;
import org.openscad.ast.node.AssertNode;
import org.openscad.ast.node.AssignmentNode;
import org.openscad.ast.node.AstNode;
import org.openscad.ast.node.ChildrenNode;
import org.openscad.ast.node.EchoNode;
import org.openscad.ast.node.ExpressionNode;
import org.openscad.ast.node.IncludeNode;
import org.openscad.ast.node.ModuleInstantiationNode;
import org.openscad.ast.node.UseNode;
import org.openscad.cst.CstNode;
import org.openscad.cst.CstTypes;

/**
 * Remaining statements: assignments, {@code echo}, {@code assert}, {@code include}, {@code use},
 * and calls of modules that are not built in. Consulted last, so any instantiation that reaches it
 * is a user module or {@code children()}.
 */
public class StatementVisitor implements CstVisitor {

    @Override
    public VisitorCategory category() {
        return VisitorCategory.STATEMENT;
    }

    @Override
    public VisitResult visit(CstNode node, VisitContext ctx) {
        return switch (node.type()) {
            case CstTypes.ASSIGNMENT_STATEMENT -> VisitResult.handled(assignment(node, ctx));
            case CstTypes.MODULE_INSTANTIATION -> VisitResult.handled(instantiation(node, ctx));
            case CstTypes.ECHO_STATEMENT -> VisitResult.handled(new EchoNode(arguments(node, ctx),
                    ctx.location(node)));
            case CstTypes.ASSERT_STATEMENT -> VisitResult.handled(assertion(node, ctx));
            case CstTypes.INCLUDE_STATEMENT -> VisitResult.handled(new IncludeNode(path(node), ctx.location(node)));
            case CstTypes.USE_STATEMENT -> VisitResult.handled(new UseNode(path(node), ctx.location(node)));
            default -> VisitResult.notApplicable();
        };
    }

    private AstNode assignment(CstNode node, VisitContext ctx) {
        Optional<String> variable = CstSupport.boundName(node);
        Optional<CstNode> value = node.childForFieldName("value");
        if (variable.isEmpty() || value.isEmpty()) {
            return ctx.error(ErrorCode.SYNTAX_ERROR, "Incomplete assignment", node);
        }
        return new AssignmentNode(variable.get(), ctx.lowerExpression(value.get()), ctx.location(node));
    }

    private AstNode instantiation(CstNode node, VisitContext ctx) {
        Optional<String> name = CstSupport.calleeName(node);
        if (name.isEmpty()) {
            return ctx.error(ErrorCode.SYNTAX_ERROR, "Module call without a name", node);
        }
        List<Argument> arguments = arguments(node, ctx);
        if ("children".equals(name.get())) {
            List<ExpressionNode> selectors = new ArrayList<>();
            for (Argument argument : arguments) {
                selectors.add(argument.value());
            }
            return new ChildrenNode(selectors, ctx.location(node));
        }
        List<AstNode> children = CstSupport.body(node).map(ctx::lowerBody).orElse(List.of());
        return new ModuleInstantiationNode(name.get(), arguments, children, ctx.location(node));
    }

    private AstNode assertion(CstNode node, VisitContext ctx) {
        Optional<CstNode> condition = node.childForFieldName("condition");
        if (condition.isEmpty()) {
            return ctx.error(ErrorCode.SYNTAX_ERROR, "assert without a condition", node);
        }
        ExpressionNode message = node.childForFieldName("message").map(ctx::lowerExpression).orElse(null);
        return new AssertNode(ctx.lowerExpression(condition.get()), message, ctx.location(node));
    }

    private static List<Argument> arguments(CstNode node, VisitContext ctx) {
        return CstSupport.argumentList(node).map(list -> CstSupport.arguments(list, ctx)).orElse(List.of());
    }

    /**
     * The path between the angle brackets of {@code include <path>} or {@code use <path>}.
     */
    static String path(CstNode node) {
        String text = node.text();
        int open = text.indexOf('<');
        int close = text.lastIndexOf('>');
        if (open < 0 || close <= open) {
            return text.trim();
        }
        return text.substring(open + 1, close).trim();
    }
}
