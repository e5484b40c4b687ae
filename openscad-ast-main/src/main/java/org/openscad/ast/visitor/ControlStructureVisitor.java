package org.openscad.ast.visitor;

import java.util.List;
import java.util.Optional;

import org.openscad.ast.diagnostics.ErrorCode;
import org.openscad.ast.node.AstNode;
import org.openscad.ast.node.Binding;
import org.openscad.ast.node.EachNode;
import org.openscad.ast.node.ExpressionNode;
import org.openscad.ast.node.ForBinding;
import org.openscad.ast.node.ForLoopNode;
import org.openscad.ast.node.IfNode;
import org.openscad.ast.node.LetNode;
import org.openscad.cst.CstNode;
import org.openscad.cst.CstTypes;

/**
 * {@code if}, {@code for} and {@code let} statements, and {@code each} inside vectors.
 * <p>
 * An {@code else if} is not a node of its own: the nested {@code if} is the only element of the
 * outer else branch.
 */
public class ControlStructureVisitor implements CstVisitor {

    @Override
    public VisitorCategory category() {
        return VisitorCategory.CONTROL_STRUCTURE;
    }

    @Override
    public VisitResult visit(CstNode node, VisitContext ctx) {
        return switch (node.type()) {
            case CstTypes.IF_STATEMENT -> VisitResult.handled(lowerIf(node, ctx));
            case CstTypes.FOR_STATEMENT -> VisitResult.handled(lowerFor(node, ctx));
            case CstTypes.LET_STATEMENT -> VisitResult.handled(lowerLet(node, ctx));
            case CstTypes.EACH_EXPRESSION -> VisitResult.handled(lowerEach(node, ctx));
            default -> VisitResult.notApplicable();
        };
    }

    private AstNode lowerIf(CstNode node, VisitContext ctx) {
        Optional<CstNode> condition = node.childForFieldName("condition");
        if (condition.isEmpty()) {
            return ctx.error(ErrorCode.SYNTAX_ERROR, "if without a condition", node);
        }
        ExpressionNode test = ctx.lowerExpression(condition.get());
        List<AstNode> thenBranch = node.childForFieldName("consequence").map(ctx::lowerBody).orElse(List.of());
        List<AstNode> elseBranch = node.childForFieldName("alternative").map(ctx::lowerBody).orElse(null);
        return new IfNode(test, thenBranch, elseBranch, ctx.location(node));
    }

    private AstNode lowerFor(CstNode node, VisitContext ctx) {
        List<ForBinding> bindings = CstSupport.forBindings(node, ctx);
        if (bindings.isEmpty()) {
            return ctx.error(ErrorCode.FOR_NO_ASSIGNMENTS, "for loop without a loop variable", node);
        }
        List<AstNode> body = CstSupport.body(node).map(ctx::lowerBody).orElse(List.of());
        return new ForLoopNode(bindings, body, ctx.location(node));
    }

    private AstNode lowerLet(CstNode node, VisitContext ctx) {
        List<Binding> bindings = CstSupport.letBindings(node, ctx);
        List<AstNode> body = CstSupport.body(node).map(ctx::lowerBody).orElse(List.of());
        return new LetNode(bindings, body, ctx.location(node));
    }

    private AstNode lowerEach(CstNode node, VisitContext ctx) {
        Optional<CstNode> operand = node.childForFieldName("operand");
        if (operand.isEmpty() && node.namedChildCount() == 1) {
            operand = Optional.of(node.namedChild(0));
        }
        if (operand.isEmpty()) {
            return ctx.error(ErrorCode.SYNTAX_ERROR, "each without an operand", node);
        }
        return new EachNode(ctx.lowerExpression(operand.get()), ctx.location(node));
    }
}
