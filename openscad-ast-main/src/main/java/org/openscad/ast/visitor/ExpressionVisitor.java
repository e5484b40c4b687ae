package org.openscad.ast.visitor;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.openscad.ast.diagnostics.ErrorCode;
import org.openscad.ast.extraction.ValueExtractor;
import org.openscad.ast.location.SourceRange;
import org.openscad.ast.node.AstNode;
import org.openscad.ast.node.BinaryExpressionNode;
import org.openscad.ast.node.BinaryOperator;
import org.openscad.ast.node.ConditionalExpressionNode;
import org.openscad.ast.node.ExpressionNode;
import org.openscad.ast.node.FunctionCallNode;
import org.openscad.ast.node.FunctionLiteralNode;
import org.openscad.ast.node.IndexExpressionNode;
import org.openscad.ast.node.LetExpressionNode;
import org.openscad.ast.node.ListComprehensionNode;
import org.openscad.ast.node.LiteralNode;
import org.openscad.ast.node.MemberAccessNode;
import org.openscad.ast.node.RangeExpressionNode;
import org.openscad.ast.node.UnaryExpressionNode;
import org.openscad.ast.node.UnaryOperator;
import org.openscad.ast.node.VariableNode;
import org.openscad.ast.node.VectorExpressionNode;
import org.openscad.cst.CstNode;
import org.openscad.cst.CstTypes;

/**
 * Expressions, from literals and variables up to comprehensions and function literals.
 * Grouping layers ({@code (x)}, primary expressions) leave no node of their own.
 */
public class ExpressionVisitor implements CstVisitor {

    @Override
    public VisitorCategory category() {
        return VisitorCategory.EXPRESSION;
    }

    @Override
    public VisitResult visit(CstNode node, VisitContext ctx) {
        AstNode lowered = switch (node.type()) {
            case CstTypes.NUMBER -> number(node, ctx);
            case CstTypes.STRING -> LiteralNode.string(ValueExtractor.unquote(node.text().trim()),
                    ctx.location(node));
            case CstTypes.BOOLEAN -> LiteralNode.bool(Boolean.parseBoolean(node.text().trim()), ctx.location(node));
            case CstTypes.UNDEF -> LiteralNode.undef(ctx.location(node));
            case CstTypes.IDENTIFIER, CstTypes.SPECIAL_VARIABLE -> new VariableNode(node.text().trim(),
                    ctx.location(node));
            case CstTypes.PRIMARY_EXPRESSION, CstTypes.EXPRESSION -> single(node, ctx);
            case CstTypes.PARENTHESIZED_EXPRESSION -> node.childForFieldName("inner")
                    .<AstNode>map(ctx::lowerExpression)
                    .orElseGet(() -> single(node, ctx));
            case CstTypes.BINARY_EXPRESSION -> binary(node, ctx);
            case CstTypes.UNARY_EXPRESSION -> unary(node, ctx);
            case CstTypes.CONDITIONAL_EXPRESSION -> conditional(node, ctx);
            case CstTypes.VECTOR_EXPRESSION -> vector(node, ctx);
            case CstTypes.INDEX_EXPRESSION -> index(node, ctx);
            case CstTypes.MEMBER_EXPRESSION -> member(node, ctx);
            case CstTypes.RANGE_EXPRESSION -> range(node, ctx);
            case CstTypes.LET_EXPRESSION -> new LetExpressionNode(CstSupport.letBindings(node, ctx),
                    required(node, "body", ctx), ctx.location(node));
            case CstTypes.LIST_COMPREHENSION -> comprehension(node, ctx);
            case CstTypes.CALL_EXPRESSION -> call(node, ctx);
            case CstTypes.FUNCTION_LITERAL -> new FunctionLiteralNode(
                    CstSupport.parameterDeclarations(node.childForFieldName("parameters").orElse(null), ctx),
                    required(node, "body", ctx), ctx.location(node));
            default -> null;
        };
        return lowered == null ? VisitResult.notApplicable() : VisitResult.handled(lowered);
    }

    private AstNode number(CstNode node, VisitContext ctx) {
        String text = node.text().trim();
        try {
            return LiteralNode.number(Double.parseDouble(text), ctx.location(node));
        } catch (NumberFormatException e) {
            return ctx.error(ErrorCode.TYPE_ERROR, "Malformed number '" + text + "'", node, e);
        }
    }

    private AstNode single(CstNode node, VisitContext ctx) {
        if (node.namedChildCount() != 1) {
            return ctx.error(ErrorCode.SYNTAX_ERROR, "Expected one operand in '" + node.text() + "'", node);
        }
        return ctx.lowerExpression(node.namedChild(0));
    }

    private ExpressionNode required(CstNode node, String field, VisitContext ctx) {
        Optional<CstNode> child = node.childForFieldName(field);
        if (child.isEmpty()) {
            return ctx.error(ErrorCode.SYNTAX_ERROR, node.type() + " is missing its " + field, node);
        }
        return ctx.lowerExpression(child.get());
    }

    private AstNode binary(CstNode node, VisitContext ctx) {
        if (node.childForFieldName("left").isEmpty() && node.namedChildCount() == 1) {
            return ctx.lowerExpression(node.namedChild(0));
        }
        String operatorText = CstSupport.operatorText(node);
        BinaryOperator operator;
        try {
            operator = Operators.getBinaryOperator(operatorText);
        } catch (IllegalArgumentException e) {
            return ctx.error(ErrorCode.UNSUPPORTED_CONSTRUCT, e.getMessage(), node, e);
        }
        return new BinaryExpressionNode(operator, required(node, "left", ctx), required(node, "right", ctx),
                ctx.location(node));
    }

    private AstNode unary(CstNode node, VisitContext ctx) {
        if (node.childForFieldName("operand").isEmpty() && node.namedChildCount() == 1) {
            return ctx.lowerExpression(node.namedChild(0));
        }
        UnaryOperator operator;
        try {
            operator = Operators.getUnaryOperator(CstSupport.operatorText(node));
        } catch (IllegalArgumentException e) {
            return ctx.error(ErrorCode.UNSUPPORTED_CONSTRUCT, e.getMessage(), node, e);
        }
        return new UnaryExpressionNode(operator, required(node, "operand", ctx), ctx.location(node));
    }

    private AstNode conditional(CstNode node, VisitContext ctx) {
        return new ConditionalExpressionNode(required(node, "condition", ctx), required(node, "consequence", ctx),
                required(node, "alternative", ctx), ctx.location(node));
    }

    private AstNode vector(CstNode node, VisitContext ctx) {
        List<ExpressionNode> elements = new ArrayList<>();
        for (CstNode element : node.namedChildren()) {
            elements.add(ctx.lowerExpression(element));
        }
        return new VectorExpressionNode(elements, ctx.location(node));
    }

    private AstNode index(CstNode node, VisitContext ctx) {
        return new IndexExpressionNode(required(node, "array", ctx), required(node, "index", ctx),
                ctx.location(node));
    }

    private AstNode member(CstNode node, VisitContext ctx) {
        Optional<CstNode> property = node.childForFieldName("property");
        if (property.isEmpty()) {
            return ctx.error(ErrorCode.SYNTAX_ERROR, "Member access without a member name", node);
        }
        return new MemberAccessNode(required(node, "object", ctx), property.get().text().trim(),
                ctx.location(node));
    }

    private AstNode range(CstNode node, VisitContext ctx) {
        Optional<CstNode> begin = node.childForFieldName("begin").or(() -> node.childForFieldName("start"));
        if (begin.isEmpty()) {
            return ctx.error(ErrorCode.SYNTAX_ERROR, "Range without a start", node);
        }
        ExpressionNode step = node.childForFieldName("step").map(ctx::lowerExpression).orElse(null);
        return new RangeExpressionNode(ctx.lowerExpression(begin.get()), step, required(node, "end", ctx),
                ctx.location(node));
    }

    private AstNode comprehension(CstNode node, VisitContext ctx) {
        SourceRange location = ctx.location(node);
        var lets = CstSupport.namedChildrenOfType(node, CstTypes.LIST_COMPREHENSION_LET).stream()
                .flatMap(let -> CstSupport.letBindings(let, ctx).stream())
                .toList();
        var generators = CstSupport.namedChildrenOfType(node, CstTypes.LIST_COMPREHENSION_FOR).stream()
                .flatMap(generator -> CstSupport.forBindings(generator, ctx).stream())
                .toList();
        ExpressionNode condition = node.childForFieldName("condition").map(ctx::lowerExpression).orElse(null);
        return new ListComprehensionNode(lets, generators, condition, required(node, "expr", ctx), location);
    }

    private AstNode call(CstNode node, VisitContext ctx) {
        Optional<CstNode> function = node.childForFieldName("function");
        if (function.isEmpty()) {
            return ctx.error(ErrorCode.SYNTAX_ERROR, "Call without a function name", node);
        }
        var arguments = CstSupport.argumentList(node)
                .map(list -> CstSupport.arguments(list, ctx))
                .orElse(List.of());
        return new FunctionCallNode(function.get().text().trim(), arguments, ctx.location(node));
    }
}
