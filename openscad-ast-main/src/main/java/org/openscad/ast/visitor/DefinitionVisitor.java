package org.openscad.ast.visitor;

import java.util.List;
import java.util.Optional;

import org.openscad.ast.diagnostics.ErrorCode;
import org.openscad.ast.node.AstNode;
import org.openscad.ast.node.FunctionDefinitionNode;
import org.openscad.ast.node.ModuleDefinitionNode;
import org.openscad.ast.node.ParameterDeclaration;
import org.openscad.cst.CstNode;
import org.openscad.cst.CstTypes;

/**
 * Module and function definitions.
 */
public class DefinitionVisitor implements CstVisitor {

    @Override
    public VisitorCategory category() {
        return VisitorCategory.DEFINITION;
    }

    @Override
    public VisitResult visit(CstNode node, VisitContext ctx) {
        return switch (node.type()) {
            case CstTypes.MODULE_DEFINITION -> VisitResult.handled(lowerModule(node, ctx));
            case CstTypes.FUNCTION_DEFINITION -> VisitResult.handled(lowerFunction(node, ctx));
            default -> VisitResult.notApplicable();
        };
    }

    private AstNode lowerModule(CstNode node, VisitContext ctx) {
        Optional<String> name = CstSupport.boundName(node);
        if (name.isEmpty()) {
            return ctx.error(ErrorCode.SYNTAX_ERROR, "module definition without a name", node);
        }
        List<ParameterDeclaration> parameters = CstSupport.parameterDeclarations(
                node.childForFieldName("parameters").orElse(null), ctx);
        List<AstNode> body = CstSupport.body(node).map(ctx::lowerBody).orElse(List.of());
        return new ModuleDefinitionNode(name.get(), parameters, body, ctx.location(node));
    }

    private AstNode lowerFunction(CstNode node, VisitContext ctx) {
        Optional<String> name = CstSupport.boundName(node);
        Optional<CstNode> value = node.childForFieldName("value");
        if (name.isEmpty() || value.isEmpty()) {
            return ctx.error(ErrorCode.SYNTAX_ERROR, "function definition without a name or a body", node);
        }
        List<ParameterDeclaration> parameters = CstSupport.parameterDeclarations(
                node.childForFieldName("parameters").orElse(null), ctx);
        return new FunctionDefinitionNode(name.get(), parameters, ctx.lowerExpression(value.get()),
                ctx.location(node));
    }
}
