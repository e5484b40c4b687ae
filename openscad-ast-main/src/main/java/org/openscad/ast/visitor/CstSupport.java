package org.openscad.ast.visitor;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.openscad.ast.extraction.ArgumentExtractor;
import org.openscad.ast.extraction.RawArgument;
import org.openscad.ast.node.Argument;
import org.openscad.ast.node.Binding;
import org.openscad.ast.node.ExpressionNode;
import org.openscad.ast.node.ForBinding;
import org.openscad.ast.node.Modifier;
import org.openscad.ast.node.ParameterDeclaration;
import org.openscad.ast.node.RangeExpressionNode;
import org.openscad.cst.CstNode;
import org.openscad.cst.CstTypes;

/**
 * Reading helpers over CST shapes shared by several visitors.
 */
final class CstSupport {

    private CstSupport() {
    }

    static boolean isInstantiation(CstNode node) {
        return CstTypes.MODULE_INSTANTIATION.equals(node.type());
    }

    /**
     * Name of the called module as written, or empty when it cannot be found.
     */
    static Optional<String> calleeName(CstNode instantiation) {
        return instantiation.childForFieldName("name")
                .or(() -> instantiation.firstNamedChildOfType(CstTypes.IDENTIFIER))
                .map(n -> n.text().trim())
                .filter(s -> !s.isEmpty());
    }

    static Optional<CstNode> argumentList(CstNode node) {
        return node.childForFieldName("arguments")
                .or(() -> node.firstNamedChildOfType(CstTypes.ARGUMENT_LIST));
    }

    static Optional<CstNode> body(CstNode node) {
        return node.childForFieldName("body");
    }

    /**
     * Whether a body holds at least one statement other than {@code ;} or an empty block.
     */
    static boolean hasStatements(CstNode body) {
        if (CstTypes.STATEMENT.equals(body.type()) || CstTypes.BLOCK.equals(body.type())) {
            for (CstNode child : body.namedChildren()) {
                if (hasStatements(child)) {
                    return true;
                }
            }
            return false;
        }
        return true;
    }

    static List<Modifier> modifiers(CstNode instantiation) {
        List<Modifier> modifiers = new ArrayList<>();
        for (CstNode child : instantiation.namedChildren()) {
            if (CstTypes.MODIFIER.equals(child.type())) {
                modifiers.add(Modifier.fromSymbol(child.text().trim()));
            }
        }
        return modifiers;
    }

    /**
     * Text of the first identifier or special variable child, the bound name of assignments,
     * arguments and parameter declarations.
     */
    static Optional<String> boundName(CstNode node) {
        Optional<CstNode> name = node.childForFieldName("name")
                .or(() -> node.childForFieldName("iterator"));
        if (name.isPresent()) {
            return Optional.of(name.get().text().trim());
        }
        for (CstNode child : node.namedChildren()) {
            if (CstTypes.IDENTIFIER.equals(child.type()) || CstTypes.SPECIAL_VARIABLE.equals(child.type())) {
                return Optional.of(child.text().trim());
            }
        }
        return Optional.empty();
    }

    static String operatorText(CstNode node) {
        Optional<CstNode> operator = node.childForFieldName("operator");
        if (operator.isPresent()) {
            return operator.get().text();
        }
        for (CstNode child : node.children()) {
            if (!child.isNamed()) {
                return child.type();
            }
        }
        return "";
    }

    static List<CstNode> namedChildrenOfType(CstNode node, String type) {
        List<CstNode> result = new ArrayList<>();
        for (CstNode child : node.namedChildren()) {
            if (type.equals(child.type())) {
                result.add(child);
            }
        }
        return result;
    }

    /**
     * Call arguments as expressions, for the calls the AST keeps generic (function calls, echo,
     * user modules).
     */
    static List<Argument> arguments(CstNode argumentList, VisitContext ctx) {
        List<Argument> arguments = new ArrayList<>();
        for (RawArgument raw : ArgumentExtractor.splitArguments(argumentList, ctx.getSink())) {
            arguments.add(new Argument(raw.name(), ctx.lowerExpression(raw.value())));
        }
        return arguments;
    }

    static List<ParameterDeclaration> parameterDeclarations(CstNode parameterList, VisitContext ctx) {
        List<ParameterDeclaration> declarations = new ArrayList<>();
        if (parameterList == null) {
            return declarations;
        }
        for (CstNode declaration : namedChildrenOfType(parameterList, CstTypes.PARAMETER_DECLARATION)) {
            Optional<String> name = boundName(declaration);
            if (name.isEmpty()) {
                ctx.getSink().warn("Parameter declaration without a name", declaration.type(),
                        ctx.location(declaration));
                continue;
            }
            ExpressionNode defaultValue = declaration.childForFieldName("value")
                    .map(ctx::lowerExpression)
                    .orElse(null);
            declarations.add(new ParameterDeclaration(name.get(), defaultValue));
        }
        return declarations;
    }

    static List<Binding> letBindings(CstNode node, VisitContext ctx) {
        List<Binding> bindings = new ArrayList<>();
        for (CstNode assignment : namedChildrenOfType(node, CstTypes.LET_ASSIGNMENT)) {
            Optional<String> name = boundName(assignment);
            Optional<CstNode> value = assignment.childForFieldName("value");
            if (name.isEmpty() || value.isEmpty()) {
                ctx.getSink().warn("Incomplete let binding '" + assignment.text() + "'", assignment.type(),
                        ctx.location(assignment));
                continue;
            }
            bindings.add(new Binding(name.get(), ctx.lowerExpression(value.get())));
        }
        return bindings;
    }

    /**
     * The {@code variable = range} bindings of a for statement or comprehension. The step of a
     * {@code [start : step : end]} range is also exposed on its own.
     */
    static List<ForBinding> forBindings(CstNode node, VisitContext ctx) {
        List<ForBinding> bindings = new ArrayList<>();
        for (CstNode assignment : namedChildrenOfType(node, CstTypes.FOR_ASSIGNMENT)) {
            Optional<String> variable = boundName(assignment);
            Optional<CstNode> range = assignment.childForFieldName("range");
            if (variable.isEmpty() || range.isEmpty()) {
                ctx.getSink().warn("Incomplete for binding '" + assignment.text() + "'", assignment.type(),
                        ctx.location(assignment));
                continue;
            }
            ExpressionNode rangeNode = ctx.lowerExpression(range.get());
            ExpressionNode step = rangeNode instanceof RangeExpressionNode r ? r.step() : null;
            bindings.add(new ForBinding(variable.get(), rangeNode, step));
        }
        return bindings;
    }
}
