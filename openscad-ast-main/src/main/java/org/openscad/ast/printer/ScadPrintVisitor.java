package org.openscad.ast.printer;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.stream.Collectors;

import org.openscad.ast.node.Argument;
import org.openscad.ast.node.AssertNode;
import org.openscad.ast.node.AssignmentNode;
import org.openscad.ast.node.AstNode;
import org.openscad.ast.node.BinaryExpressionNode;
import org.openscad.ast.node.BinaryOperator;
import org.openscad.ast.node.Binding;
import org.openscad.ast.node.ChildrenNode;
import org.openscad.ast.node.CircleNode;
import org.openscad.ast.node.ColorNode;
import org.openscad.ast.node.ConditionalExpressionNode;
import org.openscad.ast.node.CubeNode;
import org.openscad.ast.node.CylinderNode;
import org.openscad.ast.node.DifferenceNode;
import org.openscad.ast.node.Dimensions;
import org.openscad.ast.node.EachNode;
import org.openscad.ast.node.EchoNode;
import org.openscad.ast.node.ErrorNode;
import org.openscad.ast.node.ExpressionNode;
import org.openscad.ast.node.ForBinding;
import org.openscad.ast.node.ForLoopNode;
import org.openscad.ast.node.FunctionCallNode;
import org.openscad.ast.node.FunctionDefinitionNode;
import org.openscad.ast.node.FunctionLiteralNode;
import org.openscad.ast.node.HullNode;
import org.openscad.ast.node.IfNode;
import org.openscad.ast.node.IncludeNode;
import org.openscad.ast.node.IndexExpressionNode;
import org.openscad.ast.node.IntersectionNode;
import org.openscad.ast.node.LetExpressionNode;
import org.openscad.ast.node.LetNode;
import org.openscad.ast.node.LinearExtrudeNode;
import org.openscad.ast.node.ListComprehensionNode;
import org.openscad.ast.node.LiteralNode;
import org.openscad.ast.node.MemberAccessNode;
import org.openscad.ast.node.MinkowskiNode;
import org.openscad.ast.node.MirrorNode;
import org.openscad.ast.node.Modifier;
import org.openscad.ast.node.ModifierNode;
import org.openscad.ast.node.ModuleDefinitionNode;
import org.openscad.ast.node.ModuleInstantiationNode;
import org.openscad.ast.node.MultmatrixNode;
import org.openscad.ast.node.OffsetNode;
import org.openscad.ast.node.ParameterDeclaration;
import org.openscad.ast.node.PolygonNode;
import org.openscad.ast.node.PolyhedronNode;
import org.openscad.ast.node.RangeExpressionNode;
import org.openscad.ast.node.ResizeNode;
import org.openscad.ast.node.RotateExtrudeNode;
import org.openscad.ast.node.RotateNode;
import org.openscad.ast.node.ScaleNode;
import org.openscad.ast.node.SphereNode;
import org.openscad.ast.node.SquareNode;
import org.openscad.ast.node.TextNode;
import org.openscad.ast.node.TranslateNode;
import org.openscad.ast.node.UnaryExpressionNode;
import org.openscad.ast.node.UnionNode;
import org.openscad.ast.node.UseNode;
import org.openscad.ast.node.VariableNode;
import org.openscad.ast.node.VectorExpressionNode;
import org.openscad.ast.node.visitor.AstVisitor;

/**
 * Prints AST nodes as OpenSCAD source. Shapes and transforms are printed with named arguments
 * holding their resolved values, so the output shows what generation made of the call rather than
 * how it was written. Error nodes print as comments.
 */
public class ScadPrintVisitor implements AstVisitor<Void, Void> {

    protected final SourcePrinter printer = new SourcePrinter();

    public String getSource() {
        return printer.getSource();
    }

    /**
     * Prints {@code node} as a statement of its own.
     */
    public void printStatement(AstNode node) {
        node.accept(this, null);
        if (node instanceof ExpressionNode) {
            printer.println();
        }
    }

    // ── primitives ──────────────────────────────────────────────────────

    @Override
    public Void visit(CubeNode n, Void arg) {
        return leaf("cube", "size = " + dimensions(n.size()), flag("center", n.center()));
    }

    @Override
    public Void visit(SphereNode n, Void arg) {
        return leaf("sphere", "r = " + number(n.radius()), optional("$fn", n.fn()), optional("$fa", n.fa()),
                optional("$fs", n.fs()));
    }

    @Override
    public Void visit(CylinderNode n, Void arg) {
        return leaf("cylinder", "h = " + number(n.h()), optional("r", n.r()), optional("r1", n.r1()),
                optional("r2", n.r2()), optional("d", n.d()), optional("d1", n.d1()), optional("d2", n.d2()),
                flag("center", n.center()), optional("$fn", n.fn()), optional("$fa", n.fa()),
                optional("$fs", n.fs()));
    }

    @Override
    public Void visit(PolyhedronNode n, Void arg) {
        return leaf("polyhedron", "points = " + matrix(n.points()), "faces = " + indexLists(n.faces()),
                optional("convexity", n.convexity()));
    }

    @Override
    public Void visit(PolygonNode n, Void arg) {
        return leaf("polygon", "points = " + matrix(n.points()),
                n.paths().isEmpty() ? null : "paths = " + indexLists(n.paths()),
                optional("convexity", n.convexity()));
    }

    @Override
    public Void visit(CircleNode n, Void arg) {
        return leaf("circle", "r = " + number(n.radius()), optional("$fn", n.fn()), optional("$fa", n.fa()),
                optional("$fs", n.fs()));
    }

    @Override
    public Void visit(SquareNode n, Void arg) {
        return leaf("square", "size = " + dimensions(n.size()), flag("center", n.center()));
    }

    @Override
    public Void visit(TextNode n, Void arg) {
        return leaf("text", "text = " + quote(n.text()), "size = " + number(n.size()),
                n.font() == null ? null : "font = " + quote(n.font()),
                "halign = " + quote(n.halign()), "valign = " + quote(n.valign()),
                "spacing = " + number(n.spacing()), "direction = " + quote(n.direction()),
                "language = " + quote(n.language()), "script = " + quote(n.script()), optional("$fn", n.fn()));
    }

    // ── transforms ──────────────────────────────────────────────────────

    @Override
    public Void visit(TranslateNode n, Void arg) {
        return parent("translate", n.children(), "v = " + vector(n.v()));
    }

    @Override
    public Void visit(RotateNode n, Void arg) {
        if (n.isAxisAngle()) {
            return parent("rotate", n.children(), "a = " + number(n.angle()), "v = " + vector(n.axis()));
        }
        return parent("rotate", n.children(), "a = " + vector(n.angles()));
    }

    @Override
    public Void visit(ScaleNode n, Void arg) {
        return parent("scale", n.children(), "v = " + vector(n.v()));
    }

    @Override
    public Void visit(MirrorNode n, Void arg) {
        return parent("mirror", n.children(), "v = " + vector(n.v()));
    }

    @Override
    public Void visit(MultmatrixNode n, Void arg) {
        return parent("multmatrix", n.children(), "m = " + matrix(n.matrix()));
    }

    @Override
    public Void visit(ColorNode n, Void arg) {
        if (n.colorName() != null) {
            return parent("color", n.children(), "c = " + quote(n.colorName()), optional("alpha", n.alpha()));
        }
        return parent("color", n.children(), "c = " + vector(n.rgba()));
    }

    @Override
    public Void visit(OffsetNode n, Void arg) {
        return parent("offset", n.children(), "r = " + number(n.r()), "delta = " + number(n.delta()),
                "chamfer = " + n.chamfer());
    }

    @Override
    public Void visit(ResizeNode n, Void arg) {
        return parent("resize", n.children(), "newsize = " + vector(n.newsize()), "auto = " + n.auto());
    }

    @Override
    public Void visit(LinearExtrudeNode n, Void arg) {
        return parent("linear_extrude", n.children(), "height = " + number(n.height()), flag("center", n.center()),
                optional("convexity", n.convexity()), "twist = " + number(n.twist()),
                optional("slices", n.slices()), "scale = " + vector(n.scale()), optional("$fn", n.fn()));
    }

    @Override
    public Void visit(RotateExtrudeNode n, Void arg) {
        return parent("rotate_extrude", n.children(), "angle = " + number(n.angle()),
                optional("convexity", n.convexity()), optional("$fn", n.fn()));
    }

    // ── boolean operations ──────────────────────────────────────────────

    @Override
    public Void visit(UnionNode n, Void arg) {
        return parent("union", n.children());
    }

    @Override
    public Void visit(DifferenceNode n, Void arg) {
        return parent("difference", n.children());
    }

    @Override
    public Void visit(IntersectionNode n, Void arg) {
        return parent("intersection", n.children());
    }

    @Override
    public Void visit(HullNode n, Void arg) {
        return parent("hull", n.children());
    }

    @Override
    public Void visit(MinkowskiNode n, Void arg) {
        return parent("minkowski", n.children());
    }

    // ── control structures ──────────────────────────────────────────────

    @Override
    public Void visit(IfNode n, Void arg) {
        printer.print("if (");
        n.condition().accept(this, arg);
        printer.print(")");
        block(n.thenBranch());
        if (n.hasElse()) {
            printer.print("else");
            if (n.elseBranch().size() == 1 && n.elseBranch().get(0) instanceof IfNode elseIf) {
                printer.print(" ");
                return visit(elseIf, arg);
            }
            block(n.elseBranch());
        }
        return null;
    }

    @Override
    public Void visit(ForLoopNode n, Void arg) {
        printer.print("for (");
        forBindings(n.variables());
        printer.print(")");
        block(n.body());
        return null;
    }

    @Override
    public Void visit(LetNode n, Void arg) {
        printer.print("let (");
        bindings(n.assignments());
        printer.print(")");
        block(n.body());
        return null;
    }

    @Override
    public Void visit(EachNode n, Void arg) {
        printer.print("each ");
        n.expression().accept(this, arg);
        return null;
    }

    // ── definitions and statements ──────────────────────────────────────

    @Override
    public Void visit(ModuleDefinitionNode n, Void arg) {
        printer.print("module " + n.name() + "(");
        parameters(n.parameters());
        printer.print(")");
        block(n.body());
        return null;
    }

    @Override
    public Void visit(FunctionDefinitionNode n, Void arg) {
        printer.print("function " + n.name() + "(");
        parameters(n.parameters());
        printer.print(") = ");
        n.expression().accept(this, arg);
        printer.println(";");
        return null;
    }

    @Override
    public Void visit(AssignmentNode n, Void arg) {
        printer.print(n.variable() + " = ");
        n.value().accept(this, arg);
        printer.println(";");
        return null;
    }

    @Override
    public Void visit(ModuleInstantiationNode n, Void arg) {
        printer.print(n.name() + "(");
        arguments(n.arguments());
        printer.print(")");
        children(n.children());
        return null;
    }

    @Override
    public Void visit(ChildrenNode n, Void arg) {
        printer.print("children(");
        expressions(n.selectors());
        printer.println(");");
        return null;
    }

    @Override
    public Void visit(EchoNode n, Void arg) {
        printer.print("echo(");
        arguments(n.arguments());
        printer.println(");");
        return null;
    }

    @Override
    public Void visit(AssertNode n, Void arg) {
        printer.print("assert(");
        n.condition().accept(this, arg);
        if (n.message() != null) {
            printer.print(", ");
            n.message().accept(this, arg);
        }
        printer.println(");");
        return null;
    }

    @Override
    public Void visit(IncludeNode n, Void arg) {
        printer.println("include <" + n.path() + ">");
        return null;
    }

    @Override
    public Void visit(UseNode n, Void arg) {
        printer.println("use <" + n.path() + ">");
        return null;
    }

    @Override
    public Void visit(ModifierNode n, Void arg) {
        for (Modifier modifier : n.modifiers()) {
            printer.print(modifier.getSymbol());
        }
        n.child().accept(this, arg);
        return null;
    }

    // ── expressions ─────────────────────────────────────────────────────

    @Override
    public Void visit(LiteralNode n, Void arg) {
        switch (n.literalType()) {
            case NUMBER -> printer.print(number((Double) n.value()));
            case STRING -> printer.print(quote((String) n.value()));
            case BOOLEAN -> printer.print(String.valueOf(n.value()));
            case UNDEF -> printer.print("undef");
        }
        return null;
    }

    @Override
    public Void visit(VariableNode n, Void arg) {
        printer.print(n.name());
        return null;
    }

    @Override
    public Void visit(BinaryExpressionNode n, Void arg) {
        int precedence = precedence(n.operator());
        operand(n.left(), precedence, n.operator() == BinaryOperator.POWER);
        printer.print(" " + n.operator().getSymbol() + " ");
        operand(n.right(), precedence, n.operator() != BinaryOperator.POWER);
        return null;
    }

    @Override
    public Void visit(UnaryExpressionNode n, Void arg) {
        printer.print(n.operator().getSymbol());
        boolean group = n.operand() instanceof BinaryExpressionNode || n.operand() instanceof ConditionalExpressionNode;
        if (group) {
            printer.print("(");
        }
        n.operand().accept(this, arg);
        if (group) {
            printer.print(")");
        }
        return null;
    }

    @Override
    public Void visit(ConditionalExpressionNode n, Void arg) {
        n.condition().accept(this, arg);
        printer.print(" ? ");
        n.thenBranch().accept(this, arg);
        printer.print(" : ");
        n.elseBranch().accept(this, arg);
        return null;
    }

    @Override
    public Void visit(VectorExpressionNode n, Void arg) {
        printer.print("[");
        expressions(n.elements());
        printer.print("]");
        return null;
    }

    @Override
    public Void visit(IndexExpressionNode n, Void arg) {
        n.array().accept(this, arg);
        printer.print("[");
        n.index().accept(this, arg);
        printer.print("]");
        return null;
    }

    @Override
    public Void visit(MemberAccessNode n, Void arg) {
        n.object().accept(this, arg);
        printer.print("." + n.member());
        return null;
    }

    @Override
    public Void visit(RangeExpressionNode n, Void arg) {
        printer.print("[");
        n.start().accept(this, arg);
        if (n.step() != null) {
            printer.print(" : ");
            n.step().accept(this, arg);
        }
        printer.print(" : ");
        n.end().accept(this, arg);
        printer.print("]");
        return null;
    }

    @Override
    public Void visit(LetExpressionNode n, Void arg) {
        printer.print("let (");
        bindings(n.assignments());
        printer.print(") ");
        n.body().accept(this, arg);
        return null;
    }

    @Override
    public Void visit(ListComprehensionNode n, Void arg) {
        printer.print("[");
        if (!n.lets().isEmpty()) {
            printer.print("let (");
            bindings(n.lets());
            printer.print(") ");
        }
        printer.print("for (");
        forBindings(n.generators());
        printer.print(") ");
        if (n.condition() != null) {
            printer.print("if (");
            n.condition().accept(this, arg);
            printer.print(") ");
        }
        n.element().accept(this, arg);
        printer.print("]");
        return null;
    }

    @Override
    public Void visit(FunctionCallNode n, Void arg) {
        printer.print(n.functionName() + "(");
        arguments(n.arguments());
        printer.print(")");
        return null;
    }

    @Override
    public Void visit(FunctionLiteralNode n, Void arg) {
        printer.print("function (");
        parameters(n.parameters());
        printer.print(") ");
        n.body().accept(this, arg);
        return null;
    }

    @Override
    public Void visit(ErrorNode n, Void arg) {
        printer.print("/* " + n.errorCode() + ": " + n.message().replace("*/", "* /") + " */");
        return null;
    }

    // ── helpers ─────────────────────────────────────────────────────────

    private Void leaf(String name, String... arguments) {
        printer.print(call(name, arguments));
        printer.println(";");
        return null;
    }

    private Void parent(String name, List<AstNode> children, String... arguments) {
        printer.print(call(name, arguments));
        children(children);
        return null;
    }

    private static String call(String name, String... arguments) {
        List<String> present = new ArrayList<>();
        for (String argument : arguments) {
            if (argument != null) {
                present.add(argument);
            }
        }
        return name + "(" + String.join(", ", present) + ")";
    }

    private void children(List<AstNode> children) {
        if (children.isEmpty()) {
            printer.println(";");
            return;
        }
        block(children);
    }

    private void block(List<AstNode> statements) {
        printer.println(" {");
        printer.indent();
        for (AstNode statement : statements) {
            printStatement(statement);
        }
        printer.unindent();
        printer.println("}");
    }

    private void operand(ExpressionNode operand, int parentPrecedence, boolean groupEqual) {
        boolean group = operand instanceof ConditionalExpressionNode
                || operand instanceof BinaryExpressionNode binary
                && (precedence(binary.operator()) < parentPrecedence
                || groupEqual && precedence(binary.operator()) == parentPrecedence);
        if (group) {
            printer.print("(");
        }
        operand.accept(this, null);
        if (group) {
            printer.print(")");
        }
    }

    private static int precedence(BinaryOperator operator) {
        return switch (operator) {
            case OR -> 1;
            case AND -> 2;
            case EQUALS, NOT_EQUALS -> 3;
            case LESS, LESS_EQUALS, GREATER, GREATER_EQUALS -> 4;
            case PLUS, MINUS -> 5;
            case MULTIPLY, DIVIDE, MODULO -> 6;
            case POWER -> 7;
        };
    }

    private void expressions(List<ExpressionNode> expressions) {
        for (Iterator<ExpressionNode> i = expressions.iterator(); i.hasNext(); ) {
            i.next().accept(this, null);
            if (i.hasNext()) {
                printer.print(", ");
            }
        }
    }

    private void arguments(List<Argument> arguments) {
        for (Iterator<Argument> i = arguments.iterator(); i.hasNext(); ) {
            Argument argument = i.next();
            if (argument.name() != null) {
                printer.print(argument.name() + " = ");
            }
            argument.value().accept(this, null);
            if (i.hasNext()) {
                printer.print(", ");
            }
        }
    }

    private void parameters(List<ParameterDeclaration> parameters) {
        for (Iterator<ParameterDeclaration> i = parameters.iterator(); i.hasNext(); ) {
            ParameterDeclaration parameter = i.next();
            printer.print(parameter.name());
            if (parameter.defaultValue() != null) {
                printer.print(" = ");
                parameter.defaultValue().accept(this, null);
            }
            if (i.hasNext()) {
                printer.print(", ");
            }
        }
    }

    private void bindings(List<Binding> bindings) {
        for (Iterator<Binding> i = bindings.iterator(); i.hasNext(); ) {
            Binding binding = i.next();
            printer.print(binding.name() + " = ");
            binding.value().accept(this, null);
            if (i.hasNext()) {
                printer.print(", ");
            }
        }
    }

    private void forBindings(List<ForBinding> bindings) {
        for (Iterator<ForBinding> i = bindings.iterator(); i.hasNext(); ) {
            ForBinding binding = i.next();
            printer.print(binding.variable() + " = ");
            binding.range().accept(this, null);
            if (i.hasNext()) {
                printer.print(", ");
            }
        }
    }

    private static String flag(String name, boolean value) {
        return value ? name + " = true" : null;
    }

    private static String optional(String name, Number value) {
        if (value == null) {
            return null;
        }
        return name + " = " + (value instanceof Double d ? number(d) : value.toString());
    }

    private static String dimensions(Dimensions size) {
        return size.isScalar() ? number(size.scalar()) : vector(size.vector());
    }

    static String number(double value) {
        if (value == Math.rint(value) && !Double.isInfinite(value) && Math.abs(value) < 1e15) {
            return Long.toString((long) value);
        }
        return Double.toString(value);
    }

    private static String vector(List<Double> values) {
        return values.stream().map(ScadPrintVisitor::number).collect(Collectors.joining(", ", "[", "]"));
    }

    private static String matrix(List<List<Double>> rows) {
        return rows.stream().map(ScadPrintVisitor::vector).collect(Collectors.joining(", ", "[", "]"));
    }

    private static String indexLists(List<List<Integer>> lists) {
        return lists.stream()
                .map(l -> l.stream().map(String::valueOf).collect(Collectors.joining(", ", "[", "]")))
                .collect(Collectors.joining(", ", "[", "]"));
    }

    private static String quote(String text) {
        return '"' + text.replace("\\", "\\\\").replace("\"", "\\\"") + '"';
    }
}
