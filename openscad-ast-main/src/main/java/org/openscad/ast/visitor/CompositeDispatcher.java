package org.openscad.ast.visitor;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import org.openscad.ast.GeneratorOptions;
import org.openscad.ast.diagnostics.DiagnosticSink;
import org.openscad.ast.diagnostics.ErrorCode;
import org.openscad.ast.node.AstNode;
import org.openscad.ast.node.ErrorNode;
import org.openscad.ast.node.ExpressionNode;
import org.openscad.ast.node.Modifier;
import org.openscad.ast.node.ModifierNode;
import org.openscad.cst.CstNode;
import org.openscad.cst.CstTypes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Lowers CST nodes by offering them to an ordered list of {@link CstVisitor}s; the first visitor
 * that handles a node wins. Nodes nobody handles are descended into when they merely wrap a
 * single child, and reported otherwise.
 * <p>
 * Any exception escaping a visitor is turned into an {@link ErrorNode} for the node being lowered,
 * so one bad statement never stops the rest of the program from being lowered.
 * <p>
 * A dispatcher holds no per-call state and may be shared between threads.
 */
public final class CompositeDispatcher {

    private static final Logger log = LoggerFactory.getLogger(CompositeDispatcher.class);

    // containers whose statements are spliced into the enclosing list
    private static final Set<String> STATEMENT_CONTAINERS = Set.of(CstTypes.SOURCE_FILE, CstTypes.BLOCK);

    private final List<CstVisitor> visitors;
    private final GeneratorOptions options;

    public CompositeDispatcher(List<CstVisitor> visitors, GeneratorOptions options) {
        List<CstVisitor> ordered = new ArrayList<>(visitors);
        ordered.sort(Comparator.comparing(CstVisitor::category));
        this.visitors = List.copyOf(ordered);
        this.options = options;
    }

    /**
     * The built-in visitors in their standard order.
     */
    public static CompositeDispatcher standard(GeneratorOptions options) {
        return new CompositeDispatcher(List.of(
                new PrimitiveVisitor(),
                new TransformVisitor(),
                new CsgVisitor(),
                new ControlStructureVisitor(),
                new ExpressionVisitor(),
                new DefinitionVisitor(),
                new StatementVisitor()), options);
    }

    public List<CstVisitor> getVisitors() {
        return visitors;
    }

    public GeneratorOptions getOptions() {
        return options;
    }

    public VisitContext newContext(DiagnosticSink sink) {
        return new VisitContext(this, sink, options);
    }

    /**
     * Lowers every top-level statement under {@code root}.
     */
    public List<AstNode> lowerProgram(CstNode root, VisitContext ctx) {
        return lowerBody(root, ctx);
    }

    /**
     * Lowers one node. Empty when the node produces nothing, such as an empty statement or a node
     * no visitor recognizes.
     */
    public Optional<AstNode> dispatch(CstNode node, VisitContext ctx) {
        if (!ctx.enter()) {
            return Optional.of(ctx.error(ErrorCode.RECURSION_LIMIT,
                    "Nesting deeper than " + options.getMaxDepth() + " levels", node));
        }
        try {
            return dispatchUnguarded(node, ctx);
        } catch (RuntimeException e) {
            log.debug("Lowering of {} failed", node.type(), e);
            return Optional.of(ctx.error(ErrorCode.INTERNAL_ERROR,
                    "Failed to lower " + node.type() + ": " + e.getMessage(), node, e));
        } finally {
            ctx.exit();
        }
    }

    private Optional<AstNode> dispatchUnguarded(CstNode node, VisitContext ctx) {
        if (node.isError()) {
            return Optional.of(ctx.error(ErrorCode.SYNTAX_ERROR, "Syntax error at '" + node.text() + "'", node));
        }
        if (node.isMissing()) {
            return Optional.of(ctx.error(ErrorCode.SYNTAX_ERROR, "Missing " + node.type(), node));
        }
        for (CstVisitor visitor : visitors) {
            VisitResult result = visitor.visit(node, ctx);
            if (result.isHandled()) {
                return Optional.of(withModifiers(node, result.node(), ctx));
            }
        }
        if (node.namedChildCount() == 1) {
            return dispatch(node.namedChild(0), ctx);
        }
        if (!node.isNamed() || CstTypes.STATEMENT.equals(node.type())) {
            // punctuation or an empty statement
            return Optional.empty();
        }
        if (options.isReportUnrecognized()) {
            ctx.getSink().warn("Unrecognized " + node.type() + " '" + node.text() + "'", node.type(),
                    ctx.location(node));
        }
        return Optional.empty();
    }

    private AstNode withModifiers(CstNode node, AstNode lowered, VisitContext ctx) {
        if (!CstSupport.isInstantiation(node) || lowered instanceof ErrorNode) {
            return lowered;
        }
        List<Modifier> modifiers = CstSupport.modifiers(node);
        if (modifiers.isEmpty()) {
            return lowered;
        }
        return new ModifierNode(modifiers, lowered, ctx.location(node));
    }

    /**
     * Lowers the body of a module, transform or control structure. A block contributes each of
     * its statements, a single statement contributes itself and an empty statement nothing.
     */
    public List<AstNode> lowerBody(CstNode body, VisitContext ctx) {
        List<AstNode> lowered = new ArrayList<>();
        if (body != null) {
            lowerInto(body, lowered, ctx);
        }
        return lowered;
    }

    private void lowerInto(CstNode node, List<AstNode> out, VisitContext ctx) {
        if (STATEMENT_CONTAINERS.contains(node.type())) {
            if (!ctx.enter()) {
                out.add(ctx.error(ErrorCode.RECURSION_LIMIT,
                        "Nesting deeper than " + options.getMaxDepth() + " levels", node));
                return;
            }
            try {
                for (CstNode child : node.namedChildren()) {
                    lowerInto(child, out, ctx);
                }
            } finally {
                ctx.exit();
            }
            return;
        }
        if (CstTypes.STATEMENT.equals(node.type()) && !node.isError()) {
            if (node.namedChildCount() == 1) {
                lowerInto(node.namedChild(0), out, ctx);
            }
            return;
        }
        dispatch(node, ctx).ifPresent(out::add);
    }

    /**
     * Lowers a node that must be an expression. Anything else becomes an error node in its place.
     */
    public ExpressionNode lowerExpression(CstNode node, VisitContext ctx) {
        Optional<AstNode> lowered = dispatch(node, ctx);
        if (lowered.isPresent() && lowered.get() instanceof ExpressionNode expression) {
            return expression;
        }
        String found = lowered.map(n -> n.type().getTag()).orElse("nothing");
        return ctx.error(ErrorCode.UNSUPPORTED_CONSTRUCT,
                "Expected an expression but " + node.type() + " lowered to " + found, node);
    }
}
