package org.openscad.ast.visitor;

import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.Test;
import org.openscad.ast.AstGenerator;
import org.openscad.ast.GenerationResult;
import org.openscad.ast.GeneratorOptions;
import org.openscad.ast.diagnostics.CollectingDiagnosticSink;
import org.openscad.ast.diagnostics.Severity;
import org.openscad.ast.node.AstNode;
import org.openscad.ast.node.CubeNode;
import org.openscad.ast.node.ErrorNode;
import org.openscad.ast.node.LiteralNode;
import org.openscad.ast.node.Modifier;
import org.openscad.ast.node.ModifierNode;
import org.openscad.ast.node.ModuleInstantiationNode;
import org.openscad.ast.node.SphereNode;
import org.openscad.ast.node.TranslateNode;
import org.openscad.cst.CstNode;
import org.openscad.cst.CstTypes;
import org.openscad.cst.SimpleCstNode;

import static org.assertj.core.api.Assertions.assertThat;
import static org.openscad.ast.CstFixtures.program;

class CompositeDispatcherTest {

    private final CollectingDiagnosticSink sink = new CollectingDiagnosticSink();

    private Optional<AstNode> dispatch(CompositeDispatcher dispatcher, CstNode node) {
        return dispatcher.dispatch(node, dispatcher.newContext(sink));
    }

    private static CstNode instantiation(String name, CstNode argument) {
        return SimpleCstNode.named(CstTypes.MODULE_INSTANTIATION)
                .field("name", SimpleCstNode.leaf(CstTypes.IDENTIFIER, name))
                .field("arguments", SimpleCstNode.named(CstTypes.ARGUMENT_LIST)
                        .token("(")
                        .child(SimpleCstNode.named(CstTypes.ARGUMENT).field("value", argument).build())
                        .token(")")
                        .build())
                .token(";")
                .build();
    }

    // ── ordering ──

    @Test
    void visitors_areOrderedByCategory() {
        CompositeDispatcher dispatcher = new CompositeDispatcher(
                List.of(new StatementVisitor(), new ExpressionVisitor(), new PrimitiveVisitor(), new CsgVisitor()),
                GeneratorOptions.defaults());

        assertThat(dispatcher.getVisitors()).extracting(CstVisitor::category).containsExactly(
                VisitorCategory.PRIMITIVE, VisitorCategory.BOOLEAN_OPERATION, VisitorCategory.EXPRESSION,
                VisitorCategory.STATEMENT);
    }

    @Test
    void builtInPrimitive_winsOverGenericInstantiation() {
        List<AstNode> statements = new AstGenerator().generate(program("cube(2);")).statements();

        assertThat(statements).singleElement().isInstanceOf(CubeNode.class);
    }

    // ── failure containment ──

    @Test
    void throwingVisitor_becomesInternalErrorNode() {
        CstVisitor exploding = new CstVisitor() {
            @Override
            public VisitorCategory category() {
                return VisitorCategory.PRIMITIVE;
            }

            @Override
            public VisitResult visit(CstNode node, VisitContext ctx) {
                if (CstTypes.NUMBER.equals(node.type())) {
                    throw new IllegalStateException("boom");
                }
                return VisitResult.notApplicable();
            }
        };
        CompositeDispatcher dispatcher = new CompositeDispatcher(List.of(exploding, new ExpressionVisitor()),
                GeneratorOptions.defaults());

        AstNode lowered = dispatch(dispatcher, SimpleCstNode.leaf(CstTypes.NUMBER, "1")).orElseThrow();

        assertThat(lowered).isInstanceOf(ErrorNode.class);
        ErrorNode error = (ErrorNode) lowered;
        assertThat(error.errorCode()).isEqualTo("E900");
        assertThat(error.message()).contains("boom");
        assertThat(error.cause()).isInstanceOf(IllegalStateException.class);
        assertThat(sink.hasErrors()).isTrue();
    }

    @Test
    void internalErrorNodes_fromRepeatedRuns_areEqual() {
        CstVisitor exploding = new CstVisitor() {
            @Override
            public VisitorCategory category() {
                return VisitorCategory.PRIMITIVE;
            }

            @Override
            public VisitResult visit(CstNode node, VisitContext ctx) {
                throw new IllegalStateException("boom");
            }
        };
        CompositeDispatcher dispatcher = new CompositeDispatcher(List.of(exploding), GeneratorOptions.defaults());
        CstNode number = SimpleCstNode.leaf(CstTypes.NUMBER, "1");

        AstNode first = dispatch(dispatcher, number).orElseThrow();
        AstNode second = dispatch(dispatcher, number).orElseThrow();

        assertThat(((ErrorNode) first).cause()).isNotSameAs(((ErrorNode) second).cause());
        assertThat(first).isEqualTo(second).hasSameHashCodeAs(second);
    }

    @Test
    void failureInOneStatement_leavesTheOthersIntact() {
        GenerationResult result = new AstGenerator().generate(program("cube(1); cylinder(r = 2); sphere(3);"));

        assertThat(result.statements()).hasSize(3);
        assertThat(result.statements().get(0)).isInstanceOf(CubeNode.class);
        assertThat(result.statements().get(1)).isInstanceOf(ErrorNode.class);
        assertThat(result.statements().get(2)).isInstanceOf(SphereNode.class);
    }

    @Test
    void nestingPastMaxDepth_becomesRecursionLimitError() {
        AstGenerator generator = new AstGenerator(GeneratorOptions.builder().maxDepth(5).build());

        GenerationResult result = generator.generate(
                program("union() { union() { union() { union() { cube(1); } } } }"));

        assertThat(result.statements()).hasSize(1);
        assertThat(result.errorNodes()).extracting(ErrorNode::errorCode).contains("E303_RECURSION_LIMIT");
    }

    // ── syntax errors and unknown nodes ──

    @Test
    void errorNode_becomesSyntaxError() {
        CompositeDispatcher dispatcher = CompositeDispatcher.standard(GeneratorOptions.defaults());

        AstNode lowered = dispatch(dispatcher, SimpleCstNode.error().text("@@").build()).orElseThrow();

        assertThat(lowered).isInstanceOfSatisfying(ErrorNode.class, error -> {
            assertThat(error.errorCode()).isEqualTo("E100");
            assertThat(error.cstNodeText()).isEqualTo("@@");
        });
    }

    @Test
    void missingNode_becomesSyntaxError() {
        CompositeDispatcher dispatcher = CompositeDispatcher.standard(GeneratorOptions.defaults());
        CstNode missing = SimpleCstNode.named(CstTypes.IDENTIFIER).text("").markMissing().build();

        AstNode lowered = dispatch(dispatcher, missing).orElseThrow();

        assertThat(((ErrorNode) lowered).message()).isEqualTo("Missing identifier");
    }

    @Test
    void singleChildWrapper_isDescendedInto() {
        CompositeDispatcher dispatcher = CompositeDispatcher.standard(GeneratorOptions.defaults());
        CstNode wrapper = SimpleCstNode.named("parenthetical").child(SimpleCstNode.leaf(CstTypes.NUMBER, "3")).build();

        assertThat(dispatch(dispatcher, wrapper).orElseThrow())
                .isInstanceOfSatisfying(LiteralNode.class, literal -> assertThat(literal.value()).isEqualTo(3.0));
    }

    @Test
    void unrecognizedNode_isReportedWhenEnabled() {
        CstNode mystery = SimpleCstNode.named("mystery")
                .child(SimpleCstNode.leaf(CstTypes.IDENTIFIER, "a"))
                .child(SimpleCstNode.leaf(CstTypes.IDENTIFIER, "b"))
                .build();

        assertThat(dispatch(CompositeDispatcher.standard(GeneratorOptions.defaults()), mystery)).isEmpty();
        assertThat(sink.getDiagnostics(Severity.WARNING)).singleElement()
                .satisfies(d -> assertThat(d.message()).startsWith("Unrecognized mystery"));
    }

    @Test
    void unrecognizedNode_isSilentWhenDisabled() {
        CstNode mystery = SimpleCstNode.named("mystery")
                .child(SimpleCstNode.leaf(CstTypes.IDENTIFIER, "a"))
                .child(SimpleCstNode.leaf(CstTypes.IDENTIFIER, "b"))
                .build();
        GeneratorOptions quiet = GeneratorOptions.builder().reportUnrecognized(false).build();

        assertThat(dispatch(CompositeDispatcher.standard(quiet), mystery)).isEmpty();
        assertThat(sink.getDiagnostics()).isEmpty();
    }

    // ── canonicalization ──

    @Test
    void truncatedName_isCanonicalized() {
        CompositeDispatcher dispatcher = CompositeDispatcher.standard(GeneratorOptions.defaults());

        AstNode lowered = dispatch(dispatcher, instantiation("sphe", SimpleCstNode.leaf(CstTypes.NUMBER, "4")))
                .orElseThrow();

        assertThat(lowered).isInstanceOfSatisfying(SphereNode.class,
                sphere -> assertThat(sphere.radius()).isEqualTo(4.0));
    }

    @Test
    void truncatedName_staysUserModuleWhenCanonicalizationIsOff() {
        GeneratorOptions literal = GeneratorOptions.builder().canonicalizeIdentifiers(false).build();

        AstNode lowered = dispatch(CompositeDispatcher.standard(literal),
                instantiation("sphe", SimpleCstNode.leaf(CstTypes.NUMBER, "4"))).orElseThrow();

        assertThat(lowered).isInstanceOfSatisfying(ModuleInstantiationNode.class, call -> {
            assertThat(call.name()).isEqualTo("sphe");
            assertThat(call.arguments()).singleElement()
                    .satisfies(argument -> assertThat(argument.name()).isNull());
        });
    }

    // ── modifiers ──

    @Test
    void modifiers_wrapTheInstantiation() {
        List<AstNode> statements = new AstGenerator()
                .generate(program("#cube(1); *translate([1, 0, 0]) cube(1); %!sphere(1);")).statements();

        assertThat(statements).hasSize(3).allMatch(ModifierNode.class::isInstance);
        ModifierNode highlighted = (ModifierNode) statements.get(0);
        ModifierNode disabled = (ModifierNode) statements.get(1);
        ModifierNode stacked = (ModifierNode) statements.get(2);
        assertThat(highlighted.modifiers()).containsExactly(Modifier.HIGHLIGHT);
        assertThat(highlighted.child()).isInstanceOf(CubeNode.class);
        assertThat(disabled.modifiers()).containsExactly(Modifier.DISABLE);
        assertThat(disabled.child()).isInstanceOf(TranslateNode.class);
        assertThat(stacked.modifiers()).containsExactly(Modifier.BACKGROUND, Modifier.ROOT);
    }

    @Test
    void modifiers_doNotWrapErrorNodes() {
        List<AstNode> statements = new AstGenerator().generate(program("#cylinder(r = 1);")).statements();

        assertThat(statements).singleElement().isInstanceOf(ErrorNode.class);
    }
}
