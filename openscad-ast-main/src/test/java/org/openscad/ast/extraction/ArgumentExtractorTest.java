package org.openscad.ast.extraction;

import java.util.List;

import org.junit.jupiter.api.Test;
import org.openscad.ast.diagnostics.CollectingDiagnosticSink;
import org.openscad.cst.CstNode;
import org.openscad.cst.CstTypes;
import org.openscad.cst.SimpleCstNode;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;
import static org.openscad.ast.CstFixtures.argumentList;

class ArgumentExtractorTest {

    private final CollectingDiagnosticSink sink = new CollectingDiagnosticSink();

    @Test
    void mixedArguments_keepSourceOrder() {
        List<Parameter> parameters = ArgumentExtractor.extractArguments(
                argumentList("cylinder(10, r = 2, center = true, $fn = 32)"), sink);

        assertThat(parameters).containsExactly(
                Parameter.positional(new Value.Number("10")),
                Parameter.named("r", new Value.Number("2")),
                Parameter.named("center", new Value.Bool(true)),
                Parameter.named("$fn", new Value.Number("32")));
    }

    @Test
    void emptyArgumentList_yieldsNothing() {
        assertThat(ArgumentExtractor.extractArguments(argumentList("union()"), sink)).isEmpty();
    }

    @Test
    void blankArgumentList_yieldsNothing() {
        CstNode blank = SimpleCstNode.named(CstTypes.ARGUMENT_LIST).text("   ").build();

        assertThat(ArgumentExtractor.extractArguments(blank, sink)).isEmpty();
        assertThat(ArgumentExtractor.extractArguments(null, sink)).isEmpty();
    }

    @Test
    void nonLiteralArgument_isKeptAsExpression() {
        List<Parameter> parameters = ArgumentExtractor.extractArguments(argumentList("cube(2 * size)"), sink);

        assertThat(parameters).hasSize(1);
        assertThat(parameters.get(0).isNamed()).isFalse();
        assertThat(parameters.get(0).value()).isInstanceOf(ExpressionValue.class);
        assertThat(parameters.get(0).value().describe()).isEqualTo("2 * size");
    }

    @Test
    void namedArgumentShape_isSplitIntoNameAndValue() {
        CstNode list = SimpleCstNode.named(CstTypes.ARGUMENT_LIST)
                .token("(")
                .child(SimpleCstNode.named(CstTypes.NAMED_ARGUMENT)
                        .field("name", SimpleCstNode.leaf(CstTypes.IDENTIFIER, "r"))
                        .token("=")
                        .field("value", SimpleCstNode.leaf(CstTypes.NUMBER, "5"))
                        .build())
                .token(")")
                .build();

        assertThat(ArgumentExtractor.extractArguments(list, sink))
                .containsExactly(Parameter.named("r", new Value.Number("5")));
    }

    @Test
    void genericArgument_isNamedOnlyWithAssignmentToken() {
        CstNode named = SimpleCstNode.named(CstTypes.ARGUMENT)
                .child(SimpleCstNode.leaf(CstTypes.IDENTIFIER, "h"))
                .token("=")
                .child(SimpleCstNode.leaf(CstTypes.NUMBER, "10"))
                .build();
        CstNode positional = SimpleCstNode.named(CstTypes.ARGUMENT)
                .child(SimpleCstNode.leaf(CstTypes.STRING, "\"red\""))
                .build();
        CstNode list = SimpleCstNode.named(CstTypes.ARGUMENT_LIST)
                .token("(")
                .child(SimpleCstNode.named(CstTypes.ARGUMENTS)
                        .child(named)
                        .token(",")
                        .child(positional)
                        .build())
                .token(")")
                .build();

        assertThat(ArgumentExtractor.extractArguments(list, sink)).containsExactly(
                Parameter.named("h", new Value.Number("10")),
                Parameter.positional(new Value.Str("red")));
        assertThat(sink.getDiagnostics()).isEmpty();
    }

    @Test
    void bareValueChild_isPositional() {
        CstNode list = SimpleCstNode.named(CstTypes.ARGUMENT_LIST)
                .token("(")
                .child(SimpleCstNode.leaf(CstTypes.NUMBER, "3"))
                .token(",")
                .child(SimpleCstNode.leaf(CstTypes.IDENTIFIER, "w"))
                .token(")")
                .build();

        assertThat(ArgumentExtractor.splitArguments(list, sink))
                .extracting(RawArgument::name, a -> a.value().text())
                .containsExactly(
                        tuple(null, "3"),
                        tuple(null, "w"));
    }

    @Test
    void malformedArgument_isSkippedWithWarning() {
        CstNode list = SimpleCstNode.named(CstTypes.ARGUMENT_LIST)
                .token("(")
                .child(SimpleCstNode.error().text("@@").build())
                .token(",")
                .child(SimpleCstNode.leaf(CstTypes.NUMBER, "1"))
                .token(")")
                .build();

        assertThat(ArgumentExtractor.extractArguments(list, sink))
                .containsExactly(Parameter.positional(new Value.Number("1")));
        assertThat(sink.getDiagnostics()).hasSize(1);
    }
}
