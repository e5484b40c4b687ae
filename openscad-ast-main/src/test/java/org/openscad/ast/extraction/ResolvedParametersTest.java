package org.openscad.ast.extraction;

import java.util.List;

import org.junit.jupiter.api.Test;
import org.openscad.ast.diagnostics.CollectingDiagnosticSink;
import org.openscad.ast.diagnostics.Diagnostic;
import org.openscad.ast.diagnostics.Severity;

import static org.assertj.core.api.Assertions.assertThat;

class ResolvedParametersTest {

    private static final List<String> CUBE = List.of("size", "center");

    private final CollectingDiagnosticSink sink = new CollectingDiagnosticSink();

    private ResolvedParameters resolve(Parameter... parameters) {
        return ResolvedParameters.resolve("cube", List.of(parameters), CUBE, List.of(), null, sink);
    }

    @Test
    void positionals_fillSlotsNotTakenByName() {
        ResolvedParameters p = resolve(
                Parameter.named("size", new Value.Number("10")),
                Parameter.positional(new Value.Bool(true)));

        assertThat(p.number("size")).contains(10.0);
        assertThat(p.bool("center")).contains(true);
        assertThat(sink.getDiagnostics()).isEmpty();
    }

    @Test
    void duplicateName_keepsFirstAndWarns() {
        ResolvedParameters p = resolve(
                Parameter.named("size", new Value.Number("1")),
                Parameter.named("size", new Value.Number("2")));

        assertThat(p.number("size")).contains(1.0);
        assertThat(sink.getDiagnostics(Severity.WARNING)).extracting(Diagnostic::message)
                .singleElement().asString().contains("more than once");
    }

    @Test
    void unknownName_isDroppedWithWarning() {
        ResolvedParameters p = resolve(Parameter.named("radius", new Value.Number("1")));

        assertThat(p.has("radius")).isFalse();
        assertThat(sink.getDiagnostics(Severity.WARNING)).extracting(Diagnostic::message)
                .singleElement().asString().contains("Unknown parameter 'radius'");
    }

    @Test
    void specialVariables_areAlwaysAccepted() {
        ResolvedParameters p = resolve(Parameter.named("$fn", new Value.Number("12")));

        assertThat(p.number("$fn")).contains(12.0);
        assertThat(sink.getDiagnostics()).isEmpty();
    }

    @Test
    void extraPositionals_areReported() {
        ResolvedParameters p = resolve(
                Parameter.positional(new Value.Number("1")),
                Parameter.positional(new Value.Bool(false)),
                Parameter.positional(new Value.Number("3")));

        assertThat(p.positional()).containsExactly(new Value.Number("3"));
        assertThat(sink.getDiagnostics(Severity.WARNING)).hasSize(1);
    }

    @Test
    void wrongKind_warnsAndFallsBack() {
        ResolvedParameters p = resolve(Parameter.named("center", new Value.Str("yes")));

        assertThat(p.bool("center", false)).isFalse();
        assertThat(sink.getDiagnostics(Severity.WARNING)).extracting(Diagnostic::message)
                .singleElement().asString().contains("should be a boolean");
    }
}
