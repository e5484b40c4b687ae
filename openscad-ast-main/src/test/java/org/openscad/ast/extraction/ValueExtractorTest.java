package org.openscad.ast.extraction;

import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.Test;
import org.openscad.ast.diagnostics.CollectingDiagnosticSink;
import org.openscad.ast.diagnostics.Severity;

import static org.assertj.core.api.Assertions.assertThat;
import static org.openscad.ast.CstFixtures.expression;

class ValueExtractorTest {

    private final CollectingDiagnosticSink sink = new CollectingDiagnosticSink();

    private Optional<Value> extract(String source) {
        return ValueExtractor.extractValue(expression(source), sink);
    }

    @Test
    void number_keepsRawText() {
        assertThat(extract("10.50")).contains(new Value.Number("10.50"));
    }

    @Test
    void string_losesItsQuotes() {
        assertThat(extract("\"M6 bolt\"")).contains(new Value.Str("M6 bolt"));
        assertThat(extract("\"say \\\"hi\\\"\"")).contains(new Value.Str("say \"hi\""));
    }

    @Test
    void booleanAndIdentifierLeaves() {
        assertThat(extract("true")).contains(new Value.Bool(true));
        assertThat(extract("false")).contains(new Value.Bool(false));
        assertThat(extract("wall")).contains(new Value.Identifier("wall"));
        assertThat(extract("$fn")).contains(new Value.Identifier("$fn"));
    }

    @Test
    void undef_isNoMatch() {
        assertThat(extract("undef")).isEmpty();
    }

    @Test
    void vector_extractsEveryElementInOrder() {
        Value value = extract("[1, -2, [3, 4]]").orElseThrow();

        assertThat(value).isInstanceOf(Value.Vector.class);
        Value.Vector vector = (Value.Vector) value;
        assertThat(vector.complete()).isTrue();
        assertThat(vector.elements()).containsExactly(
                new Value.Number("1"),
                new Value.Number("-2"),
                new Value.Vector(List.of(new Value.Number("3"), new Value.Number("4")), true));
    }

    @Test
    void vector_withUnextractableElement_isMarkedIncomplete() {
        Value.Vector vector = (Value.Vector) extract("[1, f(2)]").orElseThrow();

        assertThat(vector.elements()).containsExactly(new Value.Number("1"));
        assertThat(vector.complete()).isFalse();
        assertThat(sink.getDiagnostics(Severity.WARNING)).isEmpty();
    }

    @Test
    void vector_whereEveryElementFails_warnsAndStaysEmpty() {
        Value.Vector vector = (Value.Vector) extract("[f(1), g(2)]").orElseThrow();

        assertThat(vector.elements()).isEmpty();
        assertThat(vector.complete()).isFalse();
        assertThat(sink.getDiagnostics(Severity.WARNING)).hasSize(1);
    }

    @Test
    void emptyVector_isCompleteAndSilent() {
        assertThat(extract("[]")).contains(new Value.Vector(List.of(), true));
        assertThat(sink.getDiagnostics()).isEmpty();
    }

    @Test
    void range_keepsBoundsAsText() {
        assertThat(extract("[0 : 2 : 10]")).contains(new Value.Range("0", "10", "2"));
        assertThat(extract("[1:n]")).contains(new Value.Range("1", "n", null));
    }

    @Test
    void wrappers_arePassedThrough() {
        assertThat(extract("(5)")).contains(new Value.Number("5"));
        assertThat(extract("((\"x\"))")).contains(new Value.Str("x"));
        assertThat(extract("+7")).contains(new Value.Number("7"));
        assertThat(extract("-(-3)")).contains(new Value.Number("3"));
    }

    @Test
    void operations_areNoMatch() {
        assertThat(extract("1 + 2")).isEmpty();
        assertThat(extract("!true")).isEmpty();
        assertThat(extract("a ? 1 : 2")).isEmpty();
        assertThat(extract("v[0]")).isEmpty();
    }
}
