package org.openscad.ast.extraction;

import java.util.List;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.openscad.ast.CstFixtures.expression;

class ParameterCoercionTest {

    private static Value.Vector vector(Value... elements) {
        return new Value.Vector(List.of(elements), true);
    }

    private static Value.Number n(String raw) {
        return new Value.Number(raw);
    }

    @Test
    void toNumber_parsesNumbersAndNumericStrings() {
        assertThat(ParameterCoercion.toNumber(n("2.5"))).contains(2.5);
        assertThat(ParameterCoercion.toNumber(n("1e3"))).contains(1000.0);
        assertThat(ParameterCoercion.toNumber(new Value.Str(" 42 "))).contains(42.0);
        assertThat(ParameterCoercion.toNumber(new Value.Str("wide"))).isEmpty();
        assertThat(ParameterCoercion.toNumber(new Value.Bool(true))).isEmpty();
        assertThat(ParameterCoercion.toNumber(new Value.Identifier("w"))).isEmpty();
    }

    @Test
    void toNumber_foldsConstantArithmetic() {
        assertThat(ParameterCoercion.toNumber(new ExpressionValue(expression("2 * (3 + 4)")))).contains(14.0);
        assertThat(ParameterCoercion.toNumber(new ExpressionValue(expression("2 ^ 3 - 1")))).contains(7.0);
        assertThat(ParameterCoercion.toNumber(new ExpressionValue(expression("-(10 / 4)")))).contains(-2.5);
    }

    @Test
    void toNumber_doesNotFoldVariablesOrCalls() {
        assertThat(ParameterCoercion.toNumber(new ExpressionValue(expression("2 * w")))).isEmpty();
        assertThat(ParameterCoercion.toNumber(new ExpressionValue(expression("sin(30)")))).isEmpty();
        assertThat(ParameterCoercion.toNumber(new ExpressionValue(expression("1 < 2")))).isEmpty();
    }

    @Test
    void toInteger_rejectsFractions() {
        assertThat(ParameterCoercion.toInteger(n("4"))).contains(4);
        assertThat(ParameterCoercion.toInteger(n("4.5"))).isEmpty();
    }

    @Test
    void toInteger_rejectsValuesOutsideIntRange() {
        assertThat(ParameterCoercion.toInteger(n("2147483647"))).contains(Integer.MAX_VALUE);
        assertThat(ParameterCoercion.toInteger(n("3000000000"))).isEmpty();
        assertThat(ParameterCoercion.toInteger(n("1e10"))).isEmpty();
        assertThat(ParameterCoercion.toInteger(n("-3000000000"))).isEmpty();
        assertThat(ParameterCoercion.toIndexLists(vector(vector(n("3000000000"))))).isEmpty();
    }

    @Test
    void toBoolean_acceptsBooleansAndTheirSpelling() {
        assertThat(ParameterCoercion.toBoolean(new Value.Bool(false))).contains(false);
        assertThat(ParameterCoercion.toBoolean(new Value.Str("true"))).contains(true);
        assertThat(ParameterCoercion.toBoolean(n("1"))).isEmpty();
    }

    @Test
    void toNumberVector_keepsDimensionality() {
        assertThat(ParameterCoercion.toNumberVector(vector(n("1"), n("2")))).contains(List.of(1.0, 2.0));
        assertThat(ParameterCoercion.toNumberVector(vector())).contains(List.of());
        assertThat(ParameterCoercion.toNumberVector(vector(n("1"), new Value.Identifier("y")))).isEmpty();
        assertThat(ParameterCoercion.toNumberVector(n("1"))).isEmpty();
    }

    @Test
    void toNumberVector_rejectsIncompleteVectors() {
        Value.Vector lossy = new Value.Vector(List.of(n("1"), n("2")), false);

        assertThat(ParameterCoercion.toNumberVector(lossy)).isEmpty();
    }

    @Test
    void matricesAndIndexLists() {
        Value.Vector points = vector(vector(n("0"), n("0")), vector(n("10"), n("0")), vector(n("0"), n("10")));
        Value.Vector faces = vector(vector(n("0"), n("1"), n("2")));

        assertThat(ParameterCoercion.toNumberMatrix(points)).contains(
                List.of(List.of(0.0, 0.0), List.of(10.0, 0.0), List.of(0.0, 10.0)));
        assertThat(ParameterCoercion.toIndexLists(faces)).contains(List.of(List.of(0, 1, 2)));
        assertThat(ParameterCoercion.toIndexLists(vector(vector(n("0.5"))))).isEmpty();
    }

    @Test
    void fit_padsOrTruncates() {
        assertThat(ParameterCoercion.fit(List.of(1.0, 2.0), 3, 0.0)).containsExactly(1.0, 2.0, 0.0);
        assertThat(ParameterCoercion.fit(List.of(1.0, 2.0, 3.0, 4.0), 3, 0.0)).containsExactly(1.0, 2.0, 3.0);
    }
}
