package org.openscad.ast.visitor;

import java.util.List;

import org.junit.jupiter.api.Test;
import org.openscad.ast.AstGenerator;
import org.openscad.ast.GenerationResult;
import org.openscad.ast.diagnostics.Diagnostic;
import org.openscad.ast.diagnostics.Severity;
import org.openscad.ast.node.AstNode;
import org.openscad.ast.node.ColorNode;
import org.openscad.ast.node.CubeNode;
import org.openscad.ast.node.DifferenceNode;
import org.openscad.ast.node.ErrorNode;
import org.openscad.ast.node.HullNode;
import org.openscad.ast.node.SphereNode;
import org.openscad.ast.node.TranslateNode;
import org.openscad.ast.node.UnionNode;

import static org.assertj.core.api.Assertions.assertThat;
import static org.openscad.ast.CstFixtures.program;

class InstantiationVisitorTest {

    private static GenerationResult generate(String source) {
        return new AstGenerator().generate(program(source));
    }

    // ── primitives ──

    @Test
    void primitive_ignoresChildrenWithWarning() {
        GenerationResult result = generate("cube(1) sphere(2);");

        assertThat(result.statements()).singleElement().isInstanceOf(CubeNode.class);
        assertThat(result.diagnostics(Severity.WARNING)).extracting(Diagnostic::message)
                .containsExactly("cube takes no children; ignoring them");
    }

    @Test
    void cylinderWithoutHeight_isErrorNode() {
        GenerationResult result = generate("cylinder(r=5);");

        ErrorNode error = (ErrorNode) result.statements().get(0);
        assertThat(error.errorCode()).isEqualTo("E301_MISSING_CYLINDER_H");
        assertThat(error.message()).isEqualTo("cylinder requires a height 'h'");
        assertThat(error.originalNodeType()).isEqualTo("module_instantiation");
        assertThat(error.cstNodeText()).isEqualTo("cylinder(r=5);");
        assertThat(result.errorNodes()).containsExactly(error);
        assertThat(result.diagnostics(Severity.ERROR)).singleElement()
                .satisfies(d -> assertThat(d.context()).isEqualTo("E301_MISSING_CYLINDER_H"));
    }

    @Test
    void missingRequiredParameters() {
        List<AstNode> statements = generate("polygon(); polyhedron(points = [[0, 0, 0]]); text();").statements();

        assertThat(statements).hasSize(3).allSatisfy(node -> assertThat(node)
                .isInstanceOfSatisfying(ErrorNode.class, e -> assertThat(e.errorCode()).isEqualTo("E301")));
    }

    // ── transforms ──

    @Test
    void transform_lowersItsBlock() {
        TranslateNode translate = (TranslateNode) generate("translate([1, 2, 3]) { cube(1); sphere(1); }")
                .statements().get(0);

        assertThat(translate.v()).containsExactly(1.0, 2.0, 3.0);
        assertThat(translate.children()).hasSize(2);
        assertThat(translate.children().get(1)).isInstanceOf(SphereNode.class);
    }

    @Test
    void nestedTransforms() {
        ColorNode color = (ColorNode) generate("color(\"red\") translate([0, 0, 5]) cube(1);").statements().get(0);

        assertThat(color.children()).singleElement().isInstanceOfSatisfying(TranslateNode.class,
                t -> assertThat(t.children()).singleElement().isInstanceOf(CubeNode.class));
    }

    @Test
    void colorFromVariable_keepsTheColoredSubtree() {
        GenerationResult result = generate("c = \"blue\"; color(c) cube(10);");

        assertThat(result.statements()).hasSize(2);
        assertThat(result.statements().get(1)).isInstanceOfSatisfying(ColorNode.class, color -> {
            assertThat(color.colorName()).isEqualTo("red");
            assertThat(color.children()).singleElement().isInstanceOf(CubeNode.class);
        });
        assertThat(result.errorNodes()).isEmpty();
        assertThat(result.diagnostics(Severity.WARNING)).isNotEmpty();
    }

    @Test
    void colorWithoutArguments_keepsItsChildren() {
        GenerationResult result = generate("color() cube(10);");

        assertThat(result.statements()).singleElement().isInstanceOfSatisfying(ColorNode.class,
                color -> assertThat(color.children()).singleElement().isInstanceOf(CubeNode.class));
        assertThat(result.errorNodes()).isEmpty();
    }

    @Test
    void invalidColorVector_fallsBackToDefaultColor() {
        GenerationResult result = generate("color([1, 0]) { cube(1); sphere(1); }");

        assertThat(result.statements()).singleElement().isInstanceOfSatisfying(ColorNode.class,
                color -> assertThat(color.children()).hasSize(2));
        assertThat(result.diagnostics(Severity.WARNING)).isNotEmpty();
    }

    // ── boolean operations ──

    @Test
    void booleanOperations_collectChildren() {
        List<AstNode> statements = generate(
                "union() { cube(10); sphere(5); } difference() { cube(2); } hull() cube(1);").statements();

        assertThat(statements).hasSize(3);
        assertThat(((UnionNode) statements.get(0)).children()).hasSize(2);
        assertThat(((DifferenceNode) statements.get(1)).children()).hasSize(1);
        assertThat(((HullNode) statements.get(2)).children()).singleElement().isInstanceOf(CubeNode.class);
    }

    @Test
    void emptyUnion_hasNoChildren() {
        assertThat(((UnionNode) generate("union();").statements().get(0)).children()).isEmpty();
    }
}
