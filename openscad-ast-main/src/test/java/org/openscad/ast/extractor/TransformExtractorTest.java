package org.openscad.ast.extractor;

import java.util.List;

import org.junit.jupiter.api.Test;
import org.openscad.ast.diagnostics.CollectingDiagnosticSink;
import org.openscad.ast.diagnostics.Severity;
import org.openscad.ast.extraction.Parameter;
import org.openscad.ast.node.AstNode;
import org.openscad.ast.node.ColorNode;
import org.openscad.ast.node.CubeNode;
import org.openscad.ast.node.Dimensions;
import org.openscad.ast.node.RotateNode;

import static org.assertj.core.api.Assertions.assertThat;
import static org.openscad.ast.CstFixtures.parameters;

class TransformExtractorTest {

    private static final List<AstNode> CHILDREN = List.of(new CubeNode(Dimensions.of(1.0), false, null));

    private final CollectingDiagnosticSink sink = new CollectingDiagnosticSink();

    private List<Parameter> params(String call) {
        return parameters(call, sink);
    }

    @Test
    void translate_padsWithZero() {
        assertThat(TransformExtractor.translate(params("translate([1, 2])"), CHILDREN, null, sink).v())
                .containsExactly(1.0, 2.0, 0.0);
        assertThat(TransformExtractor.translate(params("translate(5)"), CHILDREN, null, sink).v())
                .containsExactly(5.0, 0.0, 0.0);
    }

    @Test
    void translate_keepsChildren() {
        assertThat(TransformExtractor.translate(params("translate([1, 2, 3])"), CHILDREN, null, sink)
                .children()).isEqualTo(CHILDREN);
    }

    @Test
    void translate_nonLiteralVectorFallsBackToOrigin() {
        assertThat(TransformExtractor.translate(params("translate([x, 0, 0])"), CHILDREN, null, sink)
                .v()).containsExactly(0.0, 0.0, 0.0);
        assertThat(sink.getDiagnostics(Severity.WARNING)).hasSize(1);
    }

    @Test
    void mirror_padsWithZeroAndDefaultsToXAxis() {
        assertThat(TransformExtractor.mirror(params("mirror([0, 1])"), CHILDREN, null, sink).v())
                .containsExactly(0.0, 1.0, 0.0);
        assertThat(TransformExtractor.mirror(params("mirror()"), CHILDREN, null, sink).v())
                .containsExactly(1.0, 0.0, 0.0);
    }

    @Test
    void scale_padsWithOneAndSpreadsScalars() {
        assertThat(TransformExtractor.scale(params("scale([2, 3])"), CHILDREN, null, sink).v())
                .containsExactly(2.0, 3.0, 1.0);
        assertThat(TransformExtractor.scale(params("scale(2)"), CHILDREN, null, sink).v())
                .containsExactly(2.0, 2.0, 2.0);
    }

    @Test
    void rotate_angleAboutAxisOrEulerAngles() {
        RotateNode aboutZ = TransformExtractor.rotate(params("rotate(45)"), CHILDREN, null, sink);
        RotateNode aboutX = TransformExtractor.rotate(params("rotate(a = 90, v = [1, 0, 0])"), CHILDREN, null, sink);
        RotateNode euler = TransformExtractor.rotate(params("rotate([10, 20])"), CHILDREN, null, sink);

        assertThat(aboutZ.angle()).isEqualTo(45.0);
        assertThat(aboutZ.axis()).containsExactly(0.0, 0.0, 1.0);
        assertThat(aboutX.axis()).containsExactly(1.0, 0.0, 0.0);
        assertThat(euler.isAxisAngle()).isFalse();
        assertThat(euler.angles()).containsExactly(10.0, 20.0, 0.0);
    }

    @Test
    void multmatrix_completesAffineRow() {
        var matrix = TransformExtractor.multmatrix(
                params("multmatrix([[1, 0, 0, 5], [0, 1, 0, 6], [0, 0, 1, 7]])"), CHILDREN, null, sink)
                .matrix();

        assertThat(matrix).hasSize(4);
        assertThat(matrix.get(0)).containsExactly(1.0, 0.0, 0.0, 5.0);
        assertThat(matrix.get(3)).containsExactly(0.0, 0.0, 0.0, 1.0);
    }

    // ── color ──

    @Test
    void color_byName() {
        ColorNode red = TransformExtractor.color(params("color(\"red\")"), CHILDREN, null, sink);

        assertThat(red.colorName()).isEqualTo("red");
        assertThat(red.rgba()).isNull();
    }

    @Test
    void color_rgbGetsOpaqueAlpha() {
        assertThat(TransformExtractor.color(params("color([1, 0.5, 0])"), CHILDREN, null, sink).rgba())
                .containsExactly(1.0, 0.5, 0.0, 1.0);
    }

    @Test
    void color_alphaOverridesVectorAlpha() {
        ColorNode color = TransformExtractor.color(params("color([1, 0, 0, 0.9], 0.5)"), CHILDREN, null, sink);

        assertThat(color.rgba()).containsExactly(1.0, 0.0, 0.0, 0.5);
        assertThat(color.alpha()).isEqualTo(0.5);
    }

    @Test
    void color_wrongLengthVectorFallsBackToDefault() {
        ColorNode color = TransformExtractor.color(params("color([1, 0])"), CHILDREN, null, sink);

        assertThat(color.colorName()).isEqualTo(TransformExtractor.DEFAULT_COLOR);
        assertThat(color.rgba()).isNull();
        assertThat(color.children()).isEqualTo(CHILDREN);
        assertThat(sink.getDiagnostics(Severity.WARNING)).singleElement()
                .satisfies(d -> assertThat(d.message()).contains("neither a name nor an RGB(A) vector"));
    }

    @Test
    void color_variableFallsBackToDefaultAndKeepsChildren() {
        ColorNode color = TransformExtractor.color(params("color(c)"), CHILDREN, null, sink);

        assertThat(color.colorName()).isEqualTo("red");
        assertThat(color.children()).isEqualTo(CHILDREN);
        assertThat(sink.getDiagnostics(Severity.WARNING)).hasSize(1);
    }

    @Test
    void color_withoutArgumentsFallsBackToDefault() {
        ColorNode color = TransformExtractor.color(params("color()"), CHILDREN, null, sink);

        assertThat(color.colorName()).isEqualTo("red");
        assertThat(color.alpha()).isNull();
        assertThat(color.children()).isEqualTo(CHILDREN);
        assertThat(sink.getDiagnostics(Severity.WARNING)).singleElement()
                .satisfies(d -> assertThat(d.message()).startsWith("color() without a color"));
    }

    // ── the rest ──

    @Test
    void offset_resize_andExtrusions() {
        var offset = TransformExtractor.offset(params("offset(delta = 2, chamfer = true)"), CHILDREN, null, sink);
        var resize = TransformExtractor.resize(params("resize([10, 20], auto = true)"), CHILDREN, null, sink);
        var linear = TransformExtractor.linearExtrude(params("linear_extrude(5, twist = 90, scale = 2)"),
                CHILDREN, null, sink);
        var rotateExtrude = TransformExtractor.rotateExtrude(params("rotate_extrude()"), CHILDREN, null, sink);

        assertThat(offset.r()).isZero();
        assertThat(offset.delta()).isEqualTo(2.0);
        assertThat(offset.chamfer()).isTrue();
        assertThat(resize.newsize()).containsExactly(10.0, 20.0, 0.0);
        assertThat(resize.auto()).containsExactly(true, true, true);
        assertThat(linear.height()).isEqualTo(5.0);
        assertThat(linear.twist()).isEqualTo(90.0);
        assertThat(linear.scale()).containsExactly(2.0, 2.0);
        assertThat(rotateExtrude.angle()).isEqualTo(360.0);
        assertThat(sink.getDiagnostics()).isEmpty();
    }

    @Test
    void linearExtrude_hugeSliceCountIsRejectedWithWarning() {
        var linear = TransformExtractor.linearExtrude(params("linear_extrude(5, slices = 1e10)"), CHILDREN, null,
                sink);

        assertThat(linear.slices()).isNull();
        assertThat(sink.getDiagnostics(Severity.WARNING)).singleElement()
                .satisfies(d -> assertThat(d.message()).contains("'slices'"));
    }
}
