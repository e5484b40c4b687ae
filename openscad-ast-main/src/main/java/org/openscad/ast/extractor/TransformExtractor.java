package org.openscad.ast.extractor;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.openscad.ast.diagnostics.DiagnosticSink;
import org.openscad.ast.extraction.Parameter;
import org.openscad.ast.extraction.ParameterCoercion;
import org.openscad.ast.extraction.ParameterValue;
import org.openscad.ast.extraction.ResolvedParameters;
import org.openscad.ast.location.SourceRange;
import org.openscad.ast.node.AstNode;
import org.openscad.ast.node.ColorNode;
import org.openscad.ast.node.LinearExtrudeNode;
import org.openscad.ast.node.MirrorNode;
import org.openscad.ast.node.MultmatrixNode;
import org.openscad.ast.node.OffsetNode;
import org.openscad.ast.node.ResizeNode;
import org.openscad.ast.node.RotateExtrudeNode;
import org.openscad.ast.node.RotateNode;
import org.openscad.ast.node.ScaleNode;
import org.openscad.ast.node.TranslateNode;

/**
 * Builds transform and extrusion nodes from extracted call parameters. The children are lowered
 * by the caller and attached as given.
 */
public final class TransformExtractor {

    static final List<String> TRANSLATE_ORDER = List.of("v");
    static final List<String> ROTATE_ORDER = List.of("a", "v");
    static final List<String> SCALE_ORDER = List.of("v");
    static final List<String> MIRROR_ORDER = List.of("v");
    static final List<String> MULTMATRIX_ORDER = List.of("m");
    static final List<String> COLOR_ORDER = List.of("c", "alpha");
    static final List<String> OFFSET_ORDER = List.of("r", "delta", "chamfer");
    static final List<String> RESIZE_ORDER = List.of("newsize", "auto");
    static final List<String> LINEAR_EXTRUDE_ORDER = List.of("height", "center", "convexity", "twist", "slices",
            "scale");
    static final List<String> ROTATE_EXTRUDE_ORDER = List.of("angle", "convexity");

    public static final List<Double> ORIGIN = List.of(0.0, 0.0, 0.0);
    public static final List<Double> UNIT_SCALE = List.of(1.0, 1.0, 1.0);
    public static final List<Double> X_AXIS = List.of(1.0, 0.0, 0.0);
    public static final List<Double> Z_AXIS = List.of(0.0, 0.0, 1.0);
    public static final double DEFAULT_EXTRUDE_HEIGHT = 100.0;
    public static final double FULL_TURN = 360.0;
    public static final String DEFAULT_COLOR = "red";

    private TransformExtractor() {
    }

    /**
     * A bare number moves along x only; shorter vectors are padded with 0.
     */
    public static TranslateNode translate(List<Parameter> parameters, List<AstNode> children,
                                          SourceRange location, DiagnosticSink sink) {
        ResolvedParameters p = ResolvedParameters.resolve("translate", parameters, TRANSLATE_ORDER, List.of(),
                location, sink);
        List<Double> v = vector3(p, "v", 0.0, ORIGIN, false);
        return new TranslateNode(v, children, location);
    }

    public static MirrorNode mirror(List<Parameter> parameters, List<AstNode> children,
                                    SourceRange location, DiagnosticSink sink) {
        ResolvedParameters p = ResolvedParameters.resolve("mirror", parameters, MIRROR_ORDER, List.of(), location,
                sink);
        List<Double> v = p.vector("v").filter(l -> !l.isEmpty())
                .map(l -> ParameterCoercion.fit(l, 3, 0.0))
                .orElse(X_AXIS);
        return new MirrorNode(v, children, location);
    }

    /**
     * A bare number scales every axis alike; shorter vectors are padded with 1.
     */
    public static ScaleNode scale(List<Parameter> parameters, List<AstNode> children,
                                  SourceRange location, DiagnosticSink sink) {
        ResolvedParameters p = ResolvedParameters.resolve("scale", parameters, SCALE_ORDER, List.of(), location,
                sink);
        List<Double> v = vector3(p, "v", 1.0, UNIT_SCALE, true);
        return new ScaleNode(v, children, location);
    }

    /**
     * {@code rotate(a)} with a vector rotates about each axis in turn; with a number it rotates
     * about {@code v}, the z axis by default.
     */
    public static RotateNode rotate(List<Parameter> parameters, List<AstNode> children,
                                    SourceRange location, DiagnosticSink sink) {
        ResolvedParameters p = ResolvedParameters.resolve("rotate", parameters, ROTATE_ORDER, List.of(), location,
                sink);
        Optional<ParameterValue> a = p.get("a");
        if (a.isPresent()) {
            Optional<Double> angle = ParameterCoercion.toNumber(a.get());
            if (angle.isPresent()) {
                List<Double> axis = p.vector("v").filter(l -> !l.isEmpty())
                        .map(l -> ParameterCoercion.fit(l, 3, 0.0))
                        .orElse(Z_AXIS);
                return new RotateNode(angle.get(), null, axis, children, location);
            }
            Optional<List<Double>> angles = ParameterCoercion.toNumberVector(a.get());
            if (angles.isPresent()) {
                if (p.has("v")) {
                    sink.debug("Axis of rotate is ignored when the angle is a vector", "rotate", location);
                }
                return new RotateNode(null, ParameterCoercion.fit(angles.get(), 3, 0.0), null,
                        children, location);
            }
            sink.warn("Parameter 'a' of rotate should be a number or a vector, got " + a.get().describe()
                    + "; using the default", "rotate", location);
        }
        return new RotateNode(null, ORIGIN, null, children, location);
    }

    /**
     * A 3x4 matrix gets the implicit {@code [0, 0, 0, 1]} bottom row; a missing one means identity.
     */
    public static MultmatrixNode multmatrix(List<Parameter> parameters, List<AstNode> children,
                                            SourceRange location, DiagnosticSink sink) {
        ResolvedParameters p = ResolvedParameters.resolve("multmatrix", parameters, MULTMATRIX_ORDER, List.of(),
                location, sink);
        List<List<Double>> matrix = p.coerce("m", ParameterCoercion::toNumberMatrix, "a matrix")
                .map(TransformExtractor::toAffine)
                .orElseGet(TransformExtractor::identity);
        return new MultmatrixNode(matrix, children, location);
    }

    /**
     * A separate {@code alpha} replaces the alpha of a color vector. A missing or unusable color
     * falls back to {@link #DEFAULT_COLOR} so the children are always kept.
     */
    public static ColorNode color(List<Parameter> parameters, List<AstNode> children,
                                  SourceRange location, DiagnosticSink sink) {
        ResolvedParameters p = ResolvedParameters.resolve("color", parameters, COLOR_ORDER, List.of(), location,
                sink);
        Double alpha = p.number("alpha").orElse(null);
        Optional<ParameterValue> c = p.get("c");
        if (c.isEmpty()) {
            sink.warn("color() without a color; using '" + DEFAULT_COLOR + "'", "color", location);
            return new ColorNode(DEFAULT_COLOR, null, alpha, children, location);
        }
        Optional<String> name = ParameterCoercion.toText(c.get());
        if (name.isPresent()) {
            return new ColorNode(name.get(), null, alpha, children, location);
        }
        Optional<List<Double>> rgba = ParameterCoercion.toNumberVector(c.get())
                .filter(v -> v.size() == 3 || v.size() == 4);
        if (rgba.isEmpty()) {
            sink.warn("Color " + c.get().describe() + " is neither a name nor an RGB(A) vector; using '"
                    + DEFAULT_COLOR + "'", "color", location);
            return new ColorNode(DEFAULT_COLOR, null, alpha, children, location);
        }
        List<Double> components = new ArrayList<>(ParameterCoercion.fit(rgba.get(), 4, 1.0));
        if (alpha != null) {
            components.set(3, alpha);
        }
        return new ColorNode(null, components, alpha, children, location);
    }

    public static OffsetNode offset(List<Parameter> parameters, List<AstNode> children,
                                    SourceRange location, DiagnosticSink sink) {
        ResolvedParameters p = ResolvedParameters.resolve("offset", parameters, OFFSET_ORDER, List.of(), location,
                sink);
        return new OffsetNode(p.number("r", 0.0), p.number("delta", 0.0), p.bool("chamfer", false),
                children, location);
    }

    /**
     * {@code auto} may be one flag for every axis or one per axis.
     */
    public static ResizeNode resize(List<Parameter> parameters, List<AstNode> children,
                                    SourceRange location, DiagnosticSink sink) {
        ResolvedParameters p = ResolvedParameters.resolve("resize", parameters, RESIZE_ORDER, List.of(), location,
                sink);
        List<Double> newsize = p.vector("newsize").map(l -> ParameterCoercion.fit(l, 3, 0.0)).orElse(ORIGIN);
        List<Boolean> auto = List.of(false, false, false);
        Optional<ParameterValue> rawAuto = p.get("auto");
        if (rawAuto.isPresent()) {
            Optional<Boolean> flag = ParameterCoercion.toBoolean(rawAuto.get());
            Optional<List<Boolean>> flags = ParameterCoercion.toBooleanVector(rawAuto.get());
            if (flag.isPresent()) {
                auto = List.of(flag.get(), flag.get(), flag.get());
            } else if (flags.isPresent()) {
                List<Boolean> padded = new ArrayList<>(flags.get());
                while (padded.size() < 3) {
                    padded.add(false);
                }
                auto = List.copyOf(padded.subList(0, 3));
            } else {
                sink.warn("Parameter 'auto' of resize should be a boolean or a vector of booleans, got "
                        + rawAuto.get().describe(), "resize", location);
            }
        }
        return new ResizeNode(newsize, auto, children, location);
    }

    public static LinearExtrudeNode linearExtrude(List<Parameter> parameters, List<AstNode> children,
                                                  SourceRange location, DiagnosticSink sink) {
        ResolvedParameters p = ResolvedParameters.resolve("linear_extrude", parameters, LINEAR_EXTRUDE_ORDER,
                List.of(), location, sink);
        List<Double> scale = List.of(1.0, 1.0);
        Optional<ParameterValue> rawScale = p.get("scale");
        if (rawScale.isPresent()) {
            Optional<Double> uniform = ParameterCoercion.toNumber(rawScale.get());
            Optional<List<Double>> perAxis = ParameterCoercion.toNumberVector(rawScale.get());
            if (uniform.isPresent()) {
                scale = List.of(uniform.get(), uniform.get());
            } else if (perAxis.isPresent() && !perAxis.get().isEmpty()) {
                scale = ParameterCoercion.fit(perAxis.get(), 2, 1.0);
            } else {
                sink.warn("Parameter 'scale' of linear_extrude should be a number or a vector, got "
                        + rawScale.get().describe(), "linear_extrude", location);
            }
        }
        return new LinearExtrudeNode(
                p.number("height", DEFAULT_EXTRUDE_HEIGHT),
                p.bool("center", false),
                p.integer("convexity").orElse(null),
                p.number("twist", 0.0),
                p.integer("slices").orElse(null),
                scale,
                p.number("$fn").orElse(null),
                children,
                location);
    }

    public static RotateExtrudeNode rotateExtrude(List<Parameter> parameters, List<AstNode> children,
                                                  SourceRange location, DiagnosticSink sink) {
        ResolvedParameters p = ResolvedParameters.resolve("rotate_extrude", parameters, ROTATE_EXTRUDE_ORDER,
                List.of(), location, sink);
        return new RotateExtrudeNode(p.number("angle", FULL_TURN), p.integer("convexity").orElse(null),
                p.number("$fn").orElse(null), children, location);
    }

    /**
     * A number becomes {@code [n, 0, 0]}, or {@code [n, n, n]} when {@code uniformScalar}; vectors
     * are fitted to three components with {@code fill}.
     */
    private static List<Double> vector3(ResolvedParameters p, String name, double fill, List<Double> fallback,
                                        boolean uniformScalar) {
        Optional<ParameterValue> raw = p.get(name);
        if (raw.isEmpty()) {
            return fallback;
        }
        Optional<Double> scalar = ParameterCoercion.toNumber(raw.get());
        if (scalar.isPresent()) {
            double n = scalar.get();
            return uniformScalar ? List.of(n, n, n) : List.of(n, 0.0, 0.0);
        }
        Optional<List<Double>> vector = ParameterCoercion.toNumberVector(raw.get());
        if (vector.isPresent() && !vector.get().isEmpty()) {
            return ParameterCoercion.fit(vector.get(), 3, fill);
        }
        p.getSink().warn("Parameter '" + name + "' of " + p.getCallee() + " should be a number or a vector, got "
                + raw.get().describe() + "; using the default", p.getCallee(), p.getLocation());
        return fallback;
    }

    private static List<List<Double>> toAffine(List<List<Double>> rows) {
        List<List<Double>> identity = identity();
        List<List<Double>> matrix = new ArrayList<>(4);
        for (int i = 0; i < 4; i++) {
            List<Double> row = new ArrayList<>(4);
            for (int j = 0; j < 4; j++) {
                boolean given = i < rows.size() && j < rows.get(i).size();
                row.add(given ? rows.get(i).get(j) : identity.get(i).get(j));
            }
            matrix.add(List.copyOf(row));
        }
        return List.copyOf(matrix);
    }

    private static List<List<Double>> identity() {
        return List.of(
                List.of(1.0, 0.0, 0.0, 0.0),
                List.of(0.0, 1.0, 0.0, 0.0),
                List.of(0.0, 0.0, 1.0, 0.0),
                List.of(0.0, 0.0, 0.0, 1.0));
    }
}
