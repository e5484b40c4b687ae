package org.openscad.ast.extractor;

import java.util.List;
import java.util.Optional;

import org.openscad.ast.diagnostics.DiagnosticSink;
import org.openscad.ast.extraction.Parameter;
import org.openscad.ast.extraction.ParameterCoercion;
import org.openscad.ast.extraction.ParameterValue;
import org.openscad.ast.extraction.ResolvedParameters;
import org.openscad.ast.extraction.Value;
import org.openscad.ast.location.SourceRange;
import org.openscad.ast.node.CircleNode;
import org.openscad.ast.node.CubeNode;
import org.openscad.ast.node.CylinderNode;
import org.openscad.ast.node.Dimensions;
import org.openscad.ast.node.PolygonNode;
import org.openscad.ast.node.PolyhedronNode;
import org.openscad.ast.node.SphereNode;
import org.openscad.ast.node.SquareNode;
import org.openscad.ast.node.TextNode;

/**
 * Builds primitive shape nodes from extracted call parameters, applying OpenSCAD's defaults.
 * <p>
 * An empty result means the call lacks a parameter the shape cannot do without, such as the
 * height of a cylinder; the caller decides what to put in its place.
 */
public final class PrimitiveExtractor {

    static final List<String> CUBE_ORDER = List.of("size", "center");
    static final List<String> SPHERE_ORDER = List.of("r");
    static final List<String> CIRCLE_ORDER = List.of("r");
    static final List<String> SQUARE_ORDER = List.of("size", "center");
    static final List<String> POLYGON_ORDER = List.of("points", "paths", "convexity");
    static final List<String> POLYHEDRON_ORDER = List.of("points", "faces", "convexity");
    static final List<String> TEXT_ORDER = List.of("text", "size", "font", "halign", "valign", "spacing",
            "direction", "language", "script");
    static final List<String> CYLINDER_NAMES = List.of("h", "r", "r1", "r2", "d", "d1", "d2", "center");

    public static final double DEFAULT_SIZE = 1.0;
    public static final double DEFAULT_RADIUS = 1.0;
    public static final double DEFAULT_TEXT_SIZE = 10.0;

    private PrimitiveExtractor() {
    }

    public static Optional<CubeNode> cube(List<Parameter> parameters, SourceRange location, DiagnosticSink sink) {
        ResolvedParameters p = ResolvedParameters.resolve("cube", parameters, CUBE_ORDER, List.of(), location, sink);
        Dimensions size = dimensions(p, 3);
        return Optional.of(new CubeNode(size, p.bool("center", false), location));
    }

    public static Optional<SquareNode> square(List<Parameter> parameters, SourceRange location, DiagnosticSink sink) {
        ResolvedParameters p = ResolvedParameters.resolve("square", parameters, SQUARE_ORDER, List.of(), location,
                sink);
        Dimensions size = dimensions(p, 2);
        return Optional.of(new SquareNode(size, p.bool("center", false), location));
    }

    public static Optional<SphereNode> sphere(List<Parameter> parameters, SourceRange location, DiagnosticSink sink) {
        ResolvedParameters p = ResolvedParameters.resolve("sphere", parameters, SPHERE_ORDER, names("d"), location,
                sink);
        Double diameter = p.number("d").orElse(null);
        double radius = radius(p.number("r"), diameter);
        return Optional.of(new SphereNode(radius, diameter, p.number("$fn").orElse(null),
                p.number("$fa").orElse(null), p.number("$fs").orElse(null), location));
    }

    public static Optional<CircleNode> circle(List<Parameter> parameters, SourceRange location, DiagnosticSink sink) {
        ResolvedParameters p = ResolvedParameters.resolve("circle", parameters, CIRCLE_ORDER, names("d"), location,
                sink);
        Double diameter = p.number("d").orElse(null);
        double radius = radius(p.number("r"), diameter);
        return Optional.of(new CircleNode(radius, diameter, p.number("$fn").orElse(null),
                p.number("$fa").orElse(null), p.number("$fs").orElse(null), location));
    }

    /**
     * {@code cylinder(h, r1, r2, center)} or {@code cylinder(h, r, center)} positionally; any radius
     * or diameter form by name. Returns empty when no height can be found.
     */
    public static Optional<CylinderNode> cylinder(List<Parameter> parameters, SourceRange location,
                                                  DiagnosticSink sink) {
        ResolvedParameters p = ResolvedParameters.resolveNamed("cylinder", parameters, CYLINDER_NAMES, location, sink);
        bindCylinderPositionals(p);

        Optional<Double> h = p.number("h");
        if (h.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new CylinderNode(h.get(),
                p.number("r").orElse(null),
                p.number("r1").orElse(null),
                p.number("r2").orElse(null),
                p.number("d").orElse(null),
                p.number("d1").orElse(null),
                p.number("d2").orElse(null),
                p.bool("center", false),
                p.number("$fn").orElse(null),
                p.number("$fa").orElse(null),
                p.number("$fs").orElse(null),
                location));
    }

    private static void bindCylinderPositionals(ResolvedParameters p) {
        List<ParameterValue> positional = p.positional();
        int i = 0;
        if (!p.has("h") && i < positional.size() && isNumeric(positional.get(i))) {
            p.bind("h", positional.get(i++));
        }
        boolean radiusGiven = p.has("r") || p.has("r1") || p.has("r2") || p.has("d") || p.has("d1") || p.has("d2");
        if (!radiusGiven && i + 1 < positional.size()
                && isNumeric(positional.get(i)) && isNumeric(positional.get(i + 1))) {
            p.bind("r1", positional.get(i++));
            p.bind("r2", positional.get(i++));
        } else if (!radiusGiven && i < positional.size() && isNumeric(positional.get(i))) {
            p.bind("r", positional.get(i++));
        }
        if (!p.has("center") && i < positional.size()
                && ParameterCoercion.toBoolean(positional.get(i)).isPresent()) {
            p.bind("center", positional.get(i++));
        }
        p.reportUnusedPositional(i);
    }

    public static Optional<PolygonNode> polygon(List<Parameter> parameters, SourceRange location,
                                                DiagnosticSink sink) {
        ResolvedParameters p = ResolvedParameters.resolve("polygon", parameters, POLYGON_ORDER, List.of(), location,
                sink);
        Optional<List<List<Double>>> points = p.coerce("points", ParameterCoercion::toNumberMatrix, "a list of points");
        if (points.isEmpty()) {
            return Optional.empty();
        }
        List<List<Integer>> paths = p.coerce("paths", ParameterCoercion::toIndexLists, "a list of index lists")
                .orElse(null);
        return Optional.of(new PolygonNode(points.get(), paths, p.integer("convexity").orElse(null), location));
    }

    /**
     * Also accepts the deprecated {@code triangles} in place of {@code faces}.
     */
    public static Optional<PolyhedronNode> polyhedron(List<Parameter> parameters, SourceRange location,
                                                      DiagnosticSink sink) {
        ResolvedParameters p = ResolvedParameters.resolve("polyhedron", parameters, POLYHEDRON_ORDER,
                names("triangles"), location, sink);
        Optional<List<List<Double>>> points = p.coerce("points", ParameterCoercion::toNumberMatrix, "a list of points");
        String facesName = p.has("faces") ? "faces" : "triangles";
        Optional<List<List<Integer>>> faces = p.coerce(facesName, ParameterCoercion::toIndexLists,
                "a list of index lists");
        if (points.isEmpty() || faces.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new PolyhedronNode(points.get(), faces.get(), p.integer("convexity").orElse(null),
                location));
    }

    public static Optional<TextNode> text(List<Parameter> parameters, SourceRange location, DiagnosticSink sink) {
        ResolvedParameters p = ResolvedParameters.resolve("text", parameters, TEXT_ORDER, List.of(), location, sink);
        Optional<String> text = p.get("text").flatMap(PrimitiveExtractor::textOf);
        if (text.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new TextNode(text.get(),
                p.number("size", DEFAULT_TEXT_SIZE),
                p.text("font").orElse(null),
                p.text("halign").orElse("left"),
                p.text("valign").orElse("baseline"),
                p.number("spacing", 1.0),
                p.text("direction").orElse("ltr"),
                p.text("language").orElse("en"),
                p.text("script").orElse("latin"),
                p.number("$fn").orElse(null),
                location));
    }

    private static Optional<String> textOf(ParameterValue value) {
        if (value instanceof Value.Number number) {
            return Optional.of(number.raw());
        }
        return ParameterCoercion.toText(value);
    }

    /**
     * Explicit radius wins over diameter; the diameter is halved.
     */
    private static double radius(Optional<Double> r, Double diameter) {
        if (r.isPresent()) {
            return r.get();
        }
        return diameter != null ? diameter / 2 : DEFAULT_RADIUS;
    }

    /**
     * A scalar stays a scalar and so does a one element vector. Longer vectors are fitted to
     * {@code axes} components, padding with 0.
     */
    private static Dimensions dimensions(ResolvedParameters p, int axes) {
        Optional<ParameterValue> raw = p.get("size");
        if (raw.isEmpty()) {
            return Dimensions.of(DEFAULT_SIZE);
        }
        Optional<Double> scalar = ParameterCoercion.toNumber(raw.get());
        if (scalar.isPresent()) {
            return Dimensions.of(scalar.get());
        }
        Optional<List<Double>> vector = ParameterCoercion.toNumberVector(raw.get());
        if (vector.isPresent() && !vector.get().isEmpty()) {
            List<Double> v = vector.get();
            if (v.size() == 1) {
                return Dimensions.of(v.get(0));
            }
            if (v.size() > axes) {
                p.getSink().debug("Size " + v + " of " + p.getCallee() + " truncated to " + axes + " components",
                        p.getCallee(), p.getLocation());
            }
            return Dimensions.of(ParameterCoercion.fit(v, axes, 0.0));
        }
        p.getSink().warn("Parameter 'size' of " + p.getCallee() + " should be a number or a vector, got "
                + raw.get().describe() + "; using the default", p.getCallee(), p.getLocation());
        return Dimensions.of(DEFAULT_SIZE);
    }

    private static boolean isNumeric(ParameterValue value) {
        return ParameterCoercion.toNumber(value).isPresent();
    }

    private static List<String> names(String... names) {
        return List.of(names);
    }
}
