package org.openscad.ast.visitor;

import java.util.List;
import java.util.Optional;
import java.util.Set;

import org.openscad.ast.diagnostics.DiagnosticSink;
import org.openscad.ast.diagnostics.ErrorCode;
import org.openscad.ast.extraction.Parameter;
import org.openscad.ast.extractor.PrimitiveExtractor;
import org.openscad.ast.location.SourceRange;
import org.openscad.ast.node.AstNode;
import org.openscad.cst.CstNode;

/**
 * {@code cube}, {@code sphere}, {@code cylinder}, {@code polyhedron}, {@code circle},
 * {@code square}, {@code polygon} and {@code text}.
 */
public class PrimitiveVisitor extends InstantiationVisitor {

    public PrimitiveVisitor() {
        super(Set.of("cube", "sphere", "cylinder", "polyhedron", "circle", "square", "polygon", "text"));
    }

    @Override
    public VisitorCategory category() {
        return VisitorCategory.PRIMITIVE;
    }

    @Override
    protected AstNode lower(String name, CstNode node, VisitContext ctx) {
        List<Parameter> parameters = CstSupport.argumentList(node).map(ctx::parameters).orElse(List.of());
        SourceRange location = ctx.location(node);
        DiagnosticSink sink = ctx.getSink();

        CstSupport.body(node)
                .filter(CstSupport::hasStatements)
                .ifPresent(body -> sink.warn(name + " takes no children; ignoring them", name, location));

        Optional<? extends AstNode> shape = switch (name) {
            case "cube" -> PrimitiveExtractor.cube(parameters, location, sink);
            case "sphere" -> PrimitiveExtractor.sphere(parameters, location, sink);
            case "cylinder" -> PrimitiveExtractor.cylinder(parameters, location, sink);
            case "polyhedron" -> PrimitiveExtractor.polyhedron(parameters, location, sink);
            case "circle" -> PrimitiveExtractor.circle(parameters, location, sink);
            case "square" -> PrimitiveExtractor.square(parameters, location, sink);
            case "polygon" -> PrimitiveExtractor.polygon(parameters, location, sink);
            case "text" -> PrimitiveExtractor.text(parameters, location, sink);
            default -> throw new IllegalArgumentException("Not a primitive: " + name);
        };
        if (shape.isPresent()) {
            return shape.get();
        }
        return switch (name) {
            case "cylinder" -> ctx.error(ErrorCode.MISSING_CYLINDER_H, "cylinder requires a height 'h'", node);
            case "polyhedron" -> ctx.error(ErrorCode.MISSING_REQUIRED_PARAMETER,
                    "polyhedron requires 'points' and 'faces'", node);
            case "polygon" -> ctx.error(ErrorCode.MISSING_REQUIRED_PARAMETER, "polygon requires 'points'", node);
            case "text" -> ctx.error(ErrorCode.MISSING_REQUIRED_PARAMETER, "text requires 'text'", node);
            default -> ctx.error(ErrorCode.VALIDATION_ERROR, "Invalid " + name + " parameters", node);
        };
    }
}
