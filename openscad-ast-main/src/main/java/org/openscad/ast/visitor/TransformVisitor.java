package org.openscad.ast.visitor;

import java.util.List;
import java.util.Set;

import org.openscad.ast.diagnostics.DiagnosticSink;
import org.openscad.ast.extraction.Parameter;
import org.openscad.ast.extractor.TransformExtractor;
import org.openscad.ast.location.SourceRange;
import org.openscad.ast.node.AstNode;
import org.openscad.cst.CstNode;

/**
 * Transforms and extrusions. Their body is lowered first and becomes the node's children.
 */
public class TransformVisitor extends InstantiationVisitor {

    public TransformVisitor() {
        super(Set.of("translate", "rotate", "scale", "mirror", "multmatrix", "color", "offset", "resize",
                "linear_extrude", "rotate_extrude"));
    }

    @Override
    public VisitorCategory category() {
        return VisitorCategory.TRANSFORM;
    }

    @Override
    protected AstNode lower(String name, CstNode node, VisitContext ctx) {
        List<Parameter> parameters = CstSupport.argumentList(node).map(ctx::parameters).orElse(List.of());
        List<AstNode> children = CstSupport.body(node).map(ctx::lowerBody).orElse(List.of());
        SourceRange location = ctx.location(node);
        DiagnosticSink sink = ctx.getSink();

        return switch (name) {
            case "translate" -> TransformExtractor.translate(parameters, children, location, sink);
            case "rotate" -> TransformExtractor.rotate(parameters, children, location, sink);
            case "scale" -> TransformExtractor.scale(parameters, children, location, sink);
            case "mirror" -> TransformExtractor.mirror(parameters, children, location, sink);
            case "multmatrix" -> TransformExtractor.multmatrix(parameters, children, location, sink);
            case "color" -> TransformExtractor.color(parameters, children, location, sink);
            case "offset" -> TransformExtractor.offset(parameters, children, location, sink);
            case "resize" -> TransformExtractor.resize(parameters, children, location, sink);
            case "linear_extrude" -> TransformExtractor.linearExtrude(parameters, children, location, sink);
            case "rotate_extrude" -> TransformExtractor.rotateExtrude(parameters, children, location, sink);
            default -> throw new IllegalArgumentException("Not a transform: " + name);
        };
    }
}
