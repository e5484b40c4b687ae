package org.openscad.ast.visitor;

import java.util.List;
import java.util.Set;

import org.openscad.ast.location.SourceRange;
import org.openscad.ast.node.AstNode;
import org.openscad.ast.node.DifferenceNode;
import org.openscad.ast.node.HullNode;
import org.openscad.ast.node.IntersectionNode;
import org.openscad.ast.node.MinkowskiNode;
import org.openscad.ast.node.UnionNode;
import org.openscad.cst.CstNode;

/**
 * Boolean operations and convex combinations: {@code union}, {@code difference},
 * {@code intersection}, {@code hull} and {@code minkowski}.
 */
public class CsgVisitor extends InstantiationVisitor {

    public CsgVisitor() {
        super(Set.of("union", "difference", "intersection", "hull", "minkowski"));
    }

    @Override
    public VisitorCategory category() {
        return VisitorCategory.BOOLEAN_OPERATION;
    }

    @Override
    protected AstNode lower(String name, CstNode node, VisitContext ctx) {
        SourceRange location = ctx.location(node);
        CstSupport.argumentList(node)
                .filter(arguments -> arguments.namedChildCount() > 0)
                .ifPresent(arguments -> ctx.getSink().debug("Ignoring arguments of " + name, name, location));
        List<AstNode> children = CstSupport.body(node).map(ctx::lowerBody).orElse(List.of());
        return switch (name) {
            case "union" -> new UnionNode(children, location);
            case "difference" -> new DifferenceNode(children, location);
            case "intersection" -> new IntersectionNode(children, location);
            case "hull" -> new HullNode(children, location);
            case "minkowski" -> new MinkowskiNode(children, location);
            default -> throw new IllegalArgumentException("Not a boolean operation: " + name);
        };
    }
}
