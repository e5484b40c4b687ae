package org.openscad.ast.node;

import java.util.List;

import org.openscad.ast.location.SourceRange;
import org.openscad.ast.node.visitor.AstVisitor;

/**
 * {@code translate(v)}. The offset always has three components.
 */
public record TranslateNode(List<Double> v,
                            List<AstNode> children, SourceRange location) implements ParentNode {

    public TranslateNode {
        v = List.copyOf(v);
        children = List.copyOf(children);
    }

    @Override
    public NodeType type() {
        return NodeType.TRANSLATE;
    }

    @Override
    public <R, A> R accept(AstVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }
}
