package org.openscad.ast.node;

import java.util.List;

import org.openscad.ast.location.SourceRange;
import org.openscad.ast.node.visitor.AstVisitor;

/**
 * {@code [let(...) for (i = range, ...) if (condition) element]}. Nested {@code for} clauses are
 * flattened into {@code generators} in source order.
 */
public record ListComprehensionNode(List<Binding> lets,
                                    List<ForBinding> generators,
                                    ExpressionNode condition,
                                    ExpressionNode element,
                                    SourceRange location) implements ExpressionNode {

    public ListComprehensionNode {
        lets = List.copyOf(lets);
        generators = List.copyOf(generators);
    }

    @Override
    public NodeType type() {
        return NodeType.LIST_COMPREHENSION;
    }

    @Override
    public <R, A> R accept(AstVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }
}
