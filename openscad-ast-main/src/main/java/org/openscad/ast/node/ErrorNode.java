package org.openscad.ast.node;

import java.util.Objects;

import org.openscad.ast.location.SourceRange;
import org.openscad.ast.node.visitor.AstVisitor;

/**
 * Stands in for a CST node that could not be lowered. It takes the place of the node it replaces,
 * so it may appear wherever a statement or an expression may.
 *
 * @param errorCode        code from {@code ErrorCode}, e.g. {@code E301_MISSING_CYLINDER_H}
 * @param message          what went wrong
 * @param originalNodeType type of the CST node that failed
 * @param cstNodeText      source text of that node
 * @param cause            exception behind the failure, if any; not part of equality, so two
 *                         lowerings of the same failing node compare equal
 */
public record ErrorNode(String errorCode,
                        String message,
                        String originalNodeType,
                        String cstNodeText,
                        Throwable cause,
                        SourceRange location) implements ExpressionNode {

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ErrorNode other)) {
            return false;
        }
        return Objects.equals(errorCode, other.errorCode)
                && Objects.equals(message, other.message)
                && Objects.equals(originalNodeType, other.originalNodeType)
                && Objects.equals(cstNodeText, other.cstNodeText)
                && Objects.equals(location, other.location);
    }

    @Override
    public int hashCode() {
        return Objects.hash(errorCode, message, originalNodeType, cstNodeText, location);
    }

    @Override
    public NodeType type() {
        return NodeType.ERROR;
    }

    @Override
    public <R, A> R accept(AstVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }
}
