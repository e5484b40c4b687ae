package org.openscad.cst;

import java.util.List;
import java.util.Optional;

/**
 * Read-only view of one node of a concrete syntax tree.
 * <p>
 * A CST keeps every token of the source. Named nodes are the grammar's rules and leaves
 * (identifiers, numbers, ...); anonymous nodes are punctuation and keywords, whose type is
 * their own text.
 */
public interface CstNode {

    /**
     * Type tag of this node, see {@link CstTypes}.
     */
    String type();

    /**
     * The source text covered by this node, whitespace and comments included.
     */
    String text();

    boolean isNamed();

    /**
     * True for nodes the parser created while recovering from a syntax error.
     */
    boolean isError();

    /**
     * True for tokens the parser inserted because the source lacked them.
     */
    boolean isMissing();

    /**
     * True if this node or any descendant is an error or missing node.
     */
    boolean hasError();

    List<CstNode> children();

    List<CstNode> namedChildren();

    Optional<CstNode> childForFieldName(String fieldName);

    CstPoint startPoint();

    CstPoint endPoint();

    default int childCount() {
        return children().size();
    }

    default int namedChildCount() {
        return namedChildren().size();
    }

    default CstNode namedChild(int index) {
        return namedChildren().get(index);
    }

    /**
     * First named child carrying the given type tag.
     */
    default Optional<CstNode> firstNamedChildOfType(String type) {
        for (CstNode child : namedChildren()) {
            if (child.type().equals(type)) {
                return Optional.of(child);
            }
        }
        return Optional.empty();
    }
}
