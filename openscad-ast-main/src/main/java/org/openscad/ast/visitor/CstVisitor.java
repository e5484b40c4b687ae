package org.openscad.ast.visitor;

import org.openscad.cst.CstNode;

/**
 * Lowers the CST node kinds of one syntactic category to AST nodes.
 * <p>
 * Implementations hold no state of their own: everything a lowering needs, including the way back
 * into the dispatcher for nested nodes, comes from the {@link VisitContext}. They never modify the
 * CST.
 */
public interface CstVisitor {

    VisitorCategory category();

    VisitResult visit(CstNode node, VisitContext context);
}
