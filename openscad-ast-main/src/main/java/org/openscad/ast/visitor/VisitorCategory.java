package org.openscad.ast.visitor;

/**
 * Syntactic category a {@link CstVisitor} covers. The declaration order is the order in which the
 * {@link CompositeDispatcher} consults visitors.
 */
public enum VisitorCategory {
    PRIMITIVE,
    TRANSFORM,
    BOOLEAN_OPERATION,
    CONTROL_STRUCTURE,
    EXPRESSION,
    DEFINITION,
    STATEMENT
}
