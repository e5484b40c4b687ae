package org.openscad.ast.node;

public enum NodeType {

    // primitives
    CUBE("cube"),
    SPHERE("sphere"),
    CYLINDER("cylinder"),
    POLYHEDRON("polyhedron"),
    POLYGON("polygon"),
    CIRCLE("circle"),
    SQUARE("square"),
    TEXT("text"),

    // transforms and extrusions
    TRANSLATE("translate"),
    ROTATE("rotate"),
    SCALE("scale"),
    MIRROR("mirror"),
    MULTMATRIX("multmatrix"),
    COLOR("color"),
    OFFSET("offset"),
    RESIZE("resize"),
    LINEAR_EXTRUDE("linear_extrude"),
    ROTATE_EXTRUDE("rotate_extrude"),

    // boolean operations
    UNION("union"),
    DIFFERENCE("difference"),
    INTERSECTION("intersection"),
    HULL("hull"),
    MINKOWSKI("minkowski"),

    // control structures
    IF("if"),
    FOR_LOOP("for_loop"),
    LET("let"),
    EACH("each"),

    // definitions and statements
    MODULE_DEFINITION("module_definition"),
    FUNCTION_DEFINITION("function_definition"),
    ASSIGNMENT("assignment"),
    MODULE_INSTANTIATION("module_instantiation"),
    CHILDREN("children"),
    ECHO("echo"),
    ASSERT("assert"),
    INCLUDE("include"),
    USE("use"),
    MODIFIER("modifier"),

    // expressions
    LITERAL("literal"),
    VARIABLE("variable"),
    BINARY("binary"),
    UNARY("unary"),
    CONDITIONAL("conditional"),
    VECTOR("vector"),
    INDEX("index"),
    MEMBER("member"),
    RANGE("range"),
    LET_EXPRESSION("let_expression"),
    LIST_COMPREHENSION("list_comprehension"),
    FUNCTION_CALL("function_call"),
    FUNCTION_LITERAL("function_literal"),

    ERROR("error");

    private final String tag;

    NodeType(String tag) {
        this.tag = tag;
    }

    public String getTag() {
        return tag;
    }
}
