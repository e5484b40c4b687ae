package org.openscad.cst;

/**
 * Type tags of the CST nodes produced by the OpenSCAD grammar.
 */
public final class CstTypes {

    public static final String SOURCE_FILE = "source_file";
    public static final String STATEMENT = "statement";
    public static final String BLOCK = "block";
    public static final String INCLUDE_STATEMENT = "include_statement";
    public static final String USE_STATEMENT = "use_statement";
    public static final String MODULE_DEFINITION = "module_definition";
    public static final String FUNCTION_DEFINITION = "function_definition";
    public static final String PARAMETER_LIST = "parameter_list";
    public static final String PARAMETER_DECLARATION = "parameter_declaration";
    public static final String ASSIGNMENT_STATEMENT = "assignment_statement";
    public static final String MODULE_INSTANTIATION = "module_instantiation";
    public static final String MODIFIER = "modifier";
    public static final String ARGUMENT_LIST = "argument_list";
    public static final String ARGUMENTS = "arguments";
    public static final String ARGUMENT = "argument";
    public static final String NAMED_ARGUMENT = "named_argument";
    public static final String IF_STATEMENT = "if_statement";
    public static final String FOR_STATEMENT = "for_statement";
    public static final String FOR_ASSIGNMENT = "for_assignment";
    public static final String LET_STATEMENT = "let_statement";
    public static final String LET_ASSIGNMENT = "let_assignment";
    public static final String ECHO_STATEMENT = "echo_statement";
    public static final String ASSERT_STATEMENT = "assert_statement";

    public static final String EXPRESSION = "expression";
    public static final String INDEX_EXPRESSION = "index_expression";
    public static final String MEMBER_EXPRESSION = "member_expression";
    public static final String CALL_EXPRESSION = "call_expression";
    public static final String UNARY_EXPRESSION = "unary_expression";
    public static final String BINARY_EXPRESSION = "binary_expression";
    public static final String CONDITIONAL_EXPRESSION = "conditional_expression";
    public static final String LET_EXPRESSION = "let_expression";
    public static final String FUNCTION_LITERAL = "function_literal";
    public static final String EACH_EXPRESSION = "each_expression";
    public static final String PARENTHESIZED_EXPRESSION = "parenthesized_expression";
    public static final String RANGE_EXPRESSION = "range_expression";
    public static final String LIST_COMPREHENSION = "list_comprehension";
    public static final String LIST_COMPREHENSION_FOR = "list_comprehension_for";
    public static final String LIST_COMPREHENSION_LET = "list_comprehension_let";
    public static final String VECTOR_EXPRESSION = "vector_expression";
    public static final String PRIMARY_EXPRESSION = "primary_expression";

    public static final String NUMBER = "number";
    public static final String STRING = "string";
    public static final String BOOLEAN = "bool";
    public static final String UNDEF = "undef";
    public static final String IDENTIFIER = "identifier";
    public static final String SPECIAL_VARIABLE = "special_variable";

    public static final String ERROR = "ERROR";

    private CstTypes() {
    }
}
