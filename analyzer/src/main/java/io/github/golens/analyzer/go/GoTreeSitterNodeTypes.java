package io.github.golens.analyzer.go;

/** Node type names of the tree-sitter Go grammar that the analyzer inspects. */
public final class GoTreeSitterNodeTypes {

    // File structure
    public static final String SOURCE_FILE = "source_file";
    public static final String PACKAGE_CLAUSE = "package_clause";
    public static final String PACKAGE_IDENTIFIER = "package_identifier";
    public static final String COMMENT = "comment";
    public static final String ERROR = "ERROR";

    // Imports
    public static final String IMPORT_DECLARATION = "import_declaration";
    public static final String IMPORT_SPEC = "import_spec";
    public static final String IMPORT_SPEC_LIST = "import_spec_list";

    // Declarations
    public static final String CONST_DECLARATION = "const_declaration";
    public static final String CONST_SPEC = "const_spec";
    public static final String VAR_DECLARATION = "var_declaration";
    public static final String VAR_SPEC = "var_spec";
    public static final String VAR_SPEC_LIST = "var_spec_list";
    public static final String TYPE_DECLARATION = "type_declaration";
    public static final String TYPE_SPEC = "type_spec";
    public static final String TYPE_ALIAS = "type_alias";
    public static final String FUNCTION_DECLARATION = "function_declaration";
    public static final String METHOD_DECLARATION = "method_declaration";

    // Types
    public static final String STRUCT_TYPE = "struct_type";
    public static final String INTERFACE_TYPE = "interface_type";
    public static final String FUNCTION_TYPE = "function_type";
    public static final String POINTER_TYPE = "pointer_type";
    public static final String GENERIC_TYPE = "generic_type";
    public static final String QUALIFIED_TYPE = "qualified_type";
    public static final String TYPE_IDENTIFIER = "type_identifier";
    public static final String FIELD_DECLARATION_LIST = "field_declaration_list";
    public static final String FIELD_DECLARATION = "field_declaration";
    public static final String METHOD_ELEM = "method_elem";
    public static final String METHOD_SPEC = "method_spec";
    public static final String TYPE_ELEM = "type_elem";
    public static final String CONSTRAINT_ELEM = "constraint_elem";
    public static final String INTERFACE_TYPE_NAME = "interface_type_name";

    // Parameters
    public static final String PARAMETER_LIST = "parameter_list";
    public static final String PARAMETER_DECLARATION = "parameter_declaration";
    public static final String VARIADIC_PARAMETER_DECLARATION = "variadic_parameter_declaration";

    // Statements
    public static final String BLOCK = "block";
    public static final String STATEMENT_LIST = "statement_list";
    public static final String EXPRESSION_STATEMENT = "expression_statement";
    public static final String ASSIGNMENT_STATEMENT = "assignment_statement";
    public static final String SHORT_VAR_DECLARATION = "short_var_declaration";
    public static final String INC_STATEMENT = "inc_statement";
    public static final String DEC_STATEMENT = "dec_statement";
    public static final String IF_STATEMENT = "if_statement";
    public static final String FOR_STATEMENT = "for_statement";
    public static final String FOR_CLAUSE = "for_clause";
    public static final String RANGE_CLAUSE = "range_clause";
    public static final String EXPRESSION_SWITCH_STATEMENT = "expression_switch_statement";
    public static final String TYPE_SWITCH_STATEMENT = "type_switch_statement";
    public static final String EXPRESSION_CASE = "expression_case";
    public static final String TYPE_CASE = "type_case";
    public static final String DEFAULT_CASE = "default_case";
    public static final String SELECT_STATEMENT = "select_statement";
    public static final String COMMUNICATION_CASE = "communication_case";
    public static final String RETURN_STATEMENT = "return_statement";
    public static final String GO_STATEMENT = "go_statement";
    public static final String DEFER_STATEMENT = "defer_statement";
    public static final String BREAK_STATEMENT = "break_statement";
    public static final String CONTINUE_STATEMENT = "continue_statement";
    public static final String GOTO_STATEMENT = "goto_statement";
    public static final String FALLTHROUGH_STATEMENT = "fallthrough_statement";
    public static final String LABELED_STATEMENT = "labeled_statement";
    public static final String LABEL_NAME = "label_name";
    public static final String SEND_STATEMENT = "send_statement";

    // Expressions
    public static final String EXPRESSION_LIST = "expression_list";
    public static final String CALL_EXPRESSION = "call_expression";
    public static final String ARGUMENT_LIST = "argument_list";
    public static final String SELECTOR_EXPRESSION = "selector_expression";
    public static final String IDENTIFIER = "identifier";
    public static final String FIELD_IDENTIFIER = "field_identifier";
    public static final String FUNC_LITERAL = "func_literal";
    public static final String PARENTHESIZED_EXPRESSION = "parenthesized_expression";

    private GoTreeSitterNodeTypes() {}
}
