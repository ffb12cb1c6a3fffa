package org.cexpr.cst;

import java.util.HashMap;
import java.util.Map;

/**
 * The node kinds the tree builder produces, keyed by their grammar tag. Tags outside this
 * set map to {@link #UNKNOWN}.
 */
public enum CstKind {
    TRANSLATION_UNIT("translation_unit"),
    EXPRESSION_STATEMENT("expression_statement"),
    ERROR("ERROR"),

    NUMBER_LITERAL("number_literal"),
    CHAR_LITERAL("char_literal"),
    STRING_LITERAL("string_literal"),
    CONCATENATED_STRING("concatenated_string"),
    TRUE("true"),
    FALSE("false"),
    IDENTIFIER("identifier"),
    QUALIFIED_IDENTIFIER("qualified_identifier"),
    FIELD_IDENTIFIER("field_identifier"),

    PARENTHESIZED_EXPRESSION("parenthesized_expression"),
    SIZEOF_EXPRESSION("sizeof_expression"),
    CAST_EXPRESSION("cast_expression"),
    MATH_EXPRESSION("math_expression"),
    LOGICAL_EXPRESSION("logical_expression"),
    RELATIONAL_EXPRESSION("relational_expression"),
    BITWISE_EXPRESSION("bitwise_expression"),
    EQUALITY_EXPRESSION("equality_expression"),
    BINARY_EXPRESSION("binary_expression"),
    SHIFT_EXPRESSION("shift_expression"),

    CALL_EXPRESSION("call_expression"),
    ARGUMENT_LIST("argument_list"),
    SUBSCRIPT_EXPRESSION("subscript_expression"),
    FIELD_EXPRESSION("field_expression"),
    UPDATE_EXPRESSION("update_expression"),
    POINTER_EXPRESSION("pointer_expression"),
    CONDITIONAL_EXPRESSION("conditional_expression"),
    ASSIGNMENT_EXPRESSION("assignment_expression"),

    TYPE_DESCRIPTOR("type_descriptor"),
    SIZED_TYPE_SPECIFIER("sized_type_specifier"),
    PRIMITIVE_TYPE("primitive_type"),
    TYPE_IDENTIFIER("type_identifier"),
    STRUCT_SPECIFIER("struct_specifier"),
    TYPE_QUALIFIER("type_qualifier"),
    ABSTRACT_POINTER_DECLARATOR("abstract_pointer_declarator"),

    UNKNOWN("");

    private static final Map<String, CstKind> BY_NAME = new HashMap<>();

    static {
        for (CstKind kind : values()) {
            if (kind != UNKNOWN) {
                BY_NAME.put(kind.kindName, kind);
            }
        }
    }

    private final String kindName;

    CstKind(String kindName) {
        this.kindName = kindName;
    }

    public String kindName() {
        return kindName;
    }

    public static CstKind fromName(String kindName) {
        return BY_NAME.getOrDefault(kindName, UNKNOWN);
    }
}
