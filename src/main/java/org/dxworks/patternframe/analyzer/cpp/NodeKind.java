package org.dxworks.patternframe.analyzer.cpp;

import org.dxworks.patternframe.syntax.SyntaxNode;

import java.util.HashMap;
import java.util.Map;

/**
 * The tree-sitter-cpp node types the extractor distinguishes. Every other type is {@link #OTHER}.
 */
public enum NodeKind {
    STRING_LITERAL("string_literal"),
    CHAR_LITERAL("char_literal"),
    CONCATENATED_STRING("concatenated_string"),
    USER_DEFINED_LITERAL("user_defined_literal"),
    LITERAL_SUFFIX("literal_suffix"),
    NUMBER_LITERAL("number_literal"),
    TRUE("true"),
    FALSE("false"),
    IDENTIFIER("identifier"),
    QUALIFIED_IDENTIFIER("qualified_identifier"),
    TYPE_IDENTIFIER("type_identifier"),
    CALL_EXPRESSION("call_expression"),
    FIELD_EXPRESSION("field_expression"),
    SUBSCRIPT_EXPRESSION("subscript_expression"),
    POINTER_EXPRESSION("pointer_expression"),
    PARENTHESIZED_EXPRESSION("parenthesized_expression"),
    BINARY_EXPRESSION("binary_expression"),
    DECLARATION("declaration"),
    INIT_DECLARATOR("init_declarator"),
    PARAMETER_DECLARATION("parameter_declaration"),
    REFERENCE_DECLARATOR("reference_declarator"),
    POINTER_DECLARATOR("pointer_declarator"),
    ASSIGN("="),
    COMMENT("comment"),
    ERROR("ERROR"),
    OTHER(null);

    private static final Map<String, NodeKind> BY_TYPE = new HashMap<>();

    static {
        for (NodeKind kind : values()) {
            if (kind.type != null) {
                BY_TYPE.put(kind.type, kind);
            }
        }
    }

    private final String type;

    NodeKind(String type) {
        this.type = type;
    }

    public String getType() {
        return type;
    }

    public static NodeKind of(String type) {
        return BY_TYPE.getOrDefault(type, OTHER);
    }

    public static NodeKind of(SyntaxNode node) {
        return of(node.getType());
    }
}
