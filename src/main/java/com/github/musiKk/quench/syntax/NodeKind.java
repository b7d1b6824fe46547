package com.github.musiKk.quench.syntax;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.experimental.Accessors;

@RequiredArgsConstructor
public enum NodeKind {
    SOURCE_FILE("source_file"),
    DECLARATION("declaration"),
    EXPRESSION_STATEMENT("expression_statement"),

    IDENTIFIER("identifier"),
    BLOCK("block"),
    CALL("call"),
    FUNCTION("function"),
    INDEX("index"),
    FIELD("field"),
    PARENTHESIZED_EXPRESSION("parenthesized_expression"),

    NULL("null"),
    BOOLEAN("boolean"),
    INTEGER("integer"),
    STRING("string"),
    SYMBOL("symbol"),
    LIST("list"),
    MAP("map"),
    PAIR("pair"),

    ERROR("ERROR");

    @Accessors(fluent = true)
    @Getter
    private final String debugName;

    public boolean isStatement() {
        return this == DECLARATION || this == EXPRESSION_STATEMENT;
    }
}
