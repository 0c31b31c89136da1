package com.polyglot.playground.dto;

public enum TokenKind {
    LINE_COMMENT(TokenCategory.COMMENT),
    BLOCK_COMMENT(TokenCategory.COMMENT),

    DOUBLE_QUOTED_STRING(TokenCategory.STRING),
    SINGLE_QUOTED_STRING(TokenCategory.STRING),
    TEMPLATE_STRING(TokenCategory.STRING),
    CHAR_LITERAL(TokenCategory.STRING),

    HEX_NUMBER(TokenCategory.NUMBER),
    BINARY_NUMBER(TokenCategory.NUMBER),
    OCTAL_NUMBER(TokenCategory.NUMBER),
    DECIMAL_NUMBER(TokenCategory.NUMBER),
    INTEGER_NUMBER(TokenCategory.NUMBER),

    ARITHMETIC_OPERATOR(TokenCategory.OPERATOR),
    COMPARISON_OPERATOR(TokenCategory.OPERATOR),
    LOGICAL_OPERATOR(TokenCategory.OPERATOR),
    ASSIGNMENT_OPERATOR(TokenCategory.OPERATOR),
    BITWISE_OPERATOR(TokenCategory.OPERATOR),
    OPERATOR(TokenCategory.OPERATOR),

    LEFT_PAREN(TokenCategory.DELIMITER),
    RIGHT_PAREN(TokenCategory.DELIMITER),
    LEFT_BRACKET(TokenCategory.DELIMITER),
    RIGHT_BRACKET(TokenCategory.DELIMITER),
    LEFT_BRACE(TokenCategory.DELIMITER),
    RIGHT_BRACE(TokenCategory.DELIMITER),
    SEMICOLON(TokenCategory.DELIMITER),
    COMMA(TokenCategory.DELIMITER),
    DOT(TokenCategory.DELIMITER),
    COLON(TokenCategory.DELIMITER),

    KEYWORD(TokenCategory.RESERVED_WORD),
    IDENTIFIER(TokenCategory.IDENTIFIER),
    PREPROCESSOR_DIRECTIVE(TokenCategory.SYMBOL),
    SYMBOL(TokenCategory.SYMBOL);

    private final TokenCategory category;

    TokenKind(TokenCategory category) {
        this.category = category;
    }

    public TokenCategory category() {
        return category;
    }

    public static TokenKind delimiter(char symbol) {
        return switch (symbol) {
            case '(' -> LEFT_PAREN;
            case ')' -> RIGHT_PAREN;
            case '[' -> LEFT_BRACKET;
            case ']' -> RIGHT_BRACKET;
            case '{' -> LEFT_BRACE;
            case '}' -> RIGHT_BRACE;
            case ';' -> SEMICOLON;
            case ',' -> COMMA;
            case '.' -> DOT;
            case ':' -> COLON;
            default -> throw new IllegalArgumentException("Not a delimiter: " + symbol);
        };
    }
}
