package com.polyglot.playground.dto;

public enum TokenCategory {
    RESERVED_WORD,
    IDENTIFIER,
    NUMBER,
    STRING,
    OPERATOR,
    DELIMITER,
    COMMENT,
    SYMBOL
}
