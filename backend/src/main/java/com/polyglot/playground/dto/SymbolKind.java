package com.polyglot.playground.dto;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum SymbolKind {
    VARIABLE,
    FUNCTION,
    CLASS,
    CONSTANT,
    PARAMETER,
    METHOD,
    KEYWORD;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean isCallable() {
        return this == FUNCTION || this == METHOD;
    }

    public boolean holdsValue() {
        return this == VARIABLE || this == CONSTANT || this == PARAMETER;
    }
}
