package com.polyglot.playground.dto;

import com.fasterxml.jackson.annotation.JsonValue;

public enum Phase {
    LEXICAL("lexico"),
    SYNTACTIC("sintactico"),
    SEMANTIC("semantico");

    private final String wireName;

    Phase(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
