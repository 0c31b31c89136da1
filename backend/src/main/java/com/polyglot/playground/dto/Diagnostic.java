package com.polyglot.playground.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record Diagnostic(
        @JsonProperty("type") Phase phase,
        String message,
        int line,
        int column,
        @JsonProperty("position") int offset,
        Severity severity,
        String context
) {

    public static Diagnostic error(Phase phase, String message, int line, int column, int offset) {
        return new Diagnostic(phase, message, line, column, offset, Severity.ERROR, null);
    }

    public static Diagnostic warning(Phase phase, String message, int line, int column, int offset) {
        return new Diagnostic(phase, message, line, column, offset, Severity.WARNING, null);
    }

    public static Diagnostic info(Phase phase, String message, int line, int column, int offset) {
        return new Diagnostic(phase, message, line, column, offset, Severity.INFO, null);
    }

    public static Diagnostic at(Phase phase, Severity severity, String message, Token token) {
        return new Diagnostic(phase, message, token.line(), token.column(), token.offset(), severity, null);
    }

    public Diagnostic withContext(String newContext) {
        return new Diagnostic(phase, message, line, column, offset, severity, newContext);
    }

    @JsonIgnore
    public boolean isError() {
        return severity == Severity.ERROR;
    }
}
