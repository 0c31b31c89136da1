package com.polyglot.playground.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ExecutionTrace(
        boolean success,
        String output,
        List<String> errors,
        List<String> executedCommands
) {

    public ExecutionTrace {
        errors = errors == null ? List.of() : List.copyOf(errors);
        executedCommands = executedCommands == null ? List.of() : List.copyOf(executedCommands);
    }

    public static ExecutionTrace success(String output, List<String> executedCommands) {
        return new ExecutionTrace(true, output, List.of(), executedCommands);
    }

    public static ExecutionTrace failure(String error) {
        return new ExecutionTrace(false, "", List.of(error), List.of());
    }

    @JsonProperty("error")
    public String error() {
        return errors.isEmpty() ? null : String.join("; ", errors);
    }
}
