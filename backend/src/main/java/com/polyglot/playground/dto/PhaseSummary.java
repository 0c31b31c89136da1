package com.polyglot.playground.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record PhaseSummary(
        boolean completed,
        Integer tokensFound,
        Integer nodesGenerated,
        Integer symbolsFound,
        int errorsFound
) {

    public static PhaseSummary lexical(boolean completed, int tokensFound, int errorsFound) {
        return new PhaseSummary(completed, tokensFound, null, null, errorsFound);
    }

    public static PhaseSummary syntax(boolean completed, int nodesGenerated, int errorsFound) {
        return new PhaseSummary(completed, null, nodesGenerated, null, errorsFound);
    }

    public static PhaseSummary semantic(boolean completed, int symbolsFound, int errorsFound) {
        return new PhaseSummary(completed, null, null, symbolsFound, errorsFound);
    }

    public static PhaseSummary notRun() {
        return new PhaseSummary(false, null, null, null, 0);
    }
}
