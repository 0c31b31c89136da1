package com.polyglot.playground.dto;

public record AnalysisPhases(
        PhaseSummary lexical,
        PhaseSummary syntax,
        PhaseSummary semantic
) {
}
