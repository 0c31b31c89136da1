package com.polyglot.playground.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.polyglot.playground.language.Language;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record AnalysisReport(
        Language language,
        List<Token> tokens,
        List<ParseNode> parseTree,
        List<SymbolEntry> symbolTable,
        List<Diagnostic> errors,
        boolean canExecute,
        AnalysisPhases analysisPhases,
        ExecutionTrace executionResult,
        List<EditorMarker> markers,
        long processingTimeMs
) {

    public List<Diagnostic> diagnosticsOf(Phase phase) {
        return errors.stream().filter(diagnostic -> diagnostic.phase() == phase).toList();
    }

    public long errorCount(Phase phase) {
        return errors.stream()
                .filter(diagnostic -> diagnostic.phase() == phase && diagnostic.isError())
                .count();
    }
}
