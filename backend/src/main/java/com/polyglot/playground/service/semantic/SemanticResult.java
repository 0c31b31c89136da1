package com.polyglot.playground.service.semantic;

import com.polyglot.playground.dto.Diagnostic;
import com.polyglot.playground.dto.SymbolEntry;

import java.util.List;

public record SemanticResult(List<Diagnostic> diagnostics, List<SymbolEntry> symbols) {

    public SemanticResult {
        diagnostics = List.copyOf(diagnostics);
        symbols = List.copyOf(symbols);
    }

    public long errorCount() {
        return diagnostics.stream().filter(Diagnostic::isError).count();
    }
}
