package com.polyglot.playground.service.syntax;

import com.polyglot.playground.dto.Diagnostic;
import com.polyglot.playground.dto.ParseNode;

import java.util.List;

public record SyntaxResult(List<ParseNode> nodes, List<Diagnostic> diagnostics) {

    public SyntaxResult {
        nodes = List.copyOf(nodes);
        diagnostics = List.copyOf(diagnostics);
    }

    public long errorCount() {
        return diagnostics.stream().filter(Diagnostic::isError).count();
    }
}
