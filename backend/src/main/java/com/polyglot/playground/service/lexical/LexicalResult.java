package com.polyglot.playground.service.lexical;

import com.polyglot.playground.dto.Diagnostic;
import com.polyglot.playground.dto.Token;

import java.util.List;

public record LexicalResult(List<Token> tokens, List<Diagnostic> diagnostics) {

    public LexicalResult {
        tokens = List.copyOf(tokens);
        diagnostics = List.copyOf(diagnostics);
    }

    public long errorCount() {
        return diagnostics.stream().filter(Diagnostic::isError).count();
    }
}
