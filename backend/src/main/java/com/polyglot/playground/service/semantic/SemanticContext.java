package com.polyglot.playground.service.semantic;

import com.polyglot.playground.dto.Diagnostic;
import com.polyglot.playground.dto.Phase;
import com.polyglot.playground.dto.Severity;
import com.polyglot.playground.dto.SymbolEntry;
import com.polyglot.playground.dto.SymbolKind;
import com.polyglot.playground.dto.Token;
import com.polyglot.playground.language.BuiltinSymbol;
import com.polyglot.playground.language.LanguageProfile;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Mutable state of one semantic run: the scope arena, the append-only symbol table, the scope
 * each token was read in and the diagnostics found so far. Never shared between runs.
 */
final class SemanticContext {

    private static final Logger logger = LoggerFactory.getLogger(SemanticContext.class);

    private final List<Token> tokens;
    private final LanguageProfile profile;
    private final ScopeTree scopes;
    private final List<SymbolEntry> symbols = new ArrayList<>();
    private final List<Diagnostic> diagnostics = new ArrayList<>();
    private final int[] scopeAt;
    private final boolean[] declarationSites;

    SemanticContext(List<Token> tokens, LanguageProfile profile) {
        this.tokens = tokens;
        this.profile = profile;
        this.scopes = new ScopeTree(profile.caseSensitive());
        this.scopeAt = new int[tokens.size()];
        this.declarationSites = new boolean[tokens.size()];
    }

    List<Token> tokens() {
        return tokens;
    }

    LanguageProfile profile() {
        return profile;
    }

    ScopeTree scopes() {
        return scopes;
    }

    List<SymbolEntry> symbols() {
        return Collections.unmodifiableList(symbols);
    }

    void seedBuiltins() {
        for (BuiltinSymbol builtin : profile.builtinSymbols()) {
            SymbolEntry entry = builtin.toEntry();
            scopes.define(ScopeTree.GLOBAL, entry);
            symbols.add(entry);
        }
    }

    /**
     * Declares the name at {@code tokenIndex} in the active scope.
     */
    SymbolEntry declare(int tokenIndex, SymbolKind kind, String dataType, String keyword) {
        return declareIn(scopes.current(), tokenIndex, kind, dataType, keyword);
    }

    /**
     * Declares a name in the given scope. A second declaration of the same name in that scope is
     * reported unless the language's redeclaration policy permits it; either way the first entry
     * is kept and returned.
     */
    SymbolEntry declareIn(int scopeIndex, int tokenIndex, SymbolKind kind, String dataType, String keyword) {
        return declareIn(scopeIndex, tokenIndex, tokens.get(tokenIndex).text(), kind, dataType, keyword);
    }

    /**
     * Declares {@code name}, which need not be the token's own text, at the token's position.
     */
    SymbolEntry declareIn(int scopeIndex, int tokenIndex, String name, SymbolKind kind, String dataType,
                          String keyword) {
        Token token = tokens.get(tokenIndex);
        markSite(tokenIndex);
        Optional<SymbolEntry> existing = scopes.lookupLocal(scopeIndex, name);
        if (existing.isPresent() && !existing.get().isBuiltin()) {
            SymbolEntry previous = existing.get();
            if (!profile.redeclarationPolicy().permits(previous.getDeclarationKeyword(), keyword)) {
                report(Severity.ERROR, "'" + name + "' is already declared in scope '"
                                + scopes.scope(scopeIndex).name() + "'", token,
                        "Previous declaration at line " + previous.getLine());
            }
            return previous;
        }
        SymbolEntry entry = new SymbolEntry(name, kind, dataType, scopes.scope(scopeIndex).name(),
                scopeIndex, token.line(), token.column(), tokenIndex);
        entry.setDeclarationKeyword(keyword);
        scopes.define(scopeIndex, entry);
        symbols.add(entry);
        return entry;
    }

    void recordScope(int tokenIndex) {
        scopeAt[tokenIndex] = scopes.current();
    }

    int scopeAt(int tokenIndex) {
        return scopeAt[tokenIndex];
    }

    /**
     * Marks a token as a name being declared or a name outside the program's own bindings, such
     * as a unit or record field; the verification pass skips it.
     */
    void markSite(int tokenIndex) {
        declarationSites[tokenIndex] = true;
    }

    boolean isSite(int tokenIndex) {
        return declarationSites[tokenIndex];
    }

    void report(Severity severity, String message, Token at, String context) {
        Diagnostic diagnostic = Diagnostic.at(Phase.SEMANTIC, severity, message, at);
        diagnostics.add(context == null ? diagnostic : diagnostic.withContext(context));
    }

    void report(Diagnostic diagnostic) {
        diagnostics.add(diagnostic);
    }

    long errorCount() {
        return diagnostics.stream().filter(Diagnostic::isError).count();
    }

    /**
     * Runs one check; a runtime failure inside it becomes a single informational diagnostic so the
     * remaining checks still run.
     */
    void guarded(String check, Runnable action) {
        try {
            action.run();
        } catch (RuntimeException e) {
            logger.warn("Semantic check '{}' failed for {}: {}", check, profile.language().tag(), e.toString());
            diagnostics.add(Diagnostic.info(Phase.SEMANTIC,
                    "Error verifying " + check + ": " + e.getMessage(), 1, 1, 0));
        }
    }

    List<Diagnostic> sortedDiagnostics() {
        List<Diagnostic> copy = new ArrayList<>(diagnostics);
        copy.sort(Comparator.comparingInt(Diagnostic::offset));
        return copy;
    }
}
