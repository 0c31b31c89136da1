package com.polyglot.playground.language;

import com.polyglot.playground.dto.Severity;

import java.util.List;
import java.util.Optional;
import java.util.Set;

final class JavaScriptProfile implements LanguageProfile {

    private static final Set<String> KEYWORDS = Vocabulary.words(
            "break", "case", "catch", "class", "const", "continue", "debugger", "default", "delete",
            "do", "else", "export", "extends", "finally", "for", "function", "if", "import", "in",
            "instanceof", "let", "new", "return", "super", "switch", "this", "throw", "try", "typeof",
            "var", "void", "while", "with", "yield", "async", "await", "static", "of",
            "true", "false", "null", "undefined");

    private static final List<String> OPERATORS = Vocabulary.longestFirst(
            Vocabulary.C_FAMILY_OPERATORS,
            List.of("**", "**=", "=>", "...", "?.", "??", "??=", "&&=", "||=", ">>>", ">>>="));

    private static final List<CommentStyle> COMMENTS = List.of(CommentStyle.DOUBLE_SLASH, CommentStyle.SLASH_STAR);

    private static final List<BuiltinSymbol> BUILTINS = List.of(
            BuiltinSymbol.object("console", "object"),
            BuiltinSymbol.object("window", "object"),
            BuiltinSymbol.object("document", "object"),
            BuiltinSymbol.object("globalThis", "object"),
            BuiltinSymbol.object("Math", "object"),
            BuiltinSymbol.object("JSON", "object"),
            BuiltinSymbol.object("process", "object"),
            BuiltinSymbol.object("module", "object"),
            BuiltinSymbol.object("exports", "object"),
            BuiltinSymbol.object("localStorage", "object"),
            BuiltinSymbol.object("arguments", "object"),
            BuiltinSymbol.constant("NaN", "number"),
            BuiltinSymbol.constant("Infinity", "number"),
            BuiltinSymbol.function("parseInt", "number"),
            BuiltinSymbol.function("parseFloat", "number"),
            BuiltinSymbol.function("isNaN", "boolean"),
            BuiltinSymbol.function("alert", "undefined"),
            BuiltinSymbol.function("prompt", "string"),
            BuiltinSymbol.function("setTimeout", "number"),
            BuiltinSymbol.function("setInterval", "number"),
            BuiltinSymbol.function("clearTimeout", "undefined"),
            BuiltinSymbol.function("clearInterval", "undefined"),
            BuiltinSymbol.function("fetch", "object"),
            BuiltinSymbol.function("require", "object"),
            BuiltinSymbol.type("Array"),
            BuiltinSymbol.type("Object"),
            BuiltinSymbol.type("String"),
            BuiltinSymbol.type("Number"),
            BuiltinSymbol.type("Boolean"),
            BuiltinSymbol.type("Promise"),
            BuiltinSymbol.type("Date"),
            BuiltinSymbol.type("Error"),
            BuiltinSymbol.type("Map"),
            BuiltinSymbol.type("Set"),
            BuiltinSymbol.type("RegExp"),
            BuiltinSymbol.type("Symbol"));

    private static final Set<String> STATEMENT_KEYWORDS = Vocabulary.words(
            "function", "var", "let", "const", "class", "if", "for", "while", "do", "return",
            "switch", "try", "throw", "import", "export", "break", "continue");

    @Override
    public Language language() {
        return Language.JAVASCRIPT;
    }

    @Override
    public Set<String> keywords() {
        return KEYWORDS;
    }

    @Override
    public List<String> operators() {
        return OPERATORS;
    }

    @Override
    public List<CommentStyle> commentStyles() {
        return COMMENTS;
    }

    @Override
    public List<BuiltinSymbol> builtinSymbols() {
        return BUILTINS;
    }

    @Override
    public TypeConversions typeConversions() {
        return TypeConversions.DYNAMIC;
    }

    @Override
    public Set<Character> stringQuotes() {
        return Set.of('"', '\'', '`');
    }

    @Override
    public Set<Character> multilineQuotes() {
        return Set.of('`');
    }

    @Override
    public boolean isIdentifierStart(char c) {
        return Character.isLetter(c) || c == '_' || c == '$';
    }

    @Override
    public boolean isIdentifierPart(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '$';
    }

    @Override
    public Set<String> statementKeywords() {
        return STATEMENT_KEYWORDS;
    }

    @Override
    public BlockStyle blockStyle() {
        return BlockStyle.BRACES;
    }

    @Override
    public Optional<Severity> undeclaredSeverity() {
        return Optional.of(Severity.WARNING);
    }

    @Override
    public boolean lazyBinding() {
        return true;
    }

    @Override
    public RedeclarationPolicy redeclarationPolicy() {
        return RedeclarationPolicy.FUNCTION_SCOPED_REBINDS;
    }
}
