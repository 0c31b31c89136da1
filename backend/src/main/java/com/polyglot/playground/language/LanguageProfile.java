package com.polyglot.playground.language;

import com.polyglot.playground.dto.Severity;
import com.polyglot.playground.dto.Token;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Static description of one language: its lexical tables, grammar hints and semantic policies.
 * Implementations hold only immutable data and are shared by every concurrent analysis.
 */
public interface LanguageProfile {

    Language language();

    /**
     * Reserved words, lower-cased when the language is case-insensitive.
     */
    Set<String> keywords();

    /**
     * Operators ordered longest first, so the first match is the longest match.
     */
    List<String> operators();

    List<CommentStyle> commentStyles();

    List<BuiltinSymbol> builtinSymbols();

    TypeConversions typeConversions();

    default boolean caseSensitive() {
        return true;
    }

    default String normalize(String name) {
        return caseSensitive() ? name : name.toLowerCase(Locale.ROOT);
    }

    default boolean isKeyword(String word) {
        return keywords().contains(normalize(word));
    }

    // lexical

    default Set<Character> stringQuotes() {
        return Set.of('"', '\'');
    }

    default Set<Character> multilineQuotes() {
        return Set.of();
    }

    default Set<String> stringPrefixes() {
        return Set.of();
    }

    default boolean tripleQuotedStrings() {
        return false;
    }

    default boolean backslashEscapes() {
        return true;
    }

    default boolean doubledQuoteEscapes() {
        return false;
    }

    default boolean charLiterals() {
        return false;
    }

    default boolean preprocessorDirectives() {
        return false;
    }

    default String numberSuffixes() {
        return "";
    }

    /**
     * Sigil that may start an identifier, such as {@code @} for T-SQL variables, or {@code 0} for none.
     */
    default char variablePrefix() {
        return 0;
    }

    /**
     * When set, identifier-shaped runs must look like natural words to be accepted.
     */
    default boolean strictWordRecognition() {
        return false;
    }

    default boolean isIdentifierStart(char c) {
        return Character.isLetter(c) || c == '_';
    }

    default boolean isIdentifierPart(char c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }

    // syntax

    /**
     * Words that begin a statement, used as synchronization points after a syntax error.
     */
    default Set<String> statementKeywords() {
        return Set.of();
    }

    /**
     * Markup elements that never take content or an end tag.
     */
    default Set<String> voidElements() {
        return Set.of();
    }

    default Set<String> blockOpeners() {
        return Set.of();
    }

    default boolean opensBlock(List<Token> tokens, int index) {
        Token token = tokens.get(index);
        return token.isKeyword() && blockOpeners().contains(normalize(token.text()));
    }

    default boolean closesBlock(List<Token> tokens, int index) {
        Token token = tokens.get(index);
        return token.isKeyword() && normalize(token.text()).equals("end");
    }

    // semantic

    default BlockStyle blockStyle() {
        return BlockStyle.NONE;
    }

    /**
     * Severity for uses of names that resolve nowhere; empty when the language is not checked.
     */
    default Optional<Severity> undeclaredSeverity() {
        return Optional.empty();
    }

    default boolean tracksIdentifier(Token token) {
        return true;
    }

    default boolean checksDeclarationOrder() {
        return false;
    }

    /**
     * Languages that bind names lazily skip unused and uninitialized variable checks.
     */
    default boolean lazyBinding() {
        return false;
    }

    default RedeclarationPolicy redeclarationPolicy() {
        return RedeclarationPolicy.ALWAYS_REPORT;
    }

    default String assignmentOperator() {
        return "=";
    }

    /**
     * Routines whose arguments are written to, such as {@code readln}.
     */
    default Set<String> inputFunctions() {
        return Set.of();
    }

    /**
     * Type name of a literal token in this language's vocabulary, or null if the token is no literal.
     */
    default String literalType(Token token) {
        return switch (token.category()) {
            case NUMBER -> "number";
            case STRING -> "string";
            default -> isBooleanLiteral(token) ? "boolean" : null;
        };
    }

    default boolean isBooleanLiteral(Token token) {
        return token.isKeyword() && (token.hasTextIgnoreCase("true") || token.hasTextIgnoreCase("false"));
    }
}
