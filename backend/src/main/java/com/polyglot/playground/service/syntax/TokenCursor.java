package com.polyglot.playground.service.syntax;

import com.polyglot.playground.dto.Token;
import com.polyglot.playground.dto.TokenCategory;
import com.polyglot.playground.language.LanguageProfile;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Read position over the comment-free token list. Every step spends from a budget proportional to
 * the input, so a grammar rule that stops making progress still terminates.
 */
final class TokenCursor {

    private final List<Token> tokens;
    private final LanguageProfile profile;
    private final Map<Integer, Integer> lineIndents = new HashMap<>();
    private int index;
    private long budget;

    TokenCursor(List<Token> tokens, LanguageProfile profile) {
        this.tokens = tokens;
        this.profile = profile;
        this.budget = (long) tokens.size() * 4 + 16;
        for (Token token : tokens) {
            lineIndents.putIfAbsent(token.line(), token.column());
        }
    }

    boolean atEnd() {
        return index >= tokens.size() || budget <= 0;
    }

    /**
     * Spends one unit of the budget. Loops that may not consume a token call this on every turn.
     */
    void tick() {
        budget--;
    }

    Token peek() {
        return peek(0);
    }

    Token peek(int ahead) {
        int at = index + ahead;
        return at >= 0 && at < tokens.size() ? tokens.get(at) : null;
    }

    Token previous() {
        return index > 0 ? tokens.get(Math.min(index, tokens.size()) - 1) : null;
    }

    Token advance() {
        Token token = peek();
        if (token != null) {
            index++;
        }
        budget--;
        return token;
    }

    int position() {
        return index;
    }

    boolean check(String text) {
        return checkAt(0, text);
    }

    boolean checkAt(int ahead, String text) {
        Token token = peek(ahead);
        if (token == null || token.category() == TokenCategory.STRING) {
            return false;
        }
        return profile.caseSensitive() ? token.hasText(text) : token.hasTextIgnoreCase(text);
    }

    boolean checkAny(String... texts) {
        for (String text : texts) {
            if (check(text)) {
                return true;
            }
        }
        return false;
    }

    boolean checkCategory(TokenCategory category) {
        Token token = peek();
        return token != null && token.category() == category;
    }

    boolean match(String text) {
        if (check(text)) {
            advance();
            return true;
        }
        return false;
    }

    /**
     * True when the current token starts a later line than the one before it.
     */
    boolean onNewLine() {
        Token current = peek();
        Token before = previous();
        return current != null && before != null && current.line() > before.line();
    }

    /**
     * Column of the first token on the line of {@code token}.
     */
    int indentOf(Token token) {
        return lineIndents.getOrDefault(token.line(), token.column());
    }

    Token last() {
        return tokens.isEmpty() ? null : tokens.get(tokens.size() - 1);
    }

    int size() {
        return tokens.size();
    }
}
