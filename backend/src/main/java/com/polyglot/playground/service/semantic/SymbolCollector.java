package com.polyglot.playground.service.semantic;

import com.polyglot.playground.dto.Token;
import com.polyglot.playground.dto.TokenCategory;
import com.polyglot.playground.language.LanguageProfile;

import java.util.List;
import java.util.Map;

/**
 * First semantic pass: walks the token stream once, opening and closing scopes, declaring the
 * names it recognizes and recording the scope every token was read in.
 */
abstract class SymbolCollector {

    private static final Map<String, String> PAIRS = Map.of("(", ")", "[", "]", "{", "}");

    protected final SemanticContext context;
    protected final List<Token> tokens;
    protected final LanguageProfile profile;
    protected final ScopeTree scopes;

    SymbolCollector(SemanticContext context) {
        this.context = context;
        this.tokens = context.tokens();
        this.profile = context.profile();
        this.scopes = context.scopes();
    }

    abstract void collect();

    protected Token at(int index) {
        return index >= 0 && index < tokens.size() ? tokens.get(index) : null;
    }

    /**
     * True when the token at {@code index} is punctuation or a word with the given text, compared
     * the way the language compares words. String literals never match.
     */
    protected boolean is(int index, String text) {
        Token token = at(index);
        if (token == null || token.category() == TokenCategory.STRING) {
            return false;
        }
        return profile.caseSensitive() ? token.hasText(text) : token.hasTextIgnoreCase(text);
    }

    protected boolean isAny(int index, String... texts) {
        for (String text : texts) {
            if (is(index, text)) {
                return true;
            }
        }
        return false;
    }

    protected boolean isIdentifier(int index) {
        Token token = at(index);
        return token != null && token.isIdentifier();
    }

    protected boolean isKeyword(int index) {
        Token token = at(index);
        return token != null && token.isKeyword();
    }

    protected String word(int index) {
        Token token = at(index);
        return token == null ? "" : profile.normalize(token.text());
    }

    protected boolean startsLine(int index) {
        return index == 0 || (at(index) != null && tokens.get(index - 1).line() < tokens.get(index).line());
    }

    /**
     * Index of the bracket closing the one at {@code openIndex}, or -1 when it is never closed.
     */
    protected int matching(int openIndex) {
        Token open = at(openIndex);
        if (open == null || !PAIRS.containsKey(open.text())) {
            return -1;
        }
        int depth = 0;
        for (int i = openIndex; i < tokens.size(); i++) {
            Token token = tokens.get(i);
            if (token.category() != TokenCategory.DELIMITER) {
                continue;
            }
            if (PAIRS.containsKey(token.text())) {
                depth++;
            } else if (PAIRS.containsValue(token.text())) {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return -1;
    }

    /**
     * Type of a single-token initializer: a literal, or a name whose declared type is known.
     */
    protected String valueType(int valueIndex) {
        Token value = at(valueIndex);
        if (value == null) {
            return null;
        }
        String literal = profile.literalType(value);
        if (literal != null) {
            return literal;
        }
        if (value.isIdentifier()) {
            return scopes.resolve(scopes.current(), value.text())
                    .map(entry -> entry.getKind().isCallable() ? entry.getReturnType() : entry.getDataType())
                    .orElse(null);
        }
        return null;
    }
}
