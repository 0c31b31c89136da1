package com.polyglot.playground.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Immutable lexeme with the position it started at. Offsets are zero based, lines and columns one based.
 */
public record Token(
        @JsonProperty("type") TokenKind kind,
        @JsonProperty("value") String text,
        int line,
        int column,
        @JsonProperty("position") int offset
) {

    @JsonProperty("category")
    public TokenCategory category() {
        return kind.category();
    }

    public boolean hasText(String candidate) {
        return text.equals(candidate);
    }

    public boolean hasTextIgnoreCase(String candidate) {
        return text.equalsIgnoreCase(candidate);
    }

    @JsonIgnore
    public boolean isComment() {
        return kind.category() == TokenCategory.COMMENT;
    }

    @JsonIgnore
    public boolean isIdentifier() {
        return kind == TokenKind.IDENTIFIER;
    }

    @JsonIgnore
    public boolean isKeyword() {
        return kind == TokenKind.KEYWORD;
    }

    @JsonIgnore
    public boolean isLiteral() {
        TokenCategory category = kind.category();
        return category == TokenCategory.NUMBER || category == TokenCategory.STRING;
    }

    @JsonIgnore
    public int endOffset() {
        return offset + text.length();
    }

    /**
     * Column just past the last character, valid for single-line lexemes.
     */
    @JsonIgnore
    public int endColumn() {
        return column + text.length();
    }
}
