package com.polyglot.playground.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ParseNode(
        @JsonProperty("type") String kind,
        String value,
        List<ParseNode> children,
        int line,
        int column
) {

    public ParseNode {
        children = children == null ? List.of() : List.copyOf(children);
    }

    public static ParseNode of(String kind, String value, Token anchor, List<ParseNode> children) {
        return new ParseNode(kind, value, children, anchor.line(), anchor.column());
    }

    public static ParseNode leaf(Token token) {
        return new ParseNode(leafKind(token), token.text(), List.of(), token.line(), token.column());
    }

    public ParseNode withKind(String newKind) {
        return new ParseNode(newKind, value, children, line, column);
    }

    /**
     * Number of nodes in this subtree, including this one.
     */
    public int nodeCount() {
        int count = 1;
        for (ParseNode child : children) {
            count += child.nodeCount();
        }
        return count;
    }

    private static String leafKind(Token token) {
        return switch (token.category()) {
            case RESERVED_WORD -> "Keyword";
            case IDENTIFIER -> "Identifier";
            case NUMBER -> "NumberLiteral";
            case STRING -> "StringLiteral";
            case OPERATOR -> "Operator";
            case DELIMITER -> "Delimiter";
            case COMMENT -> "Comment";
            case SYMBOL -> "Symbol";
        };
    }
}
