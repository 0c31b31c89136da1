package com.polyglot.playground.language;

public enum CommentStyle {
    DOUBLE_SLASH("//", null),
    HASH("#", null),
    DOUBLE_DASH("--", null),
    SLASH_STAR("/*", "*/"),
    BRACE("{", "}"),
    PAREN_STAR("(*", "*)"),
    MARKUP("<!--", "-->");

    private final String opener;
    private final String closer;

    CommentStyle(String opener, String closer) {
        this.opener = opener;
        this.closer = closer;
    }

    public String opener() {
        return opener;
    }

    public String closer() {
        return closer;
    }

    public boolean isLineComment() {
        return closer == null;
    }
}
