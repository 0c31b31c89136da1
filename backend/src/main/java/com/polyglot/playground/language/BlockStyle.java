package com.polyglot.playground.language;

public enum BlockStyle {
    BRACES,
    INDENTATION,
    KEYWORDS,
    NONE
}
