package com.polyglot.playground.dto;

public record EditorMarker(
        int startLine,
        int startColumn,
        int endLine,
        int endColumn,
        String message,
        int severity
) {
}
