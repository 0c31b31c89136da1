package com.polyglot.playground.service;

import com.polyglot.playground.dto.Diagnostic;
import com.polyglot.playground.dto.EditorMarker;

import org.springframework.stereotype.Service;

import java.util.List;
import java.util.stream.Collectors;

@Service
public class MarkerMapper {

    static final int DEFAULT_MARKER_WIDTH = 10;

    public List<EditorMarker> toMarkers(List<Diagnostic> diagnostics, String source) {
        return diagnostics.stream()
                .map(diagnostic -> toMarker(diagnostic, source))
                .collect(Collectors.toList());
    }

    public EditorMarker toMarker(Diagnostic diagnostic, String source) {
        int width = lexemeLength(source, diagnostic.offset());
        int endColumn = diagnostic.column() + (width > 0 ? width : DEFAULT_MARKER_WIDTH);
        return new EditorMarker(diagnostic.line(), diagnostic.column(), diagnostic.line(), endColumn,
                diagnostic.message(), diagnostic.severity().markerSeverity());
    }

    /**
     * Length of the word, quoted literal or single symbol starting at {@code offset}, or 0 when
     * nothing starts there. Never extends past the end of the line.
     */
    static int lexemeLength(String source, int offset) {
        if (source == null || offset < 0 || offset >= source.length()) {
            return 0;
        }
        char first = source.charAt(offset);
        if (Character.isWhitespace(first)) {
            return 0;
        }
        int end = offset + 1;
        if (isWordPart(first)) {
            while (end < source.length() && isWordPart(source.charAt(end))) {
                end++;
            }
        } else if (first == '"' || first == '\'' || first == '`') {
            while (end < source.length() && source.charAt(end) != '\n') {
                if (source.charAt(end++) == first) {
                    break;
                }
            }
        }
        return end - offset;
    }

    private static boolean isWordPart(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '@' || c == '$';
    }
}
