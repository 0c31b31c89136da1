package com.polyglot.playground.service;

import com.polyglot.playground.dto.Diagnostic;
import com.polyglot.playground.dto.EditorMarker;
import com.polyglot.playground.dto.Phase;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class MarkerMapperTest {

    private final MarkerMapper mapper = new MarkerMapper();

    @Test
    void markerSpansTheWordAtTheDiagnostic() {
        String source = "int x = total + 1;";
        Diagnostic diagnostic = Diagnostic.error(Phase.SEMANTIC, "Identifier 'total' has not been declared", 1, 9, 8);

        EditorMarker marker = mapper.toMarker(diagnostic, source);

        assertThat(marker.startLine()).isEqualTo(1);
        assertThat(marker.endLine()).isEqualTo(1);
        assertThat(marker.startColumn()).isEqualTo(9);
        assertThat(marker.endColumn()).isEqualTo(14);
        assertThat(marker.severity()).isEqualTo(8);
        assertThat(marker.message()).isEqualTo(diagnostic.message());
    }

    @Test
    void severityFollowsEditorConvention() {
        List<EditorMarker> markers = mapper.toMarkers(List.of(
                Diagnostic.error(Phase.LEXICAL, "e", 1, 1, 0),
                Diagnostic.warning(Phase.SYNTACTIC, "w", 1, 1, 0),
                Diagnostic.info(Phase.SEMANTIC, "i", 1, 1, 0)), "abc");

        assertThat(markers).extracting(EditorMarker::severity).containsExactly(8, 4, 2);
    }

    @Test
    void fallsBackToDefaultWidthPastTheEnd() {
        EditorMarker marker = mapper.toMarker(Diagnostic.error(Phase.SYNTACTIC, "end", 1, 4, 3), "abc");

        assertThat(marker.endColumn()).isEqualTo(4 + MarkerMapper.DEFAULT_MARKER_WIDTH);
    }

    @Test
    void measuresLexemes() {
        assertThat(MarkerMapper.lexemeLength("@count = 1", 0)).isEqualTo(6);
        assertThat(MarkerMapper.lexemeLength("x = \"abc\";", 4)).isEqualTo(5);
        assertThat(MarkerMapper.lexemeLength("s = 'open\nnext", 4)).isEqualTo(5);
        assertThat(MarkerMapper.lexemeLength("(a", 0)).isEqualTo(1);
        assertThat(MarkerMapper.lexemeLength("a  b", 1)).isZero();
        assertThat(MarkerMapper.lexemeLength(null, 0)).isZero();
    }
}
