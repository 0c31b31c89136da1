package com.polyglot.playground.language;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;

class LanguageTest {

    @ParameterizedTest
    @CsvSource({
            "javascript, JAVASCRIPT",
            "js, JAVASCRIPT",
            "Python, PYTHON",
            "py, PYTHON",
            "c++, CPP",
            "cpp, CPP",
            "HTML, HTML",
            "pascal, PASCAL",
            "pl/sql, PLSQL",
            "plsql, PLSQL",
            "t-sql, TSQL",
            "sql, TSQL",
            "cobol, UNKNOWN"
    })
    void resolvesTagsAndAliases(String tag, Language expected) {
        assertThat(Language.fromTag(tag)).isEqualTo(expected);
    }

    @Test
    void missingTagIsUnknown() {
        assertThat(Language.fromTag(null)).isEqualTo(Language.UNKNOWN);
        assertThat(Language.fromTag("   ")).isEqualTo(Language.UNKNOWN);
    }

    @Test
    void everyLanguageHasAProfileForItself() {
        for (Language language : Language.values()) {
            assertThat(language.profile().language()).isEqualTo(language);
        }
    }

    @Test
    void sqlDialectsAreCaseInsensitive() {
        assertThat(Language.TSQL.profile().isKeyword("SELECT")).isTrue();
        assertThat(Language.PLSQL.profile().isKeyword("Begin")).isTrue();
        assertThat(Language.JAVASCRIPT.profile().isKeyword("Const")).isFalse();
    }
}
