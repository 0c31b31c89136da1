package com.polyglot.playground.language;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Map;

/**
 * Closed set of languages the analyzer understands. Tags arriving from callers are resolved once,
 * here, and every later phase works from the enum and its {@link LanguageProfile}.
 */
public enum Language {
    JAVASCRIPT("javascript", "JavaScript"),
    PYTHON("python", "Python"),
    CPP("cpp", "C++"),
    HTML("html", "HTML"),
    PASCAL("pascal", "Pascal"),
    PLSQL("plsql", "PL/SQL"),
    TSQL("tsql", "T-SQL"),
    UNKNOWN("unknown", "Unknown");

    private static final Map<String, Language> ALIASES = Map.ofEntries(
            Map.entry("javascript", JAVASCRIPT),
            Map.entry("js", JAVASCRIPT),
            Map.entry("python", PYTHON),
            Map.entry("py", PYTHON),
            Map.entry("cpp", CPP),
            Map.entry("c++", CPP),
            Map.entry("html", HTML),
            Map.entry("pascal", PASCAL),
            Map.entry("plsql", PLSQL),
            Map.entry("pl/sql", PLSQL),
            Map.entry("tsql", TSQL),
            Map.entry("t-sql", TSQL),
            Map.entry("sql", TSQL),
            Map.entry("unknown", UNKNOWN));

    private final String tag;
    private final String displayName;

    Language(String tag, String displayName) {
        this.tag = tag;
        this.displayName = displayName;
    }

    @JsonValue
    public String tag() {
        return tag;
    }

    public String displayName() {
        return displayName;
    }

    public boolean isSql() {
        return this == PLSQL || this == TSQL;
    }

    public LanguageProfile profile() {
        return LanguageProfiles.of(this);
    }

    /**
     * Resolves a caller-supplied tag or alias. Anything unrecognized, including null, maps to {@link #UNKNOWN}.
     */
    public static Language fromTag(String tag) {
        if (tag == null || tag.isBlank()) {
            return UNKNOWN;
        }
        return ALIASES.getOrDefault(tag.trim().toLowerCase(Locale.ROOT), UNKNOWN);
    }
}
