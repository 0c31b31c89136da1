package com.polyglot.playground.language;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

final class LanguageProfiles {

    private static final Map<Language, LanguageProfile> PROFILES;

    static {
        Map<Language, LanguageProfile> profiles = new EnumMap<>(Language.class);
        profiles.put(Language.JAVASCRIPT, new JavaScriptProfile());
        profiles.put(Language.PYTHON, new PythonProfile());
        profiles.put(Language.CPP, new CppProfile());
        profiles.put(Language.HTML, new HtmlProfile());
        profiles.put(Language.PASCAL, new PascalProfile());
        profiles.put(Language.PLSQL, new PlSqlProfile());
        profiles.put(Language.TSQL, new TSqlProfile());
        profiles.put(Language.UNKNOWN, new UnknownProfile());
        PROFILES = Collections.unmodifiableMap(profiles);
    }

    private LanguageProfiles() {
    }

    static LanguageProfile of(Language language) {
        return PROFILES.get(language);
    }
}
