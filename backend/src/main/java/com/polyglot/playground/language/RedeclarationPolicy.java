package com.polyglot.playground.language;

import java.util.Set;

public enum RedeclarationPolicy {
    ALWAYS_REPORT,
    FUNCTION_SCOPED_REBINDS,
    NEVER_REPORT;

    private static final Set<String> REBINDABLE_KEYWORDS = Set.of("var", "function");

    public boolean permits(String previousKeyword, String keyword) {
        return switch (this) {
            case ALWAYS_REPORT -> false;
            case NEVER_REPORT -> true;
            case FUNCTION_SCOPED_REBINDS -> REBINDABLE_KEYWORDS.contains(previousKeyword)
                    && REBINDABLE_KEYWORDS.contains(keyword);
        };
    }
}
