package com.polyglot.playground.language;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

final class Vocabulary {

    static final List<String> C_FAMILY_OPERATORS = List.of(
            "<<=", ">>=", "===", "!==",
            "++", "--", "<<", ">>", "<=", ">=", "==", "!=", "&&", "||",
            "+=", "-=", "*=", "/=", "%=", "&=", "|=", "^=",
            "+", "-", "*", "/", "%", "=", "<", ">", "!", "&", "|", "^", "~", "?");

    private Vocabulary() {
    }

    static Set<String> words(String... words) {
        return Set.copyOf(Arrays.asList(words));
    }

    @SafeVarargs
    static List<String> longestFirst(Collection<String>... groups) {
        Set<String> merged = new LinkedHashSet<>();
        for (Collection<String> group : groups) {
            merged.addAll(group);
        }
        List<String> ordered = new ArrayList<>(merged);
        ordered.sort(Comparator.comparingInt(String::length).reversed());
        return List.copyOf(ordered);
    }
}
