package com.polyglot.playground.language;

import java.util.Arrays;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Implicit assignment conversions of a language. Types the table has never heard of (user classes,
 * library types) are always accepted, so only clashes between known built-in types are reported.
 */
public final class TypeConversions {

    public static final TypeConversions DYNAMIC = new TypeConversions(true, Map.of(), Set.of());

    private static final Set<String> WILDCARDS = Set.of("any", "auto", "unknown", "null", "var");

    private final boolean dynamic;
    private final Map<String, Set<String>> allowed;
    private final Set<String> knownTypes;

    private TypeConversions(boolean dynamic, Map<String, Set<String>> allowed, Set<String> knownTypes) {
        this.dynamic = dynamic;
        this.allowed = allowed;
        this.knownTypes = knownTypes;
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean isDynamic() {
        return dynamic;
    }

    public boolean isAssignable(String target, String source) {
        if (dynamic) {
            return true;
        }
        String to = canonical(target);
        String from = canonical(source);
        if (to.isEmpty() || from.isEmpty() || to.equals(from)) {
            return true;
        }
        if (WILDCARDS.contains(to) || WILDCARDS.contains(from)) {
            return true;
        }
        if (!knownTypes.contains(to) || !knownTypes.contains(from)) {
            return true;
        }
        return allowed.getOrDefault(to, Set.of()).contains(from);
    }

    static String canonical(String type) {
        if (type == null) {
            return "";
        }
        String normalized = type.toLowerCase(Locale.ROOT).replace("std::", "").trim();
        int cut = indexOfAny(normalized, '(', '[', '<');
        if (cut >= 0) {
            normalized = normalized.substring(0, cut).trim();
        }
        int space = normalized.lastIndexOf(' ');
        return space >= 0 ? normalized.substring(space + 1) : normalized;
    }

    private static int indexOfAny(String text, char... candidates) {
        int best = -1;
        for (char candidate : candidates) {
            int index = text.indexOf(candidate);
            if (index >= 0 && (best < 0 || index < best)) {
                best = index;
            }
        }
        return best;
    }

    public static final class Builder {

        private final Map<String, Set<String>> allowed = new HashMap<>();
        private final Set<String> knownTypes = new HashSet<>();

        private Builder() {
        }

        /**
         * Types in a family convert implicitly into each other.
         */
        public Builder family(String... types) {
            for (String target : types) {
                allow(target, types);
            }
            return this;
        }

        public Builder allow(String target, String... sources) {
            knownTypes.add(target);
            Set<String> accepted = allowed.computeIfAbsent(target, key -> new HashSet<>());
            for (String source : sources) {
                knownTypes.add(source);
                accepted.add(source);
            }
            return this;
        }

        public Builder allowInto(String[] targets, String... sources) {
            for (String target : targets) {
                allow(target, sources);
            }
            return this;
        }

        public Builder known(String... types) {
            knownTypes.addAll(Arrays.asList(types));
            return this;
        }

        public TypeConversions build() {
            Map<String, Set<String>> frozen = new HashMap<>();
            allowed.forEach((target, sources) -> frozen.put(target, Set.copyOf(sources)));
            return new TypeConversions(false, Map.copyOf(frozen), Set.copyOf(knownTypes));
        }
    }
}
