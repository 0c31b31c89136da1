package com.polyglot.playground.service.lexical;

import java.util.Locale;

/**
 * Tells plausible words from keyboard noise when the language of a snippet is unknown.
 */
final class WordHeuristics {

    private static final String VOWELS = "aeiouy";
    private static final int MAX_WORD_LENGTH = 30;

    private WordHeuristics() {
    }

    static boolean looksLikeWord(String word) {
        String letters = word.toLowerCase(Locale.ROOT).replaceAll("[^\\p{L}]", "");
        if (word.length() <= 2) {
            return true;
        }
        if (word.length() > MAX_WORD_LENGTH || letters.isEmpty()) {
            return false;
        }
        if (!containsVowelAndConsonant(letters)) {
            return false;
        }
        return !hasLongRun(letters) && !isRepeatingPattern(letters);
    }

    private static boolean containsVowelAndConsonant(String letters) {
        boolean vowel = false;
        boolean consonant = false;
        for (int i = 0; i < letters.length(); i++) {
            char c = letters.charAt(i);
            if (c > 0x7F) {
                // non-latin scripts are taken at face value
                return true;
            }
            if (VOWELS.indexOf(c) >= 0) {
                vowel = true;
            } else {
                consonant = true;
            }
        }
        return vowel && consonant;
    }

    private static boolean hasLongRun(String letters) {
        int run = 1;
        for (int i = 1; i < letters.length(); i++) {
            run = letters.charAt(i) == letters.charAt(i - 1) ? run + 1 : 1;
            if (run >= 3) {
                return true;
            }
        }
        return false;
    }

    /**
     * True for strings such as {@code asdasdasd} made of one short unit repeated at least three times.
     */
    private static boolean isRepeatingPattern(String letters) {
        int length = letters.length();
        for (int unit = 1; unit <= length / 3; unit++) {
            if (length % unit != 0) {
                continue;
            }
            String head = letters.substring(0, unit);
            if (head.repeat(length / unit).equals(letters)) {
                return true;
            }
        }
        return false;
    }
}
