package com.polyglot.playground.service.syntax;

import com.polyglot.playground.dto.Diagnostic;
import com.polyglot.playground.dto.Phase;
import com.polyglot.playground.dto.Severity;
import com.polyglot.playground.dto.Token;
import com.polyglot.playground.dto.TokenCategory;
import com.polyglot.playground.language.BlockStyle;
import com.polyglot.playground.language.Language;
import com.polyglot.playground.language.LanguageProfile;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Whole-program checks run after parsing: bracket and block balance, plus the structural
 * landmarks a language expects.
 */
final class StructuralChecks {

    private static final Map<String, String> PAIRS = Map.of("(", ")", "[", "]", "{", "}");

    private final List<Token> tokens;
    private final LanguageProfile profile;
    private final List<Diagnostic> diagnostics = new ArrayList<>();

    StructuralChecks(List<Token> tokens, LanguageProfile profile) {
        this.tokens = tokens;
        this.profile = profile;
    }

    List<Diagnostic> run() {
        Language language = profile.language();
        if (language != Language.HTML) {
            checkDelimiters();
        }
        if (profile.blockStyle() == BlockStyle.KEYWORDS) {
            checkBlocks();
        }
        if (language == Language.CPP) {
            checkMainFunction();
        }
        if (language == Language.HTML) {
            checkDocumentStructure();
        }
        return diagnostics;
    }

    private void checkDelimiters() {
        Deque<Token> openers = new ArrayDeque<>();
        for (Token token : tokens) {
            if (token.category() != TokenCategory.DELIMITER) {
                continue;
            }
            if (PAIRS.containsKey(token.text())) {
                openers.push(token);
            } else if (PAIRS.containsValue(token.text())) {
                if (openers.isEmpty()) {
                    report(Severity.ERROR, "Unmatched closing symbol '" + token.text() + "'", token,
                            "Expected: nothing, Found: " + token.text());
                    continue;
                }
                Token opener = openers.pop();
                String expected = PAIRS.get(opener.text());
                if (!expected.equals(token.text())) {
                    report(Severity.ERROR, "Mismatched closing symbol '" + token.text() + "' for '"
                            + opener.text() + "' opened at line " + opener.line(), token,
                            "Expected: " + expected + ", Found: " + token.text());
                }
            }
        }
        Iterator<Token> unclosed = openers.descendingIterator();
        while (unclosed.hasNext()) {
            Token opener = unclosed.next();
            report(Severity.ERROR, "Unclosed symbol '" + opener.text() + "'", opener,
                    "Expected: " + PAIRS.get(opener.text()) + ", Found: end of input");
        }
    }

    private void checkBlocks() {
        Deque<Token> openers = new ArrayDeque<>();
        for (int i = 0; i < tokens.size(); i++) {
            if (profile.opensBlock(tokens, i)) {
                openers.push(tokens.get(i));
            } else if (profile.closesBlock(tokens, i)) {
                if (openers.isEmpty()) {
                    Token token = tokens.get(i);
                    report(Severity.ERROR, "'" + token.text() + "' without a matching block opener", token,
                            "Expected: begin, Found: " + token.text());
                } else {
                    openers.pop();
                }
            }
        }
        Iterator<Token> unclosed = openers.descendingIterator();
        while (unclosed.hasNext()) {
            Token opener = unclosed.next();
            report(Severity.ERROR, "Block opened by '" + opener.text() + "' is never closed", opener,
                    "Expected: end, Found: end of input");
        }
    }

    private void checkMainFunction() {
        for (int i = 0; i + 1 < tokens.size(); i++) {
            if (tokens.get(i).isIdentifier() && tokens.get(i).hasText("main") && tokens.get(i + 1).hasText("(")) {
                return;
            }
        }
        if (!tokens.isEmpty()) {
            report(Severity.WARNING, "C++ program should define a 'main' function", tokens.get(0), null);
        }
    }

    private void checkDocumentStructure() {
        for (String tag : List.of("html", "head", "body")) {
            if (!hasStartTag(tag) && !tokens.isEmpty()) {
                report(Severity.WARNING, "HTML document should contain a <" + tag + "> element", tokens.get(0), null);
            }
        }
    }

    private boolean hasStartTag(String tag) {
        for (int i = 0; i + 1 < tokens.size(); i++) {
            if (tokens.get(i).hasText("<") && tokens.get(i + 1).text().toLowerCase(Locale.ROOT).equals(tag)) {
                return true;
            }
        }
        return false;
    }

    private void report(Severity severity, String message, Token at, String context) {
        Diagnostic diagnostic = Diagnostic.at(Phase.SYNTACTIC, severity, message, at);
        diagnostics.add(context == null ? diagnostic : diagnostic.withContext(context));
    }
}
