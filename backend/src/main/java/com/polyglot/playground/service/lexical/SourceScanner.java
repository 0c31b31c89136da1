package com.polyglot.playground.service.lexical;

import com.polyglot.playground.dto.Diagnostic;
import com.polyglot.playground.dto.Phase;
import com.polyglot.playground.dto.Token;
import com.polyglot.playground.dto.TokenKind;
import com.polyglot.playground.language.CommentStyle;
import com.polyglot.playground.language.Language;
import com.polyglot.playground.language.LanguageProfile;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

final class SourceScanner {

    private static final Pattern HEX_PATTERN = Pattern.compile("0[xX][0-9a-fA-F]+(?:_[0-9a-fA-F]+)*");
    private static final Pattern BINARY_PATTERN = Pattern.compile("0[bB][01]+(?:_[01]+)*");
    private static final Pattern OCTAL_PATTERN = Pattern.compile("0[oO][0-7]+(?:_[0-7]+)*");
    private static final Pattern DECIMAL_PATTERN = Pattern.compile(
            "(?:\\d+\\.\\d+|\\.\\d+)(?:[eE][+-]?\\d+)?|\\d+[eE][+-]?\\d+");
    private static final Pattern INTEGER_PATTERN = Pattern.compile("\\d+(?:_\\d+)*");

    private static final List<NumberShape> NUMBER_SHAPES = List.of(
            new NumberShape(HEX_PATTERN, TokenKind.HEX_NUMBER),
            new NumberShape(BINARY_PATTERN, TokenKind.BINARY_NUMBER),
            new NumberShape(OCTAL_PATTERN, TokenKind.OCTAL_NUMBER),
            new NumberShape(DECIMAL_PATTERN, TokenKind.DECIMAL_NUMBER),
            new NumberShape(INTEGER_PATTERN, TokenKind.INTEGER_NUMBER));

    private static final Set<String> COMPARISON_OPERATORS = Set.of(
            "==", "===", "!=", "!==", "<", ">", "<=", ">=", "<>", "!<", "!>");
    private static final Set<String> LOGICAL_OPERATORS = Set.of("&&", "||", "!", "??");
    private static final Set<String> BITWISE_OPERATORS = Set.of("&", "|", "^", "~", "<<", ">>", ">>>");
    private static final Set<String> ARITHMETIC_OPERATORS = Set.of(
            "+", "-", "*", "/", "%", "**", "//", "++", "--");

    private static final String DELIMITERS = "()[]{};,.:";

    private final String source;
    private final LanguageProfile profile;
    private final long iterationCeiling;
    private final boolean markup;

    private final List<Token> tokens = new ArrayList<>();
    private final List<Diagnostic> diagnostics = new ArrayList<>();

    private int pos;
    private int line = 1;
    private int column = 1;
    private boolean insideMarkupTag;

    SourceScanner(String source, LanguageProfile profile, int iterationFactor) {
        this.source = source;
        this.profile = profile;
        this.iterationCeiling = (long) source.length() * iterationFactor;
        this.markup = profile.language() == Language.HTML;
    }

    LexicalResult scan() {
        long iterations = 0;
        while (pos < source.length()) {
            if (++iterations > iterationCeiling) {
                diagnostics.add(Diagnostic.error(Phase.LEXICAL,
                        "Lexical analysis aborted for safety", line, column, pos));
                break;
            }
            int before = pos;
            scanNext();
            if (pos == before) {
                // no rule consumed input, step over the character to keep moving
                advance(1);
            }
        }
        return partialResult();
    }

    LexicalResult partialResult() {
        return new LexicalResult(tokens, diagnostics);
    }

    private void scanNext() {
        char c = source.charAt(pos);
        if (Character.isWhitespace(c) || Character.isSpaceChar(c)) {
            advance(1);
            return;
        }
        if (scanComment() || scanString() || scanNumber() || scanOperator()
                || scanDelimiter() || scanWord() || scanDirective()) {
            return;
        }
        scanUnrecognized(c);
    }

    // comments

    private boolean scanComment() {
        for (CommentStyle style : profile.commentStyles()) {
            if (!source.startsWith(style.opener(), pos)) {
                continue;
            }
            if (style.isLineComment()) {
                int end = source.indexOf('\n', pos);
                emit(TokenKind.LINE_COMMENT, (end < 0 ? source.length() : end) - pos);
                return true;
            }
            int close = source.indexOf(style.closer(), pos + style.opener().length());
            if (close < 0) {
                error("Unterminated block comment", line, column, pos, null);
                emit(TokenKind.BLOCK_COMMENT, source.length() - pos);
            } else {
                emit(TokenKind.BLOCK_COMMENT, close + style.closer().length() - pos);
            }
            return true;
        }
        return false;
    }

    // strings

    private boolean scanString() {
        if (markup && !insideMarkupTag) {
            return false;
        }
        int prefixLength = stringPrefixLength();
        int quotePos = pos + prefixLength;
        if (quotePos >= source.length() || !profile.stringQuotes().contains(source.charAt(quotePos))) {
            return false;
        }
        char quote = source.charAt(quotePos);
        boolean triple = profile.tripleQuotedStrings()
                && source.startsWith(String.valueOf(quote).repeat(3), quotePos);
        boolean multiline = triple || profile.multilineQuotes().contains(quote);
        int bodyStart = quotePos + (triple ? 3 : 1);

        int end = findStringEnd(quote, triple, multiline, bodyStart);
        boolean terminated = end >= 0;
        if (!terminated) {
            end = multiline ? source.length() : lineEnd(bodyStart);
        }

        int startLine = line;
        int startColumn = column;
        int startOffset = pos;
        Token token = emit(stringKind(quote), end - pos);
        if (!terminated) {
            error("Unterminated string literal (cadena sin cerrar)", startLine, startColumn, startOffset,
                    "Token: " + token.text());
        }
        return true;
    }

    private int stringPrefixLength() {
        Set<String> prefixes = profile.stringPrefixes();
        if (prefixes.isEmpty() || (pos > 0 && profile.isIdentifierPart(source.charAt(pos - 1)))) {
            return 0;
        }
        for (int length = 2; length >= 1; length--) {
            if (pos + length >= source.length()) {
                continue;
            }
            String candidate = source.substring(pos, pos + length).toLowerCase(Locale.ROOT);
            if (prefixes.contains(candidate) && profile.stringQuotes().contains(source.charAt(pos + length))) {
                return length;
            }
        }
        return 0;
    }

    /**
     * Offset just past the closing quote, or -1 when the literal runs off its line or the input.
     */
    private int findStringEnd(char quote, boolean triple, boolean multiline, int from) {
        String closer = triple ? String.valueOf(quote).repeat(3) : String.valueOf(quote);
        int i = from;
        while (i < source.length()) {
            char c = source.charAt(i);
            if (c == '\\' && profile.backslashEscapes()) {
                i += 2;
                continue;
            }
            if (c == '\n' && !multiline) {
                return -1;
            }
            if (source.startsWith(closer, i)) {
                if (!triple && profile.doubledQuoteEscapes()
                        && i + 1 < source.length() && source.charAt(i + 1) == quote) {
                    i += 2;
                    continue;
                }
                return i + closer.length();
            }
            i++;
        }
        return -1;
    }

    private TokenKind stringKind(char quote) {
        return switch (quote) {
            case '`' -> TokenKind.TEMPLATE_STRING;
            case '\'' -> profile.charLiterals() ? TokenKind.CHAR_LITERAL : TokenKind.SINGLE_QUOTED_STRING;
            default -> TokenKind.DOUBLE_QUOTED_STRING;
        };
    }

    // numbers

    private boolean scanNumber() {
        char c = source.charAt(pos);
        boolean leadingDot = c == '.' && pos + 1 < source.length() && Character.isDigit(source.charAt(pos + 1));
        if (!Character.isDigit(c) && !leadingDot) {
            return false;
        }
        if (leadingDot && !tokens.isEmpty() && tokens.get(tokens.size() - 1).endOffset() == pos
                && tokens.get(tokens.size() - 1).isIdentifier()) {
            return false;
        }

        int bestEnd = -1;
        TokenKind bestKind = null;
        for (NumberShape shape : NUMBER_SHAPES) {
            Matcher matcher = shape.pattern().matcher(source).region(pos, source.length());
            if (matcher.lookingAt() && matcher.end() > bestEnd) {
                bestEnd = matcher.end();
                bestKind = shape.kind();
            }
        }
        if (bestKind == null) {
            return false;
        }

        String suffixes = profile.numberSuffixes();
        while (bestEnd < source.length() && suffixes.indexOf(source.charAt(bestEnd)) >= 0) {
            bestEnd++;
        }

        int tail = bestEnd;
        while (tail < source.length() && profile.isIdentifierPart(source.charAt(tail))) {
            tail++;
        }
        int startLine = line;
        int startColumn = column;
        int startOffset = pos;
        Token token = emit(bestKind, tail - pos);
        if (tail > bestEnd) {
            error("Malformed number '" + token.text() + "'", startLine, startColumn, startOffset,
                    "Token: " + token.text());
        }
        return true;
    }

    // operators and delimiters

    private boolean scanOperator() {
        for (String operator : profile.operators()) {
            if (source.startsWith(operator, pos)) {
                trackMarkupTag(operator);
                emit(operatorKind(operator), operator.length());
                return true;
            }
        }
        return false;
    }

    private void trackMarkupTag(String operator) {
        if (!markup) {
            return;
        }
        if (operator.equals(">") || operator.equals("/>")) {
            insideMarkupTag = false;
            return;
        }
        int next = pos + operator.length();
        if ((operator.equals("<") || operator.equals("</")) && next < source.length()) {
            char c = source.charAt(next);
            insideMarkupTag = Character.isLetter(c) || c == '!';
        }
    }

    private TokenKind operatorKind(String operator) {
        if (operator.equals(profile.assignmentOperator())) {
            return TokenKind.ASSIGNMENT_OPERATOR;
        }
        if (operator.equals("=")) {
            return TokenKind.COMPARISON_OPERATOR;
        }
        if (COMPARISON_OPERATORS.contains(operator)) {
            return TokenKind.COMPARISON_OPERATOR;
        }
        if (operator.length() > 1 && operator.endsWith("=")) {
            return TokenKind.ASSIGNMENT_OPERATOR;
        }
        if (LOGICAL_OPERATORS.contains(operator)) {
            return TokenKind.LOGICAL_OPERATOR;
        }
        if (BITWISE_OPERATORS.contains(operator)) {
            return TokenKind.BITWISE_OPERATOR;
        }
        if (ARITHMETIC_OPERATORS.contains(operator)) {
            return TokenKind.ARITHMETIC_OPERATOR;
        }
        return TokenKind.OPERATOR;
    }

    private boolean scanDelimiter() {
        char c = source.charAt(pos);
        if (DELIMITERS.indexOf(c) < 0) {
            return false;
        }
        emit(TokenKind.delimiter(c), 1);
        return true;
    }

    // words

    private boolean scanWord() {
        int start = pos;
        int i = pos;
        char prefix = profile.variablePrefix();
        if (prefix != 0) {
            while (i < source.length() && i - start < 2 && source.charAt(i) == prefix) {
                i++;
            }
        }
        if (i >= source.length() || !profile.isIdentifierStart(source.charAt(i))) {
            return false;
        }
        i++;
        while (i < source.length() && profile.isIdentifierPart(source.charAt(i))) {
            i++;
        }

        String word = source.substring(start, i);
        if (profile.strictWordRecognition() && !WordHeuristics.looksLikeWord(word)) {
            error("Unrecognized character sequence '" + word + "'", line, column, pos, "Token: " + word);
            advance(i - start);
            return true;
        }
        boolean sigil = prefix != 0 && word.charAt(0) == prefix;
        emit(!sigil && profile.isKeyword(word) ? TokenKind.KEYWORD : TokenKind.IDENTIFIER, i - start);
        return true;
    }

    private boolean scanDirective() {
        if (!profile.preprocessorDirectives() || source.charAt(pos) != '#') {
            return false;
        }
        emit(TokenKind.PREPROCESSOR_DIRECTIVE, lineEnd(pos) - pos);
        return true;
    }

    private void scanUnrecognized(char c) {
        if (Character.isISOControl(c) || Character.getType(c) == Character.FORMAT) {
            advance(1);
            return;
        }
        if (c > 0x20 && c < 0x7F) {
            emit(TokenKind.SYMBOL, 1);
            return;
        }
        int width = Character.charCount(source.codePointAt(pos));
        String text = source.substring(pos, pos + width);
        error("Unrecognized character '" + text + "'", line, column, pos, null);
        advance(width);
    }

    // cursor

    private Token emit(TokenKind kind, int length) {
        Token token = new Token(kind, source.substring(pos, pos + length), line, column, pos);
        tokens.add(token);
        advance(length);
        return token;
    }

    private void advance(int count) {
        int end = Math.min(pos + count, source.length());
        while (pos < end) {
            if (source.charAt(pos) == '\n') {
                line++;
                column = 1;
            } else {
                column++;
            }
            pos++;
        }
    }

    private int lineEnd(int from) {
        int end = source.indexOf('\n', from);
        return end < 0 ? source.length() : end;
    }

    private void error(String message, int atLine, int atColumn, int atOffset, String context) {
        Diagnostic diagnostic = Diagnostic.error(Phase.LEXICAL, message, atLine, atColumn, atOffset);
        diagnostics.add(context == null ? diagnostic : diagnostic.withContext(context));
    }

    private record NumberShape(Pattern pattern, TokenKind kind) {
    }
}
