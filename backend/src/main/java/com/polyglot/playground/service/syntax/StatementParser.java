package com.polyglot.playground.service.syntax;

import com.polyglot.playground.dto.Diagnostic;
import com.polyglot.playground.dto.ParseNode;
import com.polyglot.playground.dto.Phase;
import com.polyglot.playground.dto.Severity;
import com.polyglot.playground.dto.Token;
import com.polyglot.playground.dto.TokenCategory;
import com.polyglot.playground.language.LanguageProfile;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Statement-level recursive descent shared by the per-language grammars. Subclasses parse one
 * statement at a time; expressions are read shallowly, up to the next terminating delimiter.
 * Missing closers at the end of input are left to the delimiter balance check.
 */
abstract class StatementParser {

    private static final Map<String, String> PAIRS = Map.of("(", ")", "[", "]", "{", "}");
    private static final Set<String> CLOSERS = Set.of(")", "]", "}");

    protected final TokenCursor cursor;
    protected final LanguageProfile profile;
    protected final List<Diagnostic> diagnostics = new ArrayList<>();

    private final int maxDepth;
    private int depth;

    protected StatementParser(TokenCursor cursor, LanguageProfile profile, int maxDepth) {
        this.cursor = cursor;
        this.profile = profile;
        this.maxDepth = maxDepth;
    }

    List<ParseNode> parseProgram() {
        List<ParseNode> nodes = new ArrayList<>();
        while (!cursor.atEnd()) {
            if (isCloser(cursor.peek())) {
                // stray closers are reported by the balance check
                cursor.advance();
                continue;
            }
            int before = cursor.position();
            ParseNode node = parseStatement();
            if (node != null) {
                nodes.add(node);
            }
            ensureProgress(before);
        }
        return nodes;
    }

    List<Diagnostic> diagnostics() {
        return diagnostics;
    }

    protected abstract ParseNode parseStatement();

    /**
     * Words that end an expression when met outside of any bracket.
     */
    protected Set<String> expressionStopWords() {
        return Set.of();
    }

    /**
     * Whether {@code next} begins a new statement even though no terminator was seen.
     */
    protected boolean endsExpression(Token previous, Token next) {
        return false;
    }

    // statement helpers

    protected void ensureProgress(int before) {
        if (cursor.position() == before && !cursor.atEnd()) {
            cursor.tick();
            cursor.advance();
        }
    }

    /**
     * Parses statements until one of {@code closers}, which is left for the caller, or the end of input.
     */
    protected List<ParseNode> parseStatementsUntil(String... closers) {
        List<ParseNode> statements = new ArrayList<>();
        while (!cursor.atEnd() && !cursor.checkAny(closers)) {
            if (isCloser(cursor.peek())) {
                break;
            }
            int before = cursor.position();
            ParseNode statement = parseNestedStatement();
            if (statement != null) {
                statements.add(statement);
            }
            ensureProgress(before);
        }
        return statements;
    }

    /**
     * Statement inside a block or compound statement. Past the configured nesting depth the
     * statement is consumed flat, up to its terminator or the closer of the enclosing block.
     */
    protected ParseNode parseNestedStatement() {
        if (depth >= maxDepth) {
            skipStatementFlat();
            return null;
        }
        depth++;
        try {
            return parseStatement();
        } finally {
            depth--;
        }
    }

    /**
     * Brace-delimited block. A block left open at the end of input is accepted silently.
     */
    protected ParseNode parseBraceBlock() {
        Token open = cursor.peek();
        if (!cursor.check("{")) {
            expect("{");
            return null;
        }
        cursor.advance();
        List<ParseNode> statements = parseStatementsUntil("}");
        cursor.match("}");
        return ParseNode.of("Block", null, open, statements);
    }

    protected Token expect(String text) {
        if (cursor.check(text)) {
            return cursor.advance();
        }
        if (cursor.atEnd()) {
            if (!CLOSERS.contains(text)) {
                reportAtEnd(Severity.ERROR, "Expected '" + text + "' but found end of input", text);
            }
            return null;
        }
        Token found = cursor.peek();
        report(Severity.ERROR, "Expected '" + text + "' but found '" + found.text() + "'", found,
                "Expected: " + text + ", Found: " + found.text());
        return null;
    }

    protected Token expectIdentifier(String what) {
        Token token = cursor.peek();
        if (token != null && token.isIdentifier()) {
            return cursor.advance();
        }
        if (token == null || cursor.atEnd()) {
            reportAtEnd(Severity.ERROR, "Expected " + what + " but found end of input", what);
        } else {
            report(Severity.ERROR, "Expected " + what + " but found '" + token.text() + "'", token,
                    "Expected: " + what + ", Found: " + token.text());
        }
        return null;
    }

    /**
     * Consumes a statement terminator, or warns when it is missing and cannot be inferred.
     */
    protected void endStatement(String terminator) {
        if (cursor.match(terminator)) {
            return;
        }
        if (terminatorOptional()) {
            return;
        }
        Token before = cursor.previous();
        if (before == null) {
            return;
        }
        Diagnostic diagnostic = new Diagnostic(Phase.SYNTACTIC,
                "Missing '" + terminator + "' at end of statement", before.line(), before.endColumn(),
                before.endOffset(), Severity.WARNING, null);
        Token found = cursor.peek();
        diagnostics.add(diagnostic.withContext("Expected: " + terminator + ", Found: "
                + (found == null || cursor.atEnd() ? "end of input" : found.text())));
    }

    protected boolean terminatorOptional() {
        return false;
    }

    /**
     * Skips ahead to the next token a statement can start from.
     */
    protected void recover() {
        while (!cursor.atEnd()) {
            Token token = cursor.peek();
            if (token.hasText(";")) {
                cursor.advance();
                return;
            }
            if (token.hasText("}") || isRecoveryPoint(token)) {
                return;
            }
            cursor.advance();
        }
    }

    protected boolean isRecoveryPoint(Token token) {
        return token.isKeyword() || profile.statementKeywords().contains(profile.normalize(token.text()));
    }

    // expressions

    protected ParseNode parseExpression() {
        return parseExpression(expressionStopWords());
    }

    protected ParseNode parseExpression(Set<String> stopWords) {
        Token anchor = cursor.peek();
        List<ParseNode> parts = new ArrayList<>();
        int pendingColons = 0;
        while (!cursor.atEnd()) {
            Token token = cursor.peek();
            if (!parts.isEmpty() && endsExpression(cursor.previous(), token)) {
                break;
            }
            if (isCloser(token) || token.hasText(";") || token.hasText(",")) {
                break;
            }
            if (token.hasText(":") && token.category() == TokenCategory.DELIMITER) {
                if (pendingColons == 0) {
                    break;
                }
                pendingColons--;
            }
            if (token.category() != TokenCategory.STRING && stopWords.contains(profile.normalize(token.text()))) {
                break;
            }
            if (token.hasText("?") || (token.isKeyword() && token.hasText("lambda"))) {
                pendingColons++;
            }
            parts.add(parseOperand());
        }
        if (parts.isEmpty()) {
            return null;
        }
        return parts.size() == 1 ? parts.get(0) : ParseNode.of("Expression", null, anchor, parts);
    }

    private ParseNode parseOperand() {
        if (isOpener(cursor.peek())) {
            return parseGroup();
        }
        Token token = cursor.advance();
        if (token.isIdentifier() && cursor.check("(")) {
            return ParseNode.of("Call", token.text(), token, List.of(parseGroup()));
        }
        return ParseNode.leaf(token);
    }

    /**
     * Bracketed group starting at the current opener. Nesting beyond the configured depth is
     * consumed flat instead of recursively.
     */
    protected ParseNode parseGroup() {
        Token opener = cursor.advance();
        String closer = PAIRS.get(opener.text());
        if (depth >= maxDepth) {
            skipFlat();
            return ParseNode.of(groupKind(opener), opener.text(), opener, List.of());
        }
        List<ParseNode> children = new ArrayList<>();
        depth++;
        try {
            while (!cursor.atEnd()) {
                Token token = cursor.peek();
                if (token.hasText(closer)) {
                    cursor.advance();
                    break;
                }
                if (isCloser(token)) {
                    break;
                }
                children.add(parseOperand());
            }
        } finally {
            depth--;
        }
        return ParseNode.of(groupKind(opener), opener.text(), opener, children);
    }

    private void skipStatementFlat() {
        int open = 0;
        while (!cursor.atEnd()) {
            Token token = cursor.peek();
            if (isOpener(token)) {
                open++;
            } else if (isCloser(token)) {
                if (open == 0) {
                    return;
                }
                open--;
            } else if (open == 0 && token.hasText(";")) {
                cursor.advance();
                return;
            }
            cursor.advance();
        }
    }

    private void skipFlat() {
        int open = 1;
        while (!cursor.atEnd() && open > 0) {
            Token token = cursor.advance();
            if (isOpener(token)) {
                open++;
            } else if (isCloser(token)) {
                open--;
            }
        }
    }

    private static String groupKind(Token opener) {
        return switch (opener.text()) {
            case "[" -> "Index";
            case "{" -> "Braces";
            default -> "Group";
        };
    }

    protected static List<ParseNode> nonNull(ParseNode... nodes) {
        List<ParseNode> present = new ArrayList<>();
        for (ParseNode node : nodes) {
            if (node != null) {
                present.add(node);
            }
        }
        return present;
    }

    protected static List<ParseNode> nonNull(List<ParseNode> nodes) {
        return nonNull(nodes.toArray(new ParseNode[0]));
    }

    protected static boolean isOpener(Token token) {
        return token != null && token.category() == TokenCategory.DELIMITER && PAIRS.containsKey(token.text());
    }

    protected static boolean isCloser(Token token) {
        return token != null && token.category() == TokenCategory.DELIMITER && CLOSERS.contains(token.text());
    }

    // diagnostics

    protected void report(Severity severity, String message, Token at) {
        report(severity, message, at, null);
    }

    protected void report(Severity severity, String message, Token at, String context) {
        Diagnostic diagnostic = Diagnostic.at(Phase.SYNTACTIC, severity, message, at);
        diagnostics.add(context == null ? diagnostic : diagnostic.withContext(context));
    }

    protected void reportAtEnd(Severity severity, String message, String expected) {
        Token last = cursor.last();
        int line = last == null ? 1 : last.line();
        int column = last == null ? 1 : last.endColumn();
        int offset = last == null ? 0 : last.endOffset();
        diagnostics.add(new Diagnostic(Phase.SYNTACTIC, message, line, column, offset, severity,
                "Expected: " + expected + ", Found: end of input"));
    }
}
