package com.polyglot.playground.service.syntax;

import com.polyglot.playground.dto.ParseNode;
import com.polyglot.playground.dto.Severity;
import com.polyglot.playground.dto.Token;
import com.polyglot.playground.language.LanguageProfile;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Python has no block tokens: suites are recovered from the columns of the first token of each line.
 */
final class PythonParser extends StatementParser {

    private static final Set<String> SIMPLE_KEYWORDS = Set.of(
            "return", "pass", "break", "continue", "raise", "del", "global", "nonlocal", "assert",
            "import", "from", "yield", "await", "print", "exec");

    PythonParser(TokenCursor cursor, LanguageProfile profile, int maxDepth) {
        super(cursor, profile, maxDepth);
    }

    @Override
    List<ParseNode> parseProgram() {
        Token first = cursor.peek();
        if (first != null && first.column() > 1) {
            report(Severity.WARNING, "Unexpected indentation", first);
        }
        return super.parseProgram();
    }

    @Override
    protected ParseNode parseStatement() {
        Token token = cursor.peek();
        if (token == null) {
            return null;
        }
        if (token.hasText("@")) {
            return parseDecorated();
        }
        if (!token.isKeyword()) {
            return parseSimpleStatement();
        }
        return switch (token.text()) {
            case "def" -> parseDef();
            case "class" -> parseClass();
            case "if" -> parseIf();
            case "while", "with" -> parseCompound(token.text().equals("while") ? "WhileStatement" : "WithStatement");
            case "for" -> parseCompound("ForStatement");
            case "try" -> parseTry();
            case "async" -> {
                cursor.advance();
                yield parseNestedStatement();
            }
            case "elif", "else", "except", "finally" -> unexpectedClause(token);
            default -> parseSimpleStatement();
        };
    }

    @Override
    protected boolean endsExpression(Token previous, Token next) {
        return previous != null && next.line() > previous.line() && !previous.hasText("\\");
    }

    private ParseNode parseSimpleStatement() {
        Token anchor = cursor.peek();
        int start = cursor.position();
        List<ParseNode> parts = new ArrayList<>();
        while (!cursor.atEnd()) {
            Token next = cursor.peek();
            if (cursor.position() > start && endsExpression(cursor.previous(), next)) {
                break;
            }
            if (next.hasText(";")) {
                cursor.advance();
                break;
            }
            if (isCloser(next)) {
                cursor.advance();
                continue;
            }
            ParseNode expression = parseExpression();
            parts.add(expression != null ? expression : ParseNode.leaf(cursor.advance()));
        }
        String kind = anchor.isKeyword() && SIMPLE_KEYWORDS.contains(anchor.text())
                ? capitalize(anchor.text()) + "Statement" : "ExpressionStatement";
        return ParseNode.of(kind, null, anchor, parts);
    }

    private ParseNode parseDecorated() {
        Token at = cursor.peek();
        ParseNode decorator = parseSimpleStatement().withKind("Decorator");
        if (cursor.atEnd()) {
            reportAtEnd(Severity.ERROR, "Expected a definition after decorator but found end of input", "def");
            return decorator;
        }
        return ParseNode.of("Decorated", null, at, nonNull(decorator, parseNestedStatement()));
    }

    private ParseNode parseDef() {
        Token keyword = cursor.advance();
        Token name = expectIdentifier("function name");
        List<ParseNode> parts = new ArrayList<>();
        if (cursor.check("(")) {
            parts.add(parseGroup().withKind("Parameters"));
        } else {
            expect("(");
        }
        if (cursor.match("->")) {
            ParseNode annotation = parseExpression();
            if (annotation != null) {
                parts.add(ParseNode.of("ReturnAnnotation", null, keyword, List.of(annotation)));
            }
        }
        requireColon(keyword);
        parts.add(parseSuite(keyword));
        return ParseNode.of("FunctionDef", name == null ? null : name.text(), keyword, nonNull(parts));
    }

    private ParseNode parseClass() {
        Token keyword = cursor.advance();
        Token name = expectIdentifier("class name");
        List<ParseNode> parts = new ArrayList<>();
        if (cursor.check("(")) {
            parts.add(parseGroup().withKind("Bases"));
        }
        requireColon(keyword);
        parts.add(parseSuite(keyword));
        return ParseNode.of("ClassDef", name == null ? null : name.text(), keyword, nonNull(parts));
    }

    private ParseNode parseIf() {
        Token keyword = cursor.peek();
        List<ParseNode> parts = new ArrayList<>();
        parts.add(parseClause(keyword));
        while (startsClause(keyword, "elif")) {
            parts.add(parseClause(keyword));
        }
        if (startsClause(keyword, "else")) {
            parts.add(parseClause(keyword));
        }
        return ParseNode.of("IfStatement", null, keyword, parts);
    }

    private ParseNode parseCompound(String kind) {
        Token keyword = cursor.peek();
        List<ParseNode> parts = new ArrayList<>();
        parts.add(parseClause(keyword));
        if (!keyword.hasText("with") && startsClause(keyword, "else")) {
            parts.add(parseClause(keyword));
        }
        return ParseNode.of(kind, null, keyword, parts);
    }

    private ParseNode parseTry() {
        Token keyword = cursor.peek();
        List<ParseNode> parts = new ArrayList<>();
        parts.add(parseClause(keyword));
        boolean handled = false;
        while (startsClause(keyword, "except")) {
            parts.add(parseClause(keyword));
            handled = true;
        }
        if (handled && startsClause(keyword, "else")) {
            parts.add(parseClause(keyword));
        }
        if (startsClause(keyword, "finally")) {
            parts.add(parseClause(keyword));
            handled = true;
        }
        if (!handled) {
            Token found = cursor.peek();
            if (found == null || cursor.atEnd()) {
                reportAtEnd(Severity.ERROR, "Expected 'except' or 'finally' block but found end of input", "except");
            } else {
                report(Severity.ERROR, "Expected 'except' or 'finally' block", found,
                        "Expected: except, Found: " + found.text());
            }
        }
        return ParseNode.of("TryStatement", null, keyword, parts);
    }

    /**
     * One {@code keyword header: suite} clause starting at the current token.
     */
    private ParseNode parseClause(Token owner) {
        Token keyword = cursor.advance();
        List<ParseNode> header = new ArrayList<>();
        while (!cursor.atEnd() && !cursor.check(":")) {
            Token next = cursor.peek();
            if (endsExpression(cursor.previous(), next) || next.hasText(";") || isCloser(next)) {
                break;
            }
            ParseNode expression = parseExpression();
            header.add(expression != null ? expression : ParseNode.leaf(cursor.advance()));
        }
        requireColon(keyword);
        List<ParseNode> parts = new ArrayList<>();
        if (!header.isEmpty()) {
            parts.add(ParseNode.of("Header", null, keyword, header));
        }
        ParseNode suite = parseSuite(owner);
        if (suite != null) {
            parts.add(suite);
        }
        return ParseNode.of(capitalize(keyword.text()) + "Clause", null, keyword, parts);
    }

    private boolean startsClause(Token owner, String word) {
        Token next = cursor.peek();
        return !cursor.atEnd() && next.isKeyword() && next.hasText(word)
                && next.column() == cursor.indentOf(owner) && cursor.onNewLine();
    }

    private void requireColon(Token keyword) {
        if (cursor.match(":")) {
            return;
        }
        Token before = cursor.previous();
        Token found = cursor.peek();
        String foundText = found == null || cursor.atEnd() ? "end of input" : found.text();
        report(Severity.ERROR, "Expected ':' after '" + keyword.text() + "' header", before,
                "Expected: :, Found: " + foundText);
    }

    /**
     * Statements indented deeper than the owning header, or a single statement on the header's line.
     */
    private ParseNode parseSuite(Token owner) {
        Token first = cursor.peek();
        if (first == null || cursor.atEnd()) {
            reportAtEnd(Severity.ERROR, "Expected an indented block after '" + owner.text()
                    + "' but found end of input", "indented block");
            return null;
        }
        if (!cursor.onNewLine()) {
            return ParseNode.of("Suite", null, first, nonNull(parseNestedStatement()));
        }
        int ownerIndent = cursor.indentOf(owner);
        if (first.column() <= ownerIndent) {
            report(Severity.ERROR, "Expected an indented block after '" + owner.text() + "'", first,
                    "Expected: indented block, Found: " + first.text());
            return null;
        }
        int indent = first.column();
        List<ParseNode> statements = new ArrayList<>();
        while (!cursor.atEnd()) {
            Token next = cursor.peek();
            boolean lineStart = cursor.onNewLine();
            if (lineStart && next.column() < indent) {
                if (next.column() > ownerIndent) {
                    report(Severity.WARNING, "Unindent does not match any outer indentation level", next);
                }
                break;
            }
            if (lineStart && next.column() > indent) {
                report(Severity.WARNING, "Unexpected indentation", next);
            }
            int before = cursor.position();
            ParseNode statement = parseNestedStatement();
            if (statement != null) {
                statements.add(statement);
            }
            ensureProgress(before);
        }
        return ParseNode.of("Suite", null, first, statements);
    }

    private ParseNode unexpectedClause(Token token) {
        report(Severity.ERROR, "Unexpected '" + token.text() + "' without a matching statement", token,
                "Expected: statement, Found: " + token.text());
        return parseSimpleStatement();
    }

    private static String capitalize(String word) {
        return word.isEmpty() ? word : Character.toUpperCase(word.charAt(0)) + word.substring(1);
    }
}
