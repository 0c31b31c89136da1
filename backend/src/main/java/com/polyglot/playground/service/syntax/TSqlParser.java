package com.polyglot.playground.service.syntax;

import com.polyglot.playground.dto.ParseNode;
import com.polyglot.playground.dto.Severity;
import com.polyglot.playground.dto.Token;
import com.polyglot.playground.language.LanguageProfile;

import java.util.ArrayList;
import java.util.List;

/**
 * Transact-SQL batches. Terminators are optional and {@code GO} separates batches.
 */
final class TSqlParser extends SqlParser {

    TSqlParser(TokenCursor cursor, LanguageProfile profile, int maxDepth) {
        super(cursor, profile, maxDepth);
    }

    @Override
    protected boolean terminatorOptional() {
        return true;
    }

    @Override
    protected ParseNode parseStatement() {
        Token token = cursor.peek();
        if (token == null) {
            return null;
        }
        if (token.hasText(";")) {
            cursor.advance();
            return null;
        }
        if (!token.isKeyword()) {
            return parseGeneric(cursor.advance(), "ExpressionStatement");
        }
        return switch (profile.normalize(token.text())) {
            case "select", "insert", "update", "delete", "with", "merge" -> parseDml();
            case "create" -> parseCreate();
            case "declare" -> parseDeclare();
            case "set" -> parseSet();
            case "print" -> parseKeywordExpression("PrintStatement");
            case "return" -> parseKeywordExpression("ReturnStatement");
            case "if" -> parseIf();
            case "while" -> parseWhile();
            case "begin" -> parseBegin();
            case "go" -> ParseNode.of("BatchSeparator", null, cursor.advance(), List.of());
            case "exec", "execute" -> parseGeneric(cursor.advance(), "ExecStatement");
            case "end", "else", "catch" -> unexpected(token);
            default -> parseGeneric(cursor.advance(), capitalize(profile.normalize(token.text())) + "Statement");
        };
    }

    @Override
    protected List<ParseNode> parseRoutineBody(Token keyword) {
        expect("as");
        return parseStatementsUntil("go");
    }

    private ParseNode parseDeclare() {
        Token keyword = cursor.advance();
        List<ParseNode> variables = new ArrayList<>();
        do {
            Token name = expectIdentifier("variable name");
            if (name == null) {
                break;
            }
            List<ParseNode> parts = new ArrayList<>();
            Token typeStart = cursor.peek();
            List<ParseNode> type = new ArrayList<>();
            while (!cursor.atEnd() && !cursor.checkAny(",", "=", ";")) {
                if (cursor.onNewLine() && startsStatement(cursor.peek())) {
                    break;
                }
                type.add(isOpener(cursor.peek()) ? parseGroup() : ParseNode.leaf(cursor.advance()));
            }
            if (!type.isEmpty()) {
                parts.add(ParseNode.of("Type", null, typeStart, type));
            }
            if (cursor.match("=")) {
                parts.add(parseSqlExpression());
            }
            variables.add(ParseNode.of("VariableDeclaration", name.text(), name, nonNull(parts)));
        } while (cursor.match(","));
        endStatement(";");
        return ParseNode.of("DeclareStatement", null, keyword, variables);
    }

    private ParseNode parseSet() {
        Token keyword = cursor.advance();
        List<ParseNode> parts = new ArrayList<>();
        if (!cursor.atEnd() && !cursor.check(";")) {
            parts.add(parseSqlExpression());
            while (!cursor.atEnd() && !cursor.check(";") && !cursor.onNewLine()
                    && !startsStatement(cursor.peek()) && !isCloser(cursor.peek())) {
                parts.add(parseSqlExpression());
            }
        }
        endStatement(";");
        return ParseNode.of("SetStatement", null, keyword, parts);
    }

    private ParseNode parseKeywordExpression(String kind) {
        Token keyword = cursor.advance();
        List<ParseNode> parts = new ArrayList<>();
        if (!cursor.atEnd() && !cursor.check(";") && !startsStatement(cursor.peek())) {
            parts.add(parseSqlExpression());
        }
        endStatement(";");
        return ParseNode.of(kind, null, keyword, parts);
    }

    private ParseNode parseIf() {
        Token keyword = cursor.advance();
        List<ParseNode> parts = new ArrayList<>();
        parts.add(parseCondition(keyword));
        parts.add(parseBody(keyword));
        if (cursor.check("else")) {
            cursor.advance();
            parts.add(parseBody(keyword));
        }
        return ParseNode.of("IfStatement", null, keyword, nonNull(parts));
    }

    private ParseNode parseWhile() {
        Token keyword = cursor.advance();
        List<ParseNode> parts = new ArrayList<>();
        parts.add(parseCondition(keyword));
        parts.add(parseBody(keyword));
        return ParseNode.of("WhileStatement", null, keyword, nonNull(parts));
    }

    private ParseNode parseBody(Token owner) {
        if (cursor.atEnd()) {
            reportAtEnd(Severity.ERROR,
                    "Expected a statement after '" + owner.text() + "' but found end of input", "statement");
            return null;
        }
        return parseNestedStatement();
    }

    /**
     * {@code BEGIN ... END} block, {@code BEGIN TRY/CATCH}, or a transaction statement.
     */
    private ParseNode parseBegin() {
        Token begin = cursor.advance();
        if (cursor.checkAny("tran", "transaction", "distributed")) {
            return parseGeneric(begin, "BeginTransaction");
        }
        String handler = null;
        if (cursor.check("try") || cursor.check("catch")) {
            handler = profile.normalize(cursor.advance().text());
        }
        List<ParseNode> statements = parseStatementsUntil("end");
        if (closeBlock("end") && handler != null) {
            expect(handler);
        }
        String kind = handler == null ? "Block" : capitalize(handler) + "Block";
        return ParseNode.of(kind, null, begin, statements);
    }
}
