package com.polyglot.playground.service.syntax;

import com.polyglot.playground.dto.ParseNode;
import com.polyglot.playground.dto.Severity;
import com.polyglot.playground.dto.Token;
import com.polyglot.playground.dto.TokenCategory;
import com.polyglot.playground.language.LanguageProfile;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

final class JavaScriptParser extends StatementParser {

    private static final Set<String> CLASS_MEMBER_MODIFIERS = Set.of("static", "async", "get", "set", "*");
    private static final Set<String> EXPORTABLE = Set.of("function", "class", "var", "let", "const", "async");
    private static final Set<String> NON_BREAKING_OPERATORS = Set.of("++", "--");

    JavaScriptParser(TokenCursor cursor, LanguageProfile profile, int maxDepth) {
        super(cursor, profile, maxDepth);
    }

    @Override
    protected ParseNode parseStatement() {
        Token token = cursor.peek();
        if (token == null) {
            return null;
        }
        if (token.hasText("{") && token.category() == TokenCategory.DELIMITER) {
            return parseBraceBlock();
        }
        if (token.hasText(";")) {
            cursor.advance();
            return null;
        }
        if (token.isIdentifier() && cursor.checkAt(1, ":")) {
            cursor.advance();
            cursor.advance();
            return ParseNode.of("LabeledStatement", token.text(), token, nonNull(parseBody()));
        }
        if (!token.isKeyword()) {
            return parseExpressionStatement();
        }
        return switch (token.text()) {
            case "var", "let", "const" -> parseVariableDeclaration();
            case "function" -> parseFunction();
            case "async" -> cursor.checkAt(1, "function") ? skipAndParseFunction() : parseExpressionStatement();
            case "class" -> parseClass();
            case "if" -> parseIf();
            case "for" -> parseFor();
            case "while" -> parseWhile();
            case "do" -> parseDoWhile();
            case "return", "throw" -> parseReturnLike();
            case "break", "continue" -> parseJump();
            case "try" -> parseTry();
            case "switch" -> parseSwitch();
            case "import" -> cursor.checkAt(1, "(") ? parseExpressionStatement() : parseModuleStatement();
            case "export" -> parseExport();
            case "else", "catch", "finally", "case", "default", "extends" -> unexpected(token);
            default -> parseExpressionStatement();
        };
    }

    @Override
    protected boolean terminatorOptional() {
        return cursor.atEnd() || cursor.check("}") || cursor.onNewLine();
    }

    /**
     * Automatic semicolon insertion, approximated: a line break ends the expression unless either
     * side of it clearly continues.
     */
    @Override
    protected boolean endsExpression(Token previous, Token next) {
        if (previous == null || next.line() <= previous.line()) {
            return false;
        }
        return !continuesAfter(previous) && !continuesBefore(next);
    }

    private boolean continuesAfter(Token token) {
        if (token.category() == TokenCategory.OPERATOR) {
            return !NON_BREAKING_OPERATORS.contains(token.text());
        }
        return isOpener(token) || token.hasText(",") || token.hasText(".");
    }

    private boolean continuesBefore(Token token) {
        if (token.category() == TokenCategory.OPERATOR) {
            return !NON_BREAKING_OPERATORS.contains(token.text()) && !token.hasText("!") && !token.hasText("~");
        }
        return token.hasText(".") || (token.isKeyword() && (token.hasText("instanceof") || token.hasText("in")));
    }

    private ParseNode parseVariableDeclaration() {
        Token keyword = cursor.advance();
        List<ParseNode> declarators = new ArrayList<>();
        do {
            Token target = cursor.peek();
            ParseNode pattern = null;
            String name = null;
            if (isOpener(target) && !target.hasText("(")) {
                pattern = parseGroup();
            } else {
                Token identifier = expectIdentifier("variable name");
                if (identifier == null) {
                    recover();
                    return ParseNode.of("VariableDeclaration", keyword.text(), keyword, declarators);
                }
                name = identifier.text();
            }
            List<ParseNode> parts = new ArrayList<>();
            if (pattern != null) {
                parts.add(pattern);
            }
            if (cursor.match("=")) {
                ParseNode init = parseExpression();
                if (init == null) {
                    reportMissingExpression("=");
                } else {
                    parts.add(init);
                }
            } else if (keyword.hasText("const") && !cursor.checkAny("of", "in")) {
                report(Severity.ERROR, "Missing initializer in const declaration", target);
            }
            declarators.add(ParseNode.of("VariableDeclarator", name, target, parts));
        } while (cursor.match(","));
        endStatement(";");
        return ParseNode.of("VariableDeclaration", keyword.text(), keyword, declarators);
    }

    private ParseNode skipAndParseFunction() {
        cursor.advance();
        return parseFunction();
    }

    private ParseNode parseFunction() {
        Token keyword = cursor.advance();
        cursor.match("*");
        Token name = expectIdentifier("function name");
        List<ParseNode> parts = new ArrayList<>();
        if (cursor.check("(")) {
            parts.add(parseGroup().withKind("Parameters"));
        } else {
            expect("(");
        }
        parts.add(parseBraceBlock());
        return ParseNode.of("FunctionDeclaration", name == null ? null : name.text(), keyword, nonNull(parts));
    }

    private ParseNode parseClass() {
        Token keyword = cursor.advance();
        Token name = expectIdentifier("class name");
        List<ParseNode> parts = new ArrayList<>();
        if (cursor.match("extends")) {
            ParseNode base = parseExpression(Set.of("{"));
            if (base != null) {
                parts.add(ParseNode.of("Extends", null, keyword, List.of(base)));
            }
        }
        if (expect("{") != null) {
            parts.addAll(parseClassMembers());
            cursor.match("}");
        }
        return ParseNode.of("ClassDeclaration", name == null ? null : name.text(), keyword, parts);
    }

    private List<ParseNode> parseClassMembers() {
        List<ParseNode> members = new ArrayList<>();
        while (!cursor.atEnd() && !cursor.check("}")) {
            int before = cursor.position();
            if (cursor.match(";")) {
                continue;
            }
            while (cursor.peek() != null && CLASS_MEMBER_MODIFIERS.contains(cursor.peek().text())
                    && !cursor.checkAt(1, "(") && !cursor.checkAt(1, "=")) {
                cursor.advance();
            }
            Token name = cursor.peek();
            if (name == null || isCloser(name)) {
                break;
            }
            if (name.hasText("[")) {
                parseGroup();
            } else {
                cursor.advance();
            }
            if (cursor.check("(")) {
                ParseNode parameters = parseGroup().withKind("Parameters");
                ParseNode body = parseBraceBlock();
                members.add(ParseNode.of("MethodDefinition", name.text(), name, nonNull(parameters, body)));
            } else {
                List<ParseNode> parts = new ArrayList<>();
                if (cursor.match("=")) {
                    ParseNode value = parseExpression();
                    if (value != null) {
                        parts.add(value);
                    }
                }
                endStatement(";");
                members.add(ParseNode.of("FieldDefinition", name.text(), name, parts));
            }
            ensureProgress(before);
        }
        return members;
    }

    private ParseNode parseIf() {
        Token keyword = cursor.advance();
        List<ParseNode> parts = new ArrayList<>();
        parts.add(parseCondition());
        parts.add(parseBody());
        if (cursor.match("else")) {
            parts.add(parseBody());
        }
        return ParseNode.of("IfStatement", null, keyword, nonNull(parts));
    }

    private ParseNode parseFor() {
        Token keyword = cursor.advance();
        cursor.match("await");
        ParseNode header = parseCondition();
        return ParseNode.of("ForStatement", null, keyword, nonNull(header == null ? null : header.withKind("ForHeader"),
                parseBody()));
    }

    private ParseNode parseWhile() {
        Token keyword = cursor.advance();
        return ParseNode.of("WhileStatement", null, keyword, nonNull(parseCondition(), parseBody()));
    }

    private ParseNode parseDoWhile() {
        Token keyword = cursor.advance();
        ParseNode body = parseBody();
        ParseNode condition = null;
        if (expect("while") != null) {
            condition = parseCondition();
        }
        endStatement(";");
        return ParseNode.of("DoWhileStatement", null, keyword, nonNull(body, condition));
    }

    private ParseNode parseReturnLike() {
        Token keyword = cursor.advance();
        ParseNode value = null;
        if (!cursor.atEnd() && !cursor.onNewLine() && !cursor.check(";") && !cursor.check("}")) {
            value = parseExpression();
        } else if (keyword.hasText("throw")) {
            reportMissingExpression("throw");
        }
        endStatement(";");
        String kind = keyword.hasText("return") ? "ReturnStatement" : "ThrowStatement";
        return ParseNode.of(kind, null, keyword, nonNull(value));
    }

    private ParseNode parseJump() {
        Token keyword = cursor.advance();
        String label = null;
        if (!cursor.onNewLine() && cursor.peek() != null && cursor.peek().isIdentifier()) {
            label = cursor.advance().text();
        }
        endStatement(";");
        return ParseNode.of(keyword.hasText("break") ? "BreakStatement" : "ContinueStatement", label, keyword, List.of());
    }

    private ParseNode parseTry() {
        Token keyword = cursor.advance();
        List<ParseNode> parts = new ArrayList<>();
        parts.add(parseBraceBlock());
        boolean handled = false;
        if (cursor.check("catch")) {
            Token catchToken = cursor.advance();
            List<ParseNode> clause = new ArrayList<>();
            if (cursor.check("(")) {
                clause.add(parseGroup().withKind("Parameters"));
            }
            clause.add(parseBraceBlock());
            parts.add(ParseNode.of("CatchClause", null, catchToken, nonNull(clause)));
            handled = true;
        }
        if (cursor.check("finally")) {
            Token finallyToken = cursor.advance();
            parts.add(ParseNode.of("FinallyClause", null, finallyToken, nonNull(parseBraceBlock())));
            handled = true;
        }
        if (!handled) {
            Token found = cursor.peek();
            if (found == null || cursor.atEnd()) {
                reportAtEnd(Severity.ERROR, "Missing catch or finally after try", "catch");
            } else {
                report(Severity.ERROR, "Missing catch or finally after try", found,
                        "Expected: catch, Found: " + found.text());
            }
        }
        return ParseNode.of("TryStatement", null, keyword, nonNull(parts));
    }

    private ParseNode parseSwitch() {
        Token keyword = cursor.advance();
        List<ParseNode> parts = new ArrayList<>();
        parts.add(parseCondition());
        if (expect("{") == null) {
            return ParseNode.of("SwitchStatement", null, keyword, nonNull(parts));
        }
        while (!cursor.atEnd() && !cursor.check("}")) {
            int before = cursor.position();
            Token label = cursor.peek();
            if (cursor.match("case")) {
                ParseNode test = parseExpression();
                expect(":");
                parts.add(ParseNode.of("SwitchCase", null, label, nonNull(test)));
            } else if (cursor.match("default")) {
                expect(":");
                parts.add(ParseNode.of("SwitchCase", "default", label, List.of()));
            } else if (isCloser(label)) {
                break;
            } else {
                ParseNode statement = parseNestedStatement();
                if (statement != null) {
                    parts.add(statement);
                }
            }
            ensureProgress(before);
        }
        cursor.match("}");
        return ParseNode.of("SwitchStatement", null, keyword, nonNull(parts));
    }

    private ParseNode parseModuleStatement() {
        Token keyword = cursor.advance();
        List<ParseNode> parts = new ArrayList<>();
        while (!cursor.atEnd() && !cursor.check(";") && !cursor.onNewLine() && !isCloser(cursor.peek())) {
            parts.add(isOpener(cursor.peek()) ? parseGroup() : ParseNode.leaf(cursor.advance()));
        }
        endStatement(";");
        return ParseNode.of(keyword.hasText("import") ? "ImportDeclaration" : "ExportDeclaration", null, keyword, parts);
    }

    private ParseNode parseExport() {
        Token keyword = cursor.peek();
        Token next = cursor.peek(1);
        boolean isDefault = next != null && next.hasText("default");
        Token declaration = cursor.peek(isDefault ? 2 : 1);
        if (declaration != null && declaration.isKeyword() && EXPORTABLE.contains(declaration.text())) {
            cursor.advance();
            if (isDefault) {
                cursor.advance();
            }
            return ParseNode.of("ExportDeclaration", isDefault ? "default" : null, keyword, nonNull(parseNestedStatement()));
        }
        return parseModuleStatement();
    }

    private ParseNode parseExpressionStatement() {
        Token anchor = cursor.peek();
        List<ParseNode> parts = new ArrayList<>();
        do {
            ParseNode expression = parseExpression();
            if (expression == null) {
                Token found = cursor.peek();
                if (found != null && !cursor.atEnd() && !isCloser(found) && !found.hasText(";")) {
                    report(Severity.ERROR, "Unexpected token '" + found.text() + "'", found);
                    cursor.advance();
                }
                break;
            }
            parts.add(expression);
        } while (cursor.match(","));
        endStatement(";");
        if (parts.isEmpty()) {
            return null;
        }
        return ParseNode.of("ExpressionStatement", null, anchor, parts);
    }

    /**
     * Parenthesized condition or header. A missing parenthesis is reported and the bare expression read.
     */
    private ParseNode parseCondition() {
        if (cursor.check("(")) {
            return parseGroup().withKind("Condition");
        }
        expect("(");
        ParseNode bare = parseExpression(Set.of("{"));
        return bare == null ? null : ParseNode.of("Condition", null, cursor.previous(), List.of(bare));
    }

    private ParseNode parseBody() {
        if (cursor.atEnd()) {
            reportAtEnd(Severity.ERROR, "Expected a statement but found end of input", "statement");
            return null;
        }
        return parseNestedStatement();
    }

    private ParseNode unexpected(Token token) {
        report(Severity.ERROR, "Unexpected '" + token.text() + "'", token,
                "Expected: statement, Found: " + token.text());
        cursor.advance();
        recover();
        return null;
    }

    private void reportMissingExpression(String after) {
        Token found = cursor.peek();
        if (found == null || cursor.atEnd()) {
            reportAtEnd(Severity.ERROR, "Expected an expression after '" + after + "' but found end of input",
                    "expression");
        } else {
            report(Severity.ERROR, "Expected an expression after '" + after + "' but found '" + found.text() + "'",
                    found, "Expected: expression, Found: " + found.text());
        }
    }
}
