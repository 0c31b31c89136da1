package com.polyglot.playground.service.syntax;

import com.polyglot.playground.dto.ParseNode;
import com.polyglot.playground.dto.Severity;
import com.polyglot.playground.dto.Token;
import com.polyglot.playground.dto.TokenCategory;
import com.polyglot.playground.dto.TokenKind;
import com.polyglot.playground.language.LanguageProfile;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

final class CppParser extends StatementParser {

    private static final Set<String> QUALIFIERS = Set.of(
            "const", "static", "extern", "inline", "virtual", "unsigned", "signed", "long", "short",
            "constexpr", "mutable", "volatile", "friend", "explicit", "register", "typename");

    private static final Set<String> TYPE_KEYWORDS = Set.of(
            "int", "float", "double", "char", "bool", "void", "long", "short", "unsigned", "signed",
            "auto", "string", "wchar_t");

    private static final Set<String> DECLARATOR_FOLLOWERS = Set.of("(", "=", ";", ",", "[", "{", ":");

    private static final Set<String> FUNCTION_TRAILERS = Set.of("const", "override", "noexcept", "final");

    private static final Set<String> STATEMENT_KEYWORDS = Set.of(
            "using", "typedef", "namespace", "class", "struct", "union", "enum", "template", "if", "for",
            "while", "switch", "do", "return", "throw", "break", "continue", "case", "default", "try",
            "public", "private", "protected", "else", "catch");

    CppParser(TokenCursor cursor, LanguageProfile profile, int maxDepth) {
        super(cursor, profile, maxDepth);
    }

    @Override
    protected ParseNode parseStatement() {
        Token token = cursor.peek();
        if (token == null) {
            return null;
        }
        if (token.kind() == TokenKind.PREPROCESSOR_DIRECTIVE) {
            cursor.advance();
            return ParseNode.of("Directive", token.text(), token, List.of());
        }
        if (token.hasText("{") && token.category() == TokenCategory.DELIMITER) {
            return parseBraceBlock();
        }
        if (token.hasText(";")) {
            cursor.advance();
            return null;
        }
        if (token.isKeyword() && STATEMENT_KEYWORDS.contains(token.text())) {
            return parseKeywordStatement(token);
        }
        int declaratorAt = declarationLength();
        if (declaratorAt > 0) {
            return parseDeclaration(declaratorAt);
        }
        if (startsConstructor()) {
            return parseConstructor();
        }
        return parseExpressionStatement();
    }

    private ParseNode parseKeywordStatement(Token token) {
        return switch (token.text()) {
            case "using", "typedef" -> parseUntilSemicolon(token.hasText("using") ? "UsingDirective" : "Typedef");
            case "namespace" -> parseNamespace();
            case "class", "struct", "union" -> parseClass();
            case "enum" -> parseEnum();
            case "template" -> parseTemplate();
            case "if" -> parseIf();
            case "for", "while", "switch" -> parseLoop();
            case "do" -> parseDoWhile();
            case "return", "throw" -> parseReturnLike();
            case "break", "continue" -> parseJump();
            case "case" -> parseCaseLabel();
            case "default" -> parseDefaultLabel();
            case "try" -> parseTry();
            case "public", "private", "protected" -> parseAccessSpecifier();
            default -> unexpected(token);
        };
    }

    /**
     * Number of tokens in the type part of a declaration at the cursor, or 0 when the statement is
     * not a declaration.
     */
    private int declarationLength() {
        int i = 0;
        while (isWord(cursor.peek(i)) && QUALIFIERS.contains(cursor.peek(i).text())
                && !isDeclaratorName(i)) {
            i++;
        }
        if (i > 0 && TYPE_KEYWORDS.contains(cursor.peek(i - 1).text()) && isDeclaratorName(i)) {
            // long long total;
            return i;
        }
        Token type = cursor.peek(i);
        if (type == null) {
            return 0;
        }
        boolean builtin = type.isKeyword() && TYPE_KEYWORDS.contains(type.text());
        if (!builtin && !type.isIdentifier()) {
            return 0;
        }
        i++;
        while (cursor.checkAt(i, "::") && isWord(cursor.peek(i + 1))) {
            i += 2;
        }
        while (isWord(cursor.peek(i)) && TYPE_KEYWORDS.contains(cursor.peek(i).text())) {
            i++;
        }
        if (cursor.checkAt(i, "<")) {
            i = skipTemplateArguments(i);
            if (i < 0) {
                return 0;
            }
        }
        while (cursor.checkAt(i, "*") || cursor.checkAt(i, "&") || cursor.checkAt(i, "&&")
                || cursor.checkAt(i, "const")) {
            i++;
        }
        return isDeclaratorName(i) ? i : 0;
    }

    private boolean isDeclaratorName(int at) {
        Token name = cursor.peek(at);
        if (name == null || !name.isIdentifier()) {
            return false;
        }
        Token follower = cursor.peek(at + 1);
        if (follower == null) {
            return true;
        }
        if (follower.hasText("::")) {
            return true;
        }
        return DECLARATOR_FOLLOWERS.contains(follower.text()) && follower.category() != TokenCategory.STRING;
    }

    private int skipTemplateArguments(int openAt) {
        int depth = 0;
        int limit = openAt + 64;
        for (int i = openAt; i < limit; i++) {
            Token token = cursor.peek(i);
            if (token == null || token.hasText(";") || token.hasText("{")) {
                return -1;
            }
            if (token.hasText("<")) {
                depth++;
            } else if (token.hasText(">")) {
                depth--;
            } else if (token.hasText(">>")) {
                depth -= 2;
            }
            if (depth <= 0) {
                return i + 1;
            }
        }
        return -1;
    }

    private ParseNode parseDeclaration(int typeLength) {
        Token anchor = cursor.peek();
        StringBuilder type = new StringBuilder();
        for (int i = 0; i < typeLength; i++) {
            Token part = cursor.advance();
            if (type.length() > 0 && !part.hasText("::") && !type.toString().endsWith("::")
                    && !part.hasText("<") && !part.hasText(">") && !type.toString().endsWith("<")) {
                type.append(' ');
            }
            type.append(part.text());
        }
        Token name = cursor.advance();
        String qualifiedName = name.text();
        while (cursor.check("::") && cursor.peek(1) != null) {
            cursor.advance();
            qualifiedName = qualifiedName + "::" + cursor.advance().text();
        }
        if (cursor.check("(")) {
            return parseFunctionRest(anchor, qualifiedName);
        }

        List<ParseNode> declarators = new ArrayList<>();
        declarators.add(parseDeclaratorRest(name));
        while (cursor.match(",")) {
            while (cursor.checkAny("*", "&")) {
                cursor.advance();
            }
            Token next = expectIdentifier("variable name");
            if (next == null) {
                recover();
                return ParseNode.of("VariableDeclaration", type.toString(), anchor, declarators);
            }
            declarators.add(parseDeclaratorRest(next));
        }
        endStatement(";");
        return ParseNode.of("VariableDeclaration", type.toString(), anchor, declarators);
    }

    private ParseNode parseDeclaratorRest(Token name) {
        List<ParseNode> parts = new ArrayList<>();
        while (cursor.check("[")) {
            parts.add(parseGroup());
        }
        if (cursor.match("=")) {
            ParseNode init = parseExpression();
            if (init == null) {
                Token found = cursor.peek();
                report(Severity.ERROR, "Expected an initializer after '='", found == null ? name : found);
            } else {
                parts.add(init);
            }
        } else if (cursor.check("{")) {
            parts.add(parseGroup().withKind("Initializer"));
        }
        return ParseNode.of("Declarator", name.text(), name, parts);
    }

    private ParseNode parseFunctionRest(Token anchor, String name) {
        List<ParseNode> parts = new ArrayList<>();
        parts.add(parseGroup().withKind("Parameters"));
        while (cursor.peek() != null && FUNCTION_TRAILERS.contains(cursor.peek().text())) {
            cursor.advance();
            if (cursor.check("(")) {
                parseGroup();
            }
        }
        if (cursor.match("->")) {
            parseExpression(Set.of("{"));
        }
        if (cursor.match(":")) {
            // constructor initializer list
            while (!cursor.atEnd() && !cursor.check("{") && !cursor.check(";")) {
                if (isOpener(cursor.peek())) {
                    parseGroup();
                } else {
                    cursor.advance();
                }
            }
        }
        if (cursor.check("{")) {
            parts.add(parseBraceBlock());
            return ParseNode.of("FunctionDefinition", name, anchor, parts);
        }
        if (cursor.match("=")) {
            parseExpression();
        }
        endStatement(";");
        return ParseNode.of("FunctionPrototype", name, anchor, parts);
    }

    /**
     * Constructors and destructors have no return type: {@code Name(...)} followed by a body or an
     * initializer list.
     */
    private boolean startsConstructor() {
        int i = 0;
        if (cursor.checkAt(i, "~")) {
            i++;
        }
        if (!isWord(cursor.peek(i))) {
            return false;
        }
        i++;
        while (cursor.checkAt(i, "::")) {
            i += cursor.checkAt(i + 1, "~") ? 3 : 2;
        }
        if (!cursor.checkAt(i, "(")) {
            return false;
        }
        int depth = 0;
        for (int j = i; cursor.peek(j) != null; j++) {
            Token token = cursor.peek(j);
            if (token.hasText("(")) {
                depth++;
            } else if (token.hasText(")") && --depth == 0) {
                return cursor.checkAt(j + 1, "{") || cursor.checkAt(j + 1, ":");
            } else if (token.hasText(";") || token.hasText("{") || token.hasText("}")) {
                return false;
            }
        }
        return false;
    }

    private ParseNode parseConstructor() {
        Token anchor = cursor.peek();
        StringBuilder name = new StringBuilder();
        while (!cursor.atEnd() && !cursor.check("(")) {
            name.append(cursor.advance().text());
        }
        return parseFunctionRest(anchor, name.toString());
    }

    private ParseNode parseNamespace() {
        Token keyword = cursor.advance();
        String name = cursor.peek() != null && cursor.peek().isIdentifier() ? cursor.advance().text() : null;
        return ParseNode.of("Namespace", name, keyword, nonNull(parseBraceBlock()));
    }

    private ParseNode parseClass() {
        Token keyword = cursor.advance();
        Token name = expectIdentifier(keyword.text() + " name");
        List<ParseNode> parts = new ArrayList<>();
        if (cursor.match(":")) {
            ParseNode bases = parseExpression(Set.of("{"));
            if (bases != null) {
                parts.add(ParseNode.of("BaseClause", null, keyword, List.of(bases)));
            }
        }
        if (cursor.check("{")) {
            Token open = cursor.advance();
            parts.add(ParseNode.of("ClassBody", null, open, parseStatementsUntil("}")));
            cursor.match("}");
            endStatement(";");
        } else {
            endStatement(";");
        }
        return ParseNode.of(capitalizedKind(keyword), name == null ? null : name.text(), keyword, parts);
    }

    private static String capitalizedKind(Token keyword) {
        return switch (keyword.text()) {
            case "struct" -> "StructDeclaration";
            case "union" -> "UnionDeclaration";
            default -> "ClassDeclaration";
        };
    }

    private ParseNode parseEnum() {
        Token keyword = cursor.advance();
        cursor.match("class");
        String name = cursor.peek() != null && cursor.peek().isIdentifier() ? cursor.advance().text() : null;
        if (cursor.match(":")) {
            cursor.advance();
        }
        List<ParseNode> parts = new ArrayList<>();
        if (cursor.check("{")) {
            parts.add(parseGroup().withKind("Enumerators"));
        }
        endStatement(";");
        return ParseNode.of("EnumDeclaration", name, keyword, parts);
    }

    private ParseNode parseTemplate() {
        Token keyword = cursor.advance();
        if (cursor.check("<")) {
            int end = skipTemplateArguments(0);
            int count = end < 0 ? 1 : end;
            for (int i = 0; i < count; i++) {
                cursor.advance();
            }
        }
        if (cursor.atEnd()) {
            reportAtEnd(Severity.ERROR, "Expected a declaration after template but found end of input", "declaration");
            return null;
        }
        return ParseNode.of("TemplateDeclaration", null, keyword, nonNull(parseNestedStatement()));
    }

    private ParseNode parseIf() {
        Token keyword = cursor.advance();
        cursor.match("constexpr");
        List<ParseNode> parts = new ArrayList<>();
        parts.add(parseCondition());
        parts.add(parseBody());
        if (cursor.match("else")) {
            parts.add(parseBody());
        }
        return ParseNode.of("IfStatement", null, keyword, nonNull(parts));
    }

    private ParseNode parseLoop() {
        Token keyword = cursor.advance();
        String kind = switch (keyword.text()) {
            case "for" -> "ForStatement";
            case "while" -> "WhileStatement";
            default -> "SwitchStatement";
        };
        return ParseNode.of(kind, null, keyword, nonNull(parseCondition(), parseBody()));
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
        ParseNode value = cursor.check(";") ? null : parseExpression();
        endStatement(";");
        return ParseNode.of(keyword.hasText("return") ? "ReturnStatement" : "ThrowStatement", null, keyword,
                nonNull(value));
    }

    private ParseNode parseJump() {
        Token keyword = cursor.advance();
        endStatement(";");
        return ParseNode.of(keyword.hasText("break") ? "BreakStatement" : "ContinueStatement", null, keyword,
                List.of());
    }

    private ParseNode parseCaseLabel() {
        Token keyword = cursor.advance();
        ParseNode value = parseExpression();
        expect(":");
        return ParseNode.of("CaseLabel", null, keyword, nonNull(value));
    }

    private ParseNode parseDefaultLabel() {
        Token keyword = cursor.advance();
        expect(":");
        return ParseNode.of("CaseLabel", "default", keyword, List.of());
    }

    private ParseNode parseAccessSpecifier() {
        Token keyword = cursor.advance();
        expect(":");
        return ParseNode.of("AccessSpecifier", keyword.text(), keyword, List.of());
    }

    private ParseNode parseTry() {
        Token keyword = cursor.advance();
        List<ParseNode> parts = new ArrayList<>();
        parts.add(parseBraceBlock());
        if (!cursor.check("catch")) {
            Token found = cursor.peek();
            if (found == null || cursor.atEnd()) {
                reportAtEnd(Severity.ERROR, "Expected 'catch' after try block but found end of input", "catch");
            } else {
                report(Severity.ERROR, "Expected 'catch' after try block", found,
                        "Expected: catch, Found: " + found.text());
            }
        }
        while (cursor.check("catch")) {
            Token catchToken = cursor.advance();
            parts.add(ParseNode.of("CatchClause", null, catchToken, nonNull(parseCondition(), parseBraceBlock())));
        }
        return ParseNode.of("TryStatement", null, keyword, nonNull(parts));
    }

    private ParseNode parseUntilSemicolon(String kind) {
        Token keyword = cursor.advance();
        List<ParseNode> parts = new ArrayList<>();
        while (!cursor.atEnd() && !cursor.check(";") && !isCloser(cursor.peek())
                && cursor.peek().kind() != TokenKind.PREPROCESSOR_DIRECTIVE) {
            parts.add(isOpener(cursor.peek()) ? parseGroup() : ParseNode.leaf(cursor.advance()));
        }
        endStatement(";");
        return ParseNode.of(kind, null, keyword, parts);
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
        return parts.isEmpty() ? null : ParseNode.of("ExpressionStatement", null, anchor, parts);
    }

    private ParseNode parseCondition() {
        if (cursor.check("(")) {
            return parseGroup().withKind("Condition");
        }
        expect("(");
        return null;
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

    private static boolean isWord(Token token) {
        return token != null && (token.isKeyword() || token.isIdentifier());
    }
}
