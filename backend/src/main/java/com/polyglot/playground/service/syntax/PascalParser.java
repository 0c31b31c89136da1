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
import java.util.Set;

final class PascalParser extends StatementParser {

    private static final Set<String> STOP_WORDS = Set.of(
            "then", "do", "of", "to", "downto", "else", "end", "until", "otherwise");

    private static final Set<String> SECTION_KEYWORDS = Set.of(
            "var", "const", "type", "label", "procedure", "function", "uses");

    private static final Set<String> TYPE_TERMINATORS = Set.of(
            "var", "const", "type", "begin", "procedure", "function");

    PascalParser(TokenCursor cursor, LanguageProfile profile, int maxDepth) {
        super(cursor, profile, maxDepth);
    }

    @Override
    List<ParseNode> parseProgram() {
        Token first = cursor.peek();
        if (first == null) {
            return List.of();
        }
        if (!cursor.check("program") && !cursor.check("unit")) {
            report(Severity.WARNING, "Expected 'program' header but found '" + first.text() + "'", first,
                    "Expected: program, Found: " + first.text());
        }
        List<ParseNode> nodes = new ArrayList<>();
        while (!cursor.atEnd()) {
            if (isCloser(cursor.peek())) {
                cursor.advance();
                continue;
            }
            int before = cursor.position();
            ParseNode node = parseTopLevel();
            if (node != null) {
                nodes.add(node);
            }
            ensureProgress(before);
        }
        return nodes;
    }

    @Override
    protected Set<String> expressionStopWords() {
        return STOP_WORDS;
    }

    /**
     * A line break ends a statement whose last token could close it, unless the next line opens
     * with an operator.
     */
    @Override
    protected boolean endsExpression(Token previous, Token next) {
        if (previous == null || next.line() <= previous.line()) {
            return false;
        }
        boolean closable = previous.isIdentifier() || previous.isLiteral() || isCloser(previous);
        return closable && (next.isIdentifier() || next.isKeyword()) && !next.hasTextIgnoreCase("and")
                && !next.hasTextIgnoreCase("or") && !next.hasTextIgnoreCase("div") && !next.hasTextIgnoreCase("mod");
    }

    private ParseNode parseTopLevel() {
        Token token = cursor.peek();
        if (!token.isKeyword()) {
            return parseStatement();
        }
        return switch (profile.normalize(token.text())) {
            case "program", "unit" -> parseHeader();
            case "begin" -> parseMainBlock();
            default -> SECTION_KEYWORDS.contains(profile.normalize(token.text()))
                    ? parseDeclarationSection() : parseStatement();
        };
    }

    private ParseNode parseHeader() {
        Token keyword = cursor.advance();
        Token name = expectIdentifier("program name");
        if (cursor.check("(")) {
            parseGroup();
        }
        endStatement(";");
        return ParseNode.of("ProgramHeader", name == null ? null : name.text(), keyword, List.of());
    }

    private ParseNode parseMainBlock() {
        ParseNode block = parseCompound();
        if (cursor.match(".")) {
            return block.withKind("MainBlock");
        }
        Token end = cursor.previous();
        Token found = cursor.peek();
        String foundText = found == null || cursor.atEnd() ? "end of input" : found.text();
        diagnostics.add(new Diagnostic(Phase.SYNTACTIC, "Missing '.' at end of program", end.line(),
                end.endColumn(), end.endOffset(), Severity.WARNING, "Expected: ., Found: " + foundText));
        cursor.match(";");
        return block.withKind("MainBlock");
    }

    private ParseNode parseDeclarationSection() {
        Token keyword = cursor.peek();
        return switch (profile.normalize(keyword.text())) {
            case "var" -> parseVarSection();
            case "const" -> parseConstSection();
            case "type" -> parseTypeSection();
            case "procedure", "function" -> parseRoutine();
            default -> parseNameList();
        };
    }

    private ParseNode parseVarSection() {
        Token keyword = cursor.advance();
        List<ParseNode> declarations = new ArrayList<>();
        while (!cursor.atEnd() && cursor.peek().isIdentifier()) {
            Token first = cursor.peek();
            List<ParseNode> names = new ArrayList<>();
            do {
                Token name = expectIdentifier("variable name");
                if (name == null) {
                    break;
                }
                names.add(ParseNode.leaf(name));
            } while (cursor.match(","));
            expect(":");
            names.add(parseTypeSpec());
            if (cursor.match("=")) {
                ParseNode init = parseExpression();
                if (init != null) {
                    names.add(init);
                }
            }
            endStatement(";");
            declarations.add(ParseNode.of("VariableDeclaration", null, first, names));
        }
        return ParseNode.of("VarSection", null, keyword, declarations);
    }

    private ParseNode parseConstSection() {
        Token keyword = cursor.advance();
        List<ParseNode> declarations = new ArrayList<>();
        while (!cursor.atEnd() && cursor.peek().isIdentifier()) {
            Token name = cursor.advance();
            List<ParseNode> parts = new ArrayList<>();
            if (cursor.match(":")) {
                parts.add(parseTypeSpec());
            }
            expect("=");
            ParseNode value = parseExpression();
            if (value != null) {
                parts.add(value);
            }
            endStatement(";");
            declarations.add(ParseNode.of("ConstDeclaration", name.text(), name, parts));
        }
        return ParseNode.of("ConstSection", null, keyword, declarations);
    }

    private ParseNode parseTypeSection() {
        Token keyword = cursor.advance();
        List<ParseNode> declarations = new ArrayList<>();
        while (!cursor.atEnd() && cursor.peek().isIdentifier()) {
            Token name = cursor.advance();
            expect("=");
            ParseNode type = parseTypeSpec();
            endStatement(";");
            declarations.add(ParseNode.of("TypeDeclaration", name.text(), name, List.of(type)));
        }
        return ParseNode.of("TypeSection", null, keyword, declarations);
    }

    private ParseNode parseNameList() {
        Token keyword = cursor.advance();
        List<ParseNode> names = new ArrayList<>();
        while (!cursor.atEnd() && !cursor.check(";") && !isRecoveryPoint(cursor.peek())) {
            names.add(ParseNode.leaf(cursor.advance()));
        }
        endStatement(";");
        return ParseNode.of("UsesClause", null, keyword, names);
    }

    /**
     * Type denoter up to the next {@code ;}, {@code =} or closing parenthesis. Record bodies are
     * consumed through their matching {@code end}.
     */
    private ParseNode parseTypeSpec() {
        Token anchor = cursor.peek();
        if (anchor == null || cursor.atEnd()) {
            reportAtEnd(Severity.ERROR, "Expected a type but found end of input", "type");
            return ParseNode.of("Type", null, cursor.last(), List.of());
        }
        StringBuilder text = new StringBuilder();
        List<ParseNode> parts = new ArrayList<>();
        while (!cursor.atEnd() && !cursor.check(";") && !cursor.check("=") && !isCloser(cursor.peek())) {
            Token token = cursor.peek();
            if (!parts.isEmpty() && token.isKeyword() && TYPE_TERMINATORS.contains(profile.normalize(token.text()))) {
                break;
            }
            if (cursor.check("record")) {
                parts.add(parseRecord());
                text.append("record");
                continue;
            }
            if (isOpener(token)) {
                parts.add(parseGroup());
                continue;
            }
            cursor.advance();
            if (text.length() > 0) {
                text.append(' ');
            }
            text.append(token.text());
            parts.add(ParseNode.leaf(token));
        }
        if (parts.isEmpty()) {
            Token found = cursor.peek();
            report(Severity.ERROR, "Expected a type but found '" + found.text() + "'", found,
                    "Expected: type, Found: " + found.text());
        }
        return ParseNode.of("Type", text.toString(), anchor, parts);
    }

    private ParseNode parseRecord() {
        Token keyword = cursor.advance();
        List<ParseNode> fields = new ArrayList<>();
        while (!cursor.atEnd() && !cursor.check("end")) {
            Token first = cursor.peek();
            if (!first.isIdentifier()) {
                cursor.advance();
                continue;
            }
            List<ParseNode> names = new ArrayList<>();
            do {
                Token name = expectIdentifier("field name");
                if (name == null) {
                    break;
                }
                names.add(ParseNode.leaf(name));
            } while (cursor.match(","));
            expect(":");
            names.add(parseTypeSpec());
            cursor.match(";");
            fields.add(ParseNode.of("FieldDeclaration", null, first, names));
        }
        cursor.match("end");
        return ParseNode.of("Record", null, keyword, fields);
    }

    private ParseNode parseRoutine() {
        Token keyword = cursor.advance();
        boolean function = keyword.hasTextIgnoreCase("function");
        Token name = expectIdentifier(function ? "function name" : "procedure name");
        String routineName = name == null ? null : name.text();
        while (name != null && cursor.check(".") && cursor.peek(1) != null && cursor.peek(1).isIdentifier()) {
            cursor.advance();
            routineName = routineName + "." + cursor.advance().text();
        }
        List<ParseNode> parts = new ArrayList<>();
        if (cursor.check("(")) {
            parts.add(parseGroup().withKind("Parameters"));
        }
        if (function) {
            if (expect(":") != null) {
                parts.add(parseTypeSpec().withKind("ReturnType"));
            }
        }
        endStatement(";");
        if (cursor.check("forward") || cursor.check("external")) {
            cursor.advance();
            endStatement(";");
            return ParseNode.of(function ? "FunctionDeclaration" : "ProcedureDeclaration", routineName, keyword, parts);
        }
        while (!cursor.atEnd() && cursor.peek().isKeyword()
                && SECTION_KEYWORDS.contains(profile.normalize(cursor.peek().text()))) {
            int before = cursor.position();
            parts.add(parseDeclarationSection());
            ensureProgress(before);
        }
        if (cursor.check("begin")) {
            parts.add(parseCompound());
            endStatement(";");
        } else {
            expect("begin");
        }
        return ParseNode.of(function ? "FunctionDeclaration" : "ProcedureDeclaration", routineName, keyword, parts);
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
            return parseSimpleStatement();
        }
        return switch (profile.normalize(token.text())) {
            case "begin" -> parseCompound();
            case "if" -> parseIf();
            case "while" -> parseWhile();
            case "for" -> parseFor();
            case "repeat" -> parseRepeat();
            case "case" -> parseCase();
            case "with" -> parseWith();
            case "goto" -> parseGoto();
            case "end", "until", "else", "then", "do", "of", "var", "const", "type", "procedure", "function",
                 "program", "uses" -> unexpected(token);
            default -> parseSimpleStatement();
        };
    }

    private ParseNode parseCompound() {
        Token begin = cursor.advance();
        List<ParseNode> statements = parseSequence("end");
        cursor.match("end");
        return ParseNode.of("CompoundStatement", null, begin, statements);
    }

    /**
     * Statements separated by {@code ;} up to {@code terminator}, which is left for the caller.
     */
    private List<ParseNode> parseSequence(String... terminators) {
        List<ParseNode> statements = new ArrayList<>();
        while (!cursor.atEnd() && !cursor.checkAny(terminators)) {
            if (isCloser(cursor.peek())) {
                cursor.advance();
                continue;
            }
            int before = cursor.position();
            ParseNode statement = parseNestedStatement();
            if (statement != null) {
                statements.add(statement);
            }
            if (!cursor.atEnd() && !cursor.checkAny(terminators) && cursor.position() > before) {
                endStatement(";");
            }
            ensureProgress(before);
        }
        return statements;
    }

    private ParseNode parseSimpleStatement() {
        Token anchor = cursor.peek();
        ParseNode expression = parseExpression();
        if (expression == null) {
            report(Severity.ERROR, "Unexpected '" + anchor.text() + "'", anchor,
                    "Expected: statement, Found: " + anchor.text());
            cursor.advance();
            return null;
        }
        boolean assignment = expression.children().stream()
                .anyMatch(child -> ":=".equals(child.value()) && "Operator".equals(child.kind()));
        return ParseNode.of(assignment ? "Assignment" : "ProcedureCall", null, anchor, List.of(expression));
    }

    private ParseNode parseIf() {
        Token keyword = cursor.advance();
        List<ParseNode> parts = new ArrayList<>();
        parts.add(parseCondition("then"));
        parts.add(parseBody());
        if (cursor.match("else")) {
            parts.add(parseBody());
        }
        return ParseNode.of("IfStatement", null, keyword, nonNull(parts));
    }

    private ParseNode parseWhile() {
        Token keyword = cursor.advance();
        return ParseNode.of("WhileStatement", null, keyword, nonNull(parseCondition("do"), parseBody()));
    }

    private ParseNode parseWith() {
        Token keyword = cursor.advance();
        return ParseNode.of("WithStatement", null, keyword, nonNull(parseCondition("do"), parseBody()));
    }

    private ParseNode parseFor() {
        Token keyword = cursor.advance();
        List<ParseNode> parts = new ArrayList<>();
        Token variable = expectIdentifier("loop variable");
        if (variable != null) {
            parts.add(ParseNode.leaf(variable));
        }
        expect(":=");
        ParseNode from = parseExpression();
        if (from != null) {
            parts.add(from);
        }
        if (!cursor.match("to") && !cursor.match("downto")) {
            Token found = cursor.peek();
            if (found == null || cursor.atEnd()) {
                reportAtEnd(Severity.ERROR, "Expected 'to' or 'downto' but found end of input", "to");
            } else {
                report(Severity.ERROR, "Expected 'to' or 'downto' but found '" + found.text() + "'", found,
                        "Expected: to, Found: " + found.text());
            }
        }
        parts.add(parseCondition("do"));
        parts.add(parseBody());
        return ParseNode.of("ForStatement", variable == null ? null : variable.text(), keyword, nonNull(parts));
    }

    private ParseNode parseRepeat() {
        Token keyword = cursor.advance();
        List<ParseNode> parts = new ArrayList<>(parseSequence("until"));
        if (expect("until") != null) {
            ParseNode condition = parseExpression();
            if (condition != null) {
                parts.add(ParseNode.of("Condition", null, keyword, List.of(condition)));
            }
        }
        return ParseNode.of("RepeatStatement", null, keyword, parts);
    }

    private ParseNode parseCase() {
        Token keyword = cursor.advance();
        List<ParseNode> parts = new ArrayList<>();
        parts.add(parseCondition("of"));
        while (!cursor.atEnd() && !cursor.check("end")) {
            int before = cursor.position();
            Token label = cursor.peek();
            if (cursor.match("else") || cursor.match("otherwise")) {
                parts.add(ParseNode.of("CaseElse", null, label, parseSequence("end")));
                break;
            }
            List<ParseNode> values = new ArrayList<>();
            do {
                ParseNode value = parseExpression();
                if (value != null) {
                    values.add(value);
                }
            } while (cursor.match(","));
            expect(":");
            values.add(parseBody());
            parts.add(ParseNode.of("CaseBranch", null, label, nonNull(values)));
            if (!cursor.match(";") && !cursor.check("end") && !cursor.check("else")) {
                endStatement(";");
            }
            ensureProgress(before);
        }
        cursor.match("end");
        return ParseNode.of("CaseStatement", null, keyword, nonNull(parts));
    }

    private ParseNode parseGoto() {
        Token keyword = cursor.advance();
        Token target = cursor.advance();
        return ParseNode.of("GotoStatement", target == null ? null : target.text(), keyword, List.of());
    }

    /**
     * Expression followed by a required keyword such as {@code then} or {@code do}.
     */
    private ParseNode parseCondition(String keyword) {
        Token anchor = cursor.peek();
        ParseNode condition = parseExpression();
        expect(keyword);
        if (condition == null || anchor == null) {
            return null;
        }
        return ParseNode.of("Condition", null, anchor, List.of(condition));
    }

    private ParseNode parseBody() {
        if (cursor.atEnd()) {
            reportAtEnd(Severity.ERROR, "Expected a statement but found end of input", "statement");
            return null;
        }
        if (cursor.checkCategory(TokenCategory.DELIMITER) && cursor.check(";")) {
            return null;
        }
        return parseNestedStatement();
    }

    private ParseNode unexpected(Token token) {
        report(Severity.ERROR, "Unexpected '" + token.text() + "'", token,
                "Expected: statement, Found: " + token.text());
        cursor.advance();
        return null;
    }
}
