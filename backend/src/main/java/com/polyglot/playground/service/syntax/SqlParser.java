package com.polyglot.playground.service.syntax;

import com.polyglot.playground.dto.ParseNode;
import com.polyglot.playground.dto.Severity;
import com.polyglot.playground.dto.Token;
import com.polyglot.playground.language.LanguageProfile;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

abstract class SqlParser extends StatementParser {

    private static final Set<String> CLAUSE_KEYWORDS = Set.of(
            "from", "where", "group", "order", "having", "values", "into", "join", "inner", "left", "right",
            "full", "cross", "on", "union", "intersect", "minus", "except", "returning", "output");

    private static final Set<String> BLOCK_WORDS = Set.of(
            "begin", "end", "then", "else", "elsif", "when", "loop", "exception");

    private static final Set<String> NESTED_SELECT_VERBS = Set.of("insert", "create", "with");

    private static final Set<String> SET_OPERATORS = Set.of("union", "all", "intersect", "minus", "except", "as");

    private static final Set<String> CONSTRAINT_WORDS = Set.of(
            "constraint", "primary", "foreign", "unique", "check", "key", "index");

    private final Set<String> stopWords;

    protected SqlParser(TokenCursor cursor, LanguageProfile profile, int maxDepth) {
        super(cursor, profile, maxDepth);
        Set<String> words = new HashSet<>(CLAUSE_KEYWORDS);
        words.addAll(BLOCK_WORDS);
        words.addAll(profile.statementKeywords());
        words.addAll(Set.of("set", "case", "is", "as", "declare"));
        this.stopWords = Set.copyOf(words);
    }

    @Override
    protected Set<String> expressionStopWords() {
        return stopWords;
    }

    @Override
    protected boolean endsExpression(Token previous, Token next) {
        if (previous == null || next.line() <= previous.line()) {
            return false;
        }
        return (previous.isIdentifier() || previous.isLiteral() || isCloser(previous)) && next.isIdentifier();
    }

    /**
     * Parameters, return type and body of a stored routine, after its name.
     */
    protected abstract List<ParseNode> parseRoutineBody(Token keyword);

    // data manipulation

    protected ParseNode parseDml() {
        return parseDml(cursor.advance());
    }

    protected ParseNode parseDml(Token verb) {
        String verbWord = profile.normalize(verb.text());
        if (verbWord.equals("merge")) {
            return parseGeneric(verb, "MergeStatement");
        }
        List<ParseNode> clauses = new ArrayList<>();
        Token clause = verb;
        List<ParseNode> items = new ArrayList<>();
        while (!cursor.atEnd() && !cursor.check(";")) {
            Token next = cursor.peek();
            if (isCloser(next)) {
                break;
            }
            if (!items.isEmpty() && endsExpression(cursor.previous(), next)) {
                break;
            }
            if (next.isKeyword() && isClause(verbWord, next)) {
                clauses.add(ParseNode.of("Clause", profile.normalize(clause.text()), clause, items));
                items = new ArrayList<>();
                clause = cursor.advance();
                continue;
            }
            if (cursor.check("case")) {
                items.add(parseCaseExpression());
                continue;
            }
            if (next.isKeyword() && startsNextStatement(verbWord, next)) {
                break;
            }
            if (cursor.match(",")) {
                continue;
            }
            items.add(parseSqlExpression());
        }
        clauses.add(ParseNode.of("Clause", profile.normalize(clause.text()), clause, items));
        ParseNode statement = ParseNode.of(capitalize(verbWord) + "Statement", null, verb, clauses);
        endStatement(";");
        return statement;
    }

    private boolean isClause(String verbWord, Token token) {
        String word = profile.normalize(token.text());
        if (word.equals("set")) {
            return verbWord.equals("update");
        }
        return CLAUSE_KEYWORDS.contains(word);
    }

    private boolean startsNextStatement(String verbWord, Token token) {
        String word = profile.normalize(token.text());
        if (BLOCK_WORDS.contains(word)) {
            return true;
        }
        if (!profile.statementKeywords().contains(word)) {
            return false;
        }
        if (word.equals("select")) {
            Token previous = cursor.previous();
            boolean chained = previous != null && SET_OPERATORS.contains(profile.normalize(previous.text()));
            return !chained && !NESTED_SELECT_VERBS.contains(verbWord);
        }
        return true;
    }

    /**
     * Expression that may contain {@code CASE ... END} sections. Consumes at least one token, or
     * reports the end of input and returns {@code null}.
     */
    protected ParseNode parseSqlExpression() {
        if (cursor.atEnd()) {
            reportAtEnd(Severity.ERROR, "Expected expression but found end of input", "expression");
            return null;
        }
        Token anchor = cursor.peek();
        List<ParseNode> parts = new ArrayList<>();
        while (!cursor.atEnd()) {
            if (cursor.check("case")) {
                parts.add(parseCaseExpression());
                continue;
            }
            ParseNode expression = parseExpression();
            if (expression == null) {
                break;
            }
            parts.add(expression);
            if (!cursor.check("case")) {
                break;
            }
        }
        if (parts.isEmpty()) {
            return ParseNode.leaf(cursor.advance());
        }
        return parts.size() == 1 ? parts.get(0) : ParseNode.of("Expression", null, anchor, parts);
    }

    protected ParseNode parseCondition(Token keyword) {
        if (cursor.atEnd()) {
            reportAtEnd(Severity.ERROR, "Expected condition but found end of input", "condition");
            return null;
        }
        return ParseNode.of("Condition", null, keyword, List.of(parseSqlExpression()));
    }

    protected ParseNode parseCaseExpression() {
        Token keyword = cursor.advance();
        List<ParseNode> parts = new ArrayList<>();
        int nested = 1;
        while (!cursor.atEnd()) {
            if (cursor.check("case")) {
                nested++;
            } else if (cursor.check("end")) {
                nested--;
                if (nested == 0) {
                    cursor.advance();
                    break;
                }
            }
            parts.add(ParseNode.leaf(cursor.advance()));
        }
        return ParseNode.of("CaseExpression", null, keyword, parts);
    }

    /**
     * Everything up to the terminator, or up to a statement keyword opening a new line.
     */
    protected ParseNode parseGeneric(Token verb, String kind) {
        List<ParseNode> parts = new ArrayList<>();
        while (!cursor.atEnd() && !cursor.check(";")) {
            Token next = cursor.peek();
            if (cursor.onNewLine() && startsStatement(next)) {
                break;
            }
            if (isCloser(next)) {
                break;
            }
            parts.add(isOpener(next) ? parseGroup() : ParseNode.leaf(cursor.advance()));
        }
        endStatement(";");
        return ParseNode.of(kind, null, verb, parts);
    }

    protected boolean startsStatement(Token token) {
        String word = profile.normalize(token.text());
        return token.isKeyword() && (profile.statementKeywords().contains(word) || BLOCK_WORDS.contains(word));
    }

    // definitions

    protected ParseNode parseCreate() {
        Token verb = cursor.advance();
        if (cursor.check("or") && cursor.peek(1) != null) {
            cursor.advance();
            cursor.advance();
        }
        Token object = cursor.peek();
        if (object == null || cursor.atEnd()) {
            reportAtEnd(Severity.ERROR, "Expected an object type after 'CREATE' but found end of input", "table");
            return ParseNode.of("CreateStatement", null, verb, List.of());
        }
        return switch (profile.normalize(object.text())) {
            case "table" -> parseCreateTable(verb);
            case "procedure", "proc", "function", "trigger", "package" -> parseCreateRoutine(verb);
            default -> parseDml(verb).withKind("CreateStatement");
        };
    }

    private ParseNode parseCreateTable(Token verb) {
        cursor.advance();
        Token name = objectName("table name");
        String tableName = name == null ? null : qualifiedRest(name.text());
        List<ParseNode> parts = new ArrayList<>();
        if (cursor.check("(")) {
            parts.add(parseColumnList());
        } else if (cursor.check("as")) {
            cursor.advance();
            if (!cursor.atEnd() && cursor.peek().isKeyword()) {
                parts.add(parseDml());
                return ParseNode.of("CreateTableStatement", tableName, verb, parts);
            }
        } else if (name != null) {
            Token found = cursor.peek();
            String foundText = found == null || cursor.atEnd() ? "end of input" : found.text();
            report(Severity.ERROR, "CREATE TABLE '" + tableName + "' is missing its column definitions", name,
                    "Expected: (, Found: " + foundText);
        }
        endStatement(";");
        return ParseNode.of("CreateTableStatement", tableName, verb, parts);
    }

    private ParseNode parseColumnList() {
        Token open = cursor.advance();
        List<ParseNode> columns = new ArrayList<>();
        List<ParseNode> current = new ArrayList<>();
        while (!cursor.atEnd()) {
            Token next = cursor.peek();
            if (cursor.check(")")) {
                cursor.advance();
                break;
            }
            if (isCloser(next)) {
                break;
            }
            if (cursor.check(",")) {
                cursor.advance();
                addColumn(columns, current);
                current = new ArrayList<>();
                continue;
            }
            current.add(isOpener(next) ? parseGroup() : ParseNode.leaf(cursor.advance()));
        }
        addColumn(columns, current);
        return ParseNode.of("ColumnList", null, open, columns);
    }

    private void addColumn(List<ParseNode> columns, List<ParseNode> parts) {
        if (parts.isEmpty()) {
            return;
        }
        ParseNode first = parts.get(0);
        String word = first.value() == null ? "" : first.value().toLowerCase(Locale.ROOT);
        String kind = CONSTRAINT_WORDS.contains(word) ? "TableConstraint" : "ColumnDefinition";
        columns.add(new ParseNode(kind, first.value(), parts.subList(1, parts.size()), first.line(), first.column()));
    }

    private ParseNode parseCreateRoutine(Token verb) {
        Token keyword = cursor.advance();
        Token name = objectName(profile.normalize(keyword.text()) + " name");
        String routineName = name == null ? null : qualifiedRest(name.text());
        List<ParseNode> parts = new ArrayList<>();
        if (cursor.check("(")) {
            parts.add(parseGroup().withKind("Parameters"));
        } else {
            List<ParseNode> header = new ArrayList<>();
            while (!cursor.atEnd() && !cursor.checkAny("as", "is", "return", "returns", "begin", "declare", ";")) {
                header.add(isOpener(cursor.peek()) ? parseGroup() : ParseNode.leaf(cursor.advance()));
            }
            if (!header.isEmpty()) {
                parts.add(ParseNode.of("Parameters", null, keyword, header));
            }
        }
        if (cursor.check("return") || cursor.check("returns")) {
            Token returns = cursor.advance();
            List<ParseNode> type = new ArrayList<>();
            while (!cursor.atEnd() && !cursor.checkAny("as", "is", "begin", ";")) {
                type.add(isOpener(cursor.peek()) ? parseGroup() : ParseNode.leaf(cursor.advance()));
            }
            parts.add(ParseNode.of("ReturnType", null, returns, type));
        }
        parts.addAll(parseRoutineBody(keyword));
        String object = profile.normalize(keyword.text());
        String kind = object.equals("proc") ? "Procedure" : capitalize(object);
        return ParseNode.of("Create" + kind, routineName, verb, parts);
    }

    /**
     * Identifier or non-clause keyword naming a schema object.
     */
    protected Token objectName(String what) {
        Token token = cursor.peek();
        if (token != null && !cursor.atEnd() && token.isKeyword() && !cursor.checkAny("as", "is", "begin")
                && !CLAUSE_KEYWORDS.contains(profile.normalize(token.text()))) {
            return cursor.advance();
        }
        return expectIdentifier(what);
    }

    private String qualifiedRest(String first) {
        StringBuilder name = new StringBuilder(first);
        while (cursor.check(".") && cursor.peek(1) != null) {
            cursor.advance();
            name.append('.').append(cursor.advance().text());
        }
        return name.toString();
    }

    /**
     * Consumes the closing keyword of a block. A block still open at the end of input is left to
     * the BEGIN/END balance check.
     */
    protected boolean closeBlock(String word) {
        if (cursor.match(word)) {
            return true;
        }
        if (!cursor.atEnd()) {
            expect(word);
        }
        return false;
    }

    protected ParseNode unexpected(Token token) {
        report(Severity.ERROR, "Unexpected '" + token.text() + "'", token,
                "Expected: statement, Found: " + token.text());
        cursor.advance();
        return null;
    }

    protected static String capitalize(String word) {
        return word.isEmpty() ? word : Character.toUpperCase(word.charAt(0)) + word.substring(1);
    }
}
