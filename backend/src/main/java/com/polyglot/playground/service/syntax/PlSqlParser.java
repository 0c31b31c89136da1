package com.polyglot.playground.service.syntax;

import com.polyglot.playground.dto.ParseNode;
import com.polyglot.playground.dto.Token;
import com.polyglot.playground.dto.TokenCategory;
import com.polyglot.playground.language.LanguageProfile;

import java.util.ArrayList;
import java.util.List;

final class PlSqlParser extends SqlParser {

    PlSqlParser(TokenCursor cursor, LanguageProfile profile, int maxDepth) {
        super(cursor, profile, maxDepth);
    }

    @Override
    protected ParseNode parseStatement() {
        Token token = cursor.peek();
        if (token == null) {
            return null;
        }
        if (token.hasText(";") || (token.hasText("/") && token.category() == TokenCategory.OPERATOR)) {
            // a lone slash runs the buffer in SQL*Plus
            cursor.advance();
            return null;
        }
        if (!token.isKeyword()) {
            return parseAssignmentOrCall();
        }
        return switch (profile.normalize(token.text())) {
            case "select", "insert", "update", "delete", "with", "merge" -> parseDml();
            case "create" -> parseCreate();
            case "declare", "begin" -> parseBlock();
            case "if" -> parseIf();
            case "loop", "for", "while" -> parseLoop();
            case "case" -> parseCaseStatement();
            case "procedure", "function" -> parseSubprogram();
            case "end", "else", "elsif", "exception", "when", "then" -> unexpected(token);
            default -> parseGeneric(cursor.advance(), capitalize(profile.normalize(token.text())) + "Statement");
        };
    }

    @Override
    protected List<ParseNode> parseRoutineBody(Token keyword) {
        List<ParseNode> parts = new ArrayList<>();
        if (cursor.match("is") || cursor.match("as")) {
            parts.add(parseDeclarations(keyword));
        } else if (cursor.match("declare")) {
            parts.add(parseDeclarations(keyword));
        } else if (!cursor.check("begin")) {
            expect("is");
        }
        if (cursor.check("begin")) {
            parts.addAll(parseBeginEnd());
        }
        return parts;
    }

    private ParseNode parseBlock() {
        Token start = cursor.peek();
        List<ParseNode> parts = new ArrayList<>();
        if (cursor.match("declare")) {
            parts.add(parseDeclarations(start));
        }
        if (cursor.check("begin")) {
            parts.addAll(parseBeginEnd());
        } else {
            expect("begin");
        }
        return ParseNode.of("Block", null, start, parts);
    }

    /**
     * {@code BEGIN ... [EXCEPTION ...] END [label];}
     */
    private List<ParseNode> parseBeginEnd() {
        Token begin = cursor.advance();
        List<ParseNode> parts = new ArrayList<>();
        parts.add(ParseNode.of("Body", null, begin, parseStatementsUntil("exception", "end")));
        if (cursor.check("exception")) {
            Token exception = cursor.advance();
            List<ParseNode> handlers = new ArrayList<>();
            while (cursor.check("when")) {
                Token when = cursor.advance();
                List<ParseNode> handler = new ArrayList<>();
                while (!cursor.atEnd() && !cursor.check("then") && !cursor.check(";")) {
                    handler.add(ParseNode.leaf(cursor.advance()));
                }
                expect("then");
                handler.addAll(parseStatementsUntil("when", "end"));
                handlers.add(ParseNode.of("Handler", null, when, handler));
            }
            parts.add(ParseNode.of("ExceptionSection", null, exception, handlers));
        }
        if (closeBlock("end")) {
            skipLabel();
            endStatement(";");
        }
        return parts;
    }

    private ParseNode parseDeclarations(Token anchor) {
        List<ParseNode> declarations = new ArrayList<>();
        while (!cursor.atEnd() && !cursor.check("begin") && !cursor.check("end")) {
            int before = cursor.position();
            Token token = cursor.peek();
            if (cursor.check("procedure") || cursor.check("function")) {
                declarations.add(parseSubprogram());
            } else if (cursor.checkAny("cursor", "type", "pragma", "subtype")) {
                declarations.add(parseGeneric(cursor.advance(), capitalize(profile.normalize(token.text())) + "Declaration"));
            } else if (token.isIdentifier()) {
                declarations.add(parseVariableDeclaration());
            } else {
                unexpected(token);
            }
            ensureProgress(before);
        }
        return ParseNode.of("DeclareSection", null, anchor, declarations);
    }

    private ParseNode parseVariableDeclaration() {
        Token name = cursor.advance();
        List<ParseNode> parts = new ArrayList<>();
        Token typeStart = cursor.peek();
        List<ParseNode> type = new ArrayList<>();
        while (!cursor.atEnd() && !cursor.checkAny(";", ":=", "default")) {
            if (cursor.onNewLine() && startsStatement(cursor.peek())) {
                break;
            }
            type.add(isOpener(cursor.peek()) ? parseGroup() : ParseNode.leaf(cursor.advance()));
        }
        if (!type.isEmpty()) {
            parts.add(ParseNode.of("Type", null, typeStart, type));
        }
        if (cursor.match(":=") || cursor.match("default")) {
            parts.add(parseSqlExpression());
        }
        endStatement(";");
        return ParseNode.of("VariableDeclaration", name.text(), name, nonNull(parts));
    }

    private ParseNode parseSubprogram() {
        Token keyword = cursor.advance();
        Token name = expectIdentifier(profile.normalize(keyword.text()) + " name");
        List<ParseNode> parts = new ArrayList<>();
        if (cursor.check("(")) {
            parts.add(parseGroup().withKind("Parameters"));
        }
        if (cursor.check("return")) {
            Token returns = cursor.advance();
            List<ParseNode> type = new ArrayList<>();
            while (!cursor.atEnd() && !cursor.checkAny("is", "as", ";")) {
                type.add(ParseNode.leaf(cursor.advance()));
            }
            parts.add(ParseNode.of("ReturnType", null, returns, type));
        }
        if (cursor.match(";")) {
            return ParseNode.of("SubprogramSpecification", name == null ? null : name.text(), keyword, parts);
        }
        parts.addAll(parseRoutineBody(keyword));
        String kind = keyword.hasTextIgnoreCase("function") ? "FunctionDefinition" : "ProcedureDefinition";
        return ParseNode.of(kind, name == null ? null : name.text(), keyword, parts);
    }

    private ParseNode parseAssignmentOrCall() {
        Token anchor = cursor.peek();
        ParseNode expression = parseSqlExpression();
        boolean assignment = expression.children().stream().anyMatch(child -> ":=".equals(child.value()));
        endStatement(";");
        return ParseNode.of(assignment ? "Assignment" : "CallStatement", null, anchor, List.of(expression));
    }

    private ParseNode parseIf() {
        Token keyword = cursor.advance();
        List<ParseNode> parts = new ArrayList<>();
        parts.add(parseBranch(keyword, "elsif", "else", "end"));
        while (cursor.check("elsif")) {
            parts.add(parseBranch(cursor.advance(), "elsif", "else", "end"));
        }
        if (cursor.check("else")) {
            Token otherwise = cursor.advance();
            parts.add(ParseNode.of("ElseBranch", null, otherwise, parseStatementsUntil("end")));
        }
        if (closeBlock("end")) {
            expect("if");
            endStatement(";");
        }
        return ParseNode.of("IfStatement", null, keyword, parts);
    }

    private ParseNode parseBranch(Token keyword, String... closers) {
        List<ParseNode> parts = new ArrayList<>();
        if (!cursor.check("then")) {
            parts.add(parseCondition(keyword));
        }
        expect("then");
        parts.addAll(parseStatementsUntil(closers));
        return ParseNode.of("Branch", null, keyword, nonNull(parts));
    }

    private ParseNode parseLoop() {
        Token keyword = cursor.peek();
        List<ParseNode> parts = new ArrayList<>();
        String value = null;
        if (cursor.match("for")) {
            Token variable = expectIdentifier("loop variable");
            value = variable == null ? null : variable.text();
            expect("in");
            cursor.match("reverse");
            if (!cursor.check("loop")) {
                parts.add(parseSqlExpression());
            }
        } else if (cursor.match("while")) {
            if (!cursor.check("loop")) {
                parts.add(parseCondition(keyword));
            }
        }
        if (expect("loop") != null) {
            parts.addAll(parseStatementsUntil("end"));
            if (closeBlock("end")) {
                expect("loop");
                skipLabel();
                endStatement(";");
            }
        }
        return ParseNode.of("LoopStatement", value, keyword, nonNull(parts));
    }

    private ParseNode parseCaseStatement() {
        Token keyword = cursor.advance();
        List<ParseNode> parts = new ArrayList<>();
        if (!cursor.check("when")) {
            parts.add(parseSqlExpression());
        }
        while (cursor.check("when")) {
            parts.add(parseBranch(cursor.advance(), "when", "else", "end").withKind("WhenBranch"));
        }
        if (cursor.check("else")) {
            Token otherwise = cursor.advance();
            parts.add(ParseNode.of("ElseBranch", null, otherwise, parseStatementsUntil("end")));
        }
        if (closeBlock("end")) {
            expect("case");
            endStatement(";");
        }
        return ParseNode.of("CaseStatement", null, keyword, nonNull(parts));
    }

    private void skipLabel() {
        Token next = cursor.peek();
        if (next != null && !cursor.atEnd() && next.isIdentifier() && !cursor.onNewLine()) {
            cursor.advance();
        }
    }
}
