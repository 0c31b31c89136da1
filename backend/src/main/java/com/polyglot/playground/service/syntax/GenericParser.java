package com.polyglot.playground.service.syntax;

import com.polyglot.playground.dto.ParseNode;
import com.polyglot.playground.dto.Token;
import com.polyglot.playground.language.LanguageProfile;

import java.util.ArrayList;
import java.util.List;

final class GenericParser extends StatementParser {

    GenericParser(TokenCursor cursor, LanguageProfile profile, int maxDepth) {
        super(cursor, profile, maxDepth);
    }

    @Override
    protected ParseNode parseStatement() {
        Token first = cursor.advance();
        List<ParseNode> tokens = new ArrayList<>();
        tokens.add(ParseNode.leaf(first));
        while (!cursor.atEnd() && cursor.peek().line() == first.line()) {
            tokens.add(ParseNode.leaf(cursor.advance()));
        }
        return ParseNode.of("Line", Integer.toString(first.line()), first, tokens);
    }
}
