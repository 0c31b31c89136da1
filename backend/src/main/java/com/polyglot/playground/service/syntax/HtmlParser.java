package com.polyglot.playground.service.syntax;

import com.polyglot.playground.dto.ParseNode;
import com.polyglot.playground.dto.Severity;
import com.polyglot.playground.dto.Token;
import com.polyglot.playground.dto.TokenCategory;
import com.polyglot.playground.language.LanguageProfile;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

final class HtmlParser extends StatementParser {

    private static final Set<String> RAW_TEXT_ELEMENTS = Set.of("script", "style");

    private static final Set<String> PARAGRAPH_CLOSERS = Set.of(
            "p", "div", "ul", "ol", "dl", "table", "h1", "h2", "h3", "h4", "h5", "h6", "section", "article",
            "header", "footer", "nav", "aside", "form", "pre", "blockquote", "hr", "main", "figure");

    /**
     * Elements whose end tag may be omitted, mapped to the start tags that close them implicitly.
     */
    private static final Map<String, Set<String>> IMPLIED_END = Map.of(
            "p", PARAGRAPH_CLOSERS,
            "li", Set.of("li"),
            "dt", Set.of("dt", "dd"),
            "dd", Set.of("dt", "dd"),
            "option", Set.of("option", "optgroup"),
            "tr", Set.of("tr", "tbody", "tfoot"),
            "td", Set.of("td", "th", "tr", "tbody", "tfoot"),
            "th", Set.of("td", "th", "tr", "tbody", "tfoot"),
            "thead", Set.of("tbody", "tfoot"),
            "tbody", Set.of("tbody", "tfoot"));

    private final Deque<ElementBuilder> open = new ArrayDeque<>();
    private final List<ParseNode> roots = new ArrayList<>();

    HtmlParser(TokenCursor cursor, LanguageProfile profile, int maxDepth) {
        super(cursor, profile, maxDepth);
    }

    @Override
    List<ParseNode> parseProgram() {
        while (!cursor.atEnd()) {
            int before = cursor.position();
            ParseNode node = parseStatement();
            if (node != null) {
                append(node);
            }
            ensureProgress(before);
        }
        while (!open.isEmpty()) {
            ElementBuilder element = open.pop();
            if (!IMPLIED_END.containsKey(element.name)) {
                report(Severity.WARNING, "Missing closing tag for '<" + element.name + ">'", element.start,
                        "Expected: </" + element.name + ">, Found: end of input");
            }
            append(element.build());
        }
        return roots;
    }

    @Override
    protected ParseNode parseStatement() {
        Token token = cursor.peek();
        if (token.hasText("</") && adjacentWord(1)) {
            parseEndTag();
            return null;
        }
        if (token.hasText("<") && cursor.peek(1) != null && cursor.peek(1).hasText("!") && adjacent(1)) {
            return parseDoctype();
        }
        if (token.hasText("<") && adjacentWord(1)) {
            return parseStartTag();
        }
        return parseText();
    }

    private ParseNode parseDoctype() {
        Token start = cursor.advance();
        cursor.advance();
        StringBuilder text = new StringBuilder();
        while (!cursor.atEnd() && !cursor.check(">")) {
            if (text.length() > 0) {
                text.append(' ');
            }
            text.append(cursor.advance().text());
        }
        cursor.match(">");
        return ParseNode.of("Doctype", text.toString(), start, List.of());
    }

    private ParseNode parseStartTag() {
        Token start = cursor.advance();
        String name = cursor.advance().text().toLowerCase(Locale.ROOT);
        List<ParseNode> attributes = new ArrayList<>();
        while (!cursor.atEnd() && !cursor.check(">") && !cursor.check("/>")
                && !cursor.check("<") && !cursor.check("</")) {
            attributes.add(parseAttribute());
        }
        boolean selfClosing = false;
        if (cursor.check("/>")) {
            cursor.advance();
            selfClosing = true;
        } else if (!cursor.match(">")) {
            Token found = cursor.peek();
            String foundText = found == null || cursor.atEnd() ? "end of input" : found.text();
            report(Severity.ERROR, "Unclosed start tag '<" + name + "'", start, "Expected: >, Found: " + foundText);
        }
        closeImpliedElements(name);
        ElementBuilder element = new ElementBuilder(name, start);
        element.children.addAll(attributes);
        if (selfClosing || profile.voidElements().contains(name)) {
            return element.build();
        }
        if (RAW_TEXT_ELEMENTS.contains(name)) {
            ParseNode text = parseRawText(name);
            if (text != null) {
                element.children.add(text);
            }
            if (!cursor.atEnd()) {
                cursor.advance();
                cursor.advance();
                cursor.match(">");
            } else {
                report(Severity.WARNING, "Missing closing tag for '<" + name + ">'", start,
                        "Expected: </" + name + ">, Found: end of input");
            }
            return element.build();
        }
        open.push(element);
        return null;
    }

    private ParseNode parseAttribute() {
        Token first = cursor.advance();
        String name = joinAdjacent(first.text());
        if (!cursor.match("=")) {
            return ParseNode.of("Attribute", name, first, List.of());
        }
        Token value = cursor.peek();
        if (value == null || cursor.atEnd() || value.hasText(">") || value.hasText("/>")) {
            return ParseNode.of("Attribute", name, first, List.of());
        }
        cursor.advance();
        String text = value.category() == TokenCategory.STRING
                ? value.text() : joinAdjacent(value.text());
        ParseNode valueNode = new ParseNode("AttributeValue", text, List.of(), value.line(), value.column());
        return ParseNode.of("Attribute", name, first, List.of(valueNode));
    }

    private String joinAdjacent(String text) {
        StringBuilder joined = new StringBuilder(text);
        while (!cursor.atEnd() && adjacent(0) && !cursor.checkAny("=", ">", "/>", "<", "</")) {
            joined.append(cursor.advance().text());
        }
        return joined.toString();
    }

    private ParseNode parseRawText(String name) {
        Token first = cursor.peek();
        StringBuilder text = new StringBuilder();
        while (!cursor.atEnd()) {
            if (cursor.check("</") && cursor.peek(1) != null && cursor.peek(1).hasTextIgnoreCase(name)) {
                break;
            }
            if (text.length() > 0) {
                text.append(' ');
            }
            text.append(cursor.advance().text());
        }
        return text.length() == 0 ? null : ParseNode.of("RawText", text.toString(), first, List.of());
    }

    private void parseEndTag() {
        Token start = cursor.advance();
        String name = cursor.advance().text().toLowerCase(Locale.ROOT);
        if (!cursor.match(">")) {
            Token found = cursor.peek();
            String foundText = found == null || cursor.atEnd() ? "end of input" : found.text();
            report(Severity.ERROR, "Unclosed end tag '</" + name + "'", start, "Expected: >, Found: " + foundText);
        }
        if (!isOpen(name)) {
            String expected = open.isEmpty() ? "nothing" : "</" + open.peek().name + ">";
            report(Severity.ERROR, "Closing tag '</" + name + ">' does not match any open element", start,
                    "Expected: " + expected + ", Found: </" + name + ">");
            return;
        }
        while (!open.isEmpty()) {
            ElementBuilder element = open.pop();
            if (element.name.equals(name)) {
                append(element.build());
                return;
            }
            if (!IMPLIED_END.containsKey(element.name)) {
                report(Severity.WARNING, "Missing closing tag for '<" + element.name + ">'", element.start,
                        "Expected: </" + element.name + ">, Found: </" + name + ">");
            }
            append(element.build());
        }
    }

    private void closeImpliedElements(String startTag) {
        while (!open.isEmpty()) {
            Set<String> closers = IMPLIED_END.get(open.peek().name);
            if (closers == null || !closers.contains(startTag)) {
                return;
            }
            append(open.pop().build());
        }
    }

    private ParseNode parseText() {
        Token first = cursor.peek();
        StringBuilder text = new StringBuilder();
        while (!cursor.atEnd()) {
            Token token = cursor.peek();
            if ((token.hasText("<") || token.hasText("</")) && text.length() > 0
                    && (adjacentWord(1) || (token.hasText("<") && cursor.peek(1) != null && cursor.peek(1).hasText("!")))) {
                break;
            }
            if (text.length() > 0) {
                text.append(' ');
            }
            text.append(cursor.advance().text());
        }
        return ParseNode.of("Text", text.toString(), first, List.of());
    }

    private void append(ParseNode node) {
        if (open.isEmpty()) {
            roots.add(node);
        } else {
            open.peek().children.add(node);
        }
    }

    private boolean isOpen(String name) {
        Iterator<ElementBuilder> elements = open.iterator();
        while (elements.hasNext()) {
            if (elements.next().name.equals(name)) {
                return true;
            }
        }
        return false;
    }

    private boolean adjacent(int ahead) {
        Token before = cursor.peek(ahead - 1);
        Token token = cursor.peek(ahead);
        return before != null && token != null && token.offset() == before.endOffset();
    }

    private boolean adjacentWord(int ahead) {
        Token token = cursor.peek(ahead);
        return adjacent(ahead) && (token.isIdentifier() || token.isKeyword());
    }

    private static final class ElementBuilder {

        private final String name;
        private final Token start;
        private final List<ParseNode> children = new ArrayList<>();

        ElementBuilder(String name, Token start) {
            this.name = name;
            this.start = start;
        }

        ParseNode build() {
            return ParseNode.of("Element", name, start, children);
        }
    }
}
