package com.polyglot.playground.service;

import com.polyglot.playground.dto.ExecutionTrace;
import com.polyglot.playground.dto.SymbolEntry;
import com.polyglot.playground.dto.SymbolKind;
import com.polyglot.playground.dto.Token;
import com.polyglot.playground.dto.TokenCategory;
import com.polyglot.playground.dto.TokenKind;
import com.polyglot.playground.language.Language;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Describes what an analyzed program would print or do by matching well-known output calls and
 * statements in its tokens. Nothing is interpreted: arguments are echoed as written.
 */
@Service
public class ExecutionTraceSynthesizer {

    private static final Logger logger = LoggerFactory.getLogger(ExecutionTraceSynthesizer.class);

    private static final Set<String> CONSOLE_METHODS = Set.of("log", "info", "warn", "error");

    private static final List<String> HTML_STRUCTURE = List.of("html", "head", "body", "title");

    /**
     * Output collected for one run: what the program prints, followed by notes about its shape.
     */
    private static final class Trace {

        private final StringBuilder printed = new StringBuilder();
        private final List<String> notes = new ArrayList<>();
        private final List<String> commands = new ArrayList<>();

        void print(String text) {
            printed.append(text);
        }

        void println(String text) {
            printed.append(text).append('\n');
        }

        void note(String text) {
            notes.add(text);
        }

        void command(String text) {
            commands.add(text);
        }

        ExecutionTrace finish(String fallback) {
            StringBuilder output = new StringBuilder(printed);
            if (output.length() > 0 && output.charAt(output.length() - 1) != '\n' && !notes.isEmpty()) {
                output.append('\n');
            }
            output.append(String.join("\n", notes));
            String text = output.length() == 0 ? fallback : output.toString();
            return ExecutionTrace.success(text, commands);
        }
    }

    public ExecutionTrace simulate(List<Token> tokens, List<SymbolEntry> symbols, Language language) {
        List<Token> significant = tokens.stream()
                .filter(token -> !token.isComment())
                .collect(Collectors.toList());
        try {
            ExecutionTrace trace = switch (language) {
                case JAVASCRIPT -> javaScript(significant, symbols);
                case PYTHON -> python(significant, symbols);
                case CPP -> cpp(significant, symbols);
                case HTML -> html(significant);
                case PASCAL -> pascal(significant, symbols);
                case PLSQL, TSQL -> sql(significant, language);
                case UNKNOWN -> new Trace().finish("Code analyzed; nothing to simulate");
            };
            logger.debug("Synthesized {} execution trace with {} commands", language.tag(), trace.executedCommands().size());
            return trace;
        } catch (RuntimeException e) {
            logger.warn("Execution trace for {} failed: {}", language.tag(), e.toString());
            return ExecutionTrace.failure("Execution error: " + e.getMessage());
        }
    }

    private ExecutionTrace javaScript(List<Token> tokens, List<SymbolEntry> symbols) {
        Trace trace = new Trace();
        for (int i = 0; i < tokens.size(); i++) {
            Token token = tokens.get(i);
            String callee = null;
            int open = -1;
            if (token.hasText("console") && hasText(tokens, i + 1, ".") && i + 2 < tokens.size()
                    && CONSOLE_METHODS.contains(tokens.get(i + 2).text()) && hasText(tokens, i + 3, "(")) {
                callee = "console." + tokens.get(i + 2).text();
                open = i + 3;
            } else if (token.hasText("alert") && hasText(tokens, i + 1, "(") && !hasText(tokens, i - 1, ".")) {
                callee = "alert";
                open = i + 1;
            } else if (token.hasText("document") && hasText(tokens, i + 1, ".") && hasText(tokens, i + 2, "write")
                    && hasText(tokens, i + 3, "(")) {
                callee = "document.write";
                open = i + 3;
            }
            if (callee != null) {
                String argument = arguments(tokens, open, true);
                trace.println(argument);
                trace.command(callee + "(" + argument + ")");
            }
        }
        List<SymbolEntry> variables = ofKind(symbols, SymbolKind.VARIABLE, SymbolKind.CONSTANT);
        if (!variables.isEmpty()) {
            trace.note("Variables declared: " + variables.stream()
                    .map(entry -> entry.getName() + ": " + describe(entry.getDataType()))
                    .collect(Collectors.joining(", ")));
        }
        noteFunctions(trace, symbols, "Functions defined: ");
        return trace.finish("JavaScript code analyzed; no console output");
    }

    private ExecutionTrace python(List<Token> tokens, List<SymbolEntry> symbols) {
        Trace trace = new Trace();
        for (int i = 0; i + 1 < tokens.size(); i++) {
            if (tokens.get(i).hasText("print") && hasText(tokens, i + 1, "(") && !hasText(tokens, i - 1, ".")) {
                String argument = arguments(tokens, i + 1, true);
                trace.println(argument);
                trace.command("print(" + argument + ")");
            }
        }
        noteFunctions(trace, symbols, "Functions defined: ");
        List<String> modules = symbols.stream()
                .filter(entry -> "module".equals(entry.getDataType()))
                .map(SymbolEntry::getName)
                .collect(Collectors.toList());
        if (!modules.isEmpty()) {
            trace.note("Imported modules: " + String.join(", ", modules));
        }
        return trace.finish("Python code analyzed; no print statements");
    }

    private ExecutionTrace cpp(List<Token> tokens, List<SymbolEntry> symbols) {
        Trace trace = new Trace();
        for (int i = 0; i < tokens.size(); i++) {
            Token token = tokens.get(i);
            if (token.hasText("cout") && hasText(tokens, i + 1, "<<")) {
                String streamed = streamed(tokens, i + 1);
                trace.print(streamed);
                trace.command("cout << " + streamed.replace("\n", "\\n"));
            } else if (token.hasText("printf") && hasText(tokens, i + 1, "(") && i + 2 < tokens.size()
                    && tokens.get(i + 2).category() == TokenCategory.STRING) {
                String format = decodeEscapes(unquote(tokens.get(i + 2).text()));
                trace.print(format);
                trace.command("printf(" + tokens.get(i + 2).text() + ")");
            }
        }
        if (symbols.stream().anyMatch(entry -> entry.getKind() == SymbolKind.FUNCTION && entry.getName().equals("main"))) {
            trace.note("Function main found");
        }
        long includes = tokens.stream()
                .filter(token -> token.kind() == TokenKind.PREPROCESSOR_DIRECTIVE && token.text().contains("include"))
                .count();
        if (includes > 0) {
            trace.note("Includes: " + includes + " file(s)");
        }
        List<SymbolEntry> variables = ofKind(symbols, SymbolKind.VARIABLE, SymbolKind.CONSTANT);
        if (!variables.isEmpty()) {
            trace.note("Variables: " + variables.stream()
                    .map(entry -> describe(entry.getDataType()) + " " + entry.getName())
                    .collect(Collectors.joining(", ")));
        }
        return trace.finish("C++ program analyzed; simulated compilation succeeded");
    }

    private ExecutionTrace html(List<Token> tokens) {
        Trace trace = new Trace();
        List<String> structure = HTML_STRUCTURE.stream()
                .filter(tag -> openingTags(tokens, tag) > 0)
                .collect(Collectors.toList());
        if (!structure.isEmpty()) {
            trace.note("HTML structure: " + structure.stream().map(tag -> "<" + tag + ">")
                    .collect(Collectors.joining(", ")));
        }
        String title = elementText(tokens, "title");
        if (!title.isEmpty()) {
            trace.note("Title: " + title);
            trace.command("render title");
        }
        countElements(trace, tokens, "div", "Divisions");
        countElements(trace, tokens, "p", "Paragraphs");
        countElements(trace, tokens, "a", "Links");
        return trace.finish("HTML document processed; basic structure only");
    }

    private ExecutionTrace pascal(List<Token> tokens, List<SymbolEntry> symbols) {
        Trace trace = new Trace();
        int begins = 0;
        int ends = 0;
        for (int i = 0; i < tokens.size(); i++) {
            Token token = tokens.get(i);
            if (token.isKeyword() && token.hasTextIgnoreCase("begin")) {
                begins++;
            } else if (token.isKeyword() && token.hasTextIgnoreCase("end")) {
                ends++;
            }
            boolean writeln = token.hasTextIgnoreCase("writeln");
            if ((writeln || token.hasTextIgnoreCase("write")) && token.isIdentifier()) {
                String argument = hasText(tokens, i + 1, "(") ? arguments(tokens, i + 1, false) : "";
                if (writeln) {
                    trace.println(argument);
                } else {
                    trace.print(argument);
                }
                trace.command(token.text().toLowerCase(Locale.ROOT) + "(" + argument + ")");
            }
        }
        if (tokens.stream().anyMatch(token -> token.isKeyword() && token.hasTextIgnoreCase("program"))) {
            trace.note("Pascal program found");
        }
        noteFunctions(trace, symbols, "Procedures and functions: ");
        trace.note("BEGIN/END blocks: " + begins + "/" + ends);
        List<SymbolEntry> variables = ofKind(symbols, SymbolKind.VARIABLE);
        if (!variables.isEmpty()) {
            trace.note("Variables: " + variables.stream()
                    .map(entry -> entry.getName() + ": " + describe(entry.getDataType()))
                    .collect(Collectors.joining(", ")));
        }
        return trace.finish("Pascal program analyzed; structure is valid");
    }

    private ExecutionTrace sql(List<Token> tokens, Language language) {
        Trace trace = new Trace();
        for (int i = 0; i < tokens.size(); i++) {
            Token token = tokens.get(i);
            String word = token.text().toLowerCase(Locale.ROOT);
            if (!token.isKeyword() && !isPutLine(tokens, i)) {
                continue;
            }
            switch (word) {
                case "create" -> {
                    if (keywordAt(tokens, i + 1, "table")) {
                        String table = qualifiedName(tokens, i + 2);
                        trace.note("Table '" + table + "' created");
                        trace.command("CREATE TABLE " + table);
                    } else {
                        trace.note("CREATE statement executed");
                        trace.command("CREATE");
                    }
                }
                case "select" -> {
                    String table = tableAfter(tokens, i, "from");
                    trace.note(table.isEmpty() ? "SELECT query executed" : "Query executed on table '" + table + "'");
                    trace.command(table.isEmpty() ? "SELECT" : "SELECT FROM " + table);
                }
                case "insert" -> {
                    String table = keywordAt(tokens, i + 1, "into") ? qualifiedName(tokens, i + 2) : qualifiedName(tokens, i + 1);
                    int rows = valueTuples(tokens, i);
                    trace.note(rows > 0
                            ? rows + " row(s) inserted into '" + table + "'"
                            : "Rows inserted into '" + table + "'");
                    trace.command("INSERT INTO " + table);
                }
                case "update" -> {
                    String table = qualifiedName(tokens, i + 1);
                    trace.note("Rows updated in '" + table + "'");
                    trace.command("UPDATE " + table);
                }
                case "delete" -> {
                    String table = keywordAt(tokens, i + 1, "from") ? qualifiedName(tokens, i + 2) : qualifiedName(tokens, i + 1);
                    trace.note("Rows deleted from '" + table + "'");
                    trace.command("DELETE FROM " + table);
                }
                case "drop" -> {
                    if (keywordAt(tokens, i + 1, "table")) {
                        String table = qualifiedName(tokens, i + 2);
                        trace.note("Table '" + table + "' dropped");
                        trace.command("DROP TABLE " + table);
                    }
                }
                case "print" -> {
                    if (language == Language.TSQL && i + 1 < tokens.size()) {
                        String text = echo(tokens.get(i + 1));
                        trace.println(text);
                        trace.command("PRINT " + text);
                    }
                }
                case "put_line" -> {
                    String text = arguments(tokens, i + 1, false);
                    trace.println(text);
                    trace.command("dbms_output.put_line(" + text + ")");
                }
                default -> {
                }
            }
        }
        return trace.finish("SQL statements analyzed; syntax is valid");
    }

    private static boolean isPutLine(List<Token> tokens, int index) {
        return tokens.get(index).hasTextIgnoreCase("put_line") && hasText(tokens, index - 1, ".")
                && index >= 2 && tokens.get(index - 2).hasTextIgnoreCase("dbms_output") && hasText(tokens, index + 1, "(");
    }

    /**
     * Text of the call arguments starting at the opening parenthesis. String literals lose their
     * quotes; commas between arguments become single spaces. Code between them keeps the spacing
     * it was written with.
     */
    private static String arguments(List<Token> tokens, int openIndex, boolean escapes) {
        StringBuilder text = new StringBuilder();
        int depth = 0;
        int lastVerbatim = -1;
        for (int i = openIndex; i < tokens.size(); i++) {
            Token token = tokens.get(i);
            if (token.category() == TokenCategory.DELIMITER && token.hasText("(")) {
                if (depth++ == 0) {
                    continue;
                }
            } else if (token.category() == TokenCategory.DELIMITER && token.hasText(")")) {
                if (--depth == 0) {
                    break;
                }
            }
            if (depth == 1 && token.hasText(",") && token.category() == TokenCategory.DELIMITER) {
                text.append(' ');
            } else if (token.category() == TokenCategory.STRING) {
                String value = unquote(token.text());
                text.append(escapes ? decodeEscapes(value) : value.replace("''", "'"));
            } else if (!(depth == 1 && token.hasText("+") && isStringNeighbour(tokens, i))) {
                if (lastVerbatim == i - 1) {
                    text.append(gapBefore(tokens, i));
                }
                text.append(token.text());
                lastVerbatim = i;
            }
        }
        return text.toString();
    }

    private static String gapBefore(List<Token> tokens, int index) {
        Token previous = tokens.get(index - 1);
        Token token = tokens.get(index);
        if (token.offset() <= previous.endOffset()) {
            return "";
        }
        return token.line() == previous.line() ? " ".repeat(token.offset() - previous.endOffset()) : " ";
    }

    private static boolean isStringNeighbour(List<Token> tokens, int index) {
        return (index > 0 && tokens.get(index - 1).category() == TokenCategory.STRING)
                || (index + 1 < tokens.size() && tokens.get(index + 1).category() == TokenCategory.STRING);
    }

    /**
     * Everything written by one {@code cout << a << b;} chain.
     */
    private static String streamed(List<Token> tokens, int firstShift) {
        StringBuilder text = new StringBuilder();
        for (int i = firstShift; i < tokens.size() && !tokens.get(i).hasText(";"); i++) {
            Token token = tokens.get(i);
            if (token.hasText("<<") || token.hasText("std") || token.hasText("::")) {
                continue;
            }
            if (token.hasText("endl")) {
                text.append('\n');
            } else if (token.category() == TokenCategory.STRING) {
                text.append(decodeEscapes(unquote(token.text())));
            } else {
                text.append(token.text());
            }
        }
        return text.toString();
    }

    private static String echo(Token token) {
        return token.category() == TokenCategory.STRING ? unquote(token.text()).replace("''", "'") : token.text();
    }

    /**
     * Strips string prefixes such as {@code f} or {@code N}, then one or three matching quotes.
     */
    static String unquote(String literal) {
        int start = 0;
        while (start < literal.length() && Character.isLetter(literal.charAt(start))) {
            start++;
        }
        if (start >= literal.length()) {
            return literal;
        }
        char quote = literal.charAt(start);
        if (quote != '"' && quote != '\'' && quote != '`') {
            return literal;
        }
        String body = literal.substring(start);
        String triple = String.valueOf(quote).repeat(3);
        int width = body.length() >= 6 && body.startsWith(triple) ? 3 : 1;
        int end = body.length();
        if (end >= 2 * width && body.endsWith(String.valueOf(quote).repeat(width))) {
            end -= width;
        }
        return body.substring(width, Math.max(width, end));
    }

    static String decodeEscapes(String text) {
        if (text.indexOf('\\') < 0) {
            return text;
        }
        StringBuilder decoded = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c != '\\' || i + 1 >= text.length()) {
                decoded.append(c);
                continue;
            }
            char next = text.charAt(++i);
            switch (next) {
                case 'n' -> decoded.append('\n');
                case 't' -> decoded.append('\t');
                case 'r' -> decoded.append('\r');
                case '0' -> decoded.append('\0');
                default -> decoded.append(next);
            }
        }
        return decoded.toString();
    }

    private static void noteFunctions(Trace trace, List<SymbolEntry> symbols, String label) {
        List<SymbolEntry> functions = ofKind(symbols, SymbolKind.FUNCTION);
        if (!functions.isEmpty()) {
            trace.note(label + functions.stream().map(SymbolEntry::getName).collect(Collectors.joining(", ")));
        }
    }

    private static List<SymbolEntry> ofKind(List<SymbolEntry> symbols, SymbolKind... kinds) {
        Set<SymbolKind> wanted = Set.of(kinds);
        return symbols.stream()
                .filter(entry -> wanted.contains(entry.getKind()) && !"module".equals(entry.getDataType()))
                .collect(Collectors.toList());
    }

    private static String describe(String dataType) {
        return dataType == null ? "unknown" : dataType;
    }

    private static int openingTags(List<Token> tokens, String tag) {
        int count = 0;
        for (int i = 1; i < tokens.size(); i++) {
            if (tokens.get(i).hasTextIgnoreCase(tag) && tokens.get(i - 1).hasText("<")) {
                count++;
            }
        }
        return count;
    }

    private static void countElements(Trace trace, List<Token> tokens, String tag, String label) {
        int count = openingTags(tokens, tag);
        if (count > 0) {
            trace.note(label + ": " + count);
        }
    }

    /**
     * Words between {@code <tag>} and the next tag.
     */
    private static String elementText(List<Token> tokens, String tag) {
        for (int i = 1; i + 1 < tokens.size(); i++) {
            if (tokens.get(i).hasTextIgnoreCase(tag) && tokens.get(i - 1).hasText("<") && tokens.get(i + 1).hasText(">")) {
                List<String> words = new ArrayList<>();
                for (int j = i + 2; j < tokens.size() && !tokens.get(j).hasText("<") && !tokens.get(j).hasText("</"); j++) {
                    words.add(tokens.get(j).text());
                }
                return String.join(" ", words);
            }
        }
        return "";
    }

    private static boolean hasText(List<Token> tokens, int index, String text) {
        return index >= 0 && index < tokens.size() && tokens.get(index).hasText(text)
                && tokens.get(index).category() != TokenCategory.STRING;
    }

    private static boolean keywordAt(List<Token> tokens, int index, String word) {
        return index >= 0 && index < tokens.size() && tokens.get(index).hasTextIgnoreCase(word)
                && tokens.get(index).category() != TokenCategory.STRING;
    }

    private static String qualifiedName(List<Token> tokens, int index) {
        if (index >= tokens.size()) {
            return "";
        }
        StringBuilder name = new StringBuilder(tokens.get(index).text());
        for (int i = index + 1; i + 1 < tokens.size() && tokens.get(i).hasText("."); i += 2) {
            name.append('.').append(tokens.get(i + 1).text());
        }
        return name.toString();
    }

    private static String tableAfter(List<Token> tokens, int start, String keyword) {
        for (int i = start + 1; i + 1 < tokens.size() && !tokens.get(i).hasText(";"); i++) {
            if (tokens.get(i).isKeyword() && tokens.get(i).hasTextIgnoreCase(keyword)) {
                return qualifiedName(tokens, i + 1);
            }
        }
        return "";
    }

    /**
     * Number of parenthesized tuples after {@code VALUES} in one INSERT statement.
     */
    private static int valueTuples(List<Token> tokens, int insertIndex) {
        int tuples = 0;
        boolean inValues = false;
        int depth = 0;
        for (int i = insertIndex + 1; i < tokens.size() && !tokens.get(i).hasText(";"); i++) {
            Token token = tokens.get(i);
            if (token.isKeyword() && token.hasTextIgnoreCase("values")) {
                inValues = true;
            } else if (token.hasText("(")) {
                if (inValues && depth == 0) {
                    tuples++;
                }
                depth++;
            } else if (token.hasText(")")) {
                depth--;
            } else if (depth == 0 && token.isKeyword() && !token.hasTextIgnoreCase("values") && inValues) {
                break;
            }
        }
        return tuples;
    }
}
