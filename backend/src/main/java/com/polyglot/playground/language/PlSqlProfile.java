package com.polyglot.playground.language;

import com.polyglot.playground.dto.Token;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

final class PlSqlProfile implements LanguageProfile {

    private static final Set<String> KEYWORDS;

    static {
        Set<String> words = new HashSet<>(SqlVocabulary.COMMON_KEYWORDS);
        words.addAll(Vocabulary.words(
                "elsif", "loop", "exit", "exception", "cursor", "open", "fetch", "close", "raise",
                "out", "nocopy", "constant", "type", "record", "package", "body", "varchar2", "number",
                "boolean", "clob", "blob", "pls_integer", "binary_integer", "sequence", "rowtype",
                "or", "others", "pragma", "bulk", "collect", "forall", "execute", "immediate"));
        KEYWORDS = Set.copyOf(words);
    }

    private static final List<String> OPERATORS = Vocabulary.longestFirst(
            List.of(":=", "=>", "||", "<>", "!=", "<=", ">=", "..", "**",
                    "+", "-", "*", "/", "=", "<", ">", "%"));

    private static final List<BuiltinSymbol> BUILTINS = List.of(
            BuiltinSymbol.object("dbms_output", "package"),
            BuiltinSymbol.function("put_line", "void").inScope("dbms_output"),
            BuiltinSymbol.function("sysdate", "date"),
            BuiltinSymbol.function("systimestamp", "timestamp"),
            BuiltinSymbol.object("user", "varchar2"),
            BuiltinSymbol.function("nvl", "any"),
            BuiltinSymbol.function("nvl2", "any"),
            BuiltinSymbol.function("to_char", "varchar2"),
            BuiltinSymbol.function("to_date", "date"),
            BuiltinSymbol.function("to_number", "number"),
            BuiltinSymbol.function("substr", "varchar2"),
            BuiltinSymbol.function("instr", "number"),
            BuiltinSymbol.function("length", "number"),
            BuiltinSymbol.function("upper", "varchar2"),
            BuiltinSymbol.function("lower", "varchar2"),
            BuiltinSymbol.function("trim", "varchar2"),
            BuiltinSymbol.function("round", "number"),
            BuiltinSymbol.function("trunc", "number"),
            BuiltinSymbol.function("count", "number"),
            BuiltinSymbol.function("sum", "number"),
            BuiltinSymbol.function("avg", "number"),
            BuiltinSymbol.function("min", "any"),
            BuiltinSymbol.function("max", "any"),
            BuiltinSymbol.function("coalesce", "any"),
            BuiltinSymbol.function("decode", "any"),
            BuiltinSymbol.function("raise_application_error", "void"),
            BuiltinSymbol.function("sqlerrm", "varchar2"),
            BuiltinSymbol.constant("sqlcode", "number"),
            BuiltinSymbol.constant("no_data_found", "exception"),
            BuiltinSymbol.constant("too_many_rows", "exception"),
            BuiltinSymbol.constant("dual", "table"),
            BuiltinSymbol.constant("rownum", "number"),
            BuiltinSymbol.object("sql", "cursor"));

    private static final String[] NUMERIC = {
            "number", "integer", "int", "pls_integer", "binary_integer", "float", "decimal", "numeric",
            "natural", "positive", "simple_integer", "real"};

    private static final String[] TEXT = {
            "varchar2", "varchar", "char", "nvarchar2", "nchar", "clob", "long", "string"};

    private static final TypeConversions CONVERSIONS = TypeConversions.builder()
            .family(NUMERIC)
            .family(TEXT)
            .allowInto(TEXT, NUMERIC)
            .allow("date", "date", "varchar2")
            .allow("timestamp", "timestamp", "date", "varchar2")
            .allow("boolean", "boolean")
            .build();

    @Override
    public Language language() {
        return Language.PLSQL;
    }

    @Override
    public Set<String> keywords() {
        return KEYWORDS;
    }

    @Override
    public List<String> operators() {
        return OPERATORS;
    }

    @Override
    public List<CommentStyle> commentStyles() {
        return List.of(CommentStyle.DOUBLE_DASH, CommentStyle.SLASH_STAR);
    }

    @Override
    public List<BuiltinSymbol> builtinSymbols() {
        return BUILTINS;
    }

    @Override
    public TypeConversions typeConversions() {
        return CONVERSIONS;
    }

    @Override
    public boolean caseSensitive() {
        return false;
    }

    @Override
    public boolean backslashEscapes() {
        return false;
    }

    @Override
    public boolean doubledQuoteEscapes() {
        return true;
    }

    @Override
    public boolean isIdentifierPart(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '$' || c == '#';
    }

    @Override
    public Set<String> statementKeywords() {
        return SqlVocabulary.STATEMENT_VERBS;
    }

    @Override
    public Set<String> blockOpeners() {
        return Set.of("begin", "case");
    }

    /**
     * {@code END IF} and {@code END LOOP} close constructs that have no opener of their own.
     */
    @Override
    public boolean closesBlock(List<Token> tokens, int index) {
        if (!LanguageProfile.super.closesBlock(tokens, index)) {
            return false;
        }
        if (index + 1 >= tokens.size()) {
            return true;
        }
        Token next = tokens.get(index + 1);
        return !(next.hasTextIgnoreCase("if") || next.hasTextIgnoreCase("loop"));
    }

    @Override
    public BlockStyle blockStyle() {
        return BlockStyle.KEYWORDS;
    }

    @Override
    public boolean checksDeclarationOrder() {
        return true;
    }

    @Override
    public String assignmentOperator() {
        return ":=";
    }

    @Override
    public String literalType(Token token) {
        return switch (token.category()) {
            case NUMBER -> "number";
            case STRING -> "varchar2";
            default -> isBooleanLiteral(token) ? "boolean" : null;
        };
    }
}
