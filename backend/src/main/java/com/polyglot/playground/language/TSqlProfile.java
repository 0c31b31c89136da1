package com.polyglot.playground.language;

import com.polyglot.playground.dto.Severity;
import com.polyglot.playground.dto.Token;

import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

final class TSqlProfile implements LanguageProfile {

    private static final Set<String> KEYWORDS;

    static {
        Set<String> words = new HashSet<>(SqlVocabulary.COMMON_KEYWORDS);
        words.addAll(Vocabulary.words(
                "print", "go", "exec", "execute", "tran", "transaction", "try", "catch", "nvarchar",
                "bigint", "smallint", "tinyint", "bit", "real", "money", "datetime", "datetime2", "nchar",
                "text", "top", "identity", "output", "raiserror", "throw", "proc", "use", "nocount",
                "off", "break", "continue", "cursor", "open", "fetch", "close", "deallocate", "next"));
        KEYWORDS = Set.copyOf(words);
    }

    private static final Set<String> STATEMENT_KEYWORDS;

    static {
        Set<String> verbs = new HashSet<>(SqlVocabulary.STATEMENT_VERBS);
        verbs.addAll(Set.of("print", "go", "exec", "execute", "set", "if", "while", "use", "return"));
        STATEMENT_KEYWORDS = Set.copyOf(verbs);
    }

    private static final List<String> OPERATORS = Vocabulary.longestFirst(
            List.of("<>", "!=", "<=", ">=", "!<", "!>", "+=", "-=", "*=", "/=", "%=", "&=", "|=", "^=",
                    "::", "+", "-", "*", "/", "%", "=", "<", ">", "&", "|", "^", "~"));

    private static final List<BuiltinSymbol> BUILTINS = List.of(
            BuiltinSymbol.constant("@@rowcount", "int"),
            BuiltinSymbol.constant("@@identity", "int"),
            BuiltinSymbol.constant("@@error", "int"),
            BuiltinSymbol.constant("@@version", "nvarchar"),
            BuiltinSymbol.constant("@@trancount", "int"),
            BuiltinSymbol.constant("@@fetch_status", "int"),
            BuiltinSymbol.function("getdate", "datetime"),
            BuiltinSymbol.function("getutcdate", "datetime"),
            BuiltinSymbol.function("len", "int"),
            BuiltinSymbol.function("upper", "varchar"),
            BuiltinSymbol.function("lower", "varchar"),
            BuiltinSymbol.function("ltrim", "varchar"),
            BuiltinSymbol.function("rtrim", "varchar"),
            BuiltinSymbol.function("substring", "varchar"),
            BuiltinSymbol.function("charindex", "int"),
            BuiltinSymbol.function("cast", "any"),
            BuiltinSymbol.function("convert", "any"),
            BuiltinSymbol.function("isnull", "any"),
            BuiltinSymbol.function("coalesce", "any"),
            BuiltinSymbol.function("count", "int"),
            BuiltinSymbol.function("sum", "decimal"),
            BuiltinSymbol.function("avg", "decimal"),
            BuiltinSymbol.function("min", "any"),
            BuiltinSymbol.function("max", "any"),
            BuiltinSymbol.function("newid", "uniqueidentifier"),
            BuiltinSymbol.function("dateadd", "datetime"),
            BuiltinSymbol.function("datediff", "int"),
            BuiltinSymbol.function("scope_identity", "decimal"),
            BuiltinSymbol.function("error_message", "nvarchar"),
            BuiltinSymbol.function("error_number", "int"));

    private static final String[] NUMERIC = {
            "int", "bigint", "smallint", "tinyint", "bit", "decimal", "numeric", "float", "real", "money"};

    private static final String[] TEXT = {"varchar", "nvarchar", "char", "nchar", "text", "ntext"};

    private static final TypeConversions CONVERSIONS = TypeConversions.builder()
            .family(NUMERIC)
            .family(TEXT)
            .allowInto(TEXT, NUMERIC)
            .allowInto(new String[]{"date", "datetime", "datetime2", "smalldatetime", "time"},
                    "varchar", "nvarchar", "date", "datetime", "datetime2", "smalldatetime", "time")
            .build();

    @Override
    public Language language() {
        return Language.TSQL;
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
    public Set<String> stringPrefixes() {
        return Set.of("n");
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
    public char variablePrefix() {
        return '@';
    }

    @Override
    public Set<String> statementKeywords() {
        return STATEMENT_KEYWORDS;
    }

    @Override
    public Set<String> blockOpeners() {
        return Set.of("begin", "case");
    }

    /**
     * {@code BEGIN TRAN} starts a transaction, not a block.
     */
    @Override
    public boolean opensBlock(List<Token> tokens, int index) {
        if (!LanguageProfile.super.opensBlock(tokens, index)) {
            return false;
        }
        if (index + 1 >= tokens.size()) {
            return true;
        }
        Token next = tokens.get(index + 1);
        return !(next.hasTextIgnoreCase("tran") || next.hasTextIgnoreCase("transaction")
                || next.hasTextIgnoreCase("distributed"));
    }

    @Override
    public BlockStyle blockStyle() {
        return BlockStyle.KEYWORDS;
    }

    @Override
    public Optional<Severity> undeclaredSeverity() {
        return Optional.of(Severity.ERROR);
    }

    /**
     * Only {@code @variables} must be declared; other names refer to schema objects.
     */
    @Override
    public boolean tracksIdentifier(Token token) {
        return token.text().startsWith("@");
    }

    @Override
    public boolean checksDeclarationOrder() {
        return true;
    }

    @Override
    public String literalType(Token token) {
        return switch (token.kind()) {
            case INTEGER_NUMBER, HEX_NUMBER -> "int";
            case DECIMAL_NUMBER -> "decimal";
            case SINGLE_QUOTED_STRING, DOUBLE_QUOTED_STRING ->
                    token.text().startsWith("N") || token.text().startsWith("n") ? "nvarchar" : "varchar";
            default -> null;
        };
    }
}
