package com.polyglot.playground.language;

import java.util.Set;

final class SqlVocabulary {

    static final Set<String> STATEMENT_VERBS = Vocabulary.words(
            "select", "insert", "update", "delete", "create", "alter", "drop", "declare", "begin",
            "truncate", "merge", "grant", "revoke", "commit", "rollback");

    static final Set<String> COMMON_KEYWORDS = Vocabulary.words(
            "select", "from", "where", "insert", "into", "values", "update", "set", "delete", "create",
            "table", "alter", "drop", "declare", "begin", "end", "if", "then", "else", "while", "for",
            "in", "is", "as", "procedure", "function", "return", "returns", "null", "not", "and", "or",
            "like", "between", "order", "by", "group", "having", "distinct", "join", "inner", "left",
            "right", "outer", "full", "cross", "on", "union", "all", "constraint", "primary", "key",
            "foreign", "references", "unique", "check", "default", "index", "view", "trigger",
            "replace", "exists", "case", "when", "commit", "rollback", "grant", "revoke", "truncate",
            "merge", "using", "database", "schema", "add", "column", "asc", "desc", "with", "true",
            "false", "char", "varchar", "date", "int", "integer", "float", "decimal", "numeric");

    private SqlVocabulary() {
    }
}
