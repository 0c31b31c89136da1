package com.polyglot.playground.language;

import com.polyglot.playground.dto.SymbolEntry;
import com.polyglot.playground.dto.SymbolKind;

public record BuiltinSymbol(String name, SymbolKind kind, String dataType, String returnType, String scope) {

    static BuiltinSymbol function(String name, String returnType) {
        return new BuiltinSymbol(name, SymbolKind.FUNCTION, "function", returnType, "global");
    }

    static BuiltinSymbol object(String name, String dataType) {
        return new BuiltinSymbol(name, SymbolKind.VARIABLE, dataType, null, "global");
    }

    static BuiltinSymbol constant(String name, String dataType) {
        return new BuiltinSymbol(name, SymbolKind.CONSTANT, dataType, null, "global");
    }

    static BuiltinSymbol type(String name) {
        return new BuiltinSymbol(name, SymbolKind.CLASS, "type", null, "global");
    }

    BuiltinSymbol inScope(String scopeName) {
        return new BuiltinSymbol(name, kind, dataType, returnType, scopeName);
    }

    public SymbolEntry toEntry() {
        SymbolEntry entry = SymbolEntry.builtin(name, kind, dataType, returnType, scope);
        entry.setConstant(kind == SymbolKind.CONSTANT);
        return entry;
    }
}
