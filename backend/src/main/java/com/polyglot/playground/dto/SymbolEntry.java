package com.polyglot.playground.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A declaration discovered during symbol-table construction. Usage and initialization flags are
 * flipped in place by the verification pass; entries are never removed during a run.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SymbolEntry {

    private final String name;
    private final SymbolKind kind;
    private String dataType;
    private final String scope;
    private final int scopeIndex;
    private final int line;
    private final int column;
    private final int declarationIndex;
    private final List<ParamInfo> parameters = new ArrayList<>();
    private String returnType;
    private boolean initialized;
    private boolean used;
    private boolean constant;
    private boolean builtin;
    private String declarationKeyword;
    private String typeSuffix = "";

    public SymbolEntry(String name, SymbolKind kind, String dataType, String scope, int scopeIndex,
                       int line, int column, int declarationIndex) {
        this.name = name;
        this.kind = kind;
        this.dataType = dataType;
        this.scope = scope;
        this.scopeIndex = scopeIndex;
        this.line = line;
        this.column = column;
        this.declarationIndex = declarationIndex;
    }

    public static SymbolEntry builtin(String name, SymbolKind kind, String dataType, String returnType, String scope) {
        SymbolEntry entry = new SymbolEntry(name, kind, dataType, scope, 0, 0, 0, -1);
        entry.returnType = returnType;
        entry.builtin = true;
        entry.initialized = true;
        entry.used = true;
        return entry;
    }

    public String getName() {
        return name;
    }

    @JsonProperty("type")
    public SymbolKind getKind() {
        return kind;
    }

    public String getDataType() {
        return dataType;
    }

    public String getScope() {
        return scope;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    public List<ParamInfo> getParameters() {
        return Collections.unmodifiableList(parameters);
    }

    public String getReturnType() {
        return returnType;
    }

    public boolean isInitialized() {
        return initialized;
    }

    public boolean isUsed() {
        return used;
    }

    public boolean isConstant() {
        return constant;
    }

    public boolean isBuiltin() {
        return builtin;
    }

    @JsonIgnore
    public int getScopeIndex() {
        return scopeIndex;
    }

    /**
     * Index of the declaring name in the comment-free token stream, or -1 for built-ins.
     */
    @JsonIgnore
    public int getDeclarationIndex() {
        return declarationIndex;
    }

    @JsonIgnore
    public String getDeclarationKeyword() {
        return declarationKeyword;
    }

    @JsonIgnore
    public String getTypeSuffix() {
        return typeSuffix;
    }

    public void addParameter(ParamInfo parameter) {
        parameters.add(parameter);
    }

    public void setReturnType(String returnType) {
        this.returnType = returnType;
    }

    public void setConstant(boolean constant) {
        this.constant = constant;
    }

    public void setDeclarationKeyword(String declarationKeyword) {
        this.declarationKeyword = declarationKeyword;
    }

    public void setTypeSuffix(String typeSuffix) {
        this.typeSuffix = typeSuffix == null ? "" : typeSuffix;
    }

    public void markInitialized() {
        this.initialized = true;
    }

    public void markUsed() {
        this.used = true;
    }

    /**
     * Appends the pending pointer or reference marker to the declared type.
     */
    public void applyTypeSuffix() {
        if (!typeSuffix.isEmpty() && dataType != null && !dataType.endsWith(typeSuffix)) {
            dataType = dataType + typeSuffix;
        }
    }

    @Override
    public String toString() {
        return kind.wireName() + " " + name + (dataType != null ? ": " + dataType : "") + " @" + scope;
    }
}
