package com.polyglot.playground.service.semantic;

import com.polyglot.playground.dto.SymbolEntry;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * One binding environment of the scope arena. The parent is an index into the same arena and is
 * always smaller than this scope's own index; the global scope has no parent.
 */
public final class Scope {

    public static final int NO_PARENT = -1;

    private final int index;
    private final String name;
    private final int parent;
    private final int level;
    private final Map<String, SymbolEntry> symbols = new LinkedHashMap<>();

    Scope(int index, String name, int parent, int level) {
        this.index = index;
        this.name = name;
        this.parent = parent;
        this.level = level;
    }

    public int index() {
        return index;
    }

    public String name() {
        return name;
    }

    public int parent() {
        return parent;
    }

    public int level() {
        return level;
    }

    public boolean isGlobal() {
        return parent == NO_PARENT;
    }

    public Collection<SymbolEntry> symbols() {
        return Collections.unmodifiableCollection(symbols.values());
    }

    Optional<SymbolEntry> lookup(String key) {
        return Optional.ofNullable(symbols.get(key));
    }

    /**
     * Binds a name unless a user declaration already holds it; built-ins may be shadowed.
     */
    void bind(String key, SymbolEntry entry) {
        SymbolEntry previous = symbols.get(key);
        if (previous == null || previous.isBuiltin()) {
            symbols.put(key, entry);
        }
    }

    @Override
    public String toString() {
        return name + "#" + index + (isGlobal() ? "" : " <- #" + parent);
    }
}
