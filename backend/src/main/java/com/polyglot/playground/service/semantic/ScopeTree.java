package com.polyglot.playground.service.semantic;

import com.polyglot.playground.dto.SymbolEntry;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Flat arena of scopes rooted at index 0 ("global"). Scopes are only appended, so a parent index
 * never points forward and the chain walked by {@link #resolve} always terminates. The active
 * scope follows a stack discipline; the global scope is never popped.
 */
public final class ScopeTree {

    public static final int GLOBAL = 0;

    private final List<Scope> scopes = new ArrayList<>();
    private final Deque<Integer> active = new ArrayDeque<>();
    private final boolean caseSensitive;

    public ScopeTree(boolean caseSensitive) {
        this.caseSensitive = caseSensitive;
        scopes.add(new Scope(GLOBAL, "global", Scope.NO_PARENT, 0));
        active.push(GLOBAL);
    }

    /**
     * Opens a child of the active scope and makes it active.
     */
    public int open(String name) {
        return openChild(name, current());
    }

    /**
     * Opens a scope under an explicit, already existing parent, e.g. an out-of-class method body
     * that must see the members of its class.
     */
    public int openChild(String name, int parent) {
        if (parent < 0 || parent >= scopes.size()) {
            throw new IllegalArgumentException("No scope with index " + parent);
        }
        Scope scope = new Scope(scopes.size(), name, parent, scopes.get(parent).level() + 1);
        scopes.add(scope);
        active.push(scope.index());
        return scope.index();
    }

    /**
     * Leaves the active scope. Closing at global level is a no-op.
     */
    public void close() {
        if (active.size() > 1) {
            active.pop();
        }
    }

    public int current() {
        return active.peek();
    }

    public int depth() {
        return active.size() - 1;
    }

    public Scope scope(int index) {
        return scopes.get(index);
    }

    public List<Scope> scopes() {
        return Collections.unmodifiableList(scopes);
    }

    public void define(int scopeIndex, SymbolEntry entry) {
        scopes.get(scopeIndex).bind(key(entry.getName()), entry);
    }

    public Optional<SymbolEntry> lookupLocal(int scopeIndex, String name) {
        return scopes.get(scopeIndex).lookup(key(name));
    }

    /**
     * Looks a name up in the given scope and then in each ancestor up to global.
     */
    public Optional<SymbolEntry> resolve(int fromScope, String name) {
        for (int index = fromScope; index != Scope.NO_PARENT; index = scopes.get(index).parent()) {
            Optional<SymbolEntry> found = scopes.get(index).lookup(key(name));
            if (found.isPresent()) {
                return found;
            }
        }
        return Optional.empty();
    }

    /**
     * Every scope from the given one up to global, innermost first.
     */
    public List<Scope> chain(int fromScope) {
        List<Scope> chain = new ArrayList<>();
        for (int index = fromScope; index != Scope.NO_PARENT; index = scopes.get(index).parent()) {
            chain.add(scopes.get(index));
        }
        return chain;
    }

    private String key(String name) {
        return caseSensitive ? name : name.toLowerCase(Locale.ROOT);
    }
}
