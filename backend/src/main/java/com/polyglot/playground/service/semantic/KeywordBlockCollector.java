package com.polyglot.playground.service.semantic;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Scope bookkeeping of the languages delimited by {@code begin ... end}. A routine or declare
 * section opens its scope at its header; the first {@code begin} after the header is its body and
 * the {@code end} that closes that body closes the scope.
 */
abstract class KeywordBlockCollector extends SymbolCollector {

    private final Deque<Routine> routines = new ArrayDeque<>();
    private int blockDepth;

    private static final class Routine {

        private int bodyDepth = -1;
    }

    KeywordBlockCollector(SemanticContext context) {
        super(context);
    }

    @Override
    void collect() {
        for (int i = 0; i < tokens.size(); i++) {
            context.recordScope(i);
            boolean opens = profile.opensBlock(tokens, i);
            boolean closes = !opens && profile.closesBlock(tokens, i);
            if (opens) {
                blockDepth++;
                Routine routine = routines.peek();
                if (routine != null && routine.bodyDepth < 0 && is(i, "begin")) {
                    routine.bodyDepth = blockDepth;
                }
            }
            if (!context.isSite(i)) {
                visit(i);
            }
            if (closes) {
                Routine routine = routines.peek();
                if (routine != null && routine.bodyDepth == blockDepth) {
                    routines.pop();
                    scopes.close();
                }
                blockDepth = Math.max(0, blockDepth - 1);
            }
        }
    }

    protected abstract void visit(int index);

    protected void openRoutine(String name) {
        scopes.open(name);
        routines.push(new Routine());
    }

    /**
     * Drops the routine opened last, for a header that turned out to be a forward declaration.
     */
    protected void abandonRoutine() {
        if (!routines.isEmpty()) {
            routines.pop();
            scopes.close();
        }
    }

    /**
     * Closes every open routine scope, e.g. at a batch separator.
     */
    protected void closeAllRoutines() {
        while (!routines.isEmpty()) {
            routines.pop();
            scopes.close();
        }
        blockDepth = 0;
    }

    /**
     * Index of the first token at or after {@code start} with the given text, not looking past
     * {@code limit}; -1 when absent.
     */
    protected int find(int start, int limit, String text) {
        for (int i = start; i < tokens.size() && i < limit; i++) {
            if (is(i, text)) {
                return i;
            }
        }
        return -1;
    }
}
