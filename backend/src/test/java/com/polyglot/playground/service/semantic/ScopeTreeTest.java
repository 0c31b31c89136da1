package com.polyglot.playground.service.semantic;

import com.polyglot.playground.dto.SymbolEntry;
import com.polyglot.playground.dto.SymbolKind;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ScopeTreeTest {

    @Test
    void startsAtGlobalScope() {
        ScopeTree tree = new ScopeTree(true);

        assertThat(tree.current()).isEqualTo(ScopeTree.GLOBAL);
        assertThat(tree.depth()).isZero();
        assertThat(tree.scope(ScopeTree.GLOBAL).isGlobal()).isTrue();
        assertThat(tree.scope(ScopeTree.GLOBAL).name()).isEqualTo("global");
    }

    @Test
    void resolvesThroughEnclosingScopes() {
        ScopeTree tree = new ScopeTree(true);
        tree.define(ScopeTree.GLOBAL, entry("limit", ScopeTree.GLOBAL));
        int function = tree.open("compute");
        int block = tree.open("block");
        tree.define(block, entry("i", block));

        assertThat(tree.resolve(block, "limit")).isPresent();
        assertThat(tree.resolve(block, "i")).isPresent();
        assertThat(tree.resolve(function, "i")).isEmpty();
        assertThat(tree.lookupLocal(block, "limit")).isEmpty();
        assertThat(tree.chain(block)).extracting(Scope::name).containsExactly("block", "compute", "global");
    }

    @Test
    void innerDeclarationShadowsOuter() {
        ScopeTree tree = new ScopeTree(true);
        SymbolEntry outer = entry("x", ScopeTree.GLOBAL);
        tree.define(ScopeTree.GLOBAL, outer);
        int inner = tree.open("f");
        SymbolEntry shadow = entry("x", inner);
        tree.define(inner, shadow);

        assertThat(tree.resolve(inner, "x")).containsSame(shadow);
        assertThat(tree.resolve(ScopeTree.GLOBAL, "x")).containsSame(outer);
    }

    @Test
    void caseInsensitiveTreeIgnoresCase() {
        ScopeTree tree = new ScopeTree(false);
        tree.define(ScopeTree.GLOBAL, entry("Counter", ScopeTree.GLOBAL));

        assertThat(tree.resolve(ScopeTree.GLOBAL, "COUNTER")).isPresent();
        assertThat(new ScopeTree(true).resolve(ScopeTree.GLOBAL, "counter")).isEmpty();
    }

    @Test
    void closingGlobalScopeIsANoOp() {
        ScopeTree tree = new ScopeTree(true);
        tree.open("f");
        tree.close();
        tree.close();
        tree.close();

        assertThat(tree.current()).isEqualTo(ScopeTree.GLOBAL);
        assertThat(tree.scopes()).hasSize(2);
    }

    @Test
    void childScopeCanAttachToAnEarlierParent() {
        ScopeTree tree = new ScopeTree(true);
        int type = tree.open("Shape");
        tree.close();
        int method = tree.openChild("area", type);

        assertThat(tree.scope(method).parent()).isEqualTo(type);
        assertThat(tree.scope(method).level()).isEqualTo(2);
        assertThatThrownBy(() -> tree.openChild("broken", 42)).isInstanceOf(IllegalArgumentException.class);
    }

    private static SymbolEntry entry(String name, int scope) {
        return new SymbolEntry(name, SymbolKind.VARIABLE, "int", "s" + scope, scope, 1, 1, 0);
    }
}
