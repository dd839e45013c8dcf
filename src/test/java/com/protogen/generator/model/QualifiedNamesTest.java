package com.protogen.generator.model;

import static org.assertj.core.api.Assertions.*;

import org.junit.jupiter.api.Test;

class QualifiedNamesTest {

    @Test
    void testScopeChainIsInnermostFirst() {
        assertThat(QualifiedNames.scopeChain("a.b.c")).containsExactly("a.b.c", "a.b", "a", "");
    }

    @Test
    void testScopeChainOfRootScope() {
        assertThat(QualifiedNames.scopeChain("")).containsExactly("");
        assertThat(QualifiedNames.scopeChain(null)).containsExactly("");
    }

    @Test
    void testJoin() {
        assertThat(QualifiedNames.join("a.b", "C")).isEqualTo("a.b.C");
        assertThat(QualifiedNames.join("", "C")).isEqualTo("C");
    }
}
