/*
 * Copyright (c) 2025 Ascesis CES Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.ascesis.ces.api.ast;

import com.ascesis.ces.api.exceptions.InvalidNodeListException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PolynomialTest {

    @Nested
    @DisplayName("Algebra")
    class Algebra {

        @Test
        @DisplayName("Theta is neutral for addition")
        void thetaIsAdditiveIdentity() {
            Polynomial p = Polynomial.sum("a", "b");
            assertThat(p.add(Polynomial.theta())).isEqualTo(p);
            assertThat(Polynomial.theta().add(p)).isEqualTo(p);
        }

        @Test
        @DisplayName("Theta annihilates multiplication")
        void thetaAnnihilatesProduct() {
            Polynomial p = Polynomial.sum("a", "b");
            assertThat(p.multiply(Polynomial.theta()).isTheta()).isTrue();
            assertThat(Polynomial.theta().multiply(p).isTheta()).isTrue();
        }

        @Test
        @DisplayName("Addition is commutative and associative")
        void additionLaws() {
            Polynomial a = Polynomial.of("a");
            Polynomial b = Polynomial.product("b", "c");
            Polynomial c = Polynomial.of("d");
            assertThat(a.add(b).isEquivalentTo(b.add(a))).isTrue();
            assertThat(a.add(b).add(c)).isEqualTo(a.add(b.add(c)));
        }

        @Test
        @DisplayName("Multiplication distributes over addition")
        void distributivity() {
            Polynomial a = Polynomial.of("a");
            Polynomial bc = Polynomial.sum("b", "c");
            Polynomial product = a.multiply(bc);
            assertThat(product.monomials()).containsExactly(List.of("a", "b"), List.of("a", "c"));
            assertThat(product).isEqualTo(Polynomial.product("a", "b").add(Polynomial.product("a", "c")));
        }

        @Test
        @DisplayName("Repeated occurrences are kept")
        void keepsMultiplicity() {
            Polynomial p = Polynomial.of("a").add(Polynomial.of("a"));
            assertThat(p.size()).isEqualTo(2);
            assertThat(p).isNotEqualTo(Polynomial.of("a"));
            assertThat(Polynomial.product("a", "a").monomials().get(0)).hasSize(2);
        }

        @Test
        @DisplayName("Equivalence ignores monomial and factor order")
        void equivalenceIgnoresOrder() {
            Polynomial left = Polynomial.product("a", "b").add(Polynomial.of("c"));
            Polynomial right = Polynomial.of("c").add(Polynomial.product("b", "a"));
            assertThat(left.isEquivalentTo(right)).isTrue();
            assertThat(left).isNotEqualTo(right);
        }

        @Test
        @DisplayName("Equality keeps monomial order")
        void equalityKeepsOrder() {
            assertThat(Polynomial.sum("b", "c")).isNotEqualTo(Polynomial.sum("c", "b"));
            assertThat(Polynomial.sum("b", "c")).isEqualTo(Polynomial.of("b").add(Polynomial.of("c")));
            assertThat(Polynomial.sum("b", "c").hashCode())
                    .isEqualTo(Polynomial.of("b").add(Polynomial.of("c")).hashCode());
        }

        @Test
        @DisplayName("Equality distinguishes a parenthesized node list from a plain one")
        void equalityKeepsPlainness() {
            Polynomial plain = Polynomial.product("a", "b");
            Polynomial grouped = plain.parenthesized();
            assertThat(grouped).isNotEqualTo(plain);
            assertThat(grouped.isEquivalentTo(plain)).isTrue();
        }

        @Test
        @DisplayName("Renaming keeps shape")
        void renameKeepsShape() {
            Polynomial p = Polynomial.product("x", "y").add(Polynomial.of("x"));
            Polynomial renamed = p.rename(n -> n.equals("x") ? "a" : n);
            assertThat(renamed.monomials()).containsExactly(List.of("a", "y"), List.of("a"));
        }
    }

    @Nested
    @DisplayName("Plainness")
    class Plainness {

        @Test
        @DisplayName("Juxtaposed identifiers are plain")
        void juxtapositionIsPlain() {
            Polynomial p = Polynomial.of("a").multiply(Polynomial.of("b"));
            assertThat(p.isPlain()).isTrue();
            assertThat(p.toNodeList()).isEqualTo(NodeList.of("a", "b"));
        }

        @Test
        @DisplayName("Sums and parenthesized polynomials are not plain")
        void sumsAreNotPlain() {
            assertThat(Polynomial.sum("a", "b").isPlain()).isFalse();
            assertThat(Polynomial.of("a").parenthesized().isPlain()).isFalse();
            assertThat(Polynomial.of("a").parenthesized().multiply(Polynomial.of("b")).isPlain()).isFalse();
        }

        @Test
        @DisplayName("A non-plain operand is rejected as a node list")
        void rejectsNonPlainNodeList() {
            assertThatThrownBy(() -> Polynomial.sum("a", "b").toNodeList())
                    .isInstanceOf(InvalidNodeListException.class)
                    .hasMessageContaining("a + b");
        }

        @Test
        @DisplayName("Flattening collects every node regardless of plainness")
        void flattenCollectsNodes() {
            Polynomial p = Polynomial.product("c", "a").add(Polynomial.of("b")).add(Polynomial.of("a"));
            assertThat(p.flatten()).isEqualTo(NodeList.of("a", "b", "c"));
            assertThat(Polynomial.theta().toNodeList().isEmpty()).isTrue();
        }
    }

    @Test
    @DisplayName("Should render sums of products")
    void rendersText() {
        assertThat(Polynomial.product("a", "b").add(Polynomial.of("c"))).hasToString("a b + c");
        assertThat(Polynomial.theta()).hasToString("θ");
    }
}
