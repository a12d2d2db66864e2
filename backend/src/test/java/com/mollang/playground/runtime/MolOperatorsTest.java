package com.mollang.playground.runtime;

import com.mollang.playground.compiler.ast.BinaryOperator;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MolOperatorsTest {

    private final MolOperators operators = new MolOperators(100);

    @Test
    void addsIntegersAndConcatenatesText() {
        assertThat(operators.add(MolValue.of(2), MolValue.of(3))).isEqualTo(MolValue.of(5));
        assertThat(operators.add(MolValue.of("ab"), MolValue.of("cd"))).isEqualTo(MolValue.of("abcd"));
        assertThat(operators.add(MolValue.of(Integer.MAX_VALUE), MolValue.of(1))).isEqualTo(MolValue.of(Integer.MIN_VALUE));
    }

    @Test
    void multipliesIntegersAndRepeatsText() {
        assertThat(operators.multiply(MolValue.of(4), MolValue.of(-3))).isEqualTo(MolValue.of(-12));
        assertThat(operators.multiply(MolValue.of("hi"), MolValue.of(3))).isEqualTo(MolValue.of("hihihi"));
        assertThat(operators.multiply(MolValue.of("hi"), MolValue.of(0))).isEqualTo(MolValue.of(""));
        assertThat(operators.multiply(MolValue.of("hi"), MolValue.of(-2))).isEqualTo(MolValue.of(""));
    }

    @Test
    void comparesIntegers() {
        assertThat(operators.apply(BinaryOperator.LESS, MolValue.of(1), MolValue.of(2))).isEqualTo(MolValue.of(true));
        assertThat(operators.apply(BinaryOperator.LESS, MolValue.of(2), MolValue.of(2))).isEqualTo(MolValue.of(false));
        assertThat(operators.apply(BinaryOperator.LESS_OR_EQUAL, MolValue.of(2), MolValue.of(2))).isEqualTo(MolValue.of(true));
    }

    @Test
    void equalityFallsBackToFalseForMixedKinds() {
        assertThat(operators.equal(MolValue.of(1), MolValue.of(1))).isEqualTo(MolValue.of(true));
        assertThat(operators.equal(MolValue.of("a"), MolValue.of("a"))).isEqualTo(MolValue.of(true));
        assertThat(operators.equal(MolValue.of(1), MolValue.of("1"))).isEqualTo(MolValue.of(false));
        assertThat(operators.equal(MolValue.of(true), MolValue.of(true))).isEqualTo(MolValue.of(false));
        assertThat(operators.equal(MolValue.ABSENT, MolValue.ABSENT)).isEqualTo(MolValue.of(false));
    }

    @Test
    void rejectsUnsupportedOperands() {
        assertThatThrownBy(() -> operators.add(MolValue.of(1), MolValue.of("a")))
                .isInstanceOf(MolRuntimeException.class)
                .hasMessage("Unsupported operand types for +: INTEGER and TEXT");
        assertThatThrownBy(() -> operators.multiply(MolValue.of(3), MolValue.of("a")))
                .hasMessageStartingWith("Unsupported operand types for *");
        assertThatThrownBy(() -> operators.less(MolValue.of("a"), MolValue.of("b")))
                .hasMessageStartingWith("Unsupported operand types for <");
        assertThatThrownBy(() -> operators.lessOrEqual(MolValue.ABSENT, MolValue.of(1)))
                .hasMessage("Unsupported operand types for <=: ABSENT and INTEGER");
    }

    @Test
    void limitsTextLength() {
        assertThatThrownBy(() -> operators.multiply(MolValue.of("ab"), MolValue.of(51)))
                .isInstanceOf(MolRuntimeException.class)
                .extracting(e -> ((MolRuntimeException) e).getKind())
                .isEqualTo(MolRuntimeException.Kind.TEXT_LIMIT_EXCEEDED);
        assertThat(operators.multiply(MolValue.of("ab"), MolValue.of(50)).render()).hasSize(100);
    }

    @Test
    void rendersValuesLikeThePrintRuntime() {
        assertThat(MolValue.ABSENT.render()).isEmpty();
        assertThat(MolValue.of(-7).render()).isEqualTo("-7");
        assertThat(MolValue.of(true).render()).isEqualTo("true");
        assertThat(MolValue.of(false).render()).isEqualTo("false");
    }
}
