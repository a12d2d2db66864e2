package com.mollang.playground.compiler.lexer;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

class IdentifierRuleTest {

    private static String name(int fillers) {
        return "바" + "아".repeat(fillers) + "압";
    }

    @ParameterizedTest
    @ValueSource(ints = {0, 1, 2, 3, 5, 10, 100})
    void acceptsPrefixFillersSuffix(int fillers) {
        assertThat(IdentifierRule.isVariableName(name(fillers))).isTrue();
    }

    @ParameterizedTest
    @ValueSource(ints = {0, 1, 4})
    void rejectsChangedPrefixOrSuffix(int fillers) {
        String name = name(fillers);
        String badPrefix = "밥" + name.substring(1);
        String badSuffix = name.substring(0, name.length() - 1) + "아";

        assertThat(IdentifierRule.isVariableName(badPrefix)).isFalse();
        assertThat(IdentifierRule.isVariableName(badSuffix)).isFalse();
    }

    @ParameterizedTest
    @ValueSource(ints = {1, 2, 3, 6})
    void rejectsAnyChangedFiller(int fillers) {
        String name = name(fillers);
        for (int i = 1; i <= fillers; i++) {
            String mutated = name.substring(0, i) + "어" + name.substring(i + 1);
            assertThat(IdentifierRule.isVariableName(mutated)).as(mutated).isFalse();
        }
    }

    @Test
    void acceptsShorthand() {
        assertThat(IdentifierRule.isVariableName("밥")).isTrue();
    }

    @Test
    void rejectsOtherWords() {
        assertThat(IdentifierRule.isVariableName("")).isFalse();
        assertThat(IdentifierRule.isVariableName(null)).isFalse();
        assertThat(IdentifierRule.isVariableName("바")).isFalse();
        assertThat(IdentifierRule.isVariableName("압")).isFalse();
        assertThat(IdentifierRule.isVariableName("밥밥")).isFalse();
        assertThat(IdentifierRule.isVariableName("바압 ")).isFalse();
        assertThat(IdentifierRule.isVariableName("rice")).isFalse();
    }

    @Test
    void recognizesFunctionNamesByPrefix() {
        assertThat(IdentifierRule.isFunctionName("캠프")).isTrue();
        assertThat(IdentifierRule.isFunctionName("캠프1")).isTrue();
        assertThat(IdentifierRule.isFunctionName("캠프파이어")).isTrue();
        assertThat(IdentifierRule.isFunctionName("캠")).isFalse();
        assertThat(IdentifierRule.isFunctionName("밥")).isFalse();
    }
}
