package com.mollang.playground.compiler.symbol;

import com.mollang.playground.compiler.ast.Ast;
import com.mollang.playground.compiler.lexer.Lexer;
import com.mollang.playground.compiler.parser.ParseException;
import com.mollang.playground.compiler.parser.Parser;

import org.junit.jupiter.api.Test;

import java.util.HashSet;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.entry;

class SymbolResolverTest {

    private static SymbolTable resolve(String source) throws ParseException {
        Ast.Program program = new Parser(new Lexer(source).tokenize()).parseProgram();
        return SymbolResolver.resolve(program);
    }

    @Test
    void namesVariablesInFirstSeenOrder() throws ParseException {
        SymbolTable symbols = resolve("바압 은 1\n밥 은 바아압 합 바압\n스크럼 밥");

        assertThat(symbols.variables()).containsExactly(
                entry("바압", "var_0"), entry("밥", "var_1"), entry("바아압", "var_2"));
    }

    @Test
    void registersAssignedVariableBeforeItsValue() throws ParseException {
        SymbolTable symbols = resolve("밥 은 바압");

        assertThat(symbols.variables()).containsExactly(entry("밥", "var_0"), entry("바압", "var_1"));
    }

    @Test
    void resolvesFunctionsCalledBeforeTheirDefinition() throws ParseException {
        SymbolTable symbols = resolve("캠프B\n캠프A [캠프B]\n캠프B [스크럼 밥]");

        assertThat(symbols.functions()).containsExactly(entry("캠프B", "func_0"), entry("캠프A", "func_1"));
        assertThat(symbols.variables()).containsExactly(entry("밥", "var_0"));
    }

    @Test
    void generatedNamesAreUnique() throws ParseException {
        SymbolTable symbols = resolve("밥 은 1 바압 은 2 바아압 은 3 바아아압 은 4 캠프1 [] 캠프2 [] 캠프3");

        assertThat(new HashSet<>(symbols.variables().values())).hasSize(4);
        assertThat(new HashSet<>(symbols.functions().values())).hasSize(3);
    }

    @Test
    void lookupOfUnknownNameFails() {
        SymbolTable symbols = new SymbolTable();
        symbols.registerVariable("밥");

        assertThat(symbols.variable("밥")).isEqualTo("var_0");
        assertThat(symbols.registerVariable("밥")).isEqualTo("var_0");
        assertThatThrownBy(() -> symbols.variable("바압")).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> symbols.function("캠프")).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void tablesAreReadOnlyViews() {
        SymbolTable symbols = new SymbolTable();

        assertThatThrownBy(() -> symbols.variables().put("밥", "var_9"))
                .isInstanceOf(UnsupportedOperationException.class);
    }
}
