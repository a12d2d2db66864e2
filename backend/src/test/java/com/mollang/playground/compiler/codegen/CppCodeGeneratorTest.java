package com.mollang.playground.compiler.codegen;

import com.mollang.playground.compiler.ast.Ast;
import com.mollang.playground.compiler.lexer.Lexer;
import com.mollang.playground.compiler.parser.ParseException;
import com.mollang.playground.compiler.parser.Parser;
import com.mollang.playground.compiler.symbol.SymbolResolver;
import com.mollang.playground.compiler.symbol.SymbolTable;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class CppCodeGeneratorTest {

    private static String generate(String source) throws ParseException {
        Ast.Program program = new Parser(new Lexer(source).tokenize()).parseProgram();
        SymbolTable symbols = SymbolResolver.resolve(program);
        return new CppCodeGenerator(symbols).generate(program);
    }

    private static String body(String cpp) {
        return cpp.substring(cpp.indexOf("int main() {"));
    }

    @Test
    void emptyProgramStillHasRuntimeAndMain() throws ParseException {
        String cpp = generate("");

        assertThat(cpp).startsWith(CppRuntime.PREAMBLE);
        assertThat(cpp).contains("struct MolObject", "void mollang_print", "MolObject mollang_input");
        assertThat(body(cpp)).contains("try {", "catch (const MolRuntimeError& e)", "return 0;");
    }

    @Test
    void lowersStatementsInsideMain() throws ParseException {
        String cpp = generate("밥 은 1 합 2\n스크럼 밥");

        assertThat(cpp).contains("MolObject var_0;\n");
        assertThat(body(cpp)).contains(
                "        var_0 = (MolObject(1) + MolObject(2));\n",
                "        mollang_print(var_0);\n");
    }

    @Test
    void emitsPrototypesBeforeGlobalsAndDefinitionsBeforeMain() throws ParseException {
        String cpp = generate("캠프2\n캠프1 [밥 은 1]\n캠프2 [퇴근 밥]");

        int prototype = cpp.indexOf("MolObject func_0();");
        int global = cpp.indexOf("MolObject var_0;");
        int definition = cpp.indexOf("MolObject func_1() {");
        int main = cpp.indexOf("int main() {");

        assertThat(prototype).isPositive();
        assertThat(cpp).contains("MolObject func_1();");
        assertThat(global).isGreaterThan(prototype);
        assertThat(definition).isGreaterThan(global);
        assertThat(main).isGreaterThan(definition);
        assertThat(cpp).contains("MolObject func_0() {\n    return var_0;\n    return MolObject();\n}");
        assertThat(body(cpp)).contains("        func_0();\n").doesNotContain("var_0 = ");
    }

    @Test
    void conditionsGoThroughBooleanCheck() throws ParseException {
        String cpp = generate("몰 밥 작 3 [입 밥 같작 1 [스크럼 밥]]");

        assertThat(body(cpp)).contains(
                "        while (mollang_condition((var_0 < MolObject(3)))) {\n"
                        + "            if (mollang_condition((var_0 <= MolObject(1)))) {\n"
                        + "                mollang_print(var_0);\n"
                        + "            }\n"
                        + "        }\n");
    }

    @Test
    void mapsOperatorsAndInput() throws ParseException {
        String cpp = generate("스크럼 뭐먹 곱 2 같 1");

        assertThat(body(cpp)).contains("mollang_print(((mollang_input() * MolObject(2)) == MolObject(1)));");
    }

    @Test
    void writesMinimumIntegerAsExpression() throws ParseException {
        assertThat(generate("스크럼 -2147483648")).contains("MolObject((-2147483647 - 1))");
        assertThat(generate("스크럼 +7")).contains("MolObject(7)");
    }

    @Test
    void escapesStringLiterals() throws ParseException {
        String cpp = generate("스크럼 '말 \"hi\" \\ \n'");

        assertThat(cpp).contains("MolObject(std::string(\"말 \\\"hi\\\" \\\\ \\n\"))");
    }

    @Test
    void quotesControlCharacters() {
        assertThat(CppCodeGenerator.quote("a\tb\rc\u0001")).isEqualTo("\"a\\tb\\rc\\001\"");
        assertThat(CppCodeGenerator.quote("")).isEqualTo("\"\"");
    }

    @Test
    void constantsAreEmittedAsTheirText() throws ParseException {
        assertThat(generate("스크럼 클로드")).contains("mollang_print(MolObject(std::string(\"클로드는 LLM 중 코딩 끝판왕\")));");
    }
}
