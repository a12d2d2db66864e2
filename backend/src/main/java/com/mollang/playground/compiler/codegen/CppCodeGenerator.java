package com.mollang.playground.compiler.codegen;

import com.mollang.playground.compiler.ast.Ast;
import com.mollang.playground.compiler.lexer.Lexer;
import com.mollang.playground.compiler.symbol.SymbolTable;

import java.util.List;

/**
 * Lowers a resolved program to C++17 source text. The symbol table must already contain every
 * name used by the program; this pass only looks names up.
 */
public class CppCodeGenerator implements Ast.Visitor<String> {

    private static final String INDENT = "    ";

    private final SymbolTable symbols;

    public CppCodeGenerator(SymbolTable symbols) {
        this.symbols = symbols;
    }

    public String generate(Ast.Program program) {
        StringBuilder out = new StringBuilder(CppRuntime.PREAMBLE);
        out.append('\n');

        for (String function : symbols.functions().values()) {
            out.append(CppRuntime.VALUE_TYPE).append(' ').append(function).append("();\n");
        }
        out.append('\n');

        for (String variable : symbols.variables().values()) {
            out.append(CppRuntime.VALUE_TYPE).append(' ').append(variable).append(";\n");
        }
        out.append('\n');

        for (Ast.Statement statement : program.statements()) {
            if (statement instanceof Ast.FunctionDef) {
                out.append(statement.accept(this)).append("\n\n");
            }
        }

        out.append("int main() {\n");
        out.append(INDENT).append("try {\n");
        for (Ast.Statement statement : program.statements()) {
            if (!(statement instanceof Ast.FunctionDef)) {
                out.append(indent(statement.accept(this), 2)).append('\n');
            }
        }
        out.append(INDENT).append("} catch (const ").append(CppRuntime.RUNTIME_ERROR).append("& e) {\n");
        out.append(INDENT).append(INDENT).append("std::cout.flush();\n");
        out.append(INDENT).append(INDENT).append("std::cerr << \"Runtime error: \" << e.what() << std::endl;\n");
        out.append(INDENT).append(INDENT).append("return 1;\n");
        out.append(INDENT).append("}\n");
        out.append(INDENT).append("return 0;\n");
        out.append("}\n");
        return out.toString();
    }

    @Override
    public String visitNumberLiteral(Ast.NumberLiteral node) {
        int value = Lexer.parseInteger(node.text())
                .orElseThrow(() -> new IllegalStateException("Not an integer literal: " + node.text()));
        // -2147483648 is not an int literal in C++
        String literal = value == Integer.MIN_VALUE ? "(-2147483647 - 1)" : Integer.toString(value);
        return CppRuntime.VALUE_TYPE + "(" + literal + ")";
    }

    @Override
    public String visitStringLiteral(Ast.StringLiteral node) {
        return CppRuntime.VALUE_TYPE + "(std::string(" + quote(node.text()) + "))";
    }

    @Override
    public String visitVariableRef(Ast.VariableRef node) {
        return symbols.variable(node.name());
    }

    @Override
    public String visitInput(Ast.InputExpr node) {
        return CppRuntime.INPUT + "()";
    }

    @Override
    public String visitBinaryOp(Ast.BinaryOp node) {
        return "(" + node.left().accept(this) + " " + node.operator().symbol() + " " + node.right().accept(this) + ")";
    }

    @Override
    public String visitAssign(Ast.Assign node) {
        return symbols.variable(node.variable()) + " = " + node.value().accept(this) + ";";
    }

    @Override
    public String visitPrint(Ast.Print node) {
        return CppRuntime.PRINT + "(" + node.value().accept(this) + ");";
    }

    @Override
    public String visitIf(Ast.If node) {
        return "if (" + condition(node.condition()) + ") {\n" + block(node.body()) + "}";
    }

    @Override
    public String visitWhile(Ast.While node) {
        return "while (" + condition(node.condition()) + ") {\n" + block(node.body()) + "}";
    }

    @Override
    public String visitFunctionDef(Ast.FunctionDef node) {
        return CppRuntime.VALUE_TYPE + " " + symbols.function(node.name()) + "() {\n"
                + block(node.body())
                + INDENT + "return " + CppRuntime.VALUE_TYPE + "();\n"
                + "}";
    }

    @Override
    public String visitFunctionCall(Ast.FunctionCall node) {
        return symbols.function(node.name()) + "();";
    }

    @Override
    public String visitReturn(Ast.Return node) {
        return "return " + node.value().accept(this) + ";";
    }

    private String condition(Ast.Expression condition) {
        return CppRuntime.CONDITION + "(" + condition.accept(this) + ")";
    }

    private String block(List<Ast.Statement> body) {
        StringBuilder out = new StringBuilder();
        for (Ast.Statement statement : body) {
            out.append(indent(statement.accept(this), 1)).append('\n');
        }
        return out.toString();
    }

    private static String indent(String code, int levels) {
        String prefix = INDENT.repeat(levels);
        StringBuilder out = new StringBuilder();
        String[] lines = code.split("\n", -1);
        for (int i = 0; i < lines.length; i++) {
            if (i > 0) {
                out.append('\n');
            }
            out.append(prefix).append(lines[i]);
        }
        return out.toString();
    }

    /**
     * Writes {@code text} as a C++ string literal. Non-ASCII characters are kept as they are, the
     * generated file is UTF-8.
     */
    static String quote(String text) {
        StringBuilder out = new StringBuilder("\"");
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            switch (c) {
                case '\\' -> out.append("\\\\");
                case '"' -> out.append("\\\"");
                case '\n' -> out.append("\\n");
                case '\r' -> out.append("\\r");
                case '\t' -> out.append("\\t");
                default -> {
                    if (c < 0x20 || c == 0x7F) {
                        out.append(String.format("\\%03o", (int) c));
                    } else {
                        out.append(c);
                    }
                }
            }
        }
        return out.append('"').toString();
    }
}
