package com.mollang.playground.compiler.symbol;

import com.mollang.playground.compiler.ast.Ast;

import java.util.List;

/**
 * First pass over a parsed program: registers every variable and function name in pre-order so
 * that code generation can refer to functions and globals before their textual definition.
 */
public class SymbolResolver implements Ast.Visitor<Void> {

    private final SymbolTable symbols;

    private SymbolResolver(SymbolTable symbols) {
        this.symbols = symbols;
    }

    public static SymbolTable resolve(Ast.Program program) {
        SymbolTable symbols = new SymbolTable();
        resolve(program, symbols);
        return symbols;
    }

    public static void resolve(Ast.Program program, SymbolTable symbols) {
        new SymbolResolver(symbols).visitAll(program.statements());
    }

    private void visitAll(List<Ast.Statement> statements) {
        for (Ast.Statement statement : statements) {
            statement.accept(this);
        }
    }

    @Override
    public Void visitNumberLiteral(Ast.NumberLiteral node) {
        return null;
    }

    @Override
    public Void visitStringLiteral(Ast.StringLiteral node) {
        return null;
    }

    @Override
    public Void visitVariableRef(Ast.VariableRef node) {
        symbols.registerVariable(node.name());
        return null;
    }

    @Override
    public Void visitInput(Ast.InputExpr node) {
        return null;
    }

    @Override
    public Void visitBinaryOp(Ast.BinaryOp node) {
        node.left().accept(this);
        node.right().accept(this);
        return null;
    }

    @Override
    public Void visitAssign(Ast.Assign node) {
        symbols.registerVariable(node.variable());
        node.value().accept(this);
        return null;
    }

    @Override
    public Void visitPrint(Ast.Print node) {
        node.value().accept(this);
        return null;
    }

    @Override
    public Void visitIf(Ast.If node) {
        node.condition().accept(this);
        visitAll(node.body());
        return null;
    }

    @Override
    public Void visitWhile(Ast.While node) {
        node.condition().accept(this);
        visitAll(node.body());
        return null;
    }

    @Override
    public Void visitFunctionDef(Ast.FunctionDef node) {
        symbols.registerFunction(node.name());
        visitAll(node.body());
        return null;
    }

    @Override
    public Void visitFunctionCall(Ast.FunctionCall node) {
        symbols.registerFunction(node.name());
        return null;
    }

    @Override
    public Void visitReturn(Ast.Return node) {
        node.value().accept(this);
        return null;
    }
}
