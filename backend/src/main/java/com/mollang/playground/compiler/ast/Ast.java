package com.mollang.playground.compiler.ast;

import java.util.List;
import java.util.Objects;

/**
 * Syntax tree of a Mollang program.
 * <p>
 * The node set is closed: {@link Node} is sealed and every traversal goes through a
 * {@link Visitor}, which has one method per variant. Function definitions only occur in
 * {@link Program#statements()}, block bodies never contain them.
 */
public final class Ast {

    private Ast() {
    }

    public sealed interface Node permits Expression, Statement {
        <R> R accept(Visitor<R> visitor);
    }

    public sealed interface Expression extends Node
            permits NumberLiteral, StringLiteral, VariableRef, InputExpr, BinaryOp {
    }

    public sealed interface Statement extends Node
            permits Assign, Print, If, While, FunctionDef, FunctionCall, Return {
    }

    public interface Visitor<R> {
        R visitNumberLiteral(NumberLiteral node);

        R visitStringLiteral(StringLiteral node);

        R visitVariableRef(VariableRef node);

        R visitInput(InputExpr node);

        R visitBinaryOp(BinaryOp node);

        R visitAssign(Assign node);

        R visitPrint(Print node);

        R visitIf(If node);

        R visitWhile(While node);

        R visitFunctionDef(FunctionDef node);

        R visitFunctionCall(FunctionCall node);

        R visitReturn(Return node);
    }

    public record Program(List<Statement> statements) {
        public Program {
            statements = List.copyOf(statements);
        }
    }

    // Expressions

    /** Integer literal, kept as written. */
    public record NumberLiteral(String text) implements Expression {
        public NumberLiteral {
            Objects.requireNonNull(text, "text");
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitNumberLiteral(this);
        }
    }

    public record StringLiteral(String text) implements Expression {
        public StringLiteral {
            Objects.requireNonNull(text, "text");
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitStringLiteral(this);
        }
    }

    public record VariableRef(String name) implements Expression {
        public VariableRef {
            Objects.requireNonNull(name, "name");
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitVariableRef(this);
        }
    }

    /** Reads one line of standard input. */
    public record InputExpr() implements Expression {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitInput(this);
        }
    }

    public record BinaryOp(Expression left, BinaryOperator operator, Expression right) implements Expression {
        public BinaryOp {
            Objects.requireNonNull(left, "left");
            Objects.requireNonNull(operator, "operator");
            Objects.requireNonNull(right, "right");
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitBinaryOp(this);
        }
    }

    // Statements

    public record Assign(String variable, Expression value) implements Statement {
        public Assign {
            Objects.requireNonNull(variable, "variable");
            Objects.requireNonNull(value, "value");
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitAssign(this);
        }
    }

    public record Print(Expression value) implements Statement {
        public Print {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitPrint(this);
        }
    }

    public record If(Expression condition, List<Statement> body) implements Statement {
        public If {
            Objects.requireNonNull(condition, "condition");
            body = List.copyOf(body);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitIf(this);
        }
    }

    public record While(Expression condition, List<Statement> body) implements Statement {
        public While {
            Objects.requireNonNull(condition, "condition");
            body = List.copyOf(body);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitWhile(this);
        }
    }

    public record FunctionDef(String name, List<Statement> body) implements Statement {
        public FunctionDef {
            Objects.requireNonNull(name, "name");
            body = List.copyOf(body);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitFunctionDef(this);
        }
    }

    /** Zero-argument call in statement position; the result is discarded. */
    public record FunctionCall(String name) implements Statement {
        public FunctionCall {
            Objects.requireNonNull(name, "name");
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitFunctionCall(this);
        }
    }

    public record Return(Expression value) implements Statement {
        public Return {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitReturn(this);
        }
    }
}
