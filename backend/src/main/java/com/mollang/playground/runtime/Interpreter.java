package com.mollang.playground.runtime;

import com.mollang.playground.compiler.ast.Ast;
import com.mollang.playground.compiler.lexer.Lexer;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;

import static com.mollang.playground.runtime.MolRuntimeException.Kind.*;

/**
 * Runs a parsed program directly, with the semantics of the C++ the compiler generates: function
 * definitions are hoisted, globals start absent, falling off the end of a function returns absent
 * and conditions must be booleans.
 * <p>
 * An instance runs one program and is not thread-safe.
 */
public class Interpreter implements Ast.Visitor<MolValue> {

    private final InterpreterLimits limits;
    private final BufferedReader input;
    private final Appendable output;
    private final MolOperators operators;

    private final Map<String, MolValue> globals = new HashMap<>();
    private final Map<String, Ast.FunctionDef> functions = new HashMap<>();

    private long steps = 0;
    private int callDepth = 0;
    private long written = 0;

    public Interpreter(InterpreterLimits limits, BufferedReader input, Appendable output) {
        this.limits = limits;
        this.input = input;
        this.output = output;
        this.operators = new MolOperators(limits.maxTextLength());
    }

    public void execute(Ast.Program program) {
        for (Ast.Statement statement : program.statements()) {
            if (statement instanceof Ast.FunctionDef definition) {
                functions.put(definition.name(), definition);
            }
        }
        for (Ast.Statement statement : program.statements()) {
            if (!(statement instanceof Ast.FunctionDef)) {
                execute(statement);
            }
        }
    }

    private void execute(Ast.Statement statement) {
        tick();
        statement.accept(this);
    }

    /**
     * Charges one step. Statements and loop condition checks both count, so a loop with an empty
     * body still runs into the limit.
     */
    private void tick() {
        if (++steps > limits.maxSteps()) {
            throw new MolRuntimeException(STEP_LIMIT_EXCEEDED,
                    "Program exceeded " + limits.maxSteps() + " steps");
        }
    }

    private void executeAll(List<Ast.Statement> statements) {
        for (Ast.Statement statement : statements) {
            execute(statement);
        }
    }

    private boolean condition(Ast.Expression expression) {
        MolValue value = expression.accept(this);
        if (value instanceof MolValue.BooleanValue bool) {
            return bool.value();
        }
        throw new MolRuntimeException(NON_BOOLEAN_CONDITION, "Condition is not a boolean: " + value.kind());
    }

    @Override
    public MolValue visitNumberLiteral(Ast.NumberLiteral node) {
        OptionalInt value = Lexer.parseInteger(node.text());
        if (value.isEmpty()) {
            throw new IllegalStateException("Not an integer literal: " + node.text());
        }
        return MolValue.of(value.getAsInt());
    }

    @Override
    public MolValue visitStringLiteral(Ast.StringLiteral node) {
        return MolValue.of(node.text());
    }

    @Override
    public MolValue visitVariableRef(Ast.VariableRef node) {
        return globals.getOrDefault(node.name(), MolValue.ABSENT);
    }

    @Override
    public MolValue visitInput(Ast.InputExpr node) {
        String line;
        try {
            line = input.readLine();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read program input", e);
        }
        if (line == null) {
            return MolValue.of("");
        }
        OptionalInt number = Lexer.parseInteger(line);
        return number.isPresent() ? MolValue.of(number.getAsInt()) : MolValue.of(line);
    }

    @Override
    public MolValue visitBinaryOp(Ast.BinaryOp node) {
        MolValue left = node.left().accept(this);
        MolValue right = node.right().accept(this);
        return operators.apply(node.operator(), left, right);
    }

    @Override
    public MolValue visitAssign(Ast.Assign node) {
        globals.put(node.variable(), node.value().accept(this));
        return MolValue.ABSENT;
    }

    @Override
    public MolValue visitPrint(Ast.Print node) {
        String text = node.value().accept(this).render();
        written += text.length() + 1L;
        if (written > limits.maxOutputLength()) {
            throw new MolRuntimeException(OUTPUT_LIMIT_EXCEEDED,
                    "Program output exceeded " + limits.maxOutputLength() + " characters");
        }
        try {
            output.append(text).append('\n');
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write program output", e);
        }
        return MolValue.ABSENT;
    }

    @Override
    public MolValue visitIf(Ast.If node) {
        if (condition(node.condition())) {
            executeAll(node.body());
        }
        return MolValue.ABSENT;
    }

    @Override
    public MolValue visitWhile(Ast.While node) {
        while (true) {
            tick();
            if (!condition(node.condition())) {
                break;
            }
            executeAll(node.body());
        }
        return MolValue.ABSENT;
    }

    @Override
    public MolValue visitFunctionDef(Ast.FunctionDef node) {
        // registered up front by execute(Program)
        return MolValue.ABSENT;
    }

    @Override
    public MolValue visitFunctionCall(Ast.FunctionCall node) {
        call(node.name());
        return MolValue.ABSENT;
    }

    @Override
    public MolValue visitReturn(Ast.Return node) {
        throw new ReturnSignal(node.value().accept(this));
    }

    MolValue call(String name) {
        Ast.FunctionDef function = functions.get(name);
        if (function == null) {
            throw new MolRuntimeException(UNDEFINED_FUNCTION, "Function '" + name + "' is not defined");
        }
        if (callDepth >= limits.maxCallDepth()) {
            throw new MolRuntimeException(CALL_DEPTH_EXCEEDED,
                    "Call depth exceeded " + limits.maxCallDepth() + " in '" + name + "'");
        }
        callDepth++;
        try {
            executeAll(function.body());
            return MolValue.ABSENT;
        } catch (ReturnSignal signal) {
            return signal.value;
        } finally {
            callDepth--;
        }
    }

    private static final class ReturnSignal extends RuntimeException {
        private final MolValue value;

        ReturnSignal(MolValue value) {
            super(null, null, false, false);
            this.value = value;
        }
    }
}
