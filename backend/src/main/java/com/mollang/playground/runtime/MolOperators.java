package com.mollang.playground.runtime;

import com.mollang.playground.compiler.ast.BinaryOperator;

import static com.mollang.playground.runtime.MolRuntimeException.Kind.TEXT_LIMIT_EXCEEDED;
import static com.mollang.playground.runtime.MolRuntimeException.Kind.UNSUPPORTED_OPERANDS;

/**
 * Binary operators over {@link MolValue}, with the same support matrix as the generated C++:
 * <ul>
 *     <li>{@code +}: integer + integer, text + text</li>
 *     <li>{@code *}: integer * integer, text * integer (repetition)</li>
 *     <li>{@code <}, {@code <=}: integer with integer</li>
 *     <li>{@code ==}: integer with integer, text with text, {@code false} for anything else</li>
 * </ul>
 * Integer arithmetic wraps around at 32 bits.
 */
public class MolOperators {

    private final int maxTextLength;

    public MolOperators(int maxTextLength) {
        this.maxTextLength = maxTextLength;
    }

    public MolValue apply(BinaryOperator operator, MolValue left, MolValue right) {
        return switch (operator) {
            case ADD -> add(left, right);
            case MULTIPLY -> multiply(left, right);
            case EQUAL -> equal(left, right);
            case LESS -> less(left, right);
            case LESS_OR_EQUAL -> lessOrEqual(left, right);
        };
    }

    public MolValue add(MolValue left, MolValue right) {
        if (left instanceof MolValue.IntegerValue a && right instanceof MolValue.IntegerValue b) {
            return MolValue.of(a.value() + b.value());
        }
        if (left instanceof MolValue.TextValue a && right instanceof MolValue.TextValue b) {
            checkLength((long) a.value().length() + b.value().length());
            return MolValue.of(a.value() + b.value());
        }
        throw unsupported(BinaryOperator.ADD, left, right);
    }

    public MolValue multiply(MolValue left, MolValue right) {
        if (left instanceof MolValue.TextValue text && right instanceof MolValue.IntegerValue count) {
            if (count.value() <= 0) {
                return MolValue.of("");
            }
            checkLength((long) text.value().length() * count.value());
            return MolValue.of(text.value().repeat(count.value()));
        }
        if (left instanceof MolValue.IntegerValue a && right instanceof MolValue.IntegerValue b) {
            return MolValue.of(a.value() * b.value());
        }
        throw unsupported(BinaryOperator.MULTIPLY, left, right);
    }

    public MolValue less(MolValue left, MolValue right) {
        if (left instanceof MolValue.IntegerValue a && right instanceof MolValue.IntegerValue b) {
            return MolValue.of(a.value() < b.value());
        }
        throw unsupported(BinaryOperator.LESS, left, right);
    }

    public MolValue lessOrEqual(MolValue left, MolValue right) {
        if (left instanceof MolValue.IntegerValue a && right instanceof MolValue.IntegerValue b) {
            return MolValue.of(a.value() <= b.value());
        }
        throw unsupported(BinaryOperator.LESS_OR_EQUAL, left, right);
    }

    public MolValue equal(MolValue left, MolValue right) {
        if (left instanceof MolValue.IntegerValue a && right instanceof MolValue.IntegerValue b) {
            return MolValue.of(a.value() == b.value());
        }
        if (left instanceof MolValue.TextValue a && right instanceof MolValue.TextValue b) {
            return MolValue.of(a.value().equals(b.value()));
        }
        return MolValue.of(false);
    }

    private void checkLength(long length) {
        if (length > maxTextLength) {
            throw new MolRuntimeException(TEXT_LIMIT_EXCEEDED,
                    "Text value of " + length + " characters exceeds the limit of " + maxTextLength);
        }
    }

    private static MolRuntimeException unsupported(BinaryOperator operator, MolValue left, MolValue right) {
        return new MolRuntimeException(UNSUPPORTED_OPERANDS,
                "Unsupported operand types for " + operator.symbol() + ": " + left.kind() + " and " + right.kind());
    }
}
