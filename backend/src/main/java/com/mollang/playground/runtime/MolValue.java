package com.mollang.playground.runtime;

import java.util.Objects;

/**
 * A Mollang value. Mirrors the {@code MolObject} variant of the generated C++ runtime.
 */
public sealed interface MolValue {

    enum Kind {
        ABSENT,
        INTEGER,
        TEXT,
        BOOLEAN
    }

    MolValue ABSENT = new Absent();

    Kind kind();

    /**
     * @return the text {@code mollang_print} writes for this value, without the line break
     */
    String render();

    static MolValue of(int value) {
        return new IntegerValue(value);
    }

    static MolValue of(String value) {
        return new TextValue(value);
    }

    static MolValue of(boolean value) {
        return new BooleanValue(value);
    }

    record Absent() implements MolValue {
        @Override
        public Kind kind() {
            return Kind.ABSENT;
        }

        @Override
        public String render() {
            return "";
        }
    }

    record IntegerValue(int value) implements MolValue {
        @Override
        public Kind kind() {
            return Kind.INTEGER;
        }

        @Override
        public String render() {
            return Integer.toString(value);
        }
    }

    record TextValue(String value) implements MolValue {
        public TextValue {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public Kind kind() {
            return Kind.TEXT;
        }

        @Override
        public String render() {
            return value;
        }
    }

    record BooleanValue(boolean value) implements MolValue {
        @Override
        public Kind kind() {
            return Kind.BOOLEAN;
        }

        @Override
        public String render() {
            return value ? "true" : "false";
        }
    }
}
