package com.mollang.playground.compiler.symbol;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Generated C++ names for the variables and functions of one compilation. Names are handed out
 * as {@code var_N} and {@code func_N} in order of first registration and never change afterwards.
 * A table belongs to a single compilation and is not shared.
 */
public class SymbolTable {

    static final String VARIABLE_PREFIX = "var_";
    static final String FUNCTION_PREFIX = "func_";

    private final Map<String, String> variables = new LinkedHashMap<>();
    private final Map<String, String> functions = new LinkedHashMap<>();

    public String registerVariable(String name) {
        return variables.computeIfAbsent(name, key -> VARIABLE_PREFIX + variables.size());
    }

    public String registerFunction(String name) {
        return functions.computeIfAbsent(name, key -> FUNCTION_PREFIX + functions.size());
    }

    public String variable(String name) {
        return lookup(variables, name, "variable");
    }

    public String function(String name) {
        return lookup(functions, name, "function");
    }

    /**
     * @return source name to generated name, in registration order
     */
    public Map<String, String> variables() {
        return Collections.unmodifiableMap(variables);
    }

    public Map<String, String> functions() {
        return Collections.unmodifiableMap(functions);
    }

    private static String lookup(Map<String, String> names, String name, String what) {
        String generated = names.get(name);
        if (generated == null) {
            throw new IllegalStateException("Unresolved " + what + " '" + name + "'");
        }
        return generated;
    }
}
