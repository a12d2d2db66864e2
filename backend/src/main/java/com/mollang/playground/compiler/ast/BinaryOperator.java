package com.mollang.playground.compiler.ast;

public enum BinaryOperator {
    ADD("+"),
    MULTIPLY("*"),
    EQUAL("=="),
    LESS("<"),
    LESS_OR_EQUAL("<=");

    private final String symbol;

    BinaryOperator(String symbol) {
        this.symbol = symbol;
    }

    /**
     * @return the operator as it is written in the generated C++
     */
    public String symbol() {
        return symbol;
    }
}
