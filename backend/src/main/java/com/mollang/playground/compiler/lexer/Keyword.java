package com.mollang.playground.compiler.lexer;

import com.mollang.playground.compiler.ast.BinaryOperator;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * The closed set of Mollang keyword words.
 */
public enum Keyword {
    // statement markers
    ASSIGN("은", Role.STATEMENT),
    IF("입", Role.STATEMENT),
    WHILE("몰", Role.STATEMENT),
    PRINT("스크럼", Role.STATEMENT),
    RETURN("퇴근", Role.STATEMENT),
    FUNCTION("캠프", Role.STATEMENT),
    // expression terms
    INPUT("뭐먹", Role.INPUT),
    // operators
    ADD("덧셈", BinaryOperator.ADD),
    SUM("합", BinaryOperator.ADD),
    PLUS("더하기", BinaryOperator.ADD),
    MULTIPLY("곱셈", BinaryOperator.MULTIPLY),
    PRODUCT("곱", BinaryOperator.MULTIPLY),
    EQUAL("같", BinaryOperator.EQUAL),
    LESS("작", BinaryOperator.LESS),
    EQUAL_LESS("같작", BinaryOperator.LESS_OR_EQUAL),
    LESS_EQUAL("작같", BinaryOperator.LESS_OR_EQUAL),
    // constants
    CURSOR("커서", "커서는 신이야"),
    GPT("지피티", "지피티는 요즘 애매해"),
    GEMINI("제미나이", "제미나이는 잘 따라가는중"),
    CLAUDE("클로드", "클로드는 LLM 중 코딩 끝판왕"),
    CLINE("클라인", "클라인도 레전드입니다… 꼭 쓰세요"),
    GROK("그록", "그록 누가씀?");

    public enum Role {
        STATEMENT,
        INPUT,
        OPERATOR,
        CONSTANT
    }

    private static final Map<String, Keyword> BY_WORD;

    static {
        Map<String, Keyword> map = new HashMap<>();
        for (Keyword keyword : values()) {
            map.put(keyword.word, keyword);
        }
        BY_WORD = Collections.unmodifiableMap(map);
    }

    private final String word;
    private final Role role;
    private final BinaryOperator operator;
    private final String constantText;

    Keyword(String word, Role role) {
        this(word, role, null, null);
    }

    Keyword(String word, BinaryOperator operator) {
        this(word, Role.OPERATOR, operator, null);
    }

    Keyword(String word, String constantText) {
        this(word, Role.CONSTANT, null, constantText);
    }

    Keyword(String word, Role role, BinaryOperator operator, String constantText) {
        this.word = word;
        this.role = role;
        this.operator = operator;
        this.constantText = constantText;
    }

    public static Optional<Keyword> fromWord(String word) {
        return Optional.ofNullable(BY_WORD.get(word));
    }

    public static boolean isKeyword(String word) {
        return BY_WORD.containsKey(word);
    }

    public String word() {
        return word;
    }

    public Role role() {
        return role;
    }

    public Optional<BinaryOperator> operator() {
        return Optional.ofNullable(operator);
    }

    /**
     * @return the fixed text a constant keyword evaluates to
     */
    public Optional<String> constantText() {
        return Optional.ofNullable(constantText);
    }
}
