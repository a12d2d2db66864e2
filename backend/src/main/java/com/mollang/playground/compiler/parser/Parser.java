package com.mollang.playground.compiler.parser;

import com.mollang.playground.compiler.ast.Ast;
import com.mollang.playground.compiler.ast.BinaryOperator;
import com.mollang.playground.compiler.lexer.IdentifierRule;
import com.mollang.playground.compiler.lexer.Keyword;
import com.mollang.playground.compiler.lexer.Token;
import com.mollang.playground.compiler.lexer.TokenKind;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static com.mollang.playground.compiler.parser.ParseException.Reason.*;

/**
 * Recursive descent parser over the token list produced by
 * {@link com.mollang.playground.compiler.lexer.Lexer}.
 * <pre>
 * program    -> statement*
 * statement  -> VAR '은' expr | '스크럼' expr | '입' expr block | '몰' expr block
 *             | FUNC block | FUNC | '퇴근' expr
 * block      -> '[' statement* ']'
 * expr       -> simple (OPERATOR simple)*
 * simple     -> NUMBER | STRING | IDENT | '뭐먹' | CONSTANT
 * </pre>
 * All operators share one precedence level and fold to the left.
 */
public class Parser {

    private static final Set<Keyword> EXPRESSION_TERMINATORS = EnumSet.of(
            Keyword.ASSIGN, Keyword.IF, Keyword.WHILE, Keyword.PRINT, Keyword.FUNCTION, Keyword.RETURN);

    private final List<Token> tokens;
    private final Set<String> definedFunctions = new HashSet<>();
    private int index = 0;
    private int blockDepth = 0;
    private boolean inFunction = false;

    public Parser(List<Token> tokens) {
        if (tokens.isEmpty() || !tokens.get(tokens.size() - 1).isEndOfInput()) {
            throw new IllegalArgumentException("Token list must end with END_OF_INPUT");
        }
        this.tokens = tokens;
    }

    public Ast.Program parseProgram() throws ParseException {
        List<Ast.Statement> statements = new ArrayList<>();
        while (!peek().isEndOfInput()) {
            statements.add(parseStatement());
        }
        return new Ast.Program(statements);
    }

    private Ast.Statement parseStatement() throws ParseException {
        Token token = peek();
        if (token.isEndOfInput()) {
            throw new ParseException(UNEXPECTED_END_OF_INPUT, token, "Unexpected end of input");
        }

        if (token.kind() == TokenKind.IDENTIFIER && IdentifierRule.isVariableName(token.text())) {
            String variable = advance().text();
            Token marker = advance();
            if (!marker.isKeyword(Keyword.ASSIGN)) {
                throw new ParseException(MISSING_ASSIGN_MARKER, marker,
                        "Expected '" + Keyword.ASSIGN.word() + "' after '" + variable + "' but found '"
                                + marker.text() + "'");
            }
            return new Ast.Assign(variable, parseExpression());
        }
        if (token.isKeyword(Keyword.PRINT)) {
            advance();
            return new Ast.Print(parseExpression());
        }
        if (token.isKeyword(Keyword.IF)) {
            advance();
            Ast.Expression condition = parseExpression();
            return new Ast.If(condition, parseBlock());
        }
        if (token.isKeyword(Keyword.WHILE)) {
            advance();
            Ast.Expression condition = parseExpression();
            return new Ast.While(condition, parseBlock());
        }
        if (token.kind() != TokenKind.STRING && IdentifierRule.isFunctionName(token.text())) {
            return parseFunction();
        }
        if (token.isKeyword(Keyword.RETURN)) {
            if (!inFunction) {
                throw new ParseException(RETURN_OUTSIDE_FUNCTION, token,
                        "'" + token.text() + "' is only allowed inside a function body");
            }
            advance();
            return new Ast.Return(parseExpression());
        }
        throw new ParseException(INVALID_STATEMENT_START, token, "Invalid statement start: '" + token.text() + "'");
    }

    private Ast.Statement parseFunction() throws ParseException {
        Token name = advance();
        if (!isOpenBracket(peek())) {
            return new Ast.FunctionCall(name.text());
        }
        if (blockDepth > 0) {
            throw new ParseException(NESTED_FUNCTION_DEFINITION, name,
                    "Function '" + name.text() + "' must be defined at top level");
        }
        if (!definedFunctions.add(name.text())) {
            throw new ParseException(DUPLICATE_FUNCTION_DEFINITION, name,
                    "Function '" + name.text() + "' is already defined");
        }
        inFunction = true;
        try {
            return new Ast.FunctionDef(name.text(), parseBlock());
        } finally {
            inFunction = false;
        }
    }

    private List<Ast.Statement> parseBlock() throws ParseException {
        Token open = advance();
        if (!isOpenBracket(open)) {
            throw new ParseException(MISSING_BLOCK, open, "Expected '[' but found '" + open.text() + "'");
        }
        blockDepth++;
        List<Ast.Statement> statements = new ArrayList<>();
        while (!isCloseBracket(peek())) {
            statements.add(parseStatement());
        }
        advance();
        blockDepth--;
        return statements;
    }

    private Ast.Expression parseExpression() throws ParseException {
        Ast.Expression left = parseSimpleExpression();
        while (peek().kind() == TokenKind.KEYWORD) {
            Keyword keyword = Keyword.fromWord(peek().text()).orElseThrow();
            if (EXPRESSION_TERMINATORS.contains(keyword)) {
                break;
            }
            Token operatorToken = advance();
            Optional<BinaryOperator> operator = keyword.operator();
            if (operator.isEmpty()) {
                throw new ParseException(UNKNOWN_OPERATOR, operatorToken, "Unknown operator: '" + operatorToken.text() + "'");
            }
            left = new Ast.BinaryOp(left, operator.get(), parseSimpleExpression());
        }
        return left;
    }

    private Ast.Expression parseSimpleExpression() throws ParseException {
        Token token = advance();
        switch (token.kind()) {
            case NUMBER:
                return new Ast.NumberLiteral(token.text());
            case STRING:
                return new Ast.StringLiteral(token.text());
            case IDENTIFIER:
                return new Ast.VariableRef(token.text());
            case KEYWORD:
                Keyword keyword = Keyword.fromWord(token.text()).orElseThrow();
                if (keyword == Keyword.INPUT) {
                    return new Ast.InputExpr();
                }
                if (keyword.role() == Keyword.Role.CONSTANT) {
                    return new Ast.StringLiteral(keyword.constantText().orElseThrow());
                }
                break;
            default:
                break;
        }
        throw new ParseException(INVALID_EXPRESSION_TERM, token, "Invalid expression term: '" + token.text() + "'");
    }

    private Token peek() {
        return tokens.get(index);
    }

    private Token advance() throws ParseException {
        Token token = tokens.get(index);
        if (token.isEndOfInput()) {
            throw new ParseException(UNEXPECTED_END_OF_INPUT, token, "Unexpected end of input");
        }
        index++;
        return token;
    }

    private static boolean isOpenBracket(Token token) {
        return token.is(TokenKind.SYMBOL, "[");
    }

    private static boolean isCloseBracket(Token token) {
        return token.is(TokenKind.SYMBOL, "]");
    }
}
