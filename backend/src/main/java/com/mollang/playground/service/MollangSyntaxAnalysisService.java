package com.mollang.playground.service;

import com.mollang.playground.compiler.MollangCompiler;
import com.mollang.playground.compiler.MollangCompiler.Compilation;
import com.mollang.playground.compiler.ast.Ast;
import com.mollang.playground.compiler.lexer.IdentifierRule;
import com.mollang.playground.compiler.lexer.Keyword;
import com.mollang.playground.compiler.lexer.Token;
import com.mollang.playground.compiler.parser.ParseException;
import com.mollang.playground.compiler.symbol.SymbolTable;
import com.mollang.playground.dto.SyntaxAnalysisRequest;
import com.mollang.playground.dto.SyntaxAnalysisResponse;
import com.mollang.playground.dto.SyntaxToken;
import com.mollang.playground.dto.SyntaxToken.TokenType;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Token classification for editor highlighting. Tokens come from the lexer; when the program
 * parses they are enriched with the names the compiler generates for them.
 */
@Service
public class MollangSyntaxAnalysisService {

    private static final Logger logger = LoggerFactory.getLogger(MollangSyntaxAnalysisService.class);

    private final MollangCompiler compiler;

    public MollangSyntaxAnalysisService(MollangCompiler compiler) {
        this.compiler = compiler;
    }

    public SyntaxAnalysisResponse analyzeSyntax(SyntaxAnalysisRequest request) {
        long startTime = System.currentTimeMillis();
        String sourceCode = request.sanitizedSourceCode();
        logger.debug("Starting syntax analysis for {} characters of code", sourceCode.length());

        Compilation compilation;
        try {
            compilation = compiler.compile(sourceCode);
        } catch (ParseException e) {
            logger.debug("Program does not parse, returning lexical tokens only: {}", e.getMessage());
            List<SyntaxToken> lexical = classify(compiler.tokenize(sourceCode), null, Set.of());
            return SyntaxAnalysisResponse.partial(lexical, MollangCompilerService.describe(e),
                    System.currentTimeMillis() - startTime);
        }

        Set<String> definedFunctions = new HashSet<>();
        for (Ast.Statement statement : compilation.program().statements()) {
            if (statement instanceof Ast.FunctionDef definition) {
                definedFunctions.add(definition.name());
            }
        }

        List<SyntaxToken> result = classify(compilation.tokens(), compilation.symbols(), definedFunctions);
        long analysisTime = System.currentTimeMillis() - startTime;
        logger.debug("Syntax analysis completed in {}ms with {} tokens", analysisTime, result.size());
        return SyntaxAnalysisResponse.success(result, analysisTime);
    }

    private List<SyntaxToken> classify(List<Token> tokens, SymbolTable symbols, Set<String> definedFunctions) {
        List<SyntaxToken> result = new ArrayList<>();
        for (Token token : tokens) {
            if (token.isEndOfInput()) {
                break;
            }
            TokenType type = tokenType(token);
            String semanticInfo = symbols == null ? null : semanticInfo(token, type, symbols, definedFunctions);
            result.add(new SyntaxToken(
                    token.start().line(), token.start().column(),
                    token.end().line(), token.end().column(),
                    type.name(), token.text(), semanticInfo));
        }
        return result;
    }

    private TokenType tokenType(Token token) {
        switch (token.kind()) {
            case KEYWORD:
                Keyword keyword = Keyword.fromWord(token.text()).orElseThrow();
                return switch (keyword.role()) {
                    case STATEMENT -> keyword == Keyword.FUNCTION ? TokenType.USER_FUNCTION : TokenType.KEYWORD;
                    case OPERATOR -> TokenType.OPERATOR;
                    case INPUT -> TokenType.BUILT_IN_FUNCTION;
                    case CONSTANT -> TokenType.BUILT_IN_CONSTANT;
                };
            case IDENTIFIER:
                if (IdentifierRule.isVariableName(token.text())) {
                    return TokenType.USER_VARIABLE;
                }
                if (IdentifierRule.isFunctionName(token.text())) {
                    return TokenType.USER_FUNCTION;
                }
                return TokenType.IDENTIFIER;
            case NUMBER:
                return TokenType.NUMBER_LITERAL;
            case STRING:
                return TokenType.STRING_LITERAL;
            default:
                return TokenType.PUNCTUATION;
        }
    }

    private String semanticInfo(Token token, TokenType type, SymbolTable symbols, Set<String> definedFunctions) {
        Map<String, String> variables = symbols.variables();
        Map<String, String> functions = symbols.functions();
        return switch (type) {
            case USER_VARIABLE, IDENTIFIER -> variables.get(token.text());
            case USER_FUNCTION -> {
                String generated = functions.get(token.text());
                if (generated == null) {
                    yield null;
                }
                yield definedFunctions.contains(token.text()) ? generated : generated + " (undefined)";
            }
            case BUILT_IN_CONSTANT -> Keyword.fromWord(token.text()).flatMap(Keyword::constantText).orElse(null);
            default -> null;
        };
    }
}
