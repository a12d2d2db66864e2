package com.mollang.playground.compiler;

import com.mollang.playground.compiler.ast.Ast;
import com.mollang.playground.compiler.codegen.CppCodeGenerator;
import com.mollang.playground.compiler.lexer.Lexer;
import com.mollang.playground.compiler.lexer.Token;
import com.mollang.playground.compiler.parser.ParseException;
import com.mollang.playground.compiler.parser.Parser;
import com.mollang.playground.compiler.symbol.SymbolResolver;
import com.mollang.playground.compiler.symbol.SymbolTable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Mollang to C++ translation: lexing, parsing, symbol resolution and code generation.
 * Holds no state between calls; every compilation gets its own {@link SymbolTable}.
 */
@Component
public class MollangCompiler {

    private static final Logger logger = LoggerFactory.getLogger(MollangCompiler.class);

    public record Compilation(List<Token> tokens, Ast.Program program, SymbolTable symbols, String cppCode) {
    }

    public List<Token> tokenize(String source) {
        return new Lexer(source).tokenize();
    }

    public Ast.Program parse(String source) throws ParseException {
        return new Parser(tokenize(source)).parseProgram();
    }

    public Compilation compile(String source) throws ParseException {
        List<Token> tokens = tokenize(source);
        logger.debug("Lexer produced {} tokens", tokens.size());

        Ast.Program program = new Parser(tokens).parseProgram();
        logger.debug("Parser produced {} top-level statements", program.statements().size());

        SymbolTable symbols = SymbolResolver.resolve(program);
        logger.debug("Resolved {} variables and {} functions",
                symbols.variables().size(), symbols.functions().size());

        String cppCode = new CppCodeGenerator(symbols).generate(program);
        return new Compilation(tokens, program, symbols, cppCode);
    }

    public String translate(String source) throws ParseException {
        return compile(source).cppCode();
    }
}
