package com.mollang.playground.service;

import com.mollang.playground.compiler.MollangCompiler;
import com.mollang.playground.compiler.ast.Ast;
import com.mollang.playground.compiler.parser.ParseException;
import com.mollang.playground.config.MollangCompilerProperties;
import com.mollang.playground.dto.CompileResponse;
import com.mollang.playground.runtime.Interpreter;
import com.mollang.playground.runtime.MolRuntimeException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.BufferedReader;
import java.io.StringReader;

/**
 * Runs programs with the tree-walking interpreter, without a native toolchain.
 */
@Service
public class MollangInterpreterService {

    private static final Logger logger = LoggerFactory.getLogger(MollangInterpreterService.class);

    private final MollangCompiler compiler;
    private final MollangCompilerProperties properties;

    public MollangInterpreterService(MollangCompiler compiler, MollangCompilerProperties properties) {
        this.compiler = compiler;
        this.properties = properties;
    }

    public CompileResponse run(String sourceCode, String input) {
        if (sourceCode == null || sourceCode.trim().isEmpty()) {
            return CompileResponse.compilationError("Source code cannot be empty");
        }
        if (sourceCode.length() > properties.maxSourceCodeLength()) {
            return CompileResponse.compilationError(
                "Source code exceeds maximum length of " + properties.maxSourceCodeLength() + " characters"
            );
        }

        Ast.Program program;
        try {
            program = compiler.parse(sourceCode);
        } catch (ParseException e) {
            logger.info("Program rejected: {}", e.getMessage());
            return CompileResponse.compilationError(MollangCompilerService.describe(e));
        }

        StringBuilder output = new StringBuilder();
        long startTime = System.currentTimeMillis();
        try {
            Interpreter interpreter = new Interpreter(
                    properties.interpreterLimits(),
                    new BufferedReader(new StringReader(input == null ? "" : input)),
                    output);
            interpreter.execute(program);

            long executionTime = System.currentTimeMillis() - startTime;
            logger.info("Interpreted program in {}ms ({} output characters)", executionTime, output.length());
            return CompileResponse.success(output.toString().stripTrailing(), executionTime);

        } catch (MolRuntimeException e) {
            long executionTime = System.currentTimeMillis() - startTime;
            logger.info("Program failed with {}: {}", e.getKind(), e.getMessage());
            String message = "Runtime error (" + e.getKind() + "): " + e.getMessage();
            if (e.getKind() == MolRuntimeException.Kind.STEP_LIMIT_EXCEEDED) {
                return CompileResponse.timeout(output.toString().stripTrailing(), message);
            }
            return CompileResponse.runtimeError(output.toString().stripTrailing(), message, executionTime);
        }
    }
}
