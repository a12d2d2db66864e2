package com.mollang.playground.service;

import com.mollang.playground.compiler.MollangCompiler;
import com.mollang.playground.compiler.lexer.Token;
import com.mollang.playground.compiler.parser.ParseException;
import com.mollang.playground.config.MollangCompilerProperties;
import com.mollang.playground.dto.CompileResponse;
import com.mollang.playground.dto.TranslateResponse;
import com.mollang.playground.exception.CompilationException;
import com.mollang.playground.exception.ExecutionException;
import com.mollang.playground.toolchain.NativeToolchain;
import com.mollang.playground.toolchain.NativeToolchain.ProcessResult;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.UUID;
import java.util.stream.Stream;

@Service
public class MollangCompilerService {

    private static final Logger logger = LoggerFactory.getLogger(MollangCompilerService.class);

    private final MollangCompiler compiler;
    private final NativeToolchain toolchain;
    private final MollangCompilerProperties properties;

    public MollangCompilerService(MollangCompiler compiler, NativeToolchain toolchain,
                                  MollangCompilerProperties properties) {
        this.compiler = compiler;
        this.toolchain = toolchain;
        this.properties = properties;
    }

    public TranslateResponse translate(String sourceCode) {
        String rejection = validate(sourceCode);
        if (rejection != null) {
            return TranslateResponse.error(rejection);
        }

        try {
            return TranslateResponse.success(compiler.translate(sourceCode));
        } catch (ParseException e) {
            logger.info("Translation rejected: {}", e.getMessage());
            Token token = e.getToken();
            return TranslateResponse.parseError(
                describe(e), token.text(), token.start().line(), token.start().column());
        }
    }

    public CompileResponse compileAndExecute(String sourceCode, String input) {
        String rejection = validate(sourceCode);
        if (rejection != null) {
            return CompileResponse.compilationError(rejection);
        }

        String cppCode;
        try {
            cppCode = compiler.translate(sourceCode);
        } catch (ParseException e) {
            logger.info("Translation rejected: {}", e.getMessage());
            return CompileResponse.compilationError(describe(e));
        }

        String sessionId = UUID.randomUUID().toString().substring(0, 8);
        Path sessionDir = Path.of(properties.tempDirectory()).resolve("session_" + sessionId);
        Path cppFile = sessionDir.resolve("temp_" + sessionId + ".cpp");
        Path executable = sessionDir.resolve("temp_" + sessionId);

        long startTime = System.currentTimeMillis();

        try {
            Files.createDirectories(sessionDir);
            Files.writeString(cppFile, cppCode, StandardCharsets.UTF_8);
            logger.info("Created temporary source file: {}", cppFile);

            ProcessResult compileResult = toolchain.compile(cppFile, executable);
            if (!compileResult.success() || !Files.exists(executable)) {
                logger.warn("C++ compilation failed for session {} with exit code {}",
                        sessionId, compileResult.exitCode());
                return CompileResponse.compilationError(compileResult.output());
            }

            ProcessResult runResult = toolchain.run(executable, input);
            long executionTime = System.currentTimeMillis() - startTime;

            if (runResult.timedOut()) {
                return CompileResponse.timeout(runResult.output(), "Program execution timeout exceeded");
            }
            if (runResult.success()) {
                return CompileResponse.success(runResult.output(), executionTime);
            }
            return CompileResponse.runtimeError(runResult.output(),
                    "Program exited with code " + runResult.exitCode(), executionTime);

        } catch (CompilationException e) {
            logger.error("Compilation failed for session {}: {}", sessionId, e.getMessage());
            return CompileResponse.compilationError(e.getMessage());
        } catch (ExecutionException e) {
            long executionTime = System.currentTimeMillis() - startTime;
            logger.error("Execution failed for session {}: {}", sessionId, e.getMessage());
            return CompileResponse.runtimeError(null, e.getMessage(), executionTime);
        } catch (IOException e) {
            logger.error("Unexpected error for session {}: {}", sessionId, e.getMessage(), e);
            return CompileResponse.compilationError("Internal server error: " + e.getMessage());
        } finally {
            cleanupDirectory(sessionDir);
        }
    }

    private String validate(String sourceCode) {
        if (sourceCode == null || sourceCode.trim().isEmpty()) {
            return "Source code cannot be empty";
        }
        if (sourceCode.length() > properties.maxSourceCodeLength()) {
            return "Source code exceeds maximum length of " + properties.maxSourceCodeLength() + " characters";
        }
        return null;
    }

    static String describe(ParseException e) {
        return "Parse error (" + e.getReason() + "): " + e.getMessage();
    }

    private void cleanupDirectory(Path directory) {
        if (!Files.exists(directory)) {
            return;
        }
        try (Stream<Path> paths = Files.walk(directory)) {
            paths.sorted(Comparator.reverseOrder())
                    .forEach(path -> {
                        try {
                            Files.delete(path);
                        } catch (IOException e) {
                            logger.warn("Failed to delete temporary file {}: {}", path, e.getMessage());
                        }
                    });
            logger.debug("Cleaned up session directory: {}", directory);
        } catch (IOException e) {
            logger.warn("Failed to clean up session directory {}: {}", directory, e.getMessage());
        }
    }
}
