package com.mollang.playground.toolchain;

import com.mollang.playground.config.MollangCompilerProperties;
import com.mollang.playground.exception.CompilationException;
import com.mollang.playground.exception.ExecutionException;

import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

/**
 * Runs the external C++ compiler and the executables it produces. Process output goes through
 * files next to the executable, so a chatty process can not block on a full pipe.
 */
@Component
public class NativeToolchain implements DisposableBean {

    private static final Logger logger = LoggerFactory.getLogger(NativeToolchain.class);

    private static final String TRUNCATION_MARKER = "\n... (output truncated)";

    private final MollangCompilerProperties properties;
    private final Set<Process> activeProcesses = ConcurrentHashMap.newKeySet();

    public NativeToolchain(MollangCompilerProperties properties) {
        this.properties = properties;
    }

    public record ProcessResult(int exitCode, String output, boolean timedOut) {

        public boolean success() {
            return !timedOut && exitCode == 0;
        }
    }

    /**
     * Compiles {@code cppFile} into {@code executable}; both live in the same directory.
     */
    public ProcessResult compile(Path cppFile, Path executable) throws CompilationException {
        List<String> command = new ArrayList<>();
        command.add(properties.compilerPath());
        command.addAll(properties.compilerFlags());
        command.add("-o");
        command.add(executable.getFileName().toString());
        command.add(cppFile.getFileName().toString());

        Path log = cppFile.resolveSibling(cppFile.getFileName() + ".log");
        try {
            ProcessBuilder processBuilder = new ProcessBuilder(command);
            processBuilder.directory(cppFile.toAbsolutePath().getParent().toFile());
            processBuilder.redirectErrorStream(true);
            processBuilder.redirectOutput(log.toFile());

            logger.info("Executing compiler: {}", String.join(" ", command));

            Process process = start(processBuilder);
            try {
                boolean finished = process.waitFor(properties.compilationTimeoutMs(), TimeUnit.MILLISECONDS);

                if (!finished) {
                    process.destroyForcibly();
                    throw new CompilationException("Compilation timeout exceeded");
                }

                String output = readOutput(log);
                int exitCode = process.exitValue();
                logger.info("Compilation finished with exit code: {}, executable exists: {}",
                           exitCode, Files.exists(executable));

                return new ProcessResult(exitCode, output, false);
            } finally {
                activeProcesses.remove(process);
            }

        } catch (IOException e) {
            throw new CompilationException("Failed to execute compiler: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CompilationException("Interrupted while compiling", e);
        }
    }

    /**
     * Runs {@code executable} with {@code input} on its standard input.
     */
    public ProcessResult run(Path executable, String input) throws ExecutionException {
        if (!Files.isRegularFile(executable)) {
            throw new ExecutionException("Compiled executable not found: " + executable.getFileName());
        }

        Path stdin = executable.resolveSibling(executable.getFileName() + ".in");
        Path stdout = executable.resolveSibling(executable.getFileName() + ".out");
        try {
            Files.writeString(stdin, input == null ? "" : input, StandardCharsets.UTF_8);

            ProcessBuilder processBuilder = new ProcessBuilder(executable.toAbsolutePath().toString());
            processBuilder.directory(executable.toAbsolutePath().getParent().toFile());
            processBuilder.redirectErrorStream(true);
            processBuilder.redirectInput(stdin.toFile());
            processBuilder.redirectOutput(stdout.toFile());

            logger.info("Executing program: {}", executable);

            Process process = start(processBuilder);
            try {
                boolean finished = process.waitFor(properties.executionTimeoutMs(), TimeUnit.MILLISECONDS);

                if (!finished) {
                    process.destroyForcibly();
                    // the output file is only complete once the process is gone
                    process.waitFor(2, TimeUnit.SECONDS);
                    logger.warn("Program {} timed out after {}ms", executable.getFileName(), properties.executionTimeoutMs());
                    return new ProcessResult(-1, readOutput(stdout), true);
                }

                int exitCode = process.exitValue();
                logger.info("Program execution finished with exit code: {}", exitCode);
                return new ProcessResult(exitCode, readOutput(stdout), false);
            } finally {
                activeProcesses.remove(process);
            }

        } catch (IOException e) {
            throw new ExecutionException("Failed to execute program: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ExecutionException("Interrupted while running program", e);
        }
    }

    /**
     * Kills compiler and program processes that are still running when the application stops.
     */
    @PreDestroy
    @Override
    public void destroy() {
        logger.info("Shutting down native toolchain ({} active processes)", activeProcesses.size());
        for (Process process : activeProcesses) {
            if (process.isAlive()) {
                logger.warn("Force killing process {}", process.pid());
                process.destroyForcibly();
            }
        }
        activeProcesses.clear();
    }

    int activeProcessCount() {
        return activeProcesses.size();
    }

    private Process start(ProcessBuilder processBuilder) throws IOException {
        Process process = processBuilder.start();
        activeProcesses.add(process);
        return process;
    }

    private String readOutput(Path file) throws IOException {
        if (!Files.exists(file)) {
            return "";
        }
        int limit = properties.maxOutputLength();
        StringBuilder output = new StringBuilder();
        boolean truncated = false;

        // a killed process may leave a partial UTF-8 sequence behind, the decoder replaces it
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(Files.newInputStream(file), StandardCharsets.UTF_8))) {
            char[] buffer = new char[8192];
            int read;
            while ((read = reader.read(buffer)) != -1) {
                int room = limit - output.length();
                if (read > room) {
                    output.append(buffer, 0, room);
                    truncated = true;
                    break;
                }
                output.append(buffer, 0, read);
            }
        }

        String text = output.toString().stripTrailing();
        return truncated ? text + TRUNCATION_MARKER : text;
    }
}
