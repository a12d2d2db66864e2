package com.mollang.playground.cli;

import com.mollang.playground.compiler.MollangCompiler;
import com.mollang.playground.compiler.ast.Ast;
import com.mollang.playground.compiler.parser.ParseException;
import com.mollang.playground.config.MollangCompilerProperties;
import com.mollang.playground.exception.CompilationException;
import com.mollang.playground.runtime.Interpreter;
import com.mollang.playground.runtime.InterpreterLimits;
import com.mollang.playground.runtime.MolRuntimeException;
import com.mollang.playground.toolchain.NativeToolchain;
import com.mollang.playground.toolchain.NativeToolchain.ProcessResult;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Command line entry point.
 * <pre>
 * mollang [--emit-only | --interpret] program.mol
 * </pre>
 * By default writes {@code program.cpp} next to the source and builds {@code program} with the
 * C++ toolchain.
 */
public final class MollangCli {

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;

    private static final String EXTENSION = ".mol";

    enum Mode {
        BUILD,
        EMIT_ONLY,
        INTERPRET
    }

    private final MollangCompiler compiler;
    private final NativeToolchain toolchain;
    private final PrintStream out;
    private final PrintStream err;

    MollangCli(MollangCompiler compiler, NativeToolchain toolchain, PrintStream out, PrintStream err) {
        this.compiler = compiler;
        this.toolchain = toolchain;
        this.out = out;
        this.err = err;
    }

    public static void main(String[] args) {
        MollangCli cli = new MollangCli(
                new MollangCompiler(),
                new NativeToolchain(MollangCompilerProperties.defaults()),
                System.out,
                System.err);
        System.exit(cli.run(args));
    }

    int run(String[] args) {
        Mode mode = Mode.BUILD;
        String file = null;
        for (String arg : args) {
            switch (arg) {
                case "--emit-only" -> mode = Mode.EMIT_ONLY;
                case "--interpret" -> mode = Mode.INTERPRET;
                default -> {
                    if (file != null || arg.startsWith("--")) {
                        return usage();
                    }
                    file = arg;
                }
            }
        }
        if (file == null) {
            return usage();
        }
        if (file.length() <= EXTENSION.length() || !file.endsWith(EXTENSION)) {
            err.println("Error: the input file must have the '" + EXTENSION + "' extension.");
            return EXIT_FAILURE;
        }

        Path source = Path.of(file);
        String code;
        try {
            code = Files.readString(source, StandardCharsets.UTF_8);
        } catch (IOException e) {
            err.println("Error: cannot open '" + file + "': " + e.getMessage());
            return EXIT_FAILURE;
        }

        try {
            if (mode == Mode.INTERPRET) {
                return interpret(code);
            }
            return build(source, code, mode);
        } catch (ParseException e) {
            err.println("Error: " + e.getMessage());
            return EXIT_FAILURE;
        }
    }

    private int interpret(String code) throws ParseException {
        Ast.Program program = compiler.parse(code);
        BufferedReader stdin = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        try {
            new Interpreter(InterpreterLimits.relaxed(), stdin, out).execute(program);
            out.flush();
            return EXIT_OK;
        } catch (MolRuntimeException e) {
            out.flush();
            err.println("Runtime error: " + e.getMessage());
            return EXIT_FAILURE;
        }
    }

    private int build(Path source, String code, Mode mode) throws ParseException {
        String cppCode = compiler.translate(code);

        String fileName = source.getFileName().toString();
        String stem = fileName.substring(0, fileName.length() - EXTENSION.length());
        Path cppFile = source.resolveSibling(stem + ".cpp");
        Path executable = source.resolveSibling(stem);

        try {
            Files.writeString(cppFile, cppCode, StandardCharsets.UTF_8);
        } catch (IOException e) {
            err.println("Error: cannot create '" + cppFile + "': " + e.getMessage());
            return EXIT_FAILURE;
        }
        out.println("Translated Mollang code to C++: " + cppFile);

        if (mode == Mode.EMIT_ONLY) {
            return EXIT_OK;
        }

        out.println("Compiling: " + cppFile + " -> " + executable);
        try {
            ProcessResult result = toolchain.compile(cppFile, executable);
            if (!result.success()) {
                err.println("C++ compilation failed:");
                err.println(result.output());
                return EXIT_FAILURE;
            }
        } catch (CompilationException e) {
            err.println("Error: " + e.getMessage());
            return EXIT_FAILURE;
        }
        out.println("Build succeeded: " + executable);
        return EXIT_OK;
    }

    private int usage() {
        err.println("Usage: mollang [--emit-only | --interpret] <input.mol>");
        return EXIT_USAGE;
    }
}
