package com.mollang.playground.config;

import com.mollang.playground.runtime.InterpreterLimits;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

import java.util.List;

@ConfigurationProperties(prefix = "mollang.compiler")
@Validated
public record MollangCompilerProperties(
    @NotBlank
    @DefaultValue("g++")
    String compilerPath,

    @NotNull
    @DefaultValue("-std=c++17")
    List<String> compilerFlags,

    @NotBlank
    @DefaultValue("/tmp/mollang")
    String tempDirectory,

    @Positive
    @DefaultValue("60000")
    Long compilationTimeoutMs,

    @Positive
    @DefaultValue("5000")
    Long executionTimeoutMs,

    @Positive
    @DefaultValue("10000")
    Integer maxSourceCodeLength,

    @Positive
    @DefaultValue("50000")
    Integer maxOutputLength,

    @Positive
    @DefaultValue("1000000")
    Long interpreterMaxSteps,

    @Positive
    @DefaultValue("1000")
    Integer interpreterMaxCallDepth,

    @Positive
    @DefaultValue("1000000")
    Integer interpreterMaxTextLength
) {

    /**
     * The values used when no Spring context is around, e.g. from the command line.
     */
    public static MollangCompilerProperties defaults() {
        return new MollangCompilerProperties(
            "g++",
            List.of("-std=c++17"),
            System.getProperty("java.io.tmpdir"),
            60000L,
            5000L,
            10000,
            50000,
            1000000L,
            1000,
            1000000
        );
    }

    public InterpreterLimits interpreterLimits() {
        return new InterpreterLimits(
            interpreterMaxSteps,
            interpreterMaxCallDepth,
            maxOutputLength,
            interpreterMaxTextLength
        );
    }
}
