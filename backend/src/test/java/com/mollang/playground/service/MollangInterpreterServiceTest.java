package com.mollang.playground.service;

import com.mollang.playground.compiler.MollangCompiler;
import com.mollang.playground.config.MollangCompilerProperties;
import com.mollang.playground.dto.CompileResponse;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class MollangInterpreterServiceTest {

    private static MollangInterpreterService service(long maxSteps) {
        MollangCompilerProperties properties = new MollangCompilerProperties(
                "g++", List.of("-std=c++17"), "/tmp/mollang",
                60000L, 5000L, 10000, 50000, maxSteps, 100, 1000000);
        return new MollangInterpreterService(new MollangCompiler(), properties);
    }

    private final MollangInterpreterService service = service(1_000_000L);

    @Test
    void runsProgramWithInput() {
        CompileResponse response = service.run("밥 은 뭐먹\n스크럼 밥 곱 2\n스크럼 \"hi\" 곱 3", "21\n");

        assertThat(response.success()).isTrue();
        assertThat(response.resultType()).isEqualTo("success");
        assertThat(response.output()).isEqualTo("42\nhihihi");
    }

    @Test
    void parseErrorIsCompilationError() {
        CompileResponse response = service.run("밥 스크럼", "");

        assertThat(response.resultType()).isEqualTo("compilation_error");
        assertThat(response.error()).startsWith("Parse error (MISSING_ASSIGN_MARKER)");
    }

    @Test
    void runtimeErrorKeepsEarlierOutput() {
        CompileResponse response = service.run("스크럼 \"first\"\n스크럼 \"a\" 합 1", "");

        assertThat(response.resultType()).isEqualTo("runtime_error");
        assertThat(response.output()).isEqualTo("first");
        assertThat(response.error()).isEqualTo(
                "Runtime error (UNSUPPORTED_OPERANDS): Unsupported operand types for +: TEXT and INTEGER");
    }

    @Test
    void stepLimitIsTimeout() {
        CompileResponse response = service(500L).run("몰 1 같 1 [밥 은 1]", "");

        assertThat(response.resultType()).isEqualTo("timeout");
        assertThat(response.error()).contains("STEP_LIMIT_EXCEEDED");
    }

    @Test
    @Timeout(10)
    void loopWithEmptyBodyTimesOut() {
        CompileResponse response = service.run("몰 1 같 1 []", "");

        assertThat(response.success()).isFalse();
        assertThat(response.resultType()).isEqualTo("timeout");
        assertThat(response.error()).contains("STEP_LIMIT_EXCEEDED");
    }

    @Test
    void rejectsBlankSource() {
        assertThat(service.run(" \n", "").error()).isEqualTo("Source code cannot be empty");
    }
}
