package com.mollang.playground.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record TranslateRequest(
    @NotBlank(message = "Source code cannot be blank")
    @Size(max = 10000, message = "Source code cannot exceed 10,000 characters")
    String sourceCode
) {

    public String sanitizedSourceCode() {
        return CompileRequest.sanitize(sourceCode).trim();
    }
}
