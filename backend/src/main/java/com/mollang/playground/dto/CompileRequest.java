package com.mollang.playground.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record CompileRequest(
    @NotBlank(message = "Source code cannot be blank")
    @Size(max = 10000, message = "Source code cannot exceed 10,000 characters")
    String sourceCode,

    @Size(max = 10000, message = "Program input cannot exceed 10,000 characters")
    String input
) {

    public String sanitizedSourceCode() {
        return sanitize(sourceCode).trim();
    }

    public String sanitizedInput() {
        return sanitize(input);
    }

    static String sanitize(String text) {
        if (text == null) {
            return "";
        }

        return text
            .replace("\0", "")
            .replace("\r\n", "\n")
            .replace("\r", "\n");
    }
}
