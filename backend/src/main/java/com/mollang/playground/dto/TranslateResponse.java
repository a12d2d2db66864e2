package com.mollang.playground.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record TranslateResponse(
        boolean success,
        String cppCode,
        String error,
        String errorToken,
        Integer line,
        Integer column
) {

    public static TranslateResponse success(String cppCode) {
        return new TranslateResponse(true, cppCode, null, null, null, null);
    }

    public static TranslateResponse error(String error) {
        return new TranslateResponse(false, null, error, null, null, null);
    }

    public static TranslateResponse parseError(String error, String errorToken, int line, int column) {
        return new TranslateResponse(false, null, error, errorToken, line, column);
    }
}
