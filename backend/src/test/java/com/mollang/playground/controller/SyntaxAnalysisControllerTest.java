package com.mollang.playground.controller;

import com.mollang.playground.dto.SyntaxAnalysisRequest;
import com.mollang.playground.dto.SyntaxAnalysisResponse;
import com.mollang.playground.dto.SyntaxToken;
import com.mollang.playground.service.MollangSyntaxAnalysisService;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(SyntaxAnalysisController.class)
class SyntaxAnalysisControllerTest {

    @Autowired
    MockMvc mockMvc;

    @MockBean
    MollangSyntaxAnalysisService syntaxAnalysisService;

    @Test
    void analyzeReturnsTokens() throws Exception {
        SyntaxToken token = new SyntaxToken(1, 1, 1, 2, "USER_VARIABLE", "밥", "var_0");
        when(syntaxAnalysisService.analyzeSyntax(any(SyntaxAnalysisRequest.class)))
                .thenReturn(SyntaxAnalysisResponse.success(List.of(token), 3));

        mockMvc.perform(post("/api/syntax/analyze")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"sourceCode\": \"밥\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.tokens[0].tokenType").value("USER_VARIABLE"))
                .andExpect(jsonPath("$.tokens[0].semanticInfo").value("var_0"));
    }

    @Test
    void missingSourceIsRejected() throws Exception {
        mockMvc.perform(post("/api/syntax/analyze")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void unexpectedFailureIsInternalServerError() throws Exception {
        when(syntaxAnalysisService.analyzeSyntax(any(SyntaxAnalysisRequest.class)))
                .thenThrow(new IllegalStateException("boom"));

        mockMvc.perform(post("/api/syntax/analyze")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"sourceCode\": \"밥\"}"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.error").value("Internal server error: boom"));
    }

    @Test
    void healthCheck() throws Exception {
        mockMvc.perform(get("/api/syntax/health"))
                .andExpect(status().isOk())
                .andExpect(content().string("Syntax analysis service is running"));
    }
}
