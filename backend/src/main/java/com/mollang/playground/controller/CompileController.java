package com.mollang.playground.controller;

import com.mollang.playground.dto.CompileRequest;
import com.mollang.playground.dto.CompileResponse;
import com.mollang.playground.dto.TranslateRequest;
import com.mollang.playground.dto.TranslateResponse;
import com.mollang.playground.service.MollangCompilerService;
import com.mollang.playground.service.MollangInterpreterService;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.*;

import jakarta.validation.Valid;

@RestController
@RequestMapping("/api")
@Validated
public class CompileController {

    private static final Logger logger = LoggerFactory.getLogger(CompileController.class);

    private final MollangCompilerService compilerService;
    private final MollangInterpreterService interpreterService;

    public CompileController(MollangCompilerService compilerService, MollangInterpreterService interpreterService) {
        this.compilerService = compilerService;
        this.interpreterService = interpreterService;
    }

    @PostMapping("/translate")
    public ResponseEntity<TranslateResponse> translate(@Valid @RequestBody TranslateRequest request) {
        logger.info("Received translation request (length: {} chars)", request.sourceCode().length());

        try {
            TranslateResponse response = compilerService.translate(request.sanitizedSourceCode());
            logger.info("Translation completed - Success: {}", response.success());
            return ResponseEntity.ok(response);

        } catch (Exception e) {
            logger.error("Unexpected error during translation: {}", e.getMessage(), e);
            return ResponseEntity.internalServerError()
                .body(TranslateResponse.error("Internal server error: " + e.getMessage()));
        }
    }

    @PostMapping("/compile")
    public ResponseEntity<CompileResponse> compile(@Valid @RequestBody CompileRequest request) {
        logger.info("Received compilation request (length: {} chars)", request.sourceCode().length());

        try {
            CompileResponse response = compilerService.compileAndExecute(
                request.sanitizedSourceCode(), request.sanitizedInput());

            logger.info("Compilation completed - Success: {}, Type: {}",
                       response.success(), response.resultType());

            return ResponseEntity.ok(response);

        } catch (Exception e) {
            logger.error("Unexpected error during compilation: {}", e.getMessage(), e);

            CompileResponse errorResponse = CompileResponse.compilationError(
                "Internal server error: " + e.getMessage()
            );

            return ResponseEntity.internalServerError().body(errorResponse);
        }
    }

    @PostMapping("/run")
    public ResponseEntity<CompileResponse> run(@Valid @RequestBody CompileRequest request) {
        logger.info("Received interpretation request (length: {} chars)", request.sourceCode().length());

        try {
            CompileResponse response = interpreterService.run(
                request.sanitizedSourceCode(), request.sanitizedInput());

            logger.info("Interpretation completed - Success: {}, Type: {}",
                       response.success(), response.resultType());

            return ResponseEntity.ok(response);

        } catch (Exception e) {
            logger.error("Unexpected error during interpretation: {}", e.getMessage(), e);
            return ResponseEntity.internalServerError()
                .body(CompileResponse.compilationError("Internal server error: " + e.getMessage()));
        }
    }

    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("Mollang Playground Backend is healthy");
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<CompileResponse> handleValidationException(MethodArgumentNotValidException e) {

        StringBuilder errorMessage = new StringBuilder("Validation error: ");

        e.getBindingResult().getFieldErrors().forEach(error ->
            errorMessage.append(error.getField())
                       .append(" - ")
                       .append(error.getDefaultMessage())
                       .append("; ")
        );

        logger.warn("Validation error: {}", errorMessage);

        CompileResponse response = CompileResponse.compilationError(errorMessage.toString());
        return ResponseEntity.badRequest().body(response);
    }
}
