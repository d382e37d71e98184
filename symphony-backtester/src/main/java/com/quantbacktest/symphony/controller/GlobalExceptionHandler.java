package com.quantbacktest.symphony.controller;

import com.quantbacktest.symphony.controller.dto.ErrorResponse;
import com.quantbacktest.symphony.engine.EvaluationException;
import com.quantbacktest.symphony.service.JobNotFoundException;
import com.quantbacktest.symphony.service.ReportNotFoundException;
import com.quantbacktest.symphony.strategy.parse.StrategyParseException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.LocalDateTime;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Maps service exceptions onto {@link ErrorResponse} bodies.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(StrategyParseException.class)
    public ResponseEntity<ErrorResponse> handleStrategyParse(StrategyParseException ex) {
        log.warn("Program rejected: [{}] {}", ex.getKind(), ex.getMessage());
        return build(HttpStatus.BAD_REQUEST, ex.getMessage(), ex.getKind().name(), null);
    }

    /**
     * Missing market data on the requested date is a client problem; anything else is not.
     */
    @ExceptionHandler(EvaluationException.class)
    public ResponseEntity<ErrorResponse> handleEvaluation(EvaluationException ex) {
        log.warn("Evaluation failed: [{}] {}", ex.getKind(), ex.getMessage());
        HttpStatus status = ex.isRecoverable() ? HttpStatus.UNPROCESSABLE_ENTITY : HttpStatus.BAD_REQUEST;
        return build(status, ex.getMessage(), ex.getKind().name(), null);
    }

    @ExceptionHandler(JobNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleJobNotFound(JobNotFoundException ex) {
        log.warn("Job not found: {}", ex.getMessage());
        return build(HttpStatus.NOT_FOUND, ex.getMessage(), null, null);
    }

    @ExceptionHandler(ReportNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleReportNotFound(ReportNotFoundException ex) {
        log.warn("Report not available: {}", ex.getMessage());
        return build(HttpStatus.NOT_FOUND, ex.getMessage(), null, null);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleMethodArgumentNotValid(MethodArgumentNotValidException ex) {
        List<String> details = ex.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .collect(Collectors.toList());
        ex.getBindingResult().getGlobalErrors()
                .forEach(error -> details.add(error.getObjectName() + ": " + error.getDefaultMessage()));

        log.warn("Validation error: {}", details);
        return build(HttpStatus.BAD_REQUEST, "Validation failed", null, details);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleHttpMessageNotReadable(HttpMessageNotReadableException ex) {
        log.warn("Malformed request payload: {}", ex.getMessage());
        return build(HttpStatus.BAD_REQUEST, "Malformed request payload", null, null);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(IllegalArgumentException ex) {
        log.warn("Invalid argument: {}", ex.getMessage());
        return build(HttpStatus.BAD_REQUEST, ex.getMessage(), null, null);
    }

    private static ResponseEntity<ErrorResponse> build(HttpStatus status, String message, String kind,
                                                       List<String> details) {
        return ResponseEntity.status(status).body(ErrorResponse.builder()
                .status(status.value())
                .error(status.getReasonPhrase())
                .message(message)
                .kind(kind)
                .details(details)
                .timestamp(LocalDateTime.now())
                .build());
    }
}
