package com.sharpskill.search.controller;

import com.sharpskill.search.exception.CorpusLoadException;
import com.sharpskill.search.exception.CorpusValidationException;
import com.sharpskill.search.exception.EmptyQueryException;
import com.sharpskill.search.exception.InvalidQueryException;
import com.sharpskill.search.exception.ReloadThrottledException;
import com.sharpskill.search.exception.SkillNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.List;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(CorpusValidationException.class)
    public ResponseEntity<ErrorResponse> handleInvalidCorpus(CorpusValidationException ex) {
        log.warn("Rejected skill corpus with {} violations", ex.getViolations().size());
        return error(HttpStatus.BAD_REQUEST, "INVALID_CORPUS", "Skill corpus rejected", ex.getViolations());
    }

    @ExceptionHandler(EmptyQueryException.class)
    public ResponseEntity<ErrorResponse> handleEmptyQuery(EmptyQueryException ex) {
        return error(HttpStatus.BAD_REQUEST, "EMPTY_QUERY", ex.getMessage(), List.of());
    }

    @ExceptionHandler(InvalidQueryException.class)
    public ResponseEntity<ErrorResponse> handleInvalidQuery(InvalidQueryException ex) {
        return error(HttpStatus.BAD_REQUEST, "INVALID_QUERY", ex.getMessage(), List.of());
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<ErrorResponse> handleMissingParams(MissingServletRequestParameterException ex) {
        String message = String.format("Parameter '%s' is missing", ex.getParameterName());
        return error(HttpStatus.BAD_REQUEST, "BAD_REQUEST", message, List.of());
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorResponse> handleTypeMismatch(MethodArgumentTypeMismatchException ex) {
        String message = String.format("Parameter '%s' has an invalid value", ex.getName());
        return error(HttpStatus.BAD_REQUEST, "BAD_REQUEST", message, List.of());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleInvalidBody(MethodArgumentNotValidException ex) {
        List<String> details = ex.getBindingResult().getFieldErrors().stream()
            .map(fe -> fe.getField() + ": " + fe.getDefaultMessage())
            .toList();
        return error(HttpStatus.BAD_REQUEST, "BAD_REQUEST", "Request body is invalid", details);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadableBody(HttpMessageNotReadableException ex) {
        return error(HttpStatus.BAD_REQUEST, "BAD_REQUEST", "Request body is not readable", List.of());
    }

    @ExceptionHandler(SkillNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(SkillNotFoundException ex) {
        return error(HttpStatus.NOT_FOUND, "RESOURCE_NOT_FOUND", ex.getMessage(), List.of());
    }

    @ExceptionHandler(ReloadThrottledException.class)
    public ResponseEntity<ErrorResponse> handleThrottled(ReloadThrottledException ex) {
        return error(HttpStatus.TOO_MANY_REQUESTS, "RELOAD_THROTTLED", ex.getMessage(), List.of());
    }

    @ExceptionHandler(CorpusLoadException.class)
    public ResponseEntity<ErrorResponse> handleCorpusUnavailable(CorpusLoadException ex) {
        log.error("Skill corpus unavailable at {}", ex.getLocation(), ex);
        return error(HttpStatus.SERVICE_UNAVAILABLE, "CORPUS_UNAVAILABLE", ex.getMessage(), List.of());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception ex) {
        log.error("Unhandled error", ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR", "An unexpected error occurred", List.of());
    }

    private static ResponseEntity<ErrorResponse> error(HttpStatus status, String code, String message, List<String> details) {
        ErrorResponse body = new ErrorResponse(
            code,
            message,
            status.value(),
            Instant.now().toEpochMilli(),
            details
        );
        return new ResponseEntity<>(body, status);
    }
}
