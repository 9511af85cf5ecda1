package com.sumeet.later.urlshortener.exception;

import com.sumeet.later.urlshortener.dto.ErrorResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.LocalDateTime;
import java.util.stream.Collectors;

@ControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    // Handle validation errors
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationExceptions(MethodArgumentNotValidException ex) {
        String details = ex.getBindingResult().getFieldErrors().stream()
                .map(GlobalExceptionHandler::describe)
                .collect(Collectors.joining("; "));
        return build(HttpStatus.BAD_REQUEST, "INVALID_INPUT", "Validation failed", details);
    }

    @ExceptionHandler({MissingRequestHeaderException.class,
            MissingServletRequestParameterException.class,
            MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ErrorResponse> handleBadRequest(Exception ex) {
        return build(HttpStatus.BAD_REQUEST, "INVALID_INPUT", ex.getMessage(), null);
    }

    @ExceptionHandler(InvalidInputException.class)
    public ResponseEntity<ErrorResponse> handleInvalidInput(InvalidInputException ex) {
        return build(HttpStatus.BAD_REQUEST, "INVALID_INPUT", ex.getMessage(), null);
    }

    @ExceptionHandler(MappingNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(MappingNotFoundException ex) {
        return build(HttpStatus.NOT_FOUND, "NOT_FOUND", ex.getMessage(), ex.getShortCode());
    }

    @ExceptionHandler(UnauthorizedAccessException.class)
    public ResponseEntity<ErrorResponse> handleUnauthorized(UnauthorizedAccessException ex) {
        return build(HttpStatus.FORBIDDEN, "UNAUTHORIZED", ex.getMessage(), ex.getShortCode());
    }

    @ExceptionHandler(ExhaustedRetriesException.class)
    public ResponseEntity<ErrorResponse> handleExhaustedRetries(ExhaustedRetriesException ex) {
        logger.warn("Short code allocation gave up after {} attempts", ex.getAttempts());
        return build(HttpStatus.SERVICE_UNAVAILABLE, "EXHAUSTED_RETRIES", ex.getMessage(), null);
    }

    // Handle all other exceptions
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleAllExceptions(Exception ex) {
        logger.error("Unhandled error: {}", ex.getMessage(), ex);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR", "An unexpected error occurred", null);
    }

    private static String describe(FieldError error) {
        return error.getField() + ": " + error.getDefaultMessage();
    }

    private static ResponseEntity<ErrorResponse> build(HttpStatus status, String errorCode, String message, String details) {
        ErrorResponse body = new ErrorResponse(status.value(), errorCode, message, LocalDateTime.now(), details);
        return new ResponseEntity<>(body, status);
    }
}
