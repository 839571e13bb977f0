package com.vouch.auth.domain.exception;

import com.vouch.auth.api.dto.ApiErrorResponse;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import static com.vouch.auth.domain.constants.TokenConstants.TRACE_ID_HEADER;

/**
 * Global exception handler for all REST controllers.
 * Maps exceptions to consistent ApiErrorResponse with proper HTTP status codes.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    /**
     * Handle validation errors from @Valid annotations
     * Returns 400 Bad Request
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiErrorResponse> handleValidation(
            MethodArgumentNotValidException ex,
            HttpServletRequest request) {

        String message = ex.getBindingResult()
                .getFieldErrors()
                .stream()
                .findFirst()
                .map(err -> err.getField() + " " + err.getDefaultMessage())
                .orElse("Invalid request");

        return build(HttpStatus.BAD_REQUEST, "VALIDATION_ERROR", message, request);
    }

    /**
     * Handle unparseable request bodies
     * Returns 400 Bad Request
     */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiErrorResponse> handleUnreadable(
            HttpMessageNotReadableException ex,
            HttpServletRequest request) {
        return build(HttpStatus.BAD_REQUEST, "VALIDATION_ERROR", "Malformed request body", request);
    }

    /**
     * Handle malformed or non-routable email
     * Returns 400 Bad Request
     */
    @ExceptionHandler(InvalidEmailException.class)
    public ResponseEntity<ApiErrorResponse> handleInvalidEmail(
            InvalidEmailException ex,
            HttpServletRequest request) {
        return build(HttpStatus.BAD_REQUEST, "INVALID_EMAIL", ex.getMessage(), request);
    }

    /**
     * Handle unknown, used, mismatched and expired tokens alike
     * Returns 400 Bad Request with one body so callers cannot tell the cases apart
     */
    @ExceptionHandler({InvalidTokenException.class, TokenExpiredException.class})
    public ResponseEntity<ApiErrorResponse> handleInvalidToken(
            TokenLifecycleException ex,
            HttpServletRequest request) {
        log.info("[TOKEN_REJECTED] Token rejected | reason={} | path={}",
                ex.getClass().getSimpleName(), request.getRequestURI());
        return build(HttpStatus.BAD_REQUEST, "INVALID_OR_EXPIRED_TOKEN",
                "The code or link is invalid or has expired.", request);
    }

    /**
     * Handle issuance rate limit
     * Returns 429 Too Many Requests with Retry-After header
     */
    @ExceptionHandler(RateLimitExceededException.class)
    public ResponseEntity<ApiErrorResponse> handleRateLimit(
            RateLimitExceededException ex,
            HttpServletRequest request) {

        ApiErrorResponse error = new ApiErrorResponse(
                "RATE_LIMIT_EXCEEDED",
                ex.getMessage(),
                request.getHeader(TRACE_ID_HEADER)
        );

        return ResponseEntity
                .status(HttpStatus.TOO_MANY_REQUESTS)
                .header("Retry-After", String.valueOf(ex.getRetryAfterSeconds()))
                .body(error);
    }

    /**
     * Handle database or Redis failure
     * Returns 503 Service Unavailable
     */
    @ExceptionHandler(StoreException.class)
    public ResponseEntity<ApiErrorResponse> handleStore(
            StoreException ex,
            HttpServletRequest request) {
        log.error("[REQUEST_FAILED] Store unavailable | path={} | error={}", request.getRequestURI(), ex.getMessage());
        return build(HttpStatus.SERVICE_UNAVAILABLE, "STORE_UNAVAILABLE",
                "Service temporarily unavailable. Please try again later.", request);
    }

    /**
     * Handle delivery failure; the issued token remains valid
     * Returns 503 Service Unavailable
     */
    @ExceptionHandler(NotifyException.class)
    public ResponseEntity<ApiErrorResponse> handleNotify(
            NotifyException ex,
            HttpServletRequest request) {
        log.error("[REQUEST_FAILED] Delivery failed | path={} | error={}", request.getRequestURI(), ex.getMessage());
        return build(HttpStatus.SERVICE_UNAVAILABLE, "DELIVERY_FAILED",
                "We could not send the message. Please try again later.", request);
    }

    /**
     * Handle random source failure
     * Returns 500 Internal Server Error
     */
    @ExceptionHandler(GenerationException.class)
    public ResponseEntity<ApiErrorResponse> handleGeneration(
            GenerationException ex,
            HttpServletRequest request) {
        log.error("[REQUEST_FAILED] Secret generation failed | path={}", request.getRequestURI(), ex);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, "GENERATION_FAILED",
                "Something went wrong. Please try again later.", request);
    }

    /**
     * Handle all other unexpected exceptions
     * Returns 500 Internal Server Error
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiErrorResponse> handleGeneric(
            Exception ex,
            HttpServletRequest request) {
        log.error("[REQUEST_FAILED] Unhandled exception | path={}", request.getRequestURI(), ex);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR",
                "Something went wrong. Please try again later.", request);
    }

    private ResponseEntity<ApiErrorResponse> build(HttpStatus status, String code, String message,
                                                   HttpServletRequest request) {
        ApiErrorResponse error = new ApiErrorResponse(code, message, request.getHeader(TRACE_ID_HEADER));
        return ResponseEntity
                .status(status)
                .body(error);
    }
}
