package com.securenotify.keysvc.api.error;

import com.securenotify.keysvc.shared.exception.*;
import com.securenotify.keysvc.shared.security.SecurityUtils;
import com.securenotify.keysvc.shared.validation.FieldError;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.List;
import java.util.Map;

/**
 * Maps exceptions to RFC 7807 Problem Detail responses. Unexpected errors expose only a reference id.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    private static final Map<String, String> DETAILS = Map.ofEntries(
            Map.entry("AUTH_REQUIRED", "An API key is required"),
            Map.entry("AUTH_FAILED", "The API key is invalid, inactive or expired"),
            Map.entry("PERMISSION_DENIED", "The API key lacks the permission for this operation"),
            Map.entry("VALIDATION_ERROR", "One or more validation errors occurred"),
            Map.entry("ALREADY_REVOKED", "The key has already been revoked"),
            Map.entry("REVOCATION_PENDING", "A revocation is already pending for this key"),
            Map.entry("INVALID_CODE", "The confirmation code is invalid"),
            Map.entry("LOCKED", "Too many failed attempts. Please try again later."),
            Map.entry("EXPIRED", "The revocation confirmation has expired"),
            Map.entry("RATE_LIMITED", "Too many requests. Please try again later."),
            Map.entry("CLEANUP_UNAUTHORIZED", "The cleanup trigger was rejected"));

    private final SecurityUtils securityUtils;

    public GlobalExceptionHandler(SecurityUtils securityUtils) {
        this.securityUtils = securityUtils;
    }

    @ExceptionHandler(KeyServiceException.class)
    public ResponseEntity<ProblemDetail> handleKeyService(KeyServiceException ex, HttpServletRequest request) {
        String detail = DETAILS.getOrDefault(ex.getErrorCode(), ex.getMessage());
        HttpHeaders headers = new HttpHeaders();
        if (ex instanceof RateLimitedException rateLimited) {
            headers.add(HttpHeaders.RETRY_AFTER, String.valueOf(rateLimited.getRetryAfterSeconds()));
        } else if (ex instanceof LockedException locked) {
            headers.add(HttpHeaders.RETRY_AFTER, String.valueOf(locked.getRetryAfterSeconds()));
        } else if (ex instanceof InvalidStateException || ex instanceof NotFoundException) {
            detail = ex.getMessage();
        }
        return buildResponse(ex.getErrorCode(), ex.getHttpStatus(), detail, request, ex.getExtensions(), headers);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ProblemDetail> handleBeanValidation(MethodArgumentNotValidException ex,
                                                              HttpServletRequest request) {
        List<FieldError> errors = ex.getBindingResult().getFieldErrors().stream()
                .map(e -> FieldError.of(e.getField(), "INVALID", e.getDefaultMessage()))
                .toList();
        return handleKeyService(new ValidationException(errors), request);
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ProblemDetail> handleTypeMismatch(MethodArgumentTypeMismatchException ex,
                                                            HttpServletRequest request) {
        return handleKeyService(new ValidationException(
                FieldError.of(ex.getName(), "INVALID_FORMAT", "Malformed " + ex.getName())), request);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ProblemDetail> handleUnreadable(HttpMessageNotReadableException ex,
                                                          HttpServletRequest request) {
        return handleKeyService(new ValidationException(
                FieldError.of("body", "MALFORMED", "Request body is missing or malformed")), request);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ProblemDetail> handleGeneric(Exception ex, HttpServletRequest request) {
        String referenceId = securityUtils.getCurrentCorrelationId();
        log.error("Unexpected error: referenceId={}", referenceId, ex);
        return buildResponse("INTERNAL_ERROR", 500, "An unexpected error occurred", request,
                referenceId == null ? Map.of() : Map.of("referenceId", referenceId), new HttpHeaders());
    }

    private ResponseEntity<ProblemDetail> buildResponse(String errorCode, int status, String detail,
                                                        HttpServletRequest request,
                                                        Map<String, Object> extensions,
                                                        HttpHeaders headers) {
        String correlationId = securityUtils.getCurrentCorrelationId();
        ProblemDetail problem = ProblemDetail.forCode(errorCode, status, detail,
                request.getRequestURI(), correlationId, extensions);

        if (problem.isServerError()) {
            log.warn("Request failed: code={}, correlationId={}", errorCode, correlationId);
        } else {
            log.debug("Handled exception: code={}, correlationId={}", errorCode, correlationId);
        }
        return ResponseEntity.status(HttpStatus.valueOf(status)).headers(headers).body(problem);
    }
}
