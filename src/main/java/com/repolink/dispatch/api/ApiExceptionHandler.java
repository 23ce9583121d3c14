package com.repolink.dispatch.api;

import com.repolink.core.error.ErrorKind;
import com.repolink.core.error.RepolinkException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.WebRequest;
import org.springframework.web.servlet.mvc.method.annotation.ResponseEntityExceptionHandler;

/**
 * Maps failures to {@link ErrorResponse} bodies. The HTTP status follows the
 * {@link ErrorKind}; framework errors (unreadable JSON, wrong method) keep
 * Spring's status and are reported as {@code VALIDATION} or {@code INTERNAL}.
 */
@RestControllerAdvice
public class ApiExceptionHandler extends ResponseEntityExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(RepolinkException.class)
    public ResponseEntity<ErrorResponse> handleRepolinkException(RepolinkException e) {
        HttpStatus status = statusFor(e.kind());
        if (status.is5xxServerError()) {
            log.error("{} [{}]: {}", e.kind(), e.code(), e.getMessage(), e);
        } else {
            log.warn("{} [{}]: {}", e.kind(), e.code(), e.getMessage());
        }
        return ResponseEntity.status(status)
                .body(new ErrorResponse(e.kind().name(), e.code(), e.getMessage()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(Exception e) {
        log.error("Unexpected failure", e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(new ErrorResponse(ErrorKind.INTERNAL.name(), "internal_error",
                        "Unexpected error: " + e.getClass().getSimpleName()));
    }

    @Override
    protected ResponseEntity<Object> handleExceptionInternal(Exception ex, Object body, HttpHeaders headers,
                                                             HttpStatusCode statusCode, WebRequest request) {
        ErrorKind kind = statusCode.is4xxClientError() ? ErrorKind.VALIDATION : ErrorKind.INTERNAL;
        log.warn("Rejected request ({}): {}", statusCode.value(), ex.getMessage());
        return ResponseEntity.status(statusCode)
                .headers(headers)
                .body(new ErrorResponse(kind.name(), "http_" + statusCode.value(), ex.getMessage()));
    }

    static HttpStatus statusFor(ErrorKind kind) {
        return switch (kind) {
            case NOT_FOUND -> HttpStatus.NOT_FOUND;
            case VALIDATION -> HttpStatus.BAD_REQUEST;
            case CONFLICT -> HttpStatus.CONFLICT;
            case UPSTREAM -> HttpStatus.BAD_GATEWAY;
            case INTERNAL -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }
}
