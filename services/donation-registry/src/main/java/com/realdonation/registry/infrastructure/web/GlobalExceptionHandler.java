package com.realdonation.registry.infrastructure.web;

import com.realdonation.observability.CorrelationContextHolder;
import com.realdonation.registry.domain.DonationRegistryException;
import com.realdonation.registry.domain.ErrorCode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.net.URI;
import java.time.Instant;

/**
 * Maps exceptions to RFC 7807 {@link ProblemDetail} responses.
 * <p>
 * Registry rejections keep their canonical error name as the title and expose it again as the
 * {@code error} property, together with the offending value:
 *
 * <pre>
 * {
 *   "type": "https://realdonation.io/errors/IllegalCaller",
 *   "title": "IllegalCaller",
 *   "status": 403,
 *   "detail": "IllegalCaller(0xa000000000000000000000000000000000000003)",
 *   "error": "IllegalCaller",
 *   "value": "0xa000000000000000000000000000000000000003",
 *   "timestamp": "2026-10-17T10:30:00Z",
 *   "correlationId": "abc-123"
 * }
 * </pre>
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    private static final String ERROR_TYPE_BASE = "https://realdonation.io/errors/";

    @ExceptionHandler(DonationRegistryException.class)
    public ProblemDetail handleRegistryFailure(DonationRegistryException ex) {
        log.info("Registry call rejected: {}", ex.getMessage());
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(statusOf(ex.code()), ex.getMessage());
        problem.setTitle(ex.code().value());
        problem.setType(URI.create(ERROR_TYPE_BASE + ex.code().value()));
        problem.setProperty("error", ex.code().value());
        if (ex.offendingValue() != null) {
            problem.setProperty("value", ex.offendingValue().toString());
        }
        enrichWithCorrelation(problem);
        return problem;
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ProblemDetail handleIllegalArgument(IllegalArgumentException ex) {
        log.warn("Bad request: {}", ex.getMessage());
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, ex.getMessage());
        problem.setTitle("Bad Request");
        problem.setType(URI.create(ERROR_TYPE_BASE + "bad-request"));
        enrichWithCorrelation(problem);
        return problem;
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ProblemDetail handleValidation(MethodArgumentNotValidException ex) {
        log.warn("Validation failed: {}", ex.getMessage());
        String detail = ex.getBindingResult().getFieldErrors().stream()
                .map(fe -> fe.getField() + ": " + fe.getDefaultMessage())
                .reduce((a, b) -> a + "; " + b)
                .orElse("Validation failed");
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, detail);
        problem.setTitle("Validation Error");
        problem.setType(URI.create(ERROR_TYPE_BASE + "validation"));
        enrichWithCorrelation(problem);
        return problem;
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ProblemDetail handleUnreadableBody(HttpMessageNotReadableException ex) {
        log.warn("Unreadable request body: {}", ex.getMessage());
        ProblemDetail problem =
                ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, "Malformed request body");
        problem.setTitle("Bad Request");
        problem.setType(URI.create(ERROR_TYPE_BASE + "bad-request"));
        enrichWithCorrelation(problem);
        return problem;
    }

    @ExceptionHandler(Exception.class)
    public ProblemDetail handleGeneric(Exception ex) {
        if (ex instanceof ErrorResponse errorResponse) {
            // framework exceptions (unknown route, wrong method, ...) already carry their status
            log.debug("Request failed with {}: {}", errorResponse.getStatusCode(), ex.getMessage());
            ProblemDetail problem = errorResponse.getBody();
            enrichWithCorrelation(problem);
            return problem;
        }
        log.error("Internal server error", ex);
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(
                HttpStatus.INTERNAL_SERVER_ERROR, "An unexpected error occurred");
        problem.setTitle("Internal Server Error");
        problem.setType(URI.create(ERROR_TYPE_BASE + "internal"));
        enrichWithCorrelation(problem);
        return problem;
    }

    static HttpStatus statusOf(ErrorCode code) {
        return switch (code) {
            case ILLEGAL_CALLER -> HttpStatus.FORBIDDEN;
            case INCORRECT_STRING_FORMAT, INSUFFICIENT_FUNDS -> HttpStatus.BAD_REQUEST;
            case PROJECT_EXISTED -> HttpStatus.NOT_FOUND;
            case TRANSACTION_FAILED -> HttpStatus.UNPROCESSABLE_ENTITY;
        };
    }

    private void enrichWithCorrelation(ProblemDetail problem) {
        problem.setProperty("timestamp", Instant.now().toString());
        CorrelationContextHolder.get()
                .ifPresent(ctx -> problem.setProperty("correlationId", ctx.correlationId()));
    }
}
