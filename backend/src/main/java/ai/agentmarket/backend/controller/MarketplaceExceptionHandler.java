package ai.agentmarket.backend.controller;

import ai.agentmarket.backend.service.exception.ErrorCode;
import ai.agentmarket.backend.service.exception.MarketplaceException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.Map;
import java.util.stream.Collectors;

/**
 * Maps rejected operations to {@code {"error": CODE, "message": ...}} responses.
 */
@Slf4j
@RestControllerAdvice
public class MarketplaceExceptionHandler {

    @ExceptionHandler(MarketplaceException.class)
    public ResponseEntity<Map<String, String>> handleMarketplace(MarketplaceException ex) {
        log.warn("Rejected request: {} - {}", ex.getErrorCode(), ex.getMessage());
        return error(ex.getErrorCode(), ex.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, String>> handleValidation(MethodArgumentNotValidException ex) {
        String message = ex.getBindingResult().getFieldErrors().stream()
                .map(FieldError::getDefaultMessage)
                .collect(Collectors.joining("; "));
        return error(ErrorCode.INVALID_ARGUMENT, message.isEmpty() ? "Invalid request" : message);
    }

    /**
     * Unreadable bodies, including unknown enum tokens rejected while binding the body.
     */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, String>> handleUnreadable(HttpMessageNotReadableException ex) {
        for (Throwable cause = ex.getCause(); cause != null; cause = cause.getCause()) {
            if (cause instanceof MarketplaceException) {
                return handleMarketplace((MarketplaceException) cause);
            }
        }
        return error(ErrorCode.INVALID_ARGUMENT, "Malformed request body");
    }

    @ExceptionHandler({MethodArgumentTypeMismatchException.class, MissingServletRequestParameterException.class})
    public ResponseEntity<Map<String, String>> handleBadParameter(Exception ex) {
        return error(ErrorCode.INVALID_ARGUMENT, ex.getMessage());
    }

    static HttpStatus statusFor(ErrorCode code) {
        switch (code) {
            case NOT_FOUND:
            case BID_NOT_FOUND:
                return HttpStatus.NOT_FOUND;
            case UNAUTHORIZED:
                return HttpStatus.FORBIDDEN;
            case INVALID_AMOUNT:
            case INVALID_MILESTONES:
            case INVALID_ARGUMENT:
                return HttpStatus.BAD_REQUEST;
            default:
                return HttpStatus.CONFLICT;
        }
    }

    private static ResponseEntity<Map<String, String>> error(ErrorCode code, String message) {
        return ResponseEntity.status(statusFor(code))
                .body(Map.of("error", code.name(), "message", message == null ? "" : message));
    }
}
