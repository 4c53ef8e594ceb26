package com.example.hybridretrieval.controller.exception;

import static com.example.hybridretrieval.controller.exception.ExceptionHelper.getTrace;

import com.example.hybridretrieval.domain.exception.BackendUnavailableException;
import jakarta.servlet.http.HttpServletRequest;
import java.util.Date;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @Value("${app.error.show-trace:false}")
    private boolean showTrace;

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationException(
            MethodArgumentNotValidException ex,
            HttpServletRequest request
    ) {
        String message = ex.getBindingResult()
                .getFieldErrors()
                .stream()
                .map(err -> err.getField() + ": " + err.getDefaultMessage())
                .findFirst()
                .orElse("Validation error");

        return build(HttpStatus.BAD_REQUEST, message, ex, request);
    }

    // invalid mode, alpha, k or chunk settings
    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleBadRequest(
            IllegalArgumentException ex,
            HttpServletRequest request
    ) {
        return build(HttpStatus.BAD_REQUEST, ex.getMessage(), ex, request);
    }

    @ExceptionHandler(BusinessException.class)
    public ResponseEntity<ErrorResponse> handleBusinessException(
            BusinessException ex,
            HttpServletRequest request
    ) {
        return build(ex.getStatus(), ex.getMessage(), ex, request);
    }

    @ExceptionHandler(BackendUnavailableException.class)
    public ResponseEntity<ErrorResponse> handleBackendUnavailable(
            BackendUnavailableException ex,
            HttpServletRequest request
    ) {
        log.warn("event=api_backend_unavailable path={} msg={}", request.getRequestURI(), ex.getMessage(), ex);
        return build(HttpStatus.SERVICE_UNAVAILABLE, ex.getMessage(), ex, request);
    }

    @ExceptionHandler(RuntimeException.class)
    public ResponseEntity<ErrorResponse> handleException(
            RuntimeException ex,
            HttpServletRequest request
    ) {
        log.error("event=api_error path={} msg={}", request.getRequestURI(), ex.getMessage(), ex);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, "Internal server error", ex, request);
    }

    private ResponseEntity<ErrorResponse> build(HttpStatus status, String message, Exception ex,
                                                HttpServletRequest request) {
        ErrorResponse error = ErrorResponse.builder()
                .error(status.name())
                .message(message)
                .status(status.value())
                .path(request.getRequestURI())
                .timestamp(new Date())
                .trace(showTrace ? getTrace(ex) : null)
                .build();

        return ResponseEntity.status(status).body(error);
    }
}
