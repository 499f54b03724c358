package org.areaflow.engine.api.exception;

import lombok.extern.slf4j.Slf4j;
import org.areaflow.engine.api.dto.ApiError;
import org.areaflow.engine.api.dto.ApiResponse;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.HashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Maps bind-time rejections to 400 responses; anything unexpected is a 500.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(UnknownActionException.class)
    public ResponseEntity<ApiResponse<Void>> handleUnknownAction(UnknownActionException ex) {
        log.warn("Rejected unknown action: {}", ex.getActionName());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(ApiResponse.error(ApiError.UNKNOWN_ACTION, ex.getMessage(),
                        Map.of("actionName", String.valueOf(ex.getActionName()))));
    }

    @ExceptionHandler(UnknownReactionException.class)
    public ResponseEntity<ApiResponse<Void>> handleUnknownReaction(UnknownReactionException ex) {
        log.warn("Rejected unknown reaction: {}", ex.getReactionName());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(ApiResponse.error(ApiError.UNKNOWN_REACTION, ex.getMessage(),
                        Map.of("reactionName", String.valueOf(ex.getReactionName()))));
    }

    @ExceptionHandler(InvalidAreaConfigException.class)
    public ResponseEntity<ApiResponse<Void>> handleInvalidConfig(InvalidAreaConfigException ex) {
        log.warn("Rejected area config: {}", ex.getMessage());
        Map<String, String> details = new HashMap<>();
        details.put("item", ex.getItemName());
        details.put("field", ex.getField());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(ApiResponse.error(ApiError.INVALID_CONFIG, ex.getMessage(), details));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiResponse<Void>> handleBeanValidation(MethodArgumentNotValidException ex) {
        String errors = ex.getBindingResult().getFieldErrors().stream()
                .map(e -> e.getField() + ": " + e.getDefaultMessage())
                .collect(Collectors.joining(", "));
        log.warn("Bean validation failed: {}", errors);
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(ApiResponse.error(ApiError.VALIDATION_ERROR, errors));
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ApiResponse<Void>> handleTypeMismatch(MethodArgumentTypeMismatchException ex) {
        log.warn("Bad request parameter: {}={}", ex.getName(), ex.getValue());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(ApiResponse.error(ApiError.VALIDATION_ERROR, "Invalid value for '" + ex.getName() + "'"));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiResponse<Void>> handleGeneric(Exception ex) {
        log.error("Unexpected error: {}", ex.getMessage(), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ApiResponse.error(ApiError.INTERNAL_ERROR, "An unexpected error occurred"));
    }
}
