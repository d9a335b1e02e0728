package com.controlplane.api.rest;

import com.controlplane.core.exception.ControlPlaneException;
import com.controlplane.core.exception.DuplicateClusterException;
import com.controlplane.core.exception.NotFoundException;
import com.controlplane.core.exception.OperationNotAllowedException;
import com.controlplane.core.exception.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.stream.Collectors;

/**
 * Maps control plane error codes to HTTP statuses with a JSON body.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(ControlPlaneException.class)
    public ResponseEntity<ErrorResponse> handleControlPlane(ControlPlaneException e) {
        HttpStatus status = statusOf(e.getErrorCode());
        if (status.is5xxServerError()) {
            log.error("Request failed [{}]", e.getErrorCode(), e);
        } else {
            log.debug("Request rejected [{}]: {}", e.getErrorCode(), e.getMessage());
        }
        return ResponseEntity.status(status).body(ErrorResponse.of(e.getErrorCode(), e.getMessage()));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleInvalidBody(MethodArgumentNotValidException e) {
        String message = e.getBindingResult().getFieldErrors().stream()
            .map(error -> error.getField() + " " + error.getDefaultMessage())
            .collect(Collectors.joining(", "));
        return ResponseEntity.badRequest().body(ErrorResponse.of(ValidationException.ERROR_CODE, message));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadableBody(HttpMessageNotReadableException e) {
        return ResponseEntity.badRequest()
            .body(ErrorResponse.of(ValidationException.ERROR_CODE, "Malformed request body"));
    }

    static HttpStatus statusOf(String errorCode) {
        if (errorCode == null) {
            return HttpStatus.INTERNAL_SERVER_ERROR;
        }
        return switch (errorCode) {
            case NotFoundException.ERROR_CODE -> HttpStatus.NOT_FOUND;
            case ValidationException.ERROR_CODE -> HttpStatus.BAD_REQUEST;
            case OperationNotAllowedException.ERROR_CODE -> HttpStatus.METHOD_NOT_ALLOWED;
            case DuplicateClusterException.ERROR_CODE -> HttpStatus.CONFLICT;
            default -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }

    public record ErrorResponse(String errorCode, String message, Instant timestamp) {
        static ErrorResponse of(String errorCode, String message) {
            return new ErrorResponse(errorCode, message, Instant.now());
        }
    }
}
