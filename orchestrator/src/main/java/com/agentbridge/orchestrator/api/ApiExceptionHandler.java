package com.agentbridge.orchestrator.api;

import com.agentbridge.orchestrator.api.dto.ErrorResponse;
import com.agentbridge.orchestrator.error.BridgeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps bridge failures onto HTTP status codes.
 *
 * ADAPTER_NOT_FOUND → 404, STORE → 503, TIMEOUT → 504, other categories → 422,
 * malformed requests → 400.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(BridgeException.class)
    public ResponseEntity<ErrorResponse> bridge(BridgeException e) {
        HttpStatus status = switch (e.getCategory()) {
            case ADAPTER_NOT_FOUND -> HttpStatus.NOT_FOUND;
            case STORE             -> HttpStatus.SERVICE_UNAVAILABLE;
            case TIMEOUT           -> HttpStatus.GATEWAY_TIMEOUT;
            default                -> HttpStatus.UNPROCESSABLE_ENTITY;
        };
        if (status.is5xxServerError()) {
            log.error("Request failed with {}: {}", e.getCategory(), e.getMessage(), e);
        }
        return ResponseEntity.status(status).body(new ErrorResponse(e.getCategory().name(), e.getMessage()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> badRequest(IllegalArgumentException e) {
        return ResponseEntity.badRequest().body(new ErrorResponse("BAD_REQUEST", e.getMessage()));
    }
}
