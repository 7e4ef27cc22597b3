package com.example.catalogsync.exception;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Map;

/**
 * Global exception handler for the application.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(SyncInProgressException.class)
    public ResponseEntity<Map<String, Object>> handleSyncInProgressException(SyncInProgressException ex) {
        log.warn("Rejected sync trigger: {}", ex.getMessage());
        return buildResponse(HttpStatus.CONFLICT, "Sync In Progress", ex);
    }

    @ExceptionHandler(RemoteException.class)
    public ResponseEntity<Map<String, Object>> handleRemoteException(RemoteException ex) {
        log.error("Remote API error in {}: {}", ex.getOperation(), ex.getMessage(), ex);

        HttpStatus status = ex.getStatusCode() == 404 ? HttpStatus.NOT_FOUND : HttpStatus.BAD_GATEWAY;
        ResponseEntity<Map<String, Object>> response = buildResponse(status, "Remote API Error", ex);
        response.getBody().put("remoteStatus", ex.getStatusCode());
        if (ex.getOperation() != null) {
            response.getBody().put("operation", ex.getOperation());
        }
        return response;
    }

    @ExceptionHandler(CatalogSyncException.class)
    public ResponseEntity<Map<String, Object>> handleCatalogSyncException(CatalogSyncException ex) {
        log.error("Catalog sync error: {}", ex.getMessage(), ex);
        return buildResponse(HttpStatus.INTERNAL_SERVER_ERROR, "Catalog Sync Error", ex);
    }

    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<Map<String, Object>> handleResourceNotFoundException(ResourceNotFoundException ex) {
        log.warn("Resource not found: {}", ex.getMessage());

        Map<String, Object> errorResponse = new HashMap<>();
        errorResponse.put("timestamp", LocalDateTime.now().toString());
        errorResponse.put("status", HttpStatus.NOT_FOUND.value());
        errorResponse.put("error", "Not Found");
        errorResponse.put("message", ex.getMessage());

        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(errorResponse);
    }

    @ExceptionHandler(NoResourceFoundException.class)
    public ResponseEntity<Void> handleNoResourceFoundException(NoResourceFoundException ex) {
        // favicon and other static lookups from browsers hitting the swagger UI
        String resourcePath = ex.getResourcePath();
        if (resourcePath != null && (resourcePath.contains("favicon.ico") || resourcePath.endsWith(".png"))) {
            log.debug("Static resource not found: {}", resourcePath);
        } else {
            log.warn("Static resource not found: {}", resourcePath);
        }

        return ResponseEntity.status(HttpStatus.NOT_FOUND).build();
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleGenericException(Exception ex) {
        log.error("Unexpected error: {}", ex.getMessage(), ex);

        Map<String, Object> errorResponse = new HashMap<>();
        errorResponse.put("timestamp", LocalDateTime.now().toString());
        errorResponse.put("status", HttpStatus.INTERNAL_SERVER_ERROR.value());
        errorResponse.put("error", "Internal Server Error");
        errorResponse.put("message", "An unexpected error occurred");

        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(errorResponse);
    }

    private ResponseEntity<Map<String, Object>> buildResponse(HttpStatus status, String error, CatalogSyncException ex) {
        Map<String, Object> errorResponse = new HashMap<>();
        errorResponse.put("timestamp", LocalDateTime.now().toString());
        errorResponse.put("status", status.value());
        errorResponse.put("error", error);
        errorResponse.put("message", ex.getMessage());
        if (ex.getFamily() != null) {
            errorResponse.put("family", ex.getFamily());
        }
        if (ex.getNaturalKey() != null) {
            errorResponse.put("naturalKey", ex.getNaturalKey());
        }
        return ResponseEntity.status(status).body(errorResponse);
    }
}
