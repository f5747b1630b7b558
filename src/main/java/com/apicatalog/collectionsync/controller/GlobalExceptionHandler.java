package com.apicatalog.collectionsync.controller;

import com.apicatalog.collectionsync.exception.*;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;
import java.util.stream.Collectors;

@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(ExcludedOwnerTypeException.class)
    public ResponseEntity<Map<String, String>> handleExcluded(ExcludedOwnerTypeException e) {
        return error(HttpStatus.UNPROCESSABLE_ENTITY, "Excluded owner type", e.getMessage());
    }

    @ExceptionHandler({OwnerTypeNotFoundException.class, ModuleNotFoundException.class})
    public ResponseEntity<Map<String, String>> handleNotFound(RuntimeException e) {
        return error(HttpStatus.NOT_FOUND, "Not found", e.getMessage());
    }

    @ExceptionHandler(SyncInProgressException.class)
    public ResponseEntity<Map<String, String>> handleSyncInProgress(SyncInProgressException e) {
        return error(HttpStatus.CONFLICT, "Sync in progress", e.getMessage());
    }

    @ExceptionHandler(SchemaIndexException.class)
    public ResponseEntity<Map<String, String>> handleSchemaIndex(SchemaIndexException e) {
        log.error("Schema index unavailable", e);
        return error(HttpStatus.SERVICE_UNAVAILABLE, "Schema index unavailable", e.getMessage());
    }

    @ExceptionHandler({RemoteApplyException.class, TransientRemoteException.class})
    public ResponseEntity<Map<String, String>> handleRemote(RuntimeException e) {
        log.error("Remote collection call failed: {}", e.getMessage());
        return error(HttpStatus.BAD_GATEWAY, "Remote collection error", e.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, String>> handleValidation(MethodArgumentNotValidException e) {
        String message = e.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .collect(Collectors.joining(", "));
        return error(HttpStatus.BAD_REQUEST, "Invalid request", message);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, String>> handleIllegalArgument(IllegalArgumentException e) {
        return error(HttpStatus.BAD_REQUEST, "Invalid request", e.getMessage());
    }

    private static ResponseEntity<Map<String, String>> error(HttpStatus status, String error, String message) {
        return ResponseEntity.status(status).body(Map.of(
                "error", error,
                "message", message != null ? message : ""));
    }
}
