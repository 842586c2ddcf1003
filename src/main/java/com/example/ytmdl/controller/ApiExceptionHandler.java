package com.example.ytmdl.controller;

import com.example.ytmdl.exception.InvalidJobStateException;
import com.example.ytmdl.exception.JobNotFoundException;
import com.example.ytmdl.exception.QueueException;
import com.example.ytmdl.exception.ValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<Map<String, String>> handleValidation(ValidationException e) {
        return body(HttpStatus.BAD_REQUEST, e);
    }

    @ExceptionHandler(JobNotFoundException.class)
    public ResponseEntity<Map<String, String>> handleNotFound(JobNotFoundException e) {
        return body(HttpStatus.NOT_FOUND, e);
    }

    @ExceptionHandler(InvalidJobStateException.class)
    public ResponseEntity<Map<String, String>> handleInvalidState(InvalidJobStateException e) {
        log.debug("Rejected operation: {}", e.getMessage());
        return body(HttpStatus.CONFLICT, e);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, String>> handleInvalidBody(MethodArgumentNotValidException e) {
        String message = e.getBindingResult().getFieldErrors().stream()
                .findFirst()
                .map(error -> error.getDefaultMessage())
                .orElse("Invalid request");
        return ResponseEntity.badRequest().body(Map.of("error", "VALIDATION_ERROR", "message", message));
    }

    private static ResponseEntity<Map<String, String>> body(HttpStatus status, QueueException e) {
        return ResponseEntity.status(status).body(Map.of("error", e.getErrorCode(), "message", e.getMessage()));
    }
}
