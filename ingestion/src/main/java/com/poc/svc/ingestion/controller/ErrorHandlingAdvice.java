package com.poc.svc.ingestion.controller;

import com.poc.svc.ingestion.dto.ErrorResponse;
import com.poc.svc.ingestion.exception.DocumentNotFoundException;
import com.poc.svc.ingestion.util.TraceContext;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.ConstraintViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 查詢 API 的錯誤一律轉為 {@link ErrorResponse}，並帶上當次請求的 traceId。
 */
@RestControllerAdvice
public class ErrorHandlingAdvice {

    private static final Logger log = LoggerFactory.getLogger(ErrorHandlingAdvice.class);

    @ExceptionHandler(DocumentNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleDocumentNotFound(DocumentNotFoundException ex) {
        return respond(HttpStatus.NOT_FOUND, "DOCUMENT_NOT_FOUND", ex.getMessage(), Map.of(
                "collection", ex.collection().value(),
                "productCode", ex.productCode()));
    }

    @ExceptionHandler(NoResourceFoundException.class)
    public ResponseEntity<ErrorResponse> handleNoResource(NoResourceFoundException ex) {
        return respond(HttpStatus.NOT_FOUND, "NOT_FOUND", "No endpoint " + ex.getResourcePath(), Map.of());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(IllegalArgumentException ex) {
        return badRequest(ex.getMessage(), Map.of());
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorResponse> handleTypeMismatch(MethodArgumentTypeMismatchException ex) {
        return badRequest("Invalid value for parameter " + ex.getName(), Map.of("parameter", ex.getName()));
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<ErrorResponse> handleMissingParameter(MissingServletRequestParameterException ex) {
        return badRequest(ex.getMessage(), Map.of("parameter", ex.getParameterName()));
    }

    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<ErrorResponse> handleConstraintViolation(ConstraintViolationException ex) {
        return badRequest(ex.getMessage(), Map.of("violations", violations(ex.getConstraintViolations())));
    }

    @ExceptionHandler(DataAccessException.class)
    public ResponseEntity<ErrorResponse> handleDataAccessException(DataAccessException ex) {
        log.error("MongoDB query failed", ex);
        return respond(HttpStatus.BAD_GATEWAY, "DATA_ACCESS_ERROR", "資料存取發生錯誤",
                Map.of("error", String.valueOf(ex.getMostSpecificCause().getMessage())));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception ex) {
        log.error("Unhandled exception", ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_SERVER_ERROR", "系統發生未預期錯誤",
                ex.getMessage() == null ? Map.of() : Map.of("error", ex.getMessage()));
    }

    private ResponseEntity<ErrorResponse> badRequest(String message, Map<String, Object> details) {
        return respond(HttpStatus.BAD_REQUEST, "BAD_REQUEST", message, details);
    }

    private ResponseEntity<ErrorResponse> respond(HttpStatus status, String code, String message, Map<String, Object> details) {
        return ResponseEntity.status(status)
                .body(ErrorResponse.of(code, message, details, TraceContext.traceId()));
    }

    private List<Map<String, String>> violations(Set<ConstraintViolation<?>> violations) {
        if (violations == null) {
            return List.of();
        }
        return violations.stream()
                .map(violation -> Map.of(
                        "property", violation.getPropertyPath().toString(),
                        "message", violation.getMessage()))
                .toList();
    }
}
