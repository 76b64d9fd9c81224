package com.aiwriter.schedule.web;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ServerWebInputException;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Maps request validation failures to 400 with a small problem body:
 * <pre>
 * {"status": 400, "error": "Bad Request", "details": ["schedule.month: must be less than or equal to 12"]}
 * </pre>
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(WebExchangeBindException.class)
    public ResponseEntity<Map<String, Object>> onBind(WebExchangeBindException e) {
        List<String> details = e.getFieldErrors().stream()
                .map(fe -> fe.getField() + ": " + fe.getDefaultMessage())
                .toList();
        return badRequest(details);
    }

    @ExceptionHandler(ServerWebInputException.class)
    public ResponseEntity<Map<String, Object>> onInput(ServerWebInputException e) {
        return badRequest(List.of(e.getReason() == null ? "malformed request" : e.getReason()));
    }

    /**
     * Raised for schedules that pass range checks but are not real dates (e.g. April 31).
     */
    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> onIllegalArgument(IllegalArgumentException e) {
        log.debug("Rejected request: {}", e.getMessage());
        return badRequest(List.of(e.getMessage()));
    }

    private static ResponseEntity<Map<String, Object>> badRequest(List<String> details) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", HttpStatus.BAD_REQUEST.value());
        body.put("error", HttpStatus.BAD_REQUEST.getReasonPhrase());
        body.put("details", details);
        return ResponseEntity.badRequest().body(body);
    }
}
