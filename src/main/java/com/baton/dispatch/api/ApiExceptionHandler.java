package com.baton.dispatch.api;

import com.baton.core.error.CoordinationException;
import com.baton.core.error.RuleViolation;
import com.baton.core.error.WorkItemNotFoundException;
import com.baton.core.store.TicketStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps coordination failures to HTTP: structural rules to 409, data-integrity rules to 422,
 * unknown work items to 404. Every body names the rule that was broken.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(CoordinationException.class)
    public ResponseEntity<Map<String, Object>> coordination(CoordinationException e) {
        HttpStatus status = e.getCategory() == RuleViolation.Category.STRUCTURAL
                ? HttpStatus.CONFLICT
                : HttpStatus.UNPROCESSABLE_ENTITY;
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", e.getMessage());
        body.put("rule", e.getRule().name());
        body.put("category", e.getCategory().name());
        if (e.getWorkItemId() != null) {
            body.put("work_item_id", e.getWorkItemId());
        }
        return ResponseEntity.status(status).body(body);
    }

    @ExceptionHandler(WorkItemNotFoundException.class)
    public ResponseEntity<Map<String, Object>> notFound(WorkItemNotFoundException e) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", e.getMessage()));
    }

    @ExceptionHandler(TicketStoreException.class)
    public ResponseEntity<Map<String, Object>> store(TicketStoreException e) {
        log.error("Ticket store failure: {}", e.getMessage(), e);
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(Map.of("error", e.getMessage()));
    }
}
