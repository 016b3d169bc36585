package com.skillflow.gateway.http;

import com.fasterxml.jackson.databind.JsonMappingException;
import com.skillflow.shared.model.SkillException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(SkillException.class)
    public ResponseEntity<Map<String, Object>> handleSkill(SkillException ex) {
        var status = statusOf(ex.getKind());
        var body = new LinkedHashMap<String, Object>();
        body.put("kind", ex.getKind().name());
        body.put("message", ex.getReason());
        if (ex.getDetail() != null) body.put("detail", ex.getDetail());
        return ResponseEntity.status(status).body(body);
    }

    /** A body rejected by one of our own type lookups reports the field that failed. */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> handleUnreadable(HttpMessageNotReadableException ex) {
        var skill = causeOf(ex, SkillException.class);
        if (skill == null) return handleBadRequest(ex);
        var mapping = causeOf(ex, JsonMappingException.class);
        var detail = mapping == null || mapping.getPath().isEmpty()
                ? skill.getDetail() : fieldReference(mapping.getPath());
        return handleSkill(new SkillException(skill.getKind(), detail, skill.getReason()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleBadRequest(Exception ex) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(Map.of("kind", "BAD_REQUEST", "message", String.valueOf(ex.getMessage())));
    }

    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<Map<String, Object>> handleUnavailable(IllegalStateException ex) {
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(Map.of("kind", "UNAVAILABLE", "message", String.valueOf(ex.getMessage())));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleUnexpected(Exception ex) {
        log.error("Unhandled request failure", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(Map.of("kind", "INTERNAL", "message", "Internal server error"));
    }

    static String fieldReference(List<JsonMappingException.Reference> path) {
        var sb = new StringBuilder();
        for (var ref : path) {
            if (ref.getFieldName() != null) {
                if (sb.length() > 0) sb.append('.');
                sb.append(ref.getFieldName());
            } else if (ref.getIndex() >= 0) {
                sb.append('[').append(ref.getIndex()).append(']');
            }
        }
        return sb.toString();
    }

    private static <T extends Throwable> T causeOf(Throwable ex, Class<T> type) {
        for (var t = ex; t != null; t = t.getCause()) {
            if (type.isInstance(t)) return type.cast(t);
        }
        return null;
    }

    static HttpStatus statusOf(SkillException.Kind kind) {
        return switch (kind) {
            case SKILL_NOT_FOUND, EXECUTION_NOT_FOUND, WORKFLOW_NOT_FOUND -> HttpStatus.NOT_FOUND;
            case ALREADY_DECIDED -> HttpStatus.CONFLICT;
            default -> HttpStatus.BAD_REQUEST;
        };
    }
}
