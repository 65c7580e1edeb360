package com.demo.fit.config;

import com.demo.fit.service.exception.EvaluatorTimeoutException;
import com.demo.fit.service.exception.EvaluatorUnavailableException;
import com.demo.fit.service.exception.FitEngineException;
import com.demo.fit.service.exception.FitNotComputedException;
import com.demo.fit.service.exception.InsufficientCreditsException;
import com.demo.fit.service.exception.ProfileNotFoundException;
import com.demo.fit.service.exception.StoreUnavailableException;
import com.demo.fit.service.exception.UniversityNotFoundException;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(InsufficientCreditsException.class)
    public ResponseEntity<Map<String, Object>> handleCredits(InsufficientCreditsException ex, HttpServletRequest req) {
        Map<String, Object> body = body(HttpStatus.PAYMENT_REQUIRED, ex.reasonCode(), ex.getMessage(), req);
        body.put("success", false);
        body.put("credits_remaining", ex.getCreditsRemaining());
        body.put("credits_needed", ex.getCreditsNeeded());
        return ResponseEntity.status(HttpStatus.PAYMENT_REQUIRED).body(body);
    }

    @ExceptionHandler(ProfileNotFoundException.class)
    public ResponseEntity<Map<String, Object>> handleProfile(ProfileNotFoundException ex, HttpServletRequest req) {
        Map<String, Object> body = body(HttpStatus.NOT_FOUND, ex.reasonCode(), ex.getMessage(), req);
        body.put("success", false);
        body.put("needs_onboarding", true);
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(body);
    }

    @ExceptionHandler({UniversityNotFoundException.class, FitNotComputedException.class})
    public ResponseEntity<Map<String, Object>> handleNotFound(FitEngineException ex,
                                                              HttpServletRequest req) {
        return respond(HttpStatus.NOT_FOUND, ex.reasonCode(), ex.getMessage(), req);
    }

    @ExceptionHandler(EvaluatorUnavailableException.class)
    public ResponseEntity<Map<String, Object>> handleEvaluator(EvaluatorUnavailableException ex, HttpServletRequest req) {
        log.warn("[EVALUATOR] {} {}", req.getRequestURI(), ex.getMessage());
        return respond(HttpStatus.SERVICE_UNAVAILABLE, ex.reasonCode(), ex.getMessage(), req);
    }

    @ExceptionHandler(EvaluatorTimeoutException.class)
    public ResponseEntity<Map<String, Object>> handleTimeout(EvaluatorTimeoutException ex, HttpServletRequest req) {
        log.warn("[EVALUATOR] {} {}", req.getRequestURI(), ex.getMessage());
        return respond(HttpStatus.GATEWAY_TIMEOUT, ex.reasonCode(), ex.getMessage(), req);
    }

    @ExceptionHandler(StoreUnavailableException.class)
    public ResponseEntity<Map<String, Object>> handleStore(StoreUnavailableException ex, HttpServletRequest req) {
        log.error("{} store failure", req.getRequestURI(), ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, ex.reasonCode(), "Storage temporarily unavailable", req);
    }

    @ExceptionHandler(DataAccessException.class)
    public ResponseEntity<Map<String, Object>> handleSql(DataAccessException ex, HttpServletRequest req) {
        log.error("{} database error", req.getRequestURI(), ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Database Error",
                ex.getMostSpecificCause() != null ? ex.getMostSpecificCause().getMessage() : ex.getMessage(), req);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleValidation(MethodArgumentNotValidException ex, HttpServletRequest req) {
        String message = ex.getBindingResult().getFieldErrors().stream()
                .map(fe -> fe.getField() + " " + fe.getDefaultMessage())
                .findFirst()
                .orElse(ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "Bad Request", message, req);
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MissingServletRequestParameterException.class,
            IllegalArgumentException.class})
    public ResponseEntity<Map<String, Object>> handleBadInput(Exception ex, HttpServletRequest req) {
        return respond(HttpStatus.BAD_REQUEST, "Bad Request", ex.getMessage(), req);
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<Map<String, Object>> handleStatus(ResponseStatusException ex, HttpServletRequest req) {
        HttpStatusCode code = ex.getStatusCode();
        HttpStatus status = HttpStatus.resolve(code.value());
        String error = status != null ? status.getReasonPhrase() : String.valueOf(code.value());
        Map<String, Object> body = body(code.value(), error, ex.getReason(), req);
        return ResponseEntity.status(code).body(body);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleAny(Exception ex, HttpServletRequest req) {
        log.error("{} unhandled", req.getRequestURI(), ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error", ex.getMessage(), req);
    }

    private static ResponseEntity<Map<String, Object>> respond(HttpStatus status, String error, String message,
                                                               HttpServletRequest req) {
        return ResponseEntity.status(status).body(body(status, error, message, req));
    }

    private static Map<String, Object> body(HttpStatus status, String error, String message, HttpServletRequest req) {
        return body(status.value(), error, message, req);
    }

    private static Map<String, Object> body(int status, String error, String message, HttpServletRequest req) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("timestamp", Instant.now());
        body.put("status", status);
        body.put("error", error);
        body.put("message", message);
        body.put("path", req.getRequestURI());
        return body;
    }
}
