package com.vibecoding.ocloud.exception;

import io.fabric8.kubernetes.client.KubernetesClientException;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * REST API 예외 처리 핸들러
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(ResourceNotFoundException ex, HttpServletRequest request) {
        log.warn("Resource not found: {}", ex.getMessage());
        return build(HttpStatus.NOT_FOUND, ex.getMessage(), request, null);
    }

    @ExceptionHandler(InvalidQuantityException.class)
    public ResponseEntity<ErrorResponse> handleInvalidQuantity(InvalidQuantityException ex, HttpServletRequest request) {
        log.warn("Invalid quantity: {}", ex.getMessage());
        return build(HttpStatus.BAD_REQUEST, ex.getMessage(), request, null);
    }

    @ExceptionHandler(InsufficientCapacityException.class)
    public ResponseEntity<ErrorResponse> handleInsufficientCapacity(InsufficientCapacityException ex,
                                                                    HttpServletRequest request) {
        log.warn("Capacity exceeded: {}", ex.getMessage());
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("dimension", ex.getDimension());
        details.put("requested", ex.getRequested());
        details.put("available", ex.getAvailable());
        return build(HttpStatus.CONFLICT, ex.getMessage(), request, details);
    }

    @ExceptionHandler(SmoClientException.class)
    public ResponseEntity<ErrorResponse> handleSmoClient(SmoClientException ex, HttpServletRequest request) {
        log.error("SMO call failed: {}", ex.getMessage());
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("upstreamStatus", ex.getStatusCode());
        return build(HttpStatus.BAD_GATEWAY, ex.getMessage(), request, details);
    }

    @ExceptionHandler(ClusterApiException.class)
    public ResponseEntity<ErrorResponse> handleClusterApi(ClusterApiException ex, HttpServletRequest request) {
        log.error("Kubernetes API error: {}", ex.getMessage(), ex);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, "Kubernetes API call failed: " + ex.getMessage(), request, null);
    }

    @ExceptionHandler(KubernetesClientException.class)
    public ResponseEntity<ErrorResponse> handleK8sClient(KubernetesClientException ex, HttpServletRequest request) {
        log.error("Kubernetes client error: {}", ex.getMessage(), ex);

        String message;
        if (ex.getCode() == 401 || ex.getCode() == 403) {
            message = "Access to the Kubernetes cluster was denied";
        } else if (ex.getCode() == 404) {
            message = "Requested Kubernetes resource was not found";
        } else {
            message = "Unable to reach the Kubernetes cluster: " + ex.getMessage();
        }

        HttpStatus status = HttpStatus.resolve(ex.getCode());
        return build(status != null ? status : HttpStatus.SERVICE_UNAVAILABLE, message, request, null);
    }

    @ExceptionHandler(OrchestrationException.class)
    public ResponseEntity<ErrorResponse> handleOrchestration(OrchestrationException ex, HttpServletRequest request) {
        log.error("Orchestration failed: {}", ex.toString());
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("code", ex.getCode());
        details.put("severity", ex.getSeverity());
        details.put("retryable", ex.isRetryable());
        details.put("correlationId", ex.getCorrelationId());
        return build(HttpStatus.INTERNAL_SERVER_ERROR, ex.getMessage(), request, details);
    }

    @ExceptionHandler({IllegalArgumentException.class, HttpMessageNotReadableException.class})
    public ResponseEntity<ErrorResponse> handleBadRequest(Exception ex, HttpServletRequest request) {
        log.warn("Bad request: {}", ex.getMessage());
        return build(HttpStatus.BAD_REQUEST, ex.getMessage(), request, null);
    }

    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<ErrorResponse> handleConflict(IllegalStateException ex, HttpServletRequest request) {
        log.warn("Conflict: {}", ex.getMessage());
        return build(HttpStatus.CONFLICT, ex.getMessage(), request, null);
    }

    @ExceptionHandler(NoResourceFoundException.class)
    public ResponseEntity<ErrorResponse> handleNoResource(NoResourceFoundException ex, HttpServletRequest request) {
        log.warn("No handler for path: {}", request.getRequestURI());
        return build(HttpStatus.NOT_FOUND, "No resource at " + request.getRequestURI(), request, null);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGeneric(Exception ex, HttpServletRequest request) {
        log.error("Unexpected error: {}", ex.getMessage(), ex);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, "Unexpected error: " + ex.getMessage(), request, null);
    }

    private ResponseEntity<ErrorResponse> build(HttpStatus status, String message, HttpServletRequest request,
                                                Map<String, Object> details) {
        ErrorResponse body = ErrorResponse.builder()
            .status(status.value())
            .error(status.getReasonPhrase())
            .message(message)
            .path(request.getRequestURI())
            .timestamp(LocalDateTime.now())
            .details(details)
            .build();
        return ResponseEntity.status(status).body(body);
    }
}
