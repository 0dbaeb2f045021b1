package com.hotpreview.dispatch.api;

import com.hotpreview.core.events.ChannelRejectedException;
import com.hotpreview.core.model.PreviewException;
import com.hotpreview.core.registry.ProjectConfigurationException;
import com.hotpreview.core.registry.ProjectNotFoundException;
import com.hotpreview.core.server.PortUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;

@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(ProjectNotFoundException.class)
    @ResponseStatus(HttpStatus.NOT_FOUND)
    public Map<String, Object> handleNotFound(ProjectNotFoundException e) {
        return body("NOT_FOUND", e);
    }

    @ExceptionHandler({ProjectConfigurationException.class, IllegalArgumentException.class})
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleBadRequest(RuntimeException e) {
        return body("BAD_REQUEST", e);
    }

    @ExceptionHandler(ChannelRejectedException.class)
    @ResponseStatus(HttpStatus.CONFLICT)
    public Map<String, Object> handleChannelRejected(ChannelRejectedException e) {
        return body("CHANNEL_REJECTED", e);
    }

    @ExceptionHandler(PortUnavailableException.class)
    public ResponseEntity<Map<String, Object>> handlePortUnavailable(PortUnavailableException e) {
        log.warn("Registration failed, no port available: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .header("Retry-After", "1")
                .body(body("PORT_UNAVAILABLE", e));
    }

    @ExceptionHandler(PreviewException.class)
    @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
    public Map<String, Object> handlePreviewFailure(PreviewException e) {
        log.error("Preview operation failed", e);
        return body("PREVIEW_ERROR", e);
    }

    private static Map<String, Object> body(String error, RuntimeException e) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", error);
        body.put("message", e.getMessage() == null ? "" : e.getMessage());
        body.put("retryable", e instanceof PreviewException pe && pe.isRetryable());
        return body;
    }
}
