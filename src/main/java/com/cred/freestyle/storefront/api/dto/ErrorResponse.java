package com.cred.freestyle.storefront.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import org.springframework.http.HttpStatus;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Error body returned by every endpoint.
 *
 * {@code kind} names the storefront failure (InsufficientStock, PaymentMismatch, ...) so the
 * presentation adapter can pick a message without parsing {@code message}. It is absent for
 * generic request errors.
 *
 * @author Storefront Team
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorResponse {

    private final Instant timestamp;
    private final int status;
    private final String error;
    private final String message;
    private final String path;
    private String kind;
    private final Map<String, Object> details = new LinkedHashMap<>();

    private ErrorResponse(HttpStatus status, String error, String message, String path) {
        this.timestamp = Instant.now();
        this.status = status.value();
        this.error = error;
        this.message = message;
        this.path = path;
    }

    public static ErrorResponse of(HttpStatus status, String error, String message, String path) {
        return new ErrorResponse(status, error, message, path);
    }

    public ErrorResponse kind(String kind) {
        this.kind = kind;
        return this;
    }

    public ErrorResponse addDetail(String key, Object value) {
        if (value != null) {
            details.put(key, value);
        }
        return this;
    }

    public Instant getTimestamp() { return timestamp; }
    public int getStatus() { return status; }
    public String getError() { return error; }
    public String getMessage() { return message; }
    public String getPath() { return path; }
    public String getKind() { return kind; }
    public Map<String, Object> getDetails() { return details; }
}
