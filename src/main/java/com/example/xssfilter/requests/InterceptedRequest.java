package com.example.xssfilter.requests;

import java.util.Objects;

/**
 * Framework-neutral view of an intercepted request: what the dispatcher needs to pick a codec.
 * {@code contentLength} is -1 when the client did not declare one.
 */
public record InterceptedRequest(
        String method,
        String contentType,
        long contentLength,
        String queryString,
        byte[] body
) {

    public InterceptedRequest {
        Objects.requireNonNull(method, "method");
        if (method.isBlank()) {
            throw new IllegalArgumentException("method must be non-blank");
        }
        body = body == null ? new byte[0] : body;
    }

    public static InterceptedRequest get(String queryString) {
        return new InterceptedRequest("GET", null, -1, queryString, null);
    }

    public static InterceptedRequest withBody(String method, String contentType, byte[] body) {
        return new InterceptedRequest(method, contentType, body == null ? -1 : body.length, null, body);
    }
}
