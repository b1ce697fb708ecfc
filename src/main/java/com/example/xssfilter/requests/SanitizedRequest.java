package com.example.xssfilter.requests;

import com.example.xssfilter.models.MultipartPart;
import java.util.List;

/**
 * Outcome of request sanitization. A {@code null} body or query string means "leave the original
 * as is". {@code parts} is only set for multipart bodies and holds the sections after sanitizing.
 */
public record SanitizedRequest(
        byte[] body,
        String queryString,
        List<MultipartPart> parts,
        Route route
) {

    public enum Route {
        JSON,
        FORM,
        MULTIPART,
        QUERY,
        PASS_THROUGH
    }

    public SanitizedRequest {
        parts = parts == null ? null : List.copyOf(parts);
    }

    public static SanitizedRequest passThrough() {
        return new SanitizedRequest(null, null, null, Route.PASS_THROUGH);
    }

    public static SanitizedRequest body(byte[] body, Route route) {
        return new SanitizedRequest(body, null, null, route);
    }

    public static SanitizedRequest multipart(byte[] body, List<MultipartPart> parts) {
        return new SanitizedRequest(body, null, parts, Route.MULTIPART);
    }

    public static SanitizedRequest query(String queryString) {
        return new SanitizedRequest(null, queryString, null, Route.QUERY);
    }

    public boolean replacesBody() {
        return body != null;
    }

    public boolean replacesQuery() {
        return queryString != null;
    }
}
