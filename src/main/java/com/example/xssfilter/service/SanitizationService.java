package com.example.xssfilter.service;

import com.example.xssfilter.codec.FormCodec;
import com.example.xssfilter.codec.JsonCodec;
import com.example.xssfilter.codec.MultipartCodec;
import com.example.xssfilter.codec.QueryRewriter;
import com.example.xssfilter.models.MultipartPart;
import com.example.xssfilter.requests.InterceptedRequest;
import com.example.xssfilter.requests.SanitizedRequest;
import com.example.xssfilter.requests.SanitizedRequest.Route;
import com.example.xssfilter.sanitize.FieldPolicy;
import java.io.ByteArrayInputStream;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.InvalidMediaTypeException;
import org.springframework.http.MediaType;

/**
 * Picks the codec for an intercepted request or response and runs it. Shared by every request
 * thread; holds nothing but the read-only {@link FieldPolicy} and stateless codecs.
 */
@Slf4j
public class SanitizationService {

    private static final String MULTIPART_FORM_DATA = "multipart/form-data";
    private static final Set<String> BODY_METHODS = Set.of("POST", "PUT", "PATCH");

    private final FieldPolicy policy;
    private final JsonCodec jsonCodec = new JsonCodec();
    private final FormCodec formCodec = new FormCodec();
    private final QueryRewriter queryRewriter = new QueryRewriter();
    private final MultipartCodec multipartCodec;

    public SanitizationService(FieldPolicy policy) {
        this(policy, MultipartCodec.DEFAULT_MAX_PARTS);
    }

    public SanitizationService(FieldPolicy policy, int maxMultipartParts) {
        this.policy = Objects.requireNonNull(policy, "policy");
        this.multipartCodec = new MultipartCodec(maxMultipartParts);
    }

    public SanitizedRequest sanitizeRequest(InterceptedRequest request) {
        switch (request.method().toUpperCase(Locale.ROOT)) {
            case "POST", "PUT", "PATCH" -> {
                return sanitizeBody(request);
            }
            case "GET" -> {
                if (request.queryString() == null || request.queryString().isEmpty()) {
                    return SanitizedRequest.passThrough();
                }
                return SanitizedRequest.query(queryRewriter.rewrite(request.queryString(), policy));
            }
            default -> {
                return SanitizedRequest.passThrough();
            }
        }
    }

    /**
     * Whether {@link #sanitizeRequest} would look at the body, so callers only buffer bodies that
     * get rewritten.
     */
    public boolean inspectsBody(String method, String contentType) {
        if (method == null || contentType == null || !BODY_METHODS.contains(method.toUpperCase(Locale.ROOT))) {
            return false;
        }
        String lower = contentType.toLowerCase(Locale.ROOT);
        return lower.contains(MULTIPART_FORM_DATA)
                || lower.contains(MediaType.APPLICATION_JSON_VALUE)
                || lower.contains(MediaType.APPLICATION_FORM_URLENCODED_VALUE);
    }

    /**
     * Rewrites a JSON response body. Any other content type, and an empty body, is returned as is.
     */
    public byte[] sanitizeResponse(String contentType, byte[] body) {
        if (contentType == null || body == null || body.length == 0
                || !contentType.toLowerCase(Locale.ROOT).contains(MediaType.APPLICATION_JSON_VALUE)) {
            return body;
        }
        return jsonCodec.sanitize(body, policy);
    }

    private SanitizedRequest sanitizeBody(InterceptedRequest request) {
        String contentType = request.contentType();
        if (contentType == null || contentType.isBlank()) {
            return SanitizedRequest.passThrough();
        }
        if (contentType.toLowerCase(Locale.ROOT).contains(MULTIPART_FORM_DATA)) {
            String boundary = MultipartCodec.boundaryOf(contentType);
            log.debug("Sanitizing multipart body ({} bytes)", request.body().length);
            List<MultipartPart> parts = multipartCodec.apply(
                    multipartCodec.decode(new ByteArrayInputStream(request.body()), boundary), policy);
            return SanitizedRequest.multipart(multipartCodec.write(parts, boundary), parts);
        }

        MediaType mediaType;
        try {
            mediaType = MediaType.parseMediaType(contentType);
        } catch (InvalidMediaTypeException ex) {
            log.debug("Unparseable content type {}, body left as is", contentType);
            return SanitizedRequest.passThrough();
        }

        if (MediaType.APPLICATION_JSON.equalsTypeAndSubtype(mediaType)) {
            // A declared length of 0 or 1 cannot hold a JSON object; -1 means not declared.
            if ((request.contentLength() >= 0 && request.contentLength() <= 1) || request.body().length <= 1) {
                return SanitizedRequest.passThrough();
            }
            log.debug("Sanitizing JSON body ({} bytes)", request.body().length);
            return SanitizedRequest.body(jsonCodec.sanitize(request.body(), policy), Route.JSON);
        }
        if (MediaType.APPLICATION_FORM_URLENCODED.equalsTypeAndSubtype(mediaType)) {
            log.debug("Sanitizing form body ({} bytes)", request.body().length);
            return SanitizedRequest.body(formCodec.sanitize(request.body(), policy), Route.FORM);
        }
        return SanitizedRequest.passThrough();
    }
}
