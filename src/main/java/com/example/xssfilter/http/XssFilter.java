package com.example.xssfilter.http;

import com.example.xssfilter.config.XssFilterProperties;
import com.example.xssfilter.requests.InterceptedRequest;
import com.example.xssfilter.requests.SanitizedRequest;
import com.example.xssfilter.service.SanitizationService;
import com.example.xssfilter.service.XssFilterException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.AntPathMatcher;
import org.springframework.util.StreamUtils;
import org.springframework.web.filter.OncePerRequestFilter;
import org.springframework.web.util.ContentCachingResponseWrapper;

/**
 * Sanitizes request bodies and query strings before the handler runs, and JSON response bodies
 * after it returns. A body that cannot be decoded stops the request with 400; a JSON response
 * that cannot be decoded is replaced by a 500 so unsanitized output never reaches the client.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 100)
@ConditionalOnProperty(value = "xss.filter.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class XssFilter extends OncePerRequestFilter {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final AntPathMatcher PATH_MATCHER = new AntPathMatcher();

    private final SanitizationService sanitizationService;
    private final XssFilterProperties properties;

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        String path = request.getRequestURI().substring(request.getContextPath().length());
        for (String pattern : properties.getExcludePaths()) {
            if (PATH_MATCHER.match(pattern, path)) {
                return true;
            }
        }
        return false;
    }

    @Override
    protected void doFilterInternal(HttpServletRequest req, HttpServletResponse res, FilterChain chain)
            throws IOException, ServletException {
        HttpServletRequest sanitizedReq;
        try {
            sanitizedReq = sanitizeRequest(req);
        } catch (XssFilterException ex) {
            log.warn("Rejected {} {}: {} ({})", req.getMethod(), req.getRequestURI(), ex.getCode(), ex.getMessage());
            writeError(res, HttpStatus.BAD_REQUEST, ex);
            return;
        }

        if (!properties.isSanitizeResponses()) {
            chain.doFilter(sanitizedReq, res);
            return;
        }

        ContentCachingResponseWrapper cachedRes = new ContentCachingResponseWrapper(res);
        chain.doFilter(sanitizedReq, cachedRes);

        byte[] written = cachedRes.getContentAsByteArray();
        byte[] rewritten;
        try {
            rewritten = sanitizationService.sanitizeResponse(cachedRes.getContentType(), written);
        } catch (XssFilterException ex) {
            log.error("Failed to sanitize response for {} {}: {}", req.getMethod(), req.getRequestURI(), ex.getCode(), ex);
            cachedRes.resetBuffer();
            res.reset();
            writeError(res, HttpStatus.INTERNAL_SERVER_ERROR, ex);
            return;
        }
        if (rewritten != written) {
            cachedRes.resetBuffer();
            cachedRes.getOutputStream().write(rewritten);
        }
        cachedRes.copyBodyToResponse();
    }

    private HttpServletRequest sanitizeRequest(HttpServletRequest req) throws IOException {
        byte[] body = null;
        if (sanitizationService.inspectsBody(req.getMethod(), req.getContentType())) {
            body = StreamUtils.copyToByteArray(req.getInputStream());
        }
        InterceptedRequest intercepted = new InterceptedRequest(
                req.getMethod(), req.getContentType(), req.getContentLengthLong(), req.getQueryString(), body);
        SanitizedRequest sanitized = sanitizationService.sanitizeRequest(intercepted);
        log.debug("{} {} routed to {}", req.getMethod(), req.getRequestURI(), sanitized.route());

        if (body == null && !sanitized.replacesQuery()) {
            return req;
        }
        // Once read, the original stream is gone, so pass-through bodies are replayed as buffered.
        byte[] replayed = sanitized.replacesBody() ? sanitized.body() : body;
        return new SanitizedRequestWrapper(req, replayed, sanitized.queryString(), sanitized.parts());
    }

    private static void writeError(HttpServletResponse res, HttpStatus status, XssFilterException ex)
            throws IOException {
        res.setStatus(status.value());
        res.setContentType(MediaType.APPLICATION_JSON_VALUE);
        res.getOutputStream().write(MAPPER.writeValueAsBytes(Map.of(
                "code", ex.getCode().name(),
                "message", ex.getMessage())));
    }
}
