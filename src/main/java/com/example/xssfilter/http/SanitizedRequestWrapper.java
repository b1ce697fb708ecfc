package com.example.xssfilter.http;

import com.example.xssfilter.models.FormPairs;
import com.example.xssfilter.models.MultipartPart;
import jakarta.servlet.ReadListener;
import jakarta.servlet.ServletException;
import jakarta.servlet.ServletInputStream;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletRequestWrapper;
import jakarta.servlet.http.Part;
import java.io.BufferedReader;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Enumeration;
import java.util.List;
import java.util.Map;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;

/**
 * Request view that downstream handlers see instead of the original. It replays the buffered
 * (possibly rewritten) body and the rewritten query string, and derives parameters and multipart
 * parts from them.
 */
public class SanitizedRequestWrapper extends HttpServletRequestWrapper {

    private final byte[] body;
    private final String queryString;
    private final List<MultipartPart> parts;
    private Map<String, String[]> parameters;

    /**
     * @param body        replacement body, or {@code null} to read the original stream
     * @param queryString replacement query string, or {@code null} to keep the original
     * @param parts       sanitized multipart sections, or {@code null} for other bodies
     */
    public SanitizedRequestWrapper(HttpServletRequest request, byte[] body, String queryString,
                                   List<MultipartPart> parts) {
        super(request);
        this.body = body;
        this.queryString = queryString;
        this.parts = parts;
    }

    @Override
    public ServletInputStream getInputStream() throws IOException {
        if (body == null) {
            return super.getInputStream();
        }
        return new BufferedServletInputStream(body);
    }

    @Override
    public BufferedReader getReader() throws IOException {
        if (body == null) {
            return super.getReader();
        }
        String encoding = getCharacterEncoding();
        Charset charset = encoding != null ? Charset.forName(encoding) : StandardCharsets.UTF_8;
        return new BufferedReader(new InputStreamReader(getInputStream(), charset));
    }

    @Override
    public int getContentLength() {
        return body == null ? super.getContentLength() : body.length;
    }

    @Override
    public long getContentLengthLong() {
        return body == null ? super.getContentLengthLong() : body.length;
    }

    @Override
    public String getHeader(String name) {
        if (body != null && HttpHeaders.CONTENT_LENGTH.equalsIgnoreCase(name)) {
            return Integer.toString(body.length);
        }
        return super.getHeader(name);
    }

    @Override
    public Enumeration<String> getHeaders(String name) {
        if (body != null && HttpHeaders.CONTENT_LENGTH.equalsIgnoreCase(name)) {
            return Collections.enumeration(List.of(Integer.toString(body.length)));
        }
        return super.getHeaders(name);
    }

    @Override
    public String getQueryString() {
        return queryString != null ? queryString : super.getQueryString();
    }

    @Override
    public Collection<Part> getParts() throws IOException, ServletException {
        if (parts == null) {
            return super.getParts();
        }
        List<Part> result = new ArrayList<>(parts.size());
        for (MultipartPart part : parts) {
            result.add(new BufferedPart(part));
        }
        return result;
    }

    @Override
    public Part getPart(String name) throws IOException, ServletException {
        if (parts == null) {
            return super.getPart(name);
        }
        for (MultipartPart part : parts) {
            if (part.fieldName().equals(name)) {
                return new BufferedPart(part);
            }
        }
        return null;
    }

    @Override
    public String getParameter(String name) {
        String[] values = getParameterMap().get(name);
        return values == null || values.length == 0 ? null : values[0];
    }

    @Override
    public String[] getParameterValues(String name) {
        String[] values = getParameterMap().get(name);
        return values == null ? null : values.clone();
    }

    @Override
    public Enumeration<String> getParameterNames() {
        return Collections.enumeration(getParameterMap().keySet());
    }

    @Override
    public Map<String, String[]> getParameterMap() {
        boolean formBody = body != null && isFormBody();
        if (queryString == null && !formBody && parts == null) {
            return super.getParameterMap();
        }
        if (parameters == null) {
            FormPairs pairs = FormPairs.parse(getQueryString());
            if (formBody) {
                FormPairs form = FormPairs.parse(new String(body, StandardCharsets.UTF_8));
                for (String key : form.keys()) {
                    form.get(key).forEach(value -> pairs.add(key, value));
                }
            }
            if (parts != null) {
                for (MultipartPart part : parts) {
                    if (part instanceof MultipartPart.FieldPart field) {
                        pairs.add(field.fieldName(), field.text());
                    }
                }
            }
            parameters = Collections.unmodifiableMap(pairs.toParameterMap());
        }
        return parameters;
    }

    private boolean isFormBody() {
        String contentType = getContentType();
        if (contentType == null) {
            return false;
        }
        try {
            return MediaType.APPLICATION_FORM_URLENCODED.equalsTypeAndSubtype(MediaType.parseMediaType(contentType));
        } catch (IllegalArgumentException ex) {
            return false;
        }
    }

    private static final class BufferedServletInputStream extends ServletInputStream {

        private final ByteArrayInputStream delegate;

        private BufferedServletInputStream(byte[] content) {
            this.delegate = new ByteArrayInputStream(content);
        }

        @Override
        public boolean isFinished() {
            return delegate.available() == 0;
        }

        @Override
        public boolean isReady() {
            return true;
        }

        @Override
        public void setReadListener(ReadListener readListener) {
            throw new UnsupportedOperationException("Buffered request body does not support async reads");
        }

        @Override
        public int read() {
            return delegate.read();
        }

        @Override
        public int read(byte[] b, int off, int len) {
            return delegate.read(b, off, len);
        }
    }
}
