package com.example.xssfilter.codec;

import com.example.xssfilter.models.MultipartPart;
import com.example.xssfilter.models.MultipartPart.FieldPart;
import com.example.xssfilter.models.MultipartPart.FilePart;
import com.example.xssfilter.sanitize.FieldPolicy;
import com.example.xssfilter.service.XssFilterException;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.fileupload.MultipartStream;
import org.apache.commons.fileupload.ParameterParser;
import org.springframework.http.InvalidMediaTypeException;
import org.springframework.http.MediaType;

/**
 * Reads a {@code multipart/form-data} body section by section and writes it back with text
 * fields sanitized. File sections are copied byte for byte.
 */
@Slf4j
public class MultipartCodec {

    public static final int DEFAULT_MAX_PARTS = 100;

    private static final int BUFFER_SIZE = 4096;
    private static final String CRLF = "\r\n";

    private final int maxParts;

    public MultipartCodec() {
        this(DEFAULT_MAX_PARTS);
    }

    public MultipartCodec(int maxParts) {
        if (maxParts < 1) {
            throw new IllegalArgumentException("maxParts must be positive");
        }
        this.maxParts = maxParts;
    }

    public static String boundaryOf(String contentType) {
        String boundary;
        try {
            boundary = MediaType.parseMediaType(contentType).getParameter("boundary");
        } catch (InvalidMediaTypeException ex) {
            throw XssFilterException.malformedMultipart("invalid content type", ex);
        }
        if (boundary != null && boundary.length() >= 2 && boundary.startsWith("\"") && boundary.endsWith("\"")) {
            boundary = boundary.substring(1, boundary.length() - 1);
        }
        if (boundary == null || boundary.isEmpty()) {
            throw XssFilterException.malformedMultipart("missing boundary", null);
        }
        return boundary;
    }

    public byte[] sanitize(InputStream body, String boundary, FieldPolicy policy) {
        return encode(decode(body, boundary), boundary, policy);
    }

    /**
     * Reads at most {@code maxParts} sections; anything after the cap is left unread.
     */
    public List<MultipartPart> decode(InputStream body, String boundary) {
        MultipartStream stream = new MultipartStream(
                body, boundary.getBytes(StandardCharsets.ISO_8859_1), BUFFER_SIZE, null);
        stream.setHeaderEncoding(StandardCharsets.UTF_8.name());

        List<MultipartPart> parts = new ArrayList<>();
        try {
            boolean next = stream.skipPreamble();
            while (next) {
                if (parts.size() >= maxParts) {
                    log.debug("Multipart body exceeds {} parts, remaining sections dropped", maxParts);
                    break;
                }
                Map<String, String> headers = parseHeaders(stream.readHeaders());
                ByteArrayOutputStream content = new ByteArrayOutputStream();
                stream.readBodyData(content);
                parts.add(toPart(headers, content.toByteArray()));
                next = stream.readBoundary();
            }
        } catch (IOException ex) {
            throw XssFilterException.malformedMultipart(ex.getMessage(), ex);
        }
        return parts;
    }

    public byte[] encode(List<MultipartPart> parts, String boundary, FieldPolicy policy) {
        return write(apply(parts, policy), boundary);
    }

    /**
     * Returns the parts with every non-skipped text field sanitized. File parts are returned as is.
     */
    public List<MultipartPart> apply(List<MultipartPart> parts, FieldPolicy policy) {
        List<MultipartPart> sanitized = new ArrayList<>(parts.size());
        for (MultipartPart part : parts) {
            if (part instanceof FieldPart field) {
                sanitized.add(new FieldPart(field.fieldName(), policy.apply(field.fieldName(), field.text())));
            } else {
                sanitized.add(part);
            }
        }
        return sanitized;
    }

    /**
     * Frames already sanitized parts with {@code boundary}.
     */
    public byte[] write(List<MultipartPart> parts, String boundary) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        for (MultipartPart part : parts) {
            append(out, "--" + boundary + CRLF);
            append(out, "Content-Disposition: " + contentDisposition(part) + CRLF);
            if (part instanceof FilePart file) {
                append(out, "Content-Type: " + file.contentType() + CRLF + CRLF);
                out.writeBytes(file.rawBytes());
            } else if (part instanceof FieldPart field) {
                append(out, CRLF);
                append(out, field.text());
            }
            append(out, CRLF);
        }
        append(out, "--" + boundary + "--" + CRLF);
        return out.toByteArray();
    }

    public static String contentDisposition(MultipartPart part) {
        String disposition = "form-data; name=\"" + escapeQuoted(part.fieldName()) + "\"";
        if (part instanceof FilePart file) {
            disposition += "; filename=\"" + escapeQuoted(file.fileName()) + "\"";
        }
        return disposition;
    }

    private static MultipartPart toPart(Map<String, String> headers, byte[] content) {
        ParameterParser parser = new ParameterParser();
        parser.setLowerCaseNames(true);
        Map<String, String> disposition = parser.parse(headers.getOrDefault("content-disposition", ""), ';');
        String fieldName = disposition.getOrDefault("name", "");
        if (content.length == 0) {
            throw XssFilterException.emptyPart(fieldName);
        }
        String fileName = disposition.get("filename");
        if (fileName != null && !fileName.isEmpty()) {
            return new FilePart(fieldName, fileName, headers.get("content-type"), content);
        }
        return new FieldPart(fieldName, new String(content, StandardCharsets.UTF_8));
    }

    private static Map<String, String> parseHeaders(String block) {
        Map<String, String> headers = new LinkedHashMap<>();
        for (String line : block.split(CRLF)) {
            int colon = line.indexOf(':');
            if (colon > 0) {
                headers.put(line.substring(0, colon).trim().toLowerCase(Locale.ROOT), line.substring(colon + 1).trim());
            }
        }
        return headers;
    }

    // Same escaping browsers apply to form-data names.
    private static String escapeQuoted(String value) {
        return value.replace("\"", "%22").replace("\r", "%0D").replace("\n", "%0A");
    }

    private static void append(ByteArrayOutputStream out, String text) {
        out.writeBytes(text.getBytes(StandardCharsets.UTF_8));
    }
}
