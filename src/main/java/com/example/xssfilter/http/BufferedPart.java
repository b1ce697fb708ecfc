package com.example.xssfilter.http;

import com.example.xssfilter.codec.MultipartCodec;
import com.example.xssfilter.models.MultipartPart;
import com.example.xssfilter.models.MultipartPart.FieldPart;
import com.example.xssfilter.models.MultipartPart.FilePart;
import jakarta.servlet.http.Part;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import org.springframework.http.HttpHeaders;

/**
 * Servlet {@link Part} over an in-memory, already sanitized multipart section, so that
 * multipart resolvers downstream read the rewritten body instead of the consumed original.
 */
class BufferedPart implements Part {

    private final MultipartPart part;
    private final byte[] content;

    BufferedPart(MultipartPart part) {
        this.part = part;
        this.content = part instanceof FilePart file
                ? file.rawBytes()
                : ((FieldPart) part).text().getBytes(StandardCharsets.UTF_8);
    }

    @Override
    public InputStream getInputStream() {
        return new ByteArrayInputStream(content);
    }

    @Override
    public String getContentType() {
        return part instanceof FilePart file ? file.contentType() : null;
    }

    @Override
    public String getName() {
        return part.fieldName();
    }

    @Override
    public String getSubmittedFileName() {
        return part instanceof FilePart file ? file.fileName() : null;
    }

    @Override
    public long getSize() {
        return content.length;
    }

    @Override
    public void write(String fileName) throws IOException {
        Files.write(Path.of(fileName), content);
    }

    @Override
    public void delete() {
        // Nothing on disk.
    }

    @Override
    public String getHeader(String name) {
        switch (name.toLowerCase(Locale.ROOT)) {
            case "content-disposition" -> {
                return MultipartCodec.contentDisposition(part);
            }
            case "content-type" -> {
                return getContentType();
            }
            default -> {
                return null;
            }
        }
    }

    @Override
    public Collection<String> getHeaders(String name) {
        String value = getHeader(name);
        return value == null ? List.of() : List.of(value);
    }

    @Override
    public Collection<String> getHeaderNames() {
        List<String> names = new ArrayList<>();
        names.add(HttpHeaders.CONTENT_DISPOSITION);
        if (getContentType() != null) {
            names.add(HttpHeaders.CONTENT_TYPE);
        }
        return names;
    }
}
