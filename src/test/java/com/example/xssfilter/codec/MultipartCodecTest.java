package com.example.xssfilter.codec;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.example.xssfilter.models.MultipartPart;
import com.example.xssfilter.models.MultipartPart.FieldPart;
import com.example.xssfilter.models.MultipartPart.FilePart;
import com.example.xssfilter.sanitize.FieldPolicy;
import com.example.xssfilter.sanitize.JsoupHtmlSanitizer;
import com.example.xssfilter.service.XssFilterException;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class MultipartCodecTest {

    private static final String BOUNDARY = "----XssBoundary7MA4YWxk";
    private static final FieldPolicy POLICY = FieldPolicy.of(JsoupHtmlSanitizer.strict(), "password");

    private final MultipartCodec codec = new MultipartCodec();

    /** Builds a body the way a browser would frame it. */
    private static final class BodyBuilder {
        private final ByteArrayOutputStream out = new ByteArrayOutputStream();

        BodyBuilder field(String name, String value) {
            text("--" + BOUNDARY + "\r\n");
            text("Content-Disposition: form-data; name=\"" + name + "\"\r\n\r\n");
            text(value + "\r\n");
            return this;
        }

        BodyBuilder file(String name, String fileName, String contentType, byte[] content) {
            text("--" + BOUNDARY + "\r\n");
            text("Content-Disposition: form-data; name=\"" + name + "\"; filename=\"" + fileName + "\"\r\n");
            if (contentType != null) {
                text("Content-Type: " + contentType + "\r\n");
            }
            text("\r\n");
            out.writeBytes(content);
            text("\r\n");
            return this;
        }

        byte[] close() {
            text("--" + BOUNDARY + "--\r\n");
            return out.toByteArray();
        }

        private void text(String s) {
            out.writeBytes(s.getBytes(StandardCharsets.UTF_8));
        }
    }

    private List<MultipartPart> decode(byte[] body) {
        return codec.decode(new ByteArrayInputStream(body), BOUNDARY);
    }

    @Test
    @DisplayName("File bytes survive unchanged while the text part loses its markup")
    void fileAndFieldRoundTrip() {
        byte[] body = new BodyBuilder()
                .file("upload", "a.txt", "text/plain", "hello".getBytes(StandardCharsets.UTF_8))
                .field("bio", "<img onerror=x>")
                .close();

        byte[] out = codec.sanitize(new ByteArrayInputStream(body), BOUNDARY, POLICY);

        String expected = "--" + BOUNDARY + "\r\n"
                + "Content-Disposition: form-data; name=\"upload\"; filename=\"a.txt\"\r\n"
                + "Content-Type: text/plain\r\n\r\n"
                + "hello\r\n"
                + "--" + BOUNDARY + "\r\n"
                + "Content-Disposition: form-data; name=\"bio\"\r\n\r\n"
                + "\r\n"
                + "--" + BOUNDARY + "--\r\n";
        assertEquals(expected, new String(out, StandardCharsets.UTF_8));
    }

    @Test
    @DisplayName("Binary file content is never passed to the sanitizer")
    void binaryFileUntouched() {
        byte[] binary = new byte[256];
        for (int i = 0; i < binary.length; i++) {
            binary[i] = (byte) i;
        }
        byte[] markup = "<script>alert(1)</script>".getBytes(StandardCharsets.UTF_8);
        byte[] body = new BodyBuilder()
                .file("blob", "data.bin", null, binary)
                .file("page", "page.html", "text/html", markup)
                .close();

        List<MultipartPart> parts = decode(codec.sanitize(new ByteArrayInputStream(body), BOUNDARY, POLICY));

        FilePart blob = assertInstanceOf(FilePart.class, parts.get(0));
        assertEquals("application/octet-stream", blob.contentType());
        assertArrayEquals(binary, blob.rawBytes());
        FilePart page = assertInstanceOf(FilePart.class, parts.get(1));
        assertArrayEquals(markup, page.rawBytes());
    }

    @Test
    @DisplayName("Decode keeps part order and metadata")
    void decodesParts() {
        byte[] body = new BodyBuilder()
                .field("title", "Hi <b>there</b>")
                .file("avatar", "me.png", "image/png", new byte[] {1, 2, 3})
                .field("password", "<b>pw</b>")
                .close();

        List<MultipartPart> parts = decode(body);

        assertEquals(List.of(
                new FieldPart("title", "Hi <b>there</b>"),
                new FilePart("avatar", "me.png", "image/png", new byte[] {1, 2, 3}),
                new FieldPart("password", "<b>pw</b>")), parts);
    }

    @Test
    @DisplayName("Skipped field names keep their markup")
    void skipsConfiguredFields() {
        List<MultipartPart> parts = codec.apply(List.of(
                new FieldPart("title", "Hi <b>there</b>"),
                new FieldPart("password", "<b>pw</b>")), POLICY);

        assertEquals(List.of(new FieldPart("title", "Hi there"), new FieldPart("password", "<b>pw</b>")), parts);
    }

    @Test
    @DisplayName("Reading stops silently at the part cap")
    void stopsAtPartCap() {
        BodyBuilder builder = new BodyBuilder();
        for (int i = 0; i < MultipartCodec.DEFAULT_MAX_PARTS + 5; i++) {
            builder.field("f" + i, "v" + i);
        }

        List<MultipartPart> parts = decode(builder.close());

        assertEquals(MultipartCodec.DEFAULT_MAX_PARTS, parts.size());
        assertEquals(new FieldPart("f99", "v99"), parts.get(99));
    }

    @Test
    @DisplayName("A section with no content aborts the whole body")
    void emptyPartIsAnError() {
        byte[] body = new BodyBuilder()
                .field("name", "bob")
                .field("nickname", "")
                .close();

        XssFilterException ex = assertThrows(XssFilterException.class, () -> decode(body));
        assertEquals(XssFilterException.Code.EMPTY_PART, ex.getCode());
    }

    @Test
    @DisplayName("Truncated body is reported as malformed")
    void truncatedBody() {
        byte[] body = ("--" + BOUNDARY + "\r\nContent-Disposition: form-data; name=\"a\"\r\n\r\nvalue")
                .getBytes(StandardCharsets.UTF_8);

        XssFilterException ex = assertThrows(XssFilterException.class, () -> decode(body));
        assertEquals(XssFilterException.Code.MALFORMED_MULTIPART, ex.getCode());
    }

    @Test
    @DisplayName("Body without any boundary yields only the closing delimiter")
    void noPartsFound() {
        byte[] out = codec.sanitize(
                new ByteArrayInputStream("nothing here".getBytes(StandardCharsets.UTF_8)), BOUNDARY, POLICY);

        assertEquals("--" + BOUNDARY + "--\r\n", new String(out, StandardCharsets.UTF_8));
    }

    @Test
    @DisplayName("Boundary is read from the content type, quoted or not")
    void boundaryFromContentType() {
        assertEquals("abc123", MultipartCodec.boundaryOf("multipart/form-data; boundary=abc123"));
        assertEquals("abc123", MultipartCodec.boundaryOf("multipart/form-data; charset=UTF-8; boundary=\"abc123\""));

        XssFilterException ex = assertThrows(XssFilterException.class,
                () -> MultipartCodec.boundaryOf("multipart/form-data"));
        assertEquals(XssFilterException.Code.MALFORMED_MULTIPART, ex.getCode());
    }
}
