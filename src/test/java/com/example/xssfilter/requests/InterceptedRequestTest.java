package com.example.xssfilter.requests;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.example.xssfilter.models.MultipartPart;
import com.example.xssfilter.models.MultipartPart.FieldPart;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class InterceptedRequestTest {

    @Test
    @DisplayName("Method must be present and non-blank")
    void rejectsBlankMethod() {
        assertThrows(NullPointerException.class, () -> new InterceptedRequest(null, null, -1, null, null));
        assertThrows(IllegalArgumentException.class, () -> new InterceptedRequest(" ", null, -1, null, null));
    }

    @Test
    @DisplayName("Missing body reads as empty")
    void nullBodyIsEmpty() {
        InterceptedRequest request = InterceptedRequest.get("a=1");

        assertEquals(0, request.body().length);
        assertEquals(-1, request.contentLength());
        assertEquals("GET", request.method());
    }

    @Test
    @DisplayName("withBody declares the body length")
    void withBodyLength() {
        assertEquals(3, InterceptedRequest.withBody("POST", "text/plain", new byte[3]).contentLength());
    }

    @Test
    @DisplayName("Sanitized outcomes report what they replace")
    void sanitizedOutcome() {
        List<MultipartPart> parts = new ArrayList<>(List.of(new FieldPart("a", "b")));
        SanitizedRequest multipart = SanitizedRequest.multipart(new byte[] {1}, parts);
        parts.clear();

        assertTrue(multipart.replacesBody());
        assertFalse(multipart.replacesQuery());
        assertEquals(1, multipart.parts().size());

        SanitizedRequest query = SanitizedRequest.query("q=");
        assertTrue(query.replacesQuery());
        assertNull(query.parts());
        assertFalse(SanitizedRequest.passThrough().replacesBody());
    }
}
