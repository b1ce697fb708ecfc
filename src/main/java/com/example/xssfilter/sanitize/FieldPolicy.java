package com.example.xssfilter.sanitize;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Decides per field name whether a value is sanitized or passed through verbatim. Built once at
 * startup and shared read-only by every request; all codecs consult the same instance.
 */
public final class FieldPolicy {

    private final Set<String> skipFields;
    private final HtmlSanitizer sanitizer;

    public FieldPolicy(Collection<String> skipFields, HtmlSanitizer sanitizer) {
        Objects.requireNonNull(skipFields, "skipFields");
        this.skipFields = Collections.unmodifiableSet(new LinkedHashSet<>(skipFields));
        this.sanitizer = Objects.requireNonNull(sanitizer, "sanitizer");
    }

    public static FieldPolicy of(HtmlSanitizer sanitizer, String... skipFields) {
        return new FieldPolicy(Arrays.asList(skipFields), sanitizer);
    }

    /**
     * Exact, case-sensitive match against the skip set.
     */
    public boolean isSkipped(String fieldName) {
        return fieldName != null && skipFields.contains(fieldName);
    }

    public String sanitize(String text) {
        return sanitizer.sanitize(text);
    }

    public String apply(String fieldName, String text) {
        return isSkipped(fieldName) ? text : sanitize(text);
    }

    public Set<String> getSkipFields() {
        return skipFields;
    }
}
