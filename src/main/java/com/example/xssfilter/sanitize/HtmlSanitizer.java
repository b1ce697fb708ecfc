package com.example.xssfilter.sanitize;

/**
 * Removes disallowed markup from a piece of text. Implementations must be side-effect free and
 * safe to call from many request threads at once.
 */
@FunctionalInterface
public interface HtmlSanitizer {

    String sanitize(String text);
}
