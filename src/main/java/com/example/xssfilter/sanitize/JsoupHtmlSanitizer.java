package com.example.xssfilter.sanitize;

import java.util.Objects;
import java.util.function.Supplier;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.safety.Safelist;

/**
 * {@link HtmlSanitizer} backed by jsoup's cleaner. Output is not pretty printed so that plain text
 * (including whitespace) survives unchanged apart from entity escaping.
 */
public class JsoupHtmlSanitizer implements HtmlSanitizer {

    public enum Level {
        /** No tags at all; text content only. */
        STRICT(Safelist::none),
        BASIC(Safelist::basic),
        BASIC_WITH_IMAGES(Safelist::basicWithImages),
        RELAXED(Safelist::relaxed);

        private final Supplier<Safelist> factory;

        Level(Supplier<Safelist> factory) {
            this.factory = factory;
        }

        Safelist safelist() {
            return factory.get();
        }
    }

    private final Safelist safelist;

    public JsoupHtmlSanitizer(Level level) {
        this(Objects.requireNonNull(level, "level").safelist());
    }

    public JsoupHtmlSanitizer(Safelist safelist) {
        this.safelist = Objects.requireNonNull(safelist, "safelist");
    }

    public static JsoupHtmlSanitizer strict() {
        return new JsoupHtmlSanitizer(Level.STRICT);
    }

    @Override
    public String sanitize(String text) {
        if (text == null || text.isEmpty()) {
            return text;
        }
        // OutputSettings caches a charset encoder, so it is not shared between threads.
        return Jsoup.clean(text, "", safelist, new Document.OutputSettings().prettyPrint(false));
    }
}
