package com.example.xssfilter.config;

import com.example.xssfilter.codec.MultipartCodec;
import com.example.xssfilter.sanitize.JsoupHtmlSanitizer;
import java.util.ArrayList;
import java.util.List;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration properties for the XSS filter.
 * These values are bound from application.yml (xss.filter.*).
 * The defaults below serve as fallbacks if properties are missing from YAML.
 * Setting skip-fields replaces the default list, so keep "password" in it if it should stay exempt.
 */
@Component
@ConfigurationProperties(prefix = "xss.filter")
@Data
public class XssFilterProperties {

    private boolean enabled = true;
    private List<String> skipFields = new ArrayList<>(List.of("password"));
    private JsoupHtmlSanitizer.Level policy = JsoupHtmlSanitizer.Level.STRICT;
    private boolean sanitizeResponses = true;
    private int maxMultipartParts = MultipartCodec.DEFAULT_MAX_PARTS;
    private List<String> excludePaths = new ArrayList<>();
}
