package com.example.xssfilter.config;

import com.example.xssfilter.sanitize.FieldPolicy;
import com.example.xssfilter.sanitize.HtmlSanitizer;
import com.example.xssfilter.sanitize.JsoupHtmlSanitizer;
import com.example.xssfilter.service.SanitizationService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@Slf4j
public class SanitizerConfig {

    @Bean
    public HtmlSanitizer htmlSanitizer(XssFilterProperties properties) {
        return new JsoupHtmlSanitizer(properties.getPolicy());
    }

    @Bean
    public FieldPolicy fieldPolicy(XssFilterProperties properties, HtmlSanitizer htmlSanitizer) {
        log.info("XSS field policy: sanitizer={}, skip-fields={}",
                properties.getPolicy(), properties.getSkipFields());
        return new FieldPolicy(properties.getSkipFields(), htmlSanitizer);
    }

    @Bean
    public SanitizationService sanitizationService(FieldPolicy fieldPolicy, XssFilterProperties properties) {
        return new SanitizationService(fieldPolicy, properties.getMaxMultipartParts());
    }
}
