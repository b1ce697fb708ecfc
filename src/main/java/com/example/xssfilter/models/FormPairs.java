package com.example.xssfilter.models;

import com.example.xssfilter.service.XssFilterException;
import java.net.URLDecoder;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.UnaryOperator;

/**
 * Ordered key to multi-value pairs of an {@code application/x-www-form-urlencoded} body or a
 * query string. Repeated keys are grouped under the position of their first occurrence.
 */
public final class FormPairs {

    private final LinkedHashMap<String, List<String>> pairs = new LinkedHashMap<>();

    public static FormPairs parse(String raw) {
        FormPairs result = new FormPairs();
        if (raw == null || raw.isEmpty()) {
            return result;
        }
        for (String segment : raw.split("&")) {
            if (segment.isEmpty()) {
                continue;
            }
            int eq = segment.indexOf('=');
            String key = eq < 0 ? segment : segment.substring(0, eq);
            String value = eq < 0 ? "" : segment.substring(eq + 1);
            result.add(decode(key), decode(value));
        }
        return result;
    }

    public void add(String key, String value) {
        pairs.computeIfAbsent(key, k -> new ArrayList<>()).add(value);
    }

    public List<String> get(String key) {
        List<String> values = pairs.get(key);
        return values == null ? List.of() : Collections.unmodifiableList(values);
    }

    public Set<String> keys() {
        return Collections.unmodifiableSet(pairs.keySet());
    }

    public boolean isEmpty() {
        return pairs.isEmpty();
    }

    /**
     * Replaces every value of {@code key} in place.
     */
    public void replaceValues(String key, UnaryOperator<String> rewrite) {
        List<String> values = pairs.get(key);
        if (values != null) {
            values.replaceAll(rewrite);
        }
    }

    public Map<String, String[]> toParameterMap() {
        Map<String, String[]> map = new LinkedHashMap<>();
        pairs.forEach((key, values) -> map.put(key, values.toArray(new String[0])));
        return map;
    }

    public String encode() {
        StringBuilder out = new StringBuilder();
        for (Map.Entry<String, List<String>> entry : pairs.entrySet()) {
            String key = URLEncoder.encode(entry.getKey(), StandardCharsets.UTF_8);
            for (String value : entry.getValue()) {
                if (out.length() > 0) {
                    out.append('&');
                }
                out.append(key).append('=').append(URLEncoder.encode(value, StandardCharsets.UTF_8));
            }
        }
        return out.toString();
    }

    private static String decode(String encoded) {
        try {
            return URLDecoder.decode(encoded, StandardCharsets.UTF_8);
        } catch (IllegalArgumentException ex) {
            throw XssFilterException.malformedForm(ex.getMessage());
        }
    }

    @Override
    public String toString() {
        return encode();
    }
}
