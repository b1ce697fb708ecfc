package com.example.xssfilter.codec;

import com.example.xssfilter.models.FormPairs;
import com.example.xssfilter.sanitize.FieldPolicy;
import java.nio.charset.StandardCharsets;

/**
 * {@code application/x-www-form-urlencoded} bodies. Every value of a repeated key is kept.
 */
public class FormCodec {

    public byte[] sanitize(byte[] body, FieldPolicy policy) {
        FormPairs pairs = decode(body);
        if (pairs.isEmpty()) {
            return body;
        }
        return encode(pairs, policy);
    }

    public FormPairs decode(byte[] body) {
        return FormPairs.parse(new String(body, StandardCharsets.UTF_8));
    }

    /**
     * Sanitizes {@code pairs} in place and returns the encoded body.
     */
    public byte[] encode(FormPairs pairs, FieldPolicy policy) {
        for (String key : pairs.keys()) {
            if (!policy.isSkipped(key)) {
                pairs.replaceValues(key, policy::sanitize);
            }
        }
        return pairs.encode().getBytes(StandardCharsets.UTF_8);
    }
}
