package com.example.xssfilter.codec;

import com.example.xssfilter.models.FormPairs;
import com.example.xssfilter.sanitize.FieldPolicy;

public class QueryRewriter {

    /**
     * Returns the query string with every value of each non-skipped parameter sanitized. Key
     * order and repeated occurrences are preserved.
     */
    public String rewrite(String rawQuery, FieldPolicy policy) {
        if (rawQuery == null || rawQuery.isEmpty()) {
            return rawQuery;
        }
        FormPairs params = FormPairs.parse(rawQuery);
        for (String key : params.keys()) {
            if (!policy.isSkipped(key)) {
                params.replaceValues(key, policy::sanitize);
            }
        }
        return params.encode();
    }
}
