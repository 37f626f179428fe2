package com.stmtobfuscator.domain.obfuscation.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Output of the replacement map builder.
 *
 * @param replacements   original text → masked text, in processing order
 * @param consistencyMap entity hash → masked text, kept for cross-run consistency
 */
public record ReplacementPlan(
        Map<String, String> replacements,
        Map<String, String> consistencyMap
) {
    public ReplacementPlan {
        replacements = Collections.unmodifiableMap(new LinkedHashMap<>(replacements));
        consistencyMap = Collections.unmodifiableMap(new LinkedHashMap<>(consistencyMap));
    }

    public static ReplacementPlan empty() {
        return new ReplacementPlan(Map.of(), Map.of());
    }

    public int size() {
        return replacements.size();
    }

    public boolean isEmpty() {
        return replacements.isEmpty();
    }
}
