package io.workline.core.conversation;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Heuristic reading of one utterance.
 *
 * @param score adversarial signal for this utterance alone, 0 to 10
 * @param gapReason set when the caller explains time spent not working
 */
public record Classification(
    double score,
    Map<String, List<String>> fields,
    List<Integer> years,
    String gapReason,
    boolean terminationIntent
) {
    public Classification {
        score = Math.max(0.0, Math.min(10.0, score));
        Map<String, List<String>> copy = new LinkedHashMap<>();
        if (fields != null) {
            fields.forEach((name, values) -> copy.put(name, values == null ? List.of() : List.copyOf(values)));
        }
        fields = Collections.unmodifiableMap(copy);
        years = years == null ? List.of() : List.copyOf(years);
        gapReason = gapReason == null ? "" : gapReason;
    }

    public List<String> values(String field) {
        return fields.getOrDefault(field, List.of());
    }

    public String first(String field) {
        List<String> values = values(field);
        return values.isEmpty() ? null : values.get(0);
    }
}
