package io.workline.core.outbox;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

public record OutboxStats(int pending, int due, int dead, Map<Integer, Integer> retryDistribution) {
    public OutboxStats {
        retryDistribution = retryDistribution == null ? Map.of() : Collections.unmodifiableMap(new TreeMap<>(retryDistribution));
    }
}
