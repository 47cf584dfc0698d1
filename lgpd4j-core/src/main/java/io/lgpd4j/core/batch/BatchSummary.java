/*
 * Copyright (c) 2025 Lgpd4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.lgpd4j.core.batch;

import io.lgpd4j.core.api.model.DetectionResult;
import io.lgpd4j.core.api.model.PiiType;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Aggregate over a batch.
 *
 * @param totalProcessed number of texts
 * @param totalWithPii texts classified NON_PUBLIC
 * @param countsByType entity count per type over the whole batch
 */
public record BatchSummary(int totalProcessed, int totalWithPii, Map<PiiType, Integer> countsByType) {
    public BatchSummary {
        Map<PiiType, Integer> copy = new EnumMap<>(PiiType.class);
        copy.putAll(countsByType);
        countsByType = Collections.unmodifiableMap(copy);
    }

    public static BatchSummary of(List<DetectionResult> results) {
        int withPii = 0;
        Map<PiiType, Integer> counts = new EnumMap<>(PiiType.class);
        for (DetectionResult r : results) {
            if (r.hasPii()) withPii++;
            r.countsByType().forEach((t, n) -> counts.merge(t, n, Integer::sum));
        }
        return new BatchSummary(results.size(), withPii, counts);
    }
}
