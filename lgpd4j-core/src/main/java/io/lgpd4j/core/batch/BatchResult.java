/*
 * Copyright (c) 2025 Lgpd4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.lgpd4j.core.batch;

import io.lgpd4j.core.api.model.DetectionResult;
import java.util.List;

/** Results in input order, plus the summary. */
public record BatchResult(List<DetectionResult> results, BatchSummary summary) {
    public BatchResult {
        results = List.copyOf(results);
    }
}
