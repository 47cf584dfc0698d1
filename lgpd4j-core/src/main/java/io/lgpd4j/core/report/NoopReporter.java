/*
 * Copyright (c) 2025 Lgpd4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.lgpd4j.core.report;

import io.lgpd4j.core.api.model.DetectionResult;
import java.time.Duration;

public final class NoopReporter implements Reporter {
    @Override
    public void report(DetectionResult result, Duration elapsed) {
        /* no-op */
    }
}
