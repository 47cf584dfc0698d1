/*
 * Copyright (c) 2025 Lgpd4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.lgpd4j.core.report;

import io.lgpd4j.core.api.model.DetectionResult;
import java.time.Duration;

/** Receives every finished detection. Implementations must be thread-safe and must not retain raw values. */
public interface Reporter {
    void report(DetectionResult result, Duration elapsed);
}
