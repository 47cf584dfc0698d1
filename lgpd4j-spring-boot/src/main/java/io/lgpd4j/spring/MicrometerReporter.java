/*
 * Copyright (c) 2025 Lgpd4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.lgpd4j.spring;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.lgpd4j.core.api.model.DetectionResult;
import io.lgpd4j.core.api.model.Entity;
import io.lgpd4j.core.api.model.Finding;
import io.lgpd4j.core.report.Reporter;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/** Counters per type/classification plus a bounded ring of recent findings (type, offsets, confidence; no values). */
public final class MicrometerReporter implements Reporter {
    public static final String PII_DETECTED = "lgpd4j_pii_detected_total";
    public static final String DETECTIONS = "lgpd4j_detections_total";
    public static final String CONTEXTUAL_DEGRADED = "lgpd4j_contextual_degraded_total";
    public static final String DETECTION_TIMER = "lgpd4j_detection_seconds";

    private final MeterRegistry registry;
    private final Deque<Finding> ring = new ArrayDeque<>();
    private final int capacity;

    @SuppressFBWarnings(
            value = "EI_EXPOSE_REP2",
            justification = "MeterRegistry is a framework-managed, thread-safe component and is not exposed.")
    public MicrometerReporter(MeterRegistry registry, int capacity) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.capacity = Math.max(10, capacity);
    }

    @Override
    public synchronized void report(DetectionResult result, Duration elapsed) {
        if (result == null) return;
        registry.counter(DETECTIONS, "classification", result.classification().name(), "mode", result.mode())
                .increment();
        registry.timer(DETECTION_TIMER, "mode", result.mode()).record(elapsed);
        if (result.metadata().contextualDegraded()) registry.counter(CONTEXTUAL_DEGRADED).increment();
        for (Entity e : result.entities()) {
            registry.counter(PII_DETECTED, "type", e.type().name()).increment();
            if (ring.size() >= capacity) ring.removeFirst();
            ring.addLast(Finding.of(e));
        }
    }

    /** Returns an unmodifiable snapshot of the recent findings ring buffer. */
    public synchronized List<Finding> recentFindings() {
        return List.copyOf(ring);
    }

    public int capacity() {
        return capacity;
    }
}
