/*
 * Copyright (c) 2025 Lgpd4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.lgpd4j.spring;

import io.lgpd4j.core.api.PiiDetector;
import io.lgpd4j.core.api.model.ModePolicy;
import java.time.Duration;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Getter
@ConfigurationProperties(prefix = "lgpd4j")
public class Lgpd4jProperties {

    @Setter
    private boolean enabled = true;

    /** strict | balanced | precise */
    @Setter
    private String mode = "balanced";

    private Policy policy = new Policy();
    private Contextual contextual = new Contextual();
    private Batch batch = new Batch();
    private Metrics metrics = new Metrics();

    public void setPolicy(Policy p) {
        this.policy = (p == null) ? new Policy() : p;
    }

    public void setContextual(Contextual c) {
        this.contextual = (c == null) ? new Contextual() : c;
    }

    public void setBatch(Batch b) {
        this.batch = (b == null) ? new Batch() : b;
    }

    public void setMetrics(Metrics m) {
        this.metrics = (m == null) ? new Metrics() : m;
    }

    // ---- nested: policy overrides (null = keep the preset value) ----
    @Getter
    @Setter
    public static final class Policy {
        private Double baseThreshold;
        private Integer afnEntityThreshold;
    }

    // ---- nested: contextual ----
    @Getter
    @Setter
    public static final class Contextual {
        private boolean enabled = true;
        private Duration timeout = ModePolicy.DEFAULT_CONTEXTUAL_TIMEOUT;
        private int maxLength = ModePolicy.DEFAULT_CONTEXTUAL_MAX_LENGTH;
        /** Threads available to the recognizer; calls beyond this wait and count against the timeout. */
        private int concurrency = PiiDetector.DEFAULT_CONTEXTUAL_CONCURRENCY;
    }

    // ---- nested: batch ----
    @Getter
    @Setter
    public static final class Batch {
        private int parallelism = 4;
    }

    // ---- nested: metrics ----
    @Getter
    @Setter
    public static final class Metrics {
        /** Size of the recent-findings ring shown by the actuator endpoint. */
        private int recentFindings = 200;
    }
}
