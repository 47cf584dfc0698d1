/*
 * Copyright (c) 2025 Lgpd4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.lgpd4j.spring;

import io.lgpd4j.core.api.Modes;
import io.lgpd4j.core.api.model.ModePolicy;
import java.util.HashMap;
import java.util.Map;
import org.springframework.boot.actuate.endpoint.annotation.Endpoint;
import org.springframework.boot.actuate.endpoint.annotation.ReadOperation;

@Endpoint(id = "lgpd4j")
public class Lgpd4jEndpoint {

    private final MicrometerReporter reporter;
    private final ModePolicy policy;

    public Lgpd4jEndpoint(MicrometerReporter reporter, ModePolicy policy) {
        this.reporter = reporter;
        this.policy = policy;
    }

    @ReadOperation
    public Map<String, Object> info() {
        Map<String, Object> m = new HashMap<>();
        m.put("status", "OK");
        m.put("mode", policy.name());
        m.put("baseThreshold", policy.baseThreshold());
        m.put("availableModes", Modes.names());
        m.put("recentFindings", reporter.recentFindings());
        return m;
    }
}
