/*
 * Copyright (c) 2025 Lgpd4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.lgpd4j.spring;

import io.lgpd4j.core.api.Modes;
import io.lgpd4j.core.api.PiiDetector;
import io.lgpd4j.core.api.model.ModePolicy;
import io.lgpd4j.core.batch.BatchDetector;
import io.lgpd4j.core.context.ContextualRecognizer;
import io.lgpd4j.core.context.RuleBasedContextualRecognizer;
import io.lgpd4j.core.report.NoopReporter;
import io.lgpd4j.core.report.Reporter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.actuate.autoconfigure.endpoint.condition.ConditionalOnAvailableEndpoint;
import org.springframework.boot.actuate.endpoint.annotation.Endpoint;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Wires a {@link PiiDetector} from {@code lgpd4j.*} properties. A bad mode or threshold fails startup. */
@Slf4j
@AutoConfiguration(
        afterName = {
            "org.springframework.boot.actuate.autoconfigure.metrics.MetricsAutoConfiguration",
            "org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration"
        })
@EnableConfigurationProperties(Lgpd4jProperties.class)
@ConditionalOnProperty(prefix = "lgpd4j", name = "enabled", havingValue = "true", matchIfMissing = true)
public class Lgpd4jAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public ModePolicy lgpd4jModePolicy(Lgpd4jProperties props) {
        ModePolicy p = Modes.policyFor(props.getMode());
        var overrides = props.getPolicy();
        if (overrides.getBaseThreshold() != null) p = p.withBaseThreshold(overrides.getBaseThreshold());
        if (overrides.getAfnEntityThreshold() != null) p = p.withAfnEntityThreshold(overrides.getAfnEntityThreshold());
        var ctx = props.getContextual();
        return p.withContextual(ctx.getTimeout(), ctx.getMaxLength());
    }

    @Bean
    @ConditionalOnMissingBean
    public ContextualRecognizer lgpd4jContextualRecognizer(Lgpd4jProperties props) {
        return props.getContextual().isEnabled() ? new RuleBasedContextualRecognizer() : ContextualRecognizer.none();
    }

    @Bean
    @ConditionalOnMissingBean(Reporter.class)
    public Reporter lgpd4jReporter() {
        return new NoopReporter();
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean
    public PiiDetector piiDetector(
            ModePolicy policy, ContextualRecognizer recognizer, Reporter reporter, Lgpd4jProperties props) {
        log.info("lgpd4j enabled: mode={}, threshold={}, contextual={}",
                policy.name(), policy.baseThreshold(), recognizer.getClass().getSimpleName());
        return PiiDetector.builder()
                .defaultPolicy(policy)
                .recognizer(recognizer)
                .contextualConcurrency(props.getContextual().getConcurrency())
                .reporter(reporter)
                .build();
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean
    public BatchDetector batchDetector(PiiDetector detector, Lgpd4jProperties props) {
        return new BatchDetector(detector, props.getBatch().getParallelism());
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnClass(MeterRegistry.class)
    static class MetricsConfiguration {

        @Bean
        @ConditionalOnBean(MeterRegistry.class)
        @ConditionalOnMissingBean
        public MicrometerReporter lgpd4jMicrometerReporter(MeterRegistry registry, Lgpd4jProperties props) {
            return new MicrometerReporter(registry, props.getMetrics().getRecentFindings());
        }
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnClass({Endpoint.class, MeterRegistry.class})
    static class EndpointConfiguration {

        @Bean
        @ConditionalOnBean(MicrometerReporter.class)
        @ConditionalOnAvailableEndpoint(endpoint = Lgpd4jEndpoint.class)
        public Lgpd4jEndpoint lgpd4jEndpoint(MicrometerReporter reporter, ModePolicy policy) {
            return new Lgpd4jEndpoint(reporter, policy);
        }
    }
}
