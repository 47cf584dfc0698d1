/*
 * Copyright (c) 2025 Lgpd4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.lgpd4j.core.batch;

import io.lgpd4j.core.api.PiiDetector;
import io.lgpd4j.core.api.model.DetectionResult;
import io.lgpd4j.core.api.model.ModePolicy;
import io.lgpd4j.core.util.NamedThreadFactory;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import lombok.extern.slf4j.Slf4j;

/**
 * Runs independent detections on a fixed pool. Results keep input order. The first failing text
 * fails the whole batch with its own exception.
 */
@Slf4j
public final class BatchDetector implements AutoCloseable {
    private final PiiDetector detector;
    private final ExecutorService pool;
    private final int parallelism;

    public BatchDetector(PiiDetector detector, int parallelism) {
        this.detector = Objects.requireNonNull(detector, "detector");
        if (parallelism <= 0) throw new IllegalArgumentException("parallelism must be positive, got " + parallelism);
        this.parallelism = parallelism;
        this.pool = Executors.newFixedThreadPool(parallelism, new NamedThreadFactory("lgpd4j-batch"));
    }

    public int parallelism() {
        return parallelism;
    }

    public BatchResult detectAll(List<String> texts) {
        return detectAll(texts, detector.defaultPolicy());
    }

    public BatchResult detectAll(List<String> texts, ModePolicy policy) {
        Objects.requireNonNull(texts, "texts");
        Objects.requireNonNull(policy, "policy");
        List<Future<DetectionResult>> futures = new ArrayList<>(texts.size());
        for (String t : texts) futures.add(pool.submit(() -> detector.detect(t, policy)));

        List<DetectionResult> results = new ArrayList<>(texts.size());
        try {
            for (Future<DetectionResult> f : futures) results.add(f.get());
        } catch (InterruptedException e) {
            futures.forEach(f -> f.cancel(true));
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for batch results", e);
        } catch (ExecutionException e) {
            futures.forEach(f -> f.cancel(true));
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException re) throw re;
            if (cause instanceof Error err) throw err;
            throw new IllegalStateException("Batch detection failed", cause);
        }
        BatchSummary summary = BatchSummary.of(results);
        log.debug("Batch [{}]: {} text(s), {} with PII", policy.name(), summary.totalProcessed(), summary.totalWithPii());
        return new BatchResult(results, summary);
    }

    @Override
    public void close() {
        pool.shutdownNow();
    }
}
