/*
 * Copyright (c) 2025 Lgpd4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.lgpd4j.core.context;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.lgpd4j.core.api.model.ContextualCandidate;
import io.lgpd4j.core.api.model.PiiType;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class TimeBoundedRecognizerTest {
    private final ExecutorService executor = Executors.newCachedThreadPool();
    private final ContextualRequest request = new ContextualRequest("Sr. João Souza", 5000, 0.5);

    @AfterEach
    void shutdown() {
        executor.shutdownNow();
    }

    @Test
    void passesCandidatesThrough() throws Exception {
        ContextualRecognizer r = req -> List.of(new ContextualCandidate(PiiType.NAME, 4, 14, 0.9));
        assertThat(new TimeBoundedRecognizer(r, Duration.ofSeconds(2), executor).recognize(request)).hasSize(1);
    }

    @Test
    void slowRecognizerTimesOut() {
        ContextualRecognizer slow = req -> {
            try {
                Thread.sleep(5_000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return List.of();
        };
        assertThatThrownBy(() -> new TimeBoundedRecognizer(slow, Duration.ofMillis(100), executor).recognize(request))
                .isInstanceOf(ContextualUnavailableException.class)
                .hasMessageContaining("timed out");
    }

    @Test
    void unexpectedFailureBecomesUnavailable() {
        ContextualRecognizer broken = req -> {
            throw new IllegalStateException("backend crashed");
        };
        assertThatThrownBy(() -> new TimeBoundedRecognizer(broken, Duration.ofSeconds(1), executor).recognize(request))
                .isInstanceOf(ContextualUnavailableException.class)
                .hasMessageContaining("backend crashed");
    }

    @Test
    void contractViolationPropagates() {
        ContextualRecognizer wrongType = req -> List.of(new ContextualCandidate(PiiType.CPF, 0, 3, 0.9));
        assertThatThrownBy(() -> new TimeBoundedRecognizer(wrongType, Duration.ofSeconds(1), executor)
                        .recognize(request))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void nullObjects() throws Exception {
        assertThat(ContextualRecognizer.none().recognize(request)).isEmpty();
        assertThatThrownBy(() -> ContextualRecognizer.unavailable("offline").recognize(request))
                .isInstanceOf(ContextualUnavailableException.class)
                .hasMessage("offline");
    }
}
