/*
 * Copyright (c) 2025 Lgpd4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.lgpd4j.core.context;

import io.lgpd4j.core.api.model.ContextualCandidate;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs the delegate on an executor and waits at most {@code timeout}. Timeouts, interrupts and
 * unexpected failures surface as {@link ContextualUnavailableException}; an
 * {@link IllegalArgumentException} from the delegate is a contract violation and is rethrown as is.
 */
public final class TimeBoundedRecognizer implements ContextualRecognizer {
    private final ContextualRecognizer delegate;
    private final Duration timeout;
    private final ExecutorService executor;

    public TimeBoundedRecognizer(ContextualRecognizer delegate, Duration timeout, ExecutorService executor) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
        this.timeout = Objects.requireNonNull(timeout, "timeout");
        this.executor = Objects.requireNonNull(executor, "executor");
        if (timeout.isZero() || timeout.isNegative()) throw new IllegalArgumentException("timeout must be positive");
    }

    @Override
    public List<ContextualCandidate> recognize(ContextualRequest request) throws ContextualUnavailableException {
        final Future<List<ContextualCandidate>> f;
        try {
            f = executor.submit(() -> delegate.recognize(request));
        } catch (RejectedExecutionException e) {
            throw new ContextualUnavailableException("Contextual executor rejected the call", e);
        }
        try {
            List<ContextualCandidate> out = f.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return out == null ? List.of() : List.copyOf(out);
        } catch (TimeoutException e) {
            f.cancel(true);
            throw new ContextualUnavailableException("Contextual recognizer timed out after " + timeout.toMillis() + " ms", e);
        } catch (InterruptedException e) {
            f.cancel(true);
            Thread.currentThread().interrupt();
            throw new ContextualUnavailableException("Interrupted while waiting for contextual recognizer", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof IllegalArgumentException iae) throw iae;
            if (cause instanceof ContextualUnavailableException cue) throw cue;
            throw new ContextualUnavailableException("Contextual recognizer failed: " + cause, cause);
        }
    }
}
