/*
 * Copyright (c) 2025 Lgpd4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.lgpd4j.core.api;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.lgpd4j.core.afn.AntiFalseNegativeEscalator;
import io.lgpd4j.core.afn.EscalationOutcome;
import io.lgpd4j.core.api.model.DetectionMetadata;
import io.lgpd4j.core.api.model.DetectionResult;
import io.lgpd4j.core.api.model.Entity;
import io.lgpd4j.core.api.model.Mode;
import io.lgpd4j.core.api.model.ModePolicy;
import io.lgpd4j.core.api.model.RawCandidate;
import io.lgpd4j.core.api.model.Source;
import io.lgpd4j.core.assemble.DecisionAssembler;
import io.lgpd4j.core.context.ContextualGateway;
import io.lgpd4j.core.context.ContextualPass;
import io.lgpd4j.core.context.ContextualRecognizer;
import io.lgpd4j.core.fuse.FusionEngine;
import io.lgpd4j.core.preset.PatternLibrary;
import io.lgpd4j.core.report.NoopReporter;
import io.lgpd4j.core.report.Reporter;
import io.lgpd4j.core.score.ConfidenceScorer;
import io.lgpd4j.core.util.NamedThreadFactory;
import io.lgpd4j.core.validate.Validators;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import lombok.extern.slf4j.Slf4j;

/**
 * Entry point: runs patterns and the contextual recognizer over one text, fuses, scores, escalates
 * and assembles the decision.
 *
 * <p>Thread-safe; one instance serves concurrent callers. Close it to release the contextual
 * executor when the detector created it.
 */
@Slf4j
public final class PiiDetector implements AutoCloseable {
    public static final int DEFAULT_CONTEXTUAL_CONCURRENCY = 4;

    private final PatternLibrary patterns;
    private final Validators validators;
    private final FusionEngine fusion;
    private final ConfidenceScorer scorer;
    private final DecisionAssembler assembler;
    private final ContextualGateway contextual;
    private final AntiFalseNegativeEscalator escalator;
    private final Reporter reporter;
    private final ModePolicy defaultPolicy;
    private final ExecutorService ownedExecutor; // null when supplied by the caller

    private PiiDetector(Builder b) {
        this.patterns = b.patterns;
        this.validators = b.validators;
        this.scorer = b.scorer;
        this.fusion = new FusionEngine();
        this.assembler = new DecisionAssembler();
        this.reporter = b.reporter;
        this.defaultPolicy = b.defaultPolicy;
        ExecutorService executor = b.contextualExecutor;
        if (executor == null) {
            // fixed size: a recognizer that ignores cancellation can pin at most this many threads
            executor = Executors.newFixedThreadPool(
                    b.contextualConcurrency, new NamedThreadFactory("lgpd4j-contextual"));
            this.ownedExecutor = executor;
        } else {
            this.ownedExecutor = null;
        }
        this.contextual = new ContextualGateway(b.recognizer, executor);
        this.escalator = new AntiFalseNegativeEscalator(validators, scorer, fusion, contextual);
        log.info("lgpd4j detector ready: default mode={}, pattern types={}", defaultPolicy.name(), patterns.types());
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Detector with built-in patterns, no contextual recognizer and the balanced preset. */
    public static PiiDetector create() {
        return builder().build();
    }

    public ModePolicy defaultPolicy() {
        return defaultPolicy;
    }

    public DetectionResult detect(String text) {
        return detect(text, defaultPolicy);
    }

    public DetectionResult detect(String text, String mode) {
        return detect(text, Modes.policyFor(mode));
    }

    /** Decodes strict UTF-8 first; malformed input is rejected. */
    public DetectionResult detect(byte[] utf8, ModePolicy policy) {
        Objects.requireNonNull(utf8, "utf8");
        String text;
        try {
            text = StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(utf8))
                    .toString();
        } catch (CharacterCodingException e) {
            throw new InvalidTextEncodingException("Input is not valid UTF-8", e);
        }
        return detect(text, policy);
    }

    public DetectionResult detect(byte[] utf8) {
        return detect(utf8, defaultPolicy);
    }

    public DetectionResult detect(String text, ModePolicy policy) {
        Objects.requireNonNull(policy, "policy");
        if (text == null) text = "";
        checkSurrogates(text);
        long t0 = System.nanoTime();
        if (text.isBlank()) {
            DetectionResult empty = DetectionResult.empty(policy.name(), DetectionMetadata.empty(text.length()));
            publish(empty, t0);
            return empty;
        }

        List<RawCandidate> raw = patterns.extract(text, policy.regexAggressiveness());
        List<Entity> patternEntities = new ArrayList<>(raw.size());
        for (RawCandidate c : raw) patternEntities.add(validators.annotate(c, Source.REGEX));

        ContextualPass ctx = contextual.run(text, policy, policy.baseThreshold());
        List<Entity> scored = scorer.scoreAll(
                fusion.fuse(patternEntities, ctx.entities()), text, policy.contextWindow());

        EscalationOutcome afn = escalator.escalate(text, scored, policy, !ctx.degraded());
        List<Entity> kept = assembler.retained(afn.entities(), policy);

        boolean degraded = ctx.degraded() || afn.contextualDegraded();
        String reason = ctx.degraded() ? ctx.reason() : afn.degradedReason();
        int added = afn.triggered() ? AntiFalseNegativeEscalator.countAdded(scored, kept) : 0;
        var metadata = new DetectionMetadata(text.length(), degraded, reason, afn.triggered(), added);

        DetectionResult result = assembler.assemble(kept, policy, metadata);
        log.debug("Detection [{}]: {} pattern candidate(s), {} contextual, {} kept, afn={}, degraded={}",
                policy.name(), raw.size(), ctx.entities().size(), result.entities().size(),
                afn.triggered(), degraded);
        publish(result, t0);
        return result;
    }

    private void publish(DetectionResult result, long t0) {
        try {
            reporter.report(result, Duration.ofNanos(System.nanoTime() - t0));
        } catch (RuntimeException e) {
            log.warn("Reporter {} failed: {}", reporter.getClass().getSimpleName(), e.toString());
        }
    }

    static void checkSurrogates(String s) {
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (Character.isHighSurrogate(c)) {
                if (i + 1 < s.length() && Character.isLowSurrogate(s.charAt(i + 1))) {
                    i++;
                    continue;
                }
                throw new InvalidTextEncodingException("Unpaired high surrogate at index " + i);
            }
            if (Character.isLowSurrogate(c)) {
                throw new InvalidTextEncodingException("Unpaired low surrogate at index " + i);
            }
        }
    }

    @Override
    public void close() {
        if (ownedExecutor != null) ownedExecutor.shutdownNow();
    }

    public static final class Builder {
        private PatternLibrary patterns = PatternLibrary.standard();
        private Validators validators = Validators.standard();
        private ConfidenceScorer scorer = ConfidenceScorer.standard();
        private ContextualRecognizer recognizer = ContextualRecognizer.none();
        private ExecutorService contextualExecutor;
        private int contextualConcurrency = DEFAULT_CONTEXTUAL_CONCURRENCY;
        private Reporter reporter = new NoopReporter();
        private ModePolicy defaultPolicy = Mode.BALANCED.policy();

        private Builder() {}

        public Builder patterns(PatternLibrary p) {
            this.patterns = Objects.requireNonNull(p, "patterns");
            return this;
        }

        public Builder validators(Validators v) {
            this.validators = Objects.requireNonNull(v, "validators");
            return this;
        }

        public Builder scorer(ConfidenceScorer s) {
            this.scorer = Objects.requireNonNull(s, "scorer");
            return this;
        }

        public Builder recognizer(ContextualRecognizer r) {
            this.recognizer = Objects.requireNonNull(r, "recognizer");
            return this;
        }

        /** Executor for the contextual call; not shut down by {@link PiiDetector#close()}. */
        @SuppressFBWarnings(value = "EI_EXPOSE_REP2", justification = "Caller owns the executor lifecycle")
        public Builder contextualExecutor(ExecutorService e) {
            this.contextualExecutor = e;
            return this;
        }

        /** Threads of the detector-owned contextual executor; ignored when an executor is supplied. */
        public Builder contextualConcurrency(int n) {
            if (n <= 0) throw new IllegalArgumentException("contextualConcurrency must be > 0, got " + n);
            this.contextualConcurrency = n;
            return this;
        }

        public Builder reporter(Reporter r) {
            this.reporter = Objects.requireNonNull(r, "reporter");
            return this;
        }

        public Builder defaultPolicy(ModePolicy p) {
            this.defaultPolicy = Objects.requireNonNull(p, "defaultPolicy");
            return this;
        }

        public Builder mode(String name) {
            this.defaultPolicy = Modes.policyFor(name);
            return this;
        }

        public PiiDetector build() {
            return new PiiDetector(this);
        }
    }
}
