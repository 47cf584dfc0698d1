/*
 * Copyright (c) 2025 Lgpd4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.lgpd4j.core.detect;

import io.lgpd4j.core.api.model.PiiType;
import io.lgpd4j.core.api.model.RawCandidate;
import io.lgpd4j.core.api.model.RegexAggressiveness;
import java.util.List;

/** Stateless structural matcher for one type. Returns candidates ordered by start, longer first. */
public interface Detector {
    PiiType type();

    List<RawCandidate> detect(String text, RegexAggressiveness level);
}
