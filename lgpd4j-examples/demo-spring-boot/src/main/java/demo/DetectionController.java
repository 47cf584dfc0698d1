/*
 * Copyright (c) 2025 Lgpd4J Contributors
 * Licensed under the Apache License 2.0
 */
package demo;

import io.lgpd4j.core.api.InvalidTextEncodingException;
import io.lgpd4j.core.api.Modes;
import io.lgpd4j.core.api.PiiDetector;
import io.lgpd4j.core.api.PolicyConfigurationException;
import io.lgpd4j.core.api.model.DetectionResult;
import io.lgpd4j.core.api.model.ModePolicy;
import io.lgpd4j.core.batch.BatchDetector;
import io.lgpd4j.core.batch.BatchResult;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/detect")
@Slf4j
public class DetectionController {

    public record DetectRequest(String text, String mode) {}

    public record BatchRequest(List<String> texts, String mode) {}

    private final PiiDetector detector;
    private final BatchDetector batch;

    public DetectionController(PiiDetector detector, BatchDetector batch) {
        this.detector = detector;
        this.batch = batch;
    }

    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE)
    public DetectionResult detect(@RequestBody DetectRequest req) {
        DetectionResult r = detector.detect(req.text(), policy(req.mode()));
        // offsets and types only, never values
        log.info("detect: mode={}, classification={}, types={}", r.mode(), r.classification(), r.countsByType());
        return r;
    }

    /** Raw UTF-8 body; malformed bytes are rejected rather than replaced. */
    @PostMapping(consumes = MediaType.TEXT_PLAIN_VALUE)
    public DetectionResult detectBytes(@RequestBody byte[] body, @RequestParam(required = false) String mode) {
        return detector.detect(body, policy(mode));
    }

    @PostMapping("/batch")
    public BatchResult detectBatch(@RequestBody BatchRequest req) {
        List<String> texts = req.texts() == null ? List.of() : req.texts();
        BatchResult r = batch.detectAll(texts, policy(req.mode()));
        log.info("batch: processed={}, withPii={}", r.summary().totalProcessed(), r.summary().totalWithPii());
        return r;
    }

    @ExceptionHandler({PolicyConfigurationException.class, InvalidTextEncodingException.class})
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, String> badRequest(RuntimeException e) {
        log.warn("Rejected request: {}", e.getMessage());
        return Map.of("error", e.getClass().getSimpleName(), "message", e.getMessage());
    }

    private ModePolicy policy(String mode) {
        return (mode == null || mode.isBlank()) ? detector.defaultPolicy() : Modes.policyFor(mode);
    }
}
