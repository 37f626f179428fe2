package com.stmtobfuscator.application.obfuscation;

import com.fasterxml.jackson.databind.JsonNode;
import com.stmtobfuscator.domain.obfuscation.model.ObfuscationOutcome;
import com.stmtobfuscator.domain.obfuscation.model.PiiEntity;
import com.stmtobfuscator.domain.obfuscation.model.ReplacementPlan;
import com.stmtobfuscator.infrastructure.obfuscation.pipeline.ObfuscationPipeline;
import com.stmtobfuscator.infrastructure.obfuscation.pipeline.ReplacementMapBuilder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class ObfuscationAppService {

    private final ObfuscationPipeline obfuscationPipeline;
    private final ReplacementMapBuilder replacementMapBuilder;

    @Value("${obfuscation.confidence-threshold:0.85}")
    private double defaultConfidenceThreshold;

    /**
     * Obfuscate a parsed statement with the detector's entities.
     *
     * @param confidenceThreshold per-request threshold; null uses the configured default
     */
    public ObfuscationOutcome obfuscate(JsonNode document, List<PiiEntity> entities, Double confidenceThreshold) {
        double threshold = resolveThreshold(confidenceThreshold);
        ObfuscationOutcome outcome = obfuscationPipeline.execute(document, entities, threshold);

        if (outcome.degraded()) {
            log.warn("[ObfuscationApp] Obfuscation degraded to fallback document: {}", outcome.stageFailures());
        }
        return outcome;
    }

    /**
     * Preview the replacement map without touching any document.
     */
    public ReplacementPlan previewReplacements(List<PiiEntity> entities, Double confidenceThreshold) {
        return replacementMapBuilder.build(entities, resolveThreshold(confidenceThreshold)).value();
    }

    private double resolveThreshold(Double requested) {
        if (requested == null || requested.isNaN()) {
            return defaultConfidenceThreshold;
        }
        if (requested < 0.0 || requested > 1.0) {
            throw new IllegalArgumentException("confidenceThreshold must be between 0 and 1, got " + requested);
        }
        return requested;
    }
}
