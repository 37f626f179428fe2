package com.stmtobfuscator.domain.obfuscation.model;

import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.List;

/**
 * Final output of the obfuscation pipeline.
 *
 * @param document      the obfuscated document, or the minimal fallback document when degraded
 * @param plan          the replacement plan that was applied
 * @param integrity     balance comparison before/after (nullable when verification itself failed)
 * @param stageFailures recoverable failures, one line per stage that fell back to its default
 * @param degraded      true when the pipeline aborted and the fallback document was returned
 */
public record ObfuscationOutcome(
        ObjectNode document,
        ReplacementPlan plan,
        IntegrityReport integrity,
        List<String> stageFailures,
        boolean degraded
) {}
