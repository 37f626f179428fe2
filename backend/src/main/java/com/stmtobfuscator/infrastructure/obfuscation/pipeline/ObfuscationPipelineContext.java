package com.stmtobfuscator.infrastructure.obfuscation.pipeline;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.stmtobfuscator.domain.obfuscation.model.FinancialSnapshot;
import com.stmtobfuscator.domain.obfuscation.model.IntegrityReport;
import com.stmtobfuscator.domain.obfuscation.model.ObfuscationOutcome;
import com.stmtobfuscator.domain.obfuscation.model.PiiEntity;
import com.stmtobfuscator.domain.obfuscation.model.ReplacementPlan;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Mutable per-call state passed through the pipeline stages.
 * Created fresh for every call; nothing survives on the pipeline bean.
 */
@Data
public class ObfuscationPipelineContext {

    // --- Input ---
    private JsonNode sourceDocument;
    private List<PiiEntity> entities;
    private double confidenceThreshold;

    // --- Copy ---
    private ObjectNode workingDocument;

    // --- Integrity ---
    private FinancialSnapshot snapshot = FinancialSnapshot.empty();
    private IntegrityReport integrityReport;

    // --- Replacement ---
    private ReplacementPlan plan = ReplacementPlan.empty();

    // --- Diagnostics ---
    private List<String> stageFailures = new ArrayList<>();

    public void recordFailure(StageResult<?> result) {
        if (result.failed()) {
            stageFailures.add(result.failure());
        }
    }

    public ObfuscationOutcome toOutcome() {
        return new ObfuscationOutcome(workingDocument, plan, integrityReport, List.copyOf(stageFailures), false);
    }
}
