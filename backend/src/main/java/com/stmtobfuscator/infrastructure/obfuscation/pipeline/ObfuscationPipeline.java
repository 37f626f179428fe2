package com.stmtobfuscator.infrastructure.obfuscation.pipeline;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.stmtobfuscator.domain.obfuscation.model.FinancialSnapshot;
import com.stmtobfuscator.domain.obfuscation.model.IntegrityReport;
import com.stmtobfuscator.domain.obfuscation.model.ObfuscationOutcome;
import com.stmtobfuscator.domain.obfuscation.model.PiiEntity;
import com.stmtobfuscator.domain.obfuscation.model.ReplacementPlan;
import com.stmtobfuscator.infrastructure.obfuscation.ObfuscationException;
import com.stmtobfuscator.infrastructure.obfuscation.validation.FinancialIntegrityChecker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;

import static com.stmtobfuscator.domain.obfuscation.model.DocumentFields.*;

/**
 * Orchestrates document obfuscation:
 * <p>
 * validate → copy → fill defaults → snapshot balances → build replacement map →
 * substitute (full text, blocks, table cells) → verify balances → annotate metadata
 * </p>
 * Never throws to the caller. If anything escapes the stages, a minimal document
 * with {@code metadata.obfuscated = false} and the error message is returned instead.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ObfuscationPipeline {

    private final FinancialIntegrityChecker integrityChecker;
    private final ReplacementMapBuilder replacementMapBuilder;
    private final TextSubstitutionEngine substitutionEngine;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    /**
     * Obfuscate the document and return it.
     *
     * @param document            statement document (must be a JSON object)
     * @param entities            detected PII entities
     * @param confidenceThreshold entities below this confidence are not masked
     * @return the obfuscated copy, or the fallback document on failure
     */
    public ObjectNode obfuscate(JsonNode document, List<PiiEntity> entities, double confidenceThreshold) {
        return execute(document, entities, confidenceThreshold).document();
    }

    /**
     * Run the full pipeline and keep the intermediate artifacts.
     */
    public ObfuscationOutcome execute(JsonNode document, List<PiiEntity> entities, double confidenceThreshold) {
        ObfuscationPipelineContext ctx = new ObfuscationPipelineContext();
        ctx.setSourceDocument(document);
        ctx.setEntities(entities);
        ctx.setConfidenceThreshold(confidenceThreshold);

        try {
            // 1. Validate
            validate(ctx);

            // 2. Copy, then fill defaults on the copy
            copy(ctx);
            fillDefaults(ctx);

            // 3. Snapshot
            snapshot(ctx);

            // 4. Build map
            StageResult<ReplacementPlan> planResult = replacementMapBuilder.build(
                    ctx.getEntities(), ctx.getConfidenceThreshold());
            ctx.setPlan(planResult.value());
            ctx.recordFailure(planResult);

            // 5. Substitute
            substitute(ctx);

            // 6. Verify
            verify(ctx);

            // 7. Annotate
            annotate(ctx);

            if (!ctx.getStageFailures().isEmpty()) {
                log.warn("[Obfuscation] Completed with recovered failures: {}", ctx.getStageFailures());
            }
            log.info("[Obfuscation] Obfuscated document with {} PII entities", ctx.getPlan().size());

            return ctx.toOutcome();
        } catch (RuntimeException e) {
            log.error("[Obfuscation] Obfuscation failed, returning fallback document", e);
            return new ObfuscationOutcome(
                    fallbackDocument(document, e),
                    ReplacementPlan.empty(),
                    null,
                    List.of(messageOf(e)),
                    true
            );
        }
    }

    // ===== Stages =====

    private void validate(ObfuscationPipelineContext ctx) {
        JsonNode document = ctx.getSourceDocument();
        if (document == null || !document.isObject()) {
            String actual = document == null ? "null" : document.getNodeType().name();
            log.error("[Obfuscation] Document is not an object: {}", actual);
            throw new ObfuscationException("Document must be an object, got " + actual);
        }
        if (ctx.getEntities() == null) {
            log.error("[Obfuscation] PII entities is not a list: null");
            throw new ObfuscationException("PII entities must be a list, got null");
        }
    }

    private void copy(ObfuscationPipelineContext ctx) {
        ObjectNode source = (ObjectNode) ctx.getSourceDocument();
        try {
            ctx.setWorkingDocument(source.deepCopy());
        } catch (RuntimeException e) {
            log.error("[Obfuscation] Error creating deep copy, falling back to the original document", e);
            ctx.setWorkingDocument(source);
            ctx.getStageFailures().add("Error creating deep copy: " + messageOf(e));
        }
    }

    private void fillDefaults(ObfuscationPipelineContext ctx) {
        ObjectNode doc = ctx.getWorkingDocument();

        JsonNode fullText = doc.get(FULL_TEXT);
        if (fullText == null || fullText.isNull()) {
            log.warn("[Obfuscation] Document missing '{}', adding empty string", FULL_TEXT);
            doc.put(FULL_TEXT, "");
        } else if (!fullText.isTextual()) {
            log.warn("[Obfuscation] '{}' is not a string ({}), converting", FULL_TEXT, fullText.getNodeType());
            doc.put(FULL_TEXT, fullText.isValueNode() ? fullText.asText() : "");
        }

        JsonNode metadata = doc.get(METADATA);
        if (metadata == null || !metadata.isObject()) {
            log.warn("[Obfuscation] Document missing '{}' object, adding empty object", METADATA);
            doc.set(METADATA, objectMapper.createObjectNode());
        }

        if (!doc.has(TEXT_BLOCKS) || doc.get(TEXT_BLOCKS).isNull()) {
            log.warn("[Obfuscation] Document missing '{}', adding empty list", TEXT_BLOCKS);
            doc.set(TEXT_BLOCKS, objectMapper.createArrayNode());
        }
    }

    private void snapshot(ObfuscationPipelineContext ctx) {
        try {
            ctx.setSnapshot(integrityChecker.extract(ctx.getWorkingDocument()));
        } catch (RuntimeException e) {
            log.error("[Obfuscation] Error extracting financial data, continuing without snapshot", e);
            ctx.getStageFailures().add("Error extracting financial data: " + messageOf(e));
        }
    }

    private void substitute(ObfuscationPipelineContext ctx) {
        ObjectNode doc = ctx.getWorkingDocument();
        TextSubstitutionEngine.Substitution substitution =
                substitutionEngine.prepare(ctx.getPlan().replacements());

        // Full text
        String fullText = substitution.apply(doc.get(FULL_TEXT).textValue());
        doc.put(FULL_TEXT, fullText);

        // Text blocks
        JsonNode blocks = doc.get(TEXT_BLOCKS);
        if (!blocks.isArray()) {
            log.warn("[Obfuscation] '{}' is not a list ({}), replacing with a single block",
                    TEXT_BLOCKS, blocks.getNodeType());
            ArrayNode single = objectMapper.createArrayNode();
            single.addObject().put(TEXT, fullText);
            doc.set(TEXT_BLOCKS, single);
        } else {
            for (JsonNode block : blocks) {
                if (!block.isObject()) {
                    log.warn("[Obfuscation] Block is not an object: {}", block.getNodeType());
                    continue;
                }
                JsonNode text = block.get(TEXT);
                if (text != null && text.isTextual()) {
                    ((ObjectNode) block).put(TEXT, substitution.apply(text.textValue()));
                }
            }
        }

        // Tables
        if (doc.has(TABLES)) {
            substituteTables(doc, substitution);
        }
    }

    private void substituteTables(ObjectNode doc, TextSubstitutionEngine.Substitution substitution) {
        JsonNode tables = doc.get(TABLES);
        if (!tables.isArray()) {
            log.warn("[Obfuscation] '{}' is not a list ({}), replacing with empty list", TABLES, tables.getNodeType());
            doc.set(TABLES, objectMapper.createArrayNode());
            return;
        }

        for (JsonNode table : tables) {
            if (!table.isObject()) {
                log.warn("[Obfuscation] Table is not an object: {}", table.getNodeType());
                continue;
            }
            JsonNode rows = table.get(ROWS);
            if (rows == null || !rows.isArray()) {
                log.warn("[Obfuscation] Table rows is not a list, skipping table");
                continue;
            }
            for (JsonNode row : rows) {
                if (!row.isArray()) {
                    log.warn("[Obfuscation] Row is not a list: {}", row.getNodeType());
                    continue;
                }
                ArrayNode cells = (ArrayNode) row;
                for (int k = 0; k < cells.size(); k++) {
                    JsonNode cell = cells.get(k);
                    if (cell.isTextual()) {
                        cells.set(k, TextNode.valueOf(substitution.apply(cell.textValue())));
                    }
                }
            }
        }
    }

    private void verify(ObfuscationPipelineContext ctx) {
        try {
            IntegrityReport report = integrityChecker.verify(ctx.getSnapshot(), ctx.getWorkingDocument());
            ctx.setIntegrityReport(report);
            if (!report.verified()) {
                log.warn("[Obfuscation] Financial integrity check failed after obfuscation");
            }
        } catch (RuntimeException e) {
            log.error("[Obfuscation] Error verifying financial integrity", e);
            ctx.getStageFailures().add("Error verifying financial integrity: " + messageOf(e));
        }
    }

    private void annotate(ObfuscationPipelineContext ctx) {
        ObjectNode metadata = (ObjectNode) ctx.getWorkingDocument().get(METADATA);
        metadata.put(OBFUSCATED, true);
        metadata.put(OBFUSCATION_TIMESTAMP, DateTimeFormatter.ISO_LOCAL_DATE_TIME.format(LocalDateTime.now(clock)));
        metadata.put(ENTITIES_OBFUSCATED, ctx.getPlan().size());
        if (ctx.getIntegrityReport() != null) {
            metadata.put(FINANCIAL_INTEGRITY_VERIFIED, ctx.getIntegrityReport().verified());
        }
    }

    // ===== Fallback =====

    private ObjectNode fallbackDocument(JsonNode source, RuntimeException error) {
        String fullText = "";
        if (source != null && source.isObject()) {
            JsonNode text = source.get(FULL_TEXT);
            if (text != null && text.isTextual()) {
                fullText = text.textValue();
            }
        }

        ObjectNode fallback = objectMapper.createObjectNode();
        fallback.put(FULL_TEXT, fullText);
        ObjectNode metadata = fallback.putObject(METADATA);
        metadata.put(ERROR, messageOf(error));
        metadata.put(OBFUSCATED, false);
        fallback.putArray(TEXT_BLOCKS);
        return fallback;
    }

    private String messageOf(Throwable e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
