package com.stmtobfuscator.infrastructure.obfuscation.pipeline;

import com.stmtobfuscator.domain.obfuscation.model.EntityGroup;
import com.stmtobfuscator.domain.obfuscation.model.PiiEntity;
import com.stmtobfuscator.domain.obfuscation.model.ReplacementPlan;
import com.stmtobfuscator.infrastructure.obfuscation.cache.EntityHashBuilder;
import com.stmtobfuscator.infrastructure.obfuscation.masking.MaskGeneratorRegistry;
import com.stmtobfuscator.infrastructure.obfuscation.preprocessing.EntityGrouper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns detected entities into an original → replacement mapping:
 * confidence filter → group variants → mask the representative → map every member.
 * <p>
 * Never throws. On an unexpected failure the plan is empty, so the document
 * comes back unredacted rather than not at all.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ReplacementMapBuilder {

    private final EntityGrouper grouper;
    private final MaskGeneratorRegistry maskRegistry;
    private final EntityHashBuilder hashBuilder;

    /**
     * Build the replacement plan for one obfuscation call.
     *
     * @param entities            detected entities
     * @param confidenceThreshold entities below this confidence are left unmasked
     * @return the plan, or an empty plan with the failure reason
     */
    public StageResult<ReplacementPlan> build(List<PiiEntity> entities, double confidenceThreshold) {
        if (entities == null) {
            return StageResult.recovered(ReplacementPlan.empty(), "PII entities must be a list, got null");
        }

        try {
            List<PiiEntity> filtered = filter(entities, confidenceThreshold);
            log.info("[ReplacementMap] Filtered {} entities to {} based on confidence threshold {}",
                    entities.size(), filtered.size(), confidenceThreshold);

            Map<String, EntityGroup> groups = grouper.group(filtered);

            Map<String, String> replacements = new LinkedHashMap<>();
            Map<String, String> consistencyMap = new LinkedHashMap<>();

            for (EntityGroup group : groups.values()) {
                try {
                    PiiEntity representative = group.representative();
                    String replacement = maskRegistry.mask(representative);

                    for (PiiEntity member : group.members()) {
                        replacements.put(member.text(), replacement);
                        recordConsistency(member, replacement, consistencyMap);
                    }
                } catch (RuntimeException e) {
                    log.error("[ReplacementMap] Error processing {} group of {} entities, skipping",
                            group.members().get(0).typeName(), group.members().size(), e);
                }
            }

            log.info("[ReplacementMap] Built replacement map with {} entries from {} groups",
                    replacements.size(), groups.size());
            return StageResult.success(new ReplacementPlan(replacements, consistencyMap));
        } catch (RuntimeException e) {
            log.error("[ReplacementMap] Failed to build replacement map, continuing with empty map", e);
            return StageResult.recovered(ReplacementPlan.empty(), "Error building replacement map: " + e.getMessage());
        }
    }

    private List<PiiEntity> filter(List<PiiEntity> entities, double confidenceThreshold) {
        List<PiiEntity> filtered = new ArrayList<>();
        int skipped = 0;

        for (PiiEntity entity : entities) {
            if (entity == null) {
                log.warn("[ReplacementMap] Null entity in detector output, skipping");
                skipped++;
                continue;
            }
            if (!entity.hasText()) {
                log.warn("[ReplacementMap] Entity {} of type {} has no text, skipping",
                        entity.id(), entity.typeName());
                skipped++;
                continue;
            }
            if (entity.confidenceOrDefault() >= confidenceThreshold) {
                filtered.add(entity);
            }
        }

        if (skipped > 0) {
            log.warn("[ReplacementMap] {} malformed entities were skipped", skipped);
        }
        return filtered;
    }

    private void recordConsistency(PiiEntity entity, String replacement, Map<String, String> consistencyMap) {
        try {
            consistencyMap.put(hashBuilder.buildKey(entity), replacement);
        } catch (RuntimeException e) {
            log.error("[ReplacementMap] Error computing entity hash for {} entity, consistency entry skipped",
                    entity.typeName(), e);
        }
    }
}
