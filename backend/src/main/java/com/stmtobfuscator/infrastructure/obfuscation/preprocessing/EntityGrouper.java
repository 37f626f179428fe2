package com.stmtobfuscator.infrastructure.obfuscation.preprocessing;

import com.stmtobfuscator.domain.obfuscation.model.EntityGroup;
import com.stmtobfuscator.domain.obfuscation.model.PiiEntity;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Clusters entities into equivalence classes keyed by type and normalized text,
 * so every variant of one real-world value receives one replacement.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class EntityGrouper {

    private final EntityTextNormalizer normalizer;

    /**
     * Group entities by "{type}_{normalizedText}".
     * Group order follows first appearance; members keep their input order.
     *
     * @param entities entities to group
     * @return insertion-ordered groups by key
     */
    public Map<String, EntityGroup> group(List<PiiEntity> entities) {
        Map<String, List<PiiEntity>> members = new LinkedHashMap<>();
        if (entities == null) {
            return Map.of();
        }

        for (PiiEntity entity : entities) {
            String key = groupKey(entity);
            members.computeIfAbsent(key, k -> new ArrayList<>()).add(entity);
        }

        Map<String, EntityGroup> groups = new LinkedHashMap<>();
        members.forEach((key, list) -> groups.put(key, new EntityGroup(key, List.copyOf(list))));

        log.debug("[Grouper] {} entities → {} groups", entities.size(), groups.size());
        return groups;
    }

    public String groupKey(PiiEntity entity) {
        return entity.typeName() + "_" + normalizer.normalize(entity.text(), entity.entityType());
    }
}
