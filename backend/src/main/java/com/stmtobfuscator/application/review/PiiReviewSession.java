package com.stmtobfuscator.application.review;

import com.stmtobfuscator.domain.obfuscation.model.EntityType;
import com.stmtobfuscator.domain.obfuscation.model.PiiEntity;
import com.stmtobfuscator.infrastructure.obfuscation.masking.MaskGeneratorRegistry;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Working set of detected entities that a reviewer can correct before obfuscation.
 * Sessions are shared across requests, so every access is synchronized.
 */
@Slf4j
public class PiiReviewSession {

    private final String reviewId;
    private final MaskGeneratorRegistry maskRegistry;
    private final List<ReviewedEntity> entities = new ArrayList<>();
    private int nextId = 0;

    PiiReviewSession(String reviewId, MaskGeneratorRegistry maskRegistry, List<PiiEntity> detected) {
        this.reviewId = reviewId;
        this.maskRegistry = maskRegistry;
        for (PiiEntity entity : detected) {
            entities.add(review(entity));
        }
    }

    public String reviewId() {
        return reviewId;
    }

    public synchronized List<ReviewedEntity> entities() {
        return List.copyOf(entities);
    }

    /**
     * Add an entity the detector missed.
     *
     * @return the id assigned to it
     */
    public synchronized String add(PiiEntity entity) {
        PiiEntity normalized = new PiiEntity(
                null,
                entity.type() != null ? entity.type() : EntityType.UNKNOWN.name(),
                entity.text() != null ? entity.text() : "",
                entity.start() != null ? entity.start() : 0,
                entity.end() != null ? entity.end() : 0,
                entity.confidenceOrDefault()
        );
        ReviewedEntity reviewed = review(normalized);
        entities.add(reviewed);
        log.info("[Review] Added PII entity {}", reviewed.id());
        return reviewed.id();
    }

    /**
     * Correct the type and/or text of an entity. Null arguments keep the current value.
     *
     * @return false if no entity has this id
     */
    public synchronized boolean update(String id, String type, String text) {
        for (int i = 0; i < entities.size(); i++) {
            ReviewedEntity current = entities.get(i);
            if (!current.id().equals(id)) {
                continue;
            }

            PiiEntity old = current.entity();
            PiiEntity updated = new PiiEntity(
                    id,
                    type != null ? type : old.type(),
                    text != null ? text : old.text(),
                    old.start(),
                    old.end(),
                    old.confidence()
            );
            boolean changed = type != null || text != null;
            String replacement = changed ? maskRegistry.mask(updated) : current.replacement();
            entities.set(i, new ReviewedEntity(id, updated, replacement));
            log.info("[Review] Updated PII entity {}", id);
            return true;
        }

        log.warn("[Review] PII entity not found: {}", id);
        return false;
    }

    /**
     * @return false if no entity has this id
     */
    public synchronized boolean remove(String id) {
        boolean removed = entities.removeIf(e -> e.id().equals(id));
        if (removed) {
            log.info("[Review] Removed PII entity {}", id);
        } else {
            log.warn("[Review] PII entity not found: {}", id);
        }
        return removed;
    }

    /**
     * Reviewed entities ready for obfuscation, with confidence pinned to 1.0.
     */
    public synchronized List<PiiEntity> approvedEntities() {
        return entities.stream()
                .map(ReviewedEntity::entity)
                .map(e -> new PiiEntity(e.id(), e.type(), e.text(), e.start(), e.end(), PiiEntity.DEFAULT_CONFIDENCE))
                .toList();
    }

    /**
     * text → replacement over the current entities; later entries win on identical text.
     */
    public synchronized Map<String, String> replacementMap() {
        Map<String, String> map = new LinkedHashMap<>();
        for (ReviewedEntity reviewed : entities) {
            if (reviewed.entity().hasText()) {
                map.put(reviewed.entity().text(), reviewed.replacement());
            }
        }
        return map;
    }

    private ReviewedEntity review(PiiEntity entity) {
        String id = entity.id() != null && !entity.id().isBlank() ? entity.id() : "entity_" + nextId;
        nextId++;
        PiiEntity withId = entity.withId(id);
        return new ReviewedEntity(id, withId, maskRegistry.mask(withId));
    }
}
