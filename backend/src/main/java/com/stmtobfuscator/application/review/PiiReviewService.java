package com.stmtobfuscator.application.review;

import com.stmtobfuscator.application.review.exception.ReviewNotFoundException;
import com.stmtobfuscator.domain.obfuscation.model.PiiEntity;
import com.stmtobfuscator.infrastructure.obfuscation.masking.MaskGeneratorRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Holds open review sessions in memory, keyed by review id.
 * When more than {@code obfuscation.review.max-open-sessions} are open, the least recently used is evicted.
 */
@Slf4j
@Service
public class PiiReviewService {

    private final MaskGeneratorRegistry maskRegistry;
    private final double confidenceThreshold;
    private final Map<String, PiiReviewSession> sessions;

    public PiiReviewService(MaskGeneratorRegistry maskRegistry,
                            @Value("${obfuscation.confidence-threshold:0.85}") double confidenceThreshold,
                            @Value("${obfuscation.review.max-open-sessions:1000}") int maxOpenSessions) {
        this.maskRegistry = maskRegistry;
        this.confidenceThreshold = confidenceThreshold;
        this.sessions = Collections.synchronizedMap(new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, PiiReviewSession> eldest) {
                boolean evict = size() > maxOpenSessions;
                if (evict) {
                    log.warn("[Review] Too many open reviews, evicting {}", eldest.getKey());
                }
                return evict;
            }
        });
    }

    /**
     * Start a review over the entities that pass the configured confidence threshold.
     */
    public PiiReviewSession open(List<PiiEntity> detected) {
        List<PiiEntity> accepted = detected == null ? List.of() : detected.stream()
                .filter(Objects::nonNull)
                .filter(e -> e.confidenceOrDefault() >= confidenceThreshold)
                .toList();

        PiiReviewSession session = new PiiReviewSession(UUID.randomUUID().toString(), maskRegistry, accepted);
        sessions.put(session.reviewId(), session);

        log.info("[Review] Opened review {} with {} of {} detected entities",
                session.reviewId(), accepted.size(), detected == null ? 0 : detected.size());
        return session;
    }

    /**
     * @throws ReviewNotFoundException if no open review has this id
     */
    public PiiReviewSession get(String reviewId) {
        PiiReviewSession session = sessions.get(reviewId);
        if (session == null) {
            throw new ReviewNotFoundException("Review not found: " + reviewId);
        }
        return session;
    }

    public String addEntity(String reviewId, PiiEntity entity) {
        return get(reviewId).add(entity);
    }

    public PiiReviewSession updateEntity(String reviewId, String entityId, String type, String text) {
        PiiReviewSession session = get(reviewId);
        if (!session.update(entityId, type, text)) {
            throw new ReviewNotFoundException("PII entity not found: " + entityId);
        }
        return session;
    }

    public void removeEntity(String reviewId, String entityId) {
        if (!get(reviewId).remove(entityId)) {
            throw new ReviewNotFoundException("PII entity not found: " + entityId);
        }
    }

    public void close(String reviewId) {
        if (sessions.remove(reviewId) == null) {
            throw new ReviewNotFoundException("Review not found: " + reviewId);
        }
        log.info("[Review] Closed review {}", reviewId);
    }
}
