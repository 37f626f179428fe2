package com.stmtobfuscator.domain.obfuscation.model;

import java.util.List;

/**
 * Entities that normalize to the same value for the same type.
 *
 * @param key     "{type}_{normalizedText}"
 * @param members entities in detection order
 */
public record EntityGroup(String key, List<PiiEntity> members) {

    /**
     * The highest-confidence member; the first one wins ties.
     */
    public PiiEntity representative() {
        PiiEntity best = null;
        for (PiiEntity member : members) {
            if (best == null || member.confidenceOrDefault() > best.confidenceOrDefault()) {
                best = member;
            }
        }
        return best;
    }
}
