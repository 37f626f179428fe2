package com.stmtobfuscator.domain.obfuscation.model;

/**
 * A detected PII span as handed over by the detector.
 *
 * @param id         optional identifier (assigned by the review session when absent)
 * @param type       raw type string, e.g. "PERSON_NAME"; unknown values are allowed
 * @param text       the exact detected text
 * @param start      start offset in the full text (nullable, informational)
 * @param end        end offset, exclusive (nullable, informational)
 * @param confidence detector confidence in [0, 1]; null means fully trusted
 */
public record PiiEntity(
        String id,
        String type,
        String text,
        Integer start,
        Integer end,
        Double confidence
) {
    public static final double DEFAULT_CONFIDENCE = 1.0;

    public static PiiEntity of(String type, String text, double confidence) {
        return new PiiEntity(null, type, text, null, null, confidence);
    }

    public EntityType entityType() {
        return EntityType.fromValue(type);
    }

    /**
     * Type string used in group keys and default masks.
     */
    public String typeName() {
        return type != null && !type.isBlank() ? type : EntityType.UNKNOWN.name();
    }

    /**
     * Missing or NaN confidence is treated as fully trusted.
     */
    public double confidenceOrDefault() {
        if (confidence == null || confidence.isNaN()) {
            return DEFAULT_CONFIDENCE;
        }
        return confidence;
    }

    public boolean hasText() {
        return text != null && !text.isEmpty();
    }

    public PiiEntity withId(String newId) {
        return new PiiEntity(newId, type, text, start, end, confidence);
    }
}
