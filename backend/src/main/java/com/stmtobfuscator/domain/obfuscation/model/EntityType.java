package com.stmtobfuscator.domain.obfuscation.model;

import java.util.Locale;

/**
 * Known PII entity types reported by the detector.
 * Anything the detector emits outside this set resolves to {@link #UNKNOWN}.
 */
public enum EntityType {
    PERSON_NAME,
    ADDRESS,
    ACCOUNT_NUMBER,
    ROUTING_NUMBER,
    PHONE_NUMBER,
    EMAIL,
    ORGANIZATION_NAME,
    CREDIT_CARD_NUMBER,
    SSN,
    DATE_OF_BIRTH,
    IP_ADDRESS,
    URL,
    UNKNOWN;

    /**
     * Resolve a raw detector type string, case-insensitively.
     *
     * @param value raw type (nullable)
     * @return the matching type, or UNKNOWN
     */
    public static EntityType fromValue(String value) {
        if (value == null || value.isBlank()) {
            return UNKNOWN;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return UNKNOWN;
        }
    }
}
