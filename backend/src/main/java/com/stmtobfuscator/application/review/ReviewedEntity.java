package com.stmtobfuscator.application.review;

import com.stmtobfuscator.domain.obfuscation.model.PiiEntity;

/**
 * An entity under review together with the mask it would receive.
 */
public record ReviewedEntity(String id, PiiEntity entity, String replacement) {}
