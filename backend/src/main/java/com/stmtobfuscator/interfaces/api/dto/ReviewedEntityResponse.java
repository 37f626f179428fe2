package com.stmtobfuscator.interfaces.api.dto;

import com.stmtobfuscator.application.review.ReviewedEntity;

public record ReviewedEntityResponse(String id, String type, String text, Double confidence, String replacement) {

    public static ReviewedEntityResponse from(ReviewedEntity reviewed) {
        return new ReviewedEntityResponse(
                reviewed.id(),
                reviewed.entity().type(),
                reviewed.entity().text(),
                reviewed.entity().confidence(),
                reviewed.replacement());
    }
}
