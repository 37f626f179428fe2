package com.stmtobfuscator.interfaces.api.dto;

import com.stmtobfuscator.application.review.PiiReviewSession;

import java.util.List;

public record ReviewResponse(String reviewId, List<ReviewedEntityResponse> entities) {

    public static ReviewResponse from(PiiReviewSession session) {
        return new ReviewResponse(
                session.reviewId(),
                session.entities().stream().map(ReviewedEntityResponse::from).toList());
    }
}
