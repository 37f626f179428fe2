package com.stmtobfuscator.interfaces.api.review;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.stmtobfuscator.application.obfuscation.ObfuscationAppService;
import com.stmtobfuscator.application.obfuscation.PiiEntityReader;
import com.stmtobfuscator.application.review.PiiReviewService;
import com.stmtobfuscator.application.review.PiiReviewSession;
import com.stmtobfuscator.domain.obfuscation.model.ObfuscationOutcome;
import com.stmtobfuscator.interfaces.api.dto.ReplacementPreviewResponse;
import com.stmtobfuscator.interfaces.api.dto.ReviewEntityAddedResponse;
import com.stmtobfuscator.interfaces.api.dto.ReviewEntityUpdateRequest;
import com.stmtobfuscator.interfaces.api.dto.ReviewObfuscationRequest;
import com.stmtobfuscator.interfaces.api.dto.ReviewOpenRequest;
import com.stmtobfuscator.interfaces.api.dto.ReviewResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Human review of detected entities before obfuscation.
 */
@RestController
@RequestMapping("/api/v1/reviews")
@RequiredArgsConstructor
public class PiiReviewController {

    private final PiiReviewService reviewService;
    private final ObfuscationAppService obfuscationAppService;
    private final PiiEntityReader entityReader;

    @PostMapping
    public ResponseEntity<ReviewResponse> open(@Valid @RequestBody ReviewOpenRequest request) {
        PiiReviewSession session = reviewService.open(entityReader.readAll(request.entities()));
        return ResponseEntity.status(HttpStatus.CREATED).body(ReviewResponse.from(session));
    }

    @GetMapping("/{reviewId}")
    public ResponseEntity<ReviewResponse> get(@PathVariable String reviewId) {
        return ResponseEntity.ok(ReviewResponse.from(reviewService.get(reviewId)));
    }

    @PostMapping("/{reviewId}/entities")
    public ResponseEntity<ReviewEntityAddedResponse> addEntity(@PathVariable String reviewId,
                                                               @RequestBody JsonNode entity) {
        String id = reviewService.addEntity(reviewId, entityReader.read(entity));
        return ResponseEntity.status(HttpStatus.CREATED).body(new ReviewEntityAddedResponse(id));
    }

    @PatchMapping("/{reviewId}/entities/{entityId}")
    public ResponseEntity<ReviewResponse> updateEntity(@PathVariable String reviewId,
                                                       @PathVariable String entityId,
                                                       @RequestBody ReviewEntityUpdateRequest request) {
        PiiReviewSession session = reviewService.updateEntity(reviewId, entityId, request.type(), request.text());
        return ResponseEntity.ok(ReviewResponse.from(session));
    }

    @DeleteMapping("/{reviewId}/entities/{entityId}")
    public ResponseEntity<Void> removeEntity(@PathVariable String reviewId, @PathVariable String entityId) {
        reviewService.removeEntity(reviewId, entityId);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/{reviewId}/replacements")
    public ResponseEntity<ReplacementPreviewResponse> replacements(@PathVariable String reviewId) {
        Map<String, String> replacements = reviewService.get(reviewId).replacementMap();
        return ResponseEntity.ok(new ReplacementPreviewResponse(replacements, replacements.size()));
    }

    /**
     * Obfuscate with exactly the reviewed entities. They carry confidence 1.0, so the default threshold keeps them all.
     */
    @PostMapping("/{reviewId}/obfuscation")
    public ResponseEntity<ObjectNode> obfuscate(@PathVariable String reviewId,
                                                @Valid @RequestBody ReviewObfuscationRequest request) {
        PiiReviewSession session = reviewService.get(reviewId);
        ObfuscationOutcome outcome = obfuscationAppService.obfuscate(
                request.document(), session.approvedEntities(), null);
        return ResponseEntity.ok(outcome.document());
    }

    @DeleteMapping("/{reviewId}")
    public ResponseEntity<Void> close(@PathVariable String reviewId) {
        reviewService.close(reviewId);
        return ResponseEntity.noContent().build();
    }
}
