package com.stmtobfuscator.interfaces.api.obfuscation;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.stmtobfuscator.application.obfuscation.ObfuscationAppService;
import com.stmtobfuscator.application.obfuscation.PiiEntityReader;
import com.stmtobfuscator.domain.obfuscation.model.ObfuscationOutcome;
import com.stmtobfuscator.domain.obfuscation.model.ReplacementPlan;
import com.stmtobfuscator.interfaces.api.dto.ObfuscationRequest;
import com.stmtobfuscator.interfaces.api.dto.ReplacementPreviewResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/obfuscation")
@RequiredArgsConstructor
public class ObfuscationController {

    private final ObfuscationAppService obfuscationAppService;
    private final PiiEntityReader entityReader;

    @PostMapping
    public ResponseEntity<ObjectNode> obfuscate(@Valid @RequestBody ObfuscationRequest request) {
        ObfuscationOutcome outcome = obfuscationAppService.obfuscate(
                request.document(),
                entityReader.readAll(request.entities()),
                request.confidenceThreshold());

        return ResponseEntity.ok(outcome.document());
    }

    @PostMapping("/replacements")
    public ResponseEntity<ReplacementPreviewResponse> previewReplacements(@Valid @RequestBody ObfuscationRequest request) {
        ReplacementPlan plan = obfuscationAppService.previewReplacements(
                entityReader.readAll(request.entities()),
                request.confidenceThreshold());

        return ResponseEntity.ok(new ReplacementPreviewResponse(plan.replacements(), plan.size()));
    }
}
