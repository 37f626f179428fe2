package com.stmtobfuscator.interfaces.api.dto;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.validation.constraints.NotNull;

public record ReviewObfuscationRequest(
        @NotNull(message = "Document is required")
        JsonNode document
) {}
