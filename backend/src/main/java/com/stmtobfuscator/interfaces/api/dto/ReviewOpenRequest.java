package com.stmtobfuscator.interfaces.api.dto;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.validation.constraints.NotNull;

public record ReviewOpenRequest(
        @NotNull(message = "Entities are required")
        JsonNode entities
) {}
