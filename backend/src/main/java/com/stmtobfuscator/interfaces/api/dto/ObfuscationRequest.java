package com.stmtobfuscator.interfaces.api.dto;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;

public record ObfuscationRequest(
        @NotNull(message = "Document is required")
        JsonNode document,

        // Read element by element so one malformed entity does not reject the request
        @NotNull(message = "Entities are required")
        JsonNode entities,

        @DecimalMin(value = "0.0", message = "Confidence threshold must be between 0 and 1")
        @DecimalMax(value = "1.0", message = "Confidence threshold must be between 0 and 1")
        Double confidenceThreshold
) {}
