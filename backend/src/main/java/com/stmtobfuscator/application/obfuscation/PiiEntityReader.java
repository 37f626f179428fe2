package com.stmtobfuscator.application.obfuscation;

import com.fasterxml.jackson.databind.JsonNode;
import com.stmtobfuscator.domain.obfuscation.model.PiiEntity;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Reads detector output leniently. A malformed element is skipped and a malformed field
 * is dropped, so one bad entity never rejects the whole request.
 */
@Slf4j
@Component
public class PiiEntityReader {

    /**
     * @param entities JSON array of entity objects (nullable)
     * @return the readable entities, or null when the input is not an array
     */
    public List<PiiEntity> readAll(JsonNode entities) {
        if (entities == null || !entities.isArray()) {
            log.warn("[EntityReader] PII entities is not a list: {}",
                    entities == null ? "null" : entities.getNodeType());
            return null;
        }

        List<PiiEntity> result = new ArrayList<>();
        for (JsonNode node : entities) {
            if (!node.isObject()) {
                log.warn("[EntityReader] Entity is not an object: {}, skipping", node.getNodeType());
                continue;
            }
            result.add(toEntity(node));
        }
        return result;
    }

    /**
     * @throws IllegalArgumentException if the node is not an object
     */
    public PiiEntity read(JsonNode entity) {
        if (entity == null || !entity.isObject()) {
            throw new IllegalArgumentException("PII entity must be an object");
        }
        return toEntity(entity);
    }

    private PiiEntity toEntity(JsonNode node) {
        return new PiiEntity(
                textField(node, "id"),
                textField(node, "type"),
                textField(node, "text"),
                intField(node, "start"),
                intField(node, "end"),
                confidence(node)
        );
    }

    // Non-numeric confidence counts as missing, which the pipeline treats as 1.0
    private Double confidence(JsonNode node) {
        JsonNode value = node.get("confidence");
        if (value == null || value.isNull()) {
            return null;
        }
        if (!value.isNumber()) {
            log.warn("[EntityReader] Confidence is not a number: {}", value.getNodeType());
            return null;
        }
        return value.doubleValue();
    }

    private String textField(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (!value.isValueNode()) {
            log.warn("[EntityReader] Entity field '{}' is not a scalar: {}", field, value.getNodeType());
            return null;
        }
        return value.asText();
    }

    private Integer intField(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value != null && value.isIntegralNumber() ? value.intValue() : null;
    }
}
