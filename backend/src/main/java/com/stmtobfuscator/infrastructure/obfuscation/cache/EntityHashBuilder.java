package com.stmtobfuscator.infrastructure.obfuscation.cache;

import com.stmtobfuscator.domain.obfuscation.model.PiiEntity;
import com.stmtobfuscator.infrastructure.obfuscation.ObfuscationException;
import com.stmtobfuscator.infrastructure.obfuscation.preprocessing.EntityTextNormalizer;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Builds deterministic SHA-256 keys for the entity consistency map.
 * Two entities share a key exactly when they share a type and a normalized text.
 */
@Component
@RequiredArgsConstructor
public class EntityHashBuilder {

    private final EntityTextNormalizer normalizer;

    /**
     * @param entity the entity to key
     * @return hex-encoded SHA-256 of "{type}:{normalizedText}"
     */
    public String buildKey(PiiEntity entity) {
        String normalized = normalizer.normalize(entity.text(), entity.entityType());
        return sha256(entity.typeName() + ":" + normalized);
    }

    private String sha256(String input) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(input.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash);
        } catch (NoSuchAlgorithmException e) {
            throw new ObfuscationException("SHA-256 not available", e);
        }
    }
}
