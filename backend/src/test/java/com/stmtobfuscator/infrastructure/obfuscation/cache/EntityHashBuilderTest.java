package com.stmtobfuscator.infrastructure.obfuscation.cache;

import com.stmtobfuscator.domain.obfuscation.model.PiiEntity;
import com.stmtobfuscator.infrastructure.obfuscation.preprocessing.EntityTextNormalizer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class EntityHashBuilderTest {

    private EntityHashBuilder hashBuilder;

    @BeforeEach
    void setUp() {
        hashBuilder = new EntityHashBuilder(new EntityTextNormalizer());
    }

    @Test
    @DisplayName("Key is 64 lowercase hex characters")
    void keyFormat() {
        String key = hashBuilder.buildKey(PiiEntity.of("PERSON_NAME", "John Doe", 0.9));

        assertThat(key).hasSize(64).matches("[0-9a-f]+");
    }

    @Test
    @DisplayName("Variants of the same value share a key")
    void variantsShareKey() {
        String a = hashBuilder.buildKey(PiiEntity.of("PHONE_NUMBER", "(555) 123-4567", 0.9));
        String b = hashBuilder.buildKey(PiiEntity.of("PHONE_NUMBER", "555-123-4567", 0.5));

        assertThat(a).isEqualTo(b);
    }

    @Test
    @DisplayName("Type changes the key")
    void typeChangesKey() {
        String account = hashBuilder.buildKey(PiiEntity.of("ACCOUNT_NUMBER", "123456789", 0.9));
        String routing = hashBuilder.buildKey(PiiEntity.of("ROUTING_NUMBER", "123456789", 0.9));

        assertThat(account).isNotEqualTo(routing);
    }

    @Test
    @DisplayName("Known digest of the canonical form")
    void knownDigest() {
        // sha256("EMAIL:abc")
        String key = hashBuilder.buildKey(PiiEntity.of("EMAIL", " ABC ", 0.9));

        assertThat(key).isEqualTo("5c8ebe81834d3f8ffefb195ac495950fb1b2d7f52e263e15b8d1da43a6addddb");
    }
}
