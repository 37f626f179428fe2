package com.stmtobfuscator.infrastructure.obfuscation.pipeline;

import com.stmtobfuscator.domain.obfuscation.model.PiiEntity;
import com.stmtobfuscator.domain.obfuscation.model.ReplacementPlan;
import com.stmtobfuscator.infrastructure.obfuscation.cache.EntityHashBuilder;
import com.stmtobfuscator.infrastructure.obfuscation.masking.MaskGeneratorRegistry;
import com.stmtobfuscator.infrastructure.obfuscation.preprocessing.EntityGrouper;
import com.stmtobfuscator.infrastructure.obfuscation.preprocessing.EntityTextNormalizer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.entry;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.when;

class ReplacementMapBuilderTest {

    private static final double THRESHOLD = 0.85;

    private ReplacementMapBuilder builder;

    @BeforeEach
    void setUp() {
        EntityTextNormalizer normalizer = new EntityTextNormalizer();
        builder = new ReplacementMapBuilder(
                new EntityGrouper(normalizer),
                new MaskGeneratorRegistry(),
                new EntityHashBuilder(normalizer));
    }

    private ReplacementPlan build(List<PiiEntity> entities) {
        StageResult<ReplacementPlan> result = builder.build(entities, THRESHOLD);
        assertThat(result.failed()).isFalse();
        return result.value();
    }

    @Test
    @DisplayName("Entity above the threshold is mapped to its mask")
    void singleEntity() {
        ReplacementPlan plan = build(List.of(PiiEntity.of("PERSON_NAME", "John Doe", 0.95)));

        assertThat(plan.replacements()).containsExactly(entry("John Doe", "XXXX XXX"));
        assertThat(plan.consistencyMap()).hasSize(1).containsValue("XXXX XXX");
    }

    @Test
    @DisplayName("Entities below the threshold are left out")
    void belowThreshold() {
        ReplacementPlan plan = build(List.of(
                PiiEntity.of("PERSON_NAME", "Jane Roe", 0.5),
                PiiEntity.of("PERSON_NAME", "John Doe", 0.85)));

        assertThat(plan.replacements()).containsOnlyKeys("John Doe");
    }

    @Test
    @DisplayName("Missing confidence counts as fully trusted")
    void missingConfidence() {
        PiiEntity entity = new PiiEntity(null, "EMAIL", "a@b.co", null, null, null);

        assertThat(build(List.of(entity)).replacements()).containsOnlyKeys("a@b.co");
    }

    @Test
    @DisplayName("Every variant maps to the mask of the highest-confidence member")
    void variantsShareReplacement() {
        ReplacementPlan plan = build(List.of(
                PiiEntity.of("PERSON_NAME", "john doe", 0.90),
                PiiEntity.of("PERSON_NAME", "John Doe", 0.95),
                PiiEntity.of("PERSON_NAME", "Mr. John Doe", 0.88)));

        assertThat(plan.replacements())
                .containsEntry("john doe", "XXXX XXX")
                .containsEntry("John Doe", "XXXX XXX")
                .containsEntry("Mr. John Doe", "XXXX XXX");
        assertThat(plan.consistencyMap()).hasSize(1);
    }

    @Test
    @DisplayName("Group mask comes from the representative's own text")
    void representativeText() {
        ReplacementPlan plan = build(List.of(
                PiiEntity.of("PHONE_NUMBER", "555-123-4567", 0.90),
                PiiEntity.of("PHONE_NUMBER", "(555) 123-4567", 0.99)));

        assertThat(plan.replacements())
                .containsEntry("555-123-4567", "(XXX) XXX-XXXX")
                .containsEntry("(555) 123-4567", "(XXX) XXX-XXXX");
    }

    @Test
    @DisplayName("Replacements keep the order groups were first seen")
    void order() {
        ReplacementPlan plan = build(List.of(
                PiiEntity.of("EMAIL", "a@b.co", 0.9),
                PiiEntity.of("ROUTING_NUMBER", "021000021", 0.9),
                PiiEntity.of("EMAIL", "A@B.co", 0.9)));

        assertThat(plan.replacements().keySet()).containsExactly("a@b.co", "A@B.co", "021000021");
    }

    @Nested
    @DisplayName("Malformed input")
    class MalformedInput {

        @Test
        @DisplayName("Null list recovers with an empty plan")
        void nullList() {
            StageResult<ReplacementPlan> result = builder.build(null, THRESHOLD);

            assertThat(result.failed()).isTrue();
            assertThat(result.failure()).isEqualTo("PII entities must be a list, got null");
            assertThat(result.value().isEmpty()).isTrue();
        }

        @Test
        @DisplayName("Null entities and entities without text are skipped")
        void nullAndEmptyEntities() {
            ReplacementPlan plan = build(Arrays.asList(
                    null,
                    PiiEntity.of("PERSON_NAME", "", 0.99),
                    PiiEntity.of("PERSON_NAME", null, 0.99),
                    PiiEntity.of("PERSON_NAME", "Jane", 0.99)));

            assertThat(plan.replacements()).containsOnlyKeys("Jane");
        }

        @Test
        @DisplayName("Empty list produces an empty plan")
        void emptyList() {
            assertThat(build(List.of()).isEmpty()).isTrue();
        }
    }

    @Nested
    @ExtendWith(MockitoExtension.class)
    @DisplayName("Failures")
    class Failures {

        @Mock
        private EntityGrouper failingGrouper;

        @Mock
        private MaskGeneratorRegistry failingRegistry;

        @Test
        @DisplayName("A failing group is skipped, the others are kept")
        void groupFailure() {
            EntityTextNormalizer normalizer = new EntityTextNormalizer();
            when(failingRegistry.mask(any(PiiEntity.class))).thenAnswer(invocation -> {
                PiiEntity entity = invocation.getArgument(0);
                if ("Bad".equals(entity.text())) {
                    throw new IllegalStateException("boom");
                }
                return "MASK";
            });
            ReplacementMapBuilder partial = new ReplacementMapBuilder(
                    new EntityGrouper(normalizer), failingRegistry, new EntityHashBuilder(normalizer));

            StageResult<ReplacementPlan> result = partial.build(List.of(
                    PiiEntity.of("PERSON_NAME", "Bad", 0.99),
                    PiiEntity.of("PERSON_NAME", "Good", 0.99)), THRESHOLD);

            assertThat(result.failed()).isFalse();
            assertThat(result.value().replacements()).containsExactly(entry("Good", "MASK"));
        }

        @Test
        @DisplayName("An unexpected failure recovers with an empty plan and the reason")
        void unexpectedFailure() {
            when(failingGrouper.group(anyList())).thenThrow(new IllegalStateException("boom"));
            ReplacementMapBuilder broken = new ReplacementMapBuilder(
                    failingGrouper, new MaskGeneratorRegistry(), new EntityHashBuilder(new EntityTextNormalizer()));

            StageResult<ReplacementPlan> result = broken.build(
                    List.of(PiiEntity.of("PERSON_NAME", "Jane", 0.99)), THRESHOLD);

            assertThat(result.failed()).isTrue();
            assertThat(result.failure()).isEqualTo("Error building replacement map: boom");
            assertThat(result.value().isEmpty()).isTrue();
        }
    }
}
