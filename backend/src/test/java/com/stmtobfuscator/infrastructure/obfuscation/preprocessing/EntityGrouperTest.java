package com.stmtobfuscator.infrastructure.obfuscation.preprocessing;

import com.stmtobfuscator.domain.obfuscation.model.EntityGroup;
import com.stmtobfuscator.domain.obfuscation.model.PiiEntity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class EntityGrouperTest {

    private EntityGrouper grouper;

    @BeforeEach
    void setUp() {
        grouper = new EntityGrouper(new EntityTextNormalizer());
    }

    @Test
    @DisplayName("Empty and null input produce no groups")
    void emptyInput() {
        assertThat(grouper.group(List.of())).isEmpty();
        assertThat(grouper.group(null)).isEmpty();
    }

    @Test
    @DisplayName("Surface variants of a name share one group")
    void nameVariants() {
        PiiEntity plain = PiiEntity.of("PERSON_NAME", "John Doe", 0.95);
        PiiEntity lower = PiiEntity.of("PERSON_NAME", "john doe", 0.90);
        PiiEntity titled = PiiEntity.of("PERSON_NAME", "Mr. John Doe", 0.88);

        Map<String, EntityGroup> groups = grouper.group(List.of(plain, lower, titled));

        assertThat(groups).containsOnlyKeys("PERSON_NAME_john doe");
        assertThat(groups.get("PERSON_NAME_john doe").members()).containsExactly(plain, lower, titled);
    }

    @Test
    @DisplayName("Phone numbers group by digits")
    void phoneVariants() {
        Map<String, EntityGroup> groups = grouper.group(List.of(
                PiiEntity.of("PHONE_NUMBER", "(555) 123-4567", 0.9),
                PiiEntity.of("PHONE_NUMBER", "555.123.4567", 0.9)));

        assertThat(groups).containsOnlyKeys("PHONE_NUMBER_5551234567");
        assertThat(groups.get("PHONE_NUMBER_5551234567").members()).hasSize(2);
    }

    @Test
    @DisplayName("Distinct fullwidth numbers stay in separate groups")
    void fullwidthNumbersApart() {
        Map<String, EntityGroup> groups = grouper.group(List.of(
                PiiEntity.of("PHONE_NUMBER", "５５５", 0.9),
                PiiEntity.of("PHONE_NUMBER", "６６６", 0.9)));

        assertThat(groups).hasSize(2);
    }

    @Test
    @DisplayName("Same text with different types stays apart")
    void typeIsPartOfKey() {
        Map<String, EntityGroup> groups = grouper.group(List.of(
                PiiEntity.of("ACCOUNT_NUMBER", "123456789", 0.9),
                PiiEntity.of("ROUTING_NUMBER", "123456789", 0.9)));

        assertThat(groups).hasSize(2);
    }

    @Test
    @DisplayName("Groups keep first-appearance order")
    void insertionOrder() {
        Map<String, EntityGroup> groups = grouper.group(List.of(
                PiiEntity.of("EMAIL", "a@b.com", 0.9),
                PiiEntity.of("PERSON_NAME", "Jane", 0.9),
                PiiEntity.of("EMAIL", "A@B.com", 0.9)));

        assertThat(groups.keySet()).containsExactly("EMAIL_a@b.com", "PERSON_NAME_jane");
    }

    @Test
    @DisplayName("Unrecognized types keep their raw name in the key")
    void unknownTypeKey() {
        assertThat(grouper.groupKey(PiiEntity.of("IBAN", " DE89 ", 0.9))).isEqualTo("IBAN_de89");
        assertThat(grouper.groupKey(PiiEntity.of(null, "x", 0.9))).isEqualTo("UNKNOWN_x");
    }

    @Test
    @DisplayName("Representative is the highest-confidence member, first on ties")
    void representative() {
        PiiEntity first = PiiEntity.of("PERSON_NAME", "john doe", 0.9);
        PiiEntity best = PiiEntity.of("PERSON_NAME", "John Doe", 0.95);
        PiiEntity tie = PiiEntity.of("PERSON_NAME", "JOHN DOE", 0.95);

        EntityGroup group = grouper.group(List.of(first, best, tie)).values().iterator().next();

        assertThat(group.representative()).isSameAs(best);
    }
}
