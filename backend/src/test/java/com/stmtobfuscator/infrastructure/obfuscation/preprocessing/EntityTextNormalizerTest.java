package com.stmtobfuscator.infrastructure.obfuscation.preprocessing;

import com.stmtobfuscator.domain.obfuscation.model.EntityType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class EntityTextNormalizerTest {

    private EntityTextNormalizer normalizer;

    @BeforeEach
    void setUp() {
        normalizer = new EntityTextNormalizer();
    }

    @Test
    @DisplayName("null text normalizes to an empty string")
    void nullText() {
        assertThat(normalizer.normalize(null, EntityType.PERSON_NAME)).isEmpty();
        assertThat(normalizer.normalize("", EntityType.EMAIL)).isEmpty();
    }

    @Test
    @DisplayName("Lowercase and trim for every type")
    void lowercaseAndTrim() {
        assertThat(normalizer.normalize("  John.Doe@Example.COM ", EntityType.EMAIL))
                .isEqualTo("john.doe@example.com");
        assertThat(normalizer.normalize(" 456 Oak Avenue ", EntityType.ADDRESS))
                .isEqualTo("456 oak avenue");
    }

    @Test
    @DisplayName("Null type behaves like a type without special rules")
    void nullType() {
        assertThat(normalizer.normalize(" (555) ABC ", null)).isEqualTo("(555) abc");
    }

    @Test
    @DisplayName("Phone, account and card numbers keep digits only")
    void digitsOnly() {
        assertThat(normalizer.normalize("(555) 123-4567", EntityType.PHONE_NUMBER)).isEqualTo("5551234567");
        assertThat(normalizer.normalize("1234-5678 9012", EntityType.ACCOUNT_NUMBER)).isEqualTo("123456789012");
        assertThat(normalizer.normalize("4111 1111 1111 1111", EntityType.CREDIT_CARD_NUMBER))
                .isEqualTo("4111111111111111");
    }

    @Test
    @DisplayName("Non-ASCII digits survive digit-only normalization")
    void nonAsciiDigits() {
        assertThat(normalizer.normalize("(５５５) １２３-４５６７", EntityType.PHONE_NUMBER)).isEqualTo("５５５１２３４５６７");
        assertThat(normalizer.normalize("١٢٣٤-٥٦٧٨", EntityType.ACCOUNT_NUMBER)).isEqualTo("١٢٣٤٥٦٧٨");
        assertThat(normalizer.normalize("５５５", EntityType.PHONE_NUMBER))
                .isNotEqualTo(normalizer.normalize("６６６", EntityType.PHONE_NUMBER));
    }

    @Test
    @DisplayName("Routing numbers are not reduced to digits")
    void routingNumberKeepsSeparators() {
        assertThat(normalizer.normalize("021-000-021", EntityType.ROUTING_NUMBER)).isEqualTo("021-000-021");
    }

    @Test
    @DisplayName("Person name titles are removed")
    void nameTitles() {
        assertThat(normalizer.normalize("Mr. John Doe", EntityType.PERSON_NAME)).isEqualTo("john doe");
        assertThat(normalizer.normalize("dr John Doe", EntityType.PERSON_NAME)).isEqualTo("john doe");
        assertThat(normalizer.normalize("Prof.  Jane Roe", EntityType.PERSON_NAME)).isEqualTo("jane roe");
        assertThat(normalizer.normalize("Mrs Smith", EntityType.PERSON_NAME)).isEqualTo("smith");
    }

    @Test
    @DisplayName("Person name suffixes are removed")
    void nameSuffixes() {
        assertThat(normalizer.normalize("John Doe Jr.", EntityType.PERSON_NAME)).isEqualTo("john doe");
        assertThat(normalizer.normalize("Jane Roe PhD", EntityType.PERSON_NAME)).isEqualTo("jane roe");
        assertThat(normalizer.normalize("Dr. John Doe Sr", EntityType.PERSON_NAME)).isEqualTo("john doe");
    }

    @Test
    @DisplayName("Titles only count as a leading word")
    void titleInsideNameIsKept() {
        assertThat(normalizer.normalize("Drew Mrsic", EntityType.PERSON_NAME)).isEqualTo("drew mrsic");
    }
}
