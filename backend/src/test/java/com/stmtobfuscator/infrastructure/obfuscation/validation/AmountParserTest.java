package com.stmtobfuscator.infrastructure.obfuscation.validation;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class AmountParserTest {

    private AmountParser parser;

    @BeforeEach
    void setUp() {
        parser = new AmountParser();
    }

    @Test
    @DisplayName("Currency symbols and thousands separators are dropped")
    void currencyFormatted() {
        assertThat(parser.parse("$1,234.56")).isEqualTo(1234.56);
        assertThat(parser.parse(" 0.00 ")).isEqualTo(0.0);
    }

    @Test
    @DisplayName("Negative amounts keep their sign")
    void negative() {
        assertThat(parser.parse("-$100.00")).isEqualTo(-100.0);
    }

    @Test
    @DisplayName("Null, empty and non-numeric text parse to zero")
    void nonNumeric() {
        assertThat(parser.parse(null)).isEqualTo(0.0);
        assertThat(parser.parse("")).isEqualTo(0.0);
        assertThat(parser.parse("n/a")).isEqualTo(0.0);
    }

    @Test
    @DisplayName("Malformed numbers parse to zero instead of throwing")
    void malformed() {
        assertThat(parser.parse("1.2.3")).isEqualTo(0.0);
        assertThat(parser.parse("--5")).isEqualTo(0.0);
    }
}
