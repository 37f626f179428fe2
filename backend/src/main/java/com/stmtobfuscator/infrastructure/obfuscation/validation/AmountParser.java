package com.stmtobfuscator.infrastructure.obfuscation.validation;

import org.springframework.stereotype.Component;

import java.util.regex.Pattern;

/**
 * Parses currency-formatted strings ("$1,234.56", "-$100.00", " 0.00 ") to numbers.
 */
@Component
public class AmountParser {

    private static final Pattern NON_NUMERIC = Pattern.compile("[^\\d.\\-]");

    /**
     * Keep digits, '.' and '-' only, then parse.
     *
     * @param amount raw amount text (nullable)
     * @return the parsed value, or 0.0 when nothing numeric remains
     */
    public double parse(String amount) {
        if (amount == null) {
            return 0.0;
        }

        String cleaned = NON_NUMERIC.matcher(amount).replaceAll("");
        if (cleaned.isEmpty()) {
            return 0.0;
        }

        try {
            return Double.parseDouble(cleaned);
        } catch (NumberFormatException e) {
            return 0.0;
        }
    }
}
