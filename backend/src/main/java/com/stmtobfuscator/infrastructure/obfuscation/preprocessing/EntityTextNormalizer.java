package com.stmtobfuscator.infrastructure.obfuscation.preprocessing;

import com.stmtobfuscator.domain.obfuscation.model.EntityType;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Canonicalizes entity text so that surface variants of the same value compare equal:
 * - lowercase + trim for every type
 * - digits only for phone, account and card numbers
 * - honorific titles and suffixes removed from person names
 */
@Component
public class EntityTextNormalizer {

    private static final Pattern NON_DIGITS = Pattern.compile("\\D", Pattern.UNICODE_CHARACTER_CLASS);

    // "mr. ", "dr ", "prof. "
    private static final Pattern NAME_TITLE = Pattern.compile("^(mr|mrs|ms|dr|prof)\\.?\\s+");

    // " jr.", " phd", " esq."
    private static final Pattern NAME_SUFFIX = Pattern.compile("\\s+(jr|sr|phd|md|esq)\\.?$");

    /**
     * Normalize the entity text for the given type.
     *
     * @param text raw entity text (nullable)
     * @param type entity type
     * @return normalized text, never null
     */
    public String normalize(String text, EntityType type) {
        if (text == null) {
            return "";
        }

        String result = text.toLowerCase(Locale.ROOT).strip();

        switch (type == null ? EntityType.UNKNOWN : type) {
            case PHONE_NUMBER, ACCOUNT_NUMBER, CREDIT_CARD_NUMBER ->
                    result = NON_DIGITS.matcher(result).replaceAll("");
            case PERSON_NAME -> {
                result = NAME_TITLE.matcher(result).replaceFirst("");
                result = NAME_SUFFIX.matcher(result).replaceFirst("");
            }
            default -> {
                // lowercase + trim only (EMAIL included)
            }
        }

        return result;
    }
}
