package com.stmtobfuscator.infrastructure.obfuscation.masking;

/**
 * Type-specific mask policies. Each keeps the shape of the input (separators, token
 * lengths, last four digits where that convention applies) and destroys its content.
 */
public final class MaskGenerators {

    static final char MASK = 'X';

    private static final int KEPT_DIGITS = 4;
    private static final int CARD_DIGITS = 16;
    private static final int SSN_DIGITS = 9;

    private MaskGenerators() {
    }

    /**
     * Every whitespace-separated token becomes X's of the same length, joined by single spaces.
     */
    public static String personName(String text) {
        String stripped = safe(text).strip();
        if (stripped.isEmpty()) {
            return "";
        }
        String[] words = stripped.split("\\s+");
        StringBuilder sb = new StringBuilder();
        for (String word : words) {
            if (sb.length() > 0) {
                sb.append(' ');
            }
            sb.append(repeat(word.length()));
        }
        return sb.toString();
    }

    /**
     * Letters and digits become X; spaces and punctuation stay.
     */
    public static String address(String text) {
        String value = safe(text);
        StringBuilder sb = new StringBuilder(value.length());
        for (int i = 0; i < value.length(); i++) {
            char ch = value.charAt(i);
            sb.append(Character.isLetterOrDigit(ch) ? MASK : ch);
        }
        return sb.toString();
    }

    /**
     * All digits but the last four become X. Fewer than four digits: all digits masked.
     */
    public static String accountNumber(String text) {
        return maskAllButLastFourDigits(safe(text));
    }

    public static String routingNumber(String text) {
        return maskDigits(safe(text));
    }

    public static String phoneNumber(String text) {
        return maskDigits(safe(text));
    }

    /**
     * Sixteen or more digits collapse to the canonical XXXX-XXXX-XXXX-1234.
     */
    public static String creditCardNumber(String text) {
        String value = safe(text);
        String digits = digitsOf(value);
        if (digits.length() >= CARD_DIGITS) {
            return "XXXX-XXXX-XXXX-" + lastFour(digits);
        }
        return maskAllButLastFourDigits(value);
    }

    /**
     * Exactly nine digits collapse to the canonical XXX-XX-1234.
     */
    public static String ssn(String text) {
        String value = safe(text);
        String digits = digitsOf(value);
        if (digits.length() == SSN_DIGITS) {
            return "XXX-XX-" + lastFour(digits);
        }
        return maskAllButLastFourDigits(value);
    }

    /**
     * First character of the local part survives; every domain label is masked at equal length.
     */
    public static String email(String text) {
        String value = safe(text);
        String[] parts = value.split("@", -1);
        if (parts.length != 2) {
            return repeat(value.length());
        }

        String local = parts[0];
        String maskedLocal = local.length() > 1
                ? local.charAt(0) + repeat(local.length() - 1)
                : String.valueOf(MASK);

        return maskedLocal + "@" + domain(parts[1]);
    }

    /**
     * Tokens of one or two characters ("of", "&") stay; longer tokens are masked.
     */
    public static String organizationName(String text) {
        String stripped = safe(text).strip();
        if (stripped.isEmpty()) {
            return "";
        }
        String[] words = stripped.split("\\s+");
        StringBuilder sb = new StringBuilder();
        for (String word : words) {
            if (sb.length() > 0) {
                sb.append(' ');
            }
            sb.append(word.length() <= 2 ? word : repeat(word.length()));
        }
        return sb.toString();
    }

    public static String url(String text) {
        String value = safe(text);

        String protocol = "";
        String rest = value;
        int schemeEnd = value.indexOf("://");
        if (schemeEnd >= 0) {
            protocol = value.substring(0, schemeEnd);
            rest = value.substring(schemeEnd + 3);
        }

        String prefix = protocol.isEmpty() ? "" : protocol + "://";
        int slash = rest.indexOf('/');
        if (slash < 0) {
            return prefix + domain(rest);
        }

        String host = rest.substring(0, slash);
        String path = rest.substring(slash + 1);
        return prefix + domain(host) + "/" + repeat(path.length());
    }

    public static String dateOfBirth(String text) {
        return maskDigits(safe(text));
    }

    public static String ipAddress(String text) {
        return maskDigits(safe(text));
    }

    /**
     * Low-fidelity mask for types without a dedicated policy, e.g. "BAN_XXXX".
     */
    public static String fallback(String typeName, String text) {
        String type = typeName == null || typeName.isBlank() ? "UNKNOWN" : typeName;
        String prefix = type.length() >= 3 ? type.substring(0, 3) : type;
        return prefix + "_" + repeat(safe(text).length() / 2);
    }

    // ===== Shared routines =====

    static String domain(String domain) {
        String[] labels = domain.split("\\.", -1);
        StringBuilder sb = new StringBuilder(domain.length());
        for (int i = 0; i < labels.length; i++) {
            if (i > 0) {
                sb.append('.');
            }
            sb.append(repeat(labels[i].length()));
        }
        return sb.toString();
    }

    static String maskDigits(String text) {
        StringBuilder sb = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            char ch = text.charAt(i);
            sb.append(isDigit(ch) ? MASK : ch);
        }
        return sb.toString();
    }

    static String maskAllButLastFourDigits(String text) {
        int digitCount = digitsOf(text).length();
        if (digitCount < KEPT_DIGITS) {
            return maskDigits(text);
        }

        int toMask = digitCount - KEPT_DIGITS;
        StringBuilder sb = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            char ch = text.charAt(i);
            if (isDigit(ch) && toMask > 0) {
                sb.append(MASK);
                toMask--;
            } else {
                sb.append(ch);
            }
        }
        return sb.toString();
    }

    private static String digitsOf(String text) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < text.length(); i++) {
            char ch = text.charAt(i);
            if (isDigit(ch)) {
                sb.append(ch);
            }
        }
        return sb.toString();
    }

    private static String lastFour(String digits) {
        return digits.substring(digits.length() - KEPT_DIGITS);
    }

    // Unicode decimal digits, not only ASCII
    private static boolean isDigit(char ch) {
        return Character.isDigit(ch);
    }

    private static String repeat(int count) {
        return String.valueOf(MASK).repeat(Math.max(count, 0));
    }

    private static String safe(String text) {
        return text == null ? "" : text;
    }
}
