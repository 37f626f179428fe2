package com.stmtobfuscator.infrastructure.obfuscation.pipeline;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Applies a replacement map to arbitrary text.
 * <p>
 * Longest originals are replaced first, so a short value contained in a longer one
 * (last four digits inside a full account number) never breaks the longer match.
 * Originals containing '(', ')', '.' or '-' are replaced as literal substrings;
 * all others only at word boundaries.
 */
@Component
public class TextSubstitutionEngine {

    private static final Pattern DELIMITED = Pattern.compile("[().\\-]");

    /**
     * Replace every mapped original in the text.
     *
     * @param text         the text to substitute (nullable)
     * @param replacements original → replacement
     * @return the substituted text
     */
    public String apply(String text, Map<String, String> replacements) {
        return prepare(replacements).apply(text);
    }

    /**
     * Order and compile the rules once, for reuse across full text, blocks and cells.
     */
    public Substitution prepare(Map<String, String> replacements) {
        List<Rule> rules = new ArrayList<>();
        if (replacements != null) {
            replacements.entrySet().stream()
                    .filter(e -> e.getKey() != null && !e.getKey().isEmpty())
                    .sorted(Comparator.comparingInt((Map.Entry<String, String> e) -> e.getKey().length()).reversed())
                    .forEach(e -> rules.add(toRule(e.getKey(), e.getValue())));
        }
        return new Substitution(List.copyOf(rules));
    }

    private Rule toRule(String original, String replacement) {
        String safeReplacement = replacement == null ? "" : replacement;
        if (DELIMITED.matcher(original).find()) {
            return new Rule(original, safeReplacement, null);
        }
        Pattern wordPattern = Pattern.compile(
                "\\b" + Pattern.quote(original) + "\\b", Pattern.UNICODE_CHARACTER_CLASS);
        return new Rule(original, safeReplacement, wordPattern);
    }

    /**
     * Compiled, ordered replacement rules.
     */
    public record Substitution(List<Rule> rules) {

        public String apply(String text) {
            if (text == null || text.isEmpty() || rules.isEmpty()) {
                return text;
            }

            String result = text;
            for (Rule rule : rules) {
                result = rule.apply(result);
            }
            return result;
        }

        public boolean isEmpty() {
            return rules.isEmpty();
        }
    }

    /**
     * @param wordPattern null for literal replacement
     */
    record Rule(String original, String replacement, Pattern wordPattern) {

        String apply(String text) {
            if (wordPattern == null) {
                return text.replace(original, replacement);
            }
            return wordPattern.matcher(text).replaceAll(Matcher.quoteReplacement(replacement));
        }
    }
}
