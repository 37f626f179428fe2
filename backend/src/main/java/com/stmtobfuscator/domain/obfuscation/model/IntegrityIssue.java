package com.stmtobfuscator.domain.obfuscation.model;

/**
 * A single difference between the financial figures before and after obfuscation.
 *
 * @param type     what went wrong
 * @param severity ERROR fails verification, WARNING is logged only
 * @param message  human-readable description
 * @param expected value before obfuscation (nullable)
 * @param actual   value after obfuscation (nullable)
 */
public record IntegrityIssue(
        IntegrityIssueType type,
        Severity severity,
        String message,
        Double expected,
        Double actual
) {
    public enum Severity {
        ERROR,
        WARNING
    }
}
