package com.stmtobfuscator.domain.obfuscation.model;

import java.util.List;

/**
 * Result of comparing financial figures before and after obfuscation.
 *
 * @param verified true if no ERROR-level issues were found
 * @param issues   all issues, both ERROR and WARNING
 */
public record IntegrityReport(
        boolean verified,
        List<IntegrityIssue> issues
) {
    public static IntegrityReport passed() {
        return new IntegrityReport(true, List.of());
    }

    public List<IntegrityIssue> errors() {
        return issues.stream().filter(i -> i.severity() == IntegrityIssue.Severity.ERROR).toList();
    }

    public List<IntegrityIssue> warnings() {
        return issues.stream().filter(i -> i.severity() == IntegrityIssue.Severity.WARNING).toList();
    }
}
