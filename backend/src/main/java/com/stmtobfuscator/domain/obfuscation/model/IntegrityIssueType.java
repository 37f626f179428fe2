package com.stmtobfuscator.domain.obfuscation.model;

public enum IntegrityIssueType {
    BEGINNING_BALANCE_MISMATCH,
    ENDING_BALANCE_MISMATCH,
    BALANCE_MISSING_AFTER
}
