package com.stmtobfuscator.domain.obfuscation.model;

/**
 * One row of a statement's transaction table. Any field may be null when the
 * table has no matching column.
 */
public record TransactionRecord(
        String date,
        String description,
        Double amount,
        Double balance
) {}
