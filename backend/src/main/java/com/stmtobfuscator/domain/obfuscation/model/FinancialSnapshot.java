package com.stmtobfuscator.domain.obfuscation.model;

import java.util.List;

/**
 * Financial figures read from a statement, used to detect collateral damage from substitution.
 *
 * @param beginningBalance "Beginning Balance" value from the full text (nullable)
 * @param endingBalance    "Ending Balance" value from the full text (nullable)
 * @param transactions     rows of the first transaction table, empty when there is none
 * @param transactionTotal sum of transaction amounts (null when no transaction table was found)
 */
public record FinancialSnapshot(
        Double beginningBalance,
        Double endingBalance,
        List<TransactionRecord> transactions,
        Double transactionTotal
) {
    public FinancialSnapshot {
        transactions = transactions == null ? List.of() : List.copyOf(transactions);
    }

    public static FinancialSnapshot empty() {
        return new FinancialSnapshot(null, null, List.of(), null);
    }

    public boolean isEmpty() {
        return beginningBalance == null && endingBalance == null && transactions.isEmpty();
    }
}
