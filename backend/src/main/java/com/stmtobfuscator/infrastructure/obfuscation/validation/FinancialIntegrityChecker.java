package com.stmtobfuscator.infrastructure.obfuscation.validation;

import com.fasterxml.jackson.databind.JsonNode;
import com.stmtobfuscator.domain.obfuscation.model.FinancialSnapshot;
import com.stmtobfuscator.domain.obfuscation.model.IntegrityIssue;
import com.stmtobfuscator.domain.obfuscation.model.IntegrityIssue.Severity;
import com.stmtobfuscator.domain.obfuscation.model.IntegrityIssueType;
import com.stmtobfuscator.domain.obfuscation.model.IntegrityReport;
import com.stmtobfuscator.domain.obfuscation.model.TransactionRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static com.stmtobfuscator.domain.obfuscation.model.DocumentFields.*;

/**
 * Reads balances and transaction rows from a statement before and after substitution,
 * and reports any balance that changed. Advisory only: a mismatch never blocks delivery.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FinancialIntegrityChecker {

    private static final Pattern BEGINNING_BALANCE = Pattern.compile(
            "beginning\\s+balance:?\\s*\\$?([\\d,]+\\.\\d{2})", Pattern.CASE_INSENSITIVE);

    private static final Pattern ENDING_BALANCE = Pattern.compile(
            "ending\\s+balance:?\\s*\\$?([\\d,]+\\.\\d{2})", Pattern.CASE_INSENSITIVE);

    private static final List<String> TRANSACTION_HEADER_KEYWORDS =
            List.of("date", "description", "amount", "balance");

    private final AmountParser amountParser;

    /**
     * Extract balances from the full text and rows from the first transaction table.
     *
     * @param document statement document
     * @return snapshot, empty when nothing financial was found
     */
    public FinancialSnapshot extract(JsonNode document) {
        if (document == null || !document.isObject()) {
            return FinancialSnapshot.empty();
        }

        String fullText = textOf(document.get(FULL_TEXT));
        Double beginning = findBalance(BEGINNING_BALANCE, fullText);
        Double ending = findBalance(ENDING_BALANCE, fullText);

        List<TransactionRecord> transactions = List.of();
        Double total = null;

        JsonNode table = findTransactionTable(document.get(TABLES));
        if (table != null) {
            transactions = extractTransactions(table);
            total = transactions.stream()
                    .map(TransactionRecord::amount)
                    .filter(Objects::nonNull)
                    .mapToDouble(Double::doubleValue)
                    .sum();
        }

        return new FinancialSnapshot(beginning, ending, transactions, total);
    }

    /**
     * Re-read the balances from the obfuscated document and compare them to the snapshot.
     * Transaction rows are not compared.
     *
     * @param before   snapshot of the original document
     * @param document obfuscated document
     * @return report; verified unless a balance changed value
     */
    public IntegrityReport verify(FinancialSnapshot before, JsonNode document) {
        if (before == null || before.isEmpty()) {
            return IntegrityReport.passed();
        }

        FinancialSnapshot after = extract(document);
        List<IntegrityIssue> issues = new ArrayList<>();

        compare("beginning_balance", IntegrityIssueType.BEGINNING_BALANCE_MISMATCH,
                before.beginningBalance(), after.beginningBalance(), issues);
        compare("ending_balance", IntegrityIssueType.ENDING_BALANCE_MISMATCH,
                before.endingBalance(), after.endingBalance(), issues);

        boolean verified = issues.stream().noneMatch(i -> i.severity() == Severity.ERROR);

        if (!verified) {
            log.warn("[Integrity] Financial integrity check failed after obfuscation: {}",
                    issues.stream().map(IntegrityIssue::message).toList());
        } else if (!issues.isEmpty()) {
            log.info("[Integrity] Verified with warnings: {}",
                    issues.stream().map(IntegrityIssue::message).toList());
        }

        return new IntegrityReport(verified, issues);
    }

    // ===== Internal methods =====

    private void compare(String key, IntegrityIssueType mismatchType,
                         Double expected, Double actual, List<IntegrityIssue> issues) {
        if (expected == null) {
            return;
        }
        if (actual == null) {
            issues.add(new IntegrityIssue(IntegrityIssueType.BALANCE_MISSING_AFTER, Severity.WARNING,
                    key + " no longer found after obfuscation", expected, null));
            return;
        }
        if (Double.compare(expected, actual) != 0) {
            issues.add(new IntegrityIssue(mismatchType, Severity.ERROR,
                    key + " mismatch: " + expected + " → " + actual, expected, actual));
        }
    }

    private Double findBalance(Pattern pattern, String fullText) {
        Matcher matcher = pattern.matcher(fullText);
        if (matcher.find()) {
            return amountParser.parse(matcher.group(1));
        }
        return null;
    }

    private JsonNode findTransactionTable(JsonNode tables) {
        if (tables == null || tables.isNull() || tables.isMissingNode()) {
            return null;
        }
        if (!tables.isArray()) {
            log.warn("[Integrity] tables is not an array: {}", tables.getNodeType());
            return null;
        }

        for (JsonNode table : tables) {
            if (!table.isObject()) {
                log.warn("[Integrity] Table is not an object: {}", table.getNodeType());
                continue;
            }
            String headerText = String.join(" ", headersOf(table));
            if (TRANSACTION_HEADER_KEYWORDS.stream().anyMatch(headerText::contains)) {
                return table;
            }
        }
        return null;
    }

    private List<TransactionRecord> extractTransactions(JsonNode table) {
        List<String> headers = headersOf(table);
        int dateCol = columnOf(headers, "date");
        int descCol = columnOf(headers, "description");
        int amountCol = columnOf(headers, "amount");
        int balanceCol = columnOf(headers, "balance");
        int requiredWidth = Math.max(Math.max(dateCol, descCol), Math.max(amountCol, balanceCol)) + 1;

        List<TransactionRecord> transactions = new ArrayList<>();
        JsonNode rows = table.get(ROWS);
        if (rows == null || !rows.isArray()) {
            return transactions;
        }

        for (JsonNode row : rows) {
            if (!row.isArray() || row.size() < requiredWidth) {
                continue;
            }
            transactions.add(new TransactionRecord(
                    dateCol >= 0 ? cellText(row.get(dateCol)) : null,
                    descCol >= 0 ? cellText(row.get(descCol)) : null,
                    amountCol >= 0 ? amountParser.parse(cellText(row.get(amountCol))) : null,
                    balanceCol >= 0 ? amountParser.parse(cellText(row.get(balanceCol))) : null
            ));
        }
        return transactions;
    }

    private List<String> headersOf(JsonNode table) {
        JsonNode headers = table.get(HEADERS);
        List<String> result = new ArrayList<>();
        if (headers != null && headers.isArray()) {
            for (JsonNode header : headers) {
                result.add(cellText(header).toLowerCase(Locale.ROOT));
            }
        }
        return result;
    }

    private int columnOf(List<String> headers, String keyword) {
        for (int i = 0; i < headers.size(); i++) {
            if (headers.get(i).contains(keyword)) {
                return i;
            }
        }
        return -1;
    }

    private String cellText(JsonNode cell) {
        return cell == null || cell.isNull() ? "" : cell.asText();
    }

    private String textOf(JsonNode node) {
        return node != null && node.isTextual() ? node.textValue() : "";
    }
}
