package com.fintech.accountreconciliation.io;

import com.fintech.accountreconciliation.dto.ReconciliationResult;
import com.fintech.accountreconciliation.entity.Transaction;
import org.springframework.stereotype.Component;

import java.math.RoundingMode;
import java.time.format.DateTimeFormatter;
import java.util.List;

/**
 * Renders reconciled ledgers as fixed-width text, e.g.
 * <pre>
 * Transaction: 2020-12-04 |   Tecnologia |    Bitbucket | 16.00 | Status:    FOUND
 * </pre>
 */
@Component
public class TransactionReportFormatter {

    private static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ISO_LOCAL_DATE;

    public String format(Transaction transaction) {
        return String.format("Transaction: %s | %12s | %12s | %4s | Status: %8s",
                DATE_FORMAT.format(transaction.getDate()),
                transaction.getDepartment(),
                transaction.getCounterpart(),
                // display only, matching always uses the exact value
                transaction.getValue().setScale(2, RoundingMode.HALF_EVEN).toPlainString(),
                transaction.getStatus());
    }

    public String format(ReconciliationResult result) {
        StringBuilder report = new StringBuilder();
        appendLedger(report, "Transactions A:", result.getLedgerA());
        report.append('\n');
        appendLedger(report, "Transactions B:", result.getLedgerB());
        return report.toString();
    }

    private void appendLedger(StringBuilder report, String title, List<Transaction> ledger) {
        report.append(title).append('\n');
        for (Transaction transaction : ledger) {
            report.append(format(transaction)).append('\n');
        }
    }
}
