package com.fintech.accountreconciliation.dto;

import com.fintech.accountreconciliation.entity.Transaction;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Captures the outcome of a reconciliation run: both ledgers with their statuses
 * updated, in input order, plus summary counts for reporting and monitoring.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReconciliationResult {

    private LocalDateTime startedAt;
    private LocalDateTime completedAt;

    @Builder.Default
    private List<Transaction> ledgerA = new ArrayList<>();

    @Builder.Default
    private List<Transaction> ledgerB = new ArrayList<>();

    @Builder.Default
    private int matchedPairs = 0;

    @Builder.Default
    private int unmatchedA = 0;

    @Builder.Default
    private int unmatchedB = 0;

    public long getDurationMs() {
        if (startedAt == null || completedAt == null) {
            return 0;
        }
        return Duration.between(startedAt, completedAt).toMillis();
    }
}
