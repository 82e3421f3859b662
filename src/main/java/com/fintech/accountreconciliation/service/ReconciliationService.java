package com.fintech.accountreconciliation.service;

import com.fintech.accountreconciliation.dto.ReconciliationResult;
import com.fintech.accountreconciliation.entity.Transaction;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Runs reconciliations between two ledgers and reports on them.
 * <p>
 * Key Design Decisions:
 * 1. Matching is delegated to {@link TransactionMatcher}; this class adds timing,
 *    summary counts, logging and metrics
 * 2. No run state is kept here, concurrent runs on distinct ledgers are allowed
 * 3. The given lists are annotated in place and handed back in the result
 */
@Service
@Slf4j
public class ReconciliationService {

    private final TransactionMatcher matcher;
    private final MeterRegistry meterRegistry;

    // Metrics
    private Counter runCounter;
    private Counter matchedCounter;
    private Counter unmatchedACounter;
    private Counter unmatchedBCounter;
    private Timer reconciliationTimer;

    public ReconciliationService(TransactionMatcher matcher, MeterRegistry meterRegistry) {
        this.matcher = matcher;
        this.meterRegistry = meterRegistry;
    }

    @PostConstruct
    public void initMetrics() {
        runCounter = Counter.builder("reconciliation.runs")
                .description("Reconciliation runs executed")
                .register(meterRegistry);

        matchedCounter = Counter.builder("reconciliation.transactions.matched")
                .description("Transaction pairs matched across ledgers")
                .register(meterRegistry);

        unmatchedACounter = Counter.builder("reconciliation.transactions.unmatched")
                .description("Transactions left without a counterpart")
                .tag("ledger", "A")
                .register(meterRegistry);

        unmatchedBCounter = Counter.builder("reconciliation.transactions.unmatched")
                .description("Transactions left without a counterpart")
                .tag("ledger", "B")
                .register(meterRegistry);

        reconciliationTimer = Timer.builder("reconciliation.duration")
                .description("Time taken to complete reconciliation run")
                .register(meterRegistry);
    }

    /**
     * Reconciles two ledgers.
     *
     * @param ledgerA first ledger, indexed by the matcher
     * @param ledgerB second ledger, walked in order
     * @return ReconciliationResult holding both annotated ledgers and the run statistics
     */
    public ReconciliationResult reconcile(@NonNull List<Transaction> ledgerA, @NonNull List<Transaction> ledgerB) {
        ReconciliationResult result = ReconciliationResult.builder()
                .startedAt(LocalDateTime.now())
                .ledgerA(ledgerA)
                .ledgerB(ledgerB)
                .build();

        log.info("Starting reconciliation of {} against {} transactions", ledgerA.size(), ledgerB.size());
        runCounter.increment();

        return reconciliationTimer.record(() -> {
            int newlyMatched = matcher.match(ledgerA, ledgerB);

            result.setMatchedPairs(newlyMatched);
            result.setUnmatchedA(countMissing(ledgerA));
            result.setUnmatchedB(countMissing(ledgerB));
            result.setCompletedAt(LocalDateTime.now());

            matchedCounter.increment(newlyMatched);
            unmatchedACounter.increment(result.getUnmatchedA());
            unmatchedBCounter.increment(result.getUnmatchedB());

            log.info("Reconciliation completed in {}ms. Matched pairs: {}, Unmatched in A: {}, Unmatched in B: {}",
                    result.getDurationMs(),
                    result.getMatchedPairs(),
                    result.getUnmatchedA(),
                    result.getUnmatchedB());

            return result;
        });
    }

    private static int countMissing(List<Transaction> ledger) {
        return (int) ledger.stream().filter(transaction -> !transaction.isFound()).count();
    }
}
