package com.fintech.accountreconciliation.service;

import com.fintech.accountreconciliation.entity.GroupingKey;
import com.fintech.accountreconciliation.entity.Transaction;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Matching engine pairing the entries of two ledgers one to one.
 * <p>
 * Algorithm:
 * 1. Index ledger A by grouping key, keeping ledger A order inside each group
 * 2. Order every group by date ascending (stable, ties keep ledger A order)
 * 3. Walk ledger B in order; each entry claims the earliest compatible entry of its group
 * <p>
 * Statuses are updated in place on the given instances. Runs keep no state on this
 * component, so independent ledger pairs can be matched concurrently.
 */
@Component
@Slf4j
public class TransactionMatcher {

    private static final Comparator<Transaction> BY_DATE = Comparator.comparing(Transaction::getDate);

    /**
     * Reconciles {@code ledgerB} against {@code ledgerA}.
     *
     * @return the number of pairs matched during this call
     */
    public int match(@NonNull List<Transaction> ledgerA, @NonNull List<Transaction> ledgerB) {
        if (ledgerA.isEmpty() || ledgerB.isEmpty()) {
            log.debug("Nothing to match, ledger sizes A={} B={}", ledgerA.size(), ledgerB.size());
            return 0;
        }

        Map<GroupingKey, List<Transaction>> index = buildIndex(ledgerA);
        log.debug("Indexed {} entries of ledger A into {} groups", ledgerA.size(), index.size());

        int matched = 0;
        for (Transaction candidate : ledgerB) {
            List<Transaction> group = index.getOrDefault(candidate.groupingKey(), Collections.emptyList());

            for (Transaction counterpart : group) {
                if (counterpart.isCompatibleWith(candidate)) {
                    counterpart.markFound();
                    candidate.markFound();
                    matched++;
                    log.debug("Matched {} with {}", candidate, counterpart);
                    break;
                }
            }
        }
        return matched;
    }

    /**
     * Groups ledger A by key. Each group is sorted once here: sorting is stable and dates
     * never change during a run, so every lookup sees the same order.
     */
    private Map<GroupingKey, List<Transaction>> buildIndex(List<Transaction> ledger) {
        Map<GroupingKey, List<Transaction>> index = new HashMap<>();
        for (Transaction transaction : ledger) {
            index.computeIfAbsent(transaction.groupingKey(), key -> new ArrayList<>()).add(transaction);
        }
        index.values().forEach(group -> group.sort(BY_DATE));
        return index;
    }
}
