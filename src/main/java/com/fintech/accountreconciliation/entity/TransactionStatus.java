package com.fintech.accountreconciliation.entity;

/**
 * Reconciliation status of a ledger entry.
 * <p>
 * The only transition is MISSING to FOUND, made when the matching engine pairs the
 * entry with one in the opposite ledger.
 */
public enum TransactionStatus {
    /**
     * No counterpart found in the opposite ledger (yet).
     */
    MISSING,

    /**
     * Paired with exactly one entry of the opposite ledger. Terminal.
     */
    FOUND
}
