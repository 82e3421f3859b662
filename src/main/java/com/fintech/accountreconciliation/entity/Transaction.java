package com.fintech.accountreconciliation.entity;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;

/**
 * Represents one entry of a ledger taking part in a reconciliation run.
 * <p>
 * Date, department, counterpart and value are fixed at construction. Only the status
 * changes, and only from MISSING to FOUND. Equality is identity: two entries with the same
 * fields are still two different ledger rows.
 */
@Getter
@ToString
public class Transaction {

    /**
     * Maximum distance, in calendar days, between the dates of two matching entries.
     */
    public static final long DATE_TOLERANCE_DAYS = 1;

    private final LocalDate date;

    private final String department;

    private final String counterpart;

    private final BigDecimal value;

    private TransactionStatus status;

    @Builder
    public Transaction(@NonNull LocalDate date,
                       @NonNull String department,
                       @NonNull String counterpart,
                       @NonNull BigDecimal value,
                       TransactionStatus status) {
        this.date = date;
        this.department = department;
        this.counterpart = counterpart;
        this.value = value;
        this.status = status == null ? TransactionStatus.MISSING : status;
    }

    public GroupingKey groupingKey() {
        return GroupingKey.of(department, counterpart, value);
    }

    @JsonIgnore
    public boolean isFound() {
        return status == TransactionStatus.FOUND;
    }

    /**
     * Checks whether this entry and {@code other} can be paired.
     * <p>
     * Both must still be MISSING, share the same grouping key, and be dated at most
     * {@value #DATE_TOLERANCE_DAYS} day apart in either direction. Reads state only.
     */
    public boolean isCompatibleWith(Transaction other) {
        // already reconciled entries are excluded, the pairing is one to one
        if (isFound() || other.isFound()) {
            return false;
        }

        if (!groupingKey().equals(other.groupingKey())) {
            return false;
        }

        long days = ChronoUnit.DAYS.between(date, other.date);
        return Math.abs(days) <= DATE_TOLERANCE_DAYS;
    }

    /**
     * Marks this entry as reconciled. FOUND is terminal, so calling it twice is harmless.
     */
    public void markFound() {
        this.status = TransactionStatus.FOUND;
    }
}
