package com.fintech.accountreconciliation.entity;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Identity of a transaction for matching purposes: department, counterpart and amount.
 * <p>
 * Two transactions sharing a key are match candidates whatever their dates. The amount is
 * compared numerically, so 16.0 and 16.00 produce the same key.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class GroupingKey {

    String department;
    String counterpart;
    BigDecimal value;

    public static GroupingKey of(String department, String counterpart, BigDecimal value) {
        return new GroupingKey(department, counterpart, value.stripTrailingZeros());
    }
}
