package com.fintech.accountreconciliation.dto;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Request body for a JSON reconciliation run. Both ledgers are required, either may be empty.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LedgerReconciliationRequest {

    @NotNull
    private List<@NotNull TransactionRow> ledgerA;

    @NotNull
    private List<@NotNull TransactionRow> ledgerB;
}
