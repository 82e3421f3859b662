package com.fintech.accountreconciliation.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One raw ledger row as submitted through the API. Fields stay text here and are
 * parsed by the same rules as CSV rows.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TransactionRow {

    @Schema(description = "Booking date, YYYY-MM-DD", example = "2020-12-04")
    private String date;

    @Schema(example = "Tecnologia")
    private String department;

    @Schema(description = "Decimal amount", example = "16.00")
    private String amount;

    @Schema(example = "Bitbucket")
    private String counterpart;
}
