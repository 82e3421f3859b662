package com.fintech.accountreconciliation.controller;

import com.fintech.accountreconciliation.dto.LedgerReconciliationRequest;
import com.fintech.accountreconciliation.dto.ReconciliationResult;
import com.fintech.accountreconciliation.dto.TransactionRow;
import com.fintech.accountreconciliation.entity.Transaction;
import com.fintech.accountreconciliation.exception.LedgerParseException;
import com.fintech.accountreconciliation.io.LedgerCsvReader;
import com.fintech.accountreconciliation.io.TransactionReportFormatter;
import com.fintech.accountreconciliation.io.TransactionRowParser;
import com.fintech.accountreconciliation.service.ReconciliationService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;

/**
 * REST API for reconciliation operations.
 * <p>
 * Provides endpoints for:
 * - Reconciling two ledgers posted as JSON rows
 * - Reconciling two uploaded CSV ledgers
 * - Rendering the plain-text report of an uploaded pair
 */
@RestController
@RequestMapping("/api/v1/reconciliation")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Reconciliation", description = "Ledger reconciliation operations API")
public class ReconciliationController {

    private final ReconciliationService reconciliationService;
    private final TransactionRowParser rowParser;
    private final LedgerCsvReader csvReader;
    private final TransactionReportFormatter formatter;

    @Operation(
            summary = "Reconcile two ledgers",
            description = "Matches the rows of ledger B against ledger A and returns both ledgers with every row marked FOUND or MISSING."
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Reconciliation completed successfully",
                    content = @Content(schema = @Schema(implementation = ReconciliationResult.class))),
            @ApiResponse(responseCode = "400", description = "A ledger is missing or a row is malformed")
    })
    @PostMapping(value = "/run", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<ReconciliationResult> reconcile(@Valid @RequestBody LedgerReconciliationRequest request) {
        log.info("Reconciliation requested via API with {} and {} rows",
                request.getLedgerA().size(), request.getLedgerB().size());

        List<Transaction> ledgerA = toTransactions(request.getLedgerA(), "ledgerA");
        List<Transaction> ledgerB = toTransactions(request.getLedgerB(), "ledgerB");

        return ResponseEntity.ok(reconciliationService.reconcile(ledgerA, ledgerB));
    }

    @Operation(
            summary = "Reconcile two CSV ledgers",
            description = "Accepts two CSV files (date,department,amount,counterpart per line, no header) and returns both ledgers annotated."
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Reconciliation completed successfully",
                    content = @Content(schema = @Schema(implementation = ReconciliationResult.class))),
            @ApiResponse(responseCode = "400", description = "A file could not be parsed")
    })
    @PostMapping(value = "/run/csv", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<ReconciliationResult> reconcileCsv(
            @Parameter(description = "First ledger") @RequestPart("ledgerA") MultipartFile ledgerA,
            @Parameter(description = "Second ledger") @RequestPart("ledgerB") MultipartFile ledgerB) {
        return ResponseEntity.ok(reconcileFiles(ledgerA, ledgerB));
    }

    @Operation(
            summary = "Render reconciliation report",
            description = "Same input as /run/csv; returns the fixed-width text report, one line per transaction."
    )
    @ApiResponse(responseCode = "200", description = "Report rendered successfully")
    @PostMapping(value = "/report", consumes = MediaType.MULTIPART_FORM_DATA_VALUE,
            produces = "text/plain;charset=UTF-8")
    public ResponseEntity<String> report(
            @Parameter(description = "First ledger") @RequestPart("ledgerA") MultipartFile ledgerA,
            @Parameter(description = "Second ledger") @RequestPart("ledgerB") MultipartFile ledgerB) {
        return ResponseEntity.ok(formatter.format(reconcileFiles(ledgerA, ledgerB)));
    }

    private ReconciliationResult reconcileFiles(MultipartFile fileA, MultipartFile fileB) {
        log.info("CSV reconciliation requested via API: {} ({} bytes), {} ({} bytes)",
                fileA.getOriginalFilename(), fileA.getSize(), fileB.getOriginalFilename(), fileB.getSize());

        List<Transaction> ledgerA = readCsv(fileA, "ledgerA");
        List<Transaction> ledgerB = readCsv(fileB, "ledgerB");
        return reconciliationService.reconcile(ledgerA, ledgerB);
    }

    private List<Transaction> readCsv(MultipartFile file, String part) {
        String source = file.getOriginalFilename() != null ? file.getOriginalFilename() : part;
        try (InputStream in = file.getInputStream()) {
            return csvReader.read(in, source);
        } catch (IOException e) {
            throw new LedgerParseException("cannot read upload: " + e.getMessage(), source, e);
        }
    }

    private List<Transaction> toTransactions(List<TransactionRow> rows, String source) {
        List<Transaction> transactions = new ArrayList<>(rows.size());
        for (int i = 0; i < rows.size(); i++) {
            TransactionRow row = rows.get(i);
            transactions.add(rowParser.parse(row.getDate(), row.getDepartment(), row.getAmount(),
                    row.getCounterpart(), source, i + 1));
        }
        return transactions;
    }
}
