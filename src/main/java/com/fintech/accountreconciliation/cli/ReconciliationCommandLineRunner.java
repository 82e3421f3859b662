package com.fintech.accountreconciliation.cli;

import com.fintech.accountreconciliation.dto.ReconciliationResult;
import com.fintech.accountreconciliation.entity.Transaction;
import com.fintech.accountreconciliation.io.LedgerCsvReader;
import com.fintech.accountreconciliation.io.TransactionReportFormatter;
import com.fintech.accountreconciliation.service.ReconciliationService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.env.SimpleCommandLinePropertySource;
import org.springframework.stereotype.Component;

import java.io.PrintStream;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Reconciles two CSV ledgers named on the command line and prints both of them
 * with their statuses:
 * <pre>
 * java -jar account-reconciliation-service.jar transactions1.csv transactions2.csv
 * </pre>
 * Without exactly two file arguments the runner does nothing and the HTTP API serves
 * requests instead.
 */
@Component
@ConditionalOnProperty(name = ReconciliationCommandLineRunner.ENABLED_PROPERTY, havingValue = "true", matchIfMissing = true)
@Slf4j
public class ReconciliationCommandLineRunner implements ApplicationRunner {

    public static final String ENABLED_PROPERTY = "reconciliation.cli.enabled";

    private final LedgerCsvReader csvReader;
    private final ReconciliationService reconciliationService;
    private final TransactionReportFormatter formatter;
    private final PrintStream out;

    @Autowired
    public ReconciliationCommandLineRunner(LedgerCsvReader csvReader,
                                           ReconciliationService reconciliationService,
                                           TransactionReportFormatter formatter) {
        this(csvReader, reconciliationService, formatter, System.out);
    }

    ReconciliationCommandLineRunner(LedgerCsvReader csvReader,
                                    ReconciliationService reconciliationService,
                                    TransactionReportFormatter formatter,
                                    PrintStream out) {
        this.csvReader = csvReader;
        this.reconciliationService = reconciliationService;
        this.formatter = formatter;
        this.out = out;
    }

    /**
     * True when the raw arguments name exactly two ledger files and the runner is not
     * switched off. Used before start-up to decide whether the web server is needed, so
     * only the command line and JVM system properties are consulted for the switch.
     */
    public static boolean isFileMode(String... args) {
        String enabled = new SimpleCommandLinePropertySource(args).getProperty(ENABLED_PROPERTY);
        if (enabled == null) {
            enabled = System.getProperty(ENABLED_PROPERTY, "true");
        }
        return Boolean.parseBoolean(enabled) && ledgerFiles(List.of(args)).size() == 2;
    }

    @Override
    public void run(ApplicationArguments args) {
        List<String> files = ledgerFiles(args.getNonOptionArgs());
        if (files.size() != 2) {
            log.debug("No ledger files on the command line, skipping file reconciliation");
            return;
        }

        Path pathA = Path.of(files.get(0));
        Path pathB = Path.of(files.get(1));
        log.info("Reconciling {} against {}", pathA, pathB);

        List<Transaction> ledgerA = csvReader.read(pathA);
        List<Transaction> ledgerB = csvReader.read(pathB);

        ReconciliationResult result = reconciliationService.reconcile(ledgerA, ledgerB);

        out.print(formatter.format(result));
        out.flush();
    }

    private static List<String> ledgerFiles(List<String> args) {
        return args.stream()
                .filter(arg -> !arg.startsWith("--"))
                .collect(Collectors.toList());
    }
}
