package com.fintech.accountreconciliation;

import com.fintech.accountreconciliation.cli.ReconciliationCommandLineRunner;
import org.springframework.boot.Banner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;

import java.util.Map;

/**
 * Account Reconciliation Service
 * <p>
 * This service pairs the transactions of two independently recorded ledgers and flags,
 * for every entry of either ledger, whether a counterpart exists in the other one.
 * <p>
 * Key Features:
 * - One-to-one matching on department, counterpart and amount, with one day of date tolerance
 * - Earliest-dated candidate wins when several entries could match
 * - CSV ledgers reconciled from the command line or uploaded through the REST API
 * - Metrics and logging for every run
 */
@SpringBootApplication
public class AccountReconciliationApplication {

    public static void main(String[] args) {
        SpringApplication application = new SpringApplication(AccountReconciliationApplication.class);
        if (ReconciliationCommandLineRunner.isFileMode(args)) {
            // one-shot run: print the report and exit without opening a port
            application.setWebApplicationType(WebApplicationType.NONE);
            application.setBannerMode(Banner.Mode.OFF);
            application.setDefaultProperties(Map.of("logging.level.root", "WARN"));
        }
        application.run(args);
    }
}
