package com.fintech.accountreconciliation.cli;

import com.fintech.accountreconciliation.exception.LedgerParseException;
import com.fintech.accountreconciliation.io.LedgerCsvReader;
import com.fintech.accountreconciliation.io.TransactionReportFormatter;
import com.fintech.accountreconciliation.io.TransactionRowParser;
import com.fintech.accountreconciliation.service.ReconciliationService;
import com.fintech.accountreconciliation.service.TransactionMatcher;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.boot.DefaultApplicationArguments;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ReconciliationCommandLineRunnerTest {

    @TempDir
    Path tempDir;

    private ByteArrayOutputStream output;

    private ReconciliationCommandLineRunner runner;

    @BeforeEach
    void setUp() {
        ReconciliationService service = new ReconciliationService(new TransactionMatcher(), new SimpleMeterRegistry());
        service.initMetrics();

        output = new ByteArrayOutputStream();
        runner = new ReconciliationCommandLineRunner(
                new LedgerCsvReader(new TransactionRowParser()),
                service,
                new TransactionReportFormatter(),
                new PrintStream(output, true, StandardCharsets.UTF_8));
    }

    @Test
    @DisplayName("Should print the report for two ledger files")
    void shouldPrintReport() throws IOException {
        // Given
        Path fileA = write("transactions1.csv",
                "2020-12-04,Tecnologia,16.00,Bitbucket\n"
                        + "2020-12-04,Jurídico,60.00,LinkSquares\n"
                        + "2020-12-05,Tecnologia,50.00,AWS\n");
        Path fileB = write("transactions2.csv",
                "2020-12-04,Tecnologia,16.00,Bitbucket\n"
                        + "2020-12-05,Tecnologia,49.99,AWS\n"
                        + "2020-12-04,Jurídico,60.00,LinkSquares\n");

        // When
        runner.run(new DefaultApplicationArguments(fileA.toString(), fileB.toString()));

        // Then
        assertThat(output.toString(StandardCharsets.UTF_8)).isEqualTo(
                "Transactions A:\n"
                        + "Transaction: 2020-12-04 |   Tecnologia |    Bitbucket | 16.00 | Status:    FOUND\n"
                        + "Transaction: 2020-12-04 |     Jurídico |  LinkSquares | 60.00 | Status:    FOUND\n"
                        + "Transaction: 2020-12-05 |   Tecnologia |          AWS | 50.00 | Status:  MISSING\n"
                        + "\n"
                        + "Transactions B:\n"
                        + "Transaction: 2020-12-04 |   Tecnologia |    Bitbucket | 16.00 | Status:    FOUND\n"
                        + "Transaction: 2020-12-05 |   Tecnologia |          AWS | 49.99 | Status:  MISSING\n"
                        + "Transaction: 2020-12-04 |     Jurídico |  LinkSquares | 60.00 | Status:    FOUND\n");
    }

    @Test
    @DisplayName("Should do nothing without two file arguments")
    void shouldSkipWithoutFiles() {
        runner.run(new DefaultApplicationArguments("--server.port=9090"));
        runner.run(new DefaultApplicationArguments("only-one.csv"));

        assertThat(output.size()).isZero();
    }

    @Test
    @DisplayName("Should ignore option arguments next to the files")
    void shouldIgnoreOptions() throws IOException {
        Path fileA = write("a.csv", "2020-12-04,Tecnologia,16.00,Bitbucket\n");
        Path fileB = write("b.csv", "2020-12-05,Tecnologia,16.00,Bitbucket\n");

        runner.run(new DefaultApplicationArguments("--debug", fileA.toString(), fileB.toString()));

        assertThat(output.toString(StandardCharsets.UTF_8))
                .contains("Transaction: 2020-12-05 |   Tecnologia |    Bitbucket | 16.00 | Status:    FOUND");
    }

    @Test
    @DisplayName("Should fail on a malformed ledger before printing anything")
    void shouldFailOnMalformedLedger() throws IOException {
        Path fileA = write("a.csv", "2020-12-04,Tecnologia,16.00,Bitbucket\n");
        Path fileB = write("b.csv", "2020-12-04,Tecnologia,sixteen,Bitbucket\n");

        assertThatThrownBy(() -> runner.run(new DefaultApplicationArguments(fileA.toString(), fileB.toString())))
                .isInstanceOf(LedgerParseException.class)
                .hasMessageContaining("invalid amount 'sixteen'");
        assertThat(output.size()).isZero();
    }

    @Test
    @DisplayName("Should detect file mode from raw arguments")
    void shouldDetectFileMode() {
        assertThat(ReconciliationCommandLineRunner.isFileMode("a.csv", "b.csv")).isTrue();
        assertThat(ReconciliationCommandLineRunner.isFileMode("--spring.profiles.active=dev", "a.csv", "b.csv")).isTrue();
        assertThat(ReconciliationCommandLineRunner.isFileMode()).isFalse();
        assertThat(ReconciliationCommandLineRunner.isFileMode("a.csv")).isFalse();
        assertThat(ReconciliationCommandLineRunner.isFileMode("a.csv", "b.csv", "c.csv")).isFalse();
    }

    @Test
    @DisplayName("Should keep the web server when the runner is switched off")
    void shouldNotEnterFileModeWhenDisabled() {
        assertThat(ReconciliationCommandLineRunner.isFileMode(
                "--reconciliation.cli.enabled=false", "a.csv", "b.csv")).isFalse();
        assertThat(ReconciliationCommandLineRunner.isFileMode(
                "--reconciliation.cli.enabled=true", "a.csv", "b.csv")).isTrue();
    }

    private Path write(String name, String content) throws IOException {
        return Files.writeString(tempDir.resolve(name), content, StandardCharsets.UTF_8);
    }
}
