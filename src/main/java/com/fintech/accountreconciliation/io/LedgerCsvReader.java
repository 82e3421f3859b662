package com.fintech.accountreconciliation.io;

import com.fintech.accountreconciliation.entity.Transaction;
import com.fintech.accountreconciliation.exception.LedgerParseException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads a ledger from CSV: one transaction per line, no header,
 * columns date, department, amount, counterpart.
 * <p>
 * Blank lines are skipped. Row order is preserved, since the matching engine
 * relies on it to settle ties.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LedgerCsvReader {

    private static final String BYTE_ORDER_MARK = "\uFEFF";

    private final TransactionRowParser rowParser;

    public List<Transaction> read(Path path) {
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return read(reader, path.toString());
        } catch (IOException e) {
            throw new LedgerParseException("cannot read ledger: " + e.getMessage(), path.toString(), e);
        }
    }

    /**
     * Reads a UTF-8 ledger from a stream. Bytes that are not valid UTF-8 fail the read
     * instead of being replaced, the same as reading from a path.
     */
    public List<Transaction> read(InputStream in, String source) {
        return read(new InputStreamReader(in, StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT)), source);
    }

    public List<Transaction> read(Reader in, String source) {
        BufferedReader reader = in instanceof BufferedReader ? (BufferedReader) in : new BufferedReader(in);
        List<Transaction> transactions = new ArrayList<>();
        int lineNumber = 0;

        try {
            String line;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                if (lineNumber == 1 && line.startsWith(BYTE_ORDER_MARK)) {
                    line = line.substring(1);
                }
                if (line.isBlank()) {
                    continue;
                }
                transactions.add(rowParser.parse(splitLine(line, source, lineNumber), source, lineNumber));
            }
        } catch (IOException e) {
            throw new LedgerParseException("cannot read ledger: " + e.getMessage(), source, lineNumber, e);
        }

        log.debug("Read {} transactions from {}", transactions.size(), source);
        return transactions;
    }

    /**
     * Splits one CSV line. Double quotes protect commas; a doubled quote inside a
     * quoted field stands for a literal quote.
     */
    static List<String> splitLine(String line, String source, int lineNumber) {
        List<String> values = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        boolean inQuotes = false;

        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (c == '"') {
                if (inQuotes && i + 1 < line.length() && line.charAt(i + 1) == '"') {
                    current.append('"');
                    i++;
                } else {
                    inQuotes = !inQuotes;
                }
            } else if (c == ',' && !inQuotes) {
                values.add(current.toString());
                current = new StringBuilder();
            } else {
                current.append(c);
            }
        }

        if (inQuotes) {
            throw new LedgerParseException("unterminated quoted field", source, lineNumber);
        }
        values.add(current.toString());
        return values;
    }
}
