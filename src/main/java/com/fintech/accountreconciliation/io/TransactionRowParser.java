package com.fintech.accountreconciliation.io;

import com.fintech.accountreconciliation.entity.Transaction;
import com.fintech.accountreconciliation.exception.LedgerParseException;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Turns the raw fields of a ledger row into a {@link Transaction}.
 * <p>
 * Field order is date, department, amount, counterpart. Every parsed transaction
 * starts as MISSING.
 */
@Component
public class TransactionRowParser {

    public static final int FIELD_COUNT = 4;

    private static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ISO_LOCAL_DATE;

    // plain decimal notation, no exponent
    private static final Pattern AMOUNT_FORMAT = Pattern.compile("-?\\d+(\\.\\d+)?");

    public Transaction parse(List<String> fields, String source, int lineNumber) {
        if (fields.size() != FIELD_COUNT) {
            throw new LedgerParseException(
                    String.format("expected %d fields but found %d", FIELD_COUNT, fields.size()),
                    source, lineNumber);
        }
        return parse(fields.get(0), fields.get(1), fields.get(2), fields.get(3), source, lineNumber);
    }

    public Transaction parse(String date, String department, String amount, String counterpart,
                             String source, int lineNumber) {
        return Transaction.builder()
                .date(parseDate(date, source, lineNumber))
                .department(requireText(department, "department", source, lineNumber))
                .value(parseAmount(amount, source, lineNumber))
                .counterpart(requireText(counterpart, "counterpart", source, lineNumber))
                .build();
    }

    private LocalDate parseDate(String raw, String source, int lineNumber) {
        String text = requireText(raw, "date", source, lineNumber);
        try {
            return LocalDate.parse(text, DATE_FORMAT);
        } catch (DateTimeParseException e) {
            throw new LedgerParseException("invalid date '" + text + "', expected YYYY-MM-DD",
                    source, lineNumber, e);
        }
    }

    private BigDecimal parseAmount(String raw, String source, int lineNumber) {
        String text = requireText(raw, "amount", source, lineNumber);
        if (!AMOUNT_FORMAT.matcher(text).matches()) {
            throw new LedgerParseException("invalid amount '" + text + "'", source, lineNumber);
        }
        try {
            return new BigDecimal(text);
        } catch (NumberFormatException e) {
            throw new LedgerParseException("invalid amount '" + text + "'", source, lineNumber, e);
        }
    }

    private String requireText(String raw, String field, String source, int lineNumber) {
        if (raw == null || raw.isBlank()) {
            throw new LedgerParseException("missing " + field, source, lineNumber);
        }
        return raw.trim();
    }
}
