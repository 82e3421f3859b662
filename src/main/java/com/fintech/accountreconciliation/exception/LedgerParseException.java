package com.fintech.accountreconciliation.exception;

/**
 * Thrown when a ledger source cannot be turned into transactions.
 * This covers unreadable files as well as malformed rows (bad dates, non-numeric amounts,
 * wrong field count). Raised before any matching takes place.
 */
public class LedgerParseException extends ReconciliationException {

    private final String source;
    private final int lineNumber;

    public LedgerParseException(String message, String source, int lineNumber) {
        super(format(message, source, lineNumber));
        this.source = source;
        this.lineNumber = lineNumber;
    }

    public LedgerParseException(String message, String source, int lineNumber, Throwable cause) {
        super(format(message, source, lineNumber), cause);
        this.source = source;
        this.lineNumber = lineNumber;
    }

    public LedgerParseException(String message, String source, Throwable cause) {
        this(message, source, 0, cause);
    }

    public String getSource() {
        return source;
    }

    /**
     * 1-based line of the offending row, or 0 when the error concerns the whole source.
     */
    public int getLineNumber() {
        return lineNumber;
    }

    private static String format(String message, String source, int lineNumber) {
        if (lineNumber > 0) {
            return String.format("%s:%d: %s", source, lineNumber, message);
        }
        return String.format("%s: %s", source, message);
    }
}
