package com.telefonchi.database.migration;

/** Thrown when the ledger table cannot be created, read or written. */
public class LedgerException extends MigrationException {

    public LedgerException(String message, Throwable cause) {
        super(message, cause);
    }

    public LedgerException(String identifier, String message, Throwable cause) {
        super(identifier, message, cause);
    }
}
