package com.telefonchi.database.migration;

/**
 * Thrown when a unit's forward operation, or the ledger write that records it, fails. The unit's
 * transaction has been rolled back; units applied earlier in the same run stay committed.
 */
public class MigrationApplyException extends MigrationException {

    public MigrationApplyException(String identifier, Throwable cause) {
        super(
                identifier,
                "Migration '%s' failed to apply: %s".formatted(identifier, describe(cause)),
                cause);
    }

    static String describe(Throwable cause) {
        if (cause == null) {
            return "unknown cause";
        }
        String message = cause.getMessage();
        return message == null || message.isBlank() ? cause.getClass().getSimpleName() : message;
    }
}
