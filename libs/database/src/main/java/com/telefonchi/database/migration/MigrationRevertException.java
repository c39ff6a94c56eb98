package com.telefonchi.database.migration;

/**
 * Thrown when a unit's revert operation, or the ledger delete that records it, fails. The unit's
 * transaction has been rolled back and its ledger entry is still present.
 */
public class MigrationRevertException extends MigrationException {

    public MigrationRevertException(String identifier, Throwable cause) {
        super(
                identifier,
                "Migration '%s' failed to revert: %s"
                        .formatted(identifier, MigrationApplyException.describe(cause)),
                cause);
    }
}
