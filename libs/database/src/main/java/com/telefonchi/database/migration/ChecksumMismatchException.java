package com.telefonchi.database.migration;

/**
 * Thrown when a unit recorded in the ledger has been edited since it was applied. Applied units are
 * immutable; the fix is a new migration, not an edit.
 */
public class ChecksumMismatchException extends MigrationException {

    private final String recordedChecksum;
    private final String currentChecksum;

    public ChecksumMismatchException(
            String identifier, String recordedChecksum, String currentChecksum) {
        super(
                identifier,
                "Migration '%s' was modified after it was applied (recorded %s, current %s)"
                        .formatted(identifier, recordedChecksum, currentChecksum),
                null);
        this.recordedChecksum = recordedChecksum;
        this.currentChecksum = currentChecksum;
    }

    public String recordedChecksum() {
        return recordedChecksum;
    }

    public String currentChecksum() {
        return currentChecksum;
    }
}
