package com.telefonchi.database.migration;

/**
 * Thrown by rollback when the ledger names a unit that no longer exists in the repository, so its
 * revert logic is unavailable. Rollback stops at that unit.
 */
public class UnresolvableRevertException extends MigrationException {

    public UnresolvableRevertException(String identifier) {
        super(
                identifier,
                ("Migration '%s' is recorded as applied but is not present in the repository;"
                                + " cannot revert it")
                        .formatted(identifier),
                null);
    }
}
