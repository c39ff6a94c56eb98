package com.telefonchi.database.migration;

/** Thrown by the scaffolder when the generated identifier is already taken. */
public class DuplicateIdentifierException extends MigrationException {

    public DuplicateIdentifierException(String identifier) {
        super(
                identifier,
                "Migration '%s' already exists; retry after a second or choose another name"
                        .formatted(identifier),
                null);
    }
}
