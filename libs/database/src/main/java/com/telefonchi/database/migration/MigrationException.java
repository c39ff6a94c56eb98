package com.telefonchi.database.migration;

import java.util.Optional;

/**
 * Base type for every failure raised by the migration engine.
 *
 * <p>Unchecked: a failed migration run is not something callers can recover from in-process. The
 * run halts and the exception surfaces to the entry point, which reports it and exits non-zero.
 */
public class MigrationException extends RuntimeException {

    private final String identifier;

    public MigrationException(String message) {
        this(null, message, null);
    }

    public MigrationException(String message, Throwable cause) {
        this(null, message, cause);
    }

    protected MigrationException(String identifier, String message, Throwable cause) {
        super(message, cause);
        this.identifier = identifier;
    }

    /** The migration unit this failure concerns, when there is one. */
    public Optional<String> identifier() {
        return Optional.ofNullable(identifier);
    }
}
