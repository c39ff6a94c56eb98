package com.telefonchi.database.migration;

/**
 * Thrown when migration units cannot be discovered or registered: duplicate identifiers, malformed
 * identifiers, a unit missing one of its two directions, or an unreadable script.
 *
 * <p>Always raised before any database interaction.
 */
public class DiscoveryException extends MigrationException {

    public DiscoveryException(String message) {
        super(message);
    }

    public DiscoveryException(String message, Throwable cause) {
        super(message, cause);
    }
}
