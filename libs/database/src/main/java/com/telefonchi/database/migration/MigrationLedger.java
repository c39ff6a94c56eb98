package com.telefonchi.database.migration;

import java.time.Instant;
import java.util.List;
import java.util.Set;

/**
 * Persistent record of which migration units have been applied, and the only authority on the
 * current schema version.
 *
 * <p>Implementations run on the connection bound to the caller's current transaction, so {@link
 * #recordApplied} and {@link #recordReverted} commit or roll back together with the unit's own
 * statements. Every failure surfaces as {@link LedgerException}.
 */
public interface MigrationLedger {

    /** Creates the ledger table if it is missing. Idempotent; runs outside unit transactions. */
    void ensureSchema();

    /** Applied entries, ordered by {@code applied_at} then identifier, ascending. */
    List<LedgerEntry> appliedEntries();

    Set<String> appliedIdentifiers();

    void recordApplied(String identifier, Instant appliedAt, String checksum);

    /** Deletes the entry for {@code identifier}; fails if there is none. */
    void recordReverted(String identifier);
}
