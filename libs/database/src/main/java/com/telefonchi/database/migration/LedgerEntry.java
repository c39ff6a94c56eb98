package com.telefonchi.database.migration;

import java.time.Instant;

/**
 * One applied migration as recorded in the ledger table.
 *
 * @param identifier identifier of the applied unit; the unit may since have been removed from the
 *     repository
 * @param appliedAt when the unit's transaction committed
 * @param checksum checksum of the unit at the time it was applied, or null
 */
public record LedgerEntry(String identifier, Instant appliedAt, String checksum) {}
