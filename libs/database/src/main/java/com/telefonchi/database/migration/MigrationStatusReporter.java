package com.telefonchi.database.migration;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Read-only comparison of the repository against the ledger.
 *
 * <p>The only write it may cause is the ledger table bootstrap ({@link
 * MigrationLedger#ensureSchema()}), so that status works against a fresh database.
 */
public class MigrationStatusReporter {

    /** Whether a unit has been applied to the database. */
    public enum State {
        APPLIED,
        PENDING
    }

    /**
     * Status of one unit.
     *
     * @param identifier unit identifier
     * @param state applied or pending
     * @param appliedAt when it was applied; null while pending
     * @param sourcePresent false when the ledger names a unit the repository no longer has
     * @param checksumMatches whether the recorded and current checksums agree; null when either is
     *     unknown or the unit is pending
     */
    public record UnitStatus(
            String identifier,
            State state,
            Instant appliedAt,
            boolean sourcePresent,
            Boolean checksumMatches) {}

    /**
     * Full status of one database.
     *
     * @param units every known unit, ordered by identifier
     * @param available number of units in the repository
     * @param applied number of ledger entries
     * @param pending number of repository units not yet applied
     * @param currentVersion highest applied identifier, null when nothing is applied
     */
    public record StatusReport(
            List<UnitStatus> units,
            int available,
            int applied,
            int pending,
            String currentVersion) {

        public StatusReport {
            units = List.copyOf(units);
        }

        public List<String> pendingIdentifiers() {
            return units.stream()
                    .filter(u -> u.state() == State.PENDING)
                    .map(UnitStatus::identifier)
                    .toList();
        }

        public boolean upToDate() {
            return pending == 0;
        }
    }

    private final MigrationRepository repository;
    private final MigrationLedger ledger;

    public MigrationStatusReporter(MigrationRepository repository, MigrationLedger ledger) {
        if (repository == null) {
            throw new IllegalArgumentException("repository must not be null");
        }
        if (ledger == null) {
            throw new IllegalArgumentException("ledger must not be null");
        }
        this.repository = repository;
        this.ledger = ledger;
    }

    public StatusReport status() {
        ledger.ensureSchema();
        Map<String, LedgerEntry> applied = new LinkedHashMap<>();
        for (LedgerEntry entry : ledger.appliedEntries()) {
            applied.put(entry.identifier(), entry);
        }

        List<UnitStatus> units = new ArrayList<>();
        int pending = 0;
        for (MigrationUnit unit : repository.list()) {
            LedgerEntry entry = applied.get(unit.identifier());
            if (entry == null) {
                units.add(new UnitStatus(unit.identifier(), State.PENDING, null, true, null));
                pending++;
            } else {
                units.add(
                        new UnitStatus(
                                unit.identifier(),
                                State.APPLIED,
                                entry.appliedAt(),
                                true,
                                checksumMatches(entry.checksum(), unit.checksum())));
            }
        }
        for (LedgerEntry entry : applied.values()) {
            if (!repository.contains(entry.identifier())) {
                units.add(
                        new UnitStatus(
                                entry.identifier(), State.APPLIED, entry.appliedAt(), false, null));
            }
        }
        units.sort(Comparator.comparing(UnitStatus::identifier));

        String currentVersion =
                applied.keySet().stream().max(Comparator.naturalOrder()).orElse(null);
        return new StatusReport(units, repository.size(), applied.size(), pending, currentVersion);
    }

    private static Boolean checksumMatches(String recorded, String current) {
        if (recorded == null || current == null) {
            return null;
        }
        return Objects.equals(recorded, current);
    }
}
