package com.telefonchi.database.migration;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Applies and reverts migration units against one database.
 *
 * <p>The runner holds no state of its own: every call recomputes what to do from the repository
 * and the ledger, so it is always safe to re-run. Units are processed one at a time on the calling
 * thread, each inside its own transaction that also carries the ledger write. The first failure
 * stops the run; units committed before it stay committed.
 *
 * <p>Assumes a single runner per database. Nothing here guards against two processes migrating
 * the same database concurrently.
 */
public class MigrationRunner {

    private static final Logger log = LoggerFactory.getLogger(MigrationRunner.class);

    /** MDC key holding the identifier of the unit being processed. */
    public static final String MDC_MIGRATION = "migration";

    /** MDC key holding {@code apply} or {@code revert}. */
    public static final String MDC_OPERATION = "operation";

    /** Most recently applied first; identifier descending breaks ties on {@code applied_at}. */
    static final Comparator<LedgerEntry> ROLLBACK_ORDER =
            Comparator.comparing(LedgerEntry::appliedAt)
                    .thenComparing(LedgerEntry::identifier)
                    .reversed();

    private final MigrationRepository repository;
    private final MigrationLedger ledger;
    private final MigrationContext context;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;
    private final MigrationMetrics metrics;
    private final boolean validateChecksums;
    private final MigrationStatusReporter statusReporter;

    /**
     * @param repository units to apply
     * @param ledger applied-unit record; must use the same data source as {@code context}
     * @param context statement surface handed to units
     * @param transactionTemplate opens one transaction per unit on the migration data source
     * @param clock source of {@code applied_at} timestamps
     * @param metrics unit counters and timers
     * @param validateChecksums whether {@link #migrate()} rejects applied units that were edited
     */
    public MigrationRunner(
            MigrationRepository repository,
            MigrationLedger ledger,
            MigrationContext context,
            TransactionTemplate transactionTemplate,
            Clock clock,
            MigrationMetrics metrics,
            boolean validateChecksums) {
        if (repository == null
                || ledger == null
                || context == null
                || transactionTemplate == null
                || clock == null
                || metrics == null) {
            throw new IllegalArgumentException("MigrationRunner collaborators must not be null");
        }
        this.repository = repository;
        this.ledger = ledger;
        this.context = context;
        this.transactionTemplate = transactionTemplate;
        this.clock = clock;
        this.metrics = metrics;
        this.validateChecksums = validateChecksums;
        this.statusReporter = new MigrationStatusReporter(repository, ledger);
    }

    /**
     * Applies every pending unit in ascending identifier order.
     *
     * @return identifiers applied by this call, in order; empty when nothing was pending
     * @throws LedgerException if the ledger cannot be prepared or read
     * @throws ChecksumMismatchException if an applied unit was edited; checked before any unit
     *     runs
     * @throws MigrationApplyException on the first unit that fails; later units are not attempted
     */
    public List<String> migrate() {
        ledger.ensureSchema();
        List<LedgerEntry> entries = ledger.appliedEntries();
        if (validateChecksums) {
            verifyChecksums(entries);
        }

        Set<String> applied = new HashSet<>();
        for (LedgerEntry entry : entries) {
            applied.add(entry.identifier());
        }
        List<MigrationUnit> pending =
                repository.list().stream().filter(u -> !applied.contains(u.identifier())).toList();

        if (pending.isEmpty()) {
            log.info("No pending migrations");
            return List.of();
        }
        log.info("Found {} pending migration(s)", pending.size());

        List<String> done = new ArrayList<>(pending.size());
        for (MigrationUnit unit : pending) {
            apply(unit);
            done.add(unit.identifier());
        }
        log.info("All migrations completed successfully ({} applied)", done.size());
        return List.copyOf(done);
    }

    /** Reverts the most recently applied unit. */
    public List<String> rollback() {
        return rollback(1);
    }

    /**
     * Reverts up to {@code count} units, most recently applied first, as recorded by the ledger.
     * Asking for more units than are applied reverts all of them.
     *
     * @return identifiers reverted by this call, in order
     * @throws IllegalArgumentException if {@code count} is less than 1
     * @throws UnresolvableRevertException if a unit to revert is missing from the repository
     * @throws MigrationRevertException on the first unit that fails to revert
     */
    public List<String> rollback(int count) {
        if (count < 1) {
            throw new IllegalArgumentException("count must be at least 1, was " + count);
        }
        ledger.ensureSchema();
        List<LedgerEntry> entries = new ArrayList<>(ledger.appliedEntries());
        if (entries.isEmpty()) {
            log.info("No migrations to rollback");
            return List.of();
        }
        entries.sort(ROLLBACK_ORDER);
        List<LedgerEntry> targets = entries.subList(0, Math.min(count, entries.size()));
        log.info("Rolling back {} migration(s)", targets.size());

        List<String> done = new ArrayList<>(targets.size());
        for (LedgerEntry entry : targets) {
            MigrationUnit unit =
                    repository
                            .get(entry.identifier())
                            .orElseThrow(() -> new UnresolvableRevertException(entry.identifier()));
            revert(unit);
            done.add(unit.identifier());
        }
        log.info("Rollback completed successfully ({} reverted)", done.size());
        return List.copyOf(done);
    }

    /**
     * Reports applied and pending units. No unit runs; at most the ledger table is created or a
     * legacy one adopted.
     *
     * @return a snapshot of the repository against the ledger
     * @throws LedgerException if the ledger cannot be prepared or read
     */
    public MigrationStatusReporter.StatusReport status() {
        return statusReporter.status();
    }

    private void apply(MigrationUnit unit) {
        String identifier = unit.identifier();
        long started = System.nanoTime();
        try (MDC.MDCCloseable m = MDC.putCloseable(MDC_MIGRATION, identifier);
                MDC.MDCCloseable o = MDC.putCloseable(MDC_OPERATION, MigrationMetrics.APPLY)) {
            log.info("Applying migration {}", identifier);
            try {
                transactionTemplate.executeWithoutResult(
                        status -> {
                            unit.apply(context);
                            ledger.recordApplied(identifier, clock.instant(), unit.checksum());
                        });
            } catch (RuntimeException e) {
                metrics.recordFailure(MigrationMetrics.APPLY, since(started));
                log.error(
                        "Migration {} failed and was rolled back: {}", identifier, e.getMessage());
                throw new MigrationApplyException(identifier, e);
            }
            Duration elapsed = since(started);
            metrics.recordSuccess(MigrationMetrics.APPLY, elapsed);
            log.info("Applied migration {} in {} ms", identifier, elapsed.toMillis());
        }
    }

    private void revert(MigrationUnit unit) {
        String identifier = unit.identifier();
        long started = System.nanoTime();
        try (MDC.MDCCloseable m = MDC.putCloseable(MDC_MIGRATION, identifier);
                MDC.MDCCloseable o = MDC.putCloseable(MDC_OPERATION, MigrationMetrics.REVERT)) {
            log.info("Reverting migration {}", identifier);
            try {
                transactionTemplate.executeWithoutResult(
                        status -> {
                            unit.revert(context);
                            ledger.recordReverted(identifier);
                        });
            } catch (RuntimeException e) {
                metrics.recordFailure(MigrationMetrics.REVERT, since(started));
                log.error(
                        "Revert of {} failed and was rolled back: {}", identifier, e.getMessage());
                throw new MigrationRevertException(identifier, e);
            }
            Duration elapsed = since(started);
            metrics.recordSuccess(MigrationMetrics.REVERT, elapsed);
            log.info("Reverted migration {} in {} ms", identifier, elapsed.toMillis());
        }
    }

    private void verifyChecksums(List<LedgerEntry> entries) {
        for (LedgerEntry entry : entries) {
            if (entry.checksum() == null) {
                continue;
            }
            repository
                    .get(entry.identifier())
                    .map(MigrationUnit::checksum)
                    .filter(current -> !current.equals(entry.checksum()))
                    .ifPresent(
                            current -> {
                                throw new ChecksumMismatchException(
                                        entry.identifier(), entry.checksum(), current);
                            });
        }
    }

    private static Duration since(long startedNanos) {
        return Duration.ofNanos(System.nanoTime() - startedNanos);
    }
}
