package com.telefonchi.database.migration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.spy;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

@DisplayName("MigrationRunner")
class MigrationRunnerTest {

    private static final Instant T0 = Instant.parse("2024-10-01T00:00:00Z");

    private static final String A = "20240101_a";
    private static final String B = "20240102_b";
    private static final String C = "20240103_c";

    private TestDatabase db;
    private MutableClock clock;
    private final List<String> events = new ArrayList<>();

    @BeforeEach
    void setUp() {
        db = TestDatabase.create();
        clock = new MutableClock(T0);
    }

    @AfterEach
    void tearDown() {
        db.shutdown();
        MDC.clear();
    }

    private MigrationRunner runner(MigrationUnit... units) {
        return db.runner(MigrationRepository.of(units), clock);
    }

    private MigrationUnit tracked(String identifier) {
        return new CodeMigrationUnit(
                identifier,
                ctx -> events.add("apply " + identifier),
                ctx -> events.add("revert " + identifier));
    }

    private static MigrationUnit createTable(String identifier, String table) {
        return new CodeMigrationUnit(
                identifier,
                ctx -> ctx.execute("CREATE TABLE " + table + " (id INT PRIMARY KEY, note TEXT)"),
                ctx -> ctx.execute("DROP TABLE " + table));
    }

    private static MigrationUnit insertRow(String identifier, int id) {
        return new CodeMigrationUnit(
                identifier,
                ctx -> ctx.update("INSERT INTO notes (id, note) VALUES (?, ?)", id, identifier),
                ctx -> ctx.update("DELETE FROM notes WHERE id = ?", id));
    }

    /** Inserts a row into {@code notes}, then throws. */
    private static MigrationUnit failing(String identifier) {
        return new CodeMigrationUnit(
                identifier,
                ctx -> {
                    ctx.update("INSERT INTO notes (id, note) VALUES (99, 'partial')");
                    throw new IllegalStateException("boom");
                },
                ctx -> {});
    }

    private List<String> ledgerIdentifiers() {
        return db.ledger().appliedEntries().stream().map(LedgerEntry::identifier).toList();
    }

    @Nested
    @DisplayName("migrate()")
    class Migrate {

        @Test
        @DisplayName("applies pending units in ascending identifier order")
        void appliesInIdentifierOrder() {
            var runner = runner(tracked(C), tracked(A), tracked(B));

            List<String> applied = runner.migrate();

            assertThat(applied).containsExactly(A, B, C);
            assertThat(events).containsExactly("apply " + A, "apply " + B, "apply " + C);
            assertThat(ledgerIdentifiers()).containsExactlyInAnyOrder(A, B, C);
        }

        @Test
        @DisplayName("a second run applies nothing and leaves ledger and schema unchanged")
        void idempotent() {
            var runner = runner(createTable(A, "notes"), insertRow(B, 1));
            runner.migrate();
            List<LedgerEntry> afterFirst = db.ledger().appliedEntries();
            var schemaAfterFirst = db.schemaSnapshot();

            clock.advance(Duration.ofMinutes(5));
            List<String> second = runner.migrate();

            assertThat(second).isEmpty();
            assertThat(db.ledger().appliedEntries()).isEqualTo(afterFirst);
            assertThat(db.schemaSnapshot()).isEqualTo(schemaAfterFirst);
            assertThat(db.rowCount("notes")).isEqualTo(1);
        }

        @Test
        @DisplayName("nothing pending on an empty repository is success")
        void nothingToDo() {
            assertThat(runner().migrate()).isEmpty();
            assertThat(db.tableExists("migrations")).isTrue();
        }

        @Test
        @DisplayName("units recorded in a legacy ledger table are not applied again")
        void legacyLedgerAdopted() {
            db.jdbcTemplate.execute(
                    "CREATE TABLE migrations ("
                            + "id INT AUTO_INCREMENT PRIMARY KEY, "
                            + "migration VARCHAR(255) NOT NULL UNIQUE, "
                            + "executed_at TIMESTAMP DEFAULT CURRENT_TIMESTAMP)");
            db.jdbcTemplate.update("INSERT INTO migrations (migration) VALUES (?)", A);

            List<String> applied = runner(tracked(A), tracked(B)).migrate();

            assertThat(applied).containsExactly(B);
            assertThat(events).containsExactly("apply " + B);
            assertThat(ledgerIdentifiers()).containsExactlyInAnyOrder(A, B);
        }

        @Test
        @DisplayName("only units added since the last run are applied")
        void appliesOnlyNewUnits() {
            runner(tracked(A)).migrate();
            events.clear();

            List<String> applied = runner(tracked(A), tracked(B)).migrate();

            assertThat(applied).containsExactly(B);
            assertThat(events).containsExactly("apply " + B);
        }

        @Test
        @DisplayName("records applied_at from the clock")
        void recordsClockTime() {
            runner(tracked(A)).migrate();

            assertThat(db.ledger().appliedEntries().get(0).appliedAt()).isEqualTo(T0);
        }

        @Test
        @DisplayName("the MDC carries the unit identifier while it runs and is cleared afterwards")
        void mdcScopedToUnit() {
            List<String> seen = new ArrayList<>();
            var unit =
                    new CodeMigrationUnit(
                            A,
                            ctx ->
                                    seen.add(
                                            MDC.get(MigrationRunner.MDC_MIGRATION)
                                                    + "/"
                                                    + MDC.get(MigrationRunner.MDC_OPERATION)),
                            ctx -> {});

            runner(unit).migrate();

            assertThat(seen).containsExactly(A + "/apply");
            assertThat(MDC.get(MigrationRunner.MDC_MIGRATION)).isNull();
            assertThat(MDC.get(MigrationRunner.MDC_OPERATION)).isNull();
        }
    }

    @Nested
    @DisplayName("migrate() failures")
    class MigrateFailures {

        @Test
        @DisplayName("halts at the failing unit; earlier units stay applied, later ones never run")
        void failFastBoundary() {
            var runner =
                    runner(createTable(A, "notes"), failing(B), createTable(C, "never_created"));

            assertThatThrownBy(runner::migrate)
                    .isInstanceOf(MigrationApplyException.class)
                    .hasMessageContaining(B)
                    .hasMessageContaining("boom")
                    .hasRootCauseInstanceOf(IllegalStateException.class)
                    .satisfies(e -> assertThat(((MigrationException) e).identifier()).contains(B));

            assertThat(ledgerIdentifiers()).containsExactly(A);
            assertThat(db.tableExists("notes")).isTrue();
            assertThat(db.rowCount("notes")).as("partial insert rolled back").isZero();
            assertThat(db.tableExists("never_created")).isFalse();
        }

        @Test
        @DisplayName("a failed ledger write rolls back the unit's own changes")
        void ledgerWriteFailureRollsBackUnit() {
            runner(createTable(A, "notes")).migrate();
            JdbcMigrationLedger ledger = spy(db.ledger());
            doThrow(new LedgerException(B, "ledger unavailable", null))
                    .when(ledger)
                    .recordApplied(eq(B), any(), any());
            var runner =
                    db.runner(
                            MigrationRepository.of(createTable(A, "notes"), insertRow(B, 1)),
                            ledger,
                            clock,
                            new MigrationMetrics(new SimpleMeterRegistry(), "test"));

            assertThatThrownBy(runner::migrate)
                    .isInstanceOf(MigrationApplyException.class)
                    .hasCauseInstanceOf(LedgerException.class)
                    .hasMessageContaining("ledger unavailable");

            assertThat(db.rowCount("notes")).isZero();
            assertThat(ledgerIdentifiers()).containsExactly(A);
        }

        @Test
        @DisplayName("a ledger that cannot be prepared halts before any unit runs")
        void ledgerBootstrapFailure() {
            JdbcMigrationLedger ledger = spy(db.ledger());
            doThrow(new LedgerException("Cannot create ledger table 'migrations'", null))
                    .when(ledger)
                    .ensureSchema();
            var runner =
                    db.runner(
                            MigrationRepository.of(tracked(A), tracked(B)),
                            ledger,
                            clock,
                            new MigrationMetrics(new SimpleMeterRegistry(), "test"));

            assertThatThrownBy(runner::migrate)
                    .isInstanceOf(LedgerException.class)
                    .hasMessageContaining("Cannot create ledger table");
            assertThat(events).isEmpty();
        }

        @Test
        @DisplayName("a ledger that cannot be read halts before any unit runs")
        void ledgerReadFailure() {
            JdbcMigrationLedger ledger = spy(db.ledger());
            doThrow(new LedgerException("Cannot read ledger table 'migrations'", null))
                    .when(ledger)
                    .appliedEntries();
            var runner =
                    db.runner(
                            MigrationRepository.of(createTable(A, "notes")),
                            ledger,
                            clock,
                            new MigrationMetrics(new SimpleMeterRegistry(), "test"));

            assertThatThrownBy(runner::migrate).isInstanceOf(LedgerException.class);
            assertThat(db.tableExists("notes")).isFalse();
        }

        @Test
        @DisplayName("re-running after fixing the failing unit applies the rest")
        void rerunAfterFailure() {
            var broken = runner(createTable(A, "notes"), failing(B));
            assertThatThrownBy(broken::migrate).isInstanceOf(MigrationApplyException.class);

            List<String> applied = runner(createTable(A, "notes"), insertRow(B, 1)).migrate();

            assertThat(applied).containsExactly(B);
            assertThat(db.rowCount("notes")).isEqualTo(1);
        }

        @Test
        @DisplayName("an applied unit whose checksum changed is rejected before anything runs")
        void checksumMismatch() {
            runner(sqlUnit(A, "CREATE TABLE notes (id INT PRIMARY KEY)", "aaaaaaaa")).migrate();
            var runner =
                    runner(
                            sqlUnit(A, "CREATE TABLE notes (id BIGINT PRIMARY KEY)", "bbbbbbbb"),
                            tracked(B));

            assertThatThrownBy(runner::migrate)
                    .isInstanceOf(ChecksumMismatchException.class)
                    .hasMessageContaining(A)
                    .satisfies(
                            e -> {
                                var mismatch = (ChecksumMismatchException) e;
                                assertThat(mismatch.recordedChecksum()).isEqualTo("aaaaaaaa");
                                assertThat(mismatch.currentChecksum()).isEqualTo("bbbbbbbb");
                            });
            assertThat(events).isEmpty();
        }

        @Test
        @DisplayName("checksum validation can be switched off")
        void checksumValidationDisabled() {
            runner(sqlUnit(A, "CREATE TABLE notes (id INT PRIMARY KEY)", "aaaaaaaa")).migrate();
            var runner =
                    new MigrationRunner(
                            MigrationRepository.of(
                                    sqlUnit(A, "CREATE TABLE notes (id BIGINT)", "bbbbbbbb")),
                            db.ledger(),
                            db.context(),
                            db.transactionTemplate,
                            clock,
                            new MigrationMetrics(new SimpleMeterRegistry(), "test"),
                            false);

            assertThat(runner.migrate()).isEmpty();
        }

        private static SqlMigrationUnit sqlUnit(String identifier, String up, String checksum) {
            return new SqlMigrationUnit(identifier, up, "DROP TABLE notes", checksum);
        }
    }

    @Nested
    @DisplayName("rollback()")
    class Rollback {

        @Test
        @DisplayName("defaults to reverting only the most recently applied unit")
        void defaultsToOne() {
            var runner = runner(tracked(A), tracked(B));
            runner.migrate();
            events.clear();

            assertThat(runner.rollback()).containsExactly(B);
            assertThat(events).containsExactly("revert " + B);
            assertThat(ledgerIdentifiers()).containsExactly(A);
        }

        @Test
        @DisplayName("a count larger than the ledger reverts everything, newest first")
        void countLargerThanLedger() {
            var runner = runner(tracked(A), tracked(B), tracked(C));
            runner.migrate();
            events.clear();

            List<String> reverted = runner.rollback(5);

            assertThat(reverted).containsExactly(C, B, A);
            assertThat(events).containsExactly("revert " + C, "revert " + B, "revert " + A);
            assertThat(ledgerIdentifiers()).isEmpty();
        }

        @Test
        @DisplayName("follows the ledger's applied order, not identifier order")
        void ledgerOrderIsAuthoritative() {
            clock = MutableClock.ticking(T0, Duration.ofSeconds(1));
            runner(tracked(A), tracked(C)).migrate();
            var full = runner(tracked(A), tracked(B), tracked(C));
            full.migrate();

            assertThat(full.rollback(3)).containsExactly(B, C, A);
        }

        @Test
        @DisplayName("with nothing applied, rollback is a no-op")
        void nothingApplied() {
            assertThat(runner(tracked(A)).rollback(3)).isEmpty();
            assertThat(events).isEmpty();
        }

        @Test
        @DisplayName("rejects a count below one")
        void rejectsNonPositiveCount() {
            var runner = runner();

            assertThatThrownBy(() -> runner.rollback(0))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> runner.rollback(-2))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("apply then revert of one unit restores the exact schema")
        void roundTripRestoresSchema() {
            var base = createTable(A, "notes");
            runner(base).migrate();
            var before = db.schemaSnapshot();
            var addColumn =
                    new CodeMigrationUnit(
                            B,
                            ctx ->
                                    ctx.execute(
                                            "ALTER TABLE notes ADD COLUMN author VARCHAR(100)"
                                                    + " DEFAULT 'anon'"),
                            ctx -> ctx.execute("ALTER TABLE notes DROP COLUMN author"));
            var runner = runner(base, addColumn);

            runner.migrate();
            assertThat(db.columnExists("notes", "author")).isTrue();
            runner.rollback();

            assertThat(db.columnExists("notes", "author")).isFalse();
            assertThat(db.schemaSnapshot()).isEqualTo(before);
        }
    }

    @Nested
    @DisplayName("rollback() failures")
    class RollbackFailures {

        @Test
        @DisplayName("a ledger entry whose unit was deleted stops the rollback")
        void unresolvableUnit() {
            runner(tracked(A), tracked(B)).migrate();
            events.clear();

            assertThatThrownBy(() -> runner(tracked(A)).rollback(2))
                    .isInstanceOf(UnresolvableRevertException.class)
                    .hasMessageContaining(B);
            assertThat(events).isEmpty();
            assertThat(ledgerIdentifiers()).containsExactly(A, B);
        }

        @Test
        @DisplayName("a failing revert keeps its ledger entry and halts")
        void failingRevert() {
            var brokenRevert =
                    new CodeMigrationUnit(
                            B,
                            ctx -> events.add("apply " + B),
                            ctx -> {
                                throw new IllegalStateException("cannot undo");
                            });
            var runner = runner(tracked(A), brokenRevert);
            runner.migrate();
            events.clear();

            assertThatThrownBy(() -> runner.rollback(2))
                    .isInstanceOf(MigrationRevertException.class)
                    .hasMessageContaining(B)
                    .hasMessageContaining("cannot undo");
            assertThat(events).isEmpty();
            assertThat(ledgerIdentifiers()).containsExactly(A, B);
        }

        @Test
        @DisplayName("a failed ledger delete rolls back the revert and keeps the entry")
        void ledgerDeleteFailureRollsBackRevert() {
            runner(createTable(A, "notes"), insertRow(B, 1)).migrate();
            JdbcMigrationLedger ledger = spy(db.ledger());
            doThrow(new LedgerException(B, "ledger unavailable", null))
                    .when(ledger)
                    .recordReverted(B);
            var runner =
                    db.runner(
                            MigrationRepository.of(createTable(A, "notes"), insertRow(B, 1)),
                            ledger,
                            clock,
                            new MigrationMetrics(new SimpleMeterRegistry(), "test"));

            assertThatThrownBy(runner::rollback)
                    .isInstanceOf(MigrationRevertException.class)
                    .hasCauseInstanceOf(LedgerException.class)
                    .hasMessageContaining(B);
            assertThat(db.rowCount("notes")).as("deleted row restored").isEqualTo(1);
            assertThat(ledgerIdentifiers()).containsExactly(A, B);
        }

        @Test
        @DisplayName("a failing revert rolls back its partial changes")
        void failingRevertRollsBack() {
            var seed =
                    new CodeMigrationUnit(
                            B,
                            ctx -> ctx.update("INSERT INTO notes (id, note) VALUES (1, 'keep')"),
                            ctx -> {
                                ctx.update("DELETE FROM notes WHERE id = 1");
                                throw new IllegalStateException("half done");
                            });
            var runner = runner(createTable(A, "notes"), seed);
            runner.migrate();

            assertThatThrownBy(runner::rollback).isInstanceOf(MigrationRevertException.class);
            assertThat(db.rowCount("notes")).isEqualTo(1);
        }
    }

    @Nested
    @DisplayName("Metrics")
    class Metrics {

        @Test
        @DisplayName("counts applied, reverted and failed units")
        void countsOutcomes() {
            var registry = new SimpleMeterRegistry();
            var runner =
                    db.runner(
                            MigrationRepository.of(
                                    createTable(A, "notes"), insertRow(B, 1), failing(C)),
                            db.ledger(),
                            clock,
                            new MigrationMetrics(registry, "test"));

            assertThatThrownBy(runner::migrate).isInstanceOf(MigrationApplyException.class);
            runner.rollback();

            assertThat(count(registry, MigrationMetrics.APPLY, MigrationMetrics.SUCCESS))
                    .isEqualTo(2.0);
            assertThat(count(registry, MigrationMetrics.APPLY, MigrationMetrics.FAILURE))
                    .isEqualTo(1.0);
            assertThat(count(registry, MigrationMetrics.REVERT, MigrationMetrics.SUCCESS))
                    .isEqualTo(1.0);
            assertThat(
                            registry.get(MigrationMetrics.DURATION)
                                    .tags(MigrationMetrics.TAG_OPERATION, MigrationMetrics.APPLY)
                                    .timer()
                                    .count())
                    .isEqualTo(3);
        }

        private double count(SimpleMeterRegistry registry, String operation, String outcome) {
            return registry.get(MigrationMetrics.UNITS)
                    .tags(
                            MigrationMetrics.TAG_DATABASE, "test",
                            MigrationMetrics.TAG_OPERATION, operation,
                            MigrationMetrics.TAG_OUTCOME, outcome)
                    .counter()
                    .count();
        }
    }

    @Test
    @DisplayName("two units: migrate both, check status, roll one back")
    void twoUnitScenario() {
        String createUsers = "20240101_create_users";
        String addFirstName = "20240102_add_first_name";
        var runner =
                runner(
                        new CodeMigrationUnit(
                                createUsers,
                                ctx -> ctx.execute("CREATE TABLE users (id INT PRIMARY KEY)"),
                                ctx -> ctx.execute("DROP TABLE users")),
                        new CodeMigrationUnit(
                                addFirstName,
                                ctx ->
                                        ctx.execute(
                                                "ALTER TABLE users"
                                                        + " ADD COLUMN first_name VARCHAR(100)"),
                                ctx -> ctx.execute("ALTER TABLE users DROP COLUMN first_name")));

        assertThat(runner.migrate()).containsExactly(createUsers, addFirstName);
        assertThat(db.ledger().appliedEntries()).hasSize(2);
        assertThat(runner.status().units())
                .extracting(MigrationStatusReporter.UnitStatus::state)
                .containsOnly(MigrationStatusReporter.State.APPLIED);

        assertThat(runner.rollback()).containsExactly(addFirstName);

        assertThat(ledgerIdentifiers()).containsExactly(createUsers);
        assertThat(runner.status().pendingIdentifiers()).containsExactly(addFirstName);
        assertThat(db.columnExists("users", "first_name")).isFalse();
    }
}
