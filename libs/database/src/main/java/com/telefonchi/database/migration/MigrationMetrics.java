package com.telefonchi.database.migration;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;

/**
 * Micrometer meters for migration runs.
 *
 * <p>Every meter carries a {@code database} tag. Unit outcomes are counted under {@value #UNITS}
 * tagged with {@code operation} ({@value #APPLY}/{@value #REVERT}) and {@code outcome} ({@value
 * #SUCCESS}/{@value #FAILURE}); per-unit durations go to {@value #DURATION}.
 */
public final class MigrationMetrics {

    public static final String UNITS = "telefonchi.migration.units";
    public static final String DURATION = "telefonchi.migration.duration";

    public static final String TAG_DATABASE = "database";
    public static final String TAG_OPERATION = "operation";
    public static final String TAG_OUTCOME = "outcome";

    public static final String APPLY = "apply";
    public static final String REVERT = "revert";
    public static final String SUCCESS = "success";
    public static final String FAILURE = "failure";

    private final MeterRegistry registry;
    private final String database;

    /**
     * @param registry meter registry (e.g. the application's, or a {@code SimpleMeterRegistry})
     * @param database logical database name used as the {@code database} tag
     */
    public MigrationMetrics(MeterRegistry registry, String database) {
        if (registry == null) {
            throw new IllegalArgumentException("registry must not be null");
        }
        if (database == null || database.isBlank()) {
            throw new IllegalArgumentException("database must not be null or blank");
        }
        this.registry = registry;
        this.database = database;
    }

    /**
     * Counts one unit that committed and records how long it took.
     *
     * @param operation {@value #APPLY} or {@value #REVERT}
     * @param elapsed time from start to commit
     */
    public void recordSuccess(String operation, Duration elapsed) {
        record(operation, SUCCESS, elapsed);
    }

    /**
     * Counts one unit that failed and was rolled back.
     *
     * <p>WHY: failures are timed too, so a slow statement that finally times out still shows up
     * in the duration histogram.
     *
     * @param operation {@value #APPLY} or {@value #REVERT}
     * @param elapsed time from start to rollback
     */
    public void recordFailure(String operation, Duration elapsed) {
        record(operation, FAILURE, elapsed);
    }

    private void record(String operation, String outcome, Duration elapsed) {
        Counter.builder(UNITS)
                .description("Migration units processed")
                .tags(baseTags(operation).and(TAG_OUTCOME, outcome))
                .register(registry)
                .increment();
        Timer.builder(DURATION)
                .description("Time spent applying or reverting one migration unit")
                .tags(baseTags(operation))
                .register(registry)
                .record(elapsed);
    }

    private Tags baseTags(String operation) {
        return Tags.of(TAG_DATABASE, database, TAG_OPERATION, operation);
    }

    /** Registry the meters are registered in. */
    public MeterRegistry registry() {
        return registry;
    }

    /** Value of the {@code database} tag. */
    public String database() {
        return database;
    }
}
