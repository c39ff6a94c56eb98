package com.telefonchi.database.migration;

/** One direction of a {@link CodeMigrationUnit}. */
@FunctionalInterface
public interface MigrationStep {

    void run(MigrationContext context);
}
