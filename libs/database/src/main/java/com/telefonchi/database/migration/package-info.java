/**
 * Versioned schema migrations for the Telefonchi database.
 *
 * <p>Contains:
 *
 * <ul>
 *   <li>{@link com.telefonchi.database.migration.MigrationUnit} and its two kinds, {@link
 *       com.telefonchi.database.migration.SqlMigrationUnit} (script pairs discovered by {@link
 *       com.telefonchi.database.migration.MigrationScriptLoader}) and {@link
 *       com.telefonchi.database.migration.CodeMigrationUnit}
 *   <li>{@link com.telefonchi.database.migration.MigrationRepository}: the ordered set of units
 *       for one run
 *   <li>{@link com.telefonchi.database.migration.MigrationLedger}: which units are applied
 *   <li>{@link com.telefonchi.database.migration.MigrationRunner}: migrate, rollback, status
 *   <li>{@link com.telefonchi.database.migration.MigrationScaffolder}: new unit templates
 *   <li>{@link com.telefonchi.database.migration.MigrationConfig}: Spring wiring
 * </ul>
 */
package com.telefonchi.database.migration;
