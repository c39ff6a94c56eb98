/**
 * Database tooling for the Telefonchi platform.
 *
 * <p>The bot, API and moderation services issue queries against a schema whose evolution is owned
 * by {@link com.telefonchi.database.migration}. The baseline schema (users, categories, brands,
 * advertisements, favorites, payments) ships as SQL migrations under {@code db/migration} on the
 * classpath.
 *
 * @see com.telefonchi.database.migration.MigrationRunner
 * @see com.telefonchi.database.migration.MigrationConfig
 */
package com.telefonchi.database;
