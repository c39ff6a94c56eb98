package com.telefonchi.database.migration;

import java.nio.file.Path;

/**
 * Result of {@link MigrationScaffolder#create(String)}.
 *
 * @param identifier identifier of the new unit
 * @param upScript path of the written up script
 * @param downScript path of the written down script
 */
public record ScaffoldedMigration(String identifier, Path upScript, Path downScript) {}
