package com.telefonchi.database.migration;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Externalized configuration of the migration engine, bound from {@code telefonchi.migration.*}.
 *
 * <pre>{@code
 * telefonchi:
 *   migration:
 *     url: jdbc:mysql://mysql:3306/telegram_bot
 *     username: root
 *     password: root
 *     locations: classpath:db/migration
 *     table: migrations
 *     scaffold-directory: src/main/resources/db/migration
 * }</pre>
 *
 * @param url JDBC URL of the database to migrate
 * @param username database user
 * @param password database password
 * @param database logical database name used to tag metrics
 * @param locations directories holding {@code *.up.sql}/{@code *.down.sql} pairs
 * @param table ledger table name
 * @param scaffoldDirectory where {@code create} writes new scripts
 * @param validateChecksums whether {@code migrate} rejects applied units that were edited
 * @param enabled whether the migration beans are created at all
 */
@Validated
@ConfigurationProperties(prefix = "telefonchi.migration")
public record MigrationProperties(
        @NotBlank String url,
        String username,
        String password,
        String database,
        @NotEmpty List<String> locations,
        @NotBlank String table,
        String scaffoldDirectory,
        @DefaultValue("true") boolean validateChecksums,
        @DefaultValue("true") boolean enabled) {

    public static final String DEFAULT_LOCATION = "classpath:db/migration";
    public static final String DEFAULT_SCAFFOLD_DIRECTORY = "src/main/resources/db/migration";

    /** Applies defaults before Bean Validation runs. */
    public MigrationProperties {
        if (database == null || database.isBlank()) {
            database = "main";
        }
        if (locations == null || locations.isEmpty()) {
            locations = List.of(DEFAULT_LOCATION);
        } else {
            locations = List.copyOf(locations);
        }
        if (table == null || table.isBlank()) {
            table = JdbcMigrationLedger.DEFAULT_TABLE;
        }
        if (scaffoldDirectory == null || scaffoldDirectory.isBlank()) {
            scaffoldDirectory = DEFAULT_SCAFFOLD_DIRECTORY;
        }
    }
}
