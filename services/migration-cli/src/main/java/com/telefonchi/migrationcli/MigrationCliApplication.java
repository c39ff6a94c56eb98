package com.telefonchi.migrationcli;

import com.telefonchi.database.migration.MigrationConfig;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Import;

/**
 * Telefonchi migration command-line tool.
 *
 * <pre>
 * java -jar telefonchi-migration-cli.jar migrate
 * java -jar telefonchi-migration-cli.jar status [--format=text|json]
 * java -jar telefonchi-migration-cli.jar create &lt;slug&gt;
 * java -jar telefonchi-migration-cli.jar rollback [count]
 * </pre>
 *
 * <p>The database is configured through {@code telefonchi.migration.*}, normally from the {@code
 * DATABASE_URL} or {@code DB_HOST}/{@code DB_PORT}/{@code DB_NAME}/{@code DB_USER}/{@code
 * DB_PASSWORD} environment variables. The process exit code is 0 on success, 1 when a command
 * fails and 2 on a usage error.
 */
@SpringBootApplication
@Import(MigrationConfig.class)
public class MigrationCliApplication {

    public static void main(String[] args) {
        System.exit(
                SpringApplication.exit(SpringApplication.run(MigrationCliApplication.class, args)));
    }
}
