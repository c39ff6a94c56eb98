package com.telefonchi.database.migration;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes empty, correctly named SQL migration templates.
 *
 * <p>The identifier is the current time to the second plus the sanitized slug. Two scaffolds with
 * the same slug in the same second collide and the second one is rejected.
 */
public class MigrationScaffolder {

    private static final Logger log = LoggerFactory.getLogger(MigrationScaffolder.class);

    private static final DateTimeFormatter CREATED_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final Path directory;
    private final MigrationRepository repository;
    private final Clock clock;

    /**
     * @param directory where scripts are written; created on first use
     * @param repository units already known, checked for identifier collisions
     * @param clock time source for the identifier prefix, in its own zone
     */
    public MigrationScaffolder(Path directory, MigrationRepository repository, Clock clock) {
        if (directory == null || repository == null || clock == null) {
            throw new IllegalArgumentException("directory, repository and clock must not be null");
        }
        this.directory = directory;
        this.repository = repository;
        this.clock = clock;
    }

    /**
     * Creates {@code <identifier>.up.sql} and {@code <identifier>.down.sql}.
     *
     * @throws IllegalArgumentException if the slug has no letters or digits
     * @throws DuplicateIdentifierException if the identifier is already in the repository or its
     *     files exist on disk
     */
    public ScaffoldedMigration create(String slug) {
        LocalDateTime now = LocalDateTime.now(clock);
        String identifier = MigrationIdentifiers.generate(now, slug);
        String name = MigrationIdentifiers.sanitizeSlug(slug);
        if (repository.contains(identifier)) {
            throw new DuplicateIdentifierException(identifier);
        }

        Path up = directory.resolve(identifier + ".up.sql");
        Path down = directory.resolve(identifier + ".down.sql");
        if (Files.exists(up) || Files.exists(down)) {
            throw new DuplicateIdentifierException(identifier);
        }

        try {
            Files.createDirectories(directory);
            write(up, upTemplate(name, now));
            try {
                write(down, downTemplate(name, identifier));
            } catch (IOException e) {
                Files.deleteIfExists(up);
                throw e;
            }
        } catch (FileAlreadyExistsException e) {
            throw new DuplicateIdentifierException(identifier);
        } catch (IOException e) {
            throw new MigrationException("Cannot write scaffold for migration " + identifier, e);
        }

        log.info("Migration created: {}", up);
        return new ScaffoldedMigration(identifier, up, down);
    }

    private static void write(Path path, String content) throws IOException {
        Files.writeString(path, content, StandardCharsets.UTF_8, StandardOpenOption.CREATE_NEW);
    }

    static String upTemplate(String name, LocalDateTime created) {
        return """
                -- Migration: %s
                -- Created: %s
                --
                -- Forward change. Separate statements with ';'.
                -- Example:
                -- CREATE TABLE example (id INT PRIMARY KEY);
                """
                .formatted(name, CREATED_FORMAT.format(created));
    }

    static String downTemplate(String name, String identifier) {
        return """
                -- Rollback: %s
                --
                -- Must undo exactly what %s.up.sql does.
                -- Example:
                -- DROP TABLE example;
                """
                .formatted(name, identifier);
    }
}
