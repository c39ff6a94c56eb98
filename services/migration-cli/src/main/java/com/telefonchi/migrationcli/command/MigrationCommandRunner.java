package com.telefonchi.migrationcli.command;

import com.telefonchi.database.migration.MigrationException;
import com.telefonchi.database.migration.MigrationRunner;
import com.telefonchi.database.migration.MigrationScaffolder;
import com.telefonchi.database.migration.MigrationStatusReporter;
import com.telefonchi.database.migration.ScaffoldedMigration;
import com.telefonchi.migrationcli.command.MigrationCommand.OutputFormat;
import com.telefonchi.migrationcli.output.StatusFormatter;
import java.io.PrintStream;
import java.util.Arrays;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

/**
 * Runs the command given on the command line once the context is up, and reports the outcome as
 * the process exit code.
 *
 * <p>Results go to stdout; usage errors and failures go to stderr.
 */
@Component
public class MigrationCommandRunner implements ApplicationRunner, ExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(MigrationCommandRunner.class);

    public static final int EXIT_OK = 0;
    public static final int EXIT_FAILURE = 1;
    public static final int EXIT_USAGE = 2;

    private final MigrationRunner runner;
    private final MigrationStatusReporter statusReporter;
    private final MigrationScaffolder scaffolder;
    private final StatusFormatter formatter;
    private final PrintStream out;
    private final PrintStream err;

    private volatile int exitCode = EXIT_OK;

    @Autowired
    public MigrationCommandRunner(
            MigrationRunner runner,
            MigrationStatusReporter statusReporter,
            MigrationScaffolder scaffolder,
            StatusFormatter formatter) {
        this(runner, statusReporter, scaffolder, formatter, System.out, System.err);
    }

    MigrationCommandRunner(
            MigrationRunner runner,
            MigrationStatusReporter statusReporter,
            MigrationScaffolder scaffolder,
            StatusFormatter formatter,
            PrintStream out,
            PrintStream err) {
        this.runner = runner;
        this.statusReporter = statusReporter;
        this.scaffolder = scaffolder;
        this.formatter = formatter;
        this.out = out;
        this.err = err;
    }

    @Override
    public void run(ApplicationArguments args) {
        exitCode = execute(Arrays.asList(args.getSourceArgs()));
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    /** Parses and runs one command line, returning the exit code. */
    int execute(List<String> args) {
        MigrationCommand command;
        try {
            command = MigrationCommand.parse(args);
        } catch (CommandLineUsageException e) {
            err.println(e.getMessage());
            err.println();
            err.print(MigrationCommand.USAGE);
            return EXIT_USAGE;
        }

        try {
            switch (command.type()) {
                case MIGRATE -> migrate();
                case STATUS -> status(command.format());
                case CREATE -> create(command.slug());
                case ROLLBACK -> rollback(command.count());
            }
            return EXIT_OK;
        } catch (MigrationException e) {
            log.error("Migration command '{}' failed", command.type(), e);
            err.println("Migration command failed: " + e.getMessage());
            return EXIT_FAILURE;
        }
    }

    private void migrate() {
        List<String> applied = runner.migrate();
        if (applied.isEmpty()) {
            out.println("No pending migrations");
            return;
        }
        applied.forEach(id -> out.println("Applied " + id));
        out.printf("%d migration(s) applied%n", applied.size());
    }

    private void status(OutputFormat format) {
        out.print(formatter.format(statusReporter.status(), format));
    }

    private void create(String slug) {
        ScaffoldedMigration created = scaffolder.create(slug);
        out.println("Created migration: " + created.identifier());
        out.println("  up:   " + created.upScript());
        out.println("  down: " + created.downScript());
    }

    private void rollback(int count) {
        List<String> reverted = runner.rollback(count);
        if (reverted.isEmpty()) {
            out.println("No migrations to rollback");
            return;
        }
        reverted.forEach(id -> out.println("Rolled back " + id));
        out.printf("%d migration(s) rolled back%n", reverted.size());
    }
}
