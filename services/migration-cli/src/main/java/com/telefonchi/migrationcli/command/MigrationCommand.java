package com.telefonchi.migrationcli.command;

import com.telefonchi.database.migration.MigrationIdentifiers;
import java.util.List;
import java.util.Locale;

/**
 * A parsed command line.
 *
 * @param type which command to run
 * @param slug migration name for {@link Type#CREATE}; null otherwise
 * @param count number of units for {@link Type#ROLLBACK}; 0 otherwise
 * @param format output format for {@link Type#STATUS}
 */
public record MigrationCommand(Type type, String slug, int count, OutputFormat format) {

    public enum Type {
        MIGRATE,
        STATUS,
        CREATE,
        ROLLBACK
    }

    public enum OutputFormat {
        TEXT,
        JSON
    }

    public static final String USAGE =
            """
            Usage: migration-cli <command> [arguments]

            Commands:
              migrate                       Apply all pending migrations
              status [--format=text|json]   Show applied and pending migrations
              create <name>                 Create a new migration script pair
              rollback [count]              Revert the last <count> migrations (default: 1)
            """;

    private static final String FORMAT_OPTION = "--format=";

    public static MigrationCommand migrate() {
        return new MigrationCommand(Type.MIGRATE, null, 0, OutputFormat.TEXT);
    }

    public static MigrationCommand status(OutputFormat format) {
        return new MigrationCommand(Type.STATUS, null, 0, format);
    }

    public static MigrationCommand create(String slug) {
        return new MigrationCommand(Type.CREATE, slug, 0, OutputFormat.TEXT);
    }

    public static MigrationCommand rollback(int count) {
        return new MigrationCommand(Type.ROLLBACK, null, count, OutputFormat.TEXT);
    }

    /**
     * Parses the raw process arguments.
     *
     * @throws CommandLineUsageException when the command is missing or unknown, or its arguments
     *     are invalid
     */
    public static MigrationCommand parse(List<String> args) {
        if (args == null || args.isEmpty()) {
            throw new CommandLineUsageException("No command given");
        }
        String command = args.get(0);
        List<String> rest = args.subList(1, args.size());
        return switch (command) {
            case "migrate" -> {
                requireNoMore(command, rest, 0);
                yield migrate();
            }
            case "status" -> status(parseFormat(rest));
            case "create" -> create(parseSlug(rest));
            case "rollback" -> rollback(parseCount(rest));
            default -> throw new CommandLineUsageException("Unknown command: " + command);
        };
    }

    private static OutputFormat parseFormat(List<String> args) {
        OutputFormat format = OutputFormat.TEXT;
        for (String arg : args) {
            if (!arg.startsWith(FORMAT_OPTION)) {
                throw new CommandLineUsageException("Unexpected argument for status: " + arg);
            }
            String value = arg.substring(FORMAT_OPTION.length()).toUpperCase(Locale.ROOT);
            try {
                format = OutputFormat.valueOf(value);
            } catch (IllegalArgumentException e) {
                throw new CommandLineUsageException(
                        "Unknown format '%s': expected text or json"
                                .formatted(arg.substring(FORMAT_OPTION.length())));
            }
        }
        return format;
    }

    private static String parseSlug(List<String> args) {
        if (args.isEmpty()) {
            throw new CommandLineUsageException("Missing migration name: create <name>");
        }
        requireNoMore("create", args, 1);
        String slug = args.get(0);
        try {
            MigrationIdentifiers.sanitizeSlug(slug);
        } catch (IllegalArgumentException e) {
            throw new CommandLineUsageException(
                    "Migration name '%s' must contain letters or digits".formatted(slug));
        }
        return slug;
    }

    private static int parseCount(List<String> args) {
        if (args.isEmpty()) {
            return 1;
        }
        requireNoMore("rollback", args, 1);
        int count;
        try {
            count = Integer.parseInt(args.get(0));
        } catch (NumberFormatException e) {
            throw new CommandLineUsageException("Rollback count must be a number: " + args.get(0));
        }
        if (count < 1) {
            throw new CommandLineUsageException("Rollback count must be at least 1: " + count);
        }
        return count;
    }

    private static void requireNoMore(String command, List<String> args, int allowed) {
        if (args.size() > allowed) {
            throw new CommandLineUsageException(
                    "Unexpected argument for %s: %s".formatted(command, args.get(allowed)));
        }
    }
}
