package com.telefonchi.database.migration;

/**
 * A migration unit backed by a pair of SQL scripts, {@code <identifier>.up.sql} and {@code
 * <identifier>.down.sql}.
 *
 * <p>The scripts are kept as text and run whole through {@link
 * MigrationContext#executeScript(String, String)}, which splits them on {@code ;} and skips
 * {@code --} and {@code /* *&#47;} comments. A comment-only script is a valid no-op.
 *
 * @param identifier ordered, unique identifier taken from the script file names
 * @param applyScript text of the up script, line endings normalized to {@code \n}
 * @param revertScript text of the down script, line endings normalized to {@code \n}
 * @param checksum CRC32 of both scripts
 */
public record SqlMigrationUnit(
        String identifier, String applyScript, String revertScript, String checksum)
        implements MigrationUnit {

    public SqlMigrationUnit {
        MigrationIdentifiers.requireValid(identifier);
        if (applyScript == null) {
            throw new DiscoveryException("Migration '%s' has no up script".formatted(identifier));
        }
        if (revertScript == null) {
            throw new DiscoveryException("Migration '%s' has no down script".formatted(identifier));
        }
    }

    @Override
    public void apply(MigrationContext context) {
        context.executeScript(identifier + ".up.sql", applyScript);
    }

    @Override
    public void revert(MigrationContext context) {
        context.executeScript(identifier + ".down.sql", revertScript);
    }
}
