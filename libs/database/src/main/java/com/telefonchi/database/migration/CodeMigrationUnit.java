package com.telefonchi.database.migration;

/**
 * A migration unit defined in code, with both directions supplied up front.
 *
 * <pre>{@code
 * new CodeMigrationUnit(
 *         "20241001_000004_add_role_to_users",
 *         ctx -> ctx.execute("ALTER TABLE users ADD COLUMN role VARCHAR(20) DEFAULT 'user'"),
 *         ctx -> ctx.execute("ALTER TABLE users DROP COLUMN role"));
 * }</pre>
 *
 * @param identifier ordered, unique identifier
 * @param applyStep forward change
 * @param revertStep inverse of {@code applyStep}
 */
public record CodeMigrationUnit(
        String identifier, MigrationStep applyStep, MigrationStep revertStep)
        implements MigrationUnit {

    public CodeMigrationUnit {
        MigrationIdentifiers.requireValid(identifier);
        if (applyStep == null) {
            throw new DiscoveryException("Migration '%s' has no apply step".formatted(identifier));
        }
        if (revertStep == null) {
            throw new DiscoveryException("Migration '%s' has no revert step".formatted(identifier));
        }
    }

    @Override
    public void apply(MigrationContext context) {
        applyStep.run(context);
    }

    @Override
    public void revert(MigrationContext context) {
        revertStep.run(context);
    }
}
