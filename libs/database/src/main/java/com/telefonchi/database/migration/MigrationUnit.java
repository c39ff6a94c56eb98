package com.telefonchi.database.migration;

/**
 * One reversible, ordered schema change.
 *
 * <p>The identifier is {@code <yyyyMMdd>[_<HHmmss>]_<slug>}; ascending lexicographic order of
 * identifiers is the order units are applied in. Once a unit has been applied to a real database it
 * must not change: {@link #checksum()} lets the runner detect edits.
 *
 * <p>{@link #revert} must be the exact structural inverse of {@link #apply}.
 */
public interface MigrationUnit {

    String identifier();

    void apply(MigrationContext context);

    void revert(MigrationContext context);

    /**
     * Fingerprint of the unit's content, or {@code null} when the unit cannot provide one (code
     * units). Units without a checksum are not verified.
     */
    default String checksum() {
        return null;
    }
}
