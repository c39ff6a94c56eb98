package com.telefonchi.database.migration;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The set of migration units known to one run, sorted by identifier.
 *
 * <p>Built once and handed to the runner; there is no global registry. Construction validates the
 * whole set up front, so a repository that exists is always well-formed.
 */
public final class MigrationRepository {

    private final List<MigrationUnit> units;
    private final Map<String, MigrationUnit> byIdentifier;

    /**
     * @throws DiscoveryException if a unit is null, has a malformed identifier, or shares its
     *     identifier with another unit
     */
    public MigrationRepository(Collection<? extends MigrationUnit> units) {
        if (units == null) {
            throw new IllegalArgumentException("units must not be null");
        }
        List<MigrationUnit> sorted = new ArrayList<>(units.size());
        for (MigrationUnit unit : units) {
            if (unit == null) {
                throw new DiscoveryException("Migration repository contains a null unit");
            }
            MigrationIdentifiers.requireValid(unit.identifier());
            sorted.add(unit);
        }
        sorted.sort(Comparator.comparing(MigrationUnit::identifier));

        Map<String, MigrationUnit> index = new LinkedHashMap<>();
        for (MigrationUnit unit : sorted) {
            if (index.putIfAbsent(unit.identifier(), unit) != null) {
                throw new DiscoveryException(
                        "Duplicate migration identifier '%s'".formatted(unit.identifier()));
            }
        }
        this.units = List.copyOf(sorted);
        this.byIdentifier = index;
    }

    /**
     * Builds a repository from code-defined units.
     *
     * @throws DiscoveryException as {@link #MigrationRepository(Collection)} does, including for a
     *     null element
     */
    public static MigrationRepository of(MigrationUnit... units) {
        return new MigrationRepository(Arrays.asList(units));
    }

    /**
     * Loads SQL units from the given locations.
     *
     * @param loader script loader
     * @param locations Spring resource locations, e.g. {@code classpath:db/migration}
     * @throws DiscoveryException if the scripts are malformed or cannot be read
     */
    public static MigrationRepository fromLocations(
            MigrationScriptLoader loader, List<String> locations) {
        return new MigrationRepository(loader.load(locations));
    }

    /** All units in application order. */
    public List<MigrationUnit> list() {
        return units;
    }

    /**
     * Looks up a unit by identifier.
     *
     * @return the unit, or empty when this repository does not contain it
     */
    public Optional<MigrationUnit> get(String identifier) {
        return Optional.ofNullable(byIdentifier.get(identifier));
    }

    /** Whether a unit with this identifier is present. */
    public boolean contains(String identifier) {
        return byIdentifier.containsKey(identifier);
    }

    /** Number of units. */
    public int size() {
        return units.size();
    }
}
