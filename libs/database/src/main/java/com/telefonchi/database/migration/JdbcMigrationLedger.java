package com.telefonchi.database.migration;

import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.ConnectionCallback;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

/**
 * {@link MigrationLedger} stored in a single table through a {@link JdbcTemplate}.
 *
 * <p>Table layout:
 *
 * <pre>
 * identifier  VARCHAR(255) PRIMARY KEY
 * applied_at  TIMESTAMP(6) NOT NULL
 * checksum    VARCHAR(64)
 * </pre>
 *
 * <p>Databases migrated by the earlier bot tooling carry a table of the same name laid out as
 * {@code (id, migration, executed_at)}. {@link #ensureSchema()} recognises that layout, renames
 * it to {@code <table>_legacy}, and copies its rows into a fresh ledger with a null checksum, so
 * units already applied there are not applied again.
 */
public class JdbcMigrationLedger implements MigrationLedger {

    private static final Logger log = LoggerFactory.getLogger(JdbcMigrationLedger.class);

    /** Default ledger table name. */
    public static final String DEFAULT_TABLE = "migrations";

    /** Suffix given to a legacy-layout table once its rows have been adopted. */
    public static final String LEGACY_SUFFIX = "_legacy";

    private static final Pattern TABLE_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]{0,63}");

    private static final RowMapper<LedgerEntry> ENTRY_MAPPER =
            (rs, rowNum) -> {
                Timestamp appliedAt = rs.getTimestamp("applied_at");
                return new LedgerEntry(
                        rs.getString("identifier"),
                        appliedAt == null ? null : appliedAt.toInstant(),
                        rs.getString("checksum"));
            };

    private final JdbcTemplate jdbcTemplate;
    private final String table;

    public JdbcMigrationLedger(JdbcTemplate jdbcTemplate) {
        this(jdbcTemplate, DEFAULT_TABLE);
    }

    /**
     * @param jdbcTemplate template on the migration data source
     * @param table ledger table name; a plain SQL identifier, since it is spliced into statements
     */
    public JdbcMigrationLedger(JdbcTemplate jdbcTemplate, String table) {
        if (jdbcTemplate == null) {
            throw new IllegalArgumentException("jdbcTemplate must not be null");
        }
        if (table == null || !TABLE_NAME.matcher(table).matches()) {
            throw new IllegalArgumentException("Invalid ledger table name: " + table);
        }
        this.jdbcTemplate = jdbcTemplate;
        this.table = table;
    }

    /**
     * Creates the ledger table if it does not exist, first adopting a legacy-layout table of the
     * same name.
     *
     * @throws LedgerException if the table cannot be inspected, converted, or created
     */
    @Override
    public void ensureSchema() {
        try {
            Set<String> columns = existingColumns();
            if (columns.contains("migration") && !columns.contains("identifier")) {
                adoptLegacyTable();
            }
            jdbcTemplate.execute(createTableSql(table));
        } catch (DataAccessException e) {
            throw new LedgerException("Cannot create ledger table '" + table + "'", e);
        }
        log.debug("Ledger table '{}' ready", table);
    }

    private static String createTableSql(String name) {
        return "CREATE TABLE IF NOT EXISTS "
                + name
                + " ("
                + "identifier VARCHAR(255) NOT NULL PRIMARY KEY, "
                + "applied_at TIMESTAMP(6) NOT NULL, "
                + "checksum VARCHAR(64)"
                + ")";
    }

    /** Lowercased column names of the ledger table; empty when the table does not exist. */
    private Set<String> existingColumns() {
        return jdbcTemplate.execute(
                (ConnectionCallback<Set<String>>)
                        connection -> {
                            DatabaseMetaData meta = connection.getMetaData();
                            String name = table;
                            if (meta.storesUpperCaseIdentifiers()) {
                                name = name.toUpperCase(Locale.ROOT);
                            } else if (meta.storesLowerCaseIdentifiers()) {
                                name = name.toLowerCase(Locale.ROOT);
                            }
                            String escape = meta.getSearchStringEscape();
                            if (escape != null && !escape.isEmpty()) {
                                name = name.replace("_", escape + "_");
                            }
                            Set<String> columns = new HashSet<>();
                            try (ResultSet rs =
                                    meta.getColumns(
                                            connection.getCatalog(),
                                            connection.getSchema(),
                                            name,
                                            null)) {
                                while (rs.next()) {
                                    columns.add(
                                            rs.getString("COLUMN_NAME").toLowerCase(Locale.ROOT));
                                }
                            }
                            return columns;
                        });
    }

    private void adoptLegacyTable() {
        String legacy = table + LEGACY_SUFFIX;
        jdbcTemplate.execute("ALTER TABLE " + table + " RENAME TO " + legacy);
        jdbcTemplate.execute(createTableSql(table));
        int copied =
                jdbcTemplate.update(
                        "INSERT INTO "
                                + table
                                + " (identifier, applied_at, checksum)"
                                + " SELECT migration, COALESCE(executed_at, CURRENT_TIMESTAMP),"
                                + " NULL FROM "
                                + legacy);
        log.info(
                "Adopted {} entries from legacy ledger table '{}', original kept as '{}'",
                copied,
                table,
                legacy);
    }

    @Override
    public List<LedgerEntry> appliedEntries() {
        try {
            return jdbcTemplate.query(
                    "SELECT identifier, applied_at, checksum FROM "
                            + table
                            + " ORDER BY applied_at, identifier",
                    ENTRY_MAPPER);
        } catch (DataAccessException e) {
            throw new LedgerException("Cannot read ledger table '" + table + "'", e);
        }
    }

    @Override
    public Set<String> appliedIdentifiers() {
        Set<String> identifiers = new LinkedHashSet<>();
        for (LedgerEntry entry : appliedEntries()) {
            identifiers.add(entry.identifier());
        }
        return identifiers;
    }

    @Override
    public void recordApplied(String identifier, Instant appliedAt, String checksum) {
        try {
            jdbcTemplate.update(
                    "INSERT INTO " + table + " (identifier, applied_at, checksum) VALUES (?, ?, ?)",
                    identifier,
                    Timestamp.from(appliedAt),
                    checksum);
        } catch (DataAccessException e) {
            throw new LedgerException(
                    identifier, "Cannot record migration '" + identifier + "' as applied", e);
        }
    }

    @Override
    public void recordReverted(String identifier) {
        int deleted;
        try {
            deleted =
                    jdbcTemplate.update(
                            "DELETE FROM " + table + " WHERE identifier = ?", identifier);
        } catch (DataAccessException e) {
            throw new LedgerException(
                    identifier, "Cannot record migration '" + identifier + "' as reverted", e);
        }
        if (deleted != 1) {
            throw new LedgerException(
                    identifier,
                    "Ledger has no entry for migration '%s' (deleted %d rows)"
                            .formatted(identifier, deleted),
                    null);
        }
    }

    /** Name of the ledger table, as configured. */
    public String table() {
        return table;
    }
}
