package com.telefonchi.database.migration;

import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.util.List;
import javax.sql.DataSource;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.core.io.support.EncodedResource;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceUtils;
import org.springframework.jdbc.datasource.init.ScriptException;
import org.springframework.jdbc.datasource.init.ScriptUtils;

/**
 * Statement-execution surface handed to a {@link MigrationUnit}.
 *
 * <p>Every call goes through a {@link JdbcTemplate} on the migration data source, so it runs on
 * whatever connection the current unit's transaction has bound to the thread. A unit never sees
 * the transaction itself; the runner commits or rolls back around it.
 */
public class MigrationContext {

    private final JdbcTemplate jdbcTemplate;

    /**
     * @param jdbcTemplate template on the migration data source; must have a {@link DataSource}
     * @throws IllegalArgumentException if the template is null or has no data source
     */
    public MigrationContext(JdbcTemplate jdbcTemplate) {
        if (jdbcTemplate == null || jdbcTemplate.getDataSource() == null) {
            throw new IllegalArgumentException("jdbcTemplate with a DataSource is required");
        }
        this.jdbcTemplate = jdbcTemplate;
    }

    /** Executes a single DDL or DML statement. */
    public void execute(String sql) {
        jdbcTemplate.execute(sql);
    }

    /** Executes statements in order, stopping at the first failure. */
    public void execute(List<String> statements) {
        for (String statement : statements) {
            jdbcTemplate.execute(statement);
        }
    }

    /**
     * Runs a whole SQL script with Spring's {@link ScriptUtils}: statements are separated by
     * {@code ;}, comments are skipped, and execution stops at the first failing statement.
     *
     * <p>WHY: the script runs on the connection bound to the current transaction, the same one the
     * ledger write uses, so a failing statement rolls back together with everything else the unit
     * did (as far as the database allows; MySQL commits DDL implicitly).
     *
     * @param name script name used in error messages, e.g. {@code <identifier>.up.sql}
     * @param script script text
     * @throws ScriptException if a statement fails or the script cannot be parsed
     */
    public void executeScript(String name, String script) {
        DataSource dataSource = jdbcTemplate.getDataSource();
        Connection connection = DataSourceUtils.getConnection(dataSource);
        try {
            ScriptUtils.executeSqlScript(
                    connection,
                    new EncodedResource(
                            new ByteArrayResource(script.getBytes(StandardCharsets.UTF_8), name),
                            StandardCharsets.UTF_8));
        } finally {
            DataSourceUtils.releaseConnection(connection, dataSource);
        }
    }

    /**
     * Executes a parameterised DML statement.
     *
     * @return the number of affected rows
     */
    public int update(String sql, Object... args) {
        return jdbcTemplate.update(sql, args);
    }

    /**
     * Runs a query expected to return exactly one row with one column.
     *
     * @param sql query with {@code ?} placeholders
     * @param type required type of the single column
     * @param args placeholder values
     * @return the column value, possibly null
     */
    public <T> T queryForObject(String sql, Class<T> type, Object... args) {
        return jdbcTemplate.queryForObject(sql, type, args);
    }

    /** Escape hatch for units that need the full {@link JdbcTemplate} API. */
    public JdbcTemplate jdbcTemplate() {
        return jdbcTemplate;
    }
}
