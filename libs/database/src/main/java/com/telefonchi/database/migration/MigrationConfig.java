package com.telefonchi.database.migration;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.nio.file.Path;
import java.time.Clock;
import javax.sql.DataSource;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.jdbc.DataSourceBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Spring wiring for the migration engine.
 *
 * <p>The engine gets its own {@link DataSource}, built from {@link MigrationProperties}, so it can
 * run against a database other than the application's. The ledger, the unit context and the
 * per-unit {@link TransactionTemplate} all share that data source; this is what makes a ledger
 * write commit together with the unit it records.
 *
 * <p>Applications opt in with {@code @Import(MigrationConfig.class)}.
 */
@Configuration
@EnableConfigurationProperties(MigrationProperties.class)
@ConditionalOnProperty(
        prefix = "telefonchi.migration",
        name = "enabled",
        havingValue = "true",
        matchIfMissing = true)
public class MigrationConfig {

    /** Bean name of the data source migrations run against. */
    public static final String DATA_SOURCE_BEAN = "migrationDataSource";

    /** Bean name of the clock used for ledger timestamps and scaffold identifiers. */
    public static final String CLOCK_BEAN = "migrationClock";

    @Bean(name = DATA_SOURCE_BEAN)
    public DataSource migrationDataSource(MigrationProperties properties) {
        return DataSourceBuilder.create()
                .url(properties.url())
                .username(properties.username())
                .password(properties.password())
                .build();
    }

    @Bean(name = CLOCK_BEAN)
    public Clock migrationClock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public MigrationRepository migrationRepository(MigrationProperties properties) {
        return MigrationRepository.fromLocations(
                new MigrationScriptLoader(), properties.locations());
    }

    @Bean
    public MigrationLedger migrationLedger(
            @Qualifier(DATA_SOURCE_BEAN) DataSource dataSource, MigrationProperties properties) {
        return new JdbcMigrationLedger(new JdbcTemplate(dataSource), properties.table());
    }

    @Bean
    public MigrationMetrics migrationMetrics(
            ObjectProvider<MeterRegistry> meterRegistry, MigrationProperties properties) {
        return new MigrationMetrics(
                meterRegistry.getIfAvailable(SimpleMeterRegistry::new), properties.database());
    }

    @Bean
    public MigrationRunner migrationRunner(
            @Qualifier(DATA_SOURCE_BEAN) DataSource dataSource,
            MigrationRepository repository,
            MigrationLedger ledger,
            MigrationMetrics metrics,
            @Qualifier(CLOCK_BEAN) Clock clock,
            MigrationProperties properties) {
        return new MigrationRunner(
                repository,
                ledger,
                new MigrationContext(new JdbcTemplate(dataSource)),
                new TransactionTemplate(new DataSourceTransactionManager(dataSource)),
                clock,
                metrics,
                properties.validateChecksums());
    }

    @Bean
    public MigrationStatusReporter migrationStatusReporter(
            MigrationRepository repository, MigrationLedger ledger) {
        return new MigrationStatusReporter(repository, ledger);
    }

    @Bean
    public MigrationScaffolder migrationScaffolder(
            MigrationProperties properties,
            MigrationRepository repository,
            @Qualifier(CLOCK_BEAN) Clock clock) {
        return new MigrationScaffolder(Path.of(properties.scaffoldDirectory()), repository, clock);
    }
}
