package com.shelfmark.app.database;

import java.nio.file.Path;

import org.flywaydb.core.Flyway;
import org.flywaydb.core.api.exception.FlywayValidateException;
import org.jdbi.v3.core.Jdbi;
import org.jdbi.v3.sqlobject.SqlObjectPlugin;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.shelfmark.app.config.Config;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;

/**
 * One catalog store: pooled SQLite connections, JDBI and Flyway migrations.
 * Opening a database migrates it; closing releases the pool.
 */
public final class Database implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(Database.class);

    private final String jdbcUrl;
    private final HikariDataSource dataSource;
    private final Jdbi jdbi;

    private Database(String jdbcUrl, HikariDataSource dataSource, Jdbi jdbi) {
        this.jdbcUrl = jdbcUrl;
        this.dataSource = dataSource;
        this.jdbi = jdbi;
    }

    public static Database openDefault() {
        return open(Config.getDbUrl());
    }

    public static Database open(Path dbFile) {
        return open("jdbc:sqlite:" + dbFile.toAbsolutePath());
    }

    public static Database open(String jdbcUrl) {
        HikariDataSource ds = createDataSource(jdbcUrl);
        try {
            migrate(ds);
            Jdbi jdbi = Jdbi.create(ds);
            jdbi.installPlugin(new SqlObjectPlugin());
            logger.debug("Catalog opened: {}", jdbcUrl);
            return new Database(jdbcUrl, ds, jdbi);
        } catch (RuntimeException e) {
            ds.close();
            throw e;
        }
    }

    private static HikariDataSource createDataSource(String jdbcUrl) {
        HikariConfig config = new HikariConfig();
        config.setJdbcUrl(jdbcUrl);
        config.setPoolName("shelfmark-db");
        config.setConnectionTestQuery("SELECT 1");
        config.setMaximumPoolSize(10);
        // sqlite-jdbc applies these per connection
        config.addDataSourceProperty("journal_mode", "WAL");
        config.addDataSourceProperty("synchronous", "NORMAL");
        config.addDataSourceProperty("busy_timeout", "10000");
        config.addDataSourceProperty("foreign_keys", "true");
        // BEGIN IMMEDIATE: writers queue on the lock instead of failing a read-to-write upgrade
        config.addDataSourceProperty("transaction_mode", "IMMEDIATE");
        return new HikariDataSource(config);
    }

    private static void migrate(HikariDataSource ds) {
        Flyway flyway = Flyway.configure()
                .dataSource(ds)
                .locations("classpath:db/migration")
                .baselineOnMigrate(true)
                .baselineVersion("0")
                .load();
        try {
            try {
                flyway.migrate();
            } catch (FlywayValidateException e) {
                logger.warn("Flyway validation failed; attempting repair.", e);
                flyway.repair();
                flyway.migrate();
            }
        } catch (RuntimeException e) {
            logger.error("Flyway migration failed", e);
            throw new IllegalStateException("Flyway migration failed", e);
        }
    }

    public Jdbi jdbi() {
        return jdbi;
    }

    public String jdbcUrl() {
        return jdbcUrl;
    }

    @Override
    public void close() {
        dataSource.close();
    }
}
