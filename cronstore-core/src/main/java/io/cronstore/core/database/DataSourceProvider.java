package io.cronstore.core.database;

import java.sql.Connection;
import java.sql.SQLException;
import javax.sql.DataSource;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import io.cronstore.commons.guava.ThrowablesUtil;
import org.h2.jdbcx.JdbcDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class DataSourceProvider
        implements AutoCloseable
{
    private final Logger logger = LoggerFactory.getLogger(getClass());

    private final DatabaseConfig config;
    private DataSource ds;
    private AutoCloseable closer;

    public DataSourceProvider(DatabaseConfig config)
    {
        this.config = config;
    }

    public synchronized DataSource get()
    {
        if (ds == null) {
            switch (config.getType()) {
            case "h2":
                // h2 database doesn't need connection pool
                createSimpleDataSource();
                break;
            default:
                createPooledDataSource();
                break;
            }
        }
        return ds;
    }

    private void createSimpleDataSource()
    {
        String url = DatabaseConfig.buildJdbcUrl(config);

        // An in-memory h2 database is dropped when its last connection is closed.
        // One connection is held until close() so that the data lives as long as
        // this provider.
        JdbcDataSource ds = new JdbcDataSource();
        ds.setUrl(url + ";DB_CLOSE_ON_EXIT=FALSE");

        logger.debug("Using database URL {}", url);

        Connection holder;
        try {
            holder = ds.getConnection();
        }
        catch (SQLException ex) {
            throw ThrowablesUtil.propagate(ex);
        }
        this.closer = holder;
        this.ds = ds;
    }

    private void createPooledDataSource()
    {
        PostgresDsn dsn = PostgresDsn.parse(config.getDsn().get());

        HikariConfig hikari = new HikariConfig();
        hikari.setJdbcUrl(dsn.getJdbcUrl());
        hikari.setDriverClassName(DatabaseConfig.getDriverClassName(config.getType()));
        hikari.setDataSourceProperties(DatabaseConfig.buildJdbcProperties(config));

        hikari.setConnectionTimeout(config.getConnectionTimeout() * 1000L);
        hikari.setIdleTimeout(config.getIdleTimeout() * 1000L);
        hikari.setValidationTimeout(config.getValidationTimeout() * 1000L);
        hikari.setMaximumPoolSize(config.getMaximumPoolSize());
        hikari.setMinimumIdle(config.getMinimumPoolSize());
        hikari.setLeakDetectionThreshold(config.getLeakDetectionThreshold());
        hikari.setPoolName("cronstore-" + config.getTables().getSchema());

        logger.debug("Using database URL {}", dsn.getMaskedJdbcUrl());

        HikariDataSource ds = new HikariDataSource(hikari);
        logger.debug("Created connection pool {} (maximum size {})", hikari.getPoolName(), config.getMaximumPoolSize());
        this.ds = ds;
        this.closer = ds;
    }

    public synchronized void close()
    {
        if (ds != null) {
            try {
                closer.close();
            }
            catch (Exception ex) {
                throw ThrowablesUtil.propagate(ex);
            }
            finally {
                ds = null;
                closer = null;
            }
        }
    }
}
