package io.cronstore.core.database;

import java.time.Duration;
import java.util.Map;
import javax.sql.DataSource;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import com.google.common.primitives.Ints;
import io.cronstore.client.config.Config;
import io.cronstore.client.config.ConfigFactory;
import io.cronstore.commons.guava.ThrowablesUtil;
import io.cronstore.core.database.schema.SchemaContext;
import io.cronstore.core.database.schema.SchemaProvisioner;
import io.cronstore.spi.CronConnection;
import io.cronstore.spi.CronConnectionException;
import io.cronstore.spi.CronStore;
import io.cronstore.spi.ExecutionLog;
import io.cronstore.spi.LogHistory;
import org.jdbi.v3.core.Handle;
import org.jdbi.v3.core.Jdbi;
import org.jdbi.v3.core.JdbiException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A {@link CronConnection} backed by a relational database.
 *
 * One instance is opened at most once. Store operations are thread-safe once
 * the connection is open; each call takes its own handle from the pool.
 */
public class DatabaseCronConnection
        implements CronConnection
{
    private enum State
    {
        NEW,
        OPEN,
        CLOSED,
    }

    private final Logger logger = LoggerFactory.getLogger(getClass());

    private final DatabaseConfig config;
    private final ConfigMapper configMapper;

    private State state = State.NEW;
    private DataSourceProvider dataSourceProvider;
    private Jdbi jdbi;
    private DatabaseJobStoreManager jobStore;
    private DatabaseExecutionLogStoreManager logStore;
    private DatabaseLockStoreManager lockStore;

    public DatabaseCronConnection(DatabaseConfig config, ConfigFactory cf)
    {
        this.config = config;
        this.configMapper = new ConfigMapper(cf);
    }

    public DatabaseConfig getConfig()
    {
        return config;
    }

    @Override
    public synchronized void open()
    {
        if (state != State.NEW) {
            throw new IllegalStateException("Connection is already " + (state == State.OPEN ? "open" : "closed"));
        }

        DataSourceProvider provider = new DataSourceProvider(config);
        Jdbi jdbi;
        try {
            DataSource ds = provider.get();
            jdbi = JdbiHelper.createJdbi(ds, config);
            ping(jdbi);
        }
        catch (RuntimeException ex) {
            closeQuietly(provider, ex);
            throw new CronConnectionException("Failed to connect to " + config.getType() + " database: " +
                    ThrowablesUtil.rootCauseMessage(ex), ex);
        }

        try {
            new SchemaProvisioner(jdbi, new SchemaContext(DatabaseConfig.isPostgres(config.getType()), config.getTables()))
                .provision();
        }
        catch (JdbiException ex) {
            closeQuietly(provider, ex);
            throw BasicDatabaseStoreManager.translateException(ex);
        }
        catch (RuntimeException ex) {
            closeQuietly(provider, ex);
            throw ex;
        }

        this.dataSourceProvider = provider;
        this.jdbi = jdbi;
        // 0 applies query_timeout configured on jdbi
        this.jobStore = new DatabaseJobStoreManager(config, jdbi, configMapper, 0);
        this.logStore = new DatabaseExecutionLogStoreManager(config, jdbi, configMapper, 0);
        this.lockStore = new DatabaseLockStoreManager(config, jdbi, configMapper, 0);
        this.state = State.OPEN;
    }

    private static void ping(Jdbi jdbi)
    {
        try (Handle handle = jdbi.open()) {
            handle.createQuery("select 1")
                .mapTo(Integer.class)
                .one();
        }
    }

    private void closeQuietly(DataSourceProvider provider, Exception cause)
    {
        try {
            provider.close();
        }
        catch (RuntimeException ex) {
            cause.addSuppressed(ex);
        }
    }

    @Override
    public synchronized boolean isOpen()
    {
        return state == State.OPEN;
    }

    @Override
    public synchronized void close()
    {
        if (state == State.OPEN) {
            logger.debug("Closing {} connection", config.getType());
            try {
                dataSourceProvider.close();
            }
            finally {
                dataSourceProvider = null;
                jdbi = null;
                jobStore = null;
                logStore = null;
                lockStore = null;
                state = State.CLOSED;
            }
        }
        else if (state == State.NEW) {
            state = State.CLOSED;
        }
    }

    private synchronized void checkOpen()
    {
        if (state != State.OPEN) {
            throw new IllegalStateException("Connection is not open");
        }
    }

    private synchronized DatabaseJobStoreManager jobs()
    {
        checkOpen();
        return jobStore;
    }

    private synchronized DatabaseExecutionLogStoreManager logs()
    {
        checkOpen();
        return logStore;
    }

    private synchronized DatabaseLockStoreManager locks()
    {
        checkOpen();
        return lockStore;
    }

    @Override
    public synchronized CronStore withTimeout(Duration timeout)
    {
        Preconditions.checkArgument(!timeout.isNegative() && !timeout.isZero(),
                "timeout must be positive: %s", timeout);
        checkOpen();
        return new TimeoutView(toQueryTimeout(timeout));
    }

    @VisibleForTesting
    static int toQueryTimeout(Duration timeout)
    {
        long seconds = timeout.getSeconds();
        if (timeout.getNano() > 0) {
            seconds++;
        }
        return Ints.saturatedCast(seconds);
    }

    private class TimeoutView
            implements CronStore
    {
        private final DatabaseJobStoreManager jobs;
        private final DatabaseExecutionLogStoreManager logs;
        private final DatabaseLockStoreManager locks;

        TimeoutView(int queryTimeout)
        {
            this.jobs = new DatabaseJobStoreManager(config, jdbi, configMapper, queryTimeout);
            this.logs = new DatabaseExecutionLogStoreManager(config, jdbi, configMapper, queryTimeout);
            this.locks = new DatabaseLockStoreManager(config, jdbi, configMapper, queryTimeout);
        }

        @Override
        public void add(String name, Config job)
        {
            checkOpen();
            jobs.add(name, job);
        }

        @Override
        public void enable(String name)
        {
            checkOpen();
            jobs.enable(name);
        }

        @Override
        public void disable(String name)
        {
            checkOpen();
            jobs.disable(name);
        }

        @Override
        public void remove(String name)
        {
            checkOpen();
            jobs.remove(name);
        }

        @Override
        public Map<String, Config> list()
        {
            checkOpen();
            return jobs.list();
        }

        @Override
        public void appendLog(ExecutionLog log)
        {
            checkOpen();
            logs.appendLog(log);
        }

        @Override
        public LogHistory history(String job, long offset, long limit)
        {
            checkOpen();
            return logs.history(job, offset, limit);
        }

        @Override
        public boolean lock(String key, Duration ttl)
        {
            checkOpen();
            return locks.lock(key, ttl);
        }
    }

    @VisibleForTesting
    synchronized Jdbi getJdbi()
    {
        checkOpen();
        return jdbi;
    }

    @Override
    public void add(String name, Config job)
    {
        jobs().add(name, job);
    }

    @Override
    public void enable(String name)
    {
        jobs().enable(name);
    }

    @Override
    public void disable(String name)
    {
        jobs().disable(name);
    }

    @Override
    public void remove(String name)
    {
        jobs().remove(name);
    }

    @Override
    public Map<String, Config> list()
    {
        return jobs().list();
    }

    @Override
    public void appendLog(ExecutionLog log)
    {
        logs().appendLog(log);
    }

    @Override
    public LogHistory history(String job, long offset, long limit)
    {
        return logs().history(job, offset, limit);
    }

    @Override
    public boolean lock(String key, Duration ttl)
    {
        return locks().lock(key, ttl);
    }
}
