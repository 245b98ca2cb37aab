package io.cronstore.core.database;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.SQLTimeoutException;
import java.sql.SQLTransientConnectionException;
import java.time.Instant;

import com.google.common.base.Optional;
import com.google.common.base.Throwables;
import io.cronstore.commons.guava.ThrowablesUtil;
import io.cronstore.spi.CronQueryException;
import io.cronstore.spi.CronTimeoutException;
import org.jdbi.v3.core.Handle;
import org.jdbi.v3.core.Jdbi;
import org.jdbi.v3.core.JdbiException;
import org.jdbi.v3.core.statement.SqlStatements;
import org.jdbi.v3.core.statement.UnableToExecuteStatementException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public abstract class BasicDatabaseStoreManager <D>
{
    protected final Logger logger = LoggerFactory.getLogger(getClass());

    protected final String databaseType;
    private final Class<? extends D> daoIface;
    private final Jdbi jdbi;
    protected final ConfigMapper configMapper;
    private final int queryTimeout;  // seconds, 0 uses the timeout of jdbi

    protected BasicDatabaseStoreManager(
            String databaseType,
            Class<? extends D> daoIface,
            Jdbi jdbi,
            ConfigMapper configMapper,
            int queryTimeout)
    {
        this.databaseType = databaseType;
        this.daoIface = daoIface;
        this.jdbi = jdbi;
        this.configMapper = configMapper;
        this.queryTimeout = queryTimeout;
    }

    public interface AutoCommitAction <T, D>
    {
        T call(Handle handle, D dao);
    }

    public interface TransactionAction <T, D>
    {
        T call(Handle handle, D dao);
    }

    private Handle open()
    {
        Handle handle = jdbi.open();
        if (queryTimeout > 0) {
            handle.getConfig(SqlStatements.class).setQueryTimeout(queryTimeout);
        }
        return handle;
    }

    public <T> T transaction(TransactionAction<T, D> action)
    {
        try (Handle handle = open()) {
            return handle.inTransaction(h -> action.call(h, h.attach(daoIface)));
        }
        catch (JdbiException ex) {
            throw translateException(ex);
        }
    }

    public <T> T autoCommit(AutoCommitAction<T, D> action)
    {
        try (Handle handle = open()) {
            return action.call(handle, handle.attach(daoIface));
        }
        catch (JdbiException ex) {
            throw translateException(ex);
        }
    }

    /**
     * Runs an insert and returns {@code valueOnConflict} if it violated a unique constraint.
     */
    public <T> T catchConflict(AutoCommitAction<T, D> action, T valueOnConflict)
    {
        try (Handle handle = open()) {
            return action.call(handle, handle.attach(daoIface));
        }
        catch (UnableToExecuteStatementException ex) {
            Optional<SQLException> sqlEx = ThrowablesUtil.findCause(ex, SQLException.class);
            if (sqlEx.isPresent() && isConflictException(sqlEx.get())) {
                return valueOnConflict;
            }
            throw translateException(ex);
        }
        catch (JdbiException ex) {
            throw translateException(ex);
        }
    }

    public boolean isConflictException(SQLException ex)
    {
        // h2 and postgresql
        return "23505".equals(ex.getSQLState());
    }

    static CronQueryException translateException(JdbiException ex)
    {
        if (isTimeoutException(ex)) {
            return new CronTimeoutException("Database operation timed out: " + ThrowablesUtil.rootCauseMessage(ex), ex);
        }
        return new CronQueryException("Database operation failed: " + ThrowablesUtil.rootCauseMessage(ex), ex);
    }

    static boolean isTimeoutException(Throwable ex)
    {
        for (Throwable cause : Throwables.getCausalChain(ex)) {
            if (cause instanceof SQLTimeoutException
                    || cause instanceof SQLTransientConnectionException
                    || cause instanceof InterruptedException) {
                // pool acquisition timeout is SQLTransientConnectionException
                return true;
            }
            if (cause instanceof SQLException) {
                String state = ((SQLException) cause).getSQLState();
                // 57014: statement canceled (postgresql and h2), HYT00: lock wait timeout (h2)
                if ("57014".equals(state) || "HYT00".equals(state)) {
                    return true;
                }
            }
        }
        return false;
    }

    public static Instant getTimestampInstant(ResultSet r, String column)
            throws SQLException
    {
        return r.getTimestamp(column).toInstant();
    }
}
