package io.cronstore.core.database;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;

import com.google.common.collect.ImmutableList;
import com.google.common.primitives.Ints;
import io.cronstore.spi.CronSerializationException;
import io.cronstore.spi.ExecutionLog;
import io.cronstore.spi.ExecutionLogStore;
import io.cronstore.spi.LogHistory;
import io.cronstore.spi.StoredExecutionLog;
import org.jdbi.v3.core.Jdbi;
import org.jdbi.v3.core.mapper.RowMapper;
import org.jdbi.v3.core.statement.StatementContext;
import org.jdbi.v3.sqlobject.customizer.Bind;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;

import static java.util.Locale.ENGLISH;

class DatabaseExecutionLogStoreManager
        extends BasicDatabaseStoreManager<DatabaseExecutionLogStoreManager.Dao>
        implements ExecutionLogStore
{
    DatabaseExecutionLogStoreManager(DatabaseConfig config, Jdbi jdbi, ConfigMapper cfm, int queryTimeout)
    {
        super(config.getType(), dao(config.getType()), jdbi, cfm, queryTimeout);
    }

    private static Class<? extends Dao> dao(String type)
    {
        switch (type) {
            case "postgresql":
                return PgDao.class;
            case "h2":
                return H2Dao.class;
            default:
                throw new IllegalArgumentException("Unknown database type: " + type);
        }
    }

    @Override
    public void appendLog(ExecutionLog log)
    {
        String data = configMapper.toText(log.getData());

        autoCommit((handle, dao) -> dao.insertLog(log.getJob(), data));
    }

    @Override
    public LogHistory history(String job, long offset, long limit)
    {
        long total = autoCommit((handle, dao) -> dao.countLogs(job));
        if (total == 0) {
            return LogHistory.empty();
        }

        long skip = Math.max(offset, 0);
        // a non-positive limit returns everything from the offset
        long size = limit > 0 ? limit : total;

        List<LogRow> rows = autoCommit((handle, dao) ->
                dao.getLogs(job, skip, Ints.saturatedCast(size)));

        ImmutableList.Builder<StoredExecutionLog> logs = ImmutableList.builder();
        for (LogRow row : rows) {
            logs.add(decode(row));
        }
        return LogHistory.builder()
            .total(total)
            .logs(logs.build())
            .build();
    }

    private StoredExecutionLog decode(LogRow row)
    {
        try {
            return StoredExecutionLog.builder()
                .id(row.id)
                .job(row.job)
                .data(configMapper.fromText(row.data))
                .createdAt(row.createdAt)
                .build();
        }
        catch (CronSerializationException ex) {
            throw new CronSerializationException(String.format(ENGLISH,
                        "Execution log %d of job '%s' can't be decoded", row.id, row.job), ex);
        }
    }

    interface Dao
    {
        @SqlQuery("select count(*) from <logsTable>" +
                " where job = :job")
        long countLogs(@Bind("job") String job);

        @SqlQuery("select id, job, data, created_at from <logsTable>" +
                " where job = :job" +
                " order by id desc" +
                " limit :limit offset :offset")
        List<LogRow> getLogs(@Bind("job") String job, @Bind("offset") long offset, @Bind("limit") int limit);

        int insertLog(String job, String data);
    }

    interface PgDao
            extends Dao
    {
        @Override
        @SqlUpdate("insert into <logsTable>" +
                " (job, data, created_at)" +
                " values (:job, cast(:data as jsonb), now())")
        int insertLog(@Bind("job") String job, @Bind("data") String data);
    }

    interface H2Dao
            extends Dao
    {
        @Override
        @SqlUpdate("insert into <logsTable>" +
                " (job, data, created_at)" +
                " values (:job, :data, now())")
        int insertLog(@Bind("job") String job, @Bind("data") String data);
    }

    static class LogRow
    {
        final long id;
        final String job;
        final String data;
        final Instant createdAt;

        LogRow(long id, String job, String data, Instant createdAt)
        {
            this.id = id;
            this.job = job;
            this.data = data;
            this.createdAt = createdAt;
        }
    }

    static class LogRowMapper
            implements RowMapper<LogRow>
    {
        @Override
        public LogRow map(ResultSet r, StatementContext ctx)
                throws SQLException
        {
            return new LogRow(
                    r.getLong("id"),
                    r.getString("job"),
                    r.getString("data"),
                    getTimestampInstant(r, "created_at"));
        }
    }
}
