package io.cronstore.core.database;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import io.cronstore.client.config.Config;
import io.cronstore.spi.CronSerializationException;
import io.cronstore.spi.JobStore;
import org.jdbi.v3.core.Jdbi;
import org.jdbi.v3.core.mapper.RowMapper;
import org.jdbi.v3.core.statement.StatementContext;
import org.jdbi.v3.sqlobject.customizer.Bind;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;

class DatabaseJobStoreManager
        extends BasicDatabaseStoreManager<DatabaseJobStoreManager.Dao>
        implements JobStore
{
    static final String NAME_FIELD = "name";
    static final String DISABLED_FIELD = "disabled";

    DatabaseJobStoreManager(DatabaseConfig config, Jdbi jdbi, ConfigMapper cfm, int queryTimeout)
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
    public void add(String name, Config job)
    {
        Config doc = job.deepCopy().set(NAME_FIELD, name);
        String data = configMapper.toText(doc);

        autoCommit((handle, dao) -> dao.upsertJob(name, data));
    }

    @Override
    public void enable(String name)
    {
        setDisabled(name, false);
    }

    @Override
    public void disable(String name)
    {
        setDisabled(name, true);
    }

    private void setDisabled(String name, boolean disabled)
    {
        if (DatabaseConfig.isPostgres(databaseType)) {
            autoCommit((handle, dao) -> ((PgDao) dao).setDisabled(name, disabled));
        }
        else {
            // h2 has no in-place json update. Lock the row and rewrite the document.
            transaction((handle, dao) -> {
                H2Dao h2 = (H2Dao) dao;
                String text = h2.lockJobData(name);
                if (text == null) {
                    return 0;
                }
                Config doc = configMapper.fromText(text).set(DISABLED_FIELD, disabled);
                return h2.updateJobData(name, configMapper.toText(doc));
            });
        }
    }

    @Override
    public void remove(String name)
    {
        transaction((handle, dao) -> {
            int jobs = dao.deleteJob(name);
            int logs = dao.deleteLogsOfJob(name);
            logger.debug("Removed job {} ({} row, {} logs)", name, jobs, logs);
            return null;
        });
    }

    @Override
    public Map<String, Config> list()
    {
        List<JobRow> rows = autoCommit((handle, dao) -> dao.listJobs());

        Map<String, Config> jobs = new LinkedHashMap<>();
        for (JobRow row : rows) {
            Config doc;
            try {
                doc = configMapper.fromText(row.data);
            }
            catch (CronSerializationException ex) {
                logger.warn("Skipping job {} because its stored definition can't be decoded", row.name, ex);
                continue;
            }
            jobs.put(row.name, doc.set(NAME_FIELD, row.name));
        }
        return jobs;
    }

    interface Dao
    {
        @SqlQuery("select name, data from <jobsTable>" +
                " order by name")
        List<JobRow> listJobs();

        @SqlUpdate("delete from <jobsTable>" +
                " where name = :name")
        int deleteJob(@Bind("name") String name);

        @SqlUpdate("delete from <logsTable>" +
                " where job = :name")
        int deleteLogsOfJob(@Bind("name") String name);

        int upsertJob(String name, String data);
    }

    interface PgDao
            extends Dao
    {
        @Override
        @SqlUpdate("insert into <jobsTable>" +
                " (name, data, updated_at)" +
                " values (:name, cast(:data as jsonb), now())" +
                " on conflict (name) do update set data = excluded.data, updated_at = now()")
        int upsertJob(@Bind("name") String name, @Bind("data") String data);

        @SqlUpdate("update <jobsTable>" +
                " set data = jsonb_set(data, '{disabled}', to_jsonb(cast(:disabled as boolean)), true), updated_at = now()" +
                " where name = :name")
        int setDisabled(@Bind("name") String name, @Bind("disabled") boolean disabled);
    }

    interface H2Dao
            extends Dao
    {
        @Override
        @SqlUpdate("merge into <jobsTable>" +
                " (name, data, updated_at)" +
                " key (name)" +
                " values (:name, :data, now())")
        int upsertJob(@Bind("name") String name, @Bind("data") String data);

        @SqlQuery("select data from <jobsTable>" +
                " where name = :name" +
                " for update")
        String lockJobData(@Bind("name") String name);

        @SqlUpdate("update <jobsTable>" +
                " set data = :data, updated_at = now()" +
                " where name = :name")
        int updateJobData(@Bind("name") String name, @Bind("data") String data);
    }

    static class JobRow
    {
        final String name;
        final String data;

        JobRow(String name, String data)
        {
            this.name = name;
            this.data = data;
        }
    }

    static class JobRowMapper
            implements RowMapper<JobRow>
    {
        @Override
        public JobRow map(ResultSet r, StatementContext ctx)
                throws SQLException
        {
            return new JobRow(r.getString("name"), r.getString("data"));
        }
    }
}
