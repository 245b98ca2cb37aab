package io.cronstore.core.database;

import org.jdbi.v3.core.Jdbi;
import org.jdbi.v3.core.h2.H2DatabasePlugin;
import org.jdbi.v3.core.statement.SqlStatements;
import org.jdbi.v3.postgres.PostgresPlugin;
import org.jdbi.v3.sqlobject.SqlObjectPlugin;

import javax.sql.DataSource;

public class JdbiHelper
{
    private JdbiHelper()
    { }

    public static Jdbi createJdbi(DataSource ds, String databaseType)
    {
        Jdbi jdbi = Jdbi.create(ds);
        jdbi.installPlugin(new SqlObjectPlugin());
        // PostgresPlugin unwraps every connection to PGConnection, which h2 rejects
        if (DatabaseConfig.isPostgres(databaseType)) {
            jdbi.installPlugin(new PostgresPlugin());
        }
        else {
            jdbi.installPlugin(new H2DatabasePlugin());
        }
        return jdbi;
    }

    /**
     * Creates a Jdbi whose statements can refer to the configured tables as
     * {@code <jobsTable>}, {@code <logsTable>} and {@code <locksTable>}.
     */
    public static Jdbi createJdbi(DataSource ds, DatabaseConfig config)
    {
        Jdbi jdbi = createJdbi(ds, config.getType());

        CronTables tables = config.getTables();
        jdbi.define("jobsTable", tables.quotedJobsTable());
        jdbi.define("logsTable", tables.quotedLogsTable());
        jdbi.define("locksTable", tables.quotedLocksTable());

        jdbi.registerRowMapper(new DatabaseJobStoreManager.JobRowMapper());
        jdbi.registerRowMapper(new DatabaseExecutionLogStoreManager.LogRowMapper());

        if (config.getQueryTimeout() > 0) {
            jdbi.getConfig(SqlStatements.class).setQueryTimeout(config.getQueryTimeout());
        }
        return jdbi;
    }
}
