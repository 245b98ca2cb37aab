package io.cronstore.core.database;

import io.cronstore.client.config.Config;
import org.immutables.value.Value;

/**
 * Names of the schema and tables a connection works on.
 *
 * Names are kept unquoted. The {@code quoted*} methods return identifiers that
 * are safe to embed in SQL.
 */
@Value.Immutable
public interface CronTables
{
    String DEFAULT_SCHEMA = "public";
    String DEFAULT_JOBS_TABLE = "cron_jobs";
    String DEFAULT_LOGS_TABLE = "cron_logs";
    String DEFAULT_LOCKS_TABLE = "cron_locks";

    String getSchema();

    String getJobsTable();

    String getLogsTable();

    String getLocksTable();

    default String quotedSchema()
    {
        return quoteIdentifier(getSchema());
    }

    default String quotedJobsTable()
    {
        return qualify(getJobsTable());
    }

    default String quotedLogsTable()
    {
        return qualify(getLogsTable());
    }

    default String quotedLocksTable()
    {
        return qualify(getLocksTable());
    }

    default String logsJobIdIndexName()
    {
        return getLogsTable() + "_job_id_idx";
    }

    default String qualify(String name)
    {
        return quotedSchema() + "." + quoteIdentifier(name);
    }

    static String quoteIdentifier(String name)
    {
        return "\"" + name.replace("\"", "\"\"") + "\"";
    }

    static ImmutableCronTables.Builder builder()
    {
        return ImmutableCronTables.builder();
    }

    static CronTables defaultTables()
    {
        return builder()
            .schema(DEFAULT_SCHEMA)
            .jobsTable(DEFAULT_JOBS_TABLE)
            .logsTable(DEFAULT_LOGS_TABLE)
            .locksTable(DEFAULT_LOCKS_TABLE)
            .build();
    }

    static CronTables convertFrom(Config settings)
    {
        return builder()
            .schema(DatabaseConfig.getNonEmptyString(settings, "schema").or(DEFAULT_SCHEMA))
            .jobsTable(DatabaseConfig.getNonEmptyString(settings, "jobs_table").or(DEFAULT_JOBS_TABLE))
            .logsTable(DatabaseConfig.getNonEmptyString(settings, "logs_table").or(DEFAULT_LOGS_TABLE))
            .locksTable(DatabaseConfig.getNonEmptyString(settings, "locks_table").or(DEFAULT_LOCKS_TABLE))
            .build();
    }
}
