package io.cronstore.core.database.schema;

import java.sql.SQLException;
import java.util.List;

import com.google.common.base.Optional;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import io.cronstore.commons.guava.ThrowablesUtil;
import io.cronstore.core.database.CronTables;
import org.jdbi.v3.core.Handle;
import org.jdbi.v3.core.Jdbi;
import org.jdbi.v3.core.statement.UnableToExecuteStatementException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Creates the schema, tables and index if they don't exist.
 *
 * Statements run in order and the first failure is thrown as is. Running this
 * again on a provisioned database does nothing.
 */
public class SchemaProvisioner
{
    private static final Logger logger = LoggerFactory.getLogger(SchemaProvisioner.class);

    // duplicate_schema, duplicate_table, duplicate_object, unique_violation on system catalogs
    private static final ImmutableSet<String> CONCURRENTLY_CREATED_STATES =
        ImmutableSet.of("42P06", "42P07", "42710", "23505");

    private final Jdbi jdbi;
    private final SchemaContext context;

    public SchemaProvisioner(Jdbi jdbi, SchemaContext context)
    {
        this.jdbi = jdbi;
        this.context = context;
    }

    public List<String> buildStatements()
    {
        CronTables tables = context.getTables();
        return ImmutableList.of(
                context.createSchemaSql(),
                context.newCreateTableBuilder(tables.quotedJobsTable())
                    .addString("name", "not null primary key")
                    .addJson("data", "not null")
                    .addTimestamp("updated_at", "not null default now()")
                    .build(),
                context.newCreateTableBuilder(tables.quotedLogsTable())
                    .addLongId("id")
                    .addString("job", "not null")
                    .addJson("data", "not null")
                    .addTimestamp("created_at", "not null default now()")
                    .build(),
                context.createIndexSql(tables.logsJobIdIndexName(), tables.quotedLogsTable(), "job, id desc"),
                context.newCreateTableBuilder(tables.quotedLocksTable())
                    .addString("name", "not null primary key")
                    .addTimestamp("expired_at", "not null")
                    .addTimestamp("updated_at", "not null default now()")
                    .build());
    }

    public void provision()
    {
        try (Handle handle = jdbi.open()) {
            for (String sql : buildStatements()) {
                execute(handle, sql);
            }
        }
        logger.info("Database schema {} is ready", context.getTables().getSchema());
    }

    private void execute(Handle handle, String sql)
    {
        try {
            handle.execute(sql);
        }
        catch (UnableToExecuteStatementException ex) {
            // "if not exists" isn't atomic on postgresql. Another instance may have
            // created the same object between the check and the creation.
            if (context.isPostgres() && isCreatedConcurrently(ex)) {
                logger.debug("Skipped statement because the object was created concurrently: {}", sql);
                return;
            }
            throw ex;
        }
    }

    private static boolean isCreatedConcurrently(UnableToExecuteStatementException ex)
    {
        Optional<SQLException> sqlEx = ThrowablesUtil.findCause(ex, SQLException.class);
        return sqlEx.isPresent() && CONCURRENTLY_CREATED_STATES.contains(sqlEx.get().getSQLState());
    }
}
