package io.cronstore.core.database.schema;

import java.util.List;

import io.cronstore.core.database.CronTables;
import io.cronstore.core.database.DataSourceProvider;
import io.cronstore.core.database.DatabaseConfig;
import io.cronstore.core.database.JdbiHelper;
import org.jdbi.v3.core.Handle;
import org.jdbi.v3.core.Jdbi;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import static io.cronstore.core.database.DatabaseTestingUtils.createConfigFactory;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.hasSize;
import static org.junit.Assert.assertEquals;

public class SchemaProvisionerTest
{
    private DataSourceProvider dsp;
    private Jdbi jdbi;
    private DatabaseConfig config;

    @Before
    public void setUp()
    {
        config = DatabaseConfig.convertFrom(createConfigFactory().create().set("schema", "cron"), "h2");
        dsp = new DataSourceProvider(config);
        jdbi = JdbiHelper.createJdbi(dsp.get(), config);
    }

    @After
    public void destroy()
    {
        dsp.close();
    }

    private SchemaProvisioner provisioner(boolean postgres)
    {
        return new SchemaProvisioner(jdbi, new SchemaContext(postgres, config.getTables()));
    }

    @Test
    public void statementsInOrder()
    {
        List<String> statements = provisioner(true).buildStatements();
        assertThat(statements, hasSize(5));
        assertEquals("CREATE SCHEMA IF NOT EXISTS \"cron\"", statements.get(0));
        assertThat(statements.get(1), containsString("\"cron\".\"cron_jobs\""));
        assertThat(statements.get(2), containsString("\"cron\".\"cron_logs\""));
        assertEquals("CREATE INDEX IF NOT EXISTS \"cron_logs_job_id_idx\" ON \"cron\".\"cron_logs\" (job, id desc)",
                statements.get(3));
        assertThat(statements.get(4), containsString("\"cron\".\"cron_locks\""));
    }

    @Test
    public void h2IndexNameIsQualified()
    {
        assertEquals("CREATE INDEX IF NOT EXISTS \"cron\".\"cron_logs_job_id_idx\" ON \"cron\".\"cron_logs\" (job, id desc)",
                provisioner(false).buildStatements().get(3));
    }

    @Test
    public void provisionIsIdempotent()
    {
        provisioner(false).provision();
        try (Handle handle = jdbi.open()) {
            handle.execute("insert into \"cron\".\"cron_jobs\" (name, data) values ('backup', '{}')");
        }

        provisioner(false).provision();

        try (Handle handle = jdbi.open()) {
            long jobs = handle.createQuery("select count(*) from \"cron\".\"cron_jobs\"")
                .mapTo(Long.class)
                .one();
            assertEquals(1L, jobs);
        }
    }

    @Test
    public void tablesCanBeUsedThroughDefinedNames()
    {
        provisioner(false).provision();
        try (Handle handle = jdbi.open()) {
            handle.execute("insert into <locksTable> (name, expired_at) values ('tick', now())");
            long locks = handle.createQuery("select count(*) from <locksTable>")
                .mapTo(Long.class)
                .one();
            assertEquals(1L, locks);
            assertEquals(CronTables.quoteIdentifier("cron") + ".\"cron_locks\"", config.getTables().quotedLocksTable());
        }
    }
}
