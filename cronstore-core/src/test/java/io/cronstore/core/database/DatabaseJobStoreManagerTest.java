package io.cronstore.core.database;

import java.util.Map;

import io.cronstore.client.config.Config;
import io.cronstore.spi.CronSerializationException;
import io.cronstore.spi.ExecutionLog;
import org.jdbi.v3.core.Handle;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import static io.cronstore.core.database.DatabaseTestingUtils.createConfigFactory;
import static io.cronstore.core.database.DatabaseTestingUtils.setupConnection;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.is;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class DatabaseJobStoreManagerTest
{
    private DatabaseCronConnection conn;

    @Before
    public void setUp()
    {
        conn = setupConnection();
    }

    @After
    public void destroy()
    {
        conn.close();
    }

    private static Config job(String cron, String command)
    {
        return createConfigFactory().create()
            .set("cron", cron)
            .set("command", command);
    }

    @Test
    public void addAndList()
    {
        conn.add("backup", job("0 * * * *", "backup.sh"));
        conn.add("cleanup", job("*/5 * * * *", "cleanup.sh"));

        Map<String, Config> jobs = conn.list();
        assertThat(jobs.keySet(), contains("backup", "cleanup"));

        Config backup = jobs.get("backup");
        assertEquals("backup", backup.get("name", String.class));
        assertEquals("0 * * * *", backup.get("cron", String.class));
        assertEquals("backup.sh", backup.get("command", String.class));
    }

    @Test
    public void addOverwritesNameField()
    {
        conn.add("backup", job("0 * * * *", "backup.sh").set("name", "something-else"));

        assertEquals("backup", conn.list().get("backup").get("name", String.class));
    }

    @Test
    public void addDoesNotModifyArgument()
    {
        Config job = job("0 * * * *", "backup.sh");
        conn.add("backup", job);

        assertFalse(job.has("name"));
    }

    @Test
    public void addReplacesExistingJob()
    {
        conn.add("backup", job("0 * * * *", "backup.sh").set("retry", 3));
        conn.add("backup", job("30 * * * *", "backup2.sh"));

        Map<String, Config> jobs = conn.list();
        assertEquals(1, jobs.size());
        Config backup = jobs.get("backup");
        assertEquals("30 * * * *", backup.get("cron", String.class));
        assertEquals("backup2.sh", backup.get("command", String.class));
        assertFalse(backup.has("retry"));
    }

    @Test
    public void disableAndEnableKeepOtherFields()
    {
        conn.add("backup", job("0 * * * *", "backup.sh")
                .setNested("env", createConfigFactory().create().set("TZ", "UTC")));

        conn.disable("backup");
        Config disabled = conn.list().get("backup");
        assertThat(disabled.get("disabled", boolean.class), is(true));
        assertEquals("0 * * * *", disabled.get("cron", String.class));
        assertEquals("UTC", disabled.getNested("env").get("TZ", String.class));

        conn.enable("backup");
        Config enabled = conn.list().get("backup");
        assertThat(enabled.get("disabled", boolean.class), is(false));
        assertEquals("backup.sh", enabled.get("command", String.class));
        assertEquals("backup", enabled.get("name", String.class));
    }

    @Test
    public void disableTwiceKeepsDisabled()
    {
        conn.add("backup", job("0 * * * *", "backup.sh"));
        conn.disable("backup");
        conn.disable("backup");

        assertThat(conn.list().get("backup").get("disabled", boolean.class), is(true));
    }

    @Test
    public void enableOrDisableMissingJobDoesNothing()
    {
        conn.enable("missing");
        conn.disable("missing");

        assertTrue(conn.list().isEmpty());
    }

    @Test
    public void addAfterDisableReplacesDisabledFlag()
    {
        conn.add("backup", job("0 * * * *", "backup.sh"));
        conn.disable("backup");
        conn.add("backup", job("0 * * * *", "backup.sh"));

        assertFalse(conn.list().get("backup").has("disabled"));
    }

    @Test
    public void removeDeletesJobAndLogs()
    {
        conn.add("backup", job("0 * * * *", "backup.sh"));
        conn.add("cleanup", job("*/5 * * * *", "cleanup.sh"));
        conn.appendLog(ExecutionLog.of("backup", createConfigFactory().create().set("status", "ok")));
        conn.appendLog(ExecutionLog.of("backup", createConfigFactory().create().set("status", "failed")));
        conn.appendLog(ExecutionLog.of("cleanup", createConfigFactory().create().set("status", "ok")));

        conn.remove("backup");

        assertThat(conn.list().keySet(), contains("cleanup"));
        assertEquals(0, conn.history("backup", 0, 10).getTotal());
        assertEquals(1, conn.history("cleanup", 0, 10).getTotal());
    }

    @Test
    public void removeMissingJobDeletesOrphanLogs()
    {
        conn.appendLog(ExecutionLog.of("orphan", createConfigFactory().create()));

        conn.remove("orphan");

        assertEquals(0, conn.history("orphan", 0, 10).getTotal());
    }

    @Test
    public void listSkipsUndecodableRows()
    {
        conn.add("backup", job("0 * * * *", "backup.sh"));
        insertRawJob("broken", "[1,2]");

        Map<String, Config> jobs = conn.list();
        assertThat(jobs.keySet(), contains("backup"));
    }

    @Test
    public void addFailsWithUnserializableDocument()
    {
        Config job = job("0 * * * *", "backup.sh");
        job.getInternalObjectNode().putPOJO("handler", new Object());

        try {
            conn.add("backup", job);
            fail();
        }
        catch (CronSerializationException ex) {
        }
        assertTrue(conn.list().isEmpty());
    }

    private void insertRawJob(String name, String data)
    {
        String value = DatabaseConfig.isPostgres(conn.getConfig().getType())
            ? "cast(:data as jsonb)"
            : ":data";
        try (Handle handle = conn.getJdbi().open()) {
            handle.createUpdate("insert into " + conn.getConfig().getTables().quotedJobsTable() +
                        " (name, data) values (:name, " + value + ")")
                .bind("name", name)
                .bind("data", data)
                .execute();
        }
    }
}
