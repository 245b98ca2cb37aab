package io.cronstore.core.database;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import io.cronstore.client.config.Config;
import io.cronstore.spi.CronConnection;
import io.cronstore.spi.CronConnectionException;
import io.cronstore.spi.CronStore;
import io.cronstore.spi.ExecutionLog;
import io.cronstore.spi.LogHistory;
import org.junit.Test;

import static io.cronstore.core.database.DatabaseTestingUtils.createConfigFactory;
import static io.cronstore.core.database.DatabaseTestingUtils.createConnection;
import static io.cronstore.core.database.DatabaseTestingUtils.getEnvironmentSettings;
import static io.cronstore.core.database.DatabaseTestingUtils.setupConnection;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.is;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class DatabaseCronConnectionTest
{
    private static Config newConfig()
    {
        return createConfigFactory().create();
    }

    @Test
    public void workedExample()
    {
        try (DatabaseCronConnection conn = setupConnection()) {
            conn.add("backup", newConfig().set("schedule", "0 * * * *").set("disabled", false));
            Config backup = conn.list().get("backup");
            assertThat(backup.get("disabled", boolean.class), is(false));

            conn.disable("backup");
            backup = conn.list().get("backup");
            assertThat(backup.get("disabled", boolean.class), is(true));
            assertEquals("0 * * * *", backup.get("schedule", String.class));

            conn.appendLog(ExecutionLog.of("backup", newConfig().set("status", "ok").set("attempt", 1)));
            conn.appendLog(ExecutionLog.of("backup", newConfig().set("status", "ok").set("attempt", 2)));
            LogHistory history = conn.history("backup", 0, 10);
            assertEquals(2, history.getTotal());
            assertEquals(2, (int) history.getLogs().get(0).getData().get("attempt", int.class));
            assertEquals(1, (int) history.getLogs().get(1).getData().get("attempt", int.class));

            conn.remove("backup");
            history = conn.history("backup", 0, 10);
            assertEquals(0, history.getTotal());
            assertTrue(history.getLogs().isEmpty());
        }
    }

    @Test
    public void openTwiceFails()
    {
        try (DatabaseCronConnection conn = setupConnection()) {
            assertTrue(conn.isOpen());
            try {
                conn.open();
                fail();
            }
            catch (IllegalStateException ex) {
            }
            assertTrue(conn.isOpen());
        }
    }

    @Test
    public void operationsFailBeforeOpen()
    {
        DatabaseCronConnection conn = createConnection(getEnvironmentSettings());
        assertFalse(conn.isOpen());
        try {
            conn.list();
            fail();
        }
        catch (IllegalStateException ex) {
        }
        try {
            conn.lock("key", Duration.ofSeconds(1));
            fail();
        }
        catch (IllegalStateException ex) {
        }
        conn.close();
    }

    @Test
    public void closeIsIdempotent()
    {
        DatabaseCronConnection conn = setupConnection();
        conn.close();
        assertFalse(conn.isOpen());
        conn.close();
        assertFalse(conn.isOpen());
    }

    @Test
    public void operationsFailAfterClose()
    {
        DatabaseCronConnection conn = setupConnection();
        conn.close();
        try {
            conn.add("backup", newConfig());
            fail();
        }
        catch (IllegalStateException ex) {
        }
        try {
            conn.history("backup", 0, 10);
            fail();
        }
        catch (IllegalStateException ex) {
        }
        try {
            conn.open();
            fail();
        }
        catch (IllegalStateException ex) {
        }
    }

    @Test
    public void unreachableServerFailsToOpen()
    {
        Config settings = newConfig()
            .set("host", "127.0.0.1")
            .set("port", 1)
            .set("connection_timeout", 1);
        CronConnection conn = new PostgresqlCronDriver(createConfigFactory()).connection(settings);
        try {
            conn.open();
            fail();
        }
        catch (CronConnectionException ex) {
            assertThat(ex.getMessage(), containsString("postgresql"));
        }
        assertFalse(conn.isOpen());
        conn.close();
    }

    @Test
    public void openIsIdempotentOnProvisionedSchema()
            throws Exception
    {
        Config settings = getEnvironmentSettings();
        if (!DatabaseTestingUtils.isPostgresEnvironment()) {
            // in-memory h2 databases are not shared between connections
            Path dir = Files.createTempDirectory("cronstore-test");
            settings.set("path", dir.toString());
        }

        try (DatabaseCronConnection first = createConnection(settings)) {
            first.open();
            DatabaseTestingUtils.cleanDatabase(first);
            first.add("backup", newConfig().set("schedule", "0 * * * *"));
        }
        try (DatabaseCronConnection second = createConnection(settings)) {
            second.open();
            assertThat(second.list().keySet(), contains("backup"));
            DatabaseTestingUtils.cleanDatabase(second);
        }
    }

    @Test
    public void customSchemaAndTableNames()
    {
        Config settings = getEnvironmentSettings()
            .set("schema", "cron test")
            .set("jobs_table", "jobs \"v2\"")
            .set("logs_table", "logs-v2")
            .set("locks_table", "locks v2");
        try (DatabaseCronConnection conn = createConnection(settings)) {
            conn.open();
            DatabaseTestingUtils.cleanDatabase(conn);

            CronTables tables = conn.getConfig().getTables();
            assertEquals("\"cron test\".\"jobs \"\"v2\"\"\"", tables.quotedJobsTable());

            conn.add("backup", newConfig().set("schedule", "0 * * * *"));
            conn.appendLog(ExecutionLog.of("backup", newConfig().set("status", "ok")));
            assertTrue(conn.lock("backup", Duration.ofSeconds(1)));

            assertThat(conn.list().keySet(), contains("backup"));
            assertEquals(1, conn.history("backup", 0, 10).getTotal());
            assertFalse(conn.lock("backup", Duration.ofSeconds(1)));
        }
    }

    @Test
    public void timeoutViewRunsOperations()
    {
        try (DatabaseCronConnection conn = setupConnection()) {
            CronStore store = conn.withTimeout(Duration.ofSeconds(5));
            store.add("backup", newConfig().set("schedule", "0 * * * *"));
            store.disable("backup");
            store.appendLog(ExecutionLog.of("backup", newConfig().set("status", "ok")));
            assertTrue(store.lock("backup@1", Duration.ofSeconds(1)));

            assertThat(conn.list().get("backup").get("disabled", boolean.class), is(true));
            assertEquals(1, store.history("backup", 0, 10).getTotal());
            assertFalse(conn.lock("backup@1", Duration.ofSeconds(1)));

            store.remove("backup");
            assertTrue(conn.list().isEmpty());
        }
    }

    @Test
    public void timeoutViewRejectsNonPositiveTimeout()
    {
        try (DatabaseCronConnection conn = setupConnection()) {
            for (Duration timeout : new Duration[] { Duration.ZERO, Duration.ofSeconds(-1) }) {
                try {
                    conn.withTimeout(timeout);
                    fail("Expected failure: " + timeout);
                }
                catch (IllegalArgumentException ex) {
                }
            }
        }
    }

    @Test
    public void timeoutViewRequiresOpenConnection()
    {
        DatabaseCronConnection conn = createConnection(getEnvironmentSettings());
        try {
            conn.withTimeout(Duration.ofSeconds(1));
            fail();
        }
        catch (IllegalStateException ex) {
        }

        conn.open();
        CronStore store = conn.withTimeout(Duration.ofSeconds(1));
        conn.close();
        try {
            store.list();
            fail();
        }
        catch (IllegalStateException ex) {
        }
    }

    @Test
    public void queryTimeoutIsRoundedUpToSeconds()
    {
        assertEquals(1, DatabaseCronConnection.toQueryTimeout(Duration.ofMillis(1)));
        assertEquals(1, DatabaseCronConnection.toQueryTimeout(Duration.ofSeconds(1)));
        assertEquals(2, DatabaseCronConnection.toQueryTimeout(Duration.ofMillis(1500)));
        assertEquals(Integer.MAX_VALUE, DatabaseCronConnection.toQueryTimeout(Duration.ofDays(365 * 100)));
    }
}
