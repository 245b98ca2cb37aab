package io.cronstore.core.database;

import java.sql.SQLException;
import java.sql.SQLTimeoutException;
import java.sql.SQLTransientConnectionException;

import io.cronstore.spi.CronQueryException;
import io.cronstore.spi.CronTimeoutException;
import org.jdbi.v3.core.ConnectionException;
import org.junit.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.instanceOf;
import static org.hamcrest.Matchers.not;
import static org.junit.Assert.assertSame;

public class BasicDatabaseStoreManagerTest
{
    @Test
    public void poolTimeoutIsTimeout()
    {
        ConnectionException ex = new ConnectionException(
                new SQLTransientConnectionException("cronstore - Connection is not available, request timed out after 1000ms."));
        CronQueryException translated = BasicDatabaseStoreManager.translateException(ex);
        assertThat(translated, instanceOf(CronTimeoutException.class));
        assertThat(translated.getMessage(), containsString("request timed out"));
        assertSame(ex, translated.getCause());
    }

    @Test
    public void statementTimeoutIsTimeout()
    {
        assertThat(BasicDatabaseStoreManager.translateException(
                    new ConnectionException(new SQLTimeoutException("timeout"))),
                instanceOf(CronTimeoutException.class));
        assertThat(BasicDatabaseStoreManager.translateException(
                    new ConnectionException(new SQLException("canceling statement due to statement timeout", "57014"))),
                instanceOf(CronTimeoutException.class));
        assertThat(BasicDatabaseStoreManager.translateException(
                    new ConnectionException(new SQLException("interrupted", new InterruptedException()))),
                instanceOf(CronTimeoutException.class));
    }

    @Test
    public void otherErrorsAreQueryErrors()
    {
        ConnectionException ex = new ConnectionException(new SQLException("relation \"cron_jobs\" does not exist", "42P01"));
        CronQueryException translated = BasicDatabaseStoreManager.translateException(ex);
        assertThat(translated, not(instanceOf(CronTimeoutException.class)));
        assertThat(translated.getMessage(), containsString("does not exist"));
    }
}
