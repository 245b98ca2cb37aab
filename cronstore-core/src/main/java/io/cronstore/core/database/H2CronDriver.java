package io.cronstore.core.database;

import com.google.inject.Inject;

import io.cronstore.client.config.Config;
import io.cronstore.client.config.ConfigFactory;
import io.cronstore.spi.CronConnection;
import io.cronstore.spi.CronDriver;

/**
 * Embedded h2 database. Settings take {@code path} to store data in files under
 * the directory. Without it, each connection gets its own in-memory database
 * that is dropped when the connection is closed.
 */
public class H2CronDriver
        implements CronDriver
{
    public static final String TYPE = "h2";

    private final ConfigFactory cf;

    @Inject
    public H2CronDriver(ConfigFactory cf)
    {
        this.cf = cf;
    }

    @Override
    public String getType()
    {
        return TYPE;
    }

    @Override
    public CronConnection connection(Config settings)
    {
        return new DatabaseCronConnection(DatabaseConfig.convertFrom(settings, TYPE), cf);
    }
}
