package io.cronstore.core.database;

import com.google.inject.Inject;

import io.cronstore.client.config.Config;
import io.cronstore.client.config.ConfigFactory;
import io.cronstore.spi.CronConnection;
import io.cronstore.spi.CronDriver;

public class PostgresqlCronDriver
        implements CronDriver
{
    public static final String TYPE = "postgresql";

    private final ConfigFactory cf;

    @Inject
    public PostgresqlCronDriver(ConfigFactory cf)
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
