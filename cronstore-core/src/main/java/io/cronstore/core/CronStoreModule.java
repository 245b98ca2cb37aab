package io.cronstore.core;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.inject.Binder;
import com.google.inject.Module;
import com.google.inject.Scopes;
import com.google.inject.multibindings.Multibinder;
import io.cronstore.client.CronStoreJson;
import io.cronstore.client.config.ConfigFactory;
import io.cronstore.core.database.H2CronDriver;
import io.cronstore.core.database.PostgresqlCronDriver;
import io.cronstore.spi.CronDriver;

public class CronStoreModule
        implements Module
{
    @Override
    public void configure(Binder binder)
    {
        binder.bind(ObjectMapper.class).toInstance(CronStoreJson.objectMapper());
        binder.bind(ConfigFactory.class).in(Scopes.SINGLETON);
        binder.bind(CronDriverRegistry.class).in(Scopes.SINGLETON);

        Multibinder<CronDriver> drivers = Multibinder.newSetBinder(binder, CronDriver.class);
        drivers.addBinding().to(PostgresqlCronDriver.class);
        drivers.addBinding().to(H2CronDriver.class);
    }
}
