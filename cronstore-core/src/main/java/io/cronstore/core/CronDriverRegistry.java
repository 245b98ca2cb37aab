package io.cronstore.core;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMultimap;
import com.google.common.collect.ImmutableSet;
import com.google.inject.Inject;
import io.cronstore.client.config.Config;
import io.cronstore.client.config.ConfigException;
import io.cronstore.client.config.ConfigFactory;
import io.cronstore.core.database.H2CronDriver;
import io.cronstore.core.database.PostgresqlCronDriver;
import io.cronstore.spi.CronConnection;
import io.cronstore.spi.CronDriver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drivers by name, and the connections opened through them.
 *
 * {@link #close()} closes every connection opened by {@link #connect(String, Config)}.
 */
public class CronDriverRegistry
        implements AutoCloseable
{
    private static final Logger logger = LoggerFactory.getLogger(CronDriverRegistry.class);

    // extra names of built-in driver types
    private static final ImmutableMultimap<String, String> ALIASES = ImmutableMultimap.<String, String>builder()
        .putAll(PostgresqlCronDriver.TYPE, "postgres", "pgsql")
        .putAll(H2CronDriver.TYPE, "memory")
        .build();

    private final Map<String, CronDriver> drivers = new LinkedHashMap<>();
    private final List<CronConnection> connections = new ArrayList<>();
    private boolean closed = false;

    public CronDriverRegistry()
    { }

    /**
     * Registers each driver under its type and the aliases of the type.
     */
    @Inject
    public CronDriverRegistry(Set<CronDriver> drivers)
    {
        for (CronDriver driver : drivers) {
            register(driver.getType(), driver);
            for (String alias : ALIASES.get(driver.getType())) {
                register(alias, driver);
            }
        }
    }

    public static CronDriverRegistry withBuiltinDrivers(ObjectMapper mapper)
    {
        ConfigFactory cf = new ConfigFactory(mapper);
        return new CronDriverRegistry(ImmutableSet.of(
                    new PostgresqlCronDriver(cf),
                    new H2CronDriver(cf)));
    }

    public synchronized void register(String name, CronDriver driver)
    {
        checkNotClosed();
        if (drivers.containsKey(name)) {
            throw new IllegalArgumentException("Cron driver '" + name + "' is already registered");
        }
        drivers.put(name, driver);
    }

    public synchronized CronDriver getDriver(String name)
    {
        checkNotClosed();
        CronDriver driver = drivers.get(name);
        if (driver == null) {
            throw new ConfigException("Unknown cron driver '" + name + "'. Available drivers are " + drivers.keySet());
        }
        return driver;
    }

    public synchronized List<String> getRegisteredNames()
    {
        checkNotClosed();
        return ImmutableList.copyOf(drivers.keySet());
    }

    /**
     * Creates and opens a connection using the named driver. The connection
     * is closed when this registry is closed if it isn't closed before.
     */
    public CronConnection connect(String name, Config settings)
    {
        CronConnection connection = getDriver(name).connection(settings);
        connection.open();
        synchronized (this) {
            if (closed) {
                connection.close();
                throw new IllegalStateException("Cron driver registry is already closed");
            }
            connections.add(connection);
        }
        logger.debug("Opened cron store connection using driver {}", name);
        return connection;
    }

    @Override
    public synchronized void close()
    {
        if (closed) {
            return;
        }
        closed = true;
        RuntimeException error = null;
        for (CronConnection connection : ImmutableList.copyOf(connections).reverse()) {
            try {
                connection.close();
            }
            catch (RuntimeException ex) {
                if (error == null) {
                    error = ex;
                }
                else {
                    error.addSuppressed(ex);
                }
            }
        }
        connections.clear();
        drivers.clear();
        if (error != null) {
            throw error;
        }
    }

    private void checkNotClosed()
    {
        if (closed) {
            throw new IllegalStateException("Cron driver registry is already closed");
        }
    }
}
