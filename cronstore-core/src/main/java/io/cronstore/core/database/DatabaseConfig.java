package io.cronstore.core.database;

import com.google.common.base.Optional;
import io.cronstore.client.config.Config;
import io.cronstore.client.config.ConfigException;
import org.immutables.value.Value;

import java.io.IOException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;
import java.util.UUID;

@Value.Immutable
public interface DatabaseConfig
{
    String getType();

    Optional<String> getPath();

    /**
     * Resolved PostgreSQL connection string. Absent for h2.
     */
    Optional<String> getDsn();

    CronTables getTables();

    Map<String, String> getOptions();

    int getQueryTimeout();  // seconds, 0 means no timeout

    ////
    // HikariCP config params
    //

    int getConnectionTimeout();  // seconds

    int getIdleTimeout();  // seconds

    int getMaximumPoolSize();

    int getMinimumPoolSize();

    int getValidationTimeout();  // seconds

    long getLeakDetectionThreshold();  // milliseconds

    @Value.Check
    default void check()
    {
        if (getQueryTimeout() < 0) {
            throw new ConfigException("query_timeout must not be negative: " + getQueryTimeout());
        }
        if (getMaximumPoolSize() < 1) {
            throw new ConfigException("maximum_pool_size must be greater than 0: " + getMaximumPoolSize());
        }
    }

    static ImmutableDatabaseConfig.Builder builder()
    {
        return ImmutableDatabaseConfig.builder();
    }

    static DatabaseConfig convertFrom(Config settings, String type)
    {
        ImmutableDatabaseConfig.Builder builder = builder();

        switch (type) {
        case "h2":
            builder.type("h2");
            builder.path(getNonEmptyString(settings, "path"));
            builder.dsn(Optional.absent());
            break;
        case "postgresql":
            {
                String dsn = PostgresDsn.resolve(settings);
                PostgresDsn.parse(dsn);  // fails early on a malformed connection string
                builder.type("postgresql");
                builder.path(Optional.absent());
                builder.dsn(Optional.of(dsn));
            }
            break;
        default:
            throw new ConfigException("Unknown database type: " + type);
        }

        builder.tables(CronTables.convertFrom(settings));

        builder.connectionTimeout(
                settings.get("connection_timeout", int.class, 30));  // HikariCP default: 30
        builder.idleTimeout(
                settings.get("idle_timeout", int.class, 600));  // HikariCP default: 600
        builder.validationTimeout(
                settings.get("validation_timeout", int.class, 5));  // HikariCP default: 5

        int maximumPoolSize = settings.get("maximum_pool_size", int.class, 10);  // HikariCP default: 10
        builder.maximumPoolSize(maximumPoolSize);
        builder.minimumPoolSize(
                settings.get("minimum_pool_size", int.class, maximumPoolSize));  // HikariCP default: same as maximumPoolSize
        builder.leakDetectionThreshold(
                settings.get("leak_detection_threshold", long.class, 0L));  // HikariCP default: 0

        builder.queryTimeout(settings.get("query_timeout", int.class, 0));

        builder.options(settings.getMapOrEmpty("opts", String.class, String.class));

        return builder.build();
    }

    /**
     * Returns the value of {@code key}. Empty strings are handled as absent.
     */
    static Optional<String> getNonEmptyString(Config settings, String key)
    {
        Optional<String> value = settings.getOptional(key, String.class);
        if (value.isPresent() && value.get().isEmpty()) {
            return Optional.absent();
        }
        return value;
    }

    static String buildJdbcUrl(DatabaseConfig config)
    {
        switch (config.getType()) {
        case "h2":
            if (config.getPath().isPresent()) {
                Path dir = FileSystems.getDefault().getPath(config.getPath().get());
                try {
                    Files.createDirectories(dir);
                }
                catch (IOException ex) {
                    throw new ConfigException(ex);
                }
                return String.format(Locale.ENGLISH,
                        "jdbc:h2:%s",
                        dir.resolve("cronstore").toAbsolutePath().toString());  // h2 requires absolute path
            }
            else {
                return String.format(Locale.ENGLISH,
                        "jdbc:h2:mem:cronstore-%s",
                        UUID.randomUUID());
            }

        case "postgresql":
            if (!config.getDsn().isPresent()) {
                throw new IllegalArgumentException("Database type is postgresql but dsn is not set unexpectedly");
            }
            return PostgresDsn.parse(config.getDsn().get()).getJdbcUrl();

        default:
            throw new ConfigException("Unsupported database type: " + config.getType());
        }
    }

    static Properties buildJdbcProperties(DatabaseConfig config)
    {
        Properties props = new Properties();

        switch (config.getType()) {
        case "h2":
            // nothing
            break;

        case "postgresql":
            props.setProperty("loginTimeout", Integer.toString(config.getConnectionTimeout()));  // seconds
            props.setProperty("tcpKeepAlive", "true");
            props.putAll(PostgresDsn.parse(config.getDsn().get()).getProperties());
            break;

        default:
            throw new ConfigException("Unsupported database type: " + config.getType());
        }

        for (Map.Entry<String, String> pair : config.getOptions().entrySet()) {
            props.setProperty(pair.getKey(), pair.getValue());
        }

        return props;
    }

    static String getDriverClassName(String type)
    {
        switch (type) {
        case "h2":
            return "org.h2.Driver";
        case "postgresql":
            return "org.postgresql.Driver";
        default:
            throw new ConfigException("Unsupported database type: " + type);
        }
    }

    static boolean isPostgres(String databaseType)
    {
        return databaseType.equals("postgresql");
    }
}
