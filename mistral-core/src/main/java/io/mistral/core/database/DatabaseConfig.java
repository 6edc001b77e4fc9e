package io.mistral.core.database;

import com.google.common.base.Optional;
import com.google.common.collect.ImmutableMap;
import io.mistral.commons.config.Config;
import io.mistral.commons.config.ConfigException;
import org.immutables.value.Value;

import java.io.IOException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;
import java.util.UUID;

@Value.Immutable
public interface DatabaseConfig
{
    String getType();

    Optional<String> getPath();

    Map<String, String> getOptions();

    Optional<RemoteDatabaseConfig> getRemoteDatabaseConfig();

    boolean getAutoMigrate();

    /**
     * One of READ_UNCOMMITTED, READ_COMMITTED, REPEATABLE_READ or SERIALIZABLE.
     * Applied to every connection when a session starts.
     */
    String getIsolationLevel();

    /**
     * True if concurrent transactions on different connections block on each other's
     * row locks. If false, writers on the same row are serialized through a
     * {@link LocalLockMap} shared by the process.
     */
    boolean getRowLocks();

    ////
    // HikariCP config params
    //

    int getConnectionTimeout();  // seconds

    int getIdleTimeout();  // seconds

    int getMaximumPoolSize();

    int getMinimumPoolSize();

    int getValidationTimeout();  // seconds

    long getLeakDetectionThreshold();  // milliseconds

    static ImmutableDatabaseConfig.Builder builder()
    {
        return ImmutableDatabaseConfig.builder();
    }

    static DatabaseConfig convertFrom(Config config)
    {
        return convertFrom(config, "database");
    }

    static DatabaseConfig convertFrom(Config config, String keyPrefix)
    {
        ImmutableDatabaseConfig.Builder builder = builder();

        String type = config.get(keyPrefix + ".type", String.class, "memory");
        switch (type) {
        case "h2":
            builder.type("h2");
            builder.path(Optional.of(config.get(keyPrefix + ".path", String.class)));
            builder.remoteDatabaseConfig(Optional.absent());
            break;
        case "memory":
            builder.type("h2");
            builder.path(Optional.absent());
            builder.remoteDatabaseConfig(Optional.absent());
            break;
        case "postgresql":
            builder.type("postgresql");
            builder.remoteDatabaseConfig(Optional.of(
                RemoteDatabaseConfig.builder()
                    .user(config.get(keyPrefix + ".user", String.class))
                    .password(config.get(keyPrefix + ".password", String.class, ""))
                    .host(config.get(keyPrefix + ".host", String.class))
                    .port(config.getOptional(keyPrefix + ".port", Integer.class))
                    .database(config.get(keyPrefix + ".database", String.class))
                    .loginTimeout(config.get(keyPrefix + ".loginTimeout", int.class, 30))
                    .socketTimeout(config.get(keyPrefix + ".socketTimeout", int.class, 1800))
                    .ssl(config.get(keyPrefix + ".ssl", boolean.class, false))
                    .sslmode(config.getOptional(keyPrefix + ".sslmode", String.class))
                    .build()));
            break;
        default:
            throw new ConfigException("Unknown database.type: " + type);
        }

        String isolationLevel = config.get(keyPrefix + ".isolationLevel", String.class, "READ_COMMITTED").toUpperCase(Locale.ENGLISH);
        isolationLevelOf(isolationLevel);  // validate
        builder.isolationLevel(isolationLevel);
        // H2 waits for a row lock only up to its lock timeout and then fails,
        // so in-process locks are used by default.
        builder.rowLocks(
                config.get(keyPrefix + ".rowLocks", boolean.class, isPostgres(type)));

        builder.connectionTimeout(
                config.get(keyPrefix + ".connectionTimeout", int.class, 30));  // HikariCP default: 30
        builder.idleTimeout(
                config.get(keyPrefix + ".idleTimeout", int.class, 600));  // HikariCP default: 600
        builder.validationTimeout(
                config.get(keyPrefix + ".validationTimeout", int.class, 5));  // HikariCP default: 5

        int maximumPoolSize = config.get(keyPrefix + ".maximumPoolSize", int.class,
                Runtime.getRuntime().availableProcessors() * 4);  // HikariCP default: 10

        builder.maximumPoolSize(maximumPoolSize);
        builder.minimumPoolSize(
                config.get(keyPrefix + ".minimumPoolSize", int.class, maximumPoolSize));
        builder.leakDetectionThreshold(
                config.get(keyPrefix + ".leakDetectionThreshold", long.class, 0L));

        // database.opts.* to options
        ImmutableMap.Builder<String, String> options = ImmutableMap.builder();
        String optionKey = keyPrefix + ".opts.";
        for (String key : config.getKeys()) {
            if (key.startsWith(optionKey)) {
                options.put(key.substring(optionKey.length()), config.get(key, String.class));
            }
        }
        builder.options(options.build());

        builder.autoMigrate(
                config.get(keyPrefix + ".migrate", boolean.class, true));

        return builder.build();
    }

    static int isolationLevelOf(String name)
    {
        switch (name) {
        case "READ_UNCOMMITTED":
            return Connection.TRANSACTION_READ_UNCOMMITTED;
        case "READ_COMMITTED":
            return Connection.TRANSACTION_READ_COMMITTED;
        case "REPEATABLE_READ":
            return Connection.TRANSACTION_REPEATABLE_READ;
        case "SERIALIZABLE":
            return Connection.TRANSACTION_SERIALIZABLE;
        default:
            throw new ConfigException("Unknown database.isolationLevel: " + name);
        }
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
                        dir.resolve("mistral").toAbsolutePath().toString());  // h2 requires absolute path
            }
            else {
                return String.format(Locale.ENGLISH,
                        "jdbc:h2:mem:mistral-%s",
                        UUID.randomUUID());
            }

        case "postgresql":
            {
                if (!config.getRemoteDatabaseConfig().isPresent()) {
                    throw new IllegalArgumentException("Database type is postgresql but remoteDatabaseConfig is not set unexpectedly");
                }
                RemoteDatabaseConfig remote = config.getRemoteDatabaseConfig().get();
                if (remote.getPort().isPresent()) {
                    return String.format(Locale.ENGLISH,
                            "jdbc:postgresql://%s:%d/%s",
                            remote.getHost(), remote.getPort().get(), remote.getDatabase());
                }
                else {
                    return String.format(Locale.ENGLISH,
                            "jdbc:postgresql://%s/%s",
                            remote.getHost(), remote.getDatabase());
                }
            }

        default:
            throw new ConfigException("Unsupported database type: " + config.getType());
        }
    }

    static Properties buildJdbcProperties(DatabaseConfig config)
    {
        Properties props = new Properties();

        if (config.getRemoteDatabaseConfig().isPresent()) {
            RemoteDatabaseConfig rc = config.getRemoteDatabaseConfig().get();
            props.setProperty("loginTimeout", Integer.toString(rc.getLoginTimeout()));  // seconds
            props.setProperty("socketTimeout", Integer.toString(rc.getSocketTimeout()));  // seconds
            props.setProperty("tcpKeepAlive", "true");
            props.setProperty("user", rc.getUser());
            props.setProperty("password", rc.getPassword());
            if (rc.getSsl()) {
                props.setProperty("ssl", "true");
                if (rc.getSslmode().isPresent()) {
                    props.setProperty("sslmode", rc.getSslmode().get());
                }
            }
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
