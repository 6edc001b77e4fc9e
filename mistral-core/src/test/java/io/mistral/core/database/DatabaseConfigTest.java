package io.mistral.core.database;

import io.mistral.commons.config.Config;
import io.mistral.commons.config.ConfigException;
import org.junit.Test;

import java.sql.Connection;
import java.util.Properties;

import static io.mistral.core.database.DatabaseTestingUtils.createConfig;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.startsWith;

public class DatabaseConfigTest
{
    @Test
    public void memoryDatabaseByDefault()
    {
        DatabaseConfig config = DatabaseConfig.convertFrom(createConfig());
        assertThat(config.getType(), is("h2"));
        assertThat(config.getPath().isPresent(), is(false));
        assertThat(config.getAutoMigrate(), is(true));
        assertThat(config.getIsolationLevel(), is("READ_COMMITTED"));
        assertThat(config.getRowLocks(), is(false));
        assertThat(DatabaseConfig.buildJdbcUrl(config), startsWith("jdbc:h2:mem:mistral-"));
    }

    @Test
    public void postgresqlUsesRowLocks()
    {
        Config system = createConfig()
            .set("database.type", "postgresql")
            .set("database.host", "db.example.com")
            .set("database.port", 5433)
            .set("database.user", "mistral")
            .set("database.password", "secret")
            .set("database.database", "scheduler")
            .set("database.ssl", true)
            .set("database.sslmode", "verify-full")
            .set("database.opts.applicationName", "mistral-test");
        DatabaseConfig config = DatabaseConfig.convertFrom(system);

        assertThat(config.getType(), is("postgresql"));
        assertThat(config.getRowLocks(), is(true));
        assertThat(DatabaseConfig.buildJdbcUrl(config), is("jdbc:postgresql://db.example.com:5433/scheduler"));

        Properties props = DatabaseConfig.buildJdbcProperties(config);
        assertThat(props.getProperty("user"), is("mistral"));
        assertThat(props.getProperty("ssl"), is("true"));
        assertThat(props.getProperty("sslmode"), is("verify-full"));
        assertThat(props.getProperty("applicationName"), is("mistral-test"));
        assertThat(DatabaseConfig.getDriverClassName(config.getType()), is("org.postgresql.Driver"));
    }

    @Test
    public void rowLocksCanBeEnabledOnH2()
    {
        DatabaseConfig config = DatabaseConfig.convertFrom(createConfig()
                .set("database.rowLocks", true)
                .set("database.isolationLevel", "serializable"));
        assertThat(config.getRowLocks(), is(true));
        assertThat(config.getIsolationLevel(), is("SERIALIZABLE"));
        assertThat(DatabaseConfig.isolationLevelOf(config.getIsolationLevel()), is(Connection.TRANSACTION_SERIALIZABLE));
    }

    @Test(expected = ConfigException.class)
    public void rejectUnknownIsolationLevel()
    {
        DatabaseConfig.convertFrom(createConfig().set("database.isolationLevel", "snapshot"));
    }

    @Test(expected = ConfigException.class)
    public void rejectUnknownType()
    {
        DatabaseConfig.convertFrom(createConfig().set("database.type", "mysql"));
    }
}
