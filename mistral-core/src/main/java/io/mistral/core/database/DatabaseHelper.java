package io.mistral.core.database;

import org.jdbi.v3.core.Handles;
import org.jdbi.v3.core.Jdbi;
import org.jdbi.v3.core.h2.H2DatabasePlugin;
import org.jdbi.v3.postgres.PostgresPlugin;
import org.jdbi.v3.sqlobject.SqlObjectPlugin;

import javax.sql.DataSource;

public class DatabaseHelper
{
    private DatabaseHelper()
    { }

    public static Jdbi createJdbi(DataSource ds)
    {
        Jdbi jdbi = Jdbi.create(ds);
        // handles are committed or rolled back explicitly before close
        jdbi.getConfig(Handles.class).setForceEndTransactions(false);
        jdbi.installPlugin(new SqlObjectPlugin());
        if (ds.getClass().getCanonicalName().startsWith("org.h2")) {
            jdbi.installPlugin(new H2DatabasePlugin());
        }
        else {
            jdbi.installPlugin(new PostgresPlugin());
        }
        return jdbi;
    }

    static Jdbi createJdbi(DataSource ds, ConfigMapper configMapper)
    {
        Jdbi jdbi = createJdbi(ds);
        jdbi.registerArgument(configMapper.getArgumentFactory());
        jdbi.registerRowMapper(new DatabaseScheduledJobStoreManager.StoredScheduledJobMapper(configMapper));
        jdbi.registerRowMapper(new DatabaseDelayedCallStoreManager.StoredDelayedCallMapper(configMapper));
        jdbi.registerRowMapper(new DatabaseNamedLockStoreManager.StoredNamedLockMapper());
        return jdbi;
    }
}
