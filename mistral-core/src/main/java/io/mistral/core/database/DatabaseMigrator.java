package io.mistral.core.database;

import com.google.inject.Inject;
import io.mistral.core.database.migrate.Migration;
import io.mistral.core.database.migrate.MigrationContext;
import io.mistral.core.database.migrate.Migration_20250310093000_CreateScheduledJobs;
import io.mistral.core.database.migrate.Migration_20250310093100_CreateDelayedCalls;
import io.mistral.core.database.migrate.Migration_20250310093200_CreateNamedLocks;
import org.jdbi.v3.core.Handle;
import org.jdbi.v3.core.Jdbi;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import javax.sql.DataSource;

public class DatabaseMigrator
{
    private static final Logger logger = LoggerFactory.getLogger(DatabaseMigrator.class);

    private final List<Migration> migrations = Stream.of(new Migration[] {
        new Migration_20250310093000_CreateScheduledJobs(),
        new Migration_20250310093100_CreateDelayedCalls(),
        new Migration_20250310093200_CreateNamedLocks(),
    })
    .sorted(Comparator.comparing(m -> m.getVersion()))
    .collect(Collectors.toList());

    private final Jdbi dbi;
    private final String databaseType;

    @Inject
    public DatabaseMigrator(DataSource ds, DatabaseConfig config)
    {
        this(DatabaseHelper.createJdbi(ds), config.getType());
    }

    DatabaseMigrator(Jdbi dbi, String databaseType)
    {
        this.dbi = dbi;
        this.databaseType = databaseType;
    }

    public String getSchemaVersion()
    {
        try (Handle handle = dbi.open()) {
            return handle.createQuery("select name from schema_migrations order by name desc limit 1")
                .mapTo(String.class)
                .one();
        }
    }

    public int migrate()
    {
        int numApplied = 0;
        MigrationContext context = new MigrationContext(databaseType);
        Set<String> appliedSet;
        try (Handle handle = dbi.open()) {
            if (!existsSchemaMigrationsTable(handle)) {
                createSchemaMigrationsTable(handle, context);
            }
            appliedSet = getAppliedMigrationNames(handle);
        }
        for (Migration m : migrations) {
            if (appliedSet.add(m.getVersion())) {
                if (applyMigrationIfNotDone(context, m)) {
                    numApplied++;
                }
            }
        }
        if (numApplied > 0) {
            logger.info("{} migrations applied.", numApplied);
        }
        return numApplied;
    }

    // synchronized so that multiple threads don't run the same migration on the same database
    private synchronized boolean applyMigrationIfNotDone(MigrationContext context, Migration m)
    {
        try (Handle handle = dbi.open()) {
            return handle.inTransaction((h) -> {
                if (context.isPostgres()) {
                    // lock tables not to run migration concurrently.
                    h.execute("LOCK TABLE schema_migrations IN EXCLUSIVE MODE");
                    if (checkIfMigrationApplied(h, m.getVersion())) {
                        return false;
                    }
                }
                // h2 doesn't need a table lock because of synchronized
                logger.debug("Applying database migration: {}", m.getVersion());
                applyMigration(m, h, context);
                return true;
            });
        }
    }

    private Set<String> getAppliedMigrationNames(Handle handle)
    {
        return new HashSet<>(
                handle.createQuery("select name from schema_migrations")
                .mapTo(String.class)
                .list());
    }

    private boolean checkIfMigrationApplied(Handle handle, String name)
    {
        return !handle.createQuery("select name from schema_migrations where name = :name")
            .bind("name", name)
            .mapTo(String.class)
            .list()
            .isEmpty();
    }

    private void createSchemaMigrationsTable(Handle handle, MigrationContext context)
    {
        handle.execute(
                context.newCreateTableBuilder("schema_migrations")
                .addString("name", "not null")
                .addTimestamp("created_at", "not null")
                .build());
    }

    private boolean existsSchemaMigrationsTable(Handle handle)
    {
        try {
            handle.createQuery("select name from schema_migrations limit 1")
                    .mapTo(String.class)
                    .list();
            return true;
        }
        catch (RuntimeException re) {
            return false;
        }
    }

    private void applyMigration(Migration m, Handle handle, MigrationContext context)
    {
        m.migrate(handle, context);
        handle.execute("insert into schema_migrations (name, created_at) values (?, now())", m.getVersion());
    }
}
