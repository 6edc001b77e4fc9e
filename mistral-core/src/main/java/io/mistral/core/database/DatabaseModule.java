package io.mistral.core.database;

import com.google.inject.Binder;
import com.google.inject.Inject;
import com.google.inject.Module;
import com.google.inject.Scopes;
import io.mistral.core.lock.NamedLockManager;
import io.mistral.core.scheduler.ScheduledJobStoreManager;
import io.mistral.core.scheduler.legacy.DelayedCallStoreManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;

public class DatabaseModule
        implements Module
{
    @Override
    public void configure(Binder binder)
    {
        binder.bind(DatabaseConfig.class).toProvider(DatabaseConfigProvider.class).in(Scopes.SINGLETON);
        binder.bind(DataSourceProvider.class).in(Scopes.SINGLETON);
        binder.bind(DataSource.class).toProvider(DataSourceProvider.class).in(Scopes.SINGLETON);
        binder.bind(AutoMigrator.class).in(Scopes.SINGLETON);
        binder.bind(LocalLockMap.class).in(Scopes.SINGLETON);
        binder.bind(TransactionManager.class).to(ThreadLocalTransactionManager.class).in(Scopes.SINGLETON);
        binder.bind(ConfigMapper.class).in(Scopes.SINGLETON);
        binder.bind(DatabaseMigrator.class).in(Scopes.SINGLETON);
        binder.bind(DatabaseRowMutator.class).in(Scopes.SINGLETON);
        binder.bind(ScheduledJobStoreManager.class).to(DatabaseScheduledJobStoreManager.class).in(Scopes.SINGLETON);
        binder.bind(DelayedCallStoreManager.class).to(DatabaseDelayedCallStoreManager.class).in(Scopes.SINGLETON);
        binder.bind(NamedLockManager.class).to(DatabaseNamedLockStoreManager.class).in(Scopes.SINGLETON);
    }

    public static class AutoMigrator
    {
        private static final Logger logger = LoggerFactory.getLogger(AutoMigrator.class);

        private final DatabaseConfig config;
        private final DatabaseMigrator migrator;

        @Inject
        public AutoMigrator(DatabaseConfig config, DatabaseMigrator migrator)
        {
            this.config = config;
            this.migrator = migrator;
        }

        public void migrate()
        {
            if (config.getAutoMigrate()) {
                int count = migrator.migrate();
                if (count > 0) {
                    logger.info("Applied {} database migrations. Schema version is {}", count, migrator.getSchemaVersion());
                }
            }
        }
    }
}
