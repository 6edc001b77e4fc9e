package io.mistral.core.database;

import com.google.inject.Provider;
import io.mistral.commons.guava.ThrowablesUtil;
import io.mistral.core.lock.NamedLockManager;
import io.mistral.core.scheduler.ScheduledJobStoreManager;
import io.mistral.core.scheduler.legacy.DelayedCallStoreManager;
import org.jdbi.v3.core.Jdbi;

import static io.mistral.core.database.DatabaseTestingUtils.createConfigMapper;

public class DatabaseFactory
        implements AutoCloseable, Provider<TransactionManager>
{
    private final DataSourceProvider dsp;
    private final DatabaseConfig config;
    private final LocalLockMap localLocks;
    private final TransactionManager tm;

    public DatabaseFactory(DataSourceProvider dsp, DatabaseConfig config)
    {
        this.dsp = dsp;
        this.config = config;
        this.localLocks = new LocalLockMap();
        this.tm = newTransactionManager();
    }

    @Override
    public TransactionManager get()
    {
        return tm;
    }

    /**
     * Another transaction manager on the same database, sharing the in-process locks
     * as two managers in one process do.
     */
    public TransactionManager newTransactionManager()
    {
        return new ThreadLocalTransactionManager(dsp.get(), config, createConfigMapper(), localLocks);
    }

    public Jdbi getJdbi()
    {
        return DatabaseHelper.createJdbi(dsp.get(), createConfigMapper());
    }

    public DatabaseConfig getConfig()
    {
        return config;
    }

    public LocalLockMap getLocalLocks()
    {
        return localLocks;
    }

    public <T> T begin(TransactionManager.SupplierInTransaction<T, Exception, RuntimeException> func)
            throws Exception
    {
        return tm.begin(func, Exception.class);
    }

    public void begin(ThrowableRunnable func)
            throws Exception
    {
        begin(() -> {
            func.run();
            return null;
        });
    }

    @FunctionalInterface
    public interface ThrowableRunnable
    {
        void run() throws Exception;
    }

    public DatabaseRowMutator getRowMutator()
    {
        return getRowMutator(tm);
    }

    public DatabaseRowMutator getRowMutator(TransactionManager tm)
    {
        return new DatabaseRowMutator(tm, config);
    }

    public ScheduledJobStoreManager getScheduledJobStoreManager()
    {
        return getScheduledJobStoreManager(tm);
    }

    public ScheduledJobStoreManager getScheduledJobStoreManager(TransactionManager tm)
    {
        return new DatabaseScheduledJobStoreManager(tm, createConfigMapper(), config, getRowMutator(tm));
    }

    public DelayedCallStoreManager getDelayedCallStoreManager()
    {
        return new DatabaseDelayedCallStoreManager(tm, createConfigMapper(), config, getRowMutator());
    }

    public NamedLockManager getNamedLockManager()
    {
        return getNamedLockManager(tm);
    }

    public NamedLockManager getNamedLockManager(TransactionManager tm)
    {
        return new DatabaseNamedLockStoreManager(tm, createConfigMapper(), config);
    }

    @Override
    public void close()
    {
        try {
            dsp.close();
        }
        catch (Exception ex) {
            throw ThrowablesUtil.propagate(ex);
        }
    }
}
