package io.mistral.core.database;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;

import com.google.common.base.Optional;
import io.mistral.core.ResourceNotFoundException;
import org.jdbi.v3.core.Handle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public abstract class BasicDatabaseStoreManager <D>
{
    protected final Logger logger = LoggerFactory.getLogger(getClass());

    protected final String databaseType;
    private final Class<? extends D> daoIface;
    protected final TransactionManager transactionManager;
    protected final ConfigMapper configMapper;

    protected BasicDatabaseStoreManager(
            String databaseType,
            Class<? extends D> daoIface,
            TransactionManager transactionManager,
            ConfigMapper configMapper)
    {
        this.databaseType = databaseType;
        this.daoIface = daoIface;
        this.transactionManager = transactionManager;
        this.configMapper = configMapper;
    }

    public <T> T requiredResource(T resource, String messageFormat, Object... messageParameters)
            throws ResourceNotFoundException
    {
        if (resource == null) {
            throw new ResourceNotFoundException("Resource does not exist: " + String.format(messageFormat, messageParameters));
        }
        return resource;
    }

    public interface AutoCommitAction <T, D>
    {
        T call(Handle handle, D dao);
    }

    public interface TransactionAction <T, D>
    {
        T call(Handle handle, D dao);
    }

    /**
     * Runs the action in the current transaction.
     *
     * @throws IllegalStateException if the calling thread has no transaction
     */
    public <T> T transaction(TransactionAction<T, D> action)
    {
        Handle handle = transactionManager.getHandle();
        return action.call(handle, handle.attach(daoIface));
    }

    /**
     * Runs the action in the current transaction, or in a temporary auto-commit
     * session if the calling thread has none.
     */
    public <T> T autoCommit(AutoCommitAction<T, D> action)
    {
        return transactionManager.autoCommit(() -> {
            Handle handle = transactionManager.getHandle();
            return action.call(handle, handle.attach(daoIface));
        });
    }

    public static Instant getTimestampInstant(ResultSet r, String column)
            throws SQLException
    {
        return r.getTimestamp(column).toInstant();
    }

    public static Optional<Instant> getOptionalTimestampInstant(ResultSet r, String column)
            throws SQLException
    {
        Timestamp t = r.getTimestamp(column);
        if (r.wasNull()) {
            return Optional.absent();
        }
        else {
            return Optional.of(t.toInstant());
        }
    }

    public static Optional<String> getOptionalString(ResultSet r, String column)
            throws SQLException
    {
        String v = r.getString(column);
        return optional(r.wasNull(), v);
    }

    public static Timestamp toTimestamp(Instant instant)
    {
        return instant == null ? null : Timestamp.from(instant);
    }

    private static <T> Optional<T> optional(boolean wasNull, T v)
    {
        if (wasNull) {
            return Optional.absent();
        }
        else {
            return Optional.of(v);
        }
    }
}
