package io.mistral.core.database;

import com.google.inject.Inject;
import io.mistral.core.lock.ImmutableStoredNamedLock;
import io.mistral.core.lock.NamedLockManager;
import io.mistral.core.lock.StoredNamedLock;
import org.jdbi.v3.core.mapper.RowMapper;
import org.jdbi.v3.core.statement.StatementContext;
import org.jdbi.v3.sqlobject.customizer.Bind;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.UUID;
import java.util.function.Supplier;

public class DatabaseNamedLockStoreManager
        extends BasicDatabaseStoreManager<DatabaseNamedLockStoreManager.Dao>
        implements NamedLockManager
{
    static final String TABLE = "named_locks";

    private final boolean rowLocks;

    @Inject
    public DatabaseNamedLockStoreManager(TransactionManager transactionManager, ConfigMapper configMapper,
            DatabaseConfig config)
    {
        super(config.getType(), Dao.class, transactionManager, configMapper);
        this.rowLocks = config.getRowLocks();
    }

    @Override
    public String createNamedLock(String name)
    {
        String id = UUID.randomUUID().toString();
        Timestamp now = toTimestamp(Instant.now().truncatedTo(ChronoUnit.MILLIS));
        transaction((handle, dao) -> {
            if (!rowLocks) {
                // H2 does not make a duplicate insert wait for the holder to finish
                transactionManager.lockLocally(TABLE + ":" + name);
            }
            return dao.insertNamedLock(id, name, now);
        });
        logger.trace("Created named lock {} id={}", name, id);
        return id;
    }

    @Override
    public boolean deleteNamedLock(String id)
    {
        return autoCommit((handle, dao) -> dao.deleteNamedLock(id)) > 0;
    }

    @Override
    public List<StoredNamedLock> getNamedLocks()
    {
        return autoCommit((handle, dao) -> dao.getNamedLocks());
    }

    @Override
    public <T> T namedLock(String name, Supplier<T> action)
    {
        String id = createNamedLock(name);
        T result = action.get();
        deleteNamedLock(id);
        return result;
    }

    @Override
    public int deleteNamedLocksCreatedBefore(Instant createdBefore)
    {
        return autoCommit((handle, dao) -> dao.deleteNamedLocksCreatedBefore(toTimestamp(createdBefore)));
    }

    public interface Dao
    {
        @SqlQuery("select * from named_locks" +
                " order by created_at, id")
        List<StoredNamedLock> getNamedLocks();

        @SqlUpdate("insert into named_locks" +
                " (id, name, created_at)" +
                " values (:id, :name, :createdAt)")
        int insertNamedLock(
                @Bind("id") String id,
                @Bind("name") String name,
                @Bind("createdAt") Timestamp createdAt);

        @SqlUpdate("delete from named_locks" +
                " where id = :id")
        int deleteNamedLock(@Bind("id") String id);

        @SqlUpdate("delete from named_locks" +
                " where created_at < :createdBefore")
        int deleteNamedLocksCreatedBefore(@Bind("createdBefore") Timestamp createdBefore);
    }

    static class StoredNamedLockMapper
            implements RowMapper<StoredNamedLock>
    {
        @Override
        public StoredNamedLock map(ResultSet r, StatementContext ctx)
                throws SQLException
        {
            return ImmutableStoredNamedLock.builder()
                .id(r.getString("id"))
                .name(r.getString("name"))
                .createdAt(getTimestampInstant(r, "created_at"))
                .build();
        }
    }
}
