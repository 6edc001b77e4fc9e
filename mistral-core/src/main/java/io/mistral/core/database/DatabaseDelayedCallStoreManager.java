package io.mistral.core.database;

import com.google.inject.Inject;
import io.mistral.commons.config.Config;
import io.mistral.core.ResourceNotFoundException;
import io.mistral.core.scheduler.JobFilter;
import io.mistral.core.scheduler.legacy.DelayedCall;
import io.mistral.core.scheduler.legacy.DelayedCallStoreManager;
import io.mistral.core.scheduler.legacy.ImmutableStoredDelayedCall;
import io.mistral.core.scheduler.legacy.StoredDelayedCall;
import org.jdbi.v3.core.mapper.RowMapper;
import org.jdbi.v3.core.statement.Query;
import org.jdbi.v3.core.statement.StatementContext;
import org.jdbi.v3.sqlobject.customizer.Bind;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

public class DatabaseDelayedCallStoreManager
        extends BasicDatabaseStoreManager<DatabaseDelayedCallStoreManager.Dao>
        implements DelayedCallStoreManager
{
    static final String TABLE = "delayed_calls";

    private final DatabaseRowMutator rowMutator;
    private final StoredDelayedCallMapper mapper;

    @Inject
    public DatabaseDelayedCallStoreManager(TransactionManager transactionManager, ConfigMapper configMapper,
            DatabaseConfig config, DatabaseRowMutator rowMutator)
    {
        super(config.getType(), Dao.class, transactionManager, configMapper);
        this.rowMutator = rowMutator;
        this.mapper = new StoredDelayedCallMapper(configMapper);
    }

    @Override
    public StoredDelayedCall createDelayedCall(DelayedCall call)
    {
        String id = UUID.randomUUID().toString();
        Instant now = Instant.now().truncatedTo(ChronoUnit.MILLIS);
        autoCommit((handle, dao) ->
                dao.insertDelayedCall(id,
                    call.getFactoryMethodPath().orNull(),
                    call.getTargetMethodName(),
                    call.getMethodArguments(),
                    call.getSerializers(),
                    call.getAuthContext(),
                    toTimestamp(call.getExecutionTime()),
                    call.getProcessing(),
                    call.getKey().orNull(),
                    toTimestamp(now)));
        return ImmutableStoredDelayedCall.builder()
            .from(call)
            .id(id)
            .createdAt(now)
            .updatedAt(now)
            .build();
    }

    @Override
    public List<StoredDelayedCall> getDelayedCalls()
    {
        return autoCommit((handle, dao) -> dao.getDelayedCalls());
    }

    @Override
    public StoredDelayedCall getDelayedCallById(String id)
        throws ResourceNotFoundException
    {
        return requiredResource(
                autoCommit((handle, dao) -> dao.getDelayedCallByIdInternal(id)),
                "delayed call id=%s", id);
    }

    @Override
    public List<StoredDelayedCall> getDelayedCallsToStart(Instant executeBefore, int limit)
    {
        return autoCommit((handle, dao) -> dao.findDelayedCallsToStart(toTimestamp(executeBefore), limit));
    }

    @Override
    public UpdateResult<StoredDelayedCall> captureDelayedCall(String id, Instant capturedAt)
    {
        Map<String, Object> specimen = new LinkedHashMap<>();
        specimen.put("processing", false);
        Map<String, Object> values = new LinkedHashMap<>();
        values.put("processing", true);
        values.put("updated_at", toTimestamp(capturedAt));
        return rowMutator.updateOnMatch(TABLE, id, specimen, values, mapper);
    }

    @Override
    public long countDelayedCalls(JobFilter filter)
    {
        StringBuilder sql = new StringBuilder("select count(*) from delayed_calls where 1 = 1");
        if (filter.isKeyFiltered()) {
            if (filter.getKey().isPresent()) {
                sql.append(" and call_key = :key");
            }
            else {
                sql.append(" and call_key is null");
            }
        }
        if (filter.getProcessing().isPresent()) {
            sql.append(" and processing = :processing");
        }
        return autoCommit((handle, dao) -> {
            Query query = handle.createQuery(sql.toString());
            if (filter.isKeyFiltered() && filter.getKey().isPresent()) {
                query.bind("key", filter.getKey().get());
            }
            if (filter.getProcessing().isPresent()) {
                query.bind("processing", (boolean) filter.getProcessing().get());
            }
            return query.mapTo(Long.class).one();
        });
    }

    @Override
    public boolean deleteDelayedCall(String id)
    {
        return autoCommit((handle, dao) -> dao.deleteDelayedCall(id)) > 0;
    }

    @Override
    public int resetProcessingCalls(Instant updatedBefore)
    {
        Timestamp now = toTimestamp(Instant.now().truncatedTo(ChronoUnit.MILLIS));
        return autoCommit((handle, dao) -> dao.resetProcessingCalls(toTimestamp(updatedBefore), now));
    }

    public interface Dao
    {
        @SqlQuery("select * from delayed_calls" +
                " order by execution_time, id")
        List<StoredDelayedCall> getDelayedCalls();

        @SqlQuery("select * from delayed_calls" +
                " where id = :id")
        StoredDelayedCall getDelayedCallByIdInternal(@Bind("id") String id);

        @SqlQuery("select * from delayed_calls" +
                " where processing = false" +
                " and execution_time <= :executeBefore" +
                " order by execution_time, id" +
                " limit :limit")
        List<StoredDelayedCall> findDelayedCallsToStart(
                @Bind("executeBefore") Timestamp executeBefore,
                @Bind("limit") int limit);

        @SqlUpdate("insert into delayed_calls" +
                " (id, factory_method_path, target_method_name, method_arguments, serializers," +
                " auth_context, execution_time, processing, call_key, created_at, updated_at)" +
                " values (:id, :factoryMethodPath, :targetMethodName, :methodArguments, :serializers," +
                " :authContext, :executionTime, :processing, :key, :now, :now)")
        int insertDelayedCall(
                @Bind("id") String id,
                @Bind("factoryMethodPath") String factoryMethodPath,
                @Bind("targetMethodName") String targetMethodName,
                @Bind("methodArguments") Config methodArguments,
                @Bind("serializers") Config serializers,
                @Bind("authContext") Config authContext,
                @Bind("executionTime") Timestamp executionTime,
                @Bind("processing") boolean processing,
                @Bind("key") String key,
                @Bind("now") Timestamp now);

        @SqlUpdate("delete from delayed_calls" +
                " where id = :id")
        int deleteDelayedCall(@Bind("id") String id);

        @SqlUpdate("update delayed_calls" +
                " set processing = false, updated_at = :now" +
                " where processing = true" +
                " and updated_at < :updatedBefore")
        int resetProcessingCalls(
                @Bind("updatedBefore") Timestamp updatedBefore,
                @Bind("now") Timestamp now);
    }

    static class StoredDelayedCallMapper
            implements RowMapper<StoredDelayedCall>
    {
        private final ConfigMapper cfm;

        StoredDelayedCallMapper(ConfigMapper cfm)
        {
            this.cfm = cfm;
        }

        @Override
        public StoredDelayedCall map(ResultSet r, StatementContext ctx)
                throws SQLException
        {
            return ImmutableStoredDelayedCall.builder()
                .id(r.getString("id"))
                .factoryMethodPath(getOptionalString(r, "factory_method_path"))
                .targetMethodName(r.getString("target_method_name"))
                .methodArguments(cfm.fromResultSetOrEmpty(r, "method_arguments"))
                .serializers(cfm.fromResultSetOrEmpty(r, "serializers"))
                .authContext(cfm.fromResultSetOrEmpty(r, "auth_context"))
                .executionTime(getTimestampInstant(r, "execution_time"))
                .processing(r.getBoolean("processing"))
                .key(getOptionalString(r, "call_key"))
                .createdAt(getTimestampInstant(r, "created_at"))
                .updatedAt(getTimestampInstant(r, "updated_at"))
                .build();
        }
    }
}
