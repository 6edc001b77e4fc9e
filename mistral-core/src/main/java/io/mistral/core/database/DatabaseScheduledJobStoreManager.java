package io.mistral.core.database;

import com.google.common.base.Optional;
import com.google.inject.Inject;
import io.mistral.commons.config.Config;
import io.mistral.core.scheduler.ImmutableStoredScheduledJob;
import io.mistral.core.scheduler.JobFilter;
import io.mistral.core.scheduler.ScheduledJob;
import io.mistral.core.scheduler.ScheduledJobStoreManager;
import io.mistral.core.scheduler.StoredScheduledJob;
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
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

public class DatabaseScheduledJobStoreManager
        extends BasicDatabaseStoreManager<DatabaseScheduledJobStoreManager.Dao>
        implements ScheduledJobStoreManager
{
    static final String TABLE = "scheduled_jobs";

    private final DatabaseRowMutator rowMutator;
    private final StoredScheduledJobMapper mapper;

    @Inject
    public DatabaseScheduledJobStoreManager(TransactionManager transactionManager, ConfigMapper configMapper,
            DatabaseConfig config, DatabaseRowMutator rowMutator)
    {
        super(config.getType(), Dao.class, transactionManager, configMapper);
        this.rowMutator = rowMutator;
        this.mapper = new StoredScheduledJobMapper(configMapper);
    }

    @Override
    public StoredScheduledJob createScheduledJob(ScheduledJob job)
    {
        String id = UUID.randomUUID().toString();
        Instant now = Instant.now().truncatedTo(ChronoUnit.MILLIS);
        autoCommit((handle, dao) ->
                dao.insertScheduledJob(id,
                    job.getRunAfter(),
                    job.getTargetFactoryFuncName().orNull(),
                    job.getFuncName(),
                    job.getFuncArgs(),
                    job.getFuncArgSerializers(),
                    job.getAuthContext(),
                    toTimestamp(job.getExecuteAt()),
                    toTimestamp(job.getCapturedAt().orNull()),
                    job.getKey().orNull(),
                    toTimestamp(now)));
        return ImmutableStoredScheduledJob.builder()
            .from(job)
            .id(id)
            .createdAt(now)
            .build();
    }

    @Override
    public List<StoredScheduledJob> getScheduledJobs()
    {
        return autoCommit((handle, dao) -> dao.getScheduledJobs());
    }

    @Override
    public Optional<StoredScheduledJob> getScheduledJobById(String id)
    {
        return Optional.fromNullable(autoCommit((handle, dao) -> dao.getScheduledJobByIdInternal(id)));
    }

    @Override
    public List<StoredScheduledJob> getScheduledJobsToStart(Instant executeBefore, Instant capturedBefore, int limit)
    {
        return autoCommit((handle, dao) ->
                dao.findScheduledJobsToStart(toTimestamp(executeBefore), toTimestamp(capturedBefore), limit));
    }

    @Override
    public UpdateResult<StoredScheduledJob> updateCapturedAt(String id, Optional<Instant> previous, Instant capturedAt)
    {
        Map<String, Object> specimen = Collections.singletonMap("captured_at", toTimestamp(previous.orNull()));
        Map<String, Object> values = new LinkedHashMap<>();
        values.put("captured_at", toTimestamp(capturedAt));
        values.put("updated_at", toTimestamp(capturedAt));
        return rowMutator.updateOnMatch(TABLE, id, specimen, values, mapper);
    }

    @Override
    public long countScheduledJobs(JobFilter filter)
    {
        StringBuilder sql = new StringBuilder("select count(*) from scheduled_jobs where 1 = 1");
        if (filter.isKeyFiltered()) {
            if (filter.getKey().isPresent()) {
                sql.append(" and job_key = :key");
            }
            else {
                sql.append(" and job_key is null");
            }
        }
        if (filter.getProcessing().isPresent()) {
            if (filter.getProcessing().get()) {
                sql.append(" and captured_at is not null");
            }
            else {
                sql.append(" and captured_at is null");
            }
        }
        return autoCommit((handle, dao) -> {
            Query query = handle.createQuery(sql.toString());
            if (filter.isKeyFiltered() && filter.getKey().isPresent()) {
                query.bind("key", filter.getKey().get());
            }
            return query.mapTo(Long.class).one();
        });
    }

    @Override
    public boolean deleteScheduledJob(String id)
    {
        return autoCommit((handle, dao) -> dao.deleteScheduledJob(id)) > 0;
    }

    public interface Dao
    {
        @SqlQuery("select * from scheduled_jobs" +
                " order by execute_at, id")
        List<StoredScheduledJob> getScheduledJobs();

        @SqlQuery("select * from scheduled_jobs" +
                " where id = :id")
        StoredScheduledJob getScheduledJobByIdInternal(@Bind("id") String id);

        @SqlQuery("select * from scheduled_jobs" +
                " where execute_at <= :executeBefore" +
                " and (captured_at is null or captured_at <= :capturedBefore)" +
                " order by execute_at, id" +
                " limit :limit")
        List<StoredScheduledJob> findScheduledJobsToStart(
                @Bind("executeBefore") Timestamp executeBefore,
                @Bind("capturedBefore") Timestamp capturedBefore,
                @Bind("limit") int limit);

        @SqlUpdate("insert into scheduled_jobs" +
                " (id, run_after, target_factory_func_name, func_name, func_args, func_arg_serializers," +
                " auth_ctx, execute_at, captured_at, job_key, created_at)" +
                " values (:id, :runAfter, :targetFactoryFuncName, :funcName, :funcArgs, :funcArgSerializers," +
                " :authCtx, :executeAt, :capturedAt, :key, :createdAt)")
        int insertScheduledJob(
                @Bind("id") String id,
                @Bind("runAfter") long runAfter,
                @Bind("targetFactoryFuncName") String targetFactoryFuncName,
                @Bind("funcName") String funcName,
                @Bind("funcArgs") Config funcArgs,
                @Bind("funcArgSerializers") Config funcArgSerializers,
                @Bind("authCtx") Config authCtx,
                @Bind("executeAt") Timestamp executeAt,
                @Bind("capturedAt") Timestamp capturedAt,
                @Bind("key") String key,
                @Bind("createdAt") Timestamp createdAt);

        @SqlUpdate("delete from scheduled_jobs" +
                " where id = :id")
        int deleteScheduledJob(@Bind("id") String id);
    }

    static class StoredScheduledJobMapper
            implements RowMapper<StoredScheduledJob>
    {
        private final ConfigMapper cfm;

        StoredScheduledJobMapper(ConfigMapper cfm)
        {
            this.cfm = cfm;
        }

        @Override
        public StoredScheduledJob map(ResultSet r, StatementContext ctx)
                throws SQLException
        {
            return ImmutableStoredScheduledJob.builder()
                .id(r.getString("id"))
                .runAfter(r.getLong("run_after"))
                .targetFactoryFuncName(getOptionalString(r, "target_factory_func_name"))
                .funcName(r.getString("func_name"))
                .funcArgs(cfm.fromResultSetOrEmpty(r, "func_args"))
                .funcArgSerializers(cfm.fromResultSetOrEmpty(r, "func_arg_serializers"))
                .authContext(cfm.fromResultSetOrEmpty(r, "auth_ctx"))
                .executeAt(getTimestampInstant(r, "execute_at"))
                .capturedAt(getOptionalTimestampInstant(r, "captured_at"))
                .key(getOptionalString(r, "job_key"))
                .createdAt(getTimestampInstant(r, "created_at"))
                .updatedAt(getOptionalTimestampInstant(r, "updated_at"))
                .build();
        }
    }
}
