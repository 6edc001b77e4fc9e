package io.mistral.core.database.migrate;

import org.jdbi.v3.core.Handle;

public class Migration_20250310093000_CreateScheduledJobs
        implements Migration
{
    @Override
    public void migrate(Handle handle, MigrationContext context)
    {
        handle.execute(
                context.newCreateTableBuilder("scheduled_jobs")
                .addUuidId("id")
                .addInt("run_after", "not null")
                .addString("target_factory_func_name", "")
                .addString("func_name", "not null")
                .addLongText("func_args", "")
                .addLongText("func_arg_serializers", "")
                .addLongText("auth_ctx", "")
                .addTimestamp("execute_at", "not null")
                .addTimestamp("captured_at", "")
                .addString("job_key", "")
                .addTimestamp("created_at", "not null")
                .addTimestamp("updated_at", "")
                .build());
        handle.execute("create index scheduled_jobs_on_execute_at on scheduled_jobs (execute_at)");
        handle.execute("create index scheduled_jobs_on_captured_at on scheduled_jobs (captured_at)");
        handle.execute("create index scheduled_jobs_on_job_key on scheduled_jobs (job_key)");
    }
}
