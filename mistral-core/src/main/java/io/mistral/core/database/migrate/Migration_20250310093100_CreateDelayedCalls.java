package io.mistral.core.database.migrate;

import org.jdbi.v3.core.Handle;

public class Migration_20250310093100_CreateDelayedCalls
        implements Migration
{
    @Override
    public void migrate(Handle handle, MigrationContext context)
    {
        handle.execute(
                context.newCreateTableBuilder("delayed_calls")
                .addUuidId("id")
                .addString("factory_method_path", "")
                .addString("target_method_name", "not null")
                .addLongText("method_arguments", "")
                .addLongText("serializers", "")
                .addLongText("auth_context", "")
                .addTimestamp("execution_time", "not null")
                .addBoolean("processing", "not null default false")
                .addString("call_key", "")
                .addTimestamp("created_at", "not null")
                .addTimestamp("updated_at", "not null")
                .build());
        handle.execute("create index delayed_calls_on_processing_execution_time on delayed_calls (processing, execution_time)");
        handle.execute("create index delayed_calls_on_call_key on delayed_calls (call_key)");
    }
}
