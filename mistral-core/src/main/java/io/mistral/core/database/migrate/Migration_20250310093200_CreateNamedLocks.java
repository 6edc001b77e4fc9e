package io.mistral.core.database.migrate;

import org.jdbi.v3.core.Handle;

public class Migration_20250310093200_CreateNamedLocks
        implements Migration
{
    @Override
    public void migrate(Handle handle, MigrationContext context)
    {
        handle.execute(
                context.newCreateTableBuilder("named_locks")
                .addUuidId("id")
                .addString("name", "not null")
                .addTimestamp("created_at", "not null")
                .build());
        // concurrent holders of the same name wait on this index until the first one's transaction ends
        handle.execute("create unique index named_locks_on_name on named_locks (name)");
    }
}
