package io.mistral.core.database;

import com.google.common.base.Optional;
import com.google.inject.Inject;
import io.mistral.core.ResourceNotFoundException;
import org.jdbi.v3.core.Handle;
import org.jdbi.v3.core.mapper.RowMapper;
import org.jdbi.v3.core.statement.Update;

import java.util.Map;
import java.util.regex.Pattern;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Locale.ENGLISH;

/**
 * Row-level concurrency primitives shared by the store managers.
 *
 * {@link #updateOnMatch} is a compare-and-swap on a single row: it updates the row only if
 * the columns named by the specimen still hold the expected values. Concurrent callers racing
 * on the same row can't both succeed, so the one that gets a count of 1 owns the row.
 */
public class DatabaseRowMutator
{
    private static final Pattern IDENTIFIER = Pattern.compile("[a-z_][a-z0-9_]*");

    private final TransactionManager tm;
    private final boolean rowLocks;

    @Inject
    public DatabaseRowMutator(TransactionManager tm, DatabaseConfig config)
    {
        this(tm, config.getRowLocks());
    }

    DatabaseRowMutator(TransactionManager tm, boolean rowLocks)
    {
        this.tm = tm;
        this.rowLocks = rowLocks;
    }

    /**
     * Updates the row identified by id to the given values if, and only if, every column
     * in specimen currently holds the specimen's value. A null specimen value matches NULL.
     *
     * Joins the current transaction, or runs in auto-commit mode if there is none.
     * Zero updated rows is a normal outcome.
     */
    public <T> UpdateResult<T> updateOnMatch(String table, String id,
            Map<String, Object> specimen, Map<String, Object> values, RowMapper<T> mapper)
    {
        checkArgument(!values.isEmpty(), "values must not be empty");
        checkIdentifier(table);

        StringBuilder sql = new StringBuilder();
        sql.append("update ").append(table).append(" set ");
        boolean first = true;
        for (String column : values.keySet()) {
            checkIdentifier(column);
            if (!first) {
                sql.append(", ");
            }
            sql.append(column).append(" = :v_").append(column);
            first = false;
        }
        sql.append(" where id = :id");
        for (Map.Entry<String, Object> pair : specimen.entrySet()) {
            checkIdentifier(pair.getKey());
            if (pair.getValue() == null) {
                sql.append(" and ").append(pair.getKey()).append(" is null");
            }
            else {
                sql.append(" and ").append(pair.getKey()).append(" = :s_").append(pair.getKey());
            }
        }

        return tm.autoCommit(() -> {
            lockLocally(table, id);

            Handle handle = tm.getHandle();
            Update update = handle.createUpdate(sql.toString()).bind("id", id);
            for (Map.Entry<String, Object> pair : values.entrySet()) {
                update.bind("v_" + pair.getKey(), pair.getValue());
            }
            for (Map.Entry<String, Object> pair : specimen.entrySet()) {
                if (pair.getValue() != null) {
                    update.bind("s_" + pair.getKey(), pair.getValue());
                }
            }

            int count = update.execute();
            if (count != 1) {
                return UpdateResult.<T>of(Optional.absent(), count);
            }

            T row = handle.createQuery("select * from " + table + " where id = :id")
                .bind("id", id)
                .map(mapper)
                .one();
            return UpdateResult.of(Optional.of(row), count);
        });
    }

    /**
     * Locks the row for the rest of the current transaction.
     *
     * @throws ResourceNotFoundException if the row doesn't exist
     * @throws IllegalStateException if the calling thread has no transaction
     */
    public void acquireLock(String table, String id)
            throws ResourceNotFoundException
    {
        checkIdentifier(table);
        if (!tm.isInTransaction()) {
            throw new IllegalStateException("Not in transaction");
        }

        lockLocally(table, id);

        String sql = "select id from " + table + " where id = :id";
        if (rowLocks) {
            sql += " for update";
        }
        java.util.Optional<String> found = tm.getHandle().createQuery(sql)
            .bind("id", id)
            .mapTo(String.class)
            .findOne();
        if (!found.isPresent()) {
            throw new ResourceNotFoundException(String.format(ENGLISH, "Resource does not exist: %s id=%s", table, id));
        }
    }

    private void lockLocally(String table, String id)
    {
        if (!rowLocks) {
            tm.lockLocally(table + ":" + id);
        }
    }

    private static void checkIdentifier(String name)
    {
        checkArgument(IDENTIFIER.matcher(name).matches(), "Invalid identifier: %s", name);
    }
}
