package io.mistral.core.database;

import com.google.common.base.Throwables;
import org.jdbi.v3.core.ConnectionException;

import java.sql.SQLException;
import java.sql.SQLRecoverableException;
import java.sql.SQLTransientException;

/**
 * Tells errors worth retrying (deadlocks, serialization failures, lost connections)
 * from deterministic ones.
 */
public final class TransientDatabaseErrors
{
    private TransientDatabaseErrors()
    { }

    public static boolean isTransient(Throwable error)
    {
        for (Throwable t : Throwables.getCausalChain(error)) {
            if (t instanceof ConnectionException) {
                return true;
            }
            if (t instanceof SQLException && isTransientSQLException((SQLException) t)) {
                return true;
            }
        }
        return false;
    }

    static boolean isTransientSQLException(SQLException ex)
    {
        if (ex instanceof SQLTransientException || ex instanceof SQLRecoverableException) {
            return true;
        }
        String state = ex.getSQLState();
        if (state == null) {
            return false;
        }
        // 40: transaction rollback (deadlock, serialization failure)
        // 08: connection exception
        return state.startsWith("40") || state.startsWith("08");
    }
}
