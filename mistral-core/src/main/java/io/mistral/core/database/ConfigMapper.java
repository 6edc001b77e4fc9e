package io.mistral.core.database;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import com.google.inject.Inject;
import io.mistral.commons.config.Config;
import io.mistral.commons.config.ConfigFactory;
import org.jdbi.v3.core.argument.AbstractArgumentFactory;
import org.jdbi.v3.core.argument.Argument;
import org.jdbi.v3.core.config.ConfigRegistry;
import org.jdbi.v3.core.statement.StatementContext;

/**
 * Maps {@link Config} values to the JSON text columns of scheduled_jobs and
 * delayed_calls (arguments, serializer keys, auth context).
 *
 * An empty object is stored as NULL and NULL reads back as an empty object.
 */
public class ConfigMapper
{
    private final ConfigFactory cf;

    @Inject
    public ConfigMapper(ConfigFactory cf)
    {
        this.cf = cf;
    }

    public AbstractArgumentFactory<Config> getArgumentFactory()
    {
        return new AbstractArgumentFactory<Config>(Types.CLOB)
        {
            @Override
            protected Argument build(Config value, ConfigRegistry registry)
            {
                String json = value.isEmpty() ? null : value.toString();
                return (int position, PreparedStatement statement, StatementContext ctx) -> {
                    if (json == null) {
                        statement.setNull(position, Types.CLOB);
                    }
                    else {
                        statement.setString(position, json);
                    }
                };
            }
        };
    }

    public Config fromResultSetOrEmpty(ResultSet rs, String column)
            throws SQLException
    {
        String json = rs.getString(column);
        if (rs.wasNull()) {
            return cf.create();
        }
        return cf.fromJsonString(json);
    }
}
