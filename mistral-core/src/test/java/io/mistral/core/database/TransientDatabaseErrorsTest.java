package io.mistral.core.database;

import org.junit.Test;

import java.sql.SQLException;
import java.sql.SQLTransientConnectionException;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;

public class TransientDatabaseErrorsTest
{
    @Test
    public void deadlockAndSerializationFailuresAreTransient()
    {
        assertThat(TransientDatabaseErrors.isTransient(new SQLException("deadlock detected", "40P01")), is(true));
        assertThat(TransientDatabaseErrors.isTransient(new SQLException("could not serialize access", "40001")), is(true));
    }

    @Test
    public void connectionErrorsAreTransient()
    {
        assertThat(TransientDatabaseErrors.isTransient(new SQLException("connection failure", "08006")), is(true));
        assertThat(TransientDatabaseErrors.isTransient(new SQLTransientConnectionException("timeout")), is(true));
    }

    @Test
    public void causeIsInspected()
    {
        RuntimeException wrapped = new RuntimeException(new SQLException("deadlock", "40P01"));
        assertThat(TransientDatabaseErrors.isTransient(wrapped), is(true));
    }

    @Test
    public void constraintViolationIsNotTransient()
    {
        assertThat(TransientDatabaseErrors.isTransient(new SQLException("duplicate key", "23505")), is(false));
        assertThat(TransientDatabaseErrors.isTransient(new SQLException("no state")), is(false));
        assertThat(TransientDatabaseErrors.isTransient(new IllegalStateException()), is(false));
    }

    @Test
    public void nonTransientErrorIsNotRetried()
    {
        int[] attempts = new int[1];
        try {
            DatabaseRetry.run(() -> {
                attempts[0]++;
                throw new IllegalArgumentException("bad");
            });
        }
        catch (IllegalArgumentException ex) {
            // expected
        }
        assertThat(attempts[0], is(1));
    }

    @Test
    public void transientErrorIsRetried()
    {
        int[] attempts = new int[1];
        String result = DatabaseRetry.run(() -> {
            attempts[0]++;
            if (attempts[0] < 3) {
                throw new RuntimeException(new SQLException("deadlock", "40P01"));
            }
            return "ok";
        });
        assertThat(result, is("ok"));
        assertThat(attempts[0], is(3));
    }
}
