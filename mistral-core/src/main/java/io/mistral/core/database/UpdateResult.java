package io.mistral.core.database;

import com.google.common.base.Optional;

/**
 * Outcome of {@link DatabaseRowMutator#updateOnMatch}: the number of updated rows
 * and, if exactly one row was updated, its new state.
 */
public final class UpdateResult <T>
{
    private final Optional<T> row;
    private final int updatedCount;

    private UpdateResult(Optional<T> row, int updatedCount)
    {
        this.row = row;
        this.updatedCount = updatedCount;
    }

    public static <T> UpdateResult<T> of(Optional<T> row, int updatedCount)
    {
        return new UpdateResult<>(row, updatedCount);
    }

    public Optional<T> getRow()
    {
        return row;
    }

    public int getUpdatedCount()
    {
        return updatedCount;
    }

    public boolean isUpdated()
    {
        return updatedCount > 0;
    }

    @Override
    public String toString()
    {
        return "UpdateResult{row=" + row + ", updatedCount=" + updatedCount + "}";
    }
}
