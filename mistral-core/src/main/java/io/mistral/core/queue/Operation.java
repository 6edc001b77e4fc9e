package io.mistral.core.queue;

/**
 * Work deferred until the transaction that registered it has finished.
 */
@FunctionalInterface
public interface Operation
{
    /**
     * @param queue queue of the drain that runs this operation. Operations
     *     registered to it run after the current batch.
     */
    void run(OperationQueue queue)
        throws Exception;
}
