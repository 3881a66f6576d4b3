package io.notebookhive.dispatcher.app;

import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Runs the code cells of a notebook and writes their outputs back into it.
 */
public interface CellExecutor {

    /**
     * @return {@code false} when no kernel is configured and {@link #execute} would do nothing
     */
    boolean enabled();

    /**
     * Executes every code cell of {@code notebook} in order, in place.
     *
     * @throws CellExecutionException when the kernel cannot be reached or a cell fails
     */
    void execute(String jobId, ObjectNode notebook) throws CellExecutionException;
}
