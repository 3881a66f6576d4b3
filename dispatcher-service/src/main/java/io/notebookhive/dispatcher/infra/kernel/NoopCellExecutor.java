package io.notebookhive.dispatcher.infra.kernel;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.notebookhive.dispatcher.app.CellExecutor;

/**
 * Used while no kernel base URL is configured.
 */
public class NoopCellExecutor implements CellExecutor {

    @Override
    public boolean enabled() {
        return false;
    }

    @Override
    public void execute(String jobId, ObjectNode notebook) {
        // no kernel configured
    }
}
