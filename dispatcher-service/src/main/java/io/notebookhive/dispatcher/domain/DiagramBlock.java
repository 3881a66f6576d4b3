package io.notebookhive.dispatcher.domain;

import io.notebookhive.topology.DiagramKind;
import java.util.Objects;

/**
 * One diagram found in a notebook. {@code blockIndex} is the position of the source cell.
 */
public record DiagramBlock(String jobId,
                           int blockIndex,
                           DiagramKind kind,
                           String source,
                           String correlationId) {

    public DiagramBlock {
        Objects.requireNonNull(jobId, "jobId");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(correlationId, "correlationId");
        if (blockIndex < 0) {
            throw new IllegalArgumentException("blockIndex must not be negative");
        }
    }
}
