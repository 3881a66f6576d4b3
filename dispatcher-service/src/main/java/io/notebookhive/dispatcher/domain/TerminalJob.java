package io.notebookhive.dispatcher.domain;

import io.notebookhive.bus.message.BlockFailure;
import io.notebookhive.bus.message.JobStatus;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Snapshot handed out exactly once, when a job leaves the tracker.
 *
 * @param error job level reason, set for transport failures and rejected notebooks
 */
public record TerminalJob(NotebookJob job,
                          JobStatus status,
                          List<BlockSnapshot> blocks,
                          String error,
                          Instant finishedAt) {

    public TerminalJob {
        Objects.requireNonNull(job, "job");
        Objects.requireNonNull(status, "status");
        if (!status.isTerminal()) {
            throw new IllegalArgumentException("status must be terminal but was " + status);
        }
        blocks = blocks == null ? List.of() : List.copyOf(blocks);
        Objects.requireNonNull(finishedAt, "finishedAt");
    }

    public List<BlockFailure> failures() {
        return blocks.stream()
            .filter(snapshot -> !snapshot.succeeded())
            .map(snapshot -> new BlockFailure(snapshot.block().blockIndex(), snapshot.block().correlationId(),
                snapshot.block().kind(), snapshot.attempts(), snapshot.failureReason()))
            .toList();
    }
}
