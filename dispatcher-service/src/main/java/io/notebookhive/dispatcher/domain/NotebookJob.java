package io.notebookhive.dispatcher.domain;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Objects;

/**
 * A submitted notebook together with the options it was submitted with.
 */
public record NotebookJob(String id,
                          JsonNode notebook,
                          String notebookPath,
                          String replyTo,
                          boolean execute) {

    public NotebookJob {
        Objects.requireNonNull(id, "id");
    }

    /**
     * Label for log lines: the notebook path when known, else the job id.
     */
    public String label() {
        return notebookPath != null ? notebookPath : id;
    }
}
