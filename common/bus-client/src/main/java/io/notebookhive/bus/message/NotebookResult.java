package io.notebookhive.bus.message;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Terminal event of a notebook job. Exactly one is published per job id.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record NotebookResult(String jobId,
                             JobStatus status,
                             JsonNode notebook,
                             List<BlockFailure> failures,
                             String error,
                             String kernelError,
                             Instant finishedAt) {

    public NotebookResult {
        jobId = MessageSupport.requireText(jobId, "jobId");
        status = Objects.requireNonNull(status, "status");
        if (!status.isTerminal()) {
            throw new IllegalArgumentException("result status must be terminal but was " + status);
        }
        failures = failures == null ? List.of() : List.copyOf(failures);
        finishedAt = Objects.requireNonNull(finishedAt, "finishedAt");
    }
}
