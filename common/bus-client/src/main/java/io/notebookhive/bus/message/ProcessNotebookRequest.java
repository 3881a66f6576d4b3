package io.notebookhive.bus.message;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Submission of a notebook for diagram conversion.
 *
 * @param jobId optional; the dispatcher generates one when absent
 * @param notebook nbformat JSON document
 * @param notebookPath optional, only used for log context
 * @param replyTo optional subject overriding the default result subject
 * @param execute whether code cells are run through the kernel service after splicing
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ProcessNotebookRequest(String jobId,
                                     JsonNode notebook,
                                     String notebookPath,
                                     String replyTo,
                                     boolean execute) {

    public ProcessNotebookRequest {
        jobId = MessageSupport.textOrNull(jobId);
        notebookPath = MessageSupport.textOrNull(notebookPath);
        replyTo = MessageSupport.textOrNull(replyTo);
    }
}
