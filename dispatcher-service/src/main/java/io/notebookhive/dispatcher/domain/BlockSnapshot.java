package io.notebookhive.dispatcher.domain;

/**
 * Final state of one block of a terminal job.
 *
 * @param attempts number of requests published for the block
 */
public record BlockSnapshot(DiagramBlock block,
                            boolean succeeded,
                            byte[] artifact,
                            String mimeType,
                            String failureReason,
                            int attempts) {
}
