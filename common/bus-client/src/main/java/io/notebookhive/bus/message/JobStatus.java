package io.notebookhive.bus.message;

/**
 * Lifecycle of a notebook job. {@link #COMPLETED}, {@link #PARTIALLY_FAILED} and {@link #FAILED}
 * are terminal.
 */
public enum JobStatus {
    PENDING,
    IN_FLIGHT,
    PARTIALLY_FAILED,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == PARTIALLY_FAILED || this == FAILED;
    }
}
