package io.notebookhive.bus;

/**
 * Raised when a message could not be handed to the broker after all publish attempts.
 */
public class BusPublishException extends RuntimeException {

    private final String subject;
    private final int attempts;

    public BusPublishException(String subject, int attempts, Throwable cause) {
        super("Failed to publish to '" + subject + "' after " + attempts + " attempt(s)"
            + (cause != null && cause.getMessage() != null ? ": " + cause.getMessage() : ""), cause);
        this.subject = subject;
        this.attempts = attempts;
    }

    public String subject() {
        return subject;
    }

    public int attempts() {
        return attempts;
    }
}
