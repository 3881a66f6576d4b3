package io.notebookhive.bus;

/**
 * A message body that cannot be decoded into the expected wire type. Consumers log and discard such
 * messages.
 */
public class MalformedMessageException extends RuntimeException {

    public MalformedMessageException(String message, Throwable cause) {
        super(message, cause);
    }
}
