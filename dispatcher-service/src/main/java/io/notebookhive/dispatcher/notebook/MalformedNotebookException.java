package io.notebookhive.dispatcher.notebook;

/**
 * The submitted document is not a notebook this service can read.
 */
public class MalformedNotebookException extends RuntimeException {

    public MalformedNotebookException(String message) {
        super(message);
    }
}
