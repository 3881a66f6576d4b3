package io.notebookhive.dispatcher.app;

public class CellExecutionException extends Exception {

    public CellExecutionException(String message) {
        super(message);
    }

    public CellExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
