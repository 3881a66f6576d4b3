package io.notebookhive.dispatcher.domain;

/**
 * Answer of {@link JobTracker#register}. A job without diagram blocks is terminal right away and
 * carries its snapshot in {@code completed}.
 */
public record Registration(boolean accepted, TerminalJob completed) {

    private static final Registration ACCEPTED = new Registration(true, null);
    private static final Registration DUPLICATE = new Registration(false, null);

    public static Registration acceptedJob() {
        return ACCEPTED;
    }

    public static Registration duplicate() {
        return DUPLICATE;
    }

    public static Registration completed(TerminalJob terminal) {
        return new Registration(true, terminal);
    }

    public boolean duplicateJob() {
        return !accepted;
    }
}
