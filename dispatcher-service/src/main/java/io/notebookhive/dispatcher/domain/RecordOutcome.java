package io.notebookhive.dispatcher.domain;

/**
 * Result of feeding one converter response into the {@link JobTracker}.
 */
public record RecordOutcome(Type type, DiagramBlock block, int nextAttempt, TerminalJob terminal) {

    public enum Type {
        /** correlation id is not tracked (late response, or the job already finished) */
        UNKNOWN,
        /** duplicate or stale response; state unchanged */
        IGNORED,
        RECORDED,
        /** the block must be re-published with {@code nextAttempt} */
        RETRY,
        /** the owning job just became terminal */
        TERMINAL
    }

    private static final RecordOutcome UNKNOWN = new RecordOutcome(Type.UNKNOWN, null, 0, null);
    private static final RecordOutcome IGNORED = new RecordOutcome(Type.IGNORED, null, 0, null);
    private static final RecordOutcome RECORDED = new RecordOutcome(Type.RECORDED, null, 0, null);

    public static RecordOutcome unknown() {
        return UNKNOWN;
    }

    public static RecordOutcome ignored() {
        return IGNORED;
    }

    public static RecordOutcome recorded() {
        return RECORDED;
    }

    public static RecordOutcome retry(DiagramBlock block, int nextAttempt) {
        return new RecordOutcome(Type.RETRY, block, nextAttempt, null);
    }

    public static RecordOutcome terminal(TerminalJob terminal) {
        return new RecordOutcome(Type.TERMINAL, null, 0, terminal);
    }
}
