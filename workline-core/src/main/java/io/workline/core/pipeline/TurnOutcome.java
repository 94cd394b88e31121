package io.workline.core.pipeline;

/**
 * What the caller-facing adapter needs after one turn: the prompt to speak and whether to keep
 * the line open. {@code NOT_FOUND} means the session expired or never existed; the adapter
 * should hang up rather than retry.
 */
public record TurnOutcome(Status status, String message, boolean continueCall, boolean fallback) {
    public enum Status {
        OK,
        NOT_FOUND,
        ALREADY_FINISHED
    }

    public TurnOutcome {
        message = message == null ? "" : message;
    }

    static TurnOutcome notFound() {
        return new TurnOutcome(Status.NOT_FOUND, "", false, false);
    }

    static TurnOutcome alreadyFinished() {
        return new TurnOutcome(Status.ALREADY_FINISHED, "", false, false);
    }
}
