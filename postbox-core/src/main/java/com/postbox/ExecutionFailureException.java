package com.postbox;

/**
 * Signals that the task hosting an actor body could not run to completion: it was aborted,
 * interrupted, rejected by the executor, or died with an {@link Error}.
 * This is never used for failures reported by the body itself; those arrive as
 * {@link Result.Failure}.
 */
public class ExecutionFailureException extends Exception {

    private final String actorName;

    public ExecutionFailureException(String message, String actorName) {
        super(message);
        this.actorName = actorName;
    }

    public ExecutionFailureException(String message, String actorName, Throwable cause) {
        super(message, cause);
        this.actorName = actorName;
    }

    /**
     * @return the name of the actor whose task failed, or null if unknown
     */
    public String getActorName() {
        return actorName;
    }
}
