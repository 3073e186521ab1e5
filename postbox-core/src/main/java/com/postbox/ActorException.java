package com.postbox;

/**
 * Unchecked wrapper for a checked failure reported by an actor body.
 * Thrown by {@link Result#getOrThrow()}.
 */
public class ActorException extends RuntimeException {

    /**
     * Creates a new ActorException with the specified detail message and cause.
     *
     * @param message the detail message
     * @param cause the failure reported by the body
     */
    public ActorException(String message, Throwable cause) {
        super(message, cause);
    }
}
