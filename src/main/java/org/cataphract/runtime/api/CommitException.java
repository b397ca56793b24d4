package org.cataphract.runtime.api;

/**
 * Thrown by a host's commit callback when the post-part state could not be persisted.
 */
public class CommitException extends Exception {

    public CommitException(String message) {
        super(message);
    }

    public CommitException(String message, Throwable cause) {
        super(message, cause);
    }
}
