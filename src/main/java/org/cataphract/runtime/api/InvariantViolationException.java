package org.cataphract.runtime.api;

/**
 * A broken engine invariant, such as negative supplies or an army on a missing
 * hex. This signals a bug rather than a user error and aborts the current part.
 */
public class InvariantViolationException extends RuntimeException {

    public InvariantViolationException(String message) {
        super(message);
    }
}
