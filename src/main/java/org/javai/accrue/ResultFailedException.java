package org.javai.accrue;

/**
 * Thrown when {@link Result#getOrThrow()} is called on a result whose error is a checked
 * exception. Unchecked errors are rethrown as they are.
 */
public class ResultFailedException extends RuntimeException {

    public ResultFailedException(Throwable cause) {
        super("Result failed: " + cause.getMessage(), cause);
    }
}
