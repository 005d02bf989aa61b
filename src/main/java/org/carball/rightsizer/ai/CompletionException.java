package org.carball.rightsizer.ai;

/**
 * The completion provider could not produce a response.
 */
public class CompletionException extends RuntimeException {

    public CompletionException(String message) {
        super(message);
    }

    public CompletionException(String message, Throwable cause) {
        super(message, cause);
    }
}
