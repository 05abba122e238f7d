package io.github.vishalmysore.cloudslash.swarm;

/**
 * Thrown by tasks to report that the provider rate-limited the request.
 */
public class ThrottledException extends Exception {

    public ThrottledException(String message) {
        super(message);
    }

    public ThrottledException(String message, Throwable cause) {
        super(message, cause);
    }
}
