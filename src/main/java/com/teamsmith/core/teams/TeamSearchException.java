package com.teamsmith.core.teams;

/**
 * Thrown when the team search for a task fails; the whole run is aborted.
 */
public class TeamSearchException extends RuntimeException {
    public TeamSearchException(String message) {
        super(message);
    }

    public TeamSearchException(String message, Throwable cause) {
        super(message, cause);
    }
}
