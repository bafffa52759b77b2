package io.shepherd.api.manager;

/**
 * Thrown when a command is submitted to a manager whose shutdown has already begun.
 */
public class ManagerShutdownException extends IllegalStateException {

    public ManagerShutdownException(String message) {
        super(message);
    }
}
