package com.sailfish.taskman.exception;

/**
 * The backing store failed: lost connectivity, a constraint violation or a schema mismatch.
 * Callers may retry the whole operation; nothing is retried automatically.
 */
public class TaskStoreException extends TaskManagerException {

    private static final long serialVersionUID = 1L;

    public TaskStoreException(String message) {
        super(message);
    }

    public TaskStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
