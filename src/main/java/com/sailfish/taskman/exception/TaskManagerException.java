package com.sailfish.taskman.exception;

/**
 * Base type for every failure the task manager surfaces to its callers.
 */
public class TaskManagerException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public TaskManagerException(String message) {
        super(message);
    }

    public TaskManagerException(String message, Throwable cause) {
        super(message, cause);
    }
}
