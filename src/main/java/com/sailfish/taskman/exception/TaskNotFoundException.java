package com.sailfish.taskman.exception;

/**
 * An operation referenced a task id that is not present.
 */
public class TaskNotFoundException extends TaskManagerException {

    private static final long serialVersionUID = 1L;

    private final long taskId;

    public TaskNotFoundException(long taskId) {
        super("Task with ID " + taskId + " not found.");
        this.taskId = taskId;
    }

    public long getTaskId() {
        return taskId;
    }
}
