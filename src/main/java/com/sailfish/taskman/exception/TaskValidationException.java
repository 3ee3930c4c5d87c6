package com.sailfish.taskman.exception;

/**
 * A user-supplied field failed validation. Raised before anything reaches the store.
 */
public class TaskValidationException extends TaskManagerException {

    private static final long serialVersionUID = 1L;

    private final String field;

    public TaskValidationException(String field, String message) {
        super(message);
        this.field = field;
    }

    /**
     * Name of the offending field, e.g. {@code "due_date"}.
     */
    public String getField() {
        return field;
    }
}
