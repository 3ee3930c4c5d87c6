package com.sailfish.taskman.model;

import com.sailfish.taskman.exception.TaskValidationException;

import java.util.Locale;

/**
 * Represents the possible statuses of a task.
 */
public enum TaskStatus {
    /**
     * Task has been recorded but work has not started. Default for new tasks.
     */
    PENDING("Pending"),
    /**
     * Task is currently being worked on.
     */
    IN_PROGRESS("In Progress"),
    /**
     * Task is done.
     */
    COMPLETED("Completed");

    private final String label;

    TaskStatus(String label) {
        this.label = label;
    }

    /**
     * The label shown to users and stored in the {@code status} column.
     */
    public String label() {
        return label;
    }

    /**
     * Parses a user-supplied status, ignoring case and surrounding whitespace.
     * "in progress", "in-progress" and "in_progress" all map to {@link #IN_PROGRESS}.
     *
     * @throws TaskValidationException if the value is blank or not a known status
     */
    public static TaskStatus parse(String value) {
        if (value == null || value.isBlank()) {
            throw new TaskValidationException("status", "Status cannot be empty");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT).replace('-', ' ').replace('_', ' ');
        for (TaskStatus status : values()) {
            if (status.label.toLowerCase(Locale.ROOT).equals(normalized)) {
                return status;
            }
        }
        throw new TaskValidationException("status", "Status must be Pending, In Progress, or Completed");
    }

    /**
     * Resolves a stored column value. Matching ignores case and surrounding whitespace, so rows
     * written under older casing (e.g. {@code In progress}) still resolve.
     *
     * @throws IllegalArgumentException if the label is unknown
     */
    public static TaskStatus fromLabel(String label) {
        for (TaskStatus status : values()) {
            if (label != null && status.label.equalsIgnoreCase(label.trim())) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown task status label: " + label);
    }

    @Override
    public String toString() {
        return label;
    }
}
