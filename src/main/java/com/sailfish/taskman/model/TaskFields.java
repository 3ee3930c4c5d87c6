package com.sailfish.taskman.model;

import com.sailfish.taskman.exception.TaskValidationException;

import java.time.LocalDateTime;

/**
 * Raw, unvalidated field values for creating or updating a task. A {@code null} field is
 * "not supplied": on update it keeps the current value, on create it fails validation
 * (except status, which defaults to Pending).
 *
 * <pre>{@code
 * TaskFields fields = TaskFields.builder()
 *         .title("Write report")
 *         .dueDate("2025-01-10")
 *         .priority("high")
 *         .build();
 * }</pre>
 */
public final class TaskFields {

    private final String title;
    private final String description;
    private final String dueDate;
    private final String priority;
    private final String status;

    private TaskFields(Builder builder) {
        this.title = builder.title;
        this.description = builder.description;
        this.dueDate = builder.dueDate;
        this.priority = builder.priority;
        this.status = builder.status;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builds a new, unsaved task from these fields.
     *
     * @throws TaskValidationException if a required field is missing or any field is invalid
     */
    public Task toNewTask(LocalDateTime createdAt) {
        return Task.of(title, description, dueDate, priority, status, createdAt);
    }

    /**
     * Validates the supplied fields and converts them into a typed update.
     *
     * @throws TaskValidationException if a supplied field is invalid
     */
    public TaskUpdate toUpdate() {
        return new TaskUpdate(
                title == null ? null : requireText("title", "Title", title),
                description == null ? null : requireText("description", "Description", description),
                dueDate == null ? null : Task.parseDueDate(dueDate),
                priority == null ? null : Priority.parse(priority),
                status == null ? null : TaskStatus.parse(status)
        );
    }

    private static String requireText(String field, String displayName, String value) {
        if (value.isBlank()) {
            throw new TaskValidationException(field, displayName + " cannot be empty");
        }
        return value.trim();
    }

    public static final class Builder {
        private String title;
        private String description;
        private String dueDate;
        private String priority;
        private String status;

        private Builder() {
        }

        public Builder title(String title) {
            this.title = title;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder dueDate(String dueDate) {
            this.dueDate = dueDate;
            return this;
        }

        public Builder priority(String priority) {
            this.priority = priority;
            return this;
        }

        public Builder status(String status) {
            this.status = status;
            return this;
        }

        public TaskFields build() {
            return new TaskFields(this);
        }
    }
}
