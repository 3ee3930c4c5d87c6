package com.sailfish.taskman.model;

import com.sailfish.taskman.exception.TaskValidationException;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.Objects;

/**
 * A single task with validated fields.
 *
 * <p>Every constructor and setter validates before assigning, so a {@code Task} never holds
 * a blank title or description, a missing due date, or a missing priority/status.
 * {@code id} is assigned by the store and {@code createdAt} is fixed at creation; neither
 * changes afterwards.
 *
 * <p>Equality is by id, so two unsaved tasks are equal only if they are the same instance.
 */
public final class Task {

    private final Long id;
    private String title;
    private String description;
    private LocalDate dueDate;
    private Priority priority;
    private TaskStatus status;
    private final LocalDateTime createdAt;

    /**
     * Creates an unsaved task.
     *
     * @param createdAt creation time; stored at whole-second precision
     * @throws TaskValidationException if any field is invalid
     */
    public Task(String title, String description, LocalDate dueDate, Priority priority,
                TaskStatus status, LocalDateTime createdAt) {
        this(null, title, description, dueDate, priority, status, createdAt);
    }

    /**
     * Reconstitutes a task, typically from a stored row.
     *
     * @throws TaskValidationException if any field is invalid
     */
    public Task(Long id, String title, String description, LocalDate dueDate, Priority priority,
                TaskStatus status, LocalDateTime createdAt) {
        if (id != null && id <= 0) {
            throw new TaskValidationException("task_id", "Task ID must be a positive integer");
        }
        this.id = id;
        setTitle(title);
        setDescription(description);
        setDueDate(dueDate);
        setPriority(priority);
        setStatus(status);
        if (createdAt == null) {
            throw new TaskValidationException("created_at", "Creation time cannot be empty");
        }
        this.createdAt = createdAt.truncatedTo(ChronoUnit.SECONDS);
    }

    /**
     * Creates an unsaved task from raw text, as typed into the shell.
     *
     * @param status may be null or blank, in which case the task starts as {@link TaskStatus#PENDING}
     * @throws TaskValidationException if any field is invalid
     */
    public static Task of(String title, String description, String dueDate, String priority,
                          String status, LocalDateTime createdAt) {
        TaskStatus resolved = status == null || status.isBlank() ? TaskStatus.PENDING : TaskStatus.parse(status);
        return new Task(title, description, parseDueDate(dueDate), Priority.parse(priority), resolved, createdAt);
    }

    /**
     * Parses an ISO {@code yyyy-MM-dd} date.
     *
     * @throws TaskValidationException if the value is blank or not a calendar date
     */
    public static LocalDate parseDueDate(String value) {
        if (value == null || value.isBlank()) {
            throw new TaskValidationException("due_date", "Due date cannot be empty");
        }
        try {
            return LocalDate.parse(value.trim());
        } catch (DateTimeParseException e) {
            throw new TaskValidationException("due_date", "Invalid date format. Use YYYY-MM-DD");
        }
    }

    /**
     * Returns a copy carrying the id the store generated for this task.
     *
     * @throws IllegalStateException if this task already has an id
     */
    public Task withId(long newId) {
        if (id != null) {
            throw new IllegalStateException("Task already has ID " + id);
        }
        return new Task(newId, title, description, dueDate, priority, status, createdAt);
    }

    /**
     * Returns a detached copy; changes to the copy do not affect this task.
     */
    public Task copy() {
        return new Task(id, title, description, dueDate, priority, status, createdAt);
    }

    public Long getId() {
        return id;
    }

    public String getTitle() {
        return title;
    }

    public void setTitle(String title) {
        this.title = requireText("title", "Title", title);
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = requireText("description", "Description", description);
    }

    public LocalDate getDueDate() {
        return dueDate;
    }

    public void setDueDate(LocalDate dueDate) {
        if (dueDate == null) {
            throw new TaskValidationException("due_date", "Due date cannot be empty");
        }
        this.dueDate = dueDate;
    }

    public Priority getPriority() {
        return priority;
    }

    public void setPriority(Priority priority) {
        if (priority == null) {
            throw new TaskValidationException("priority", "Priority cannot be empty");
        }
        this.priority = priority;
    }

    public TaskStatus getStatus() {
        return status;
    }

    public void setStatus(TaskStatus status) {
        if (status == null) {
            throw new TaskValidationException("status", "Status cannot be empty");
        }
        this.status = status;
    }

    public LocalDateTime getCreatedAt() {
        return createdAt;
    }

    private static String requireText(String field, String displayName, String value) {
        if (value == null || value.isBlank()) {
            throw new TaskValidationException(field, displayName + " cannot be empty");
        }
        return value.trim();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Task that = (Task) o;
        return id != null && Objects.equals(id, that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(id);
    }

    @Override
    public String toString() {
        return "Task{" +
               "id=" + id +
               ", title='" + title + '\'' +
               ", priority=" + priority +
               ", status=" + status +
               ", dueDate=" + dueDate +
               '}';
    }
}
