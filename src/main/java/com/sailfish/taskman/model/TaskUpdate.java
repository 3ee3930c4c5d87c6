package com.sailfish.taskman.model;

import java.time.LocalDate;
import java.util.Optional;

/**
 * A validated partial update. Absent fields keep their current value.
 */
public final class TaskUpdate {

    private static final TaskUpdate EMPTY = new TaskUpdate(null, null, null, null, null);

    private final String title;
    private final String description;
    private final LocalDate dueDate;
    private final Priority priority;
    private final TaskStatus status;

    TaskUpdate(String title, String description, LocalDate dueDate, Priority priority, TaskStatus status) {
        this.title = title;
        this.description = description;
        this.dueDate = dueDate;
        this.priority = priority;
        this.status = status;
    }

    public static TaskUpdate empty() {
        return EMPTY;
    }

    public static TaskUpdate status(TaskStatus status) {
        return new TaskUpdate(null, null, null, null, status);
    }

    public Optional<String> title() {
        return Optional.ofNullable(title);
    }

    public Optional<String> description() {
        return Optional.ofNullable(description);
    }

    public Optional<LocalDate> dueDate() {
        return Optional.ofNullable(dueDate);
    }

    public Optional<Priority> priority() {
        return Optional.ofNullable(priority);
    }

    public Optional<TaskStatus> status() {
        return Optional.ofNullable(status);
    }

    public boolean isEmpty() {
        return title == null && description == null && dueDate == null && priority == null && status == null;
    }

    /**
     * Applies the present fields through the task's validating setters.
     *
     * @return the same task, for chaining
     */
    public Task applyTo(Task task) {
        title().ifPresent(task::setTitle);
        description().ifPresent(task::setDescription);
        dueDate().ifPresent(task::setDueDate);
        priority().ifPresent(task::setPriority);
        status().ifPresent(task::setStatus);
        return task;
    }

    @Override
    public String toString() {
        return "TaskUpdate{" +
               "title=" + title +
               ", description=" + description +
               ", dueDate=" + dueDate +
               ", priority=" + priority +
               ", status=" + status +
               '}';
    }
}
