package com.sailfish.taskman.query;

import com.sailfish.taskman.model.Priority;
import com.sailfish.taskman.model.Task;
import com.sailfish.taskman.model.TaskStatus;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Equality predicates on due date, priority and status, combined with AND.
 *
 * <p>An unset predicate is ignored rather than matching nothing, so {@link #none()} accepts
 * every task.
 */
public final class TaskFilter {

    private static final TaskFilter NONE = new TaskFilter(null, null, null);

    private final LocalDate dueDate;
    private final Priority priority;
    private final TaskStatus status;

    private TaskFilter(LocalDate dueDate, Priority priority, TaskStatus status) {
        this.dueDate = dueDate;
        this.priority = priority;
        this.status = status;
    }

    public static TaskFilter none() {
        return NONE;
    }

    public static TaskFilter byStatus(TaskStatus status) {
        return builder().status(status).build();
    }

    public static TaskFilter byPriority(Priority priority) {
        return builder().priority(priority).build();
    }

    public static Builder builder() {
        return new Builder();
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
        return dueDate == null && priority == null && status == null;
    }

    public boolean matches(Task task) {
        return (dueDate == null || dueDate.equals(task.getDueDate()))
                && (priority == null || priority == task.getPriority())
                && (status == null || status == task.getStatus());
    }

    /**
     * Returns the matching tasks in their input order. Single pass.
     */
    public List<Task> apply(List<Task> tasks) {
        Objects.requireNonNull(tasks, "tasks cannot be null");
        List<Task> result = new ArrayList<>(tasks.size());
        for (Task task : tasks) {
            if (matches(task)) {
                result.add(task);
            }
        }
        return result;
    }

    @Override
    public String toString() {
        return "TaskFilter{" +
               "dueDate=" + dueDate +
               ", priority=" + priority +
               ", status=" + status +
               '}';
    }

    public static final class Builder {
        private LocalDate dueDate;
        private Priority priority;
        private TaskStatus status;

        private Builder() {
        }

        public Builder dueDate(LocalDate dueDate) {
            this.dueDate = dueDate;
            return this;
        }

        public Builder priority(Priority priority) {
            this.priority = priority;
            return this;
        }

        public Builder status(TaskStatus status) {
            this.status = status;
            return this;
        }

        public TaskFilter build() {
            return new TaskFilter(dueDate, priority, status);
        }
    }
}
