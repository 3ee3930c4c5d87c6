package com.sailfish.taskman.query;

import com.sailfish.taskman.model.Task;

import java.util.Comparator;

/**
 * The fields a task list can be sorted by, each with its natural direction.
 */
public enum SortKey {
    /**
     * Earliest due date first.
     */
    DUE_DATE("Due Date", Comparator.comparing(Task::getDueDate)),
    /**
     * Most severe first: High, then Medium, then Low.
     */
    PRIORITY("Priority", Comparator.comparingInt((Task t) -> t.getPriority().rank()).reversed()),
    /**
     * Oldest first.
     */
    CREATED_AT("Created At", Comparator.comparing(Task::getCreatedAt));

    private final String label;
    private final Comparator<Task> comparator;

    SortKey(String label, Comparator<Task> comparator) {
        this.label = label;
        this.comparator = comparator;
    }

    public String label() {
        return label;
    }

    public Comparator<Task> comparator() {
        return comparator;
    }
}
