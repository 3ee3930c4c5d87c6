package com.sailfish.taskman.model;

import com.sailfish.taskman.exception.TaskValidationException;

import java.util.Locale;

/**
 * Task priority. {@link #rank()} grows with severity: HIGH outranks MEDIUM outranks LOW.
 */
public enum Priority {
    LOW("Low", 1),
    MEDIUM("Medium", 2),
    HIGH("High", 3);

    private final String label;
    private final int rank;

    Priority(String label, int rank) {
        this.label = label;
        this.rank = rank;
    }

    public String label() {
        return label;
    }

    public int rank() {
        return rank;
    }

    /**
     * Parses a user-supplied priority, ignoring case and surrounding whitespace.
     *
     * @throws TaskValidationException if the value is blank or not Low, Medium or High
     */
    public static Priority parse(String value) {
        if (value == null || value.isBlank()) {
            throw new TaskValidationException("priority", "Priority cannot be empty");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (Priority priority : values()) {
            if (priority.label.toLowerCase(Locale.ROOT).equals(normalized)) {
                return priority;
            }
        }
        throw new TaskValidationException("priority", "Priority must be Low, Medium, or High");
    }

    /**
     * Resolves a stored column value. Matching ignores case and surrounding whitespace, so rows
     * written under other casing (e.g. {@code high}) still resolve.
     *
     * @throws IllegalArgumentException if the label is unknown
     */
    public static Priority fromLabel(String label) {
        for (Priority priority : values()) {
            if (label != null && priority.label.equalsIgnoreCase(label.trim())) {
                return priority;
            }
        }
        throw new IllegalArgumentException("Unknown priority label: " + label);
    }

    @Override
    public String toString() {
        return label;
    }
}
