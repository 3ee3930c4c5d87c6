package com.sailfish.taskman.cli;

import com.sailfish.taskman.model.Priority;
import com.sailfish.taskman.model.Task;
import com.sailfish.taskman.model.TaskStatus;

import java.io.PrintStream;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Objects;

/**
 * Renders tasks and headers for the interactive shell.
 */
public class TaskPrinter {

    static final int HEADER_WIDTH = 60;
    static final String SEPARATOR = "=".repeat(100);
    static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final PrintStream out;

    public TaskPrinter(PrintStream out) {
        this.out = Objects.requireNonNull(out, "out cannot be null");
    }

    public void printHeader(String title) {
        String line = "=".repeat(HEADER_WIDTH);
        int padding = Math.max(0, (HEADER_WIDTH - title.length()) / 2);
        out.println(line);
        out.println(" ".repeat(padding) + title);
        out.println(line);
    }

    /**
     * Prints every field of each task, numbered from 1.
     */
    public void printTasks(List<Task> tasks) {
        if (tasks.isEmpty()) {
            out.println();
            out.println("📭 No tasks to display.");
            return;
        }

        out.println();
        int index = 1;
        for (Task task : tasks) {
            out.println(SEPARATOR);
            out.println("Task #" + index++ + " - ID: " + task.getId());
            out.println(SEPARATOR);
            out.println("📌 Title       : " + task.getTitle());
            out.println("📝 Description : " + task.getDescription());
            out.println("📅 Due Date    : " + task.getDueDate());
            out.println(priorityIcon(task.getPriority()) + "  Priority    : " + task.getPriority().label());
            out.println(statusIcon(task.getStatus()) + "  Status      : " + task.getStatus().label());
            out.println("🕐 Created At  : " + TIMESTAMP_FORMAT.format(task.getCreatedAt()));
            out.println();
        }
        out.println(SEPARATOR);
    }

    static String statusIcon(TaskStatus status) {
        switch (status) {
            case PENDING:
                return "⏳";
            case IN_PROGRESS:
                return "🔄";
            case COMPLETED:
                return "✅";
            default:
                return "•";
        }
    }

    static String priorityIcon(Priority priority) {
        switch (priority) {
            case LOW:
                return "🟢";
            case MEDIUM:
                return "🟡";
            case HIGH:
                return "🔴";
            default:
                return "•";
        }
    }
}
