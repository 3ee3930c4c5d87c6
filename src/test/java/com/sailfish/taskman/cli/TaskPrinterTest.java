package com.sailfish.taskman.cli;

import com.sailfish.taskman.model.Priority;
import com.sailfish.taskman.model.TaskStatus;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static com.sailfish.taskman.support.TestTasks.T0;
import static com.sailfish.taskman.support.TestTasks.task;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TaskPrinterTest {

    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
    private final TaskPrinter printer = new TaskPrinter(new PrintStream(buffer, true, StandardCharsets.UTF_8));

    private String printed() {
        return buffer.toString(StandardCharsets.UTF_8);
    }

    @Test
    void printsEveryField() {
        printer.printTasks(List.of(task(4, "Write report", "2025-01-10", Priority.HIGH, TaskStatus.IN_PROGRESS, T0)));

        String out = printed();
        assertTrue(out.contains("Task #1 - ID: 4"));
        assertTrue(out.contains("Write report"));
        assertTrue(out.contains("Write report description"));
        assertTrue(out.contains("2025-01-10"));
        assertTrue(out.contains("Priority    : High"));
        assertTrue(out.contains("Status      : In Progress"));
        assertTrue(out.contains("Created At  : 2025-01-01 09:00:00"));
    }

    @Test
    void emptyListHasPlaceholder() {
        printer.printTasks(List.of());
        assertTrue(printed().contains("No tasks to display."));
    }

    @Test
    void headerIsCentered() {
        printer.printHeader("ABC");
        String[] lines = printed().split("\\R");
        assertEquals("=".repeat(TaskPrinter.HEADER_WIDTH), lines[0]);
        assertEquals(" ".repeat(28) + "ABC", lines[1]);
    }

    @Test
    void iconsPerValue() {
        assertEquals("✅", TaskPrinter.statusIcon(TaskStatus.COMPLETED));
        assertEquals("🔴", TaskPrinter.priorityIcon(Priority.HIGH));
    }
}
