package com.sailfish.taskman.cli;

import com.sailfish.taskman.model.Priority;
import com.sailfish.taskman.model.Task;
import com.sailfish.taskman.model.TaskStatus;
import com.sailfish.taskman.query.SortKey;
import com.sailfish.taskman.service.TaskService;
import com.sailfish.taskman.service.impl.TaskServiceImpl;
import com.sailfish.taskman.support.InMemoryTaskGateway;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.BufferedReader;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static com.sailfish.taskman.support.TestTasks.task;
import static org.assertj.core.api.Assertions.assertThat;

class TaskShellTest {

    private InMemoryTaskGateway gateway;
    private TaskService service;
    private ByteArrayOutputStream output;

    @BeforeEach
    void setUp() {
        gateway = new InMemoryTaskGateway();
        gateway.seed(task(1, "Existing", "2025-02-01", Priority.MEDIUM));
        service = new TaskServiceImpl(gateway, Clock.fixed(Instant.parse("2025-01-01T09:00:00Z"), ZoneOffset.UTC));
        output = new ByteArrayOutputStream();
    }

    private int run(String... lines) {
        String script = String.join("\n", lines) + "\n";
        PrintStream out = new PrintStream(output, true, StandardCharsets.UTF_8);
        return new TaskShell(service, new BufferedReader(new StringReader(script)), out).run();
    }

    private String output() {
        return output.toString(StandardCharsets.UTF_8);
    }

    @Test
    void exitChoiceEndsLoop() {
        assertThat(run("7")).isEqualTo(TaskShell.EXIT_OK);
        assertThat(output()).contains("Thank you for using Task Manager. Goodbye!");
    }

    @Test
    void endOfInputExitsCleanly() {
        assertThat(run()).isEqualTo(TaskShell.EXIT_OK);
        assertThat(output()).contains("Exiting application...");
    }

    @Test
    void invalidMenuChoiceIsReported() {
        run("9", "", "7");
        assertThat(output()).contains("Invalid choice. Please enter a number between 1 and 7.");
    }

    @Test
    void addTaskWithDefaultStatus() {
        run("1", "Write report", "Quarterly numbers", "2025-01-10", "high", "", "", "7");

        assertThat(output()).contains("Task added successfully! Task ID: 2");
        Task added = service.get(2);
        assertThat(added.getTitle()).isEqualTo("Write report");
        assertThat(added.getPriority()).isEqualTo(Priority.HIGH);
        assertThat(added.getStatus()).isEqualTo(TaskStatus.PENDING);
    }

    @Test
    void addTaskValidationErrorReturnsToMenu() {
        run("1", "Write report", "Quarterly numbers", "10/01/2025", "high", "", "", "7");

        assertThat(output()).contains("❌ Invalid date format. Use YYYY-MM-DD");
        assertThat(service.size()).isEqualTo(1);
        assertThat(output()).contains("Goodbye!");
    }

    @Test
    void storeFailureIsReportedAsDatabaseError() {
        gateway.failWrites(true);

        run("4", "1", "", "7");

        assertThat(output()).contains("❌ Database error: simulated store outage");
        assertThat(service.get(1).getStatus()).isEqualTo(TaskStatus.PENDING);
    }

    @Test
    void listShowsAllTasksWithTotal() {
        run("2", "", "7");

        assertThat(output()).contains("Existing").contains("Total tasks: 1");
    }

    @Test
    void updateKeepsBlankFields() {
        run("3", "1", "", "", "", "High", "in progress", "", "7");

        Task updated = service.get(1);
        assertThat(updated.getTitle()).isEqualTo("Existing");
        assertThat(updated.getPriority()).isEqualTo(Priority.HIGH);
        assertThat(updated.getStatus()).isEqualTo(TaskStatus.IN_PROGRESS);
        assertThat(output()).contains("Task updated successfully!");
    }

    @Test
    void updateWithNoChanges() {
        run("3", "1", "", "", "", "", "", "", "7");
        assertThat(output()).contains("No changes made.");
    }

    @Test
    void nonNumericTaskIdIsRejected() {
        run("4", "abc", "", "7");
        assertThat(output()).contains("Invalid Task ID. Please enter a number.");
    }

    @Test
    void unknownTaskIdIsReported() {
        run("4", "99", "", "7");
        assertThat(output()).contains("❌ Task with ID 99 not found.");
    }

    @Test
    void completeMarksTask() {
        run("4", "1", "", "7");

        assertThat(service.get(1).getStatus()).isEqualTo(TaskStatus.COMPLETED);
        assertThat(output()).contains("Task 1 marked as completed!");
    }

    @Test
    void deleteRequiresYes() {
        run("5", "1", "no", "", "7");
        assertThat(output()).contains("Deletion cancelled.");
        assertThat(service.size()).isEqualTo(1);

        run("5", "1", "YES", "", "7");
        assertThat(service.size()).isZero();
        assertThat(gateway.loadAll()).isEmpty();
    }

    @Test
    void filterAndSortByPriorityReversed() {
        gateway.seed(task(2, "Urgent", "2025-01-05", Priority.HIGH));
        gateway.seed(task(3, "Someday", "2025-03-01", Priority.LOW));
        service.reload();

        run("6", "", "", "pending", "2", "Y", "", "7");

        String out = output();
        assertThat(out).contains("Total tasks: 3");
        assertThat(out.indexOf("Someday")).isLessThan(out.indexOf("Existing"));
        assertThat(out.indexOf("Existing")).isLessThan(out.indexOf("Urgent"));
    }

    @Test
    void filterWithNoMatches() {
        run("6", "", "", "completed", "", "7");
        assertThat(output()).contains("No tasks found matching the criteria.");
    }

    @Test
    void parseSortChoiceFallsBackToDueDate() {
        assertThat(TaskShell.parseSortChoice("2")).isEqualTo(SortKey.PRIORITY);
        assertThat(TaskShell.parseSortChoice("3")).isEqualTo(SortKey.CREATED_AT);
        assertThat(TaskShell.parseSortChoice("")).isEqualTo(SortKey.DUE_DATE);
        assertThat(TaskShell.parseSortChoice("9")).isEqualTo(SortKey.DUE_DATE);
    }
}
