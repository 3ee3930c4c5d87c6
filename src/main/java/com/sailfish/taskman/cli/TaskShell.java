package com.sailfish.taskman.cli;

import com.sailfish.taskman.exception.TaskManagerException;
import com.sailfish.taskman.exception.TaskStoreException;
import com.sailfish.taskman.model.Priority;
import com.sailfish.taskman.model.Task;
import com.sailfish.taskman.model.TaskFields;
import com.sailfish.taskman.model.TaskStatus;
import com.sailfish.taskman.query.SortKey;
import com.sailfish.taskman.query.TaskFilter;
import com.sailfish.taskman.service.TaskService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Numbered-menu front end over a {@link TaskService}.
 *
 * <p>Failures from the service are printed and control returns to the menu; only choosing
 * Exit or reaching end of input ends the loop.
 */
public class TaskShell {

    private static final Logger log = LoggerFactory.getLogger(TaskShell.class);

    public static final int EXIT_OK = 0;

    private final TaskService taskService;
    private final BufferedReader in;
    private final PrintStream out;
    private final TaskPrinter printer;

    /**
     * Raised internally when input runs out mid-action.
     */
    private static final class EndOfInput extends RuntimeException {
        private static final long serialVersionUID = 1L;
    }

    public TaskShell(TaskService taskService, BufferedReader in, PrintStream out) {
        this.taskService = Objects.requireNonNull(taskService, "taskService cannot be null");
        this.in = Objects.requireNonNull(in, "in cannot be null");
        this.out = Objects.requireNonNull(out, "out cannot be null");
        this.printer = new TaskPrinter(out);
    }

    /**
     * Runs the menu loop until the user exits.
     *
     * @return the process exit code
     */
    public int run() {
        try {
            while (true) {
                displayMenu();
                String choice = prompt("\nEnter your choice (1-7): ");
                switch (choice) {
                    case "1":
                        guarded(this::addTask);
                        break;
                    case "2":
                        guarded(this::listTasks);
                        break;
                    case "3":
                        guarded(this::updateTask);
                        break;
                    case "4":
                        guarded(this::completeTask);
                        break;
                    case "5":
                        guarded(this::deleteTask);
                        break;
                    case "6":
                        guarded(this::filterAndSortTasks);
                        break;
                    case "7":
                        out.println("\nThank you for using Task Manager. Goodbye!");
                        return EXIT_OK;
                    default:
                        out.println("\n❌ Invalid choice. Please enter a number between 1 and 7.");
                }
                prompt("\nPress Enter to continue...");
            }
        } catch (EndOfInput e) {
            out.println("\n\nExiting application...");
            return EXIT_OK;
        }
    }

    private void guarded(Runnable action) {
        try {
            action.run();
        } catch (TaskStoreException e) {
            log.warn("Store operation failed: {}", e.getMessage());
            out.println("\n❌ Database error: " + e.getMessage());
        } catch (TaskManagerException e) {
            out.println("\n❌ " + e.getMessage());
        }
    }

    private void displayMenu() {
        out.println();
        printer.printHeader("TASK MANAGEMENT SYSTEM");
        out.println("\n1. Add New Task");
        out.println("2. List All Tasks");
        out.println("3. Update Task");
        out.println("4. Mark Task as Completed");
        out.println("5. Delete Task");
        out.println("6. Filter/Sort Tasks");
        out.println("7. Exit");
    }

    private void addTask() {
        printer.printHeader("ADD NEW TASK");
        TaskFields fields = TaskFields.builder()
                .title(prompt("\nEnter task title: "))
                .description(prompt("Enter task description: "))
                .dueDate(prompt("Enter due date (YYYY-MM-DD): "))
                .priority(prompt("Enter priority (Low/Medium/High): "))
                .status(blankToNull(prompt("Enter status (Pending/In Progress/Completed) [Default: Pending]: ")))
                .build();

        Task task = taskService.add(fields);
        out.println("\n✅ Task added successfully! Task ID: " + task.getId());
    }

    private void listTasks() {
        printer.printHeader("ALL TASKS");
        List<Task> tasks = taskService.list(TaskFilter.none(), SortKey.DUE_DATE);
        if (tasks.isEmpty()) {
            out.println("\n📭 No tasks found.");
            return;
        }
        printer.printTasks(tasks);
        out.println("\nTotal tasks: " + tasks.size());
    }

    private void updateTask() {
        printer.printHeader("UPDATE TASK");
        Optional<Long> id = readTaskId("\nEnter Task ID to update: ");
        if (id.isEmpty()) {
            return;
        }
        Task task = taskService.get(id.get());

        out.println("\nCurrent task details:");
        printer.printTasks(List.of(task));
        out.println("\nLeave blank to keep current value.");

        TaskFields fields = TaskFields.builder()
                .title(blankToNull(prompt("New title [" + task.getTitle() + "]: ")))
                .description(blankToNull(prompt("New description [" + task.getDescription() + "]: ")))
                .dueDate(blankToNull(prompt("New due date [" + task.getDueDate() + "]: ")))
                .priority(blankToNull(prompt("New priority [" + task.getPriority().label() + "]: ")))
                .status(blankToNull(prompt("New status [" + task.getStatus().label() + "]: ")))
                .build();

        if (fields.toUpdate().isEmpty()) {
            out.println("\n⚠️ No changes made.");
            return;
        }
        taskService.update(id.get(), fields);
        out.println("\n✅ Task updated successfully!");
    }

    private void completeTask() {
        printer.printHeader("MARK TASK AS COMPLETED");
        Optional<Long> id = readTaskId("\nEnter Task ID to mark as completed: ");
        if (id.isEmpty()) {
            return;
        }
        taskService.complete(id.get());
        out.println("\n✅ Task " + id.get() + " marked as completed!");
    }

    private void deleteTask() {
        printer.printHeader("DELETE TASK");
        Optional<Long> id = readTaskId("\nEnter Task ID to delete: ");
        if (id.isEmpty()) {
            return;
        }
        Task task = taskService.get(id.get());

        out.println("\nTask to delete:");
        printer.printTasks(List.of(task));

        String confirm = prompt("\n⚠️ Are you sure you want to delete this task? (yes/no): ");
        if (!"yes".equalsIgnoreCase(confirm)) {
            out.println("\n❌ Deletion cancelled.");
            return;
        }
        taskService.delete(id.get());
        out.println("\n✅ Task " + id.get() + " deleted successfully!");
    }

    private void filterAndSortTasks() {
        printer.printHeader("FILTER & SORT TASKS");
        out.println("\nFilter options (leave blank to skip):");
        String dueDate = blankToNull(prompt("Filter by due date (YYYY-MM-DD): "));
        String priority = blankToNull(prompt("Filter by priority (Low/Medium/High): "));
        String status = blankToNull(prompt("Filter by status (Pending/In Progress/Completed): "));

        TaskFilter filter = TaskFilter.builder()
                .dueDate(dueDate == null ? null : Task.parseDueDate(dueDate))
                .priority(priority == null ? null : Priority.parse(priority))
                .status(status == null ? null : TaskStatus.parse(status))
                .build();

        if (taskService.list(filter, null).isEmpty()) {
            out.println("\n📭 No tasks found matching the criteria.");
            return;
        }

        out.println("\nSort by:");
        SortKey[] keys = SortKey.values();
        for (int i = 0; i < keys.length; i++) {
            out.println((i + 1) + ". " + keys[i].label());
        }
        SortKey sortKey = parseSortChoice(prompt("Enter choice (1-3) [Default: 1]: "));
        boolean reversed = prompt("Reverse order? (y/N): ").toLowerCase(Locale.ROOT).startsWith("y");

        List<Task> tasks = taskService.list(filter, sortKey, reversed);
        printer.printHeader("FILTERED & SORTED TASKS");
        printer.printTasks(tasks);
        out.println("\nTotal tasks: " + tasks.size());
    }

    static SortKey parseSortChoice(String choice) {
        SortKey[] keys = SortKey.values();
        try {
            int index = Integer.parseInt(choice.trim());
            if (index >= 1 && index <= keys.length) {
                return keys[index - 1];
            }
        } catch (NumberFormatException e) {
            log.debug("Unrecognised sort choice '{}', using default", choice);
        }
        return SortKey.DUE_DATE;
    }

    private Optional<Long> readTaskId(String message) {
        String raw = prompt(message);
        try {
            return Optional.of(Long.parseLong(raw));
        } catch (NumberFormatException e) {
            out.println("\n❌ Invalid Task ID. Please enter a number.");
            return Optional.empty();
        }
    }

    private String prompt(String message) {
        out.print(message);
        out.flush();
        try {
            String line = in.readLine();
            if (line == null) {
                throw new EndOfInput();
            }
            return line.trim();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read input", e);
        }
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
