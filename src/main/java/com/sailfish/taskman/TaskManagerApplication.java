package com.sailfish.taskman;

import com.sailfish.taskman.cli.TaskShell;
import com.sailfish.taskman.config.StoreConnector;
import com.sailfish.taskman.config.StoreConnector.StoreConnection;
import com.sailfish.taskman.config.StoreProperties;
import com.sailfish.taskman.service.TaskService;
import com.sailfish.taskman.service.impl.TaskServiceImpl;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.FileDescriptor;
import java.io.FileOutputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

/**
 * Entry point: connects to the store, loads the tasks and runs the interactive shell.
 */
public final class TaskManagerApplication {

    private static final Logger log = LoggerFactory.getLogger(TaskManagerApplication.class);

    public static final int EXIT_FATAL = 1;

    private TaskManagerApplication() {
    }

    public static void main(String[] args) {
        PrintStream out = new PrintStream(new FileOutputStream(FileDescriptor.out), true, StandardCharsets.UTF_8);
        BufferedReader in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));

        StoreProperties properties;
        try {
            properties = StoreProperties.fromEnvironment(System.getenv());
        } catch (IllegalArgumentException e) {
            log.error("Invalid database configuration", e);
            out.println("❌ Fatal error: " + e.getMessage());
            System.exit(EXIT_FATAL);
            return;
        }
        System.exit(run(new StoreConnector(properties), in, out));
    }

    /**
     * Runs the application against the given connector.
     *
     * @return the process exit code
     */
    static int run(StoreConnector connector, BufferedReader in, PrintStream out) {
        try (StoreConnection connection = connector.connect()) {
            TaskService taskService = new TaskServiceImpl(connection.gateway());
            return new TaskShell(taskService, in, out).run();
        } catch (RuntimeException e) {
            log.error("Task manager stopped on a fatal error", e);
            out.println("❌ Fatal error: " + e.getMessage());
            return EXIT_FATAL;
        }
    }
}
