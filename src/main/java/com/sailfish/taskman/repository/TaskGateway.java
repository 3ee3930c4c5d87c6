package com.sailfish.taskman.repository;

import com.sailfish.taskman.model.Task;
import com.sailfish.taskman.model.TaskUpdate;

import java.util.List;
import java.util.Optional;

/**
 * Row-store access for tasks. Implementations translate each call into a single
 * parameterized statement against the {@code tasks} table and never build SQL from user input.
 *
 * <p>Failures surface as {@link com.sailfish.taskman.exception.TaskStoreException}; a missing row
 * on update/delete surfaces as {@link com.sailfish.taskman.exception.TaskNotFoundException}.
 */
public interface TaskGateway {

    /**
     * Creates the {@code tasks} table and its indexes if they do not exist yet.
     * Safe to call on every startup.
     */
    void ensureSchema();

    /**
     * Inserts a task that has no id yet.
     *
     * @param task the unsaved task
     * @return the id generated by the store
     * @throws IllegalArgumentException if the task already carries an id
     */
    long insert(Task task);

    /**
     * Applies a partial update to one row. An empty update succeeds without touching the store.
     *
     * @param id     the task id
     * @param update the fields to change
     */
    void update(long id, TaskUpdate update);

    /**
     * Deletes one row.
     *
     * @param id the task id
     */
    void delete(long id);

    /**
     * Finds a task record by its ID.
     *
     * @param id the task id
     * @return an Optional containing the task if found, empty otherwise
     */
    Optional<Task> findById(long id);

    /**
     * Reads every row, ordered by id.
     *
     * @return all tasks in the store
     */
    List<Task> loadAll();
}
