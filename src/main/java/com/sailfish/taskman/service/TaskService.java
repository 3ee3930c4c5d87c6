package com.sailfish.taskman.service;

import com.sailfish.taskman.model.Task;
import com.sailfish.taskman.model.TaskFields;
import com.sailfish.taskman.query.SortKey;
import com.sailfish.taskman.query.TaskFilter;

import java.util.List;
import java.util.Optional;

/**
 * Service interface for managing tasks: CRUD plus in-memory filtering and sorting.
 *
 * <p>Writes go to the store first and are reflected in memory only once the store has
 * acknowledged them. Reads are served from memory and never touch the store. Returned tasks
 * are copies; changing them has no effect until passed back through {@link #update}.
 */
public interface TaskService {

    /**
     * Validates and persists a new task.
     *
     * @param fields the task's fields; status may be omitted and defaults to Pending
     * @return the saved task with its generated id
     * @throws com.sailfish.taskman.exception.TaskValidationException if a field is invalid; nothing is stored
     * @throws com.sailfish.taskman.exception.TaskStoreException if the store rejects the insert
     */
    Task add(TaskFields fields);

    /**
     * Applies a partial update. Fields left unset keep their value.
     *
     * @return the updated task
     * @throws com.sailfish.taskman.exception.TaskNotFoundException if no task has this id
     * @throws com.sailfish.taskman.exception.TaskValidationException if a supplied field is invalid
     * @throws com.sailfish.taskman.exception.TaskStoreException if the store rejects the update
     */
    Task update(long id, TaskFields fields);

    /**
     * Marks a task as Completed.
     *
     * @return the updated task
     * @throws com.sailfish.taskman.exception.TaskNotFoundException if no task has this id
     */
    Task complete(long id);

    /**
     * Deletes a task.
     *
     * @throws com.sailfish.taskman.exception.TaskNotFoundException if no task has this id
     * @throws com.sailfish.taskman.exception.TaskStoreException if the store rejects the delete
     */
    void delete(long id);

    Optional<Task> find(long id);

    /**
     * @throws com.sailfish.taskman.exception.TaskNotFoundException if no task has this id
     */
    Task get(long id);

    /**
     * All tasks in load/insertion order.
     */
    List<Task> list();

    /**
     * Filters, then sorts, the current tasks.
     *
     * @param filter  predicates to apply; null means no filtering
     * @param sortKey key to sort by; null keeps load/insertion order
     */
    List<Task> list(TaskFilter filter, SortKey sortKey);

    /**
     * As {@link #list(TaskFilter, SortKey)}, optionally inverting the key's direction.
     * Tasks that tie on the key keep their relative order either way.
     */
    List<Task> list(TaskFilter filter, SortKey sortKey, boolean reversed);

    int size();

    /**
     * Discards the in-memory tasks and reloads them from the store.
     */
    void reload();
}
