package com.sailfish.taskman.service.impl;

import com.sailfish.taskman.exception.TaskNotFoundException;
import com.sailfish.taskman.model.Task;
import com.sailfish.taskman.model.TaskFields;
import com.sailfish.taskman.model.TaskStatus;
import com.sailfish.taskman.model.TaskUpdate;
import com.sailfish.taskman.query.MergeSort;
import com.sailfish.taskman.query.SortKey;
import com.sailfish.taskman.query.TaskFilter;
import com.sailfish.taskman.repository.TaskGateway;
import com.sailfish.taskman.service.TaskService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Default implementation of the TaskService.
 *
 * <p>Keeps a mirror of the {@code tasks} table keyed by id. The mirror is filled from
 * {@link TaskGateway#loadAll()} on construction and afterwards changed only after the gateway
 * call for that change has succeeded, so it never runs ahead of the store.
 *
 * <p>Not thread-safe; intended for a single interactive caller.
 */
public class TaskServiceImpl implements TaskService {

    private static final Logger log = LoggerFactory.getLogger(TaskServiceImpl.class);

    private final TaskGateway gateway;
    private final Clock clock;
    private final Map<Long, Task> mirror = new LinkedHashMap<>();

    public TaskServiceImpl(TaskGateway gateway) {
        this(gateway, Clock.systemDefaultZone());
    }

    public TaskServiceImpl(TaskGateway gateway, Clock clock) {
        this.gateway = Objects.requireNonNull(gateway, "gateway cannot be null");
        this.clock = Objects.requireNonNull(clock, "clock cannot be null");
        reload();
    }

    @Override
    public void reload() {
        List<Task> tasks = gateway.loadAll();
        mirror.clear();
        for (Task task : tasks) {
            mirror.put(task.getId(), task);
        }
        log.info("Loaded {} tasks from the store", mirror.size());
    }

    @Override
    public Task add(TaskFields fields) {
        Objects.requireNonNull(fields, "fields cannot be null");
        Task task = fields.toNewTask(LocalDateTime.now(clock));

        long id = gateway.insert(task);
        Task saved = task.withId(id);
        mirror.put(id, saved);

        log.info("Added task {} '{}'", id, saved.getTitle());
        return saved.copy();
    }

    @Override
    public Task update(long id, TaskFields fields) {
        Objects.requireNonNull(fields, "fields cannot be null");
        Task current = requireTask(id);
        TaskUpdate update = fields.toUpdate();
        Task updated = update.applyTo(current.copy());

        gateway.update(id, update);
        mirror.put(id, updated);

        log.info("Updated task {} with {}", id, update);
        return updated.copy();
    }

    @Override
    public Task complete(long id) {
        Task current = requireTask(id);
        TaskUpdate update = TaskUpdate.status(TaskStatus.COMPLETED);
        Task updated = update.applyTo(current.copy());

        gateway.update(id, update);
        mirror.put(id, updated);

        log.info("Marked task {} as completed", id);
        return updated.copy();
    }

    @Override
    public void delete(long id) {
        requireTask(id);
        gateway.delete(id);
        mirror.remove(id);
        log.info("Deleted task {}", id);
    }

    @Override
    public Optional<Task> find(long id) {
        return Optional.ofNullable(mirror.get(id)).map(Task::copy);
    }

    @Override
    public Task get(long id) {
        return requireTask(id).copy();
    }

    @Override
    public List<Task> list() {
        return snapshot();
    }

    @Override
    public List<Task> list(TaskFilter filter, SortKey sortKey) {
        return list(filter, sortKey, false);
    }

    @Override
    public List<Task> list(TaskFilter filter, SortKey sortKey, boolean reversed) {
        List<Task> tasks = snapshot();
        if (filter != null && !filter.isEmpty()) {
            tasks = filter.apply(tasks);
        }
        if (sortKey != null) {
            Comparator<Task> comparator = reversed ? sortKey.comparator().reversed() : sortKey.comparator();
            tasks = MergeSort.sort(tasks, comparator);
        }
        log.debug("Listed {} tasks (filter={}, sortKey={}, reversed={})", tasks.size(), filter, sortKey, reversed);
        return tasks;
    }

    @Override
    public int size() {
        return mirror.size();
    }

    private Task requireTask(long id) {
        Task task = mirror.get(id);
        if (task == null) {
            throw new TaskNotFoundException(id);
        }
        return task;
    }

    private List<Task> snapshot() {
        List<Task> copies = new ArrayList<>(mirror.size());
        for (Task task : mirror.values()) {
            copies.add(task.copy());
        }
        return copies;
    }
}
