package com.sailfish.taskman.repository;

import com.sailfish.taskman.exception.TaskNotFoundException;
import com.sailfish.taskman.exception.TaskStoreException;
import com.sailfish.taskman.exception.TaskValidationException;
import com.sailfish.taskman.model.Task;
import com.sailfish.taskman.model.TaskRecord;
import com.sailfish.taskman.model.TaskUpdate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import jakarta.persistence.EntityManager;
import jakarta.persistence.EntityManagerFactory;
import jakarta.persistence.EntityTransaction;
import jakarta.persistence.PersistenceException;
import jakarta.persistence.Query;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * JPA implementation of the {@link TaskGateway}.
 *
 * <p>Each call opens its own {@link EntityManager} and, for writes, its own resource-local
 * transaction, so every operation is one atomic statement. On failure the transaction is rolled
 * back and the cause is rethrown as a {@link TaskStoreException}.
 */
public class JpaTaskGateway implements TaskGateway {

    private static final Logger log = LoggerFactory.getLogger(JpaTaskGateway.class);

    static final String CREATE_TABLE_SQL =
            "CREATE TABLE IF NOT EXISTS tasks (" +
            "task_id INT AUTO_INCREMENT PRIMARY KEY, " +
            "title VARCHAR(255) NOT NULL, " +
            "description TEXT NOT NULL, " +
            "due_date DATE NOT NULL, " +
            "priority ENUM('Low', 'Medium', 'High') NOT NULL, " +
            "status ENUM('Pending', 'In Progress', 'Completed') NOT NULL DEFAULT 'Pending', " +
            "created_at TIMESTAMP NOT NULL DEFAULT CURRENT_TIMESTAMP, " +
            "INDEX idx_status (status), " +
            "INDEX idx_due_date (due_date), " +
            "INDEX idx_priority (priority))";

    private final EntityManagerFactory entityManagerFactory;

    public JpaTaskGateway(EntityManagerFactory entityManagerFactory) {
        this.entityManagerFactory = Objects.requireNonNull(entityManagerFactory, "entityManagerFactory cannot be null");
    }

    @Override
    public void ensureSchema() {
        inTransaction("ensure schema", em -> em.createNativeQuery(CREATE_TABLE_SQL).executeUpdate());
        log.info("Table 'tasks' created/verified");
    }

    @Override
    public long insert(Task task) {
        Objects.requireNonNull(task, "task cannot be null");
        if (task.getId() != null) {
            throw new IllegalArgumentException("Task already has ID " + task.getId());
        }
        TaskRecord record = TaskRecord.fromTask(task);
        inTransaction("insert task", em -> {
            em.persist(record);
            return null;
        });
        if (record.getId() == null) {
            throw new TaskStoreException("Store did not return a generated ID for task '" + task.getTitle() + "'");
        }
        log.debug("Persisted new TaskRecord with ID: {}", record.getId());
        return record.getId();
    }

    @Override
    public void update(long id, TaskUpdate update) {
        Objects.requireNonNull(update, "update cannot be null");
        if (update.isEmpty()) {
            log.debug("Empty update for task ID {}, nothing to do", id);
            return;
        }

        // Assignments come from this fixed set of attribute names; values are always bound.
        Map<String, Object> assignments = new LinkedHashMap<>();
        update.title().ifPresent(v -> assignments.put("title", v));
        update.description().ifPresent(v -> assignments.put("description", v));
        update.dueDate().ifPresent(v -> assignments.put("dueDate", v));
        update.priority().ifPresent(v -> assignments.put("priority", v));
        update.status().ifPresent(v -> assignments.put("status", v));

        List<String> setClauses = new ArrayList<>(assignments.size());
        for (String attribute : assignments.keySet()) {
            setClauses.add("t." + attribute + " = :" + attribute);
        }
        String jpql = "UPDATE TaskRecord t SET " + String.join(", ", setClauses) + " WHERE t.id = :id";

        int updatedCount = inTransaction("update task " + id, em -> {
            Query query = em.createQuery(jpql);
            assignments.forEach(query::setParameter);
            query.setParameter("id", id);
            return query.executeUpdate();
        });

        if (updatedCount == 0) {
            log.warn("Attempted to update non-existent task ID {}", id);
            throw new TaskNotFoundException(id);
        }
        log.debug("Updated task ID {} with {}", id, update);
    }

    @Override
    public void delete(long id) {
        int deletedCount = inTransaction("delete task " + id, em ->
                em.createQuery("DELETE FROM TaskRecord t WHERE t.id = :id")
                        .setParameter("id", id)
                        .executeUpdate());

        if (deletedCount == 0) {
            log.warn("Attempted to delete non-existent task ID {}", id);
            throw new TaskNotFoundException(id);
        }
        log.debug("Deleted task ID {}", id);
    }

    @Override
    public Optional<Task> findById(long id) {
        TaskRecord record = read("find task " + id, em -> em.find(TaskRecord.class, id));
        return Optional.ofNullable(record).map(this::toTask);
    }

    @Override
    public List<Task> loadAll() {
        List<TaskRecord> records = read("load tasks", em ->
                em.createQuery("SELECT t FROM TaskRecord t ORDER BY t.id", TaskRecord.class)
                        .getResultList());

        List<Task> tasks = new ArrayList<>(records.size());
        for (TaskRecord record : records) {
            tasks.add(toTask(record));
        }
        log.debug("Loaded {} tasks from the store", tasks.size());
        return tasks;
    }

    private Task toTask(TaskRecord record) {
        try {
            return record.toTask();
        } catch (TaskValidationException e) {
            throw new TaskStoreException("Stored row for task ID " + record.getId()
                    + " does not match the task schema: " + e.getMessage(), e);
        }
    }

    private <R> R read(String operation, Function<EntityManager, R> work) {
        EntityManager em = null;
        try {
            em = entityManagerFactory.createEntityManager();
            return work.apply(em);
        } catch (PersistenceException | IllegalStateException e) {
            log.error("Failed to {}: {}", operation, e.getMessage(), e);
            throw new TaskStoreException("Failed to " + operation + ": " + e.getMessage(), e);
        } finally {
            if (em != null) {
                em.close();
            }
        }
    }

    private <R> R inTransaction(String operation, Function<EntityManager, R> work) {
        EntityManager em = null;
        EntityTransaction tx = null;
        try {
            em = entityManagerFactory.createEntityManager();
            tx = em.getTransaction();
            tx.begin();
            R result = work.apply(em);
            tx.commit();
            return result;
        } catch (PersistenceException | IllegalStateException e) {
            rollbackQuietly(tx, e);
            log.error("Failed to {}: {}", operation, e.getMessage(), e);
            throw new TaskStoreException("Failed to " + operation + ": " + e.getMessage(), e);
        } finally {
            if (em != null) {
                em.close();
            }
        }
    }

    private void rollbackQuietly(EntityTransaction tx, Exception cause) {
        if (tx == null || !tx.isActive()) {
            return;
        }
        try {
            tx.rollback();
        } catch (PersistenceException rollbackFailure) {
            cause.addSuppressed(rollbackFailure);
            log.warn("Rollback failed: {}", rollbackFailure.getMessage());
        }
    }
}
