package com.sailfish.taskman.model;

import jakarta.persistence.*;
import java.io.Serializable;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Objects;

/**
 * Represents one row of the {@code tasks} table.
 *
 * <p>This is the persistence shape only; validation lives in {@link Task}. Use
 * {@link #fromTask(Task)} and {@link #toTask()} to move between the two.
 */
@Entity
@Table(name = "tasks", indexes = {
    @Index(name = "idx_status", columnList = "status"),
    @Index(name = "idx_due_date", columnList = "due_date"),
    @Index(name = "idx_priority", columnList = "priority")
})
public class TaskRecord implements Serializable {

    private static final long serialVersionUID = 1L;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "task_id")
    private Long id;

    @Column(name = "title", nullable = false, length = 255)
    private String title;

    @Column(name = "description", nullable = false)
    private String description;

    @Column(name = "due_date", nullable = false)
    private LocalDate dueDate;

    @Convert(converter = PriorityConverter.class)
    @Column(name = "priority", nullable = false)
    private Priority priority;

    @Convert(converter = TaskStatusConverter.class)
    @Column(name = "status", nullable = false)
    private TaskStatus status;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = LocalDateTime.now();
        }
        if (status == null) {
            status = TaskStatus.PENDING;
        }
    }

    /**
     * Copies an unsaved task into a new record. The id is left for the store to generate.
     */
    public static TaskRecord fromTask(Task task) {
        TaskRecord record = new TaskRecord();
        record.setTitle(task.getTitle());
        record.setDescription(task.getDescription());
        record.setDueDate(task.getDueDate());
        record.setPriority(task.getPriority());
        record.setStatus(task.getStatus());
        record.setCreatedAt(task.getCreatedAt());
        return record;
    }

    /**
     * Rebuilds the validated domain task.
     *
     * @throws com.sailfish.taskman.exception.TaskValidationException if the row holds invalid data
     */
    public Task toTask() {
        return new Task(id, title, description, dueDate, priority, status, createdAt);
    }

    public Long getId() {
        return id;
    }

    public void setId(Long id) {
        this.id = id;
    }

    public String getTitle() {
        return title;
    }

    public void setTitle(String title) {
        this.title = title;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public LocalDate getDueDate() {
        return dueDate;
    }

    public void setDueDate(LocalDate dueDate) {
        this.dueDate = dueDate;
    }

    public Priority getPriority() {
        return priority;
    }

    public void setPriority(Priority priority) {
        this.priority = priority;
    }

    public TaskStatus getStatus() {
        return status;
    }

    public void setStatus(TaskStatus status) {
        this.status = status;
    }

    public LocalDateTime getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(LocalDateTime createdAt) {
        this.createdAt = createdAt;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        TaskRecord that = (TaskRecord) o;
        return Objects.equals(id, that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "TaskRecord{" +
               "id=" + id +
               ", title='" + title + '\'' +
               ", dueDate=" + dueDate +
               ", priority=" + priority +
               ", status=" + status +
               ", createdAt=" + createdAt +
               '}';
    }
}
