package com.sailfish.taskman.query;

import com.sailfish.taskman.model.Priority;
import com.sailfish.taskman.model.Task;
import com.sailfish.taskman.model.TaskStatus;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SortKeyTest {

    private static Task task(long id, String due, Priority priority, LocalDateTime createdAt) {
        return new Task(id, "t" + id, "d", LocalDate.parse(due), priority, TaskStatus.PENDING, createdAt);
    }

    private final LocalDateTime base = LocalDateTime.of(2025, 1, 1, 9, 0);
    private final List<Task> tasks = List.of(
            task(1, "2025-01-10", Priority.LOW, base.plusHours(2)),
            task(2, "2025-01-05", Priority.HIGH, base.plusHours(3)),
            task(3, "2025-01-10", Priority.MEDIUM, base),
            task(4, "2025-01-01", Priority.HIGH, base.plusHours(1)));

    @Test
    void dueDateAscending() {
        assertThat(MergeSort.sort(tasks, SortKey.DUE_DATE.comparator()))
                .extracting(Task::getId).containsExactly(4L, 2L, 1L, 3L);
    }

    @Test
    void priorityHighFirstWithTiesInInputOrder() {
        assertThat(MergeSort.sort(tasks, SortKey.PRIORITY.comparator()))
                .extracting(Task::getId).containsExactly(2L, 4L, 3L, 1L);
    }

    @Test
    void createdAtOldestFirst() {
        assertThat(MergeSort.sort(tasks, SortKey.CREATED_AT.comparator()))
                .extracting(Task::getId).containsExactly(3L, 4L, 1L, 2L);
    }
}
