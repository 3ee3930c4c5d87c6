package com.sailfish.taskman.model;

import com.sailfish.taskman.exception.TaskValidationException;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TaskFieldsTest {

    @Test
    void toUpdateCarriesOnlySuppliedFields() {
        TaskUpdate update = TaskFields.builder()
                .priority("low")
                .dueDate("2025-03-01")
                .build()
                .toUpdate();

        assertThat(update.priority()).contains(Priority.LOW);
        assertThat(update.dueDate()).contains(LocalDate.of(2025, 3, 1));
        assertThat(update.title()).isEmpty();
        assertThat(update.description()).isEmpty();
        assertThat(update.status()).isEmpty();
    }

    @Test
    void toUpdateWithNothingSuppliedIsEmpty() {
        assertThat(TaskFields.builder().build().toUpdate().isEmpty()).isTrue();
    }

    @Test
    void toUpdateRejectsSuppliedBlankTitle() {
        assertThatThrownBy(() -> TaskFields.builder().title(" ").build().toUpdate())
                .isInstanceOf(TaskValidationException.class)
                .hasMessage("Title cannot be empty");
    }

    @Test
    void toNewTaskRequiresAllMandatoryFields() {
        TaskFields missingDescription = TaskFields.builder()
                .title("t")
                .dueDate("2025-03-01")
                .priority("High")
                .build();

        assertThatThrownBy(() -> missingDescription.toNewTask(LocalDateTime.now()))
                .isInstanceOf(TaskValidationException.class)
                .hasMessage("Description cannot be empty");
    }

    @Test
    void applyToUpdatesTaskThroughSetters() {
        Task task = Task.of("t", "d", "2025-01-03", "Medium", null, LocalDateTime.of(2025, 1, 1, 0, 0));

        TaskFields.builder().title("new title").status("completed").build().toUpdate().applyTo(task);

        assertThat(task.getTitle()).isEqualTo("new title");
        assertThat(task.getStatus()).isEqualTo(TaskStatus.COMPLETED);
        assertThat(task.getDescription()).isEqualTo("d");
    }
}
