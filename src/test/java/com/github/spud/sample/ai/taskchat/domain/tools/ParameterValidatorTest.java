package com.github.spud.sample.ai.taskchat.domain.tools;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

import com.github.spud.sample.ai.taskchat.domain.error.ErrorCode;
import com.github.spud.sample.ai.taskchat.domain.error.ValidationException;
import com.github.spud.sample.ai.taskchat.domain.tools.task.AddTaskParams;
import com.github.spud.sample.ai.taskchat.domain.tools.task.ListTasksParams;
import com.github.spud.sample.ai.taskchat.domain.tools.task.Priority;
import com.github.spud.sample.ai.taskchat.domain.tools.task.TaskStatusFilter;
import com.github.spud.sample.ai.taskchat.domain.tools.task.UpdateTaskParams;
import jakarta.validation.Validation;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ParameterValidatorTest {

  private final ParameterValidator validator =
    new ParameterValidator(Validation.buildDefaultValidatorFactory().getValidator());

  @Test
  void bindsSnakeCaseParametersToTypedObject() {
    AddTaskParams params = validator.validate("add_task", Map.of(
      "title", "buy milk",
      "priority", "HIGH",
      "due_date", "2026-03-01",
      "tags", List.of("home")), AddTaskParams.class);

    assertThat(params.getTitle()).isEqualTo("buy milk");
    assertThat(params.getPriority()).isEqualTo(Priority.HIGH);
    assertThat(params.getDueDate()).isEqualTo("2026-03-01");
    assertThat(params.getTags()).containsExactly("home");
  }

  @Test
  void emptyParametersBindDefaults() {
    ListTasksParams params = validator.validate("list_tasks", Map.of(), ListTasksParams.class);

    assertThat(params.getStatus()).isNull();
  }

  @Test
  void relativeDueDateFilterIsAccepted() {
    ListTasksParams params = validator.validate("list_tasks",
      Map.of("status", "Pending", "due_date", "this_week"), ListTasksParams.class);

    assertThat(params.getStatus()).isEqualTo(TaskStatusFilter.PENDING);
  }

  @Test
  void missingRequiredFieldIsReported() {
    ValidationException error = reject(Map.of("description", "x"), AddTaskParams.class);

    assertThat(error.getCode()).isEqualTo(ErrorCode.INVALID_PARAMETERS);
    assertThat(error.getFieldErrors()).containsKey("title");
  }

  @Test
  void unknownParameterIsReported() {
    ValidationException error = reject(Map.of("title", "x", "colour", "red"),
      AddTaskParams.class);

    assertThat(error.getFieldErrors()).containsEntry("colour", "unknown parameter");
  }

  @Test
  void enumValueOutsideAllowedSetIsReported() {
    ValidationException error = reject(Map.of("title", "x", "priority", "urgent"),
      AddTaskParams.class);

    assertThat(error.getFieldErrors()).containsKey("priority");
  }

  @Test
  void wrongTypeIsReported() {
    ValidationException error = reject(Map.of("title", "x", "tags", Map.of("a", 1)),
      AddTaskParams.class);

    assertThat(error.getFieldErrors()).containsKey("tags");
  }

  @Test
  void constraintViolationUsesSnakeCaseFieldName() {
    ValidationException error = reject(Map.of("title", "x", "due_date", "next friday"),
      AddTaskParams.class);

    assertThat(error.getFieldErrors()).containsKey("due_date");
  }

  @Test
  void updateWithoutAnyChangeIsRejected() {
    ValidationException error = reject(Map.of("task_identifier", "7"), UpdateTaskParams.class);

    assertThat(error.getFieldErrors()).containsEntry("any_field_set",
      "at least one field to update is required");
  }

  @Test
  void overlongTitleIsRejected() {
    ValidationException error = reject(Map.of("title", "x".repeat(256)), AddTaskParams.class);

    assertThat(error.getFieldErrors()).containsKey("title");
  }

  private <T> ValidationException reject(Map<String, Object> parameters, Class<T> type) {
    return catchThrowableOfType(() -> validator.validate("tool", parameters, type),
      ValidationException.class);
  }
}
