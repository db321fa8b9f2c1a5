package com.github.spud.sample.ai.taskchat.domain.tools.task;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Deletes the task matching the identifier, narrowed by the optional filters when the identifier
 * alone is ambiguous.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DeleteTaskParams {

  @NotBlank
  @Size(max = 255)
  private String taskIdentifier;

  private TaskStatusFilter status;

  private Priority priority;

  @Pattern(regexp = TaskDates.DUE_DATE_FILTER, message = TaskDates.DUE_DATE_FILTER_MESSAGE)
  private String dueDate;
}
