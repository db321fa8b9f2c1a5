package com.github.spud.sample.ai.taskchat.domain.tools.task;

import jakarta.validation.constraints.Pattern;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ListTasksParams {

  private TaskStatusFilter status;

  private Priority priority;

  @Pattern(regexp = TaskDates.DUE_DATE_FILTER, message = TaskDates.DUE_DATE_FILTER_MESSAGE)
  private String dueDate;
}
