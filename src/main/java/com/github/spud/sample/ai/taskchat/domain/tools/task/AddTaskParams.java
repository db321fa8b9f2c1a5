package com.github.spud.sample.ai.taskchat.domain.tools.task;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AddTaskParams {

  @NotBlank
  @Size(min = 1, max = 255)
  private String title;

  @Size(max = 1000)
  private String description;

  private Priority priority;

  @Pattern(regexp = TaskDates.DUE_DATE, message = TaskDates.DUE_DATE_MESSAGE)
  private String dueDate;

  @Size(max = 20)
  private List<@NotBlank @Size(max = 50) String> tags;

  private RecurrencePattern recurrencePattern;
}
