package com.github.spud.sample.ai.taskchat.domain.tools.task;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CompleteTaskParams {

  /**
   * Task id or (part of) its title
   */
  @NotBlank
  @Size(max = 255)
  private String taskIdentifier;

  /**
   * false marks the task pending again
   */
  @Builder.Default
  private Boolean completed = Boolean.TRUE;
}
