package com.github.spud.sample.ai.taskchat.domain.tools;

import java.util.List;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

@Getter
@Builder
@ToString
public class ChainExecutionResult {

  /**
   * One entry per requested call, in request order
   */
  private final List<CallResult> perCallResults;

  /**
   * Every attempt of every call, ordered by call index then attempt number
   */
  private final List<ToolInvocationRecord> records;

  private final ChainStatus overallStatus;

  private final List<String> failedToolNames;

  /**
   * The turn deadline passed before the chain finished
   */
  private final boolean deadlineExceeded;

  public static ChainExecutionResult empty() {
    return ChainExecutionResult.builder()
      .perCallResults(List.of())
      .records(List.of())
      .overallStatus(ChainStatus.SUCCESS)
      .failedToolNames(List.of())
      .build();
  }
}
