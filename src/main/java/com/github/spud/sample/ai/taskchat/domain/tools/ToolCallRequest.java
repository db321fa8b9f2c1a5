package com.github.spud.sample.ai.taskchat.domain.tools;

import java.util.LinkedHashMap;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.util.StringUtils;

/**
 * One tool invocation decided by the reasoning step, before validation.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ToolCallRequest {

  private String name;

  /**
   * Raw parameters. String values of the form {@code ${slot.path}} reference earlier outputs.
   */
  @Builder.Default
  private Map<String, Object> parameters = new LinkedHashMap<>();

  /**
   * Slot the result is bound to. Defaults to the tool name.
   */
  private String outputName;

  /**
   * Caller asserts this call is side-effect-free and independent of its neighbours.
   */
  private boolean parallelSafe;

  public String slotName() {
    return StringUtils.hasText(outputName) ? outputName : name;
  }
}
