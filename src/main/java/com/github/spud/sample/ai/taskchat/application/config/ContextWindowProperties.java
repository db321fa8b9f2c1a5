package com.github.spud.sample.ai.taskchat.application.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration for message history loading behavior
 */
@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "taskchat.context")
public class ContextWindowProperties {

  /**
   * Maximum number of historical messages handed to the reasoning step per turn
   */
  private int maxMessages = 50;

  /**
   * Context limit of the model behind the reasoning step, in estimated tokens
   */
  private int modelTokenLimit = 8000;

  /**
   * Share of the model limit kept free for the response
   */
  private double responseReserveRatio = 0.2;

  /**
   * Token estimate heuristic: one token per this many characters
   */
  private int charsPerToken = 4;

  /**
   * When the token budget drops more messages than this, the dropped span is replaced by one
   * synthetic summary message. Set to -1 to always truncate silently.
   */
  private int summaryThreshold = 10;

  public int usableTokenBudget() {
    return (int) Math.floor(modelTokenLimit * (1.0 - responseReserveRatio));
  }
}
