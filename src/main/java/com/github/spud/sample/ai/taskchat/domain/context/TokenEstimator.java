package com.github.spud.sample.ai.taskchat.domain.context;

import com.github.spud.sample.ai.taskchat.application.config.ContextWindowProperties;
import com.github.spud.sample.ai.taskchat.domain.message.ChatMessage;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Character-count heuristic. Every message costs at least one token.
 */
@Component
@RequiredArgsConstructor
public class TokenEstimator {

  private final ContextWindowProperties properties;

  public int estimate(ChatMessage message) {
    return estimate(message.getContent());
  }

  public int estimate(String content) {
    int charsPerToken = Math.max(1, properties.getCharsPerToken());
    int length = content != null ? content.length() : 0;
    return Math.max(1, (length + charsPerToken - 1) / charsPerToken);
  }
}
