package com.github.spud.sample.ai.taskchat.domain.message;

import org.springframework.ai.chat.messages.MessageType;

public enum MessageRole {
  USER,
  ASSISTANT,
  SYSTEM;

  /**
   * Spring AI message type used when the history is handed to a Spring AI reasoning step
   */
  public MessageType toMessageType() {
    return switch (this) {
      case USER -> MessageType.USER;
      case ASSISTANT -> MessageType.ASSISTANT;
      case SYSTEM -> MessageType.SYSTEM;
    };
  }
}
