package com.github.spud.sample.ai.taskchat.domain.error;

public class ConversationNotFoundException extends TaskChatException {

  public ConversationNotFoundException(String message) {
    super(ErrorCode.CONVERSATION_NOT_FOUND, message);
  }
}
