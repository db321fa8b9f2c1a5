package com.github.spud.sample.ai.taskchat.domain.message;

import com.github.spud.sample.ai.taskchat.infrastructure.persistence.entity.ConversationMessage;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.stereotype.Component;

/**
 * Mapper for converting between domain messages, persistence entities, and Spring AI messages
 */
@Component
public class ChatMessageMapper {

  /**
   * Convert domain message to persistence entity
   */
  public ConversationMessage toEntity(ChatMessage domain) {
    ConversationMessage entity = new ConversationMessage();
    entity.setId(domain.getId());
    entity.setConversationId(domain.getConversationId());
    entity.setUserId(domain.getUserId());
    entity.setRole(domain.getRole());
    entity.setContent(domain.getContent() != null ? domain.getContent() : "");
    entity.setToolCalls(
      domain.getToolCalls() != null ? new ArrayList<>(domain.getToolCalls()) : null);
    entity.setCreatedAt(toOffset(domain.getCreatedAt()));
    return entity;
  }

  /**
   * Convert persistence entity to domain message
   */
  public ChatMessage toDomain(ConversationMessage entity) {
    return ChatMessage.builder()
      .id(entity.getId())
      .conversationId(entity.getConversationId())
      .userId(entity.getUserId())
      .role(entity.getRole())
      .content(entity.getContent())
      .toolCalls(entity.getToolCalls() != null ? new ArrayList<>(entity.getToolCalls()) : null)
      .seq(entity.getSeq())
      .createdAt(toInstant(entity.getCreatedAt()))
      .build();
  }

  /**
   * Convert entity list to domain list
   */
  public List<ChatMessage> toDomainList(List<ConversationMessage> entities) {
    List<ChatMessage> domains = new ArrayList<>(entities.size());
    for (ConversationMessage entity : entities) {
      domains.add(toDomain(entity));
    }
    return domains;
  }

  /**
   * Convert domain messages to Spring AI messages (for a Spring AI based reasoning step)
   */
  public List<Message> toSpringMessages(List<ChatMessage> domains) {
    List<Message> messages = new ArrayList<>(domains.size());
    for (ChatMessage domain : domains) {
      messages.add(toSpringMessage(domain));
    }
    return messages;
  }

  public Message toSpringMessage(ChatMessage domain) {
    return switch (domain.getRole()) {
      case USER -> new UserMessage(domain.getContent());
      case ASSISTANT -> new AssistantMessage(domain.getContent());
      case SYSTEM -> new SystemMessage(domain.getContent());
    };
  }

  public static OffsetDateTime toOffset(Instant instant) {
    return instant != null ? instant.atOffset(ZoneOffset.UTC) : null;
  }

  public static Instant toInstant(OffsetDateTime dateTime) {
    return dateTime != null ? dateTime.toInstant() : null;
  }
}
