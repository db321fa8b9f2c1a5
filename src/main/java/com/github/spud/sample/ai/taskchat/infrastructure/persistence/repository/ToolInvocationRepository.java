package com.github.spud.sample.ai.taskchat.infrastructure.persistence.repository;

import com.github.spud.sample.ai.taskchat.infrastructure.persistence.entity.ToolInvocation;
import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface ToolInvocationRepository extends JpaRepository<ToolInvocation, UUID> {

  List<ToolInvocation> findByConversationIdAndUserIdOrderByStartedAtAsc(UUID conversationId,
    String userId);
}
