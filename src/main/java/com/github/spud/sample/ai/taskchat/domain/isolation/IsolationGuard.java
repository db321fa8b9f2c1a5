package com.github.spud.sample.ai.taskchat.domain.isolation;

import com.github.spud.sample.ai.taskchat.domain.auth.UserContext;
import com.github.spud.sample.ai.taskchat.domain.error.AuthorizationException;
import com.github.spud.sample.ai.taskchat.domain.error.ErrorCode;
import com.github.spud.sample.ai.taskchat.domain.message.ChatMessage;
import com.github.spud.sample.ai.taskchat.domain.tools.ToolCallRequest;
import com.github.spud.sample.ai.taskchat.infrastructure.observability.TraceContext;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Enforces that every read and write is scoped to the authenticated user. Repositories take the
 * user id as a query parameter; this class covers what a query cannot: ownership decisions,
 * caller-supplied identity in tool parameters, and a second filter over loaded rows.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class IsolationGuard {

  /**
   * Parameter keys (normalised: lower case, no separators) that name a user.
   */
  private static final Set<String> IDENTITY_KEYS = Set.of("userid", "ownerid", "owneruserid");

  private final SecurityAuditSink auditSink;
  private final Clock clock;

  /**
   * Reject access to a conversation owned by someone else.
   */
  public void assertOwner(UserContext user, String ownerUserId, String conversationId) {
    if (!user.getUserId().equals(ownerUserId)) {
      audit(ErrorCode.CONVERSATION_NOT_OWNED, user, ownerUserId, conversationId, null,
        "conversation owned by another user");
      throw new AuthorizationException(ErrorCode.CONVERSATION_NOT_OWNED,
        "Conversation not owned by caller");
    }
  }

  /**
   * Screen a whole chain before anything runs: a tool never receives a caller-supplied identity,
   * the dispatcher injects it.
   */
  public void screenToolChain(UserContext user, List<ToolCallRequest> calls) {
    for (ToolCallRequest call : calls) {
      findIdentityValue(call.getParameters()).ifPresent(claimed -> {
        audit(ErrorCode.CROSS_USER_ACCESS, user, claimed, null, call.getName(),
          "tool parameters carry a caller-supplied user identifier");
        throw new AuthorizationException(ErrorCode.CROSS_USER_ACCESS,
          "Tool call " + call.getName() + " supplied a user identifier");
      });
    }
  }

  /**
   * Drop every message not owned by the caller. Anything dropped here slipped past the query
   * filter and is audited.
   */
  public List<ChatMessage> retainOwned(UserContext user, List<ChatMessage> messages) {
    List<ChatMessage> owned = new ArrayList<>(messages.size());
    for (ChatMessage message : messages) {
      if (user.getUserId().equals(message.getUserId())) {
        owned.add(message);
      } else {
        log.error("Foreign message {} filtered from conversation {}", message.getId(),
          message.getConversationId());
        audit(ErrorCode.CROSS_USER_ACCESS, user, message.getUserId(),
          String.valueOf(message.getConversationId()), null,
          "foreign message filtered from history");
      }
    }
    return owned;
  }

  /**
   * Returns the first identity value found at any depth, {@code "<present>"} when the key holds a
   * non-string value.
   */
  static Optional<String> findIdentityValue(Object value) {
    if (value instanceof Map<?, ?> map) {
      for (Map.Entry<?, ?> entry : map.entrySet()) {
        if (entry.getKey() != null && isIdentityKey(entry.getKey().toString())) {
          Object claimed = entry.getValue();
          return Optional.of(claimed instanceof String s ? s : "<present>");
        }
        Optional<String> nested = findIdentityValue(entry.getValue());
        if (nested.isPresent()) {
          return nested;
        }
      }
    } else if (value instanceof Collection<?> items) {
      for (Object item : items) {
        Optional<String> nested = findIdentityValue(item);
        if (nested.isPresent()) {
          return nested;
        }
      }
    }
    return Optional.empty();
  }

  private static boolean isIdentityKey(String key) {
    String normalised = key.replace("_", "").replace("-", "").toLowerCase(Locale.ROOT);
    return IDENTITY_KEYS.contains(normalised);
  }

  private void audit(ErrorCode code, UserContext user, String targetUserId,
    String conversationId, String resource, String detail) {
    auditSink.record(SecurityAuditEvent.builder()
      .code(code)
      .userId(user.getUserId())
      .targetUserId(targetUserId)
      .conversationId(conversationId)
      .resource(resource)
      .detail(detail)
      .traceId(TraceContext.currentTraceId())
      .occurredAt(clock.instant())
      .build());
  }
}
