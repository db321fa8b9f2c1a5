package com.github.spud.sample.ai.taskchat.infrastructure.observability;

import com.github.spud.sample.ai.taskchat.domain.isolation.SecurityAuditEvent;
import com.github.spud.sample.ai.taskchat.domain.isolation.SecurityAuditSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Default audit sink: one structured line per event on the {@code SECURITY_AUDIT} logger, which
 * the log pipeline routes to the audit store.
 */
@Component
public class LoggingSecurityAuditSink implements SecurityAuditSink {

  private static final Logger AUDIT = LoggerFactory.getLogger("SECURITY_AUDIT");

  @Override
  public void record(SecurityAuditEvent event) {
    AUDIT.warn("code={} userId={} targetUserId={} conversationId={} resource={} traceId={} "
        + "at={} detail={}",
      event.getCode(), event.getUserId(), event.getTargetUserId(), event.getConversationId(),
      event.getResource(), event.getTraceId(), event.getOccurredAt(), event.getDetail());
  }
}
