package com.github.spud.sample.ai.taskchat.domain.isolation;

/**
 * Write-only target for security audit events. Implementations must not throw.
 */
public interface SecurityAuditSink {

  void record(SecurityAuditEvent event);
}
