package com.github.spud.sample.ai.taskchat.domain.tools.task;

/**
 * External task CRUD store. Every operation is scoped to {@code userId}; writes carrying the same
 * idempotency key take effect at most once.
 */
public interface TaskStore {

  /**
   * @param idempotencyKey null for read-only operations
   * @return the store's JSON result
   * @throws TaskStoreException when the store rejects or fails the operation
   */
  String execute(String userId, TaskOperation operation, Object parameters,
    String idempotencyKey);
}
