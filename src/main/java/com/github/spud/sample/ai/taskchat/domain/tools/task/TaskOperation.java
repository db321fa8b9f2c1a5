package com.github.spud.sample.ai.taskchat.domain.tools.task;

import lombok.Getter;

/**
 * Task store operations exposed as tools.
 */
@Getter
public enum TaskOperation {

  ADD("add_task", "add", AddTaskParams.class, true, false),
  LIST("list_tasks", "list", ListTasksParams.class, false, true),
  COMPLETE("complete_task", "complete", CompleteTaskParams.class, true, false),
  UPDATE("update_task", "update", UpdateTaskParams.class, true, false),
  DELETE("delete_task", "delete", DeleteTaskParams.class, true, false);

  private final String toolName;

  /**
   * Path segment of the store endpoint
   */
  private final String operation;

  private final Class<?> parametersType;

  private final boolean idempotent;

  private final boolean readOnly;

  TaskOperation(String toolName, String operation, Class<?> parametersType, boolean idempotent,
    boolean readOnly) {
    this.toolName = toolName;
    this.operation = operation;
    this.parametersType = parametersType;
    this.idempotent = idempotent;
    this.readOnly = readOnly;
  }
}
