package com.github.spud.sample.ai.taskchat.domain.tools.task;

import com.github.spud.sample.ai.taskchat.domain.tools.ToolExecutionService;
import com.github.spud.sample.ai.taskchat.util.JsonUtils;
import java.util.Map;
import org.springframework.ai.chat.model.ToolContext;
import org.springframework.ai.tool.ToolCallback;
import org.springframework.ai.tool.definition.ToolDefinition;
import org.springframework.util.StringUtils;

/**
 * Tool callback forwarding one {@link TaskOperation} to the {@link TaskStore}. The user comes from
 * the {@link ToolContext} injected by the dispatcher, never from the tool input.
 */
public class TaskToolCallback implements ToolCallback {

  private final ToolDefinition definition;
  private final TaskOperation operation;
  private final TaskStore taskStore;

  public TaskToolCallback(ToolDefinition definition, TaskOperation operation,
    TaskStore taskStore) {
    this.definition = definition;
    this.operation = operation;
    this.taskStore = taskStore;
  }

  @Override
  public ToolDefinition getToolDefinition() {
    return definition;
  }

  @Override
  public String call(String toolInput) {
    throw new IllegalStateException(operation.getToolName() + " requires a user bound context");
  }

  @Override
  public String call(String toolInput, ToolContext toolContext) {
    Map<String, Object> context = toolContext != null ? toolContext.getContext() : Map.of();
    Object userId = context.get(ToolExecutionService.USER_ID);
    if (!(userId instanceof String user) || !StringUtils.hasText(user)) {
      throw new IllegalStateException(operation.getToolName() + " requires a user bound context");
    }
    Object parameters = JsonUtils.fromToolJson(toolInput, operation.getParametersType());
    String idempotencyKey = operation.isIdempotent()
      ? (String) context.get(ToolExecutionService.IDEMPOTENCY_KEY)
      : null;
    return taskStore.execute(user, operation, parameters, idempotencyKey);
  }
}
