package com.github.spud.sample.ai.taskchat.domain.tools.task;

import com.github.spud.sample.ai.taskchat.domain.tools.ToolRegistry;
import com.github.spud.sample.ai.taskchat.domain.tools.ToolRegistry.Registration;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.tool.definition.DefaultToolDefinition;
import org.springframework.ai.tool.definition.ToolDefinition;
import org.springframework.context.annotation.Configuration;

/**
 * 任务工具配置 注册五个任务工具及其输入 Schema
 */
@Slf4j
@Configuration
@RequiredArgsConstructor
public class TaskToolsConfig {

  private final ToolRegistry toolRegistry;
  private final TaskStore taskStore;

  @PostConstruct
  public void registerTaskTools() {
    log.info("Registering task tools...");

    register(TaskOperation.ADD,
      "Create a new task for the user.",
      """
        {
            "type": "object",
            "properties": {
                "title": {"type": "string", "minLength": 1, "maxLength": 255},
                "description": {"type": "string", "maxLength": 1000},
                "priority": {"type": "string", "enum": ["high", "medium", "low", "none"]},
                "due_date": {"type": "string", "description": "ISO date or date-time"},
                "tags": {"type": "array", "items": {"type": "string", "maxLength": 50}},
                "recurrence_pattern": {
                    "type": "string",
                    "enum": ["none", "daily", "weekly", "monthly", "yearly"]
                }
            },
            "required": ["title"],
            "additionalProperties": false
        }
        """);

    register(TaskOperation.LIST,
      "List the user's tasks, optionally filtered by status, priority or due date.",
      """
        {
            "type": "object",
            "properties": {
                "status": {"type": "string", "enum": ["all", "pending", "completed"]},
                "priority": {"type": "string", "enum": ["high", "medium", "low", "none"]},
                "due_date": {
                    "type": "string",
                    "description": "today, tomorrow, this_week, this_month or YYYY-MM-DD"
                }
            },
            "additionalProperties": false
        }
        """);

    register(TaskOperation.COMPLETE,
      "Mark a task as completed, or pending again with completed=false.",
      """
        {
            "type": "object",
            "properties": {
                "task_identifier": {"type": "string", "description": "Task id or title"},
                "completed": {"type": "boolean"}
            },
            "required": ["task_identifier"],
            "additionalProperties": false
        }
        """);

    register(TaskOperation.UPDATE,
      "Update the title, description, priority, due date, tags or recurrence of a task.",
      """
        {
            "type": "object",
            "properties": {
                "task_identifier": {"type": "string", "description": "Task id or title"},
                "title": {"type": "string", "minLength": 1, "maxLength": 255},
                "description": {"type": "string", "maxLength": 1000},
                "priority": {"type": "string", "enum": ["high", "medium", "low", "none"]},
                "due_date": {"type": "string", "description": "ISO date or date-time"},
                "tags": {"type": "array", "items": {"type": "string", "maxLength": 50}},
                "recurrence_pattern": {
                    "type": "string",
                    "enum": ["none", "daily", "weekly", "monthly", "yearly"]
                }
            },
            "required": ["task_identifier"],
            "additionalProperties": false
        }
        """);

    register(TaskOperation.DELETE,
      "Delete a task. Filters narrow the match when the identifier is ambiguous.",
      """
        {
            "type": "object",
            "properties": {
                "task_identifier": {"type": "string", "description": "Task id or title"},
                "status": {"type": "string", "enum": ["all", "pending", "completed"]},
                "priority": {"type": "string", "enum": ["high", "medium", "low", "none"]},
                "due_date": {
                    "type": "string",
                    "description": "today, tomorrow, this_week, this_month or YYYY-MM-DD"
                }
            },
            "required": ["task_identifier"],
            "additionalProperties": false
        }
        """);

    log.info("Task tools registered: {}", toolRegistry.size());
  }

  private void register(TaskOperation operation, String description, String inputSchema) {
    ToolDefinition def = DefaultToolDefinition.builder()
      .name(operation.getToolName())
      .description(description)
      .inputSchema(inputSchema)
      .build();

    toolRegistry.register(Registration.builder()
      .definition(def)
      .callback(new TaskToolCallback(def, operation, taskStore))
      .parametersType(operation.getParametersType())
      .idempotent(operation.isIdempotent())
      .readOnly(operation.isReadOnly())
      .build());
  }
}
