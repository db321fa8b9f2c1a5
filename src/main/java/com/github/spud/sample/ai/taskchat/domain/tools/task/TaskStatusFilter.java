package com.github.spud.sample.ai.taskchat.domain.tools.task;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/**
 * Completion filter of list and delete operations. Accepted case-insensitively, written lower case.
 */
public enum TaskStatusFilter {
  ALL("all"),
  PENDING("pending"),
  COMPLETED("completed");

  private final String value;

  TaskStatusFilter(String value) {
    this.value = value;
  }

  @JsonValue
  public String getValue() {
    return value;
  }

  @JsonCreator
  public static TaskStatusFilter from(String value) {
    String normalised = value.trim().toLowerCase(Locale.ROOT);
    for (TaskStatusFilter candidate : values()) {
      if (candidate.value.equals(normalised)) {
        return candidate;
      }
    }
    throw new IllegalArgumentException("Unsupported value: " + value);
  }
}
