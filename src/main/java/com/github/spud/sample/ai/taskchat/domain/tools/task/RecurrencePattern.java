package com.github.spud.sample.ai.taskchat.domain.tools.task;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/**
 * How a completed task repeats. Accepted case-insensitively, written lower case.
 */
public enum RecurrencePattern {
  NONE("none"),
  DAILY("daily"),
  WEEKLY("weekly"),
  MONTHLY("monthly"),
  YEARLY("yearly");

  private final String value;

  RecurrencePattern(String value) {
    this.value = value;
  }

  @JsonValue
  public String getValue() {
    return value;
  }

  @JsonCreator
  public static RecurrencePattern from(String value) {
    String normalised = value.trim().toLowerCase(Locale.ROOT);
    for (RecurrencePattern candidate : values()) {
      if (candidate.value.equals(normalised)) {
        return candidate;
      }
    }
    throw new IllegalArgumentException("Unsupported value: " + value);
  }
}
