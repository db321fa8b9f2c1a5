package com.github.spud.sample.ai.taskchat.domain.tools.task;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/**
 * Task priority. Accepted case-insensitively, written lower case.
 */
public enum Priority {
  HIGH("high"),
  MEDIUM("medium"),
  LOW("low"),
  NONE("none");

  private final String value;

  Priority(String value) {
    this.value = value;
  }

  @JsonValue
  public String getValue() {
    return value;
  }

  @JsonCreator
  public static Priority from(String value) {
    String normalised = value.trim().toLowerCase(Locale.ROOT);
    for (Priority candidate : values()) {
      if (candidate.value.equals(normalised)) {
        return candidate;
      }
    }
    throw new IllegalArgumentException("Unsupported value: " + value);
  }
}
