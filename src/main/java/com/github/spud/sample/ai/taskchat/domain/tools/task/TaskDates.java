package com.github.spud.sample.ai.taskchat.domain.tools.task;

/**
 * Accepted due date formats.
 */
final class TaskDates {

  /**
   * ISO date, optionally with a time and offset
   */
  static final String DUE_DATE =
    "^\\d{4}-\\d{2}-\\d{2}([T ]\\d{2}:\\d{2}(:\\d{2}(\\.\\d{1,9})?)?(Z|[+-]\\d{2}:?\\d{2})?)?$";

  /**
   * Relative keyword or ISO date, used by filters
   */
  static final String DUE_DATE_FILTER =
    "^(today|tomorrow|this_week|this_month|\\d{4}-\\d{2}-\\d{2})$";

  static final String DUE_DATE_MESSAGE = "must be an ISO date or date-time";

  static final String DUE_DATE_FILTER_MESSAGE =
    "must be today, tomorrow, this_week, this_month or YYYY-MM-DD";

  private TaskDates() {
  }
}
