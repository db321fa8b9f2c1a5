package com.github.spud.sample.ai.taskchat.application;

import com.fasterxml.jackson.databind.JsonNode;
import com.github.spud.sample.ai.taskchat.domain.tools.CallResult;
import com.github.spud.sample.ai.taskchat.domain.tools.ChainExecutionResult;
import com.github.spud.sample.ai.taskchat.domain.tools.ChainStatus;
import com.github.spud.sample.ai.taskchat.util.JsonUtils;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.springframework.boot.json.JsonParseException;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Builds the assistant text of a turn. Failures are described in plain words with a retry
 * suggestion; error codes and raw error output never reach the text.
 */
@Component
public class ResponseComposer {

  static final String RETRY_SUGGESTION = "Please try again in a moment.";

  static final String NOTHING_TO_DO = "How can I help you with your tasks?";

  private static final int MAX_LISTED_TASKS = 10;

  private static final Map<String, String> FAILURE_PHRASES = Map.of(
    "add_task", "add the task",
    "list_tasks", "load your tasks",
    "complete_task", "update the task status",
    "update_task", "update the task",
    "delete_task", "delete the task");

  private static final Map<String, String> SUCCESS_PHRASES = Map.of(
    "add_task", "The task was added.",
    "list_tasks", "Here are your tasks.",
    "complete_task", "The task status was updated.",
    "update_task", "The task was updated.",
    "delete_task", "The task was deleted.");

  public String compose(TurnPlan plan, ChainExecutionResult chain) {
    String reply = plan.getAssistantReply();
    if (chain.getOverallStatus() == ChainStatus.SUCCESS) {
      if (StringUtils.hasText(reply)) {
        return reply.trim();
      }
      String described = describeSuccesses(chain.getPerCallResults());
      return described.isEmpty() ? NOTHING_TO_DO : described;
    }

    // the upstream reply was written before execution and may claim work that failed
    List<String> parts = new ArrayList<>();
    if (chain.getOverallStatus() == ChainStatus.PARTIAL) {
      String described = describeSuccesses(chain.getPerCallResults());
      if (!described.isEmpty()) {
        parts.add(described);
      }
    }
    parts.add(describeFailures(chain));
    parts.add(RETRY_SUGGESTION);
    return String.join(" ", parts);
  }

  private static String describeFailures(ChainExecutionResult chain) {
    Set<String> phrases = new LinkedHashSet<>();
    for (CallResult result : chain.getPerCallResults()) {
      if (result.isFailed()) {
        phrases.add(phrase(FAILURE_PHRASES, result.getToolName(), "finish one of the steps"));
      }
    }
    if (phrases.isEmpty()) {
      return "Sorry, I couldn't finish everything you asked for.";
    }
    return "Sorry, I couldn't " + joinPhrases(new ArrayList<>(phrases)) + ".";
  }

  private static String describeSuccesses(List<CallResult> results) {
    List<String> sentences = new ArrayList<>();
    for (CallResult result : results) {
      if (result.isSuccess()) {
        sentences.add(describeSuccess(result));
      }
    }
    return String.join(" ", sentences);
  }

  private static String describeSuccess(CallResult result) {
    JsonNode node = parse(result.getResultOrError());
    if (node != null && "list_tasks".equals(result.getToolName())
      && node.path("tasks").isArray()) {
      return describeTasks(node.path("tasks"));
    }
    if (node != null && node.path("message").isTextual()
      && StringUtils.hasText(node.path("message").asText())) {
      return node.path("message").asText().trim();
    }
    return phrase(SUCCESS_PHRASES, result.getToolName(), "Done.");
  }

  private static String describeTasks(JsonNode tasks) {
    if (tasks.isEmpty()) {
      return "You have no tasks.";
    }
    List<String> titles = new ArrayList<>();
    for (JsonNode task : tasks) {
      if (titles.size() == MAX_LISTED_TASKS) {
        break;
      }
      String title = task.path("title").asText("");
      if (!title.isEmpty()) {
        titles.add(task.path("completed").asBoolean(false) ? title + " (done)" : title);
      }
    }
    String noun = tasks.size() == 1 ? "task" : "tasks";
    String listed = titles.isEmpty() ? "" : ": " + String.join(", ", titles);
    String more = tasks.size() > titles.size() && !titles.isEmpty() ? " and more" : "";
    return "You have " + tasks.size() + " " + noun + listed + more + ".";
  }

  private static String phrase(Map<String, String> phrases, String toolName, String fallback) {
    return toolName != null ? phrases.getOrDefault(toolName, fallback) : fallback;
  }

  private static String joinPhrases(List<String> phrases) {
    if (phrases.size() == 1) {
      return phrases.get(0);
    }
    return String.join(", ", phrases.subList(0, phrases.size() - 1)) + " or "
      + phrases.get(phrases.size() - 1);
  }

  private static JsonNode parse(String raw) {
    if (!StringUtils.hasText(raw)) {
      return null;
    }
    try {
      return JsonUtils.readTree(raw);
    } catch (JsonParseException e) {
      return null;
    }
  }
}
