package com.github.spud.sample.ai.taskchat.domain.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.github.spud.sample.ai.taskchat.util.JsonUtils;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.Getter;
import org.springframework.boot.json.JsonParseException;

/**
 * Named outputs of earlier calls in one chain. A string parameter of the exact form
 * {@code ${slot}} or {@code ${slot.path.to.field}} is replaced with the JSON value found there;
 * numeric path segments index into arrays.
 */
public class OutputSlots {

  private static final Pattern REFERENCE =
    Pattern.compile("^\\$\\{([A-Za-z0-9_\\-]+)((?:\\.[A-Za-z0-9_\\-]+)*)}$");

  private final Map<String, JsonNode> slots = new HashMap<>();

  /**
   * Bind a raw tool result. Output that is not JSON is bound as a text value.
   */
  public void bind(String slotName, String rawResult) {
    JsonNode node;
    try {
      node = rawResult != null ? JsonUtils.readTree(rawResult) : TextNode.valueOf("");
    } catch (JsonParseException e) {
      node = TextNode.valueOf(rawResult);
    }
    slots.put(slotName, node == null || node.isMissingNode() ? TextNode.valueOf(rawResult) : node);
  }

  /**
   * Returns a copy of {@code parameters} with every reference replaced.
   *
   * @throws UnresolvedReferenceException when a referenced slot or path does not exist
   */
  public Map<String, Object> resolve(Map<String, Object> parameters) {
    Map<String, Object> resolved = new LinkedHashMap<>();
    if (parameters == null) {
      return resolved;
    }
    for (Map.Entry<String, Object> entry : parameters.entrySet()) {
      resolved.put(entry.getKey(), resolveValue(entry.getValue()));
    }
    return resolved;
  }

  /**
   * Slot names referenced anywhere in {@code parameters}.
   */
  public static Set<String> referencedSlots(Map<String, Object> parameters) {
    Set<String> names = new LinkedHashSet<>();
    collectReferences(parameters, names);
    return names;
  }

  private Object resolveValue(Object value) {
    if (value instanceof String text) {
      Matcher matcher = REFERENCE.matcher(text);
      if (!matcher.matches()) {
        return value;
      }
      return lookup(text, matcher.group(1), matcher.group(2));
    }
    if (value instanceof Map<?, ?> map) {
      Map<Object, Object> copy = new LinkedHashMap<>();
      map.forEach((k, v) -> copy.put(k, resolveValue(v)));
      return copy;
    }
    if (value instanceof Collection<?> items) {
      List<Object> copy = new ArrayList<>(items.size());
      items.forEach(item -> copy.add(resolveValue(item)));
      return copy;
    }
    return value;
  }

  private Object lookup(String reference, String slotName, String path) {
    JsonNode node = slots.get(slotName);
    if (node == null) {
      throw new UnresolvedReferenceException(reference, slotName);
    }
    if (!path.isEmpty()) {
      for (String segment : path.substring(1).split("\\.")) {
        node = node.isArray() && segment.chars().allMatch(Character::isDigit)
          ? node.path(Integer.parseInt(segment))
          : node.path(segment);
        if (node.isMissingNode()) {
          throw new UnresolvedReferenceException(reference, slotName);
        }
      }
    }
    return JsonUtils.objectMapper().convertValue(node, Object.class);
  }

  private static void collectReferences(Object value, Set<String> names) {
    if (value instanceof String text) {
      Matcher matcher = REFERENCE.matcher(text);
      if (matcher.matches()) {
        names.add(matcher.group(1));
      }
    } else if (value instanceof Map<?, ?> map) {
      map.values().forEach(v -> collectReferences(v, names));
    } else if (value instanceof Collection<?> items) {
      items.forEach(item -> collectReferences(item, names));
    }
  }

  @Getter
  public static class UnresolvedReferenceException extends RuntimeException {

    private final String slotName;

    public UnresolvedReferenceException(String reference, String slotName) {
      super("Unresolved output reference " + reference);
      this.slotName = slotName;
    }
  }
}
