package com.github.spud.sample.ai.taskchat.domain.tools;

import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.exc.InvalidFormatException;
import com.fasterxml.jackson.databind.exc.MismatchedInputException;
import com.fasterxml.jackson.databind.exc.UnrecognizedPropertyException;
import com.github.spud.sample.ai.taskchat.domain.error.ErrorCode;
import com.github.spud.sample.ai.taskchat.domain.error.ValidationException;
import com.github.spud.sample.ai.taskchat.util.JsonUtils;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Binds raw tool parameters to the tool's typed parameter class and runs its bean validation
 * constraints. Unknown keys, wrong types and enum values outside the allowed set fail binding.
 */
@Component
@RequiredArgsConstructor
public class ParameterValidator {

  private final Validator validator;

  public <T> T validate(String toolName, Map<String, Object> parameters, Class<T> type) {
    T bound;
    try {
      bound = JsonUtils.toolMapper().convertValue(parameters, type);
    } catch (IllegalArgumentException e) {
      throw invalid(toolName, bindingErrors(e));
    }
    if (bound == null) {
      throw invalid(toolName, Map.of("parameters", "must not be null"));
    }

    Set<ConstraintViolation<T>> violations = validator.validate(bound);
    if (!violations.isEmpty()) {
      Map<String, String> fieldErrors = violations.stream()
        .collect(Collectors.toMap(
          v -> snakeCase(v.getPropertyPath().toString()),
          ConstraintViolation::getMessage,
          (first, second) -> first,
          LinkedHashMap::new));
      throw invalid(toolName, fieldErrors);
    }
    return bound;
  }

  private static Map<String, String> bindingErrors(IllegalArgumentException e) {
    Throwable cause = e.getCause();
    if (cause instanceof UnrecognizedPropertyException unknown) {
      return Map.of(unknown.getPropertyName(), "unknown parameter");
    }
    if (cause instanceof InvalidFormatException format) {
      return Map.of(fieldOf(format), "invalid value '" + format.getValue() + "'");
    }
    if (cause instanceof MismatchedInputException mismatch) {
      return Map.of(fieldOf(mismatch), "wrong type");
    }
    if (cause instanceof JsonMappingException mapping && !mapping.getPath().isEmpty()) {
      return Map.of(fieldOf(mapping), "invalid value");
    }
    return Map.of("parameters", "malformed");
  }

  private static String fieldOf(JsonMappingException e) {
    return e.getPath().stream()
      .map(ref -> ref.getFieldName() != null ? ref.getFieldName() : "[" + ref.getIndex() + "]")
      .collect(Collectors.joining("."));
  }

  private static String snakeCase(String propertyPath) {
    return propertyPath.replaceAll("([a-z0-9])([A-Z])", "$1_$2").toLowerCase();
  }

  private static ValidationException invalid(String toolName, Map<String, String> fieldErrors) {
    return new ValidationException(ErrorCode.INVALID_PARAMETERS,
      "Invalid parameters for " + toolName + ": " + fieldErrors, fieldErrors);
  }
}
