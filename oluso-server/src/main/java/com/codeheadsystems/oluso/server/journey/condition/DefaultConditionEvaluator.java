package com.codeheadsystems.oluso.server.journey.condition;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Default {@link ConditionEvaluator}.
 * <p>
 * Ordering operators compare numerically when both sides are numbers, then as ISO-8601 dates,
 * then as case-insensitive strings. String operators are case-insensitive. A null field is
 * less than any value.
 */
@Singleton
public class DefaultConditionEvaluator implements ConditionEvaluator {

  private static final Logger log = LoggerFactory.getLogger(DefaultConditionEvaluator.class);

  @Inject
  public DefaultConditionEvaluator() {
  }

  @Override
  public boolean evaluate(List<StepCondition> conditions, ConditionEvaluationContext context) {
    boolean result = true;
    String pending = StepCondition.AND;
    for (StepCondition condition : conditions) {
      boolean current = evaluate(condition, context);
      result = StepCondition.OR.equals(pending) ? result || current : result && current;
      pending = condition.logicalOperator().toLowerCase(Locale.ROOT);
    }
    return result;
  }

  @Override
  public boolean evaluate(StepCondition condition, ConditionEvaluationContext context) {
    boolean result = test(condition, fieldValue(condition.type(), condition.field(), context));
    return condition.negate() != result;
  }

  private boolean test(StepCondition condition, Object value) {
    String expected = condition.value();
    String text = value == null ? null : value.toString();
    switch (ConditionOperator.fromName(condition.operator())) {
      case EQ:
        return compare(value, expected) == 0;
      case NE:
        return compare(value, expected) != 0;
      case GT:
        return compare(value, expected) > 0;
      case LT:
        return compare(value, expected) < 0;
      case GTE:
        return compare(value, expected) >= 0;
      case LTE:
        return compare(value, expected) <= 0;
      case CONTAINS:
        return text != null && lower(text).contains(lower(nullToEmpty(expected)));
      case STARTS_WITH:
        return text != null && lower(text).startsWith(lower(nullToEmpty(expected)));
      case ENDS_WITH:
        return text != null && lower(text).endsWith(lower(nullToEmpty(expected)));
      case EXISTS:
        return value != null;
      case NOT_EXISTS:
        return value == null;
      case EMPTY:
        return text == null || text.isEmpty();
      case NOT_EMPTY:
        return text != null && !text.isEmpty();
      case REGEX:
        return matches(text, expected);
      case IN:
        return isInList(text, expected);
      case NOT_IN:
        return !isInList(text, expected);
      case TRUE:
        return isTruthy(value);
      case FALSE:
        return !isTruthy(value);
      default:
        log.debug("Unknown condition operator '{}' evaluates false", condition.operator());
        return false;
    }
  }

  private static Object fieldValue(String type, String field, ConditionEvaluationContext context) {
    if (type == null || field == null) {
      return null;
    }
    switch (type.toLowerCase(Locale.ROOT)) {
      case "data":
      case "journeydata":
        return context.journeyData().get(field);
      case "claim":
      case "claims":
        return context.claims().get(field);
      case "context":
        return contextValue(field, context);
      case "path":
        return nestedValue(context.journeyData(), field);
      default:
        return null;
    }
  }

  private static Object contextValue(String field, ConditionEvaluationContext context) {
    switch (field.toLowerCase(Locale.ROOT).replace("_", "")) {
      case "userid":
        return context.userId();
      case "tenantid":
        return context.tenantId();
      case "clientid":
        return context.clientId();
      case "isauthenticated":
        return context.userId() != null && !context.userId().isEmpty();
      default:
        return null;
    }
  }

  private static Object nestedValue(Map<String, Object> data, String path) {
    Object current = data;
    for (String part : path.split("\\.")) {
      if (!(current instanceof Map<?, ?> map)) {
        return null;
      }
      current = map.get(part);
      if (current == null) {
        return null;
      }
    }
    return current;
  }

  static int compare(Object left, String right) {
    if (left == null && right == null) {
      return 0;
    }
    if (left == null) {
      return -1;
    }
    if (right == null) {
      return 1;
    }
    String leftText = left.toString();
    Optional<BigDecimal> leftNumber = number(leftText);
    Optional<BigDecimal> rightNumber = number(right);
    if (leftNumber.isPresent() && rightNumber.isPresent()) {
      return leftNumber.get().compareTo(rightNumber.get());
    }
    Optional<Instant> leftDate = date(leftText);
    Optional<Instant> rightDate = date(right);
    if (leftDate.isPresent() && rightDate.isPresent()) {
      return leftDate.get().compareTo(rightDate.get());
    }
    return leftText.compareToIgnoreCase(right);
  }

  private static Optional<BigDecimal> number(String text) {
    try {
      return Optional.of(new BigDecimal(text.trim()));
    } catch (NumberFormatException e) {
      return Optional.empty();
    }
  }

  private static Optional<Instant> date(String text) {
    try {
      return Optional.of(OffsetDateTime.parse(text).toInstant());
    } catch (DateTimeParseException e) {
      // not an offset date-time, try the local forms
    }
    try {
      return Optional.of(LocalDateTime.parse(text).toInstant(ZoneOffset.UTC));
    } catch (DateTimeParseException e) {
      // not a local date-time
    }
    try {
      return Optional.of(LocalDate.parse(text).atStartOfDay().toInstant(ZoneOffset.UTC));
    } catch (DateTimeParseException e) {
      return Optional.empty();
    }
  }

  private static boolean matches(String text, String pattern) {
    if (text == null || text.isEmpty() || pattern == null || pattern.isEmpty()) {
      return false;
    }
    try {
      return Pattern.compile(pattern, Pattern.CASE_INSENSITIVE).matcher(text).find();
    } catch (PatternSyntaxException e) {
      log.warn("Invalid condition pattern '{}': {}", pattern, e.getDescription());
      return false;
    }
  }

  private static boolean isInList(String text, String list) {
    if (text == null || list == null || list.isEmpty()) {
      return false;
    }
    return Arrays.stream(list.split(",")).map(String::trim).anyMatch(item -> item.equalsIgnoreCase(text));
  }

  private static boolean isTruthy(Object value) {
    if (value == null) {
      return false;
    }
    if (value instanceof Boolean b) {
      return b;
    }
    if (value instanceof Number n) {
      return n.doubleValue() != 0;
    }
    if (value instanceof String s) {
      return !s.isEmpty() && !s.equalsIgnoreCase("false") && !s.equals("0");
    }
    return true;
  }

  private static String lower(String value) {
    return value.toLowerCase(Locale.ROOT);
  }

  private static String nullToEmpty(String value) {
    return value == null ? "" : value;
  }
}
