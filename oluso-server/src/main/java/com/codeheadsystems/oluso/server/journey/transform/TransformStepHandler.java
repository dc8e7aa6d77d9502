package com.codeheadsystems.oluso.server.journey.transform;

import com.codeheadsystems.oluso.model.OidcConstants;
import com.codeheadsystems.oluso.server.journey.StepExecutionContext;
import com.codeheadsystems.oluso.server.journey.StepHandler;
import com.codeheadsystems.oluso.server.journey.StepHandlerResult;
import com.fasterxml.jackson.core.type.TypeReference;
import java.net.URLDecoder;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The {@code transform} step: computes values from journey data, user input and step
 * configuration and writes them back into the journey data.
 * <p>
 * Rules run in order and independently. A failing required rule fails the step with
 * {@code transform_failed}; a failing optional rule is logged and skipped. A rule that yields
 * null writes nothing.
 */
@Singleton
public class TransformStepHandler implements StepHandler {

  public static final String STEP_TYPE = "transform";

  private static final Logger log = LoggerFactory.getLogger(TransformStepHandler.class);
  private static final TypeReference<List<TransformRule>> RULES = new TypeReference<>() {
  };

  @Inject
  public TransformStepHandler() {
  }

  @Override
  public String stepType() {
    return STEP_TYPE;
  }

  @Override
  public StepHandlerResult execute(StepExecutionContext context) {
    List<TransformRule> rules;
    try {
      rules = context.setting("transforms", RULES).orElse(List.of());
    } catch (IllegalArgumentException e) {
      log.warn("Transform step {} has an unreadable rule list: {}", context.stepId(), e.getMessage());
      return StepHandlerResult.fail(OidcConstants.Errors.TRANSFORM_FAILED, "Invalid transform configuration");
    }
    if (rules.isEmpty()) {
      log.warn("Transform step {} has no transforms defined, skipping", context.stepId());
      return StepHandlerResult.skip();
    }

    Map<String, Object> outputData = new LinkedHashMap<>();
    for (TransformRule rule : rules) {
      if (rule.outputKey() == null || rule.outputKey().isBlank()) {
        log.warn("Transform step {} has a {} rule without an output key, skipping it",
            context.stepId(), rule.type());
        continue;
      }
      try {
        String result = apply(rule, context);
        if (result != null) {
          outputData.put(rule.outputKey(), result);
          context.journeyData().put(rule.outputKey(), result);
          log.trace("Transform {}: {} -> {}", rule.transformType(), rule.inputKey(), rule.outputKey());
        }
      } catch (RuntimeException e) {
        log.warn("Transform failed for {}: {}", rule.outputKey(), e.getMessage());
        if (rule.required()) {
          return StepHandlerResult.fail(OidcConstants.Errors.TRANSFORM_FAILED,
              "Required transform for " + rule.outputKey() + " failed");
        }
      }
    }
    return StepHandlerResult.success(outputData);
  }

  String apply(TransformRule rule, StepExecutionContext context) {
    TransformType type = rule.transformType();
    String input = input(rule, context);
    if (input == null && !type.ignoresInput()) {
      return rule.defaultValue();
    }
    switch (type) {
      case COPY:
        return input;
      case CONSTANT:
        return rule.constantValue();
      case UPPERCASE:
        return input.toUpperCase(Locale.ROOT);
      case LOWERCASE:
        return input.toLowerCase(Locale.ROOT);
      case TRIM:
        return input.trim();
      case HASH:
        return hash(input, rule.hashAlgorithm());
      case PREFIX:
        return nullToEmpty(rule.prefix()) + input;
      case SUFFIX:
        return input + nullToEmpty(rule.suffix());
      case REPLACE:
        return replace(input, rule.find(), rule.replaceWith());
      case REGEX_REPLACE:
        return isEmpty(input) || isEmpty(rule.pattern())
            ? input
            : Pattern.compile(rule.pattern()).matcher(input).replaceAll(nullToEmpty(rule.replaceWith()));
      case REGEX_MATCH:
        return isEmpty(input) || isEmpty(rule.pattern()) ? null : firstMatch(input, rule.pattern());
      case SUBSTRING:
        return substring(input, rule.startIndex(), rule.length());
      case SPLIT:
        return split(input, rule.delimiter(), rule.index());
      case COMBINE:
        return combine(rule, context);
      case TEMPLATE:
        return template(nullToEmpty(rule.template()), context);
      case MAP: {
        String mapped = rule.mapping().get(input);
        return mapped != null ? mapped : rule.defaultValue();
      }
      case CONDITIONAL:
        return conditional(rule, input);
      case BASE64_ENCODE:
        return Base64.getEncoder().encodeToString(input.getBytes(StandardCharsets.UTF_8));
      case BASE64_DECODE:
        return new String(Base64.getDecoder().decode(input), StandardCharsets.UTF_8);
      case URL_ENCODE:
        return URLEncoder.encode(input, StandardCharsets.UTF_8)
            .replace("+", "%20")
            .replace("*", "%2A")
            .replace("%7E", "~");
      case URL_DECODE:
        return URLDecoder.decode(input.replace("+", "%2B"), StandardCharsets.UTF_8);
      default:
        return input;
    }
  }

  private static String input(TransformRule rule, StepExecutionContext context) {
    String key = nullToEmpty(rule.inputKey());
    String source = rule.inputSource() == null ? "" : rule.inputSource().toLowerCase(Locale.ROOT);
    switch (source) {
      case "constant":
        return rule.constantValue();
      case "input":
        return context.input().get(key);
      case "config":
        return context.stringSetting(key).orElse(null);
      default: {
        Object value = context.journeyData().get(key);
        return value == null ? null : value.toString();
      }
    }
  }

  static String hash(String value, String algorithm) {
    if (isEmpty(value)) {
      return null;
    }
    String name = algorithm == null ? "sha256" : algorithm.toLowerCase(Locale.ROOT);
    String jdkName;
    switch (name) {
      case "md5":
        jdkName = "MD5";
        break;
      case "sha1":
        jdkName = "SHA-1";
        break;
      case "sha384":
        jdkName = "SHA-384";
        break;
      case "sha512":
        jdkName = "SHA-512";
        break;
      default:
        jdkName = "SHA-256";
    }
    try {
      byte[] digest = MessageDigest.getInstance(jdkName).digest(value.getBytes(StandardCharsets.UTF_8));
      return Base64.getEncoder().encodeToString(digest);
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException(jdkName + " not available", e);
    }
  }

  static String substring(String value, Integer startIndex, Integer length) {
    if (isEmpty(value)) {
      return null;
    }
    int start = clamp(startIndex == null ? 0 : startIndex, value.length());
    int remaining = value.length() - start;
    int len = length == null ? remaining : Math.max(0, Math.min(length, remaining));
    return value.substring(start, start + len);
  }

  private static String split(String value, String delimiter, Integer index) {
    String[] parts = value.split(Pattern.quote(delimiter == null ? "," : delimiter), -1);
    int i = index == null ? 0 : index;
    return i >= 0 && i < parts.length ? parts[i] : null;
  }

  private static String replace(String value, String find, String replaceWith) {
    if (isEmpty(find)) {
      return value;
    }
    return value.replace(find, nullToEmpty(replaceWith));
  }

  private static String firstMatch(String value, String pattern) {
    Matcher matcher = Pattern.compile(pattern).matcher(value);
    return matcher.find() ? matcher.group() : "";
  }

  private static String combine(TransformRule rule, StepExecutionContext context) {
    String delimiter = rule.delimiter() == null ? " " : rule.delimiter();
    return rule.inputKeys().stream()
        .map(key -> context.journeyData().get(key))
        .map(value -> value == null ? "" : value.toString())
        .collect(Collectors.joining(delimiter));
  }

  private static String template(String template, StepExecutionContext context) {
    String result = template;
    for (Map.Entry<String, Object> entry : context.journeyData().entrySet()) {
      Object value = entry.getValue();
      result = result.replace("{data:" + entry.getKey() + "}", value == null ? "" : value.toString());
    }
    for (Map.Entry<String, String> entry : context.input().entrySet()) {
      result = result.replace("{input:" + entry.getKey() + "}", nullToEmpty(entry.getValue()));
    }
    return result.replace("{user:id}", nullToEmpty(context.userId()));
  }

  private static String conditional(TransformRule rule, String input) {
    for (TransformCondition condition : rule.conditions()) {
      if (conditionMatches(condition, input)) {
        return condition.thenValue();
      }
    }
    return rule.defaultValue();
  }

  private static boolean conditionMatches(TransformCondition condition, String input) {
    String operator = condition.operator() == null ? "" : condition.operator().toLowerCase(Locale.ROOT);
    String expected = nullToEmpty(condition.value());
    switch (operator) {
      case "notequals":
      case "not_equals":
      case "neq":
        return !equalsIgnoreCase(input, condition.value());
      case "contains":
        return input != null && input.toLowerCase(Locale.ROOT).contains(expected.toLowerCase(Locale.ROOT));
      case "startswith":
      case "starts_with":
        return input != null && input.toLowerCase(Locale.ROOT).startsWith(expected.toLowerCase(Locale.ROOT));
      case "exists":
      case "notnull":
        return !isEmpty(input);
      case "notexists":
      case "null":
        return isEmpty(input);
      default:
        return equalsIgnoreCase(input, condition.value());
    }
  }

  private static boolean equalsIgnoreCase(String left, String right) {
    return left == null ? right == null : left.equalsIgnoreCase(right);
  }

  private static int clamp(int value, int max) {
    return Math.max(0, Math.min(value, max));
  }

  private static boolean isEmpty(String value) {
    return value == null || value.isEmpty();
  }

  private static String nullToEmpty(String value) {
    return value == null ? "" : value;
  }
}
