package com.codeheadsystems.oluso.server.journey.transform;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A declarative data-mapping rule of a {@code transform} step. Only the settings that the rule's
 * type reads need to be present.
 *
 * @param type          the transform kind, see {@link TransformType}; defaults to copy
 * @param inputKey      key of the input value
 * @param inputSource   data (default), input, config or constant
 * @param outputKey     journey data key the result is written to
 * @param defaultValue  result when the input is missing, and the fallback for map and conditional
 * @param required      whether a failure of this rule fails the step
 * @param constantValue value for the constant type and source
 * @param prefix        prefix to prepend
 * @param suffix        suffix to append
 * @param find          literal to replace
 * @param replaceWith   replacement for replace and regex_replace
 * @param pattern       regular expression
 * @param hashAlgorithm md5, sha1, sha256 (default), sha384 or sha512
 * @param startIndex    substring start
 * @param length        substring length
 * @param delimiter     split and combine delimiter
 * @param index         split token index
 * @param inputKeys     data keys joined by combine
 * @param template      template with {data:key}, {input:key} and {user:id} placeholders
 * @param mapping       lookup table for map
 * @param conditions    branches for conditional
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TransformRule(@JsonProperty("type") String type,
                            @JsonProperty("inputKey") String inputKey,
                            @JsonProperty("inputSource") String inputSource,
                            @JsonProperty("outputKey") String outputKey,
                            @JsonProperty("defaultValue") String defaultValue,
                            @JsonProperty("required") boolean required,
                            @JsonProperty("constantValue") String constantValue,
                            @JsonProperty("prefix") String prefix,
                            @JsonProperty("suffix") String suffix,
                            @JsonProperty("find") String find,
                            @JsonProperty("replaceWith") String replaceWith,
                            @JsonProperty("pattern") String pattern,
                            @JsonProperty("hashAlgorithm") String hashAlgorithm,
                            @JsonProperty("startIndex") Integer startIndex,
                            @JsonProperty("length") Integer length,
                            @JsonProperty("delimiter") String delimiter,
                            @JsonProperty("index") Integer index,
                            @JsonProperty("inputKeys") List<String> inputKeys,
                            @JsonProperty("template") String template,
                            @JsonProperty("mapping") Map<String, String> mapping,
                            @JsonProperty("conditions") List<TransformCondition> conditions) {

  public TransformRule {
    inputKeys = inputKeys == null ? List.of() : List.copyOf(inputKeys);
    mapping = mapping == null ? Map.of() : Map.copyOf(mapping);
    conditions = conditions == null ? List.of() : List.copyOf(conditions);
  }

  public TransformType transformType() {
    return TransformType.fromValue(type);
  }

  public static Builder builder(String type, String outputKey) {
    return new Builder(type, outputKey);
  }

  public static final class Builder {
    private final String type;
    private final String outputKey;
    private String inputKey;
    private String inputSource;
    private String defaultValue;
    private boolean required;
    private String constantValue;
    private String prefix;
    private String suffix;
    private String find;
    private String replaceWith;
    private String pattern;
    private String hashAlgorithm;
    private Integer startIndex;
    private Integer length;
    private String delimiter;
    private Integer index;
    private List<String> inputKeys = List.of();
    private String template;
    private Map<String, String> mapping = new LinkedHashMap<>();
    private List<TransformCondition> conditions = List.of();

    private Builder(String type, String outputKey) {
      this.type = type;
      this.outputKey = outputKey;
    }

    public Builder withInputKey(String value) {
      this.inputKey = value;
      return this;
    }

    public Builder withInputSource(String value) {
      this.inputSource = value;
      return this;
    }

    public Builder withDefaultValue(String value) {
      this.defaultValue = value;
      return this;
    }

    public Builder withRequired(boolean value) {
      this.required = value;
      return this;
    }

    public Builder withConstantValue(String value) {
      this.constantValue = value;
      return this;
    }

    public Builder withPrefix(String value) {
      this.prefix = value;
      return this;
    }

    public Builder withSuffix(String value) {
      this.suffix = value;
      return this;
    }

    public Builder withReplace(String findValue, String replacement) {
      this.find = findValue;
      this.replaceWith = replacement;
      return this;
    }

    public Builder withPattern(String value) {
      this.pattern = value;
      return this;
    }

    public Builder withHashAlgorithm(String value) {
      this.hashAlgorithm = value;
      return this;
    }

    public Builder withSubstring(Integer start, Integer len) {
      this.startIndex = start;
      this.length = len;
      return this;
    }

    public Builder withDelimiter(String value) {
      this.delimiter = value;
      return this;
    }

    public Builder withIndex(Integer value) {
      this.index = value;
      return this;
    }

    public Builder withInputKeys(String... values) {
      this.inputKeys = List.of(values);
      return this;
    }

    public Builder withTemplate(String value) {
      this.template = value;
      return this;
    }

    public Builder withMapping(String from, String to) {
      this.mapping.put(from, to);
      return this;
    }

    public Builder withConditions(TransformCondition... values) {
      this.conditions = List.of(values);
      return this;
    }

    public TransformRule build() {
      return new TransformRule(type, inputKey, inputSource, outputKey, defaultValue, required,
          constantValue, prefix, suffix, find, replaceWith, pattern, hashAlgorithm, startIndex,
          length, delimiter, index, inputKeys, template, mapping, conditions);
    }
  }
}
