package com.codeheadsystems.oluso.server.journey.transform;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One branch of a {@code conditional} transform.
 *
 * @param operator  equals, notequals, contains, startswith, exists or notexists
 * @param value     the value to compare with
 * @param thenValue the result when the branch matches
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TransformCondition(@JsonProperty("operator") String operator,
                                 @JsonProperty("value") String value,
                                 @JsonProperty("thenValue") String thenValue) {
}
