package com.codeheadsystems.oluso.server.common;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Either a value or a typed failure reason. Used where several distinct failure causes must be
 * told apart internally but collapse to one outcome at the protocol boundary.
 *
 * @param <T> the value type
 * @param <E> the failure reason type
 */
public final class Result<T, E> {

  private final T value;
  private final E failure;

  private Result(T value, E failure) {
    this.value = value;
    this.failure = failure;
  }

  public static <T, E> Result<T, E> success(T value) {
    return new Result<>(Objects.requireNonNull(value, "value"), null);
  }

  public static <T, E> Result<T, E> failure(E reason) {
    return new Result<>(null, Objects.requireNonNull(reason, "reason"));
  }

  public boolean isSuccess() {
    return failure == null;
  }

  public T value() {
    if (!isSuccess()) {
      throw new IllegalStateException("Result is a failure: " + failure);
    }
    return value;
  }

  public E failure() {
    if (isSuccess()) {
      throw new IllegalStateException("Result is a success");
    }
    return failure;
  }

  public Optional<T> toOptional() {
    return Optional.ofNullable(value);
  }

  public <U> Result<U, E> map(Function<T, U> mapper) {
    return isSuccess() ? success(mapper.apply(value)) : failure(failure);
  }

  @Override
  public String toString() {
    return isSuccess() ? "Success[" + value + "]" : "Failure[" + failure + "]";
  }
}
