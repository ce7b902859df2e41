package edu.cmu.cs.cs15745.isle;

import java.util.Objects;

/**
 * Result of exploring one branch of the search: the final state, or the reason the
 * inclusion failed along that branch.
 */
public final class Outcome<T> {
  private final T value;
  private final String reason;

  private Outcome(T value, String reason) {
    this.value = value;
    this.reason = reason;
  }

  public static <T> Outcome<T> success(T value) {
    return new Outcome<>(Objects.requireNonNull(value), null);
  }

  public static <T> Outcome<T> failure(String reason) {
    return new Outcome<>(null, Objects.requireNonNull(reason));
  }

  public boolean isSuccess() {
    return value != null;
  }

  public T value() {
    if (value == null) {
      throw new IllegalStateException("Failed outcome: " + reason);
    }
    return value;
  }

  public String reason() {
    if (reason == null) {
      throw new IllegalStateException("Successful outcome has no failure reason");
    }
    return reason;
  }

  @Override
  public String toString() {
    return isSuccess() ? "success" : "failure: " + reason;
  }
}
