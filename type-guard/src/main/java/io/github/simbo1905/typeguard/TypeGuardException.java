package io.github.simbo1905.typeguard;

import java.util.Objects;

/// Thrown by the assertion entry points when a value does not conform
public final class TypeGuardException extends RuntimeException {

  static final String SUPPRESSED_MESSAGE = "type guard failed";

  private final transient Verdict.Fail failure;

  TypeGuardException(Verdict.Fail failure, String message) {
    super(message == null ? SUPPRESSED_MESSAGE : message);
    this.failure = Objects.requireNonNull(failure, "failure");
  }

  public Verdict.Fail failure() {
    return failure;
  }

  public Path path() {
    return failure.path();
  }

  public Verdict.Reason reason() {
    return failure.reason();
  }
}
