package io.github.simbo1905.typeguard;

import java.util.Objects;

/// Construction-time failure: the descriptor graph cannot be compiled safely.
///
/// Thrown by descriptor constructors, [TypeRegistry.Builder] and [TypeRegistry#normalize].
/// Never thrown while validating a value.
public final class DescriptorException extends RuntimeException {
  private final Reason reason;

  DescriptorException(Reason reason, String message) {
    super(message);
    this.reason = Objects.requireNonNull(reason, "reason");
  }

  DescriptorException(Reason reason, String message, Throwable cause) {
    super(message, cause);
    this.reason = Objects.requireNonNull(reason, "reason");
  }

  /// Public factory for collaborators outside this package (descriptor readers)
  public static DescriptorException malformed(String message, Throwable cause) {
    return new DescriptorException(Reason.MALFORMED_DESCRIPTOR, message, cause);
  }

  public static DescriptorException malformed(String message) {
    return new DescriptorException(Reason.MALFORMED_DESCRIPTOR, message);
  }

  public Reason reason() {
    return reason;
  }

  public enum Reason {
    MALFORMED_DESCRIPTOR,
    UNRESOLVED_REFERENCE,
    UNBOUND_TYPE_PARAMETER,
    CYCLIC_WITHOUT_REFERENCE
  }
}
