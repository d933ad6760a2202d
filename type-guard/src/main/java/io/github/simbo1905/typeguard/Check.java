package io.github.simbo1905.typeguard;

/// A compiled validation step for one descriptor node.
///
/// Scalar checks answer at once. Checks that visit children push a [Frame] with
/// [ValidationContext#suspend] and return `null`; the context's run loop then drives
/// the frame one child at a time, so nesting in the value never deepens the Java stack.
@FunctionalInterface
interface Check {
  Verdict start(Object value, ValidationContext context);

  /// A container check suspended on the context's work stack
  @FunctionalInterface
  interface Frame {
    /// Called with `null` on entry and then with the verdict of each child the frame
    /// asked for. Returns the frame's own verdict, or `null` after asking for the next
    /// child with [ValidationContext#descend].
    Verdict resume(Verdict child, ValidationContext context);
  }
}
