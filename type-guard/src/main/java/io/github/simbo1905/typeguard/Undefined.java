package io.github.simbo1905.typeguard;

/// Runtime stand-in for an absent value.
///
/// Java has `null` but no second "nothing" value, so an explicit sentinel marks
/// a property that is present yet undefined. An absent map key reads as [#VALUE] too.
public enum Undefined {
  VALUE;

  @Override
  public String toString() {
    return "undefined";
  }
}
