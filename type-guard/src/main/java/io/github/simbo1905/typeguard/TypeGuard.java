package io.github.simbo1905.typeguard;

import java.util.Objects;
import java.util.function.Function;
import java.util.function.Predicate;

/// A compiled validator for one closed type.
///
/// Obtained from [TypeGuards#guard] or [TypeRegistry#guard] and reusable from any
/// number of threads.
///
/// ```java
/// TypeGuard user = TypeGuards.guard(Types.object(
///     Types.property("name", Types.string()),
///     Types.optional("age", Types.number())));
///
/// user.is(Map.of("name", "ada"));                  // true
/// user.isEqual(Map.of("name", "ada", "x", 1));     // false, "x" is not declared
/// user.validate(Map.of("name", 1)).passed();       // false
/// Map<String, Object> checked = user.assertType(payload);
/// ```
///
/// The equality family (`isEqual`, `validateEquals`, `assertEquals`) rejects keys no object descriptor declares, at every object
/// level. Everything else accepts extra keys.
public final class TypeGuard {

  private final CompiledValidator validator;

  private TypeGuard(CompiledValidator validator) {
    this.validator = validator;
  }

  /// Guard for an already normalized type; compiled validators are shared process-wide
  public static TypeGuard of(NormalizedType type) {
    Objects.requireNonNull(type, "type");
    return new TypeGuard(ValidatorCache.get(type));
  }

  public NormalizedType type() {
    return validator.type();
  }

  /// Whether `value` conforms; extra object keys are allowed
  public boolean is(Object value) {
    return TypeGuardSettings.shortCircuit() || validator.run(value, false, false).passed();
  }

  /// Whether `value` conforms with no undeclared object keys
  public boolean isEqual(Object value) {
    return TypeGuardSettings.shortCircuit() || validator.run(value, true, false).passed();
  }

  /// Explains why `value` does not conform, or [Verdict#pass()]
  public Verdict validate(Object value) {
    return explain(value, false);
  }

  /// As [#validate] with undeclared keys rejected
  public Verdict validateEquals(Object value) {
    return explain(value, true);
  }

  /// Returns `value` if it conforms
  ///
  /// @throws TypeGuardException carrying the failure otherwise
  public <T> T assertType(Object value) {
    return require(value, false);
  }

  /// Returns `value` if it conforms with no undeclared object keys
  ///
  /// @throws TypeGuardException carrying the failure otherwise
  public <T> T assertEquals(Object value) {
    return require(value, true);
  }

  public Predicate<Object> createIs() {
    return this::is;
  }

  public Predicate<Object> createEquals() {
    return this::isEqual;
  }

  public <T> Function<Object, T> createAssertType() {
    return this::assertType;
  }

  public <T> Function<Object, T> createAssertEquals() {
    return this::assertEquals;
  }

  private Verdict explain(Object value, boolean strict) {
    if (TypeGuardSettings.shortCircuit()) {
      return Verdict.pass();
    }
    return validator.run(value, strict, true);
  }

  @SuppressWarnings("unchecked")
  private <T> T require(Object value, boolean strict) {
    final var verdict = explain(value, strict);
    if (verdict instanceof Verdict.Fail fail) {
      throw new TypeGuardException(fail, TypeGuardSettings.messageHook().message(fail));
    }
    return (T) value;
  }

  @Override
  public String toString() {
    return "TypeGuard[" + validator.type() + "]";
  }
}
