package io.github.simbo1905.typeguard;

import java.util.Objects;
import java.util.function.Function;
import java.util.function.Predicate;

/// One-shot entry points for self-contained descriptors.
///
/// Descriptors are resolved against [TypeRegistry#empty()], so they may not contain
/// references or generics; build a [TypeRegistry] for those. Compiled validators are
/// cached, so calling these repeatedly with an equal descriptor compiles once.
///
/// The validator cache lives for the whole process and is never evicted: it holds one
/// entry per structurally distinct descriptor ever passed here. Code that builds
/// descriptors dynamically and without bound should create a [TypeGuard] once with
/// [#guard] and keep it, rather than calling these methods with fresh descriptors.
public final class TypeGuards {

  private TypeGuards() {
  }

  public static TypeGuard guard(TypeDescriptor descriptor) {
    Objects.requireNonNull(descriptor, "descriptor");
    return TypeRegistry.empty().guard(descriptor);
  }

  public static boolean is(TypeDescriptor descriptor, Object value) {
    return guard(descriptor).is(value);
  }

  public static boolean equals(TypeDescriptor descriptor, Object value) {
    return guard(descriptor).isEqual(value);
  }

  public static Verdict validate(TypeDescriptor descriptor, Object value) {
    return guard(descriptor).validate(value);
  }

  public static Verdict validateEquals(TypeDescriptor descriptor, Object value) {
    return guard(descriptor).validateEquals(value);
  }

  public static <T> T assertType(TypeDescriptor descriptor, Object value) {
    return guard(descriptor).assertType(value);
  }

  public static <T> T assertEquals(TypeDescriptor descriptor, Object value) {
    return guard(descriptor).assertEquals(value);
  }

  public static Predicate<Object> createIs(TypeDescriptor descriptor) {
    return guard(descriptor).createIs();
  }

  public static Predicate<Object> createEquals(TypeDescriptor descriptor) {
    return guard(descriptor).createEquals();
  }

  public static <T> Function<Object, T> createAssertType(TypeDescriptor descriptor) {
    return guard(descriptor).createAssertType();
  }

  public static <T> Function<Object, T> createAssertEquals(TypeDescriptor descriptor) {
    return guard(descriptor).createAssertEquals();
  }
}
