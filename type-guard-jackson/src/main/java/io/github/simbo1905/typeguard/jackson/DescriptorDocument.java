package io.github.simbo1905.typeguard.jackson;

import io.github.simbo1905.typeguard.TypeDescriptor;
import io.github.simbo1905.typeguard.TypeGuard;
import io.github.simbo1905.typeguard.TypeRegistry;

import java.util.Objects;

/// A parsed descriptor document: its definitions and the type it validates
public record DescriptorDocument(TypeRegistry registry, TypeDescriptor type) {

  public DescriptorDocument {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(type, "type");
  }

  /// Normalizes and compiles `type` against `registry`
  public TypeGuard guard() {
    return registry.guard(type);
  }
}
