package io.github.simbo1905.typeguard;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Logger;

/// Resolution scope for named and generic descriptors.
///
/// Recursive types are written as [TypeDescriptor.Reference]s to names defined here:
///
/// ```java
/// TypeRegistry registry = TypeRegistry.builder()
///     .define("Node", Types.object(
///         Types.property("value", Types.number()),
///         Types.optional("next", Types.ref("Node"))))
///     .defineGeneric("Box", List.of("T"), Types.object(Types.property("item", Types.param("T"))))
///     .build();
///
/// TypeGuard nodes = registry.guard(Types.ref("Node"));
/// TypeGuard boxes = registry.guard(Types.generic("Box", Types.string()));
/// ```
///
/// Registries are immutable and safe to share between threads.
public final class TypeRegistry {

  private static final Logger LOG = Logger.getLogger(TypeRegistry.class.getName());

  private static final TypeRegistry EMPTY = new TypeRegistry(Map.of(), Map.of());

  private final Map<String, TypeDescriptor> definitions;
  private final Map<String, GenericDefinition> generics;
  private final Map<TypeDescriptor, NormalizedType> normalized = new ConcurrentHashMap<>();

  private TypeRegistry(Map<String, TypeDescriptor> definitions, Map<String, GenericDefinition> generics) {
    this.definitions = Map.copyOf(definitions);
    this.generics = Map.copyOf(generics);
  }

  /// Registry with no definitions; resolves only self-contained descriptors
  public static TypeRegistry empty() {
    return EMPTY;
  }

  public static Builder builder() {
    return new Builder();
  }

  /// Non-generic definition, or `null`
  public TypeDescriptor definition(String id) {
    return definitions.get(id);
  }

  /// Generic definition, or `null`
  public GenericDefinition generic(String id) {
    return generics.get(id);
  }

  /// Closes `descriptor` against this registry.
  ///
  /// @throws DescriptorException if a reference is unresolved, a parameter is left
  ///     unbound, or a recursive definition re-enters itself without consuming the value
  public NormalizedType normalize(TypeDescriptor descriptor) {
    Objects.requireNonNull(descriptor, "descriptor");
    if (this == EMPTY) {
      // shared by every TypeGuards call; ValidatorCache already dedupes what it compiles
      return new Normalizer(this).normalize(descriptor);
    }
    final var cached = normalized.get(descriptor);
    if (cached != null) {
      return cached;
    }
    final var result = new Normalizer(this).normalize(descriptor);
    final var raced = normalized.putIfAbsent(descriptor, result);
    return raced != null ? raced : result;
  }

  /// Compiled guard for `descriptor` resolved in this registry
  public TypeGuard guard(TypeDescriptor descriptor) {
    return TypeGuard.of(normalize(descriptor));
  }

  int cachedNormalizations() {
    return normalized.size();
  }

  @Override
  public String toString() {
    return "TypeRegistry[definitions=" + definitions.keySet() + ", generics=" + generics.keySet() + "]";
  }

  /// `id<parameters> = body`
  public record GenericDefinition(String id, List<String> parameters, TypeDescriptor body) {
    public GenericDefinition {
      Objects.requireNonNull(id, "id");
      Objects.requireNonNull(body, "body");
      parameters = List.copyOf(parameters);
      if (parameters.isEmpty()) {
        throw DescriptorException.malformed("generic " + id + " declares no parameters");
      }
      if (new HashSet<>(parameters).size() != parameters.size()) {
        throw DescriptorException.malformed("generic " + id + " declares a parameter twice: " + parameters);
      }
    }
  }

  public static final class Builder {
    private final Map<String, TypeDescriptor> definitions = new LinkedHashMap<>();
    private final Map<String, GenericDefinition> generics = new LinkedHashMap<>();

    private Builder() {
    }

    public Builder define(String id, TypeDescriptor descriptor) {
      Objects.requireNonNull(id, "id");
      Objects.requireNonNull(descriptor, "descriptor");
      checkUnused(id);
      checkNoFreeParameters(id, descriptor, Set.of());
      definitions.put(id, descriptor);
      return this;
    }

    public Builder defineGeneric(String id, List<String> parameters, TypeDescriptor body) {
      final var definition = new GenericDefinition(id, parameters, body);
      checkUnused(id);
      checkNoFreeParameters(id, body, Set.copyOf(definition.parameters()));
      generics.put(id, definition);
      return this;
    }

    public TypeRegistry build() {
      LOG.fine(() -> "registry.build definitions=" + definitions.size() + " generics=" + generics.size());
      return new TypeRegistry(definitions, generics);
    }

    private void checkUnused(String id) {
      if (id.isBlank()) {
        throw DescriptorException.malformed("definition id must not be blank");
      }
      if (definitions.containsKey(id) || generics.containsKey(id)) {
        throw DescriptorException.malformed("duplicate definition: " + id);
      }
    }

    private static void checkNoFreeParameters(String id, TypeDescriptor body, Set<String> declared) {
      for (String name : body.parameters()) {
        if (!declared.contains(name)) {
          LOG.severe(() -> "ERROR: DESCRIPTOR: unbound type parameter " + name + " in " + id);
          throw new DescriptorException(DescriptorException.Reason.UNBOUND_TYPE_PARAMETER,
              "unbound type parameter " + name + " in definition " + id);
        }
      }
    }
  }
}
