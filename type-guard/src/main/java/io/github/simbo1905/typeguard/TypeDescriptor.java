package io.github.simbo1905.typeguard;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/// Structural description of the type a value is checked against.
///
/// A closed family of immutable records. Recursion is only expressed through
/// [Reference] names that a [TypeRegistry] resolves; a descriptor never points
/// at itself. Equality and hash codes are structural, so equal descriptors
/// share one compiled validator.
///
/// ```java
/// TypeDescriptor user = Types.object(
///     Types.property("name", Types.string()),
///     Types.optional("tags", Types.array(Types.string())));
/// ```
public sealed interface TypeDescriptor {

  /// Direct sub-descriptors in declaration order. References are leaves.
  List<TypeDescriptor> children();

  /// Ids of every [Reference] reachable without resolving references
  default Set<String> references() {
    final var ids = new LinkedHashSet<String>();
    walk(this, d -> {
      if (d instanceof Reference r) ids.add(r.id());
    });
    return ids;
  }

  /// Names of every free [Parameter] in this descriptor
  default Set<String> parameters() {
    final var names = new LinkedHashSet<String>();
    walk(this, d -> {
      if (d instanceof Parameter p) names.add(p.name());
    });
    return names;
  }

  /// Pre-order visit of the descriptor tree, iterative like the validation loops
  static void walk(TypeDescriptor root, java.util.function.Consumer<TypeDescriptor> visitor) {
    final Deque<TypeDescriptor> stack = new ArrayDeque<>();
    stack.push(root);
    while (!stack.isEmpty()) {
      final var node = stack.pop();
      visitor.accept(node);
      final var kids = node.children();
      for (int i = kids.size() - 1; i >= 0; i--) {
        stack.push(kids.get(i));
      }
    }
  }

  /// string, number, boolean, null, undefined, bigint, any, unknown or never
  record Primitive(PrimitiveKind kind) implements TypeDescriptor {
    public Primitive {
      Objects.requireNonNull(kind, "kind");
    }

    @Override
    public List<TypeDescriptor> children() {
      return List.of();
    }
  }

  /// A single scalar that must be matched exactly.
  ///
  /// Numbers compare like doubles, so `Literal(1)` and `Literal(1.0)` are the same literal.
  record Literal(Object value) implements TypeDescriptor {
    private static final double MAX_SAFE_INTEGER = 9007199254740991d;

    public Literal {
      value = normalize(value);
    }

    @Override
    public List<TypeDescriptor> children() {
      return List.of();
    }

    /// `===` against a runtime value
    public boolean matches(Object candidate) {
      if (!(value instanceof Number) || value instanceof BigInteger) {
        return value.equals(candidate);
      }
      if (!PrimitiveKind.NUMBER.matches(candidate)) {
        return false;
      }
      final var number = (Number) candidate;
      if (value instanceof Long expected && isIntegral(number)) {
        return expected == number.longValue();
      }
      return ((Number) value).doubleValue() == number.doubleValue();
    }

    private static Object normalize(Object value) {
      if (value instanceof String || value instanceof Boolean || value instanceof BigInteger) {
        return value;
      }
      if (value instanceof Character c) {
        return String.valueOf(c);
      }
      if (value instanceof Number number) {
        if (isIntegral(number)) {
          return number.longValue();
        }
        if (number instanceof BigDecimal decimal) {
          try {
            return decimal.longValueExact();
          } catch (ArithmeticException notExact) {
            return decimal.doubleValue();
          }
        }
        final double d = number.doubleValue();
        if (d == Math.rint(d) && Math.abs(d) <= MAX_SAFE_INTEGER) {
          return (long) d;
        }
        return d;
      }
      throw DescriptorException.malformed("literal must be a string, number, bigint or boolean: "
          + (value == null ? "null" : value.getClass().getName()));
    }

    private static boolean isIntegral(Number n) {
      return n instanceof Long || n instanceof Integer || n instanceof Short || n instanceof Byte;
    }
  }

  /// Homogeneous sequence
  record ArrayOf(TypeDescriptor element) implements TypeDescriptor {
    public ArrayOf {
      Objects.requireNonNull(element, "element");
    }

    @Override
    public List<TypeDescriptor> children() {
      return List.of(element);
    }
  }

  /// One tuple position; a `rest` element stands for any number of trailing values
  record TupleElement(TypeDescriptor type, boolean rest) {
    public TupleElement {
      Objects.requireNonNull(type, "type");
    }
  }

  /// Fixed-arity sequence with an optional variadic tail
  record Tuple(List<TupleElement> elements) implements TypeDescriptor {
    public Tuple {
      elements = List.copyOf(elements);
      for (int i = 0; i < elements.size(); i++) {
        if (elements.get(i).rest() && i != elements.size() - 1) {
          throw DescriptorException.malformed("tuple rest element must be the final element, found at position " + i);
        }
      }
    }

    /// Per-position types, excluding the rest element
    public List<TypeDescriptor> fixed() {
      final var types = new ArrayList<TypeDescriptor>(elements.size());
      for (TupleElement e : elements) {
        if (!e.rest()) types.add(e.type());
      }
      return types;
    }

    /// Element type of the variadic tail, or `null` if the tuple is closed
    public TypeDescriptor restType() {
      if (elements.isEmpty()) return null;
      final var last = elements.get(elements.size() - 1);
      return last.rest() ? last.type() : null;
    }

    @Override
    public List<TypeDescriptor> children() {
      return elements.stream().map(TupleElement::type).toList();
    }
  }

  /// Declared property of an [ObjectShape]. `readonly` has no runtime effect.
  record Property(String name, TypeDescriptor type, boolean optional, boolean readonly) {
    public Property {
      Objects.requireNonNull(name, "name");
      Objects.requireNonNull(type, "type");
    }
  }

  enum IndexKey {STRING, NUMBER}

  /// Type of the values stored under keys that no property declares
  record IndexSignature(IndexKey key, TypeDescriptor type) {
    public IndexSignature {
      Objects.requireNonNull(key, "key");
      Objects.requireNonNull(type, "type");
    }
  }

  /// Object shape: ordered properties plus at most one string and one number index signature
  record ObjectShape(List<Property> properties, List<IndexSignature> indexSignatures) implements TypeDescriptor {
    public ObjectShape {
      properties = List.copyOf(properties);
      indexSignatures = List.copyOf(indexSignatures);
      final Set<String> names = new HashSet<>();
      for (Property p : properties) {
        if (!names.add(p.name())) {
          throw DescriptorException.malformed("duplicate property name: " + p.name());
        }
      }
      final Set<IndexKey> keys = new HashSet<>();
      for (IndexSignature s : indexSignatures) {
        if (!keys.add(s.key())) {
          throw DescriptorException.malformed("duplicate " + s.key().name().toLowerCase(java.util.Locale.ROOT)
              + " index signature");
        }
      }
    }

    public Property property(String name) {
      for (Property p : properties) {
        if (p.name().equals(name)) return p;
      }
      return null;
    }

    public IndexSignature index(IndexKey key) {
      for (IndexSignature s : indexSignatures) {
        if (s.key() == key) return s;
      }
      return null;
    }

    @Override
    public List<TypeDescriptor> children() {
      final var kids = new ArrayList<TypeDescriptor>(properties.size() + indexSignatures.size());
      properties.forEach(p -> kids.add(p.type()));
      indexSignatures.forEach(s -> kids.add(s.type()));
      return kids;
    }
  }

  /// At least one member must match; declaration order decides diagnostic precedence
  record Union(List<TypeDescriptor> members) implements TypeDescriptor {
    public Union {
      members = List.copyOf(members);
      if (members.isEmpty()) {
        throw DescriptorException.malformed("union must have at least one member");
      }
    }

    @Override
    public List<TypeDescriptor> children() {
      return members;
    }
  }

  /// Every member must match the same value
  record Intersection(List<TypeDescriptor> members) implements TypeDescriptor {
    public Intersection {
      members = List.copyOf(members);
      if (members.isEmpty()) {
        throw DescriptorException.malformed("intersection must have at least one member");
      }
    }

    @Override
    public List<TypeDescriptor> children() {
      return members;
    }
  }

  /// Named placeholder resolved through a [TypeRegistry]
  record Reference(String id) implements TypeDescriptor {
    public Reference {
      Objects.requireNonNull(id, "id");
      if (id.isBlank()) {
        throw DescriptorException.malformed("reference id must not be blank");
      }
    }

    @Override
    public List<TypeDescriptor> children() {
      return List.of();
    }
  }

  /// A generic definition applied to concrete arguments
  record Generic(String baseId, List<TypeDescriptor> arguments) implements TypeDescriptor {
    public Generic {
      Objects.requireNonNull(baseId, "baseId");
      arguments = List.copyOf(arguments);
      if (baseId.isBlank()) {
        throw DescriptorException.malformed("generic base id must not be blank");
      }
    }

    @Override
    public List<TypeDescriptor> children() {
      return arguments;
    }
  }

  /// Free type parameter; only meaningful inside a generic definition body
  record Parameter(String name) implements TypeDescriptor {
    public Parameter {
      Objects.requireNonNull(name, "name");
    }

    @Override
    public List<TypeDescriptor> children() {
      return List.of();
    }
  }
}
