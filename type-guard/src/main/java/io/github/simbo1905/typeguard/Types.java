package io.github.simbo1905.typeguard;

import io.github.simbo1905.typeguard.TypeDescriptor.ArrayOf;
import io.github.simbo1905.typeguard.TypeDescriptor.Generic;
import io.github.simbo1905.typeguard.TypeDescriptor.IndexKey;
import io.github.simbo1905.typeguard.TypeDescriptor.IndexSignature;
import io.github.simbo1905.typeguard.TypeDescriptor.Intersection;
import io.github.simbo1905.typeguard.TypeDescriptor.Literal;
import io.github.simbo1905.typeguard.TypeDescriptor.ObjectShape;
import io.github.simbo1905.typeguard.TypeDescriptor.Parameter;
import io.github.simbo1905.typeguard.TypeDescriptor.Primitive;
import io.github.simbo1905.typeguard.TypeDescriptor.Property;
import io.github.simbo1905.typeguard.TypeDescriptor.Reference;
import io.github.simbo1905.typeguard.TypeDescriptor.Tuple;
import io.github.simbo1905.typeguard.TypeDescriptor.TupleElement;
import io.github.simbo1905.typeguard.TypeDescriptor.Union;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/// Static factories for building descriptors in code.
///
/// ```java
/// import static io.github.simbo1905.typeguard.Types.*;
///
/// TypeDescriptor point = object(property("x", number()), property("y", number()));
/// TypeDescriptor shape = union(literal("circle"), literal("square"));
/// ```
public final class Types {

  private static final Primitive STRING = new Primitive(PrimitiveKind.STRING);
  private static final Primitive NUMBER = new Primitive(PrimitiveKind.NUMBER);
  private static final Primitive BOOLEAN = new Primitive(PrimitiveKind.BOOLEAN);
  private static final Primitive NULL = new Primitive(PrimitiveKind.NULL);
  private static final Primitive UNDEFINED = new Primitive(PrimitiveKind.UNDEFINED);
  private static final Primitive BIGINT = new Primitive(PrimitiveKind.BIGINT);
  private static final Primitive ANY = new Primitive(PrimitiveKind.ANY);
  private static final Primitive UNKNOWN = new Primitive(PrimitiveKind.UNKNOWN);
  private static final Primitive NEVER = new Primitive(PrimitiveKind.NEVER);

  private Types() {
  }

  public static Primitive primitive(PrimitiveKind kind) {
    return switch (kind) {
      case STRING -> STRING;
      case NUMBER -> NUMBER;
      case BOOLEAN -> BOOLEAN;
      case NULL -> NULL;
      case UNDEFINED -> UNDEFINED;
      case BIGINT -> BIGINT;
      case ANY -> ANY;
      case UNKNOWN -> UNKNOWN;
      case NEVER -> NEVER;
    };
  }

  public static Primitive string() {
    return STRING;
  }

  public static Primitive number() {
    return NUMBER;
  }

  public static Primitive bool() {
    return BOOLEAN;
  }

  public static Primitive nullType() {
    return NULL;
  }

  public static Primitive undefined() {
    return UNDEFINED;
  }

  public static Primitive bigint() {
    return BIGINT;
  }

  public static Primitive any() {
    return ANY;
  }

  public static Primitive unknown() {
    return UNKNOWN;
  }

  public static Primitive never() {
    return NEVER;
  }

  public static Literal literal(Object value) {
    return new Literal(value);
  }

  public static ArrayOf array(TypeDescriptor element) {
    return new ArrayOf(element);
  }

  /// Closed tuple: `[a, b, c]`
  public static Tuple tuple(TypeDescriptor... elements) {
    final var list = new ArrayList<TupleElement>(elements.length);
    for (TypeDescriptor e : elements) {
      list.add(new TupleElement(e, false));
    }
    return new Tuple(list);
  }

  /// Tuple with a variadic tail: `[a, b, ...rest[]]`
  public static Tuple tupleWithRest(List<TypeDescriptor> fixed, TypeDescriptor rest) {
    final var list = new ArrayList<TupleElement>(fixed.size() + 1);
    fixed.forEach(e -> list.add(new TupleElement(e, false)));
    list.add(new TupleElement(rest, true));
    return new Tuple(list);
  }

  public static ObjectShape object(Property... properties) {
    return new ObjectShape(Arrays.asList(properties), List.of());
  }

  public static ObjectShape object(List<Property> properties, IndexSignature... indexSignatures) {
    return new ObjectShape(properties, Arrays.asList(indexSignatures));
  }

  /// `{ [key: string]: type }`
  public static ObjectShape record(TypeDescriptor valueType) {
    return new ObjectShape(List.of(), List.of(stringIndex(valueType)));
  }

  public static Property property(String name, TypeDescriptor type) {
    return new Property(name, type, false, false);
  }

  public static Property optional(String name, TypeDescriptor type) {
    return new Property(name, type, true, false);
  }

  public static Property readonly(String name, TypeDescriptor type) {
    return new Property(name, type, false, true);
  }

  public static IndexSignature stringIndex(TypeDescriptor type) {
    return new IndexSignature(IndexKey.STRING, type);
  }

  public static IndexSignature numberIndex(TypeDescriptor type) {
    return new IndexSignature(IndexKey.NUMBER, type);
  }

  public static Union union(TypeDescriptor... members) {
    return new Union(Arrays.asList(members));
  }

  /// `type | null`
  public static Union nullable(TypeDescriptor type) {
    return new Union(List.of(type, NULL));
  }

  public static Intersection intersection(TypeDescriptor... members) {
    return new Intersection(Arrays.asList(members));
  }

  public static Reference ref(String id) {
    return new Reference(id);
  }

  public static Generic generic(String baseId, TypeDescriptor... arguments) {
    return new Generic(baseId, Arrays.asList(arguments));
  }

  public static Parameter param(String name) {
    return new Parameter(name);
  }
}
