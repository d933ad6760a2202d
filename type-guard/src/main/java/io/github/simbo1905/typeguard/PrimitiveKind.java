package io.github.simbo1905.typeguard;

import java.math.BigInteger;

/// Kinds accepted by [TypeDescriptor.Primitive]
public enum PrimitiveKind {
  STRING("string"),
  NUMBER("number"),
  BOOLEAN("boolean"),
  NULL("null"),
  UNDEFINED("undefined"),
  BIGINT("bigint"),
  ANY("any"),
  UNKNOWN("unknown"),
  NEVER("never");

  private final String typeName;

  PrimitiveKind(String typeName) {
    this.typeName = typeName;
  }

  /// Lower-case name as written in type expressions and failure messages
  public String typeName() {
    return typeName;
  }

  /// True if the runtime kind of `value` is this kind
  public boolean matches(Object value) {
    return switch (this) {
      case STRING -> value instanceof String;
      case NUMBER -> value instanceof Number && !(value instanceof BigInteger);
      case BOOLEAN -> value instanceof Boolean;
      case NULL -> value == null;
      case UNDEFINED -> value == Undefined.VALUE;
      case BIGINT -> value instanceof BigInteger;
      case ANY, UNKNOWN -> true;
      case NEVER -> false;
    };
  }

  /// Looks up a kind by its [#typeName()]
  public static PrimitiveKind ofTypeName(String name) {
    for (PrimitiveKind kind : values()) {
      if (kind.typeName.equals(name)) {
        return kind;
      }
    }
    throw DescriptorException.malformed("unknown primitive type: " + name);
  }
}
