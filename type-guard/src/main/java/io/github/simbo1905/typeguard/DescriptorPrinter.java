package io.github.simbo1905.typeguard;

import io.github.simbo1905.typeguard.TypeDescriptor.ArrayOf;
import io.github.simbo1905.typeguard.TypeDescriptor.Generic;
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

import java.util.List;

/// Renders descriptors in TypeScript-like notation for logs and messages:
/// `{ id: number; tags?: string[] }`, `[string, ...number[]]`, `"a" | "b"`.
public final class DescriptorPrinter {

  private DescriptorPrinter() {
  }

  public static String print(TypeDescriptor descriptor) {
    final var sb = new StringBuilder(64);
    append(sb, descriptor, false);
    return sb.toString();
  }

  private static void append(StringBuilder sb, TypeDescriptor d, boolean nested) {
    if (d instanceof Primitive p) {
      sb.append(p.kind().typeName());
    } else if (d instanceof Literal l) {
      appendLiteral(sb, l.value());
    } else if (d instanceof ArrayOf a) {
      final boolean wrap = a.element() instanceof Union || a.element() instanceof Intersection;
      if (wrap) sb.append('(');
      append(sb, a.element(), false);
      if (wrap) sb.append(')');
      sb.append("[]");
    } else if (d instanceof Tuple t) {
      sb.append('[');
      final List<TupleElement> elements = t.elements();
      for (int i = 0; i < elements.size(); i++) {
        if (i > 0) sb.append(", ");
        final var e = elements.get(i);
        if (e.rest()) {
          sb.append("...");
          append(sb, new ArrayOf(e.type()), false);
        } else {
          append(sb, e.type(), false);
        }
      }
      sb.append(']');
    } else if (d instanceof ObjectShape o) {
      appendObject(sb, o);
    } else if (d instanceof Union u) {
      appendJoined(sb, u.members(), " | ", nested);
    } else if (d instanceof Intersection i) {
      appendJoined(sb, i.members(), " & ", nested);
    } else if (d instanceof Reference r) {
      sb.append(r.id());
    } else if (d instanceof Generic g) {
      sb.append(g.baseId()).append('<');
      for (int i = 0; i < g.arguments().size(); i++) {
        if (i > 0) sb.append(", ");
        append(sb, g.arguments().get(i), false);
      }
      sb.append('>');
    } else if (d instanceof Parameter p) {
      sb.append(p.name());
    } else {
      throw new AssertionError("unreachable: " + d.getClass());
    }
  }

  private static void appendJoined(StringBuilder sb, List<TypeDescriptor> members, String separator, boolean nested) {
    if (nested) sb.append('(');
    for (int i = 0; i < members.size(); i++) {
      if (i > 0) sb.append(separator);
      append(sb, members.get(i), true);
    }
    if (nested) sb.append(')');
  }

  private static void appendObject(StringBuilder sb, ObjectShape o) {
    if (o.properties().isEmpty() && o.indexSignatures().isEmpty()) {
      sb.append("{}");
      return;
    }
    sb.append("{ ");
    boolean first = true;
    for (Property p : o.properties()) {
      if (!first) sb.append("; ");
      first = false;
      if (p.readonly()) sb.append("readonly ");
      sb.append(Path.isIdentifier(p.name()) ? p.name() : quote(p.name()));
      if (p.optional()) sb.append('?');
      sb.append(": ");
      append(sb, p.type(), false);
    }
    for (IndexSignature s : o.indexSignatures()) {
      if (!first) sb.append("; ");
      first = false;
      sb.append("[key: ").append(s.key() == TypeDescriptor.IndexKey.STRING ? "string" : "number").append("]: ");
      append(sb, s.type(), false);
    }
    sb.append(" }");
  }

  static void appendLiteral(StringBuilder sb, Object value) {
    if (value instanceof String s) {
      sb.append(quote(s));
    } else if (value instanceof java.math.BigInteger b) {
      sb.append(b).append('n');
    } else {
      sb.append(value);
    }
  }

  static String quote(String s) {
    final var sb = new StringBuilder(s.length() + 2).append('"');
    for (int i = 0; i < s.length(); i++) {
      final char c = s.charAt(i);
      switch (c) {
        case '"' -> sb.append("\\\"");
        case '\\' -> sb.append("\\\\");
        case '\n' -> sb.append("\\n");
        case '\r' -> sb.append("\\r");
        case '\t' -> sb.append("\\t");
        default -> sb.append(c);
      }
    }
    return sb.append('"').toString();
  }
}
