package io.github.simbo1905.typeguard;

import java.util.List;

/// Location of a failure inside the validated value, rendered as `value.items[2].name`.
///
/// [Segment.Branch] entries record which union member was being tried; they are
/// kept for callers that inspect the path and are not part of the rendered text.
public record Path(List<Segment> segments) {

  static final String ROOT_NAME = "value";

  private static final Path ROOT = new Path(List.of());

  public Path {
    segments = List.copyOf(segments);
  }

  public static Path root() {
    return ROOT;
  }

  /// Number of field and index steps below the root
  public int depth() {
    int depth = 0;
    for (Segment s : segments) {
      if (!(s instanceof Segment.Branch)) depth++;
    }
    return depth;
  }

  public Path with(Segment segment) {
    final var list = new java.util.ArrayList<Segment>(segments.size() + 1);
    list.addAll(segments);
    list.add(segment);
    return new Path(list);
  }

  public String render() {
    final var sb = new StringBuilder(ROOT_NAME);
    for (Segment s : segments) {
      if (s instanceof Segment.Field f) {
        if (isIdentifier(f.name())) {
          sb.append('.').append(f.name());
        } else {
          sb.append('[').append(DescriptorPrinter.quote(f.name())).append(']');
        }
      } else if (s instanceof Segment.Index i) {
        sb.append('[').append(i.index()).append(']');
      }
    }
    return sb.toString();
  }

  @Override
  public String toString() {
    return render();
  }

  static boolean isIdentifier(String name) {
    if (name.isEmpty() || !Character.isJavaIdentifierStart(name.charAt(0))) {
      return false;
    }
    for (int i = 1; i < name.length(); i++) {
      if (!Character.isJavaIdentifierPart(name.charAt(i))) return false;
    }
    return true;
  }

  /// One navigation step
  public sealed interface Segment {
    record Field(String name) implements Segment {
    }

    record Index(int index) implements Segment {
    }

    record Branch(int index) implements Segment {
    }
  }
}
