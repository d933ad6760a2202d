package io.github.simbo1905.typeguard;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/// A closed descriptor ready for compilation.
///
/// `root` and every body in `definitions` are free of generic instantiations and
/// type parameters. The only [TypeDescriptor.Reference] nodes left name recursive
/// definitions, and each of them has an entry in `definitions`.
public record NormalizedType(TypeDescriptor root, Map<String, TypeDescriptor> definitions) {

  public NormalizedType {
    Objects.requireNonNull(root, "root");
    definitions = Collections.unmodifiableMap(new LinkedHashMap<>(definitions));
  }

  @Override
  public String toString() {
    final var sb = new StringBuilder(DescriptorPrinter.print(root));
    definitions.forEach((id, body) -> sb.append("; ").append(id).append(" = ").append(DescriptorPrinter.print(body)));
    return sb.toString();
  }
}
