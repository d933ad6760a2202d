package io.github.simbo1905.typeguard;

import java.util.Set;

/// Keys one object descriptor accepts: its property names plus whatever its index signatures cover
record DeclaredKeys(Set<String> names, boolean stringIndex, boolean numberIndex) {

  DeclaredKeys {
    names = Set.copyOf(names);
  }

  boolean covers(String key) {
    return stringIndex || names.contains(key) || (numberIndex && RuntimeKinds.isNumericKey(key));
  }
}
