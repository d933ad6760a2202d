package io.github.simbo1905.typeguard;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Logger;

/// Process-wide compiled validators keyed by structurally equal [NormalizedType]s
final class ValidatorCache {

  private static final Logger LOG = Logger.getLogger(ValidatorCache.class.getName());

  private static final Map<NormalizedType, CompiledValidator> CACHE = new ConcurrentHashMap<>();

  private ValidatorCache() {
  }

  static CompiledValidator get(NormalizedType type) {
    final var cached = CACHE.get(type);
    if (cached != null) {
      LOG.finest(() -> "cache hit " + type);
      return cached;
    }
    // compile outside the map lock; a lost race only wastes one compilation
    final var compiled = ValidatorCompiler.compile(type);
    final var raced = CACHE.putIfAbsent(type, compiled);
    return raced != null ? raced : compiled;
  }

  static int size() {
    return CACHE.size();
  }

  static void clear() {
    CACHE.clear();
  }
}
