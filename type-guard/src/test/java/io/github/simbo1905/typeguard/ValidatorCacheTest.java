package io.github.simbo1905.typeguard;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static io.github.simbo1905.typeguard.Types.*;
import static org.assertj.core.api.Assertions.assertThat;

class ValidatorCacheTest extends TypeGuardTestBase {

  @Test
  void structurallyEqualDescriptorsShareOneCompiledValidator() {
    ValidatorCache.clear();
    final var before = ValidatorCache.size();

    TypeGuards.guard(object(property("id", number()), property("tags", array(string()))));
    TypeGuards.guard(object(property("id", number()), property("tags", array(string()))));
    TypeGuards.is(object(property("id", number()), property("tags", array(string()))), obj("id", 1, "tags", List.of()));

    assertThat(ValidatorCache.size()).isEqualTo(before + 1);
  }

  @Test
  void emptyRegistryDoesNotRetainNormalizations() {
    for (int i = 0; i < 50; i++) {
      TypeGuards.is(object(property("field" + i, number())), obj("field" + i, i));
    }
    assertThat(TypeRegistry.empty().cachedNormalizations()).isZero();
  }

  @Test
  void registriesWithTheSameDefinitionsShareCompiledValidators() {
    ValidatorCache.clear();
    final var first = TypeRegistry.builder()
        .define("Node", object(property("v", number()), optional("next", ref("Node"))))
        .build();
    final var second = TypeRegistry.builder()
        .define("Node", object(property("v", number()), optional("next", ref("Node"))))
        .build();

    first.guard(ref("Node"));
    second.guard(ref("Node"));

    assertThat(ValidatorCache.size()).isEqualTo(1);
  }

  @Test
  void oneGuardIsSafeToShareAcrossThreads() throws Exception {
    final var registry = TypeRegistry.builder()
        .define("Node", object(property("v", number()), optional("next", ref("Node"))))
        .build();
    final var guard = registry.guard(ref("Node"));
    final var good = obj("v", 1, "next", obj("v", 2));
    final var bad = obj("v", 1, "next", obj("v", "x"));
    final var cyclic = obj("v", 1);
    cyclic.put("next", cyclic);

    final int threads = 8;
    final var start = new CountDownLatch(1);
    final ExecutorService pool = Executors.newFixedThreadPool(threads);
    try {
      final List<Future<Boolean>> results = new ArrayList<>();
      for (int t = 0; t < threads; t++) {
        final Callable<Boolean> task = () -> {
          start.await();
          for (int i = 0; i < 500; i++) {
            if (!guard.is(good) || guard.is(bad) || !guard.isEqual(cyclic)) {
              return false;
            }
            final var verdict = (Verdict.Fail) guard.validate(bad);
            if (!verdict.message().equals("value.next.v: expected number, got string")) {
              return false;
            }
          }
          return true;
        };
        results.add(pool.submit(task));
      }
      start.countDown();
      for (Future<Boolean> result : results) {
        assertThat(result.get(30, TimeUnit.SECONDS)).isTrue();
      }
    } finally {
      pool.shutdownNow();
    }
  }

  @Test
  void concurrentFirstUseCompilesEquivalentValidators() throws Exception {
    ValidatorCache.clear();
    final var descriptor = union(tuple(string(), number()), record(bool()));
    final int threads = 8;
    final var start = new CountDownLatch(1);
    final ExecutorService pool = Executors.newFixedThreadPool(threads);
    try {
      final List<Future<TypeGuard>> guards = new ArrayList<>();
      for (int t = 0; t < threads; t++) {
        guards.add(pool.submit(() -> {
          start.await();
          return TypeGuards.guard(descriptor);
        }));
      }
      start.countDown();
      for (Future<TypeGuard> future : guards) {
        final var guard = future.get(30, TimeUnit.SECONDS);
        assertThat(guard.is(List.of("a", 1))).isTrue();
        assertThat(guard.is(obj("x", true))).isTrue();
        assertThat(guard.is(obj("x", 1))).isFalse();
      }
      assertThat(ValidatorCache.size()).isEqualTo(1);
    } finally {
      pool.shutdownNow();
    }
  }
}
