package io.github.simbo1905.typeguard;

import io.github.simbo1905.typeguard.DescriptorException.Reason;
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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.UnaryOperator;
import java.util.logging.Logger;

/// One normalization session against a [TypeRegistry]. Not thread-safe; not reused.
///
/// 1. close: instantiate generics (memoized on base and arguments), substitute parameters,
///    collect every reachable definition
/// 2. find the definitions that lie on a reference cycle
/// 3. reject cycles that never descend into the value
/// 4. inline non-recursive definitions and intern equal subtrees
final class Normalizer {

  private static final Logger LOG = Logger.getLogger(Normalizer.class.getName());

  static final int MAX_INSTANTIATIONS_PER_BASE = 256;

  private final TypeRegistry registry;

  /// id -> closed body; bodies may still reference each other
  private final Map<String, TypeDescriptor> closed = new LinkedHashMap<>();
  private final Deque<PendingBody> pending = new ArrayDeque<>();
  private final Set<String> scheduled = new HashSet<>();
  private final Map<InstantiationKey, String> instantiations = new HashMap<>();
  private final Map<String, Integer> instantiationsPerBase = new HashMap<>();

  private final Map<TypeDescriptor, TypeDescriptor> interned = new HashMap<>();
  private final Map<String, TypeDescriptor> inlined = new HashMap<>();
  private Set<String> recursive = Set.of();

  Normalizer(TypeRegistry registry) {
    this.registry = registry;
  }

  private record PendingBody(String id, TypeDescriptor body, Map<String, TypeDescriptor> bindings) {
  }

  private record InstantiationKey(String baseId, List<TypeDescriptor> arguments) {
  }

  NormalizedType normalize(TypeDescriptor root) {
    final var closedRoot = close(root, Map.of());
    while (!pending.isEmpty()) {
      final var next = pending.pop();
      StructuredLog.finer(LOG, "normalize.close", "id", next.id());
      closed.put(next.id(), close(next.body(), next.bindings()));
    }

    recursive = findRecursive();
    for (String id : recursive) {
      checkConsumesValue(id);
    }

    final var canonicalRoot = canonical(closedRoot);
    final var definitions = new LinkedHashMap<String, TypeDescriptor>();
    for (var entry : closed.entrySet()) {
      if (recursive.contains(entry.getKey())) {
        definitions.put(entry.getKey(), canonical(entry.getValue()));
      }
    }
    StructuredLog.fine(LOG, "normalize.done",
        "reachable", closed.size(), "recursive", recursive.size(), "instantiations", instantiations.size(),
        "interned", interned.size());
    return new NormalizedType(canonicalRoot, definitions);
  }

  // ------------------------------------------------------------------
  // Closing: generic instantiation and parameter substitution
  // ------------------------------------------------------------------

  private TypeDescriptor close(TypeDescriptor d, Map<String, TypeDescriptor> bindings) {
    if (d instanceof Parameter p) {
      final var bound = bindings.get(p.name());
      if (bound == null) {
        throw error(Reason.UNBOUND_TYPE_PARAMETER, "unbound type parameter " + p.name());
      }
      return bound;
    }
    if (d instanceof Reference r) {
      scheduleDefinition(r.id());
      return r;
    }
    if (d instanceof Generic g) {
      return instantiate(g, bindings);
    }
    return rebuild(d, child -> close(child, bindings));
  }

  private void scheduleDefinition(String id) {
    if (scheduled.contains(id)) {
      return;
    }
    final var body = registry.definition(id);
    if (body == null) {
      if (registry.generic(id) != null) {
        throw error(Reason.MALFORMED_DESCRIPTOR, "generic " + id + " referenced without type arguments");
      }
      throw error(Reason.UNRESOLVED_REFERENCE, "unresolved reference: " + id);
    }
    scheduled.add(id);
    pending.push(new PendingBody(id, body, Map.of()));
  }

  private Reference instantiate(Generic g, Map<String, TypeDescriptor> bindings) {
    final var definition = registry.generic(g.baseId());
    if (definition == null) {
      if (registry.definition(g.baseId()) != null) {
        throw error(Reason.MALFORMED_DESCRIPTOR, g.baseId() + " is not generic");
      }
      throw error(Reason.UNRESOLVED_REFERENCE, "unresolved generic: " + g.baseId());
    }
    if (definition.parameters().size() != g.arguments().size()) {
      throw error(Reason.MALFORMED_DESCRIPTOR, "generic " + g.baseId() + " expects "
          + definition.parameters().size() + " type arguments, got " + g.arguments().size());
    }
    final var arguments = new ArrayList<TypeDescriptor>(g.arguments().size());
    for (TypeDescriptor argument : g.arguments()) {
      arguments.add(close(argument, bindings));
    }
    final var key = new InstantiationKey(g.baseId(), List.copyOf(arguments));
    final var existing = instantiations.get(key);
    if (existing != null) {
      return new Reference(existing);
    }

    final int count = instantiationsPerBase.merge(g.baseId(), 1, Integer::sum);
    if (count > MAX_INSTANTIATIONS_PER_BASE) {
      LOG.warning(() -> "generic " + g.baseId() + " keeps producing new instantiations; last arguments "
          + arguments.stream().map(DescriptorPrinter::print).toList());
      throw error(Reason.MALFORMED_DESCRIPTOR, "generic " + g.baseId() + " does not converge after "
          + MAX_INSTANTIATIONS_PER_BASE + " instantiations");
    }

    final var id = uniqueId(DescriptorPrinter.print(new Generic(g.baseId(), arguments)));
    instantiations.put(key, id);
    scheduled.add(id);

    final var parameterBindings = new HashMap<String, TypeDescriptor>();
    for (int i = 0; i < arguments.size(); i++) {
      parameterBindings.put(definition.parameters().get(i), arguments.get(i));
    }
    pending.push(new PendingBody(id, definition.body(), parameterBindings));
    StructuredLog.finer(LOG, "normalize.instantiate", "id", id, "base", g.baseId());
    return new Reference(id);
  }

  private String uniqueId(String candidate) {
    if (!scheduled.contains(candidate) && registry.definition(candidate) == null) {
      return candidate;
    }
    int n = 2;
    while (scheduled.contains(candidate + "#" + n) || registry.definition(candidate + "#" + n) != null) {
      n++;
    }
    return candidate + "#" + n;
  }

  // ------------------------------------------------------------------
  // Cycle analysis
  // ------------------------------------------------------------------

  private Set<String> findRecursive() {
    final var result = new LinkedHashSet<String>();
    for (String id : closed.keySet()) {
      if (reaches(id, id, false)) {
        result.add(id);
      }
    }
    return result;
  }

  /// Rejects a definition that reaches itself without passing through an array,
  /// tuple or object position; validating it would revisit the same value forever
  private void checkConsumesValue(String id) {
    if (reaches(id, id, true)) {
      throw error(Reason.CYCLIC_WITHOUT_REFERENCE,
          "definition " + id + " refers back to itself without an intervening array, tuple or object");
    }
  }

  private boolean reaches(String from, String target, boolean unguardedOnly) {
    final Deque<String> work = new ArrayDeque<>();
    final Set<String> seen = new HashSet<>();
    work.push(from);
    while (!work.isEmpty()) {
      final var id = work.pop();
      final var body = closed.get(id);
      for (String next : unguardedOnly ? unguardedReferences(body) : body.references()) {
        if (next.equals(target)) {
          return true;
        }
        if (seen.add(next)) {
          work.push(next);
        }
      }
    }
    return false;
  }

  private static Set<String> unguardedReferences(TypeDescriptor body) {
    final var ids = new LinkedHashSet<String>();
    final Deque<TypeDescriptor> work = new ArrayDeque<>();
    work.push(body);
    while (!work.isEmpty()) {
      final var d = work.pop();
      if (d instanceof Reference r) {
        ids.add(r.id());
      } else if (d instanceof Union || d instanceof Intersection) {
        d.children().forEach(work::push);
      }
    }
    return ids;
  }

  // ------------------------------------------------------------------
  // Inlining and interning
  // ------------------------------------------------------------------

  private TypeDescriptor canonical(TypeDescriptor d) {
    if (d instanceof Reference r && !recursive.contains(r.id())) {
      final var done = inlined.get(r.id());
      if (done != null) {
        return done;
      }
      final var body = canonical(closed.get(r.id()));
      inlined.put(r.id(), body);
      return body;
    }
    final var rebuilt = rebuild(d, this::canonical);
    final var existing = interned.putIfAbsent(rebuilt, rebuilt);
    return existing != null ? existing : rebuilt;
  }

  /// Copies `d` with `f` applied to each direct child
  static TypeDescriptor rebuild(TypeDescriptor d, UnaryOperator<TypeDescriptor> f) {
    if (d instanceof Primitive || d instanceof Literal || d instanceof Reference || d instanceof Parameter) {
      return d;
    }
    if (d instanceof ArrayOf a) {
      return new ArrayOf(f.apply(a.element()));
    }
    if (d instanceof Tuple t) {
      final var elements = new ArrayList<TupleElement>(t.elements().size());
      for (TupleElement e : t.elements()) {
        elements.add(new TupleElement(f.apply(e.type()), e.rest()));
      }
      return new Tuple(elements);
    }
    if (d instanceof ObjectShape o) {
      final var properties = new ArrayList<Property>(o.properties().size());
      for (Property p : o.properties()) {
        properties.add(new Property(p.name(), f.apply(p.type()), p.optional(), p.readonly()));
      }
      final var indexSignatures = new ArrayList<IndexSignature>(o.indexSignatures().size());
      for (IndexSignature s : o.indexSignatures()) {
        indexSignatures.add(new IndexSignature(s.key(), f.apply(s.type())));
      }
      return new ObjectShape(properties, indexSignatures);
    }
    if (d instanceof Union u) {
      return new Union(u.members().stream().map(f).toList());
    }
    if (d instanceof Intersection i) {
      return new Intersection(i.members().stream().map(f).toList());
    }
    if (d instanceof Generic g) {
      return new Generic(g.baseId(), g.arguments().stream().map(f).toList());
    }
    throw new AssertionError("unreachable: " + d.getClass());
  }

  private static DescriptorException error(Reason reason, String message) {
    LOG.severe(() -> "ERROR: DESCRIPTOR: " + reason + " " + message);
    return new DescriptorException(reason, message);
  }
}
