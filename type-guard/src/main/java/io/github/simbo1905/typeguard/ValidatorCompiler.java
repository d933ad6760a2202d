package io.github.simbo1905.typeguard;

import io.github.simbo1905.typeguard.TypeDescriptor.ArrayOf;
import io.github.simbo1905.typeguard.TypeDescriptor.IndexKey;
import io.github.simbo1905.typeguard.TypeDescriptor.IndexSignature;
import io.github.simbo1905.typeguard.TypeDescriptor.Intersection;
import io.github.simbo1905.typeguard.TypeDescriptor.Literal;
import io.github.simbo1905.typeguard.TypeDescriptor.ObjectShape;
import io.github.simbo1905.typeguard.TypeDescriptor.Primitive;
import io.github.simbo1905.typeguard.TypeDescriptor.Property;
import io.github.simbo1905.typeguard.TypeDescriptor.Reference;
import io.github.simbo1905.typeguard.TypeDescriptor.Tuple;
import io.github.simbo1905.typeguard.TypeDescriptor.Union;
import io.github.simbo1905.typeguard.Verdict.ArityMismatch;
import io.github.simbo1905.typeguard.Verdict.Fail;
import io.github.simbo1905.typeguard.Verdict.MissingProperty;
import io.github.simbo1905.typeguard.Verdict.NoUnionMemberMatched;
import io.github.simbo1905.typeguard.Verdict.SuperfluousProperty;
import io.github.simbo1905.typeguard.Verdict.TypeMismatch;
import io.github.simbo1905.typeguard.Verdict.Unreachable;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

/// Lowers a [NormalizedType] into a tree of [Check] closures.
///
/// Nodes are compiled once each, keyed by identity; the normalizer interns equal
/// subtrees so structurally equal nodes share a check. Each recursive definition
/// gets an arena slot and references call through the slot at validation time,
/// so compilation never follows a cycle. Container checks run as [Check.Frame]s on
/// the context's work stack, so validation depth is bounded by the heap, not the thread stack.
final class ValidatorCompiler {

  private static final Logger LOG = Logger.getLogger(ValidatorCompiler.class.getName());

  private static final Check PASS = (value, context) -> Verdict.pass();
  private static final Check NEVER = (value, context) -> context.fail(Unreachable.INSTANCE);

  private final Map<String, Integer> slots = new HashMap<>();
  private final Check[] arena;
  private final Map<TypeDescriptor, Check> compiled = new IdentityHashMap<>();

  private ValidatorCompiler(NormalizedType type) {
    this.arena = new Check[type.definitions().size()];
    int slot = 0;
    for (String id : type.definitions().keySet()) {
      slots.put(id, slot++);
    }
  }

  static CompiledValidator compile(NormalizedType type) {
    final var compiler = new ValidatorCompiler(type);
    for (var entry : type.definitions().entrySet()) {
      compiler.arena[compiler.slots.get(entry.getKey())] = compiler.compileNode(entry.getValue());
    }
    final var root = compiler.compileNode(type.root());
    StructuredLog.fine(LOG, "compile.done", "nodes", compiler.compiled.size(),
        "definitions", compiler.arena.length, "type", type);
    return new CompiledValidator(type, root);
  }

  private Check compileNode(TypeDescriptor d) {
    final var existing = compiled.get(d);
    if (existing != null) {
      return existing;
    }
    LOG.finest(() -> "compile node " + d.getClass().getSimpleName());
    final Check check;
    if (d instanceof Primitive p) {
      check = primitive(p);
    } else if (d instanceof Literal l) {
      check = literal(l);
    } else if (d instanceof ArrayOf a) {
      check = array(a);
    } else if (d instanceof Tuple t) {
      check = tuple(t);
    } else if (d instanceof ObjectShape o) {
      check = object(o);
    } else if (d instanceof Union u) {
      check = union(u);
    } else if (d instanceof Intersection i) {
      check = intersection(i);
    } else if (d instanceof Reference r) {
      check = reference(r);
    } else {
      // Generic and Parameter never survive normalization
      throw new IllegalStateException("descriptor is not normalized: " + DescriptorPrinter.print(d));
    }
    compiled.put(d, check);
    return check;
  }

  private static Check primitive(Primitive p) {
    final var kind = p.kind();
    return switch (kind) {
      case ANY, UNKNOWN -> PASS;
      case NEVER -> NEVER;
      default -> (value, context) -> {
        if (kind.matches(value)) {
          context.progress();
          return Verdict.pass();
        }
        return context.fail(new TypeMismatch(kind.typeName(), RuntimeKinds.describe(value)));
      };
    };
  }

  private static Check literal(Literal l) {
    final var sb = new StringBuilder();
    DescriptorPrinter.appendLiteral(sb, l.value());
    final var expected = sb.toString();
    return (value, context) -> {
      if (l.matches(value)) {
        context.progress();
        return Verdict.pass();
      }
      return context.fail(new TypeMismatch(expected, RuntimeKinds.describeValue(value)));
    };
  }

  private Check array(ArrayOf a) {
    final var element = compileNode(a.element());
    return (value, context) -> {
      if (!RuntimeKinds.isSequence(value)) {
        return context.fail(new TypeMismatch("array", RuntimeKinds.describe(value)));
      }
      final int length = RuntimeKinds.length(value);
      return context.suspend(new Check.Frame() {
        private int next;

        @Override
        public Verdict resume(Verdict child, ValidationContext ctx) {
          if (child != null) {
            ctx.pop();
            if (!child.passed()) return child;
          }
          if (next == length) {
            return Verdict.pass();
          }
          final int i = next++;
          ctx.push(new Path.Segment.Index(i));
          return ctx.descend(element, RuntimeKinds.element(value, i));
        }
      });
    };
  }

  private Check tuple(Tuple t) {
    final var fixed = t.fixed().stream().map(this::compileNode).toArray(Check[]::new);
    final var restType = t.restType();
    final Check rest = restType == null ? null : compileNode(restType);
    final int minimum = fixed.length;
    final int maximum = rest == null ? fixed.length : -1;
    return (value, context) -> {
      if (!RuntimeKinds.isSequence(value)) {
        return context.fail(new TypeMismatch("array", RuntimeKinds.describe(value)));
      }
      final int length = RuntimeKinds.length(value);
      if (length < minimum || (maximum >= 0 && length > maximum)) {
        return context.fail(new ArityMismatch(minimum, maximum, length));
      }
      return context.suspend(new Check.Frame() {
        private int next;

        @Override
        public Verdict resume(Verdict child, ValidationContext ctx) {
          if (child != null) {
            ctx.pop();
            if (!child.passed()) return child;
          }
          if (next == length) {
            return Verdict.pass();
          }
          final int i = next++;
          ctx.push(new Path.Segment.Index(i));
          return ctx.descend(i < fixed.length ? fixed[i] : rest, RuntimeKinds.element(value, i));
        }
      });
    };
  }

  private Check object(ObjectShape o) {
    final int count = o.properties().size();
    final var names = new String[count];
    final var optional = new boolean[count];
    final var checks = new Check[count];
    for (int i = 0; i < count; i++) {
      final Property p = o.properties().get(i);
      names[i] = p.name();
      optional[i] = p.optional();
      checks[i] = compileNode(p.type());
    }
    final IndexSignature stringIndex = o.index(IndexKey.STRING);
    final IndexSignature numberIndex = o.index(IndexKey.NUMBER);
    final var shape = new ObjectCheck(names, optional, checks,
        new DeclaredKeys(Set.of(names), stringIndex != null, numberIndex != null),
        stringIndex == null ? null : compileNode(stringIndex.type()),
        numberIndex == null ? null : compileNode(numberIndex.type()));
    return shape::start;
  }

  /// Declared properties first, then every undeclared key against the index signatures
  /// and, in strict mode, the superfluous-key rule
  private record ObjectCheck(String[] names, boolean[] optional, Check[] checks, DeclaredKeys declared,
                             Check stringCheck, Check numberCheck) {

    Verdict start(Object value, ValidationContext context) {
      if (!(value instanceof Map<?, ?> map)) {
        return context.fail(new TypeMismatch("object", RuntimeKinds.describe(value)));
      }
      return context.suspend(new Walk(value, RuntimeKinds.stringKeyed(map), context));
    }

    private final class Walk implements Check.Frame {
      private final Map<String, Object> entries;
      private final boolean closed;
      private final boolean deferred;
      private int next;
      private Iterator<Map.Entry<String, Object>> extras;
      private String key;
      private Object member;
      private boolean stringPending;

      Walk(Object value, Map<String, Object> entries, ValidationContext context) {
        this.entries = entries;
        this.deferred = context.strict() && context.strictDeferred(value);
        this.closed = context.strict() && !deferred;
      }

      @Override
      public Verdict resume(Verdict child, ValidationContext context) {
        if (child != null) {
          context.pop();
          if (!child.passed()) return child;
        }
        if (stringPending) {
          stringPending = false;
          return visit(stringCheck, key, member, context);
        }
        while (next < names.length) {
          final int i = next++;
          final var name = names[i];
          if (!entries.containsKey(name)) {
            if (optional[i]) continue;
            return context.fail(new MissingProperty(name));
          }
          final var value = entries.get(name);
          if (optional[i] && value == Undefined.VALUE) continue;
          context.progress();
          return visit(checks[i], name, value, context);
        }
        if (extras == null) {
          if (stringCheck == null && numberCheck == null && !closed) {
            return finish(context);
          }
          extras = entries.entrySet().iterator();
        }
        while (extras.hasNext()) {
          final var entry = extras.next();
          final var name = entry.getKey();
          if (declared.names().contains(name)) continue;
          if (numberCheck != null && RuntimeKinds.isNumericKey(name)) {
            key = name;
            member = entry.getValue();
            stringPending = stringCheck != null;
            return visit(numberCheck, name, member, context);
          }
          if (stringCheck != null) {
            return visit(stringCheck, name, entry.getValue(), context);
          }
          if (closed) {
            return context.fail(new SuperfluousProperty(name));
          }
        }
        return finish(context);
      }

      private Verdict finish(ValidationContext context) {
        if (deferred) {
          context.declare(declared);
        }
        return Verdict.pass();
      }
    }
  }

  private static Verdict visit(Check check, String key, Object member, ValidationContext context) {
    context.push(new Path.Segment.Field(key));
    return context.descend(check, member);
  }

  private Check union(Union u) {
    final var members = u.members().stream().map(this::compileNode).toArray(Check[]::new);
    return (value, context) -> context.suspend(new UnionWalk(members, value, context.explain()));
  }

  /// Tries members in order; the first to pass wins. A failed member's declared keys are forgotten.
  private static final class UnionWalk implements Check.Frame {
    private final Check[] members;
    private final Object value;
    private final List<Fail> attempts;
    private int next;
    private int progressMark;
    private int declaredMark;
    private int closest = -1;
    private int closestDepth = -1;
    private int closestProgress = -1;

    UnionWalk(Check[] members, Object value, boolean explain) {
      this.members = members;
      this.value = value;
      this.attempts = explain ? new ArrayList<>(members.length) : List.of();
    }

    @Override
    public Verdict resume(Verdict child, ValidationContext context) {
      if (child != null) {
        context.pop();
        if (child.passed()) {
          return child;
        }
        context.rewindDeclared(declaredMark);
        if (context.explain()) {
          remember((Fail) child, context.progressMark() - progressMark);
        }
      }
      if (next == members.length) {
        return context.fail(new NoUnionMemberMatched(attempts, closest));
      }
      final int i = next++;
      progressMark = context.progressMark();
      declaredMark = context.declaredMark();
      context.push(new Path.Segment.Branch(i));
      return context.descend(members[i], value);
    }

    private void remember(Fail fail, int gained) {
      final int depth = fail.depth();
      if (depth > closestDepth || (depth == closestDepth && gained > closestProgress)) {
        closest = attempts.size();
        closestDepth = depth;
        closestProgress = gained;
      }
      attempts.add(fail);
    }
  }

  /// Runs every member on the same value. The outermost strict intersection on a value
  /// owns its superfluous-key check and accepts only keys declared by object members
  /// that passed, so a union member contributes the keys of the branch that matched.
  private Check intersection(Intersection in) {
    final var members = in.members().stream().map(this::compileNode).toArray(Check[]::new);
    return (value, context) -> {
      final boolean owner = context.strict() && !context.strictDeferred(value);
      final Object previous = context.deferStrict(value);
      final int mark = context.declaredMark();
      return context.suspend(new Check.Frame() {
        private int next;

        @Override
        public Verdict resume(Verdict child, ValidationContext ctx) {
          if (child != null && !child.passed()) {
            ctx.restoreStrict(previous);
            return child;
          }
          if (next < members.length) {
            return ctx.descend(members[next++], value);
          }
          ctx.restoreStrict(previous);
          if (!owner) {
            return Verdict.pass();
          }
          Verdict verdict = Verdict.pass();
          if (value instanceof Map<?, ?> map) {
            for (String key : RuntimeKinds.stringKeyed(map).keySet()) {
              if (!ctx.declaredSince(mark, key)) {
                verdict = ctx.fail(new SuperfluousProperty(key));
                break;
              }
            }
          }
          ctx.rewindDeclared(mark);
          return verdict;
        }
      });
    };
  }

  private Check reference(Reference r) {
    final Integer slot = slots.get(r.id());
    if (slot == null) {
      throw new IllegalStateException("reference has no recursive definition: " + r.id());
    }
    final int index = slot;
    final Check[] table = arena;
    return (value, context) -> {
      final var target = table[index];
      if (!RuntimeKinds.isContainer(value)) {
        return target.start(value, context);
      }
      if (!context.enter(index, value)) {
        LOG.finest(() -> "cycle guard: " + r.id() + " re-entered on the same value, treating as pass");
        return Verdict.pass();
      }
      return context.suspend((child, ctx) -> {
        if (child == null) {
          return ctx.descend(target, value);
        }
        ctx.exit(index, value);
        return child;
      });
    };
  }
}
