package io.github.simbo1905.typeguard;

import java.util.List;
import java.util.Objects;

/// Outcome of one validation: [Pass] or [Fail] with the failure reason and where it happened.
///
/// Failures are values, never exceptions; only the assertion entry points turn a
/// [Fail] into a [TypeGuardException].
public sealed interface Verdict {

  boolean passed();

  static Verdict pass() {
    return Pass.INSTANCE;
  }

  static Fail fail(Reason reason, Path path) {
    return new Fail(reason, path);
  }

  enum Pass implements Verdict {
    INSTANCE;

    @Override
    public boolean passed() {
      return true;
    }
  }

  record Fail(Reason reason, Path path) implements Verdict {
    public Fail {
      Objects.requireNonNull(reason, "reason");
      Objects.requireNonNull(path, "path");
    }

    @Override
    public boolean passed() {
      return false;
    }

    /// How far into the value this failure was detected.
    ///
    /// Missing and superfluous keys count one level below their object; a union
    /// failure is as deep as its closest attempt.
    public int depth() {
      final var innermost = innermost();
      final int depth = innermost.path.depth();
      return innermost.reason instanceof MissingProperty || innermost.reason instanceof SuperfluousProperty
          ? depth + 1
          : depth;
    }

    /// `value.items[2].name: expected string, got number`
    public String message() {
      final var sb = new StringBuilder();
      Fail fail = this;
      while (fail.reason instanceof NoUnionMemberMatched u && u.closest() != null) {
        sb.append(fail.path.render()).append(": no union member matched; closest: ");
        fail = u.closest();
      }
      return sb.append(fail.path.render()).append(": ").append(fail.reason.describe()).toString();
    }

    /// Follows closest union attempts down to the failure that is not a union
    private Fail innermost() {
      Fail fail = this;
      while (fail.reason instanceof NoUnionMemberMatched u && u.closest() != null) {
        fail = u.closest();
      }
      return fail;
    }

    @Override
    public String toString() {
      return message();
    }
  }

  /// Why a value failed
  sealed interface Reason {
    String describe();
  }

  record TypeMismatch(String expected, String actual) implements Reason {
    @Override
    public String describe() {
      return "expected " + expected + ", got " + actual;
    }
  }

  record MissingProperty(String name) implements Reason {
    @Override
    public String describe() {
      return "missing required property " + DescriptorPrinter.quote(name);
    }
  }

  record SuperfluousProperty(String key) implements Reason {
    @Override
    public String describe() {
      return "superfluous property " + DescriptorPrinter.quote(key);
    }
  }

  /// Sequence length outside `[minimum, maximum]`; `maximum` is -1 when a rest element is declared
  record ArityMismatch(int minimum, int maximum, int actual) implements Reason {
    @Override
    public String describe() {
      final String expected = maximum < 0
          ? "at least " + minimum + " element" + (minimum == 1 ? "" : "s")
          : maximum + " element" + (maximum == 1 ? "" : "s");
      return "expected " + expected + ", got " + actual;
    }
  }

  /// Every member failed. `attempts` is empty when validation ran without diagnostics.
  record NoUnionMemberMatched(List<Fail> attempts, int closestIndex) implements Reason {
    public NoUnionMemberMatched {
      attempts = List.copyOf(attempts);
    }

    /// The most specific attempt, or `null` when none were recorded
    public Fail closest() {
      return closestIndex >= 0 && closestIndex < attempts.size() ? attempts.get(closestIndex) : null;
    }

    @Override
    public String describe() {
      final var closest = closest();
      return closest == null
          ? "no union member matched"
          : "no union member matched; closest: " + closest.message();
    }
  }

  enum Unreachable implements Reason {
    INSTANCE;

    @Override
    public String describe() {
      return "no value is assignable to never";
    }
  }
}
