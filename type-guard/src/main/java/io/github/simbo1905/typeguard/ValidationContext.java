package io.github.simbo1905.typeguard;

import io.github.simbo1905.typeguard.Verdict.Fail;
import io.github.simbo1905.typeguard.Verdict.Reason;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/// Per-call state: modes, the work stack, the path stack, the recursion guard and a
/// progress counter. Created for one top-level call and never shared between threads.
final class ValidationContext {

  private final boolean strict;
  private final boolean explain;
  private final Deque<Check.Frame> frames = new ArrayDeque<>();
  private final List<Path.Segment> path;
  private final Set<GuardKey> active = new HashSet<>();
  private final List<DeclaredKeys> declared = new ArrayList<>();
  private Check pendingCheck;
  private Object pendingValue;
  private int progress;
  private Object strictHandledByIntersection;

  ValidationContext(boolean strict, boolean explain) {
    this.strict = strict;
    this.explain = explain;
    this.path = explain ? new ArrayList<>() : List.of();
  }

  /// Runs `root` against `value` to completion.
  ///
  /// Each iteration resumes the top frame with the verdict of the child it last asked
  /// for (`null` when the frame was just pushed) until the stack is empty.
  Verdict run(Check root, Object value) {
    Verdict verdict = root.start(value, this);
    while (!frames.isEmpty()) {
      final var outcome = frames.peek().resume(verdict, this);
      if (outcome != null) {
        frames.pop();
        verdict = outcome;
        continue;
      }
      final var check = pendingCheck;
      final var child = pendingValue;
      if (check == null) {
        throw new IllegalStateException("frame suspended without asking for a child");
      }
      pendingCheck = null;
      pendingValue = null;
      verdict = check.start(child, this);
    }
    return verdict;
  }

  /// Pushes `frame`; the check that created it returns this `null` from [Check#start]
  Verdict suspend(Check.Frame frame) {
    frames.push(frame);
    return null;
  }

  /// Asks the run loop to check `child` and resume the current frame with the verdict
  Verdict descend(Check check, Object child) {
    pendingCheck = check;
    pendingValue = child;
    return null;
  }

  /// Reject keys no descriptor declares
  boolean strict() {
    return strict;
  }

  /// Record paths and union attempts
  boolean explain() {
    return explain;
  }

  void push(Path.Segment segment) {
    if (explain) path.add(segment);
  }

  void pop() {
    if (explain) path.remove(path.size() - 1);
  }

  Fail fail(Reason reason) {
    return new Fail(reason, explain ? new Path(path) : Path.root());
  }

  /// Counts a satisfied check; union diagnostics prefer the attempt that got furthest
  void progress() {
    progress++;
  }

  int progressMark() {
    return progress;
  }

  /// Marks `value` as having its superfluous-key check done by an enclosing intersection.
  /// Returns the previous mark for [#restoreStrict].
  Object deferStrict(Object value) {
    final var previous = strictHandledByIntersection;
    strictHandledByIntersection = value;
    return previous;
  }

  void restoreStrict(Object previous) {
    strictHandledByIntersection = previous;
  }

  boolean strictDeferred(Object value) {
    return strictHandledByIntersection == value;
  }

  /// Records the keys an object accepted on a value whose key check an intersection owns
  void declare(DeclaredKeys keys) {
    declared.add(keys);
  }

  int declaredMark() {
    return declared.size();
  }

  /// Forgets keys declared since `mark`, as when a union branch fails
  void rewindDeclared(int mark) {
    declared.subList(mark, declared.size()).clear();
  }

  /// True if an object that passed since `mark` accepts `key`
  boolean declaredSince(int mark, String key) {
    for (int i = mark; i < declared.size(); i++) {
      if (declared.get(i).covers(key)) return true;
    }
    return false;
  }

  /// False if `(slot, value)` is already being validated further up this call
  boolean enter(int slot, Object value) {
    return active.add(new GuardKey(slot, value));
  }

  void exit(int slot, Object value) {
    active.remove(new GuardKey(slot, value));
  }

  /// Recursive definition slot plus value identity
  private record GuardKey(int slot, Object value) {
    @Override
    public boolean equals(Object obj) {
      return obj instanceof GuardKey other && other.slot == slot && other.value == value;
    }

    @Override
    public int hashCode() {
      return 31 * slot + System.identityHashCode(value);
    }
  }
}
