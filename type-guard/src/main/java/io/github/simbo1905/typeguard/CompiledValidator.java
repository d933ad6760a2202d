package io.github.simbo1905.typeguard;

/// Root [Check] of a compiled [NormalizedType]. Immutable; each run gets its own context.
final class CompiledValidator {

  private final NormalizedType type;
  private final Check root;

  CompiledValidator(NormalizedType type, Check root) {
    this.type = type;
    this.root = root;
  }

  NormalizedType type() {
    return type;
  }

  Verdict run(Object value, boolean strict, boolean explain) {
    return new ValidationContext(strict, explain).run(root, value);
  }

  @Override
  public String toString() {
    return "CompiledValidator[" + type + "]";
  }
}
