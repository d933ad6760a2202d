package io.github.simbo1905.typeguard;

/// Turns an assertion failure into exception text. Returning `null` suppresses the text.
@FunctionalInterface
public interface MessageHook {

  /// `value.items[2].name: expected string, got number`
  MessageHook DEFAULT = Verdict.Fail::message;

  MessageHook SUPPRESSED = fail -> null;

  String message(Verdict.Fail fail);
}
