package io.github.simbo1905.typeguard;

import java.util.Locale;
import java.util.Objects;
import java.util.logging.Logger;

/// Process-wide configuration for every [TypeGuard].
///
/// Defaults come from system properties, read once when the class loads:
///
/// - `typeguard.shortCircuit` (`true`/`false`, default `false`): when on, every
///   check reports a pass without looking at the value
/// - `typeguard.messages` (`full` or `none`, default `full`): `none` installs
///   [MessageHook#SUPPRESSED]
///
/// The short-circuit flag is read when a check starts; the message hook only when an
/// assertion failure is being rendered.
public final class TypeGuardSettings {

  private static final Logger LOG = Logger.getLogger(TypeGuardSettings.class.getName());

  public static final String SHORT_CIRCUIT_PROPERTY = "typeguard.shortCircuit";
  public static final String MESSAGES_PROPERTY = "typeguard.messages";

  private static final boolean DEFAULT_SHORT_CIRCUIT = Boolean.getBoolean(SHORT_CIRCUIT_PROPERTY);
  private static final MessageHook DEFAULT_HOOK = hookFor(System.getProperty(MESSAGES_PROPERTY, "full"));

  private static volatile boolean shortCircuit = DEFAULT_SHORT_CIRCUIT;
  private static volatile MessageHook messageHook = DEFAULT_HOOK;

  private TypeGuardSettings() {
  }

  public static boolean shortCircuit() {
    return shortCircuit;
  }

  public static void shortCircuit(boolean enabled) {
    LOG.info(() -> "typeguard short-circuit " + (enabled ? "enabled" : "disabled"));
    shortCircuit = enabled;
  }

  public static MessageHook messageHook() {
    return messageHook;
  }

  public static void messageHook(MessageHook hook) {
    messageHook = Objects.requireNonNull(hook, "hook");
  }

  /// Restores the defaults read from system properties
  public static void reset() {
    shortCircuit = DEFAULT_SHORT_CIRCUIT;
    messageHook = DEFAULT_HOOK;
  }

  static MessageHook hookFor(String setting) {
    return switch (setting.trim().toLowerCase(Locale.ROOT)) {
      case "full" -> MessageHook.DEFAULT;
      case "none" -> MessageHook.SUPPRESSED;
      default -> {
        LOG.warning(() -> "ignoring " + MESSAGES_PROPERTY + "=" + setting + "; expected full or none");
        yield MessageHook.DEFAULT;
      }
    };
  }
}
