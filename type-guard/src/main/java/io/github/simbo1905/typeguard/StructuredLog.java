package io.github.simbo1905.typeguard;

import java.util.logging.Level;
import java.util.logging.Logger;

/// key=value JUL events: `event=compile.done nodes=12 definitions=1`.
/// Nothing is formatted unless the level is enabled.
final class StructuredLog {

  private static final int MAX_VALUE_LENGTH = 200;

  private StructuredLog() {
  }

  static void fine(Logger log, String event, Object... kv) {
    if (log.isLoggable(Level.FINE)) log.fine(() -> ev(event, kv));
  }

  static void finer(Logger log, String event, Object... kv) {
    if (log.isLoggable(Level.FINER)) log.finer(() -> ev(event, kv));
  }

  static String ev(String event, Object... kv) {
    final var sb = new StringBuilder(64).append("event=").append(event);
    for (int i = 0; i + 1 < kv.length; i += 2) {
      final String value = kv[i + 1] == null ? "null" : flatten(kv[i + 1].toString());
      sb.append(' ').append(kv[i]).append('=');
      if (value.indexOf(' ') >= 0 || value.indexOf('"') >= 0) {
        sb.append('"').append(value.replace("\"", "\\\"")).append('"');
      } else {
        sb.append(value);
      }
    }
    return sb.toString();
  }

  private static String flatten(String s) {
    final String trimmed = s.length() > MAX_VALUE_LENGTH ? s.substring(0, MAX_VALUE_LENGTH) + "..." : s;
    return trimmed.replace('\n', ' ').replace('\r', ' ').replace('\t', ' ');
  }
}
