package io.github.simbo1905.typeguard;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.List;
import java.util.Map;

/// Classifies plain Java values into the runtime kinds used in failure messages
final class RuntimeKinds {

  private RuntimeKinds() {
  }

  static String describe(Object value) {
    if (value == null) return "null";
    if (value == Undefined.VALUE) return "undefined";
    if (value instanceof String) return "string";
    if (value instanceof Boolean) return "boolean";
    if (value instanceof BigInteger) return "bigint";
    if (value instanceof Number) return "number";
    if (isSequence(value)) return "array";
    if (value instanceof Map) return "object";
    return value.getClass().getSimpleName();
  }

  /// Like [#describe] but shows the value itself for strings, numbers and booleans
  static String describeValue(Object value) {
    if (value instanceof String s) return DescriptorPrinter.quote(s);
    if (value instanceof Boolean || (value instanceof Number && !(value instanceof BigInteger))) {
      return String.valueOf(value);
    }
    if (value instanceof BigInteger b) return b + "n";
    return describe(value);
  }

  static boolean isSequence(Object value) {
    return value instanceof List || (value != null && value.getClass().isArray());
  }

  /// Values that may take part in a cycle; scalars never can
  static boolean isContainer(Object value) {
    return value instanceof Map || isSequence(value);
  }

  static int length(Object sequence) {
    if (sequence instanceof List<?> list) {
      return list.size();
    }
    return java.lang.reflect.Array.getLength(sequence);
  }

  static Object element(Object sequence, int index) {
    if (sequence instanceof List<?> list) {
      return list.get(index);
    }
    return java.lang.reflect.Array.get(sequence, index);
  }

  /// Own keys as strings. Maps keyed by anything other than `String` are copied once.
  @SuppressWarnings("unchecked")
  static Map<String, Object> stringKeyed(Map<?, ?> map) {
    for (Object key : map.keySet()) {
      if (!(key instanceof String)) {
        final var copy = new java.util.LinkedHashMap<String, Object>(map.size() * 2);
        map.forEach((k, v) -> copy.put(String.valueOf(k), v));
        return copy;
      }
    }
    return (Map<String, Object>) map;
  }

  /// Canonical numeric string test: the key is numeric when printing the number it
  /// parses to gives the key back, as JavaScript prints numbers. So `"0"`, `"-1.5"`,
  /// `"1e+21"`, `"1e-7"`, `"NaN"` and `"Infinity"` are numeric, while `"01"`, `"1e3"`
  /// and `"1.0"` are not. `"-0"` is numeric too although `-0` prints as `"0"`.
  static boolean isNumericKey(String key) {
    if ("-0".equals(key)) return true;
    final double parsed;
    try {
      parsed = Double.parseDouble(key);
    } catch (NumberFormatException e) {
      return false;
    }
    return numberToString(parsed).equals(key);
  }

  /// JavaScript `Number.prototype.toString()` for a double
  static String numberToString(double d) {
    if (Double.isNaN(d)) return "NaN";
    if (d == 0) return "0";
    if (Double.isInfinite(d)) return d > 0 ? "Infinity" : "-Infinity";
    if (d < 0) return "-" + numberToString(-d);
    // shortest digits such that d = digits x 10^(n - k)
    final var decimal = new BigDecimal(Double.toString(d)).stripTrailingZeros();
    final String digits = decimal.unscaledValue().toString();
    final int k = digits.length();
    final int n = k - decimal.scale();
    if (k <= n && n <= 21) {
      return digits + "0".repeat(n - k);
    }
    if (0 < n && n <= 21) {
      return digits.substring(0, n) + "." + digits.substring(n);
    }
    if (-6 < n && n <= 0) {
      return "0." + "0".repeat(-n) + digits;
    }
    final int exponent = n - 1;
    final String suffix = (exponent < 0 ? "e-" : "e+") + Math.abs(exponent);
    return k == 1 ? digits + suffix : digits.charAt(0) + "." + digits.substring(1) + suffix;
  }
}
