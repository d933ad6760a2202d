package io.github.simbo1905.typeguard.jackson;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.simbo1905.typeguard.Undefined;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/// Converts Jackson trees into the plain values a [io.github.simbo1905.typeguard.TypeGuard] checks.
///
/// | JSON | Java |
/// |------|------|
/// | object | `LinkedHashMap<String, Object>` in document order |
/// | array | `ArrayList<Object>` |
/// | string | `String` |
/// | integral number | `Long`, or `BigDecimal` when out of range |
/// | fractional number | `Double`, or `BigDecimal` when parsed as one |
/// | true / false | `Boolean` |
/// | null | `null` |
/// | missing node | [Undefined#VALUE] |
///
/// JSON has no bigint, so no conversion ever yields a `BigInteger`.
public final class JacksonValues {

  private static final ObjectMapper MAPPER = new ObjectMapper();

  private JacksonValues() {
  }

  /// Parses `json` and converts the tree
  ///
  /// @throws IllegalArgumentException if `json` is not well-formed
  public static Object parse(String json) {
    Objects.requireNonNull(json, "json");
    try {
      return toValue(MAPPER.readTree(json));
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("not valid JSON: " + e.getOriginalMessage(), e);
    }
  }

  public static Object toValue(JsonNode node) {
    if (node == null || node.isMissingNode()) {
      return Undefined.VALUE;
    }
    if (node.isNull()) {
      return null;
    }
    if (node.isObject()) {
      final var map = new LinkedHashMap<String, Object>(Math.max(16, node.size() * 2));
      final Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
      while (fields.hasNext()) {
        final var field = fields.next();
        map.put(field.getKey(), toValue(field.getValue()));
      }
      return map;
    }
    if (node.isArray()) {
      final var list = new ArrayList<Object>(node.size());
      for (JsonNode element : node) {
        list.add(toValue(element));
      }
      return list;
    }
    if (node.isTextual()) {
      return node.textValue();
    }
    if (node.isBoolean()) {
      return node.booleanValue();
    }
    if (node.isIntegralNumber()) {
      return node.canConvertToLong() ? (Object) node.longValue() : node.decimalValue();
    }
    if (node.isBigDecimal()) {
      return node.decimalValue();
    }
    if (node.isNumber()) {
      return node.doubleValue();
    }
    // binary and POJO nodes have no structural counterpart
    return node;
  }
}
