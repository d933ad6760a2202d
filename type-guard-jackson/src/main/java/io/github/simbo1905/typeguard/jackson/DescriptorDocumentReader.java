package io.github.simbo1905.typeguard.jackson;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.simbo1905.typeguard.DescriptorException;
import io.github.simbo1905.typeguard.PrimitiveKind;
import io.github.simbo1905.typeguard.TypeDescriptor;
import io.github.simbo1905.typeguard.TypeDescriptor.IndexKey;
import io.github.simbo1905.typeguard.TypeDescriptor.IndexSignature;
import io.github.simbo1905.typeguard.TypeDescriptor.Property;
import io.github.simbo1905.typeguard.TypeDescriptor.TupleElement;
import io.github.simbo1905.typeguard.TypeRegistry;
import io.github.simbo1905.typeguard.Types;

import java.io.IOException;
import java.io.InputStream;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.BiConsumer;
import java.util.logging.Logger;

/// Reads descriptor documents written in JSON.
///
/// ```json
/// { "definitions": { "Node": { "object": { "value": "number", "next?": { "ref": "Node" } } } },
///   "generics":    { "Box": { "parameters": ["T"], "type": { "object": { "item": { "param": "T" } } } } },
///   "type":        { "ref": "Node" } }
/// ```
///
/// Type expressions:
///
/// - `"string"`, `"number"`, `"boolean"`, `"null"`, `"undefined"`, `"bigint"`, `"any"`, `"unknown"`, `"never"`
/// - `{"literal": v}` where `v` is a string, number or boolean
/// - `{"array": t}`
/// - `{"tuple": [t, ...], "rest": t}`; `rest` is optional
/// - `{"object": {"name": t, "opt?": t, "readonly id": t}, "index": {"string": t, "number": t}}`; `index` is optional
/// - `{"union": [t, ...]}` and `{"intersection": [t, ...]}`
/// - `{"ref": "Id"}`, `{"generic": "Id", "arguments": [t, ...]}` and `{"param": "T"}`
///
/// Anything else fails with a [DescriptorException] naming the JSON pointer of the offending node.
public final class DescriptorDocumentReader {

  private static final Logger LOG = Logger.getLogger(DescriptorDocumentReader.class.getName());

  private static final ObjectMapper MAPPER = new ObjectMapper();

  private static final Set<String> DOCUMENT_KEYS = Set.of("definitions", "generics", "type");
  private static final Set<String> GENERIC_KEYS = Set.of("parameters", "type");
  private static final Set<String> INDEX_KEYS = Set.of("string", "number");
  private static final Map<String, Set<String>> EXPRESSION_KEYS = Map.of(
      "literal", Set.of(),
      "array", Set.of(),
      "tuple", Set.of("rest"),
      "object", Set.of("index"),
      "union", Set.of(),
      "intersection", Set.of(),
      "ref", Set.of(),
      "generic", Set.of("arguments"),
      "param", Set.of());

  private static final String OPTIONAL_SUFFIX = "?";
  private static final String READONLY_PREFIX = "readonly ";

  private DescriptorDocumentReader() {
  }

  public static DescriptorDocument read(String json) {
    Objects.requireNonNull(json, "json");
    try {
      return read(MAPPER.readTree(json));
    } catch (IOException e) {
      throw unreadable(e);
    }
  }

  public static DescriptorDocument read(InputStream in) {
    Objects.requireNonNull(in, "in");
    try {
      return read(MAPPER.readTree(in));
    } catch (IOException e) {
      throw unreadable(e);
    }
  }

  public static DescriptorDocument read(Path file) {
    Objects.requireNonNull(file, "file");
    LOG.fine(() -> "reading descriptor document " + file);
    try (InputStream in = Files.newInputStream(file)) {
      return read(in);
    } catch (IOException e) {
      throw unreadable(e);
    }
  }

  public static DescriptorDocument read(JsonNode document) {
    Objects.requireNonNull(document, "document");
    requireObject(document, "");
    checkKeys(document, "", DOCUMENT_KEYS);

    final var builder = TypeRegistry.builder();
    final var definitions = document.get("definitions");
    if (definitions != null) {
      requireObject(definitions, "/definitions");
      forEachField(definitions, (id, body) -> {
        final var pointer = "/definitions/" + escape(id);
        builder.define(id, readType(body, pointer));
      });
    }
    final var generics = document.get("generics");
    if (generics != null) {
      requireObject(generics, "/generics");
      forEachField(generics, (id, body) -> readGeneric(builder, id, body, "/generics/" + escape(id)));
    }
    final var type = document.get("type");
    if (type == null) {
      throw malformed("", "missing \"type\"");
    }
    final var result = new DescriptorDocument(builder.build(), readType(type, "/type"));
    LOG.fine(() -> "read descriptor document " + result.registry() + " type=" + result.type());
    return result;
  }

  /// Reads a single type expression with no surrounding document
  public static TypeDescriptor readType(JsonNode node) {
    Objects.requireNonNull(node, "node");
    return readType(node, "");
  }

  private static void readGeneric(TypeRegistry.Builder builder, String id, JsonNode body, String pointer) {
    requireObject(body, pointer);
    checkKeys(body, pointer, GENERIC_KEYS);
    final var parameters = body.get("parameters");
    if (parameters == null || !parameters.isArray()) {
      throw malformed(pointer + "/parameters", "expected an array of parameter names");
    }
    final var names = new ArrayList<String>(parameters.size());
    for (int i = 0; i < parameters.size(); i++) {
      names.add(requireText(parameters.get(i), pointer + "/parameters/" + i));
    }
    final var type = body.get("type");
    if (type == null) {
      throw malformed(pointer, "missing \"type\"");
    }
    builder.defineGeneric(id, names, readType(type, pointer + "/type"));
  }

  private static TypeDescriptor readType(JsonNode node, String pointer) {
    if (node.isTextual()) {
      try {
        return Types.primitive(PrimitiveKind.ofTypeName(node.textValue()));
      } catch (DescriptorException e) {
        throw malformed(pointer, e.getMessage());
      }
    }
    requireObject(node, pointer);
    final String kind = kindOf(node, pointer);
    checkKeys(node, pointer, withKind(kind));
    final var body = node.get(kind);
    final var at = pointer + "/" + kind;
    try {
      return switch (kind) {
        case "literal" -> Types.literal(literalValue(body, at));
        case "array" -> Types.array(readType(body, at));
        case "tuple" -> tuple(node, pointer);
        case "object" -> object(node, pointer);
        case "union" -> Types.union(readTypes(body, at).toArray(TypeDescriptor[]::new));
        case "intersection" -> Types.intersection(readTypes(body, at).toArray(TypeDescriptor[]::new));
        case "ref" -> Types.ref(requireText(body, at));
        case "generic" -> generic(node, pointer);
        case "param" -> Types.param(requireText(body, at));
        default -> throw new AssertionError("unreachable kind " + kind);
      };
    } catch (DescriptorException e) {
      // nested expressions already report their own pointer
      if (e.getMessage() != null && e.getMessage().startsWith("at /")) {
        throw e;
      }
      throw malformed(pointer, e.getMessage());
    }
  }

  private static String kindOf(JsonNode node, String pointer) {
    String kind = null;
    final Iterator<String> names = node.fieldNames();
    while (names.hasNext()) {
      final var name = names.next();
      if (EXPRESSION_KEYS.containsKey(name)) {
        if (kind != null) {
          throw malformed(pointer, "type expression has both \"" + kind + "\" and \"" + name + "\"");
        }
        kind = name;
      }
    }
    if (kind == null) {
      throw malformed(pointer, "expected one of " + EXPRESSION_KEYS.keySet().stream().sorted().toList());
    }
    return kind;
  }

  private static Set<String> withKind(String kind) {
    final var keys = new HashSet<>(EXPRESSION_KEYS.get(kind));
    keys.add(kind);
    return keys;
  }

  private static Object literalValue(JsonNode node, String pointer) {
    if (node.isTextual()) return node.textValue();
    if (node.isBoolean()) return node.booleanValue();
    if (node.isNumber()) {
      final var number = node.numberValue();
      // JSON has no bigint; large integers stay numbers
      return number instanceof BigInteger big ? new BigDecimal(big) : number;
    }
    throw malformed(pointer, "literal must be a string, number or boolean, got " + node.getNodeType());
  }

  private static TypeDescriptor tuple(JsonNode node, String pointer) {
    final var elements = new ArrayList<TupleElement>();
    for (TypeDescriptor type : readTypes(node.get("tuple"), pointer + "/tuple")) {
      elements.add(new TupleElement(type, false));
    }
    final var rest = node.get("rest");
    if (rest != null) {
      elements.add(new TupleElement(readType(rest, pointer + "/rest"), true));
    }
    return new TypeDescriptor.Tuple(elements);
  }

  private static TypeDescriptor object(JsonNode node, String pointer) {
    final var shape = node.get("object");
    requireObject(shape, pointer + "/object");
    final var properties = new ArrayList<Property>(shape.size());
    forEachField(shape, (key, value) -> {
      final var at = pointer + "/object/" + escape(key);
      String name = key;
      final boolean readonly = name.startsWith(READONLY_PREFIX);
      if (readonly) name = name.substring(READONLY_PREFIX.length());
      final boolean optional = name.endsWith(OPTIONAL_SUFFIX);
      if (optional) name = name.substring(0, name.length() - OPTIONAL_SUFFIX.length());
      properties.add(new Property(name, readType(value, at), optional, readonly));
    });
    final var signatures = new ArrayList<IndexSignature>(2);
    final var index = node.get("index");
    if (index != null) {
      requireObject(index, pointer + "/index");
      checkKeys(index, pointer + "/index", INDEX_KEYS);
      forEachField(index, (key, value) -> signatures.add(new IndexSignature(
          "string".equals(key) ? IndexKey.STRING : IndexKey.NUMBER,
          readType(value, pointer + "/index/" + key))));
    }
    return Types.object(properties, signatures.toArray(IndexSignature[]::new));
  }

  private static TypeDescriptor generic(JsonNode node, String pointer) {
    final var base = requireText(node.get("generic"), pointer + "/generic");
    final var arguments = node.get("arguments");
    if (arguments == null) {
      throw malformed(pointer, "generic " + base + " needs \"arguments\"");
    }
    return Types.generic(base, readTypes(arguments, pointer + "/arguments").toArray(TypeDescriptor[]::new));
  }

  private static List<TypeDescriptor> readTypes(JsonNode node, String pointer) {
    if (!node.isArray()) {
      throw malformed(pointer, "expected an array, got " + node.getNodeType());
    }
    final var types = new ArrayList<TypeDescriptor>(node.size());
    for (int i = 0; i < node.size(); i++) {
      types.add(readType(node.get(i), pointer + "/" + i));
    }
    return types;
  }

  private static void forEachField(JsonNode node, BiConsumer<String, JsonNode> action) {
    final Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
    while (fields.hasNext()) {
      final var field = fields.next();
      action.accept(field.getKey(), field.getValue());
    }
  }

  private static void checkKeys(JsonNode node, String pointer, Set<String> allowed) {
    final Iterator<String> names = node.fieldNames();
    while (names.hasNext()) {
      final var name = names.next();
      if (!allowed.contains(name)) {
        throw malformed(pointer, "unexpected key \"" + name + "\"");
      }
    }
  }

  private static void requireObject(JsonNode node, String pointer) {
    if (!node.isObject()) {
      throw malformed(pointer, "expected an object, got " + node.getNodeType());
    }
  }

  private static String requireText(JsonNode node, String pointer) {
    if (node == null || !node.isTextual()) {
      throw malformed(pointer, "expected a string, got " + (node == null ? "nothing" : node.getNodeType()));
    }
    return node.textValue();
  }

  /// RFC 6901 reference token
  static String escape(String token) {
    return token.replace("~", "~0").replace("/", "~1");
  }

  private static DescriptorException malformed(String pointer, String message) {
    final var text = "at " + (pointer.isEmpty() ? "/" : pointer) + ": " + message;
    LOG.severe(() -> "ERROR: DESCRIPTOR: " + text);
    return DescriptorException.malformed(text);
  }

  private static DescriptorException unreadable(IOException e) {
    LOG.severe(() -> "ERROR: DESCRIPTOR: cannot read descriptor document: " + e.getMessage());
    return DescriptorException.malformed("cannot read descriptor document: " + e.getMessage(), e);
  }
}
