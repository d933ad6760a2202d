package io.github.simbo1905.typeguard.jackson;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.simbo1905.typeguard.DescriptorException;
import io.github.simbo1905.typeguard.DescriptorException.Reason;
import io.github.simbo1905.typeguard.TypeDescriptor;
import io.github.simbo1905.typeguard.Verdict;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static io.github.simbo1905.typeguard.Types.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DescriptorDocumentReaderTest extends JacksonTestBase {

  private static final ObjectMapper MAPPER = new ObjectMapper();

  private static DescriptorDocument load(String name) throws IOException {
    try (InputStream in = resource(name)) {
      return DescriptorDocumentReader.read(in);
    }
  }

  private static Reason reasonOf(Throwable e) {
    return ((DescriptorException) e).reason();
  }

  @Test
  void recursiveDocumentBuildsAWorkingGuard() throws IOException {
    final var document = load("node.json");

    assertThat(document.type()).isEqualTo(ref("Node"));
    assertThat(document.registry().definition("Node"))
        .isEqualTo(object(property("value", number()), optional("next", ref("Node"))));

    final var guard = document.guard();
    assertThat(guard.is(JacksonValues.parse("{\"value\": 1, \"next\": {\"value\": 2}}"))).isTrue();
    final var verdict = guard.validate(JacksonValues.parse("{\"value\": 1, \"next\": {\"value\": \"x\"}}"));
    assertThat(((Verdict.Fail) verdict).message()).isEqualTo("value.next.value: expected number, got string");
  }

  @Test
  void modifiersLiteralsTuplesGenericsAndIntersections() throws IOException {
    final var document = load("order.json");

    assertThat(document.registry().definition("Line")).isEqualTo(object(
        readonly("sku", string()),
        property("quantity", number()),
        property("price", ref("Money")),
        optional("note", union(string(), nullType()))));
    assertThat(document.registry().generic("Page").parameters()).containsExactly("T");

    final var guard = document.guard();
    final var order = JacksonValues.parse("""
        {"id": "o-1",
         "lines": {"items": [{"sku": "a", "quantity": 2, "price": [9.5, "EUR"]}],
                   "next": {"items": [{"sku": "b", "quantity": 1, "price": [3, "USD"], "note": null}]}}}
        """);
    assertThat(guard.isEqual(order)).isTrue();

    final var wrongCurrency = JacksonValues.parse("""
        {"id": "o-2", "lines": {"items": [{"sku": "a", "quantity": 2, "price": [9.5, "GBP"]}]}}
        """);
    final var failure = (Verdict.Fail) guard.validate(wrongCurrency);
    assertThat(failure.path().render()).isEqualTo("value.lines.items[0].price[1]");
  }

  @Test
  void numberIndexSignature() throws IOException {
    final var guard = load("tagged.json").guard();
    assertThat(guard.isEqual(JacksonValues.parse("{\"name\": \"n\", \"0\": true, \"12\": false}"))).isTrue();
    assertThat(guard.isEqual(JacksonValues.parse("{\"name\": \"n\", \"x\": true}"))).isFalse();
    assertThat(guard.is(JacksonValues.parse("{\"name\": \"n\", \"3\": \"no\"}"))).isFalse();
  }

  @Test
  void unboundParameterKeepsItsReason() {
    assertThatThrownBy(() -> load("unbound.json"))
        .isInstanceOf(DescriptorException.class)
        .extracting(DescriptorDocumentReaderTest::reasonOf)
        .isEqualTo(Reason.UNBOUND_TYPE_PARAMETER);
  }

  @Test
  void readsFromAFile(@TempDir Path dir) throws IOException {
    final var file = dir.resolve("pair.json");
    Files.writeString(file, "{\"type\": {\"tuple\": [\"string\"], \"rest\": \"number\"}}");

    final var document = DescriptorDocumentReader.read(file);

    assertThat(document.type()).isEqualTo(tupleWithRest(List.of(string()), number()));
    assertThat(document.guard().is(List.of("a", 1L, 2L))).isTrue();
  }

  @Test
  void readsASingleTypeExpression() throws IOException {
    final TypeDescriptor type = DescriptorDocumentReader.readType(MAPPER.readTree(
        "{\"union\": [{\"literal\": 1}, {\"literal\": true}, {\"array\": \"bigint\"}]}"));
    assertThat(type).isEqualTo(union(literal(1), literal(true), array(bigint())));
  }

  @Test
  void unknownPrimitiveNamesThePointer() {
    assertThatThrownBy(() -> DescriptorDocumentReader.read("{\"type\": {\"object\": {\"a\": \"int\"}}}"))
        .isInstanceOf(DescriptorException.class)
        .hasMessage("at /type/object/a: unknown primitive type: int")
        .extracting(DescriptorDocumentReaderTest::reasonOf)
        .isEqualTo(Reason.MALFORMED_DESCRIPTOR);
  }

  @Test
  void unexpectedKeysAreRejected() {
    assertThatThrownBy(() -> DescriptorDocumentReader.read("{\"type\": \"string\", \"extra\": 1}"))
        .isInstanceOf(DescriptorException.class)
        .hasMessage("at /: unexpected key \"extra\"");
    assertThatThrownBy(() -> DescriptorDocumentReader.read("{\"type\": {\"array\": \"string\", \"rest\": \"number\"}}"))
        .isInstanceOf(DescriptorException.class)
        .hasMessage("at /type: unexpected key \"rest\"");
    assertThatThrownBy(() -> DescriptorDocumentReader.read("{\"type\": {\"union\": [\"string\"], \"ref\": \"X\"}}"))
        .isInstanceOf(DescriptorException.class)
        .hasMessageContaining("has both");
    assertThatThrownBy(() -> DescriptorDocumentReader.read("{\"type\": {\"object\": {}, \"index\": {\"symbol\": \"string\"}}}"))
        .isInstanceOf(DescriptorException.class)
        .hasMessage("at /type/index: unexpected key \"symbol\"");
  }

  @Test
  void wrongJsonTypesAreRejected() {
    assertThatThrownBy(() -> DescriptorDocumentReader.read("[]"))
        .isInstanceOf(DescriptorException.class)
        .hasMessage("at /: expected an object, got ARRAY");
    assertThatThrownBy(() -> DescriptorDocumentReader.read("{\"type\": {\"union\": \"string\"}}"))
        .isInstanceOf(DescriptorException.class)
        .hasMessage("at /type/union: expected an array, got STRING");
    assertThatThrownBy(() -> DescriptorDocumentReader.read("{\"type\": {\"literal\": [1]}}"))
        .isInstanceOf(DescriptorException.class)
        .hasMessageStartingWith("at /type/literal: literal must be");
    assertThatThrownBy(() -> DescriptorDocumentReader.read("{\"type\": {\"ref\": 3}}"))
        .isInstanceOf(DescriptorException.class)
        .hasMessageStartingWith("at /type/ref: expected a string");
  }

  @Test
  void missingTypeIsRejected() {
    assertThatThrownBy(() -> DescriptorDocumentReader.read("{\"definitions\": {}}"))
        .isInstanceOf(DescriptorException.class)
        .hasMessage("at /: missing \"type\"");
  }

  @Test
  void descriptorConstraintsAreReportedWithThePointer() {
    assertThatThrownBy(() -> DescriptorDocumentReader.read("{\"type\": {\"object\": {\"a\": \"string\", \"a?\": \"number\"}}}"))
        .isInstanceOf(DescriptorException.class)
        .hasMessage("at /type: duplicate property name: a");
    assertThatThrownBy(() -> DescriptorDocumentReader.read("{\"type\": {\"union\": []}}"))
        .isInstanceOf(DescriptorException.class)
        .hasMessage("at /type: union must have at least one member");
  }

  @Test
  void pointerTokensAreEscaped() {
    assertThat(DescriptorDocumentReader.escape("a/b~c")).isEqualTo("a~1b~0c");
    assertThatThrownBy(() -> DescriptorDocumentReader.read("{\"definitions\": {\"a/b\": \"nope\"}, \"type\": \"string\"}"))
        .isInstanceOf(DescriptorException.class)
        .hasMessageStartingWith("at /definitions/a~1b:");
  }

  @Test
  void unparsableJsonIsMalformed() {
    assertThatThrownBy(() -> DescriptorDocumentReader.read("{\"type\": "))
        .isInstanceOf(DescriptorException.class)
        .hasMessageStartingWith("cannot read descriptor document")
        .hasCauseInstanceOf(IOException.class)
        .extracting(DescriptorDocumentReaderTest::reasonOf)
        .isEqualTo(Reason.MALFORMED_DESCRIPTOR);
  }
}
