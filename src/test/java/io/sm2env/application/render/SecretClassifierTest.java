package io.sm2env.application.render;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;

import io.sm2env.domain.secret.RawSecret;
import io.sm2env.domain.secret.SecretValue;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class SecretClassifierTest {
  private final SecretClassifier classifier = new SecretClassifier();

  @Test
  void jsonObjectBecomesOrderedKeyValueMap() {
    SecretValue value = classifier.classify(RawSecret.ofText("{\"DB_HOST\":\"localhost\",\"DB_PORT\":\"5432\"}"));

    SecretValue.KeyValueMap map = assertInstanceOf(SecretValue.KeyValueMap.class, value);
    assertEquals(List.of("DB_HOST", "DB_PORT"), List.copyOf(map.entries().keySet()));
    assertEquals("5432", map.entries().get("DB_PORT"));
  }

  @Test
  void scalarMembersKeepTheirLiteralText() {
    SecretValue value = classifier.classify(
        RawSecret.ofText("{\"port\":5432,\"ratio\":1.50,\"on\":true,\"off\":false,\"none\":null}"));

    Map<String, String> entries = ((SecretValue.KeyValueMap) value).entries();
    assertEquals("5432", entries.get("port"));
    assertEquals("1.50", entries.get("ratio"));
    assertEquals("true", entries.get("on"));
    assertEquals("false", entries.get("off"));
    assertEquals("null", entries.get("none"));
  }

  @Test
  void nestedValuesBecomeCompactJson() {
    SecretValue value = classifier.classify(
        RawSecret.ofText("{\"db\": {\"host\": \"h\", \"ports\": [1, 2]}, \"tags\": [ \"a\" ]}"));

    Map<String, String> entries = ((SecretValue.KeyValueMap) value).entries();
    assertEquals("{\"host\":\"h\",\"ports\":[1,2]}", entries.get("db"));
    assertEquals("[\"a\"]", entries.get("tags"));
  }

  @Test
  void duplicateKeyKeepsFirstPositionAndLastValue() {
    SecretValue value = classifier.classify(RawSecret.ofText("{\"A\":\"1\",\"B\":\"2\",\"A\":\"3\"}"));

    Map<String, String> entries = ((SecretValue.KeyValueMap) value).entries();
    assertEquals(List.of("A", "B"), List.copyOf(entries.keySet()));
    assertEquals("3", entries.get("A"));
  }

  @Test
  void nonObjectTextIsPlainTextVerbatim() {
    for (String text : List.of("hello", "  spaced  ", "", "[1,2,3]", "42", "\"quoted\"", "{broken", "{} trailing",
        "{}{}")) {
      SecretValue value = classifier.classify(RawSecret.ofText(text));
      SecretValue.PlainText plain = assertInstanceOf(SecretValue.PlainText.class, value, text);
      assertEquals(text, plain.text());
    }
  }

  @Test
  void emptyObjectIsEmptyMap() {
    SecretValue value = classifier.classify(RawSecret.ofText("{ }"));
    assertEquals(0, assertInstanceOf(SecretValue.KeyValueMap.class, value).entries().size());
  }

  @Test
  void invalidUtf8BytesAreBinary() {
    byte[] bytes = new byte[42];
    for (int i = 0; i < bytes.length; i++) {
      bytes[i] = (byte) (0x80 + i);
    }
    SecretValue value = classifier.classify(RawSecret.ofBytes(bytes));

    SecretValue.Binary binary = assertInstanceOf(SecretValue.Binary.class, value);
    assertEquals(42, binary.size());
    assertArrayEquals(bytes, binary.bytes());
  }

  @Test
  void validUtf8BinaryPayloadIsClassifiedAsText() {
    SecretValue json = classifier.classify(RawSecret.ofBytes("{\"K\":\"v\"}".getBytes(StandardCharsets.UTF_8)));
    SecretValue text = classifier.classify(RawSecret.ofBytes("just text".getBytes(StandardCharsets.UTF_8)));

    assertInstanceOf(SecretValue.KeyValueMap.class, json);
    assertEquals(SecretValue.plainText("just text"), text);
  }
}
