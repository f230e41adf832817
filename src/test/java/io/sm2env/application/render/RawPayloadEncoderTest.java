package io.sm2env.application.render;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;

import io.sm2env.domain.secret.SecretValue;
import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

class RawPayloadEncoderTest {
  private final RawPayloadEncoder encoder = new RawPayloadEncoder();

  @Test
  void textIsWrittenExactly() throws Exception {
    assertEquals("hello", encoder.encode(SecretValue.plainText("hello")).asUtf8());
  }

  @Test
  void binaryBytesAreWrittenUntouched() throws Exception {
    byte[] bytes = {(byte) 0xFF, 0x00, (byte) 0x80, 0x7F};
    assertArrayEquals(bytes, encoder.encode(SecretValue.binary(bytes)).bytes());
  }

  @Test
  void keyValueKeepsEnvLines() throws Exception {
    Map<String, String> entries = new LinkedHashMap<>();
    entries.put("A", "1");
    entries.put("B", "2");
    assertEquals("A=1\nB=2\n", encoder.encode(SecretValue.keyValue(entries)).asUtf8());
  }
}
