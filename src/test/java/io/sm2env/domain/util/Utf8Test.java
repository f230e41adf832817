package io.sm2env.domain.util;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.charset.StandardCharsets;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class Utf8Test {

  @Test
  void decodesValidUtf8() {
    assertEquals(Optional.of("héllo"), Utf8.decodeStrict("héllo".getBytes(StandardCharsets.UTF_8)));
    assertEquals(Optional.of(""), Utf8.decodeStrict(new byte[0]));
  }

  @Test
  void rejectsMalformedSequences() {
    assertTrue(Utf8.decodeStrict(new byte[] {(byte) 0xC3, (byte) 0x28}).isEmpty());
    assertTrue(Utf8.decodeStrict(new byte[] {(byte) 0xFF, 0x00, 0x01}).isEmpty());
  }

  @Test
  void unpairedSurrogatesAreNotEncodable() {
    assertTrue(Utf8.isEncodable("plain ascii and emoji 😀"));
    assertFalse(Utf8.isEncodable("broken \uD800 surrogate"));
  }
}
