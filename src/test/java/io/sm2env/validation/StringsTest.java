package io.sm2env.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class StringsTest {

  @Test
  void secretNamesAcceptArnsAndPaths() {
    assertEquals("prod/db-creds", Strings.requireSecretName(" prod/db-creds "));
    assertEquals("arn:aws:secretsmanager:eu-west-1:1:secret:x+y=z@a.b",
        Strings.requireSecretName("arn:aws:secretsmanager:eu-west-1:1:secret:x+y=z@a.b"));
  }

  @Test
  void secretNamesRejectSpacesAndOverlongValues() {
    assertThrows(IllegalArgumentException.class, () -> Strings.requireSecretName("has space"));
    assertThrows(IllegalArgumentException.class,
        () -> Strings.requireSecretName("a".repeat(Strings.MAX_SECRET_NAME_LENGTH + 1)));
  }

  @Test
  void blankAndControlCharactersAreRejected() {
    IllegalArgumentException blank = assertThrows(IllegalArgumentException.class,
        () -> Strings.requireNonBlank("name", "   "));
    assertEquals("name must not be blank", blank.getMessage());
    assertThrows(IllegalArgumentException.class, () -> Strings.requireNonBlank("name", "a\u0001b"));
  }

  @Test
  void regionsFollowAwsShape() {
    assertEquals("ap-southeast-2", Strings.requireRegion("ap-southeast-2"));
    assertEquals("us-gov-west-1", Strings.requireRegion("us-gov-west-1"));
    assertThrows(IllegalArgumentException.class, () -> Strings.requireRegion("US-EAST-1"));
  }

  @Test
  void printableAsciiEnforcesLength() {
    assertEquals("ok", Strings.requirePrintableAscii("profile", "ok", 2));
    assertThrows(IllegalArgumentException.class, () -> Strings.requirePrintableAscii("profile", "long", 2));
    assertThrows(IllegalArgumentException.class, () -> Strings.requirePrintableAscii("profile", "pré", 10));
  }
}
