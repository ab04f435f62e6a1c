package com.databricks.grpcbase;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

/** Tests for parsing {@code grpc://} URIs. */
class ChannelUriTest {

  private static final Object[][] VALID_URIS = {
    {"grpc://localhost", "localhost", 9090, true},
    {"grpc://localhost:1234", "localhost", 1234, true},
    {"grpc://localhost:1234?ssl=true", "localhost", 1234, true},
    {"grpc://localhost:1234?ssl=false", "localhost", 1234, false},
    {"grpc://localhost:1234?ssl=1", "localhost", 1234, true},
    {"grpc://localhost:1234?ssl=0", "localhost", 1234, false},
    {"grpc://localhost:1234?ssl=on", "localhost", 1234, true},
    {"grpc://localhost:1234?ssl=off", "localhost", 1234, false},
    {"grpc://localhost:1234?ssl=TRUE", "localhost", 1234, true},
    {"grpc://localhost:1234?ssl=FALSE", "localhost", 1234, false},
    {"grpc://localhost:1234?ssl=ON", "localhost", 1234, true},
    {"grpc://localhost:1234?ssl=OFF", "localhost", 1234, false},
    {"grpc://localhost:1234?ssl=0&ssl=1", "localhost", 1234, true},
    {"grpc://localhost:1234?ssl=1&ssl=0", "localhost", 1234, false},
    {"GRPC://example.com:443", "example.com", 443, true},
  };

  private static final String[][] INVALID_URIS = {
    {"http://localhost", "Invalid scheme 'http' in the URI, expected 'grpc'"},
    {"localhost:1234", "Invalid scheme 'localhost' in the URI, expected 'grpc'"},
    {"grpc://:1234", "Host name is missing in URI 'grpc://:1234'"},
    {"grpc://host:1234;param", "Host name is missing"},
    {"grpc://localhost:1234?ssl=invalid", "Invalid boolean value 'invalid'"},
    {"grpc://localhost:1234?ssl=1&ssl=invalid", "Invalid boolean value 'invalid'"},
    {"grpc://localhost?ssl=1&ssl=1&ssl=invalid", "Invalid boolean value 'invalid'"},
    {"grpc://host:1234/path", "Unexpected path '/path' in the URI 'grpc://host:1234/path'"},
    {"grpc://host:1234#frag", "Unexpected fragment 'frag'"},
    {"grpc://user@host:1234", "Unexpected user info 'user'"},
    {"grpc://localhost:1234?ssl=1&ffl=true", "Unexpected query parameters {ffl=true}"},
    {"grpc://local host", "Invalid URI 'grpc://local host'"},
  };

  @Test
  void testValidUris() {
    for (Object[] row : VALID_URIS) {
      String uri = (String) row[0];
      ChannelUri parsed = ChannelUri.parse(uri);

      assertEquals(row[1], parsed.getHost(), uri);
      assertEquals((int) row[2], parsed.getPort(), uri);
      assertEquals((boolean) row[3], parsed.isSsl(), uri);
      assertEquals(row[1] + ":" + row[2], parsed.getTarget(), uri);
    }
  }

  @Test
  void testDefaultPortOnlyAppliesWithoutExplicitPort() {
    for (Object[] row : VALID_URIS) {
      String uri = (String) row[0];
      ChannelUri parsed = ChannelUri.parse(uri, 4321, true);

      int expectedPort = uri.contains(":" + row[2]) ? (int) row[2] : 4321;
      assertEquals(expectedPort, parsed.getPort(), uri);
    }
  }

  @Test
  void testDefaultSsl() {
    assertFalse(ChannelUri.parse("grpc://localhost", 9090, false).isSsl());
    assertTrue(ChannelUri.parse("grpc://localhost?ssl=on", 9090, false).isSsl());
  }

  @Test
  void testInvalidUris() {
    for (String[] row : INVALID_URIS) {
      IllegalArgumentException error =
          assertThrows(IllegalArgumentException.class, () -> ChannelUri.parse(row[0]), row[0]);
      assertTrue(
          error.getMessage().contains(row[1]),
          "'" + error.getMessage() + "' should contain '" + row[1] + "'");
    }
  }

  @Test
  void testQueryParameterWithoutValueIsIgnored() {
    assertTrue(ChannelUri.parse("grpc://localhost?ssl").isSsl());
    assertTrue(ChannelUri.parse("grpc://localhost?ssl=").isSsl());
  }

  @Test
  void testNullUri() {
    assertThrows(NullPointerException.class, () -> ChannelUri.parse(null));
  }

  @Test
  void testEqualsAndToString() {
    ChannelUri first = ChannelUri.parse("grpc://localhost:1234?ssl=off");
    ChannelUri second = new ChannelUri("localhost", 1234, false);

    assertEquals(first, second);
    assertEquals(first.hashCode(), second.hashCode());
    assertNotEquals(first, ChannelUri.parse("grpc://localhost:1234"));
    assertEquals("grpc://localhost:1234?ssl=false", first.toString());
  }
}
