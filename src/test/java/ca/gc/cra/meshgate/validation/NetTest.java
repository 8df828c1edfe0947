package ca.gc.cra.meshgate.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class NetTest {

  @Test
  void hostPortAppliesDefaultPortWhenMissing() {
    assertEquals("gateway.local:4403", Net.validateHostPort("gateway.local", 4403));
    assertEquals("10.1.2.3:9000", Net.validateHostPort(" 10.1.2.3:9000 ", 4403));
    assertEquals("[::1]:4403", Net.validateHostPort("[::1]", 4403));
    assertEquals("[fe80::1]:8080", Net.validateHostPort("[fe80::1]:8080", 4403));
  }

  @Test
  void hostPortWithoutDefaultRequiresPort() {
    assertEquals("localhost:80", Net.validateHostPort("localhost:80"));
    assertThrows(IllegalArgumentException.class, () -> Net.validateHostPort("localhost"));
  }

  @Test
  void rejectsMalformedAddresses() {
    assertThrows(IllegalArgumentException.class, () -> Net.validateHostPort("::1", 4403));
    assertThrows(IllegalArgumentException.class, () -> Net.validateHostPort("host:0", 4403));
    assertThrows(IllegalArgumentException.class, () -> Net.validateHostPort("host:http", 4403));
    assertThrows(IllegalArgumentException.class, () -> Net.validateHostPort("300.1.1.1", 4403));
    assertThrows(IllegalArgumentException.class, () -> Net.validateHostPort("-bad.example", 4403));
    assertThrows(IllegalArgumentException.class, () -> Net.validateHostPort("[zz::1]", 4403));
    assertThrows(IllegalArgumentException.class, () -> Net.validateHostPort("   ", 4403));
    assertThrows(NullPointerException.class, () -> Net.validateHostPort(null, 4403));
  }

  @Test
  void validateHostStripsBrackets() {
    assertEquals("::1", Net.validateHost("[::1]"));
    assertEquals("0.0.0.0", Net.validateHost("0.0.0.0"));
    assertThrows(IllegalArgumentException.class, () -> Net.validateHost("under_score"));
  }
}
