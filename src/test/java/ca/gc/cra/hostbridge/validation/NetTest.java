package ca.gc.cra.hostbridge.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class NetTest {

  @Test
  void acceptsLoopbackLiteralsAndLocalhost() {
    assertEquals("127.0.0.1", Net.requireLoopbackHost("127.0.0.1"));
    assertEquals("127.1.2.3", Net.requireLoopbackHost("127.1.2.3"));
    assertEquals("localhost", Net.requireLoopbackHost("LOCALHOST"));
    assertEquals("::1", Net.requireLoopbackHost("[::1]"));
  }

  @Test
  void rejectsRoutableHosts() {
    assertThrows(IllegalArgumentException.class, () -> Net.requireLoopbackHost("0.0.0.0"));
    assertThrows(IllegalArgumentException.class, () -> Net.requireLoopbackHost("10.0.0.5"));
    assertThrows(IllegalArgumentException.class, () -> Net.requireLoopbackHost("example.com"));
  }

  @Test
  void rejectsOutOfRangeOctets() {
    assertThrows(IllegalArgumentException.class, () -> Net.requireLoopbackHost("127.0.0.300"));
  }

  @Test
  void loopbackAddressResolvesWithoutDns() {
    assertTrue(Net.loopbackAddress("localhost").isLoopbackAddress());
    assertTrue(Net.loopbackAddress("127.0.0.1").isLoopbackAddress());
  }

  @Test
  void portZeroOnlyWhenEphemeralAllowed() {
    assertEquals(0, Net.requirePort(0, true));
    assertThrows(IllegalArgumentException.class, () -> Net.requirePort(0, false));
    assertThrows(IllegalArgumentException.class, () -> Net.requirePort(65536, true));
  }
}
