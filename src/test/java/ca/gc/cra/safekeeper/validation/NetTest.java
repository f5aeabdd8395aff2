package ca.gc.cra.safekeeper.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class NetTest {

  @Test
  void validateHostPortHandlesHostname() {
    assertEquals("broker.example.com:9092", Net.validateHostPort("broker.example.com:9092"));
  }

  @Test
  void validateHostPortHandlesIpv4() {
    assertEquals("10.0.0.1:9092", Net.validateHostPort("10.0.0.1:9092"));
  }

  @Test
  void validateHostPortHandlesIpv6() {
    assertEquals("[2001:db8::1]:9093", Net.validateHostPort("[2001:db8::1]:9093"));
  }

  @Test
  void validateHostPortRejectsMalformedInput() {
    assertThrows(IllegalArgumentException.class, () -> Net.validateHostPort("localhost"));
    assertThrows(IllegalArgumentException.class, () -> Net.validateHostPort("localhost:70000"));
    assertThrows(IllegalArgumentException.class, () -> Net.validateHostPort("2001:db8::1:443"));
    assertThrows(IllegalArgumentException.class, () -> Net.validateHostPort("300.1.1.1:80"));
    assertThrows(IllegalArgumentException.class, () -> Net.validateHostPort("-bad.host:80"));
  }

  @Test
  void bootstrapServersNormalizeEachEntry() {
    assertEquals("a.local:9092,b.local:9093", Net.validateBootstrapServers(" a.local:9092 , b.local:9093,"));
    assertThrows(IllegalArgumentException.class, () -> Net.validateBootstrapServers(" , "));
  }

  @Test
  void httpEndpointRequiresHttpScheme() {
    assertEquals("http://collector:4317", Net.validateHttpEndpoint("http://collector:4317"));
    assertThrows(IllegalArgumentException.class, () -> Net.validateHttpEndpoint("grpc://collector:4317"));
    assertThrows(IllegalArgumentException.class, () -> Net.validateHttpEndpoint("http:///nohost"));
  }
}
