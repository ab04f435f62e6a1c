package com.databricks.grpcbase;

import static org.junit.jupiter.api.Assertions.*;

import com.databricks.grpcbase.tls.InsecureTlsConfig;
import com.databricks.grpcbase.tls.SecureTlsConfig;
import com.databricks.grpcbase.tls.TlsConfig;
import io.grpc.InsecureChannelCredentials;
import io.grpc.ManagedChannel;
import io.grpc.TlsChannelCredentials;
import org.junit.jupiter.api.Test;

/** Tests for GrpcChannelFactory and the TLS configurations it uses. */
class GrpcChannelFactoryTest {

  private final GrpcChannelFactory factory = new GrpcChannelFactory();

  @Test
  void testCreateChannel_Plaintext() {
    ManagedChannel channel = factory.createChannel("grpc://localhost:50051?ssl=false");
    try {
      assertEquals("localhost:50051", channel.authority());
      assertFalse(channel.isShutdown());
    } finally {
      channel.shutdownNow();
    }
  }

  @Test
  void testCreateChannel_DefaultsToTls() {
    ManagedChannel channel = factory.createChannel("grpc://example.com");
    try {
      assertEquals("example.com:9090", channel.authority());
    } finally {
      channel.shutdownNow();
    }
  }

  @Test
  void testCreateChannel_CustomTlsConfig() {
    ManagedChannel channel =
        factory.createChannel(ChannelUri.parse("grpc://localhost:443"), new InsecureTlsConfig());
    try {
      assertEquals("localhost:443", channel.authority());
    } finally {
      channel.shutdownNow();
    }
  }

  @Test
  void testCreateChannel_InvalidUri() {
    IllegalArgumentException exception =
        assertThrows(
            IllegalArgumentException.class, () -> factory.createChannel("http://localhost"));

    assertTrue(exception.getMessage().contains("Invalid scheme"));
  }

  @Test
  void testCreateChannel_NullArguments() {
    assertThrows(NullPointerException.class, () -> factory.createChannel((ChannelUri) null));
    assertThrows(
        NullPointerException.class,
        () -> factory.createChannel(ChannelUri.parse("grpc://localhost"), null));
  }

  @Test
  void testTlsConfigForSsl() {
    assertTrue(TlsConfig.forSsl(true) instanceof SecureTlsConfig);
    assertTrue(TlsConfig.forSsl(false) instanceof InsecureTlsConfig);
    assertTrue(TlsConfig.forSsl(true).toChannelCredentials() instanceof TlsChannelCredentials);
    assertTrue(
        TlsConfig.forSsl(false).toChannelCredentials() instanceof InsecureChannelCredentials);
  }
}
