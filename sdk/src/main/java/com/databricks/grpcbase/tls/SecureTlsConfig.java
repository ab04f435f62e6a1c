package com.databricks.grpcbase.tls;

import io.grpc.ChannelCredentials;
import io.grpc.TlsChannelCredentials;

/**
 * Secure TLS configuration using system CA certificates.
 *
 * <p>This is the default configuration, enabling TLS encryption using the operating system's
 * trusted CA certificates.
 *
 * @see TlsConfig
 */
public class SecureTlsConfig extends TlsConfig {

  /**
   * Returns secure TLS credentials using system CA certificates.
   *
   * @return TLS channel credentials with system CAs
   */
  @Override
  public ChannelCredentials toChannelCredentials() {
    return TlsChannelCredentials.create();
  }
}
