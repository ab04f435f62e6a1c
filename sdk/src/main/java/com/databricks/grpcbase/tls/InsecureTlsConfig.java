package com.databricks.grpcbase.tls;

import io.grpc.ChannelCredentials;
import io.grpc.InsecureChannelCredentials;

/**
 * Plaintext configuration, used for {@code grpc://host?ssl=false} URIs.
 *
 * <p>Only meant for local development and tests: traffic is not encrypted.
 */
public class InsecureTlsConfig extends TlsConfig {

  @Override
  public ChannelCredentials toChannelCredentials() {
    return InsecureChannelCredentials.create();
  }
}
