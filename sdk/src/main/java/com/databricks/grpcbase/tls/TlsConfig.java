package com.databricks.grpcbase.tls;

import io.grpc.ChannelCredentials;

/**
 * Abstract base class for transport security configuration.
 *
 * <p>Implementations define how the gRPC channel is secured. Channels created from a {@code
 * grpc://} URI use {@link SecureTlsConfig} unless the URI carries {@code ssl=false}, in which case
 * {@link InsecureTlsConfig} is used. Custom implementations can provide alternative settings such
 * as a private certificate authority or mutual TLS:
 *
 * <pre>{@code
 * public class CustomTlsConfig extends TlsConfig {
 *     private final File caCertFile;
 *
 *     public CustomTlsConfig(File caCertFile) {
 *         this.caCertFile = caCertFile;
 *     }
 *
 *     @Override
 *     public ChannelCredentials toChannelCredentials() {
 *         try {
 *             return TlsChannelCredentials.newBuilder()
 *                 .trustManager(caCertFile)
 *                 .build();
 *         } catch (IOException e) {
 *             throw new UncheckedIOException("Failed to load CA certificate", e);
 *         }
 *     }
 * }
 * }</pre>
 *
 * @see com.databricks.grpcbase.GrpcChannelFactory
 */
public abstract class TlsConfig {

  /**
   * Converts this configuration to gRPC channel credentials.
   *
   * @return channel credentials for the connection
   */
  public abstract ChannelCredentials toChannelCredentials();

  /**
   * Returns the configuration matching an {@code ssl} flag.
   *
   * @param ssl whether the channel should be encrypted
   * @return a secure or an insecure configuration
   */
  public static TlsConfig forSsl(boolean ssl) {
    return ssl ? new SecureTlsConfig() : new InsecureTlsConfig();
  }
}
