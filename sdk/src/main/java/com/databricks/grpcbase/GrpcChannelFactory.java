package com.databricks.grpcbase;

import com.databricks.grpcbase.tls.TlsConfig;
import io.grpc.ChannelCredentials;
import io.grpc.Grpc;
import io.grpc.ManagedChannel;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import javax.annotation.Nonnull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Factory for gRPC channels configured for long-lived streaming connections.
 *
 * <p>Channels are created with keep-alive settings so that idle server-streaming calls are not
 * silently dropped by intermediaries.
 */
public class GrpcChannelFactory {
  private static final Logger logger = LoggerFactory.getLogger(GrpcChannelFactory.class);

  private static final long KEEP_ALIVE_TIME_SECONDS = 30;
  private static final long KEEP_ALIVE_TIMEOUT_SECONDS = 10;

  /**
   * Parses a {@code grpc://} URI and creates a channel for it.
   *
   * @param uri the URI of the server
   * @return a new channel
   * @throws IllegalArgumentException if the URI is invalid
   * @see ChannelUri
   */
  @Nonnull
  public ManagedChannel createChannel(@Nonnull String uri) {
    return createChannel(ChannelUri.parse(uri));
  }

  /**
   * Creates a channel for parsed connection parameters.
   *
   * @param uri the connection parameters
   * @return a new channel
   */
  @Nonnull
  public ManagedChannel createChannel(@Nonnull ChannelUri uri) {
    Objects.requireNonNull(uri, "uri cannot be null");
    return createChannel(uri, TlsConfig.forSsl(uri.isSsl()));
  }

  /**
   * Creates a channel with a custom transport security configuration.
   *
   * @param uri the connection parameters; its SSL flag is ignored
   * @param tlsConfig the transport security configuration
   * @return a new channel
   */
  @Nonnull
  public ManagedChannel createChannel(@Nonnull ChannelUri uri, @Nonnull TlsConfig tlsConfig) {
    Objects.requireNonNull(uri, "uri cannot be null");
    Objects.requireNonNull(tlsConfig, "tlsConfig cannot be null");
    ChannelCredentials credentials = tlsConfig.toChannelCredentials();
    logger.debug("Creating channel to {}", uri);

    return Grpc.newChannelBuilder(uri.getTarget(), credentials)
        .keepAliveTime(KEEP_ALIVE_TIME_SECONDS, TimeUnit.SECONDS)
        .keepAliveTimeout(KEEP_ALIVE_TIMEOUT_SECONDS, TimeUnit.SECONDS)
        .keepAliveWithoutCalls(true)
        .build();
  }
}
