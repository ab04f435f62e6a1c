package com.databricks.grpcbase;

import io.grpc.Channel;
import io.grpc.ManagedChannel;
import io.grpc.StatusRuntimeException;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;
import javax.annotation.Nonnull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Base class for gRPC API clients.
 *
 * <p>Manages the channel and stub for one server and turns gRPC failures of unary calls into
 * {@link ApiClientException}s. Subclasses expose the API-specific methods:
 *
 * <pre>{@code
 * public class ItemsClient extends BaseApiClient<ItemsGrpc.ItemsBlockingStub> {
 *     public ItemsClient(String serverUrl) {
 *         super(serverUrl, ItemsGrpc::newBlockingStub);
 *     }
 *
 *     public Item getItem(long id) {
 *         return call("getItem", stub -> stub.getItem(GetItemRequest.newBuilder().setId(id).build()));
 *     }
 * }
 *
 * try (ItemsClient client = new ItemsClient("grpc://items.example.com:443")) {
 *     Item item = client.getItem(42);
 * }
 * }</pre>
 *
 * @param <S> The gRPC stub type
 */
public abstract class BaseApiClient<S> implements AutoCloseable {
  private static final Logger logger = LoggerFactory.getLogger(BaseApiClient.class);
  private static final long SHUTDOWN_TIMEOUT_SECONDS = 5;

  private final Function<Channel, S> createStub;
  private final GrpcChannelFactory channelFactory;

  private String serverUrl;
  private ManagedChannel channel;
  private S stub;

  /**
   * Creates a client and connects to the server.
   *
   * @param serverUrl the {@code grpc://} URI of the server
   * @param createStub function creating a stub from a channel
   */
  protected BaseApiClient(@Nonnull String serverUrl, @Nonnull Function<Channel, S> createStub) {
    this(serverUrl, createStub, true);
  }

  /**
   * Creates a client.
   *
   * @param serverUrl the {@code grpc://} URI of the server
   * @param createStub function creating a stub from a channel
   * @param autoConnect whether to connect right away; otherwise {@link #connect()} must be called
   *     before making calls
   */
  protected BaseApiClient(
      @Nonnull String serverUrl, @Nonnull Function<Channel, S> createStub, boolean autoConnect) {
    this(serverUrl, createStub, autoConnect, new GrpcChannelFactory());
  }

  BaseApiClient(
      @Nonnull String serverUrl,
      @Nonnull Function<Channel, S> createStub,
      boolean autoConnect,
      @Nonnull GrpcChannelFactory channelFactory) {
    this.serverUrl = Objects.requireNonNull(serverUrl, "serverUrl cannot be null");
    this.createStub = Objects.requireNonNull(createStub, "createStub cannot be null");
    this.channelFactory = Objects.requireNonNull(channelFactory, "channelFactory cannot be null");
    if (autoConnect) {
      connect();
    }
  }

  /** Returns the URL of the server. */
  @Nonnull
  public synchronized String getServerUrl() {
    return serverUrl;
  }

  /**
   * Returns the underlying gRPC channel.
   *
   * <p>Provided as a last resort for advanced users; prefer the client's own methods.
   *
   * @return the channel
   * @throws ClientNotConnectedException if the client is not connected
   */
  @Nonnull
  public synchronized ManagedChannel getChannel() {
    if (channel == null) {
      throw new ClientNotConnectedException(serverUrl, "channel");
    }
    return channel;
  }

  /**
   * Returns the underlying gRPC stub.
   *
   * <p>Provided as a last resort for advanced users; calls made on the stub directly are not
   * classified.
   *
   * @return the stub
   * @throws ClientNotConnectedException if the client is not connected
   */
  @Nonnull
  public synchronized S getStub() {
    if (stub == null) {
      throw new ClientNotConnectedException(serverUrl, "stub");
    }
    return stub;
  }

  /** Returns whether the client is connected to the server. */
  public synchronized boolean isConnected() {
    return channel != null;
  }

  /**
   * Connects to the server using the current URL. Does nothing if already connected.
   *
   * @throws IllegalArgumentException if the URL is not a valid gRPC URI
   */
  public void connect() {
    connect(null);
  }

  /**
   * Connects to the server, possibly using a new URL.
   *
   * <p>If the client is already connected and the URL did not change, this does nothing. If the
   * URL changed, the old channel is shut down and a new one is created. To force a reconnection to
   * the same URL, call {@link #disconnect()} first.
   *
   * @param newServerUrl the URL to connect to, or null to keep the current one
   * @throws IllegalArgumentException if the URL is not a valid gRPC URI
   */
  public void connect(String newServerUrl) {
    ManagedChannel previous = null;
    synchronized (this) {
      if (newServerUrl != null && !newServerUrl.equals(serverUrl)) {
        ManagedChannel created = channelFactory.createChannel(newServerUrl);
        previous = channel;
        serverUrl = newServerUrl;
        channel = created;
        stub = createStub.apply(created);
      } else if (channel != null) {
        return;
      } else {
        channel = channelFactory.createChannel(serverUrl);
        stub = createStub.apply(channel);
      }
      logger.debug("Connected to {}", serverUrl);
    }
    if (previous != null) {
      shutdown(previous);
    }
  }

  /** Disconnects from the server. Does nothing if the client is not connected. */
  public void disconnect() {
    ManagedChannel previous;
    synchronized (this) {
      previous = channel;
      channel = null;
      stub = null;
    }
    if (previous != null) {
      shutdown(previous);
      logger.debug("Disconnected from {}", getServerUrl());
    }
  }

  /** Same as {@link #disconnect()}. */
  @Override
  public void close() {
    disconnect();
  }

  /**
   * Calls a unary stub method, classifying gRPC failures.
   *
   * @param operation the name of the operation, used in error messages
   * @param method the call to make on the stub
   * @param <R> the response type
   * @return the response
   * @throws ClientNotConnectedException if the client is not connected
   * @throws GrpcStatusException if the call failed with a gRPC status
   */
  protected <R> R call(@Nonnull String operation, @Nonnull Function<S, R> method) {
    Objects.requireNonNull(operation, "operation cannot be null");
    Objects.requireNonNull(method, "method cannot be null");
    S currentStub;
    String url;
    synchronized (this) {
      currentStub = stub;
      url = serverUrl;
    }
    if (currentStub == null) {
      throw new ClientNotConnectedException(url, operation);
    }
    try {
      return method.apply(currentStub);
    } catch (StatusRuntimeException e) {
      throw GrpcErrorHandling.fromStatusException(url, operation, e);
    }
  }

  private static void shutdown(ManagedChannel channel) {
    channel.shutdown();
    try {
      if (!channel.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
        logger.warn("Channel did not terminate gracefully, forcing shutdown");
        channel.shutdownNow();
      }
    } catch (InterruptedException e) {
      logger.warn("Interrupted while waiting for channel shutdown");
      channel.shutdownNow();
      Thread.currentThread().interrupt();
    }
  }
}
