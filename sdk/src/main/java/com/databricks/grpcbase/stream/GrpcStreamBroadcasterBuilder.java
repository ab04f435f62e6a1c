package com.databricks.grpcbase.stream;

import com.databricks.grpcbase.common.retry.BackoffStrategy;
import com.databricks.grpcbase.common.retry.LinearBackoff;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.function.Function;
import javax.annotation.Nonnull;

/**
 * Builder for {@link GrpcStreamBroadcaster} instances.
 *
 * <p>Example usage:
 *
 * <pre>{@code
 * GrpcStreamBroadcaster<EventProto, Event> broadcaster =
 *     GrpcStreamBroadcaster.builder("events", () -> stub.streamEvents(request), Event::fromProto)
 *         .retryStrategy(ExponentialBackoff.builder().limit(10).build())
 *         .build();
 * }</pre>
 *
 * @param <I> The type of messages received from the call
 * @param <O> The type of messages delivered to receivers
 * @see GrpcStreamBroadcaster#builder(String, StreamMethod, Function)
 */
public final class GrpcStreamBroadcasterBuilder<I, O> {
  /** Default capacity of each receiver's buffer. */
  public static final int DEFAULT_RECEIVER_SIZE = 50;

  private final String name;
  private final StreamMethod<I> streamMethod;
  private final Function<I, O> transform;
  private Optional<BackoffStrategy> retryStrategy = Optional.empty();
  private Optional<ExecutorService> executor = Optional.empty();
  private int defaultReceiverSize = DEFAULT_RECEIVER_SIZE;

  GrpcStreamBroadcasterBuilder(
      @Nonnull String name,
      @Nonnull StreamMethod<I> streamMethod,
      @Nonnull Function<I, O> transform) {
    this.name = Objects.requireNonNull(name, "name cannot be null");
    this.streamMethod = Objects.requireNonNull(streamMethod, "streamMethod cannot be null");
    this.transform = Objects.requireNonNull(transform, "transform cannot be null");
  }

  /**
   * Sets the strategy used to decide when to reconnect.
   *
   * <p>The broadcaster works on its own copy, so the given instance can be shared. If not set, it
   * retries every 3 seconds with up to 1 second of jitter, forever.
   *
   * @param retryStrategy The retry strategy
   * @return This builder for method chaining
   */
  @Nonnull
  public GrpcStreamBroadcasterBuilder<I, O> retryStrategy(@Nonnull BackoffStrategy retryStrategy) {
    this.retryStrategy =
        Optional.of(Objects.requireNonNull(retryStrategy, "retryStrategy cannot be null"));
    return this;
  }

  /**
   * Sets the executor running the background loop.
   *
   * <p>The loop occupies one thread for the broadcaster's whole life. If not set, the broadcaster
   * creates its own daemon thread and shuts it down when stopped. When providing a custom executor,
   * the caller is responsible for shutting it down.
   *
   * @param executor The executor service to use
   * @return This builder for method chaining
   */
  @Nonnull
  public GrpcStreamBroadcasterBuilder<I, O> executor(@Nonnull ExecutorService executor) {
    this.executor = Optional.of(Objects.requireNonNull(executor, "executor cannot be null"));
    return this;
  }

  /**
   * Sets the buffer capacity used by {@link GrpcStreamBroadcaster#newReceiver()}.
   *
   * @param defaultReceiverSize Maximum number of buffered messages per receiver
   * @return This builder for method chaining
   * @throws IllegalArgumentException if the size is not positive
   */
  @Nonnull
  public GrpcStreamBroadcasterBuilder<I, O> defaultReceiverSize(int defaultReceiverSize) {
    if (defaultReceiverSize <= 0) {
      throw new IllegalArgumentException(
          "defaultReceiverSize must be positive, got " + defaultReceiverSize);
    }
    this.defaultReceiverSize = defaultReceiverSize;
    return this;
  }

  /**
   * Builds the broadcaster and starts streaming in the background.
   *
   * @return A new, running broadcaster
   */
  @Nonnull
  public GrpcStreamBroadcaster<I, O> build() {
    BackoffStrategy strategy = retryStrategy.orElseGet(LinearBackoff::new).copy();
    boolean ownsExecutor = !executor.isPresent();
    GrpcStreamBroadcaster<I, O> broadcaster =
        new GrpcStreamBroadcaster<>(
            name,
            streamMethod,
            transform,
            strategy,
            executor.orElseGet(() -> GrpcStreamBroadcaster.createDefaultExecutor(name)),
            ownsExecutor,
            defaultReceiverSize);
    broadcaster.start();
    return broadcaster;
  }
}
