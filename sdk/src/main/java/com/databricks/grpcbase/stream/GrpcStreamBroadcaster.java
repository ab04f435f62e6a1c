package com.databricks.grpcbase.stream;

import com.databricks.grpcbase.GrpcErrorHandling;
import com.databricks.grpcbase.common.retry.BackoffStrategy;
import io.grpc.Context;
import io.grpc.Status;
import java.time.Duration;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns a server-streaming gRPC call into a durable feed shared by many receivers.
 *
 * <p>A background loop opens the call, transforms every message and delivers it to every receiver
 * attached at that time. When the call ends, cleanly or with an error, the loop asks its retry
 * strategy how long to wait and reconnects. When the strategy gives up, or {@link #stop()} is
 * called, all receivers end after their buffered messages have been read.
 *
 * <p>Each receiver has a bounded buffer. Delivery waits for space, so a consumer that does not keep
 * up slows down the stream for every receiver rather than losing messages.
 *
 * <p>Example usage:
 *
 * <pre>{@code
 * GrpcStreamBroadcaster<EventProto, Event> broadcaster =
 *     GrpcStreamBroadcaster.builder("events", () -> stub.streamEvents(request), Event::fromProto)
 *         .build();
 *
 * try (StreamReceiver<Event> receiver = broadcaster.newReceiver()) {
 *     for (Event event : receiver) {
 *         handle(event);
 *     }
 * } finally {
 *     broadcaster.stop();
 * }
 * }</pre>
 *
 * @param <I> The type of messages received from the call
 * @param <O> The type of messages delivered to receivers
 */
public class GrpcStreamBroadcaster<I, O> {
  private static final Logger logger = LoggerFactory.getLogger(GrpcStreamBroadcaster.class);

  private static final long EXECUTOR_SHUTDOWN_TIMEOUT_SECONDS = 5;

  private final String name;
  private final StreamMethod<I> streamMethod;
  private final Function<I, O> transform;
  private final BackoffStrategy retryStrategy;
  private final ExecutorService executor;
  private final boolean ownsExecutor;
  private final int defaultReceiverSize;

  private final List<ReceiverBuffer<O>> buffers = new CopyOnWriteArrayList<>();
  private final CompletableFuture<Void> cancellationToken = new CompletableFuture<>();
  private final CountDownLatch terminated = new CountDownLatch(1);
  private final Object runnerLock = new Object();

  private volatile StreamState state = StreamState.IDLE;
  private volatile boolean exhausted = false;
  @Nullable private volatile Context.CancellableContext callContext;
  @Nullable private Thread runner;

  GrpcStreamBroadcaster(
      @Nonnull String name,
      @Nonnull StreamMethod<I> streamMethod,
      @Nonnull Function<I, O> transform,
      @Nonnull BackoffStrategy retryStrategy,
      @Nonnull ExecutorService executor,
      boolean ownsExecutor,
      int defaultReceiverSize) {
    this.name = name;
    this.streamMethod = streamMethod;
    this.transform = transform;
    this.retryStrategy = retryStrategy;
    this.executor = executor;
    this.ownsExecutor = ownsExecutor;
    this.defaultReceiverSize = defaultReceiverSize;
  }

  /**
   * Creates a builder for a broadcaster.
   *
   * @param name Name of the stream, used in log messages
   * @param streamMethod Opens the call; invoked again on every reconnection
   * @param transform Converts call messages to the type delivered to receivers
   * @param <I> The type of messages received from the call
   * @param <O> The type of messages delivered to receivers
   * @return A new builder
   */
  @Nonnull
  public static <I, O> GrpcStreamBroadcasterBuilder<I, O> builder(
      @Nonnull String name,
      @Nonnull StreamMethod<I> streamMethod,
      @Nonnull Function<I, O> transform) {
    return new GrpcStreamBroadcasterBuilder<>(name, streamMethod, transform);
  }

  static ExecutorService createDefaultExecutor(String name) {
    return Executors.newSingleThreadExecutor(
        r -> {
          Thread t = new Thread(r);
          t.setDaemon(true);
          t.setName("GrpcStreamBroadcaster-" + name);
          return t;
        });
  }

  void start() {
    executor.execute(this::run);
  }

  /** Returns the name of the stream. */
  @Nonnull
  public String getName() {
    return name;
  }

  /** Returns the current lifecycle state. */
  @Nonnull
  public StreamState getState() {
    return state;
  }

  /**
   * Returns whether the broadcaster closed because its retry strategy gave up, as opposed to being
   * stopped.
   */
  public boolean isExhausted() {
    return exhausted;
  }

  /** Returns whether the broadcaster still delivers messages. */
  public boolean isRunning() {
    return state != StreamState.CLOSED;
  }

  /**
   * Attaches a new receiver with the default buffer size.
   *
   * @return a receiver of messages published from now on
   * @throws IllegalStateException if the broadcaster is closed
   */
  @Nonnull
  public StreamReceiver<O> newReceiver() {
    return newReceiver(defaultReceiverSize);
  }

  /**
   * Attaches a new receiver.
   *
   * @param maxSize maximum number of messages buffered for this receiver
   * @return a receiver of messages published from now on
   * @throws IllegalArgumentException if maxSize is not positive
   * @throws IllegalStateException if the broadcaster is closed
   */
  @Nonnull
  public StreamReceiver<O> newReceiver(int maxSize) {
    ReceiverBuffer<O> buffer = new ReceiverBuffer<>(maxSize);
    synchronized (buffers) {
      if (state == StreamState.CLOSED) {
        throw new IllegalStateException("Stream " + name + " is closed");
      }
      buffers.add(buffer);
    }
    return new StreamReceiver<>(buffer, () -> buffers.remove(buffer));
  }

  /**
   * Stops streaming and ends all receivers.
   *
   * <p>Cancels any wait or in-flight call and blocks until the background loop has finished.
   * Messages already buffered can still be read. Can be called many times and from any thread.
   */
  public void stop() {
    if (cancellationToken.complete(null)) {
      logger.debug("{}: stopping", name);
    }
    Context.CancellableContext context = callContext;
    if (context != null) {
      context.cancel(null);
    }
    synchronized (runnerLock) {
      if (runner != null && runner != Thread.currentThread()) {
        runner.interrupt();
      }
    }
    if (!isRunnerThread()) {
      awaitTermination();
    }
    if (ownsExecutor) {
      shutdownExecutor();
    }
  }

  private void run() {
    synchronized (runnerLock) {
      runner = Thread.currentThread();
    }
    try {
      streamLoop();
    } catch (Throwable e) {
      logger.error("{}: stream loop failed", name, e);
    } finally {
      closeReceivers();
      synchronized (runnerLock) {
        runner = null;
      }
      terminated.countDown();
      if (ownsExecutor) {
        executor.shutdown();
      }
    }
  }

  private void streamLoop() {
    while (!cancellationToken.isDone()) {
      state = StreamState.CONNECTING;
      Throwable error = null;
      Context.CancellableContext context = Context.current().withCancellation();
      callContext = context;
      Context previous = context.attach();
      try {
        if (cancellationToken.isDone()) {
          return;
        }
        Iterator<I> call = streamMethod.open();
        logger.info("{}: starting to stream", name);
        state = StreamState.STREAMING;
        while (call.hasNext()) {
          I message = call.next();
          O transformed;
          try {
            transformed =
                Objects.requireNonNull(transform.apply(message), "transform returned null");
          } catch (RuntimeException e) {
            logger.error("{}: failed to transform message, stopping stream", name, e);
            return;
          }
          if (!publish(transformed)) {
            return;
          }
        }
      } catch (RuntimeException e) {
        error = e;
      } finally {
        context.detach(previous);
        context.cancel(null);
        callContext = null;
      }

      if (cancellationToken.isDone()) {
        return;
      }
      Optional<Duration> interval = retryStrategy.nextInterval();
      if (!interval.isPresent()) {
        logGiveUp(error);
        exhausted = true;
        return;
      }
      logRetry(interval.get(), error);
      state = StreamState.BACKING_OFF;
      if (!sleep(interval.get())) {
        return;
      }
    }
  }

  // Returns false if the loop must end.
  private boolean publish(O message) {
    for (ReceiverBuffer<O> buffer : buffers) {
      try {
        if (!buffer.put(message)) {
          buffers.remove(buffer);
        }
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        return false;
      }
    }
    return !cancellationToken.isDone();
  }

  // Returns false if stopped while waiting. A zero interval still yields to other threads.
  private boolean sleep(Duration interval) {
    if (interval.isZero()) {
      Thread.yield();
    }
    try {
      cancellationToken.get(interval.toNanos(), TimeUnit.NANOSECONDS);
      return false;
    } catch (TimeoutException e) {
      return true;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return false;
    } catch (ExecutionException e) {
      logger.warn("{}: cancellation token failed", name, e.getCause());
      return false;
    }
  }

  private void logRetry(Duration interval, @Nullable Throwable error) {
    String seconds = String.format(Locale.ROOT, "%.3f", interval.toNanos() / 1e9);
    if (error != null) {
      logger.warn(
          "{}: connection ended, retrying {} in {} seconds. Error: {}.",
          name,
          retryStrategy.progress(),
          seconds,
          describe(error));
    } else {
      logger.warn(
          "{}: connection ended, retrying {} in {} seconds.",
          name,
          retryStrategy.progress(),
          seconds);
    }
  }

  private void logGiveUp(@Nullable Throwable error) {
    if (error != null) {
      logger.error(
          "{}: connection ended, retry limit exceeded {}, giving up. Error: {}.",
          name,
          retryStrategy.progress(),
          describe(error));
    } else {
      logger.error(
          "{}: connection ended, retry limit exceeded {}, giving up. Stream exhausted.",
          name,
          retryStrategy.progress());
    }
  }

  private static String describe(Throwable error) {
    Status status = GrpcErrorHandling.statusOf(error);
    return status != null ? GrpcErrorHandling.describe(status) : error.toString();
  }

  private void closeReceivers() {
    synchronized (buffers) {
      state = StreamState.CLOSED;
      for (ReceiverBuffer<O> buffer : buffers) {
        buffer.close();
      }
      buffers.clear();
    }
  }

  private boolean isRunnerThread() {
    synchronized (runnerLock) {
      return runner == Thread.currentThread();
    }
  }

  private void awaitTermination() {
    try {
      terminated.await();
    } catch (InterruptedException e) {
      logger.warn("{}: interrupted while waiting for the stream to stop", name);
      Thread.currentThread().interrupt();
    }
  }

  private void shutdownExecutor() {
    executor.shutdown();
    if (isRunnerThread()) {
      return;
    }
    try {
      if (!executor.awaitTermination(EXECUTOR_SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
        logger.warn("{}: executor did not terminate gracefully, forcing shutdown", name);
        executor.shutdownNow();
      }
    } catch (InterruptedException e) {
      logger.warn("{}: interrupted while waiting for executor shutdown", name);
      executor.shutdownNow();
      Thread.currentThread().interrupt();
    }
  }
}
