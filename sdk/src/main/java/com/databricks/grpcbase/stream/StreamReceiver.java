package com.databricks.grpcbase.stream;

import java.time.Duration;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * One consumer's view of a {@link GrpcStreamBroadcaster}.
 *
 * <p>A receiver only sees messages published after it was created. It ends when the broadcaster
 * stops, or gives up reconnecting, and all buffered messages have been read. Iteration blocks
 * waiting for the next message:
 *
 * <pre>{@code
 * try (StreamReceiver<Event> receiver = broadcaster.newReceiver()) {
 *     for (Event event : receiver) {
 *         handle(event);
 *     }
 * }
 * }</pre>
 *
 * <p>A receiver is meant to be consumed by a single thread and can only be iterated once. If the
 * consuming thread is interrupted while waiting, iteration ends and the interrupt flag is kept.
 *
 * @param <O> The message type
 */
public final class StreamReceiver<O> implements Iterable<O>, Iterator<O>, AutoCloseable {

  private final ReceiverBuffer<O> buffer;
  private final Runnable onClose;

  @Nullable private O pending;

  StreamReceiver(@Nonnull ReceiverBuffer<O> buffer, @Nonnull Runnable onClose) {
    this.buffer = buffer;
    this.onClose = onClose;
  }

  /** Returns this receiver; it can only be iterated once. */
  @Override
  public Iterator<O> iterator() {
    return this;
  }

  /**
   * Waits for the next message.
   *
   * @return true if a message is available, false if the receiver ended
   */
  @Override
  public boolean hasNext() {
    if (pending != null) {
      return true;
    }
    try {
      pending = buffer.take();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return false;
    }
    return pending != null;
  }

  /**
   * Returns the next message, waiting for it if needed.
   *
   * @throws NoSuchElementException if the receiver ended
   */
  @Override
  public O next() {
    if (!hasNext()) {
      throw new NoSuchElementException("Receiver has ended");
    }
    O message = pending;
    pending = null;
    return message;
  }

  /**
   * Waits for the next message.
   *
   * @return the message
   * @throws NoSuchElementException if the receiver ended
   * @throws InterruptedException if interrupted while waiting
   */
  @Nonnull
  public O receive() throws InterruptedException {
    if (pending != null) {
      return next();
    }
    O message = buffer.take();
    if (message == null) {
      throw new NoSuchElementException("Receiver has ended");
    }
    return message;
  }

  /**
   * Waits up to the given time for the next message.
   *
   * @param timeout maximum time to wait
   * @return the message, or null if none arrived in time or the receiver ended; use {@link
   *     #isDone()} to tell the two apart
   * @throws InterruptedException if interrupted while waiting
   */
  @Nullable public O poll(@Nonnull Duration timeout) throws InterruptedException {
    Objects.requireNonNull(timeout, "timeout cannot be null");
    if (pending != null) {
      return next();
    }
    return buffer.poll(timeout.toNanos(), TimeUnit.NANOSECONDS);
  }

  /** Returns true once the receiver ended and every buffered message has been read. */
  public boolean isDone() {
    return pending == null && buffer.isDrained();
  }

  /**
   * Detaches the receiver from the broadcaster.
   *
   * <p>Messages already buffered can still be read; nothing new is delivered. Closing the last
   * receiver does not stop the broadcaster.
   */
  @Override
  public void close() {
    buffer.close();
    onClose.run();
  }
}
