package com.databricks.grpcbase.stream;

import java.util.ArrayDeque;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import javax.annotation.Nullable;

/**
 * Bounded FIFO between the broadcaster loop and one receiver.
 *
 * <p>This class provides thread-safe coordination between:
 *
 * <ul>
 *   <li>The broadcaster thread calling {@link #put} for every transformed message
 *   <li>The consumer thread calling {@link #take} or {@link #poll}
 * </ul>
 *
 * <p>{@link #put} blocks while the buffer is full, which is how a slow consumer applies
 * backpressure to the whole stream. Once closed, no new messages are accepted, but messages that
 * were already buffered can still be read.
 *
 * @param <T> The message type
 */
final class ReceiverBuffer<T> {

  private final ArrayDeque<T> queue;
  private final int capacity;

  private final ReentrantLock lock = new ReentrantLock();
  private final Condition notEmpty = lock.newCondition();
  private final Condition notFull = lock.newCondition();

  private volatile boolean closed = false;

  /**
   * Creates a new buffer.
   *
   * @param capacity Maximum number of buffered messages
   * @throws IllegalArgumentException if capacity is not positive
   */
  ReceiverBuffer(int capacity) {
    if (capacity <= 0) {
      throw new IllegalArgumentException("capacity must be positive, got " + capacity);
    }
    this.capacity = capacity;
    this.queue = new ArrayDeque<>(capacity);
  }

  /**
   * Appends a message, waiting for space if the buffer is full.
   *
   * @param message The message to add
   * @return true if the message was added, false if the buffer is closed
   * @throws InterruptedException if interrupted while waiting for space
   */
  boolean put(T message) throws InterruptedException {
    lock.lock();
    try {
      while (queue.size() >= capacity && !closed) {
        notFull.await();
      }
      if (closed) {
        return false;
      }
      queue.addLast(message);
      notEmpty.signal();
      return true;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Removes the oldest message, waiting until one is available.
   *
   * @return The message, or null if the buffer is closed and drained
   * @throws InterruptedException if interrupted while waiting
   */
  @Nullable T take() throws InterruptedException {
    lock.lock();
    try {
      while (queue.isEmpty() && !closed) {
        notEmpty.await();
      }
      return removeFirst();
    } finally {
      lock.unlock();
    }
  }

  /**
   * Removes the oldest message, waiting up to the given time for one to become available.
   *
   * @param timeout Maximum time to wait
   * @param unit Time unit for timeout
   * @return The message, or null if the timeout elapsed or the buffer is closed and drained
   * @throws InterruptedException if interrupted while waiting
   */
  @Nullable T poll(long timeout, TimeUnit unit) throws InterruptedException {
    long nanos = unit.toNanos(timeout);
    lock.lock();
    try {
      while (queue.isEmpty() && !closed) {
        if (nanos <= 0) {
          return null;
        }
        nanos = notEmpty.awaitNanos(nanos);
      }
      return removeFirst();
    } finally {
      lock.unlock();
    }
  }

  /** Closes the buffer and wakes up all waiting threads. Idempotent. */
  void close() {
    lock.lock();
    try {
      closed = true;
      notEmpty.signalAll();
      notFull.signalAll();
    } finally {
      lock.unlock();
    }
  }

  boolean isClosed() {
    return closed;
  }

  /** Returns true once the buffer is closed and every buffered message has been read. */
  boolean isDrained() {
    lock.lock();
    try {
      return closed && queue.isEmpty();
    } finally {
      lock.unlock();
    }
  }

  int size() {
    lock.lock();
    try {
      return queue.size();
    } finally {
      lock.unlock();
    }
  }

  int capacity() {
    return capacity;
  }

  @Nullable private T removeFirst() {
    T message = queue.pollFirst();
    if (message != null) {
      notFull.signal();
    }
    return message;
  }
}
