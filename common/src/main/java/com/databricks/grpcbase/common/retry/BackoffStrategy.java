package com.databricks.grpcbase.common.retry;

import java.time.Duration;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.concurrent.ThreadLocalRandom;
import javax.annotation.Nonnull;

/**
 * Base class for retry strategies.
 *
 * <p>A strategy computes the time to wait before the next retry attempt and keeps count of the
 * attempts made so far. Once the count reaches the configured limit the strategy is exhausted and
 * {@link #nextInterval()} returns an empty value until {@link #reset()} is called.
 *
 * <p>Strategies are mutable and not thread-safe. A configured instance can be shared as a template:
 * components that retry call {@link #copy()} once and only ever mutate their own copy.
 *
 * <p>Iterating a strategy yields intervals until it is exhausted:
 *
 * <pre>{@code
 * for (Duration interval : LinearBackoff.builder().limit(3).build()) {
 *     Thread.sleep(interval.toMillis());
 *     // retry
 * }
 * }</pre>
 *
 * @see LinearBackoff
 * @see ExponentialBackoff
 */
public abstract class BackoffStrategy implements Iterable<Duration> {

  /** Default retry interval. */
  public static final Duration DEFAULT_RETRY_INTERVAL = Duration.ofSeconds(3);

  /** Default retry jitter. */
  public static final Duration DEFAULT_RETRY_JITTER = Duration.ofSeconds(1);

  protected final Duration jitter;
  protected final OptionalInt limit;
  private int count = 0;

  protected BackoffStrategy(@Nonnull Duration jitter, @Nonnull OptionalInt limit) {
    if (jitter.isNegative()) {
      throw new IllegalArgumentException("jitter must not be negative, got " + jitter);
    }
    if (limit.isPresent() && limit.getAsInt() < 0) {
      throw new IllegalArgumentException("limit must not be negative, got " + limit.getAsInt());
    }
    this.jitter = jitter;
    this.limit = limit;
  }

  /**
   * Returns the time to wait before the next retry.
   *
   * @return the interval, or empty if the retry limit has been reached
   */
  @Nonnull
  public final Optional<Duration> nextInterval() {
    if (limit.isPresent() && count >= limit.getAsInt()) {
      return Optional.empty();
    }
    count++;
    return Optional.of(nominalInterval(count).plus(randomJitter()));
  }

  /**
   * Returns the interval before jitter for the given attempt.
   *
   * @param attempt the attempt number, starting at 1
   * @return the nominal interval
   */
  @Nonnull
  protected abstract Duration nominalInterval(int attempt);

  /**
   * Returns a new strategy with the same configuration and an attempt count of zero.
   *
   * @return an independent copy of this strategy
   */
  @Nonnull
  public abstract BackoffStrategy copy();

  /** Resets the attempt count. The configuration is left unchanged. */
  public void reset() {
    count = 0;
  }

  /** Returns the number of intervals handed out since construction or the last reset. */
  public int getCount() {
    return count;
  }

  /** Returns the retry limit, or empty if retries are unlimited. */
  @Nonnull
  public OptionalInt getLimit() {
    return limit;
  }

  /** Returns the jitter bound added on top of every interval. */
  @Nonnull
  public Duration getJitter() {
    return jitter;
  }

  /**
   * Returns the retry progress for log messages, in the form {@code (count/limit)} or {@code
   * (count/∞)} for unlimited strategies.
   *
   * @return the progress string
   */
  @Nonnull
  public String progress() {
    if (!limit.isPresent()) {
      return "(" + count + "/∞)";
    }
    return "(" + count + "/" + limit.getAsInt() + ")";
  }

  /**
   * Returns an iterator over the remaining retry intervals.
   *
   * <p>The iterator draws from this strategy, so it advances the attempt count. It ends the first
   * time {@link #nextInterval()} returns empty.
   */
  @Override
  @Nonnull
  public Iterator<Duration> iterator() {
    return new Iterator<Duration>() {
      private Optional<Duration> next = null;
      private boolean done = false;

      @Override
      public boolean hasNext() {
        if (done) {
          return false;
        }
        if (next == null) {
          next = nextInterval();
          if (!next.isPresent()) {
            done = true;
            return false;
          }
        }
        return true;
      }

      @Override
      public Duration next() {
        if (!hasNext()) {
          throw new NoSuchElementException("Retry limit reached " + progress());
        }
        Duration interval = next.get();
        next = null;
        return interval;
      }
    };
  }

  private Duration randomJitter() {
    long bound = jitter.toNanos();
    if (bound <= 0) {
      return Duration.ZERO;
    }
    return Duration.ofNanos(ThreadLocalRandom.current().nextLong(bound));
  }

  static Duration requireNonNegative(Duration value, String name) {
    if (value == null) {
      throw new NullPointerException(name + " cannot be null");
    }
    if (value.isNegative()) {
      throw new IllegalArgumentException(name + " must not be negative, got " + value);
    }
    return value;
  }
}
