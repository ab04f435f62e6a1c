package com.databricks.grpcbase.common.retry;

import java.time.Duration;
import java.util.OptionalInt;
import javax.annotation.Nonnull;

/**
 * Retry strategy that waits a constant interval, plus jitter, between attempts.
 *
 * <p>Example usage:
 *
 * <pre>{@code
 * BackoffStrategy strategy = LinearBackoff.builder()
 *     .interval(Duration.ofSeconds(2))
 *     .jitter(Duration.ofMillis(500))
 *     .limit(5)
 *     .build();
 * }</pre>
 *
 * <p>Defaults: interval 3s, jitter 1s, no limit.
 */
public final class LinearBackoff extends BackoffStrategy {

  private final Duration interval;

  /** Creates a strategy with default settings, retrying forever. */
  public LinearBackoff() {
    this(DEFAULT_RETRY_INTERVAL, DEFAULT_RETRY_JITTER, OptionalInt.empty());
  }

  private LinearBackoff(Duration interval, Duration jitter, OptionalInt limit) {
    super(jitter, limit);
    this.interval = interval;
  }

  /**
   * Returns a new builder for creating LinearBackoff instances.
   *
   * @return a new builder
   */
  @Nonnull
  public static Builder builder() {
    return new Builder();
  }

  /** Returns the constant interval before jitter. */
  @Nonnull
  public Duration getInterval() {
    return interval;
  }

  @Override
  @Nonnull
  protected Duration nominalInterval(int attempt) {
    return interval;
  }

  @Override
  @Nonnull
  public LinearBackoff copy() {
    return new LinearBackoff(interval, jitter, limit);
  }

  @Override
  public String toString() {
    return "LinearBackoff{interval=" + interval + ", jitter=" + jitter + ", limit=" + limit + "}";
  }

  /** Builder for {@link LinearBackoff}. */
  public static final class Builder {
    private Duration interval = DEFAULT_RETRY_INTERVAL;
    private Duration jitter = DEFAULT_RETRY_JITTER;
    private OptionalInt limit = OptionalInt.empty();

    private Builder() {}

    /**
     * Sets the time to wait before each retry.
     *
     * @param interval the interval, must not be negative
     * @return this builder for method chaining
     */
    @Nonnull
    public Builder interval(@Nonnull Duration interval) {
      this.interval = requireNonNegative(interval, "interval");
      return this;
    }

    /**
     * Sets the upper bound of the random jitter added to each interval.
     *
     * @param jitter the jitter bound, must not be negative
     * @return this builder for method chaining
     */
    @Nonnull
    public Builder jitter(@Nonnull Duration jitter) {
      this.jitter = requireNonNegative(jitter, "jitter");
      return this;
    }

    /**
     * Sets the maximum number of retries. {@code 0} means no retry at all.
     *
     * @param limit the retry limit, must not be negative
     * @return this builder for method chaining
     */
    @Nonnull
    public Builder limit(int limit) {
      if (limit < 0) {
        throw new IllegalArgumentException("limit must not be negative, got " + limit);
      }
      this.limit = OptionalInt.of(limit);
      return this;
    }

    /**
     * Removes the retry limit.
     *
     * @return this builder for method chaining
     */
    @Nonnull
    public Builder unlimited() {
      this.limit = OptionalInt.empty();
      return this;
    }

    /**
     * Builds the strategy.
     *
     * @return a new LinearBackoff with an attempt count of zero
     */
    @Nonnull
    public LinearBackoff build() {
      return new LinearBackoff(interval, jitter, limit);
    }
  }
}
