package com.databricks.grpcbase.common.retry;

import java.time.Duration;
import java.util.OptionalInt;
import javax.annotation.Nonnull;

/**
 * Retry strategy whose interval grows geometrically up to a maximum.
 *
 * <p>The nominal interval for attempt {@code n} (starting at 1) is {@code min(initialInterval *
 * multiplier^(n-1), maxInterval)}. Jitter is added on top of the capped value.
 *
 * <p>Defaults: initial interval 3s, max interval 60s, multiplier 2.0, jitter 1s, no limit.
 */
public final class ExponentialBackoff extends BackoffStrategy {

  /** Default maximum interval. */
  public static final Duration DEFAULT_MAX_INTERVAL = Duration.ofSeconds(60);

  /** Default multiplier applied for every attempt. */
  public static final double DEFAULT_MULTIPLIER = 2.0;

  private final Duration initialInterval;
  private final Duration maxInterval;
  private final double multiplier;

  /** Creates a strategy with default settings, retrying forever. */
  public ExponentialBackoff() {
    this(
        DEFAULT_RETRY_INTERVAL,
        DEFAULT_MAX_INTERVAL,
        DEFAULT_MULTIPLIER,
        DEFAULT_RETRY_JITTER,
        OptionalInt.empty());
  }

  private ExponentialBackoff(
      Duration initialInterval,
      Duration maxInterval,
      double multiplier,
      Duration jitter,
      OptionalInt limit) {
    super(jitter, limit);
    this.initialInterval = initialInterval;
    this.maxInterval = maxInterval;
    this.multiplier = multiplier;
  }

  /**
   * Returns a new builder for creating ExponentialBackoff instances.
   *
   * @return a new builder
   */
  @Nonnull
  public static Builder builder() {
    return new Builder();
  }

  @Nonnull
  public Duration getInitialInterval() {
    return initialInterval;
  }

  @Nonnull
  public Duration getMaxInterval() {
    return maxInterval;
  }

  public double getMultiplier() {
    return multiplier;
  }

  @Override
  @Nonnull
  protected Duration nominalInterval(int attempt) {
    double nanos = initialInterval.toNanos() * Math.pow(multiplier, attempt - 1);
    if (nanos >= maxInterval.toNanos()) {
      return maxInterval;
    }
    return Duration.ofNanos((long) nanos);
  }

  @Override
  @Nonnull
  public ExponentialBackoff copy() {
    return new ExponentialBackoff(initialInterval, maxInterval, multiplier, jitter, limit);
  }

  @Override
  public String toString() {
    return "ExponentialBackoff{initialInterval="
        + initialInterval
        + ", maxInterval="
        + maxInterval
        + ", multiplier="
        + multiplier
        + ", jitter="
        + jitter
        + ", limit="
        + limit
        + "}";
  }

  /** Builder for {@link ExponentialBackoff}. */
  public static final class Builder {
    private Duration initialInterval = DEFAULT_RETRY_INTERVAL;
    private Duration maxInterval = DEFAULT_MAX_INTERVAL;
    private double multiplier = DEFAULT_MULTIPLIER;
    private Duration jitter = DEFAULT_RETRY_JITTER;
    private OptionalInt limit = OptionalInt.empty();

    private Builder() {}

    /**
     * Sets the time to wait before the first retry.
     *
     * @param initialInterval the first interval, must not be negative
     * @return this builder for method chaining
     */
    @Nonnull
    public Builder initialInterval(@Nonnull Duration initialInterval) {
      this.initialInterval = requireNonNegative(initialInterval, "initialInterval");
      return this;
    }

    /**
     * Sets the cap applied to the interval before jitter is added.
     *
     * @param maxInterval the maximum interval, must not be negative
     * @return this builder for method chaining
     */
    @Nonnull
    public Builder maxInterval(@Nonnull Duration maxInterval) {
      this.maxInterval = requireNonNegative(maxInterval, "maxInterval");
      return this;
    }

    /**
     * Sets the growth factor between consecutive intervals.
     *
     * @param multiplier the multiplier, at least 1.0
     * @return this builder for method chaining
     */
    @Nonnull
    public Builder multiplier(double multiplier) {
      if (Double.isNaN(multiplier) || multiplier < 1.0) {
        throw new IllegalArgumentException("multiplier must be at least 1.0, got " + multiplier);
      }
      this.multiplier = multiplier;
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
     * @return a new ExponentialBackoff with an attempt count of zero
     */
    @Nonnull
    public ExponentialBackoff build() {
      return new ExponentialBackoff(initialInterval, maxInterval, multiplier, jitter, limit);
    }
  }
}
