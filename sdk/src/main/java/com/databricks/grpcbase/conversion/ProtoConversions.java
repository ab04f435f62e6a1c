package com.databricks.grpcbase.conversion;

import com.google.protobuf.Timestamp;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Objects;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/** Conversions between protobuf well-known types and {@code java.time} types. */
public final class ProtoConversions {

  private ProtoConversions() {}

  /**
   * Converts an instant to a protobuf timestamp.
   *
   * @param instant the instant to convert, may be null
   * @return the timestamp, or null if the instant is null
   */
  @Nullable public static Timestamp toTimestamp(@Nullable Instant instant) {
    if (instant == null) {
      return null;
    }
    return Timestamp.newBuilder()
        .setSeconds(instant.getEpochSecond())
        .setNanos(instant.getNano())
        .build();
  }

  /**
   * Converts a protobuf timestamp to an instant, keeping nanosecond precision.
   *
   * @param timestamp the timestamp to convert
   * @return the instant
   */
  @Nonnull
  public static Instant toInstant(@Nonnull Timestamp timestamp) {
    Objects.requireNonNull(timestamp, "timestamp cannot be null");
    return Instant.ofEpochSecond(timestamp.getSeconds(), timestamp.getNanos());
  }

  /**
   * Converts a protobuf timestamp to a date-time in the given zone.
   *
   * @param timestamp the timestamp to convert
   * @param zone the time zone of the result
   * @return the date-time
   */
  @Nonnull
  public static ZonedDateTime toZonedDateTime(@Nonnull Timestamp timestamp, @Nonnull ZoneId zone) {
    Objects.requireNonNull(zone, "zone cannot be null");
    return toInstant(timestamp).atZone(zone);
  }
}
