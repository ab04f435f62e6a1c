package com.databricks.grpcbase;

import io.grpc.Status;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * The gRPC server returned an error status.
 *
 * <p>This exception is specific to gRPC. Code that wants to stay protocol-independent should
 * catch {@link ApiClientException} and look at {@link #getKind()} instead.
 *
 * <p>Instances are created by {@link GrpcErrorHandling}.
 */
public class GrpcStatusException extends ApiClientException {

  private final int statusCode;
  private final String statusName;
  @Nullable private final Status status;

  GrpcStatusException(
      @Nonnull ErrorKind kind,
      @Nonnull String serverUrl,
      @Nonnull String operation,
      @Nonnull String description,
      int statusCode,
      @Nonnull String statusName,
      @Nullable Status status,
      @Nullable Throwable cause) {
    super(kind, serverUrl, operation, description, cause);
    this.statusCode = statusCode;
    this.statusName = statusName;
    this.status = status;
  }

  /** Returns the numeric gRPC status code as received from the wire. */
  public int getStatusCode() {
    return statusCode;
  }

  /** Returns the gRPC status name, e.g. {@code UNAVAILABLE}. */
  @Nonnull
  public String getStatusName() {
    return statusName;
  }

  /**
   * Returns the original gRPC status, if the error was created from one.
   *
   * @return the status, or null when classified from a raw code
   */
  @Nullable public Status getStatus() {
    return status;
  }
}
