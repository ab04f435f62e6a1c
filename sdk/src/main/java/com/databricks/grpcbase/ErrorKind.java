package com.databricks.grpcbase;

import javax.annotation.Nonnull;

/**
 * Protocol-independent kinds of API client errors.
 *
 * <p>Every kind has a fixed description and a fixed retryable verdict. Retryable errors might
 * succeed if the operation is retried; the others will not until something outside the client
 * changes. When uncertain, errors are assumed to be retryable.
 *
 * <p>See the <a href="https://github.com/grpc/grpc/blob/master/doc/statuscodes.md">gRPC status
 * codes</a> for the meaning of the codes the kinds are mapped from.
 */
public enum ErrorKind {
  /** The client is not connected to the server. Raised before any call is attempted. */
  NOT_CONNECTED("The client is not connected to the server", true),

  /** The server returned a status code this library does not know about. */
  UNRECOGNIZED_STATUS("Got an unrecognized status code", true),

  CANCELLED("The operation was cancelled", true),

  UNKNOWN("There was an error that can't be described using other statuses", true),

  /**
   * The client specified an invalid argument.
   *
   * <p>Unlike {@link #PRECONDITION_FAILED}, the argument is problematic regardless of the state of
   * the system.
   */
  INVALID_ARGUMENT("The client specified an invalid argument", false),

  /**
   * The deadline expired before the operation could complete. For operations that change the state
   * of the system this may be returned even if the operation has completed successfully.
   */
  TIMED_OUT("The time limit was exceeded while waiting for the operation to complete", true),

  /** Retryable: the entity might be created later. */
  NOT_FOUND("The requested entity was not found", true),

  /** Retryable: the entity might be deleted later. */
  ALREADY_EXISTS("The entity that we attempted to create already exists", true),

  /** Retryable: permission might be granted later. */
  PERMISSION_DENIED("The caller does not have permission to execute the specified operation", true),

  RESOURCE_EXHAUSTED(
      "Some resource has been exhausted (for example per-user quota, disk space, etc.)", true),

  /** The system is not in the state required for the operation, for example a non-empty dir. */
  PRECONDITION_FAILED(
      "The operation was rejected because the system is not in a required state", true),

  /** Typically a concurrency issue or transaction abort. */
  ABORTED("The operation was aborted", true),

  OUT_OF_RANGE("The operation was attempted past the valid range", true),

  NOT_IMPLEMENTED(
      "The operation is not implemented or not supported/enabled in this service", false),

  INTERNAL_ERROR("Some invariants expected by the underlying system have been broken", true),

  UNAVAILABLE("The service is currently unavailable", true),

  DATA_LOSS("Unrecoverable data loss or corruption", false),

  UNAUTHENTICATED(
      "The request does not have valid authentication credentials for the operation", false);

  private final String description;
  private final boolean retryable;

  ErrorKind(String description, boolean retryable) {
    this.description = description;
    this.retryable = retryable;
  }

  /** Returns the fixed human-readable description of this kind. */
  @Nonnull
  public String getDescription() {
    return description;
  }

  /** Returns whether retrying an operation that failed with this kind might succeed. */
  public boolean isRetryable() {
    return retryable;
  }
}
