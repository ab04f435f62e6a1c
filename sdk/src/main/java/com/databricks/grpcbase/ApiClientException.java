package com.databricks.grpcbase;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Base exception for all errors raised by an API client.
 *
 * <p>This is an unchecked exception (extends {@link RuntimeException}). To simplify retrying,
 * every error carries an {@link ErrorKind} and a retryable verdict that only depends on the kind:
 *
 * <pre>{@code
 * try {
 *     client.call("listItems", stub -> stub.listItems(request));
 * } catch (ApiClientException e) {
 *     if (!e.isRetryable()) {
 *         logger.error("Permanent failure", e);
 *         throw e;
 *     }
 *     logger.warn("Retriable error, will retry", e);
 * }
 * }</pre>
 *
 * <p>Subclasses:
 *
 * <ul>
 *   <li>{@link ClientNotConnectedException} - the client has no channel to the server
 *   <li>{@link GrpcStatusException} - the gRPC server returned an error status
 * </ul>
 */
public class ApiClientException extends RuntimeException {

  private final ErrorKind kind;
  private final String serverUrl;
  private final String operation;
  private final String description;

  /**
   * Constructs a new ApiClientException.
   *
   * @param kind the kind of error
   * @param serverUrl the URL of the server the operation was sent to
   * @param operation the operation that failed
   * @param description a human-readable description of the error
   * @param cause the original error, if any
   */
  public ApiClientException(
      @Nonnull ErrorKind kind,
      @Nonnull String serverUrl,
      @Nonnull String operation,
      @Nonnull String description,
      @Nullable Throwable cause) {
    super("Failed calling '" + operation + "' on '" + serverUrl + "': " + description, cause);
    this.kind = kind;
    this.serverUrl = serverUrl;
    this.operation = operation;
    this.description = description;
  }

  /** Returns the kind of this error. */
  @Nonnull
  public ErrorKind getKind() {
    return kind;
  }

  /** Returns the URL of the server the failed operation was sent to. */
  @Nonnull
  public String getServerUrl() {
    return serverUrl;
  }

  /** Returns the name of the operation that failed. */
  @Nonnull
  public String getOperation() {
    return operation;
  }

  /** Returns the full human-readable description of the error. */
  @Nonnull
  public String getDescription() {
    return description;
  }

  /** Returns whether retrying the operation might succeed. */
  public boolean isRetryable() {
    return kind.isRetryable();
  }
}
