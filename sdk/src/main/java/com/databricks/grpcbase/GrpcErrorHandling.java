package com.databricks.grpcbase;

import io.grpc.Status;
import io.grpc.StatusException;
import io.grpc.StatusRuntimeException;
import java.util.Objects;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Utility for classifying gRPC errors into {@link ErrorKind}s.
 *
 * <p>The retryable verdict of the resulting exception depends only on the kind, never on the
 * message or diagnostic text, so callers can build retry loops keyed on the kind alone.
 */
public final class GrpcErrorHandling {

  private GrpcErrorHandling() {}

  /**
   * Maps a gRPC status code to an error kind.
   *
   * @param code the status code
   * @return the kind; {@link ErrorKind#UNRECOGNIZED_STATUS} for codes that are not errors
   */
  @Nonnull
  public static ErrorKind kindOf(@Nonnull Status.Code code) {
    switch (code) {
      case CANCELLED:
        return ErrorKind.CANCELLED;
      case UNKNOWN:
        return ErrorKind.UNKNOWN;
      case INVALID_ARGUMENT:
        return ErrorKind.INVALID_ARGUMENT;
      case DEADLINE_EXCEEDED:
        return ErrorKind.TIMED_OUT;
      case NOT_FOUND:
        return ErrorKind.NOT_FOUND;
      case ALREADY_EXISTS:
        return ErrorKind.ALREADY_EXISTS;
      case PERMISSION_DENIED:
        return ErrorKind.PERMISSION_DENIED;
      case RESOURCE_EXHAUSTED:
        return ErrorKind.RESOURCE_EXHAUSTED;
      case FAILED_PRECONDITION:
        return ErrorKind.PRECONDITION_FAILED;
      case ABORTED:
        return ErrorKind.ABORTED;
      case OUT_OF_RANGE:
        return ErrorKind.OUT_OF_RANGE;
      case UNIMPLEMENTED:
        return ErrorKind.NOT_IMPLEMENTED;
      case INTERNAL:
        return ErrorKind.INTERNAL_ERROR;
      case UNAVAILABLE:
        return ErrorKind.UNAVAILABLE;
      case DATA_LOSS:
        return ErrorKind.DATA_LOSS;
      case UNAUTHENTICATED:
        return ErrorKind.UNAUTHENTICATED;
      case OK:
      default:
        return ErrorKind.UNRECOGNIZED_STATUS;
    }
  }

  /**
   * Classifies a raw numeric status code, as received on the wire.
   *
   * @param codeValue the numeric status code
   * @param operation the operation that failed
   * @param serverUrl the URL of the server
   * @param message the message sent by the server, may be empty
   * @param diagnostic debug information about the failure, may be empty
   * @return the classified exception
   */
  @Nonnull
  public static GrpcStatusException classify(
      int codeValue,
      @Nonnull String operation,
      @Nonnull String serverUrl,
      @Nullable String message,
      @Nullable String diagnostic) {
    Status.Code code = codeForValue(codeValue);
    String statusName = code != null ? code.name() : "UNRECOGNIZED(" + codeValue + ")";
    ErrorKind kind = code != null ? kindOf(code) : ErrorKind.UNRECOGNIZED_STATUS;
    return create(kind, codeValue, statusName, operation, serverUrl, message, diagnostic, null, null);
  }

  /**
   * Classifies a gRPC status code.
   *
   * @param code the status code
   * @param operation the operation that failed
   * @param serverUrl the URL of the server
   * @param message the message sent by the server, may be empty
   * @param diagnostic debug information about the failure, may be empty
   * @return the classified exception
   */
  @Nonnull
  public static GrpcStatusException classify(
      @Nonnull Status.Code code,
      @Nonnull String operation,
      @Nonnull String serverUrl,
      @Nullable String message,
      @Nullable String diagnostic) {
    Objects.requireNonNull(code, "code cannot be null");
    return create(
        kindOf(code),
        code.value(),
        code.name(),
        operation,
        serverUrl,
        message,
        diagnostic,
        null,
        null);
  }

  /**
   * Classifies a gRPC status, keeping the status and the original error.
   *
   * @param serverUrl the URL of the server
   * @param operation the operation that failed
   * @param status the status returned by the call
   * @param cause the error that carried the status, may be null
   * @return the classified exception
   */
  @Nonnull
  public static GrpcStatusException fromStatus(
      @Nonnull String serverUrl,
      @Nonnull String operation,
      @Nonnull Status status,
      @Nullable Throwable cause) {
    Objects.requireNonNull(status, "status cannot be null");
    Status.Code code = status.getCode();
    String diagnostic = status.getCause() != null ? status.getCause().toString() : null;
    return create(
        kindOf(code),
        code.value(),
        code.name(),
        operation,
        serverUrl,
        status.getDescription(),
        diagnostic,
        status,
        cause);
  }

  /**
   * Classifies the status carried by a gRPC exception.
   *
   * @param serverUrl the URL of the server
   * @param operation the operation that failed
   * @param error a {@link StatusRuntimeException} or {@link StatusException}
   * @return the classified exception
   * @throws IllegalArgumentException if the error does not carry a gRPC status
   */
  @Nonnull
  public static GrpcStatusException fromStatusException(
      @Nonnull String serverUrl, @Nonnull String operation, @Nonnull Throwable error) {
    Status status = statusOf(error);
    if (status == null) {
      throw new IllegalArgumentException(
          "Not a gRPC status error: " + error.getClass().getName(), error);
    }
    return fromStatus(serverUrl, operation, status, error);
  }

  /**
   * Returns the gRPC status carried by an error, if it is a gRPC status error.
   *
   * @param error the error to inspect
   * @return the status, or null if the error does not carry one
   */
  @Nullable public static Status statusOf(@Nullable Throwable error) {
    if (error instanceof StatusRuntimeException) {
      return ((StatusRuntimeException) error).getStatus();
    }
    if (error instanceof StatusException) {
      return ((StatusException) error).getStatus();
    }
    return null;
  }

  /**
   * Describes a gRPC status the same way classified exceptions do.
   *
   * @param status the status to describe
   * @return the full description, e.g. {@code "The service is currently unavailable
   *     <status=UNAVAILABLE>: connection refused"}
   */
  @Nonnull
  public static String describe(@Nonnull Status status) {
    Objects.requireNonNull(status, "status cannot be null");
    String diagnostic = status.getCause() != null ? status.getCause().toString() : null;
    return describe(
        kindOf(status.getCode()), status.getCode().name(), status.getDescription(), diagnostic);
  }

  /**
   * Builds the full description of a status error: the kind description, the status name, the
   * server message and the diagnostic string, with empty parts left out.
   */
  @Nonnull
  static String describe(
      @Nonnull ErrorKind kind,
      @Nonnull String statusName,
      @Nullable String message,
      @Nullable String diagnostic) {
    StringBuilder description =
        new StringBuilder(kind.getDescription()).append(" <status=").append(statusName).append('>');
    if (message != null && !message.isEmpty()) {
      description.append(": ").append(message);
    }
    if (diagnostic != null && !diagnostic.isEmpty()) {
      description.append(" (").append(diagnostic).append(')');
    }
    return description.toString();
  }

  @Nullable private static Status.Code codeForValue(int value) {
    for (Status.Code code : Status.Code.values()) {
      if (code.value() == value) {
        return code;
      }
    }
    return null;
  }

  private static GrpcStatusException create(
      ErrorKind kind,
      int codeValue,
      String statusName,
      String operation,
      String serverUrl,
      @Nullable String message,
      @Nullable String diagnostic,
      @Nullable Status status,
      @Nullable Throwable cause) {
    Objects.requireNonNull(operation, "operation cannot be null");
    Objects.requireNonNull(serverUrl, "serverUrl cannot be null");
    return new GrpcStatusException(
        kind,
        serverUrl,
        operation,
        describe(kind, statusName, message, diagnostic),
        codeValue,
        statusName,
        status,
        cause);
  }
}
