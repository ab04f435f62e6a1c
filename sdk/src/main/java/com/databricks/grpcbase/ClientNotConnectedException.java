package com.databricks.grpcbase;

import javax.annotation.Nonnull;

/**
 * The client is not connected to the server.
 *
 * <p>Thrown before any call is attempted, when the client was created without auto-connect or has
 * been disconnected. Always retryable: calling {@link BaseApiClient#connect()} fixes it.
 */
public class ClientNotConnectedException extends ApiClientException {

  /**
   * Constructs a new ClientNotConnectedException.
   *
   * @param serverUrl the URL of the server the client is configured for
   * @param operation the operation that could not be performed
   */
  public ClientNotConnectedException(@Nonnull String serverUrl, @Nonnull String operation) {
    super(
        ErrorKind.NOT_CONNECTED,
        serverUrl,
        operation,
        ErrorKind.NOT_CONNECTED.getDescription(),
        null);
  }
}
