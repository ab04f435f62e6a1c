package com.databricks.grpcbase.stream;

/** Lifecycle states of a {@link GrpcStreamBroadcaster}. */
public enum StreamState {
  /** Created, the background loop has not started yet. */
  IDLE,
  /** Opening the upstream call. */
  CONNECTING,
  /** Receiving messages from the upstream call. */
  STREAMING,
  /** The connection ended and the loop is waiting before reconnecting. */
  BACKING_OFF,
  /** Terminal. Either stopped or the retry strategy gave up. */
  CLOSED
}
