package com.databricks.grpcbase.stream;

import io.grpc.CallOptions;
import io.grpc.Channel;
import io.grpc.MethodDescriptor;
import io.grpc.stub.ClientCalls;
import java.util.Iterator;
import java.util.Objects;
import javax.annotation.Nonnull;

/**
 * Opens a server-streaming call.
 *
 * <p>This is the shape of a grpc-java blocking stub method, so a method reference can usually be
 * used directly:
 *
 * <pre>{@code
 * StreamMethod<Event> method = () -> stub.streamEvents(request);
 * }</pre>
 *
 * <p>The method is called again every time the broadcaster reconnects. Failures may be thrown by
 * {@link #open()} itself or later by the returned iterator; a normal end of the iterator means the
 * server closed the stream.
 *
 * @param <I> The type of messages produced by the call
 */
@FunctionalInterface
public interface StreamMethod<I> {

  /**
   * Starts a new call.
   *
   * @return a blocking iterator over the messages of the call
   */
  Iterator<I> open();

  /**
   * Creates a stream method calling a server-streaming method directly on a channel.
   *
   * <p>Useful when no generated stub is at hand; each {@link #open()} starts a new call with the
   * same request.
   *
   * @param channel the channel to call on
   * @param method the descriptor of a server-streaming method
   * @param request the request sent on every call
   * @param <R> the request type
   * @param <I> the response type
   * @return the stream method
   * @throws IllegalArgumentException if the method is not server-streaming
   */
  @Nonnull
  static <R, I> StreamMethod<I> serverStreaming(
      @Nonnull Channel channel, @Nonnull MethodDescriptor<R, I> method, @Nonnull R request) {
    Objects.requireNonNull(channel, "channel cannot be null");
    Objects.requireNonNull(method, "method cannot be null");
    Objects.requireNonNull(request, "request cannot be null");
    if (method.getType() != MethodDescriptor.MethodType.SERVER_STREAMING) {
      throw new IllegalArgumentException(
          "Method " + method.getFullMethodName() + " is not server-streaming");
    }
    return () ->
        ClientCalls.blockingServerStreamingCall(channel, method, CallOptions.DEFAULT, request);
  }
}
